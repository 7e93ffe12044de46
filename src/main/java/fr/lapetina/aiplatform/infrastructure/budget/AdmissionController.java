package fr.lapetina.aiplatform.infrastructure.budget;

import fr.lapetina.aiplatform.domain.exception.ControlPlaneException;
import fr.lapetina.aiplatform.infrastructure.event.EventStream;
import fr.lapetina.aiplatform.infrastructure.event.EventWatch;
import fr.lapetina.aiplatform.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.aiplatform.infrastructure.scheduling.ScheduledLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Hierarchical spend control.
 *
 * Scopes are checked global, then service, then tenant; the first scope whose
 * spend plus the estimate exceeds its amount rejects the request. Recorded
 * costs accumulate in memory under the write lock and are flushed additively
 * to the daily statistics store by the reconcile loop.
 */
public final class AdmissionController implements CostTracker, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdmissionController.class);

    private static final double CRITICAL_PERCENTAGE = 90.0;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Budget> budgets = new LinkedHashMap<>();
    private final Map<String, Spending> spendings = new LinkedHashMap<>();
    private final Map<String, Double> pendingDeltas = new LinkedHashMap<>();

    private final BudgetStore store;
    private final Executor persistenceExecutor;
    private final ExecutorService ownedExecutor;
    private final EventStream<BudgetAlert> alertStream;
    private final ScheduledLoop reconcileLoop;
    private final MetricsRegistry metrics;
    private final BudgetSettings settings;
    private final Clock clock;

    private AdmissionController(Builder builder) {
        this.store = builder.store;
        this.metrics = builder.metrics;
        this.settings = builder.settings;
        this.clock = builder.clock;
        if (builder.persistenceExecutor != null) {
            this.persistenceExecutor = builder.persistenceExecutor;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "budget-persistence");
                t.setDaemon(true);
                return t;
            });
            this.persistenceExecutor = ownedExecutor;
        }
        this.alertStream = new EventStream<>("budget-alerts",
                builder.ringBufferSize, builder.watchCapacity, builder.waitStrategy);
        this.reconcileLoop = new ScheduledLoop("budget-reconcile", settings.reconcileInterval(), this::reconcile);
        metrics.registerDroppedEvents(alertStream.getName(), alertStream::getDroppedCount);
    }

    /**
     * Loads budgets, seeding the defaults when none are stored, then starts
     * the alert stream and reconcile loop.
     */
    public void start() {
        loadBudgets();
        alertStream.start();
        reconcileLoop.start();
        log.info("AdmissionController started: budgets={}, reconcileInterval={}",
                listBudgets(null).size(), settings.reconcileInterval());
    }

    // ==================== ADMISSION ====================

    /**
     * Checks whether a request with the given estimated cost fits every
     * configured budget. A rejection has no side effects.
     */
    public BudgetCheckResult checkBudget(String feature, String tenantId, double estimatedCost) {
        if (estimatedCost < 0) {
            throw ControlPlaneException.validation("Estimated cost must be >= 0: " + estimatedCost);
        }

        Map<String, BudgetInfo> infos = new LinkedHashMap<>();
        List<BudgetInfo> evaluated = new ArrayList<>();
        List<Budget> evaluatedBudgets = new ArrayList<>();
        BudgetCheckResult rejection = null;

        lock.readLock().lock();
        try {
            for (String scopeId : scopesFor(feature, tenantId)) {
                Budget budget = budgets.get(scopeId);
                if (budget == null) {
                    continue;
                }
                double spent = spentLocked(scopeId);
                if (spent + estimatedCost > budget.amount()) {
                    rejection = BudgetCheckResult.rejected(budget.scopeType(),
                            rejectionReason(budget.scopeType(), feature, tenantId), infos);
                    break;
                }
                BudgetInfo info = BudgetInfo.of(budget, spent);
                infos.put(scopeId, info);
                evaluated.add(info);
                evaluatedBudgets.add(budget);
            }
        } finally {
            lock.readLock().unlock();
        }

        if (rejection != null) {
            log.warn("Budget check rejected: feature={}, tenant={}, estimatedCost={}, reason={}",
                    feature, tenantId, estimatedCost, rejection.reason());
            metrics.incrementBudgetRejection(rejection.rejectedScope().wireName());
            return rejection;
        }

        for (int i = 0; i < evaluated.size(); i++) {
            emitAlerts(evaluatedBudgets.get(i), evaluated.get(i));
        }
        return BudgetCheckResult.allowed(infos);
    }

    private static List<String> scopesFor(String feature, String tenantId) {
        List<String> scopes = new ArrayList<>(3);
        scopes.add(ScopeType.GLOBAL.scopeId(null));
        if (feature != null && !feature.isBlank()) {
            scopes.add(ScopeType.SERVICE.scopeId(feature));
        }
        if (tenantId != null && !tenantId.isBlank()) {
            scopes.add(ScopeType.TENANT.scopeId(tenantId));
        }
        return scopes;
    }

    private static String rejectionReason(ScopeType scope, String feature, String tenantId) {
        return switch (scope) {
            case GLOBAL -> "global budget exceeded";
            case SERVICE -> String.format("service budget for %s exceeded", feature);
            case TENANT -> String.format("tenant budget for %s exceeded", tenantId);
        };
    }

    // Alerts are not deduplicated: every passing check re-emits for each crossed threshold
    private void emitAlerts(Budget budget, BudgetInfo info) {
        if (budget.amount() <= 0) {
            return;
        }
        Instant now = clock.instant();
        for (AlertThreshold threshold : budget.alerts()) {
            if (!threshold.enabled() || info.percentage() < threshold.at() * 100) {
                continue;
            }
            BudgetAlert.Level level = info.percentage() >= CRITICAL_PERCENTAGE
                    ? BudgetAlert.Level.CRITICAL
                    : BudgetAlert.Level.WARNING;
            BudgetAlert alert = new BudgetAlert(budget.id(), budget.name(), level, threshold.action(),
                    threshold.at(), info.used(), info.total(), info.percentage(), now);
            if (!alertStream.publish(alert)) {
                log.debug("Budget alert dropped: budgetId={}, threshold={}", budget.id(), threshold.at());
            }
        }
    }

    // ==================== COST RECORDING ====================

    /**
     * Adds a served request's cost to the global and service scopes and
     * persists the cost record in the background. Tenant spend is not
     * updated here.
     */
    @Override
    public void recordCost(CostRecord record) {
        if (record.amount() < 0 || Double.isNaN(record.amount())) {
            throw ControlPlaneException.validation("Cost amount must be >= 0: " + record.amount());
        }
        if (record.feature() == null || record.feature().isBlank()) {
            throw ControlPlaneException.validation("Cost record feature is required");
        }

        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            addSpendLocked(ScopeType.GLOBAL.scopeId(null), record.amount(), now);
            addSpendLocked(ScopeType.SERVICE.scopeId(record.feature()), record.amount(), now);
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Cost recorded: requestId={}, feature={}, costType={}, amount={}",
                record.requestId(), record.feature(), record.costType(), record.amount());
        metrics.addCost(record.feature(), record.amount());
        persistAsync("cost record " + record.requestId(), () -> store.saveCostRecord(record));
    }

    // Caller holds the write lock
    private void addSpendLocked(String scopeId, double amount, Instant now) {
        Spending current = spendings.get(scopeId);
        if (current == null) {
            current = Spending.empty(scopeId, now);
        }
        spendings.put(scopeId, current.add(amount, now));
        pendingDeltas.merge(scopeId, amount, Double::sum);
    }

    // Caller holds a lock
    private double spentLocked(String scopeId) {
        Spending spending = spendings.get(scopeId);
        return spending != null ? spending.amount() : 0.0;
    }

    // ==================== RECONCILIATION ====================

    /**
     * Flushes accumulated spend deltas into the daily statistics store.
     * Deltas that fail to write are kept for the next pass.
     *
     * @return number of scopes flushed
     */
    public int reconcile() {
        Map<String, Double> deltas;
        lock.writeLock().lock();
        try {
            if (pendingDeltas.isEmpty()) {
                return 0;
            }
            deltas = new LinkedHashMap<>(pendingDeltas);
            pendingDeltas.clear();
        } finally {
            lock.writeLock().unlock();
        }

        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        Map<String, Double> failed = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : deltas.entrySet()) {
            try {
                store.addDailyCost(today, entry.getKey(), entry.getValue());
            } catch (RuntimeException e) {
                log.warn("Failed to flush daily cost: scope={}, delta={}, error={}",
                        entry.getKey(), entry.getValue(), e.getMessage());
                failed.put(entry.getKey(), entry.getValue());
            }
        }

        if (!failed.isEmpty()) {
            lock.writeLock().lock();
            try {
                failed.forEach((scope, delta) -> pendingDeltas.merge(scope, delta, Double::sum));
            } finally {
                lock.writeLock().unlock();
            }
        }

        int flushed = deltas.size() - failed.size();
        log.debug("Spend reconciled: date={}, flushed={}, retained={}", today, flushed, failed.size());
        return flushed;
    }

    // ==================== BUDGET MANAGEMENT ====================

    /**
     * Creates a budget with zero spend.
     *
     * @throws ControlPlaneException CONFLICT if the scope already has a budget
     */
    public Budget createBudget(Budget budget) {
        Budget created;
        lock.writeLock().lock();
        try {
            if (budgets.containsKey(budget.id())) {
                throw ControlPlaneException.conflict("Budget already exists: " + budget.id());
            }
            created = budget.created(clock.instant());
            budgets.put(created.id(), created);
            spendings.putIfAbsent(created.id(), Spending.empty(created.id(), created.createdAt()));
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Budget created: id={}, amount={}, period={}", created.id(), created.amount(), created.period().wireName());
        persistAsync("budget " + created.id(), () -> store.saveBudget(created));
        return created;
    }

    /**
     * Replaces amount, period and alerts of an existing budget. Null period or
     * alerts keep the current values. Spend is untouched.
     */
    public Budget updateBudget(String id, double amount, BudgetPeriod period, List<AlertThreshold> alerts) {
        if (amount < 0) {
            throw ControlPlaneException.validation("Budget amount must be >= 0: " + amount);
        }
        Budget updated;
        lock.writeLock().lock();
        try {
            Budget existing = budgets.get(id);
            if (existing == null) {
                throw ControlPlaneException.notFound("Budget not found: " + id);
            }
            updated = existing.updated(amount, period, alerts, clock.instant());
            budgets.put(id, updated);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Budget updated: id={}, amount={}, period={}", id, updated.amount(), updated.period().wireName());
        persistAsync("budget " + id, () -> store.saveBudget(updated));
        return updated;
    }

    public Budget getBudget(String id) {
        lock.readLock().lock();
        try {
            Budget budget = budgets.get(id);
            if (budget == null) {
                throw ControlPlaneException.notFound("Budget not found: " + id);
            }
            return budget;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param scopeType restricts the listing to one scope type, or null for all
     */
    public List<Budget> listBudgets(ScopeType scopeType) {
        lock.readLock().lock();
        try {
            List<Budget> result = new ArrayList<>();
            for (Budget budget : budgets.values()) {
                if (scopeType == null || budget.scopeType() == scopeType) {
                    result.add(budget);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Spending> getSpending(String scopeId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(spendings.get(scopeId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public EventWatch<BudgetAlert> watchAlerts() {
        return alertStream.watch();
    }

    // ==================== PERSISTENCE ====================

    private void loadBudgets() {
        List<Budget> stored;
        try {
            stored = store.loadBudgets();
        } catch (RuntimeException e) {
            log.error("Failed to load budgets from store, seeding defaults", e);
            stored = List.of();
        }

        if (stored.isEmpty()) {
            for (Budget budget : settings.defaultBudgets()) {
                try {
                    createBudget(budget);
                } catch (ControlPlaneException e) {
                    log.debug("Default budget already present: id={}", budget.id());
                }
            }
            log.info("Default budgets seeded: count={}", settings.defaultBudgets().size());
            return;
        }

        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            for (Budget budget : stored) {
                budgets.put(budget.id(), budget);
                spendings.putIfAbsent(budget.id(), Spending.empty(budget.id(), now));
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Budgets loaded from store: count={}", stored.size());
    }

    private void persistAsync(String what, Runnable write) {
        try {
            CompletableFuture.runAsync(write, persistenceExecutor)
                    .exceptionally(ex -> {
                        log.warn("Failed to persist {}: error={}", what, ex.getMessage());
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Persistence executor rejected write: {}", what);
        }
    }

    @Override
    public void close() {
        reconcileLoop.close();
        reconcile();
        alertStream.close();
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("AdmissionController stopped");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BudgetStore store = new InMemoryBudgetStore();
        private Executor persistenceExecutor;
        private MetricsRegistry metrics;
        private BudgetSettings settings = BudgetSettings.defaults();
        private Clock clock = Clock.systemUTC();
        private int ringBufferSize = 128;
        private int watchCapacity = 10;
        private String waitStrategy = "blocking";

        public Builder store(BudgetStore store) {
            this.store = store;
            return this;
        }

        public Builder persistenceExecutor(Executor executor) {
            this.persistenceExecutor = executor;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder settings(BudgetSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder events(int ringBufferSize, int watchCapacity, String waitStrategy) {
            this.ringBufferSize = ringBufferSize;
            this.watchCapacity = watchCapacity;
            this.waitStrategy = waitStrategy;
            return this;
        }

        public AdmissionController build() {
            if (metrics == null) {
                metrics = MetricsRegistry.inMemory();
            }
            return new AdmissionController(this);
        }
    }
}
