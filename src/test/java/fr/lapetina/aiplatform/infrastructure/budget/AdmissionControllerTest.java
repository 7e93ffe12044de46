package fr.lapetina.aiplatform.infrastructure.budget;

import fr.lapetina.aiplatform.domain.exception.ControlPlaneException;
import fr.lapetina.aiplatform.domain.model.ErrorKind;
import fr.lapetina.aiplatform.infrastructure.event.EventWatch;
import fr.lapetina.aiplatform.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AdmissionControllerTest {

    private MutableClock clock;
    private InMemoryBudgetStore store;
    private AdmissionController controller;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atMinuteBoundary();
        store = new InMemoryBudgetStore();
        controller = newController(store);
        controller.start();
    }

    @AfterEach
    void tearDown() {
        controller.close();
    }

    private AdmissionController newController(BudgetStore budgetStore) {
        return AdmissionController.builder()
                .store(budgetStore)
                .persistenceExecutor(Runnable::run)
                .clock(clock)
                .build();
    }

    private void spend(String feature, double amount) {
        controller.recordCost(new CostRecord("req-" + amount, feature, "acme", "provider",
                "self_hosted", amount, clock.instant()));
    }

    private double spent(String scopeId) {
        return controller.getSpending(scopeId).map(Spending::amount).orElse(0.0);
    }

    @Nested
    @DisplayName("Admission")
    class AdmissionTests {

        @Test
        @DisplayName("should seed the default budgets on first start")
        void shouldSeedDefaults() {
            assertThat(controller.listBudgets(null))
                    .extracting(Budget::id)
                    .containsExactly("global", "service:text_to_image");
            assertThat(controller.getBudget("global").amount()).isEqualTo(30000);
            assertThat(controller.getBudget("service:text_to_image").period()).isEqualTo(BudgetPeriod.DAILY);
        }

        @Test
        @DisplayName("should allow a request that fits every budget")
        void shouldAllowWithinBudget() {
            BudgetCheckResult result = controller.checkBudget("text_to_image", "acme", 5.0);

            assertThat(result.allowed()).isTrue();
            assertThat(result.reason()).isEmpty();
            assertThat(result.budgets()).containsKeys("global", "service:text_to_image");
            assertThat(result.budgets().get("global").remaining()).isEqualTo(30000);
        }

        @Test
        @DisplayName("should reject when the global budget would be exceeded")
        void shouldRejectOverGlobal() {
            spend("text_generation", 29999);

            BudgetCheckResult rejected = controller.checkBudget("text_generation", null, 2.0);
            assertThat(rejected.allowed()).isFalse();
            assertThat(rejected.rejectedScope()).isEqualTo(ScopeType.GLOBAL);
            assertThat(rejected.reason()).isEqualTo("global budget exceeded");

            assertThat(controller.checkBudget("text_generation", null, 1.0).allowed()).isTrue();
        }

        @Test
        @DisplayName("should reject when the service budget would be exceeded")
        void shouldRejectOverService() {
            spend("text_to_image", 999.5);

            BudgetCheckResult result = controller.checkBudget("text_to_image", null, 1.0);

            assertThat(result.allowed()).isFalse();
            assertThat(result.rejectedScope()).isEqualTo(ScopeType.SERVICE);
            assertThat(result.reason()).isEqualTo("service budget for text_to_image exceeded");
            assertThat(controller.checkBudget("text_generation", null, 1.0).allowed()).isTrue();
        }

        @Test
        @DisplayName("should reject when the tenant budget would be exceeded")
        void shouldRejectOverTenant() {
            controller.createBudget(Budget.of(ScopeType.TENANT, "acme", 5.0, BudgetPeriod.DAILY));

            BudgetCheckResult result = controller.checkBudget("text_generation", "acme", 6.0);

            assertThat(result.allowed()).isFalse();
            assertThat(result.reason()).isEqualTo("tenant budget for acme exceeded");
            assertThat(controller.checkBudget("text_generation", "globex", 6.0).allowed()).isTrue();
        }

        @Test
        @DisplayName("should treat scopes without a budget as unlimited")
        void shouldIgnoreScopesWithoutBudget() {
            BudgetCheckResult result = controller.checkBudget("text_generation", "acme", 100.0);

            assertThat(result.allowed()).isTrue();
            assertThat(result.budgets()).containsOnlyKeys("global");
        }

        @Test
        @DisplayName("should leave spend untouched on a rejection")
        void shouldNotChargeOnRejection() {
            spend("text_to_image", 999.5);

            controller.checkBudget("text_to_image", null, 10.0);

            assertThat(spent("global")).isEqualTo(999.5);
            assertThat(spent("service:text_to_image")).isEqualTo(999.5);
        }

        @Test
        @DisplayName("should reject a negative estimate")
        void shouldRejectNegativeEstimate() {
            assertThatThrownBy(() -> controller.checkBudget("text_to_image", null, -1.0))
                    .isInstanceOf(ControlPlaneException.class)
                    .extracting(e -> ((ControlPlaneException) e).getKind())
                    .isEqualTo(ErrorKind.VALIDATION);
        }
    }

    @Nested
    @DisplayName("Cost recording")
    class CostRecordingTests {

        @Test
        @DisplayName("should add cost to the global and service scopes only")
        void shouldRecordOnGlobalAndService() {
            controller.createBudget(Budget.of(ScopeType.TENANT, "acme", 50.0, BudgetPeriod.MONTHLY));

            spend("text_to_image", 2.5);

            assertThat(spent("global")).isEqualTo(2.5);
            assertThat(spent("service:text_to_image")).isEqualTo(2.5);
            assertThat(spent("tenant:acme")).isZero();
            assertThat(store.getCostRecords()).hasSize(1);
        }

        @Test
        @DisplayName("should track spend for a feature without a budget")
        void shouldTrackUnbudgetedFeature() {
            spend("text_generation", 0.25);

            assertThat(controller.getSpending("service:text_generation"))
                    .map(Spending::amount)
                    .hasValue(0.25);
        }

        @Test
        @DisplayName("should reject a negative cost")
        void shouldRejectNegativeCost() {
            assertThatThrownBy(() -> spend("text_to_image", -0.5))
                    .isInstanceOf(ControlPlaneException.class);
            assertThat(spent("global")).isZero();
        }

        @Test
        @DisplayName("should not lose updates under concurrent recording")
        void shouldRecordConcurrently() throws InterruptedException {
            int threads = 8;
            int perThread = 500;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch startGate = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            try {
                for (int t = 0; t < threads; t++) {
                    pool.execute(() -> {
                        try {
                            startGate.await();
                            for (int i = 0; i < perThread; i++) {
                                spend("text_to_image", 1.0);
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        } finally {
                            done.countDown();
                        }
                    });
                }
                startGate.countDown();
                assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
            } finally {
                pool.shutdownNow();
            }

            assertThat(spent("global")).isEqualTo(threads * perThread);
            assertThat(spent("service:text_to_image")).isEqualTo(threads * perThread);
        }
    }

    @Nested
    @DisplayName("Reconciliation")
    class ReconcileTests {

        @Test
        @DisplayName("should flush spend deltas into the daily statistics")
        void shouldFlushDeltas() {
            spend("text_to_image", 2.5);
            spend("text_to_image", 1.5);

            assertThat(controller.reconcile()).isEqualTo(2);

            LocalDate today = LocalDate.of(2026, 1, 15);
            assertThat(store.getDailyCost(today, "global")).isEqualTo(4.0);
            assertThat(store.getDailyCost(today, "service:text_to_image")).isEqualTo(4.0);
            assertThat(controller.reconcile()).isZero();
        }

        @Test
        @DisplayName("should keep deltas that fail to flush for the next pass")
        void shouldRetainFailedDeltas() {
            FailingDailyStore failing = new FailingDailyStore();
            try (AdmissionController flaky = newController(failing)) {
                flaky.start();
                flaky.recordCost(new CostRecord("req-1", "text_generation", null, "p", "self_hosted",
                        3.0, clock.instant()));

                assertThat(flaky.reconcile()).isZero();

                failing.healthy = true;
                assertThat(flaky.reconcile()).isEqualTo(2);
                assertThat(failing.getDailyCost(LocalDate.of(2026, 1, 15), "global")).isEqualTo(3.0);
            }
        }
    }

    @Nested
    @DisplayName("Budget management")
    class ManagementTests {

        @Test
        @DisplayName("should refuse a second budget for the same scope")
        void shouldRefuseDuplicate() {
            assertThatThrownBy(() -> controller.createBudget(
                    Budget.of(ScopeType.GLOBAL, null, 10, BudgetPeriod.DAILY)))
                    .isInstanceOf(ControlPlaneException.class)
                    .extracting(e -> ((ControlPlaneException) e).getKind())
                    .isEqualTo(ErrorKind.CONFLICT);
        }

        @Test
        @DisplayName("should update the amount and keep the spend")
        void shouldUpdateAmount() {
            spend("text_to_image", 40.0);

            Budget updated = controller.updateBudget("global", 50.0, null, null);

            assertThat(updated.amount()).isEqualTo(50.0);
            assertThat(updated.period()).isEqualTo(BudgetPeriod.MONTHLY);
            assertThat(spent("global")).isEqualTo(40.0);
            assertThat(controller.checkBudget("text_generation", null, 20.0).allowed()).isFalse();
            assertThat(store.loadBudgets()).anyMatch(b -> b.id().equals("global") && b.amount() == 50.0);
        }

        @Test
        @DisplayName("should report unknown budgets as not found")
        void shouldReportUnknownBudget() {
            assertThatThrownBy(() -> controller.getBudget("tenant:nobody"))
                    .isInstanceOf(ControlPlaneException.class)
                    .extracting(e -> ((ControlPlaneException) e).getKind())
                    .isEqualTo(ErrorKind.NOT_FOUND);
            assertThatThrownBy(() -> controller.updateBudget("tenant:nobody", 1.0, null, null))
                    .isInstanceOf(ControlPlaneException.class);
        }

        @Test
        @DisplayName("should filter budgets by scope type")
        void shouldFilterByScope() {
            controller.createBudget(Budget.of(ScopeType.TENANT, "acme", 5.0, BudgetPeriod.DAILY));

            assertThat(controller.listBudgets(ScopeType.TENANT))
                    .extracting(Budget::id)
                    .containsExactly("tenant:acme");
        }

        @Test
        @DisplayName("should load stored budgets instead of seeding defaults")
        void shouldLoadStoredBudgets() {
            InMemoryBudgetStore seeded = new InMemoryBudgetStore();
            seeded.saveBudget(Budget.of(ScopeType.TENANT, "acme", 5.0, BudgetPeriod.DAILY));

            try (AdmissionController restored = newController(seeded)) {
                restored.start();

                assertThat(restored.listBudgets(null))
                        .extracting(Budget::id)
                        .containsExactly("tenant:acme");
            }
        }
    }

    @Nested
    @DisplayName("Alerts")
    class AlertTests {

        @Test
        @DisplayName("should emit a warning once a threshold is crossed")
        void shouldEmitWarning() throws InterruptedException {
            spend("text_generation", 24000);

            try (EventWatch<BudgetAlert> watch = controller.watchAlerts()) {
                assertThat(controller.checkBudget("text_generation", null, 0.0).allowed()).isTrue();

                Optional<BudgetAlert> alert = watch.poll(Duration.ofSeconds(5));
                assertThat(alert).isPresent();
                assertThat(alert.get().budgetId()).isEqualTo("global");
                assertThat(alert.get().level()).isEqualTo(BudgetAlert.Level.WARNING);
                assertThat(alert.get().action()).isEqualTo(AlertAction.NOTIFY);
                assertThat(alert.get().percentage()).isCloseTo(80.0, within(1e-9));
            }
        }

        @Test
        @DisplayName("should flag alerts above ninety percent as critical")
        void shouldEmitCritical() throws InterruptedException {
            spend("text_to_image", 950);

            try (EventWatch<BudgetAlert> watch = controller.watchAlerts()) {
                controller.checkBudget("text_to_image", null, 1.0);

                Optional<BudgetAlert> first = watch.poll(Duration.ofSeconds(5));
                Optional<BudgetAlert> second = watch.poll(Duration.ofSeconds(5));
                assertThat(first).isPresent();
                assertThat(second).isPresent();
                assertThat(List.of(first.get(), second.get()))
                        .allMatch(a -> a.budgetId().equals("service:text_to_image"))
                        .allMatch(a -> a.level() == BudgetAlert.Level.CRITICAL)
                        .extracting(BudgetAlert::action)
                        .containsExactly(AlertAction.NOTIFY, AlertAction.BLOCK);
            }
        }

        @Test
        @DisplayName("should alert on every admitted check and never on cost recording")
        void shouldAlertOnChecksOnly() throws InterruptedException {
            try (EventWatch<BudgetAlert> watch = controller.watchAlerts()) {
                spend("text_generation", 24000);
                assertThat(watch.poll(Duration.ofMillis(200))).isEmpty();

                controller.checkBudget("text_generation", null, 0.0);
                controller.checkBudget("text_generation", null, 0.0);

                assertThat(watch.poll(Duration.ofSeconds(5))).isPresent();
                assertThat(watch.poll(Duration.ofSeconds(5))).isPresent();
            }
        }
    }

    private static final class FailingDailyStore implements BudgetStore {
        private final InMemoryBudgetStore delegate = new InMemoryBudgetStore();
        private volatile boolean healthy;

        @Override
        public void saveBudget(Budget budget) {
            delegate.saveBudget(budget);
        }

        @Override
        public List<Budget> loadBudgets() {
            return delegate.loadBudgets();
        }

        @Override
        public void saveCostRecord(CostRecord record) {
            delegate.saveCostRecord(record);
        }

        @Override
        public void addDailyCost(LocalDate date, String scopeId, double delta) {
            if (!healthy) {
                throw new IllegalStateException("statistics store offline");
            }
            delegate.addDailyCost(date, scopeId, delta);
        }

        double getDailyCost(LocalDate date, String scopeId) {
            return delegate.getDailyCost(date, scopeId);
        }
    }
}
