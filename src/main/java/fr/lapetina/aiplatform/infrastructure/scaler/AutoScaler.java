package fr.lapetina.aiplatform.infrastructure.scaler;

import fr.lapetina.aiplatform.domain.exception.ControlPlaneException;
import fr.lapetina.aiplatform.domain.model.InstanceMetrics;
import fr.lapetina.aiplatform.domain.model.InstanceSnapshot;
import fr.lapetina.aiplatform.infrastructure.event.EventStream;
import fr.lapetina.aiplatform.infrastructure.event.EventWatch;
import fr.lapetina.aiplatform.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.aiplatform.infrastructure.registry.ServiceRegistry;
import fr.lapetina.aiplatform.infrastructure.scheduling.ScheduledLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Reactive replica control for self-hosted features.
 *
 * Each check reads the deployment's replica count, aggregates the registry
 * metrics of the feature's instances and applies at most one step:
 * - scale up by one when CPU, queue depth or request rate exceed their targets
 * - scale down by one when the fleet is idle or under-utilized
 * - scale to zero when the last replica has been idle past the idle timeout
 *
 * Up and down cooldowns are independent. A cooldown only starts once the
 * cluster has accepted the new replica count.
 */
public final class AutoScaler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AutoScaler.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ScaleConfig> configs = new LinkedHashMap<>();
    private final Map<String, ActivityTracker> trackers = new HashMap<>();

    private final ServiceRegistry registry;
    private final ClusterClient cluster;
    private final EventStream<ScaleEvent> events;
    private final ScheduledLoop scaleLoop;
    private final MetricsRegistry metrics;
    private final ScalerSettings settings;
    private final Clock clock;
    private final boolean loopEnabled;

    private AutoScaler(Builder builder) {
        this.registry = builder.registry;
        this.cluster = builder.cluster;
        this.metrics = builder.metrics;
        this.settings = builder.settings;
        this.clock = builder.clock;
        this.loopEnabled = builder.loopEnabled;
        this.events = new EventStream<>("scale-events",
                builder.ringBufferSize, builder.watchCapacity, builder.waitStrategy);
        this.scaleLoop = new ScheduledLoop("scale-loop", settings.loopInterval(), this::checkAll);
        for (ScaleConfig config : settings.configs()) {
            configs.put(config.featureId(), config);
        }
        metrics.registerDroppedEvents(events.getName(), events::getDroppedCount);
    }

    public void start() {
        events.start();
        if (loopEnabled) {
            scaleLoop.start();
        }
        log.info("AutoScaler started: features={}, loopEnabled={}, interval={}, rpsCeiling={}",
                configs.keySet(), loopEnabled, settings.loopInterval(), settings.rpsCeiling());
    }

    // ==================== EVALUATION ====================

    /**
     * Evaluates one feature and applies the resulting action.
     *
     * @throws ControlPlaneException NOT_FOUND when the feature has no scale config,
     *                               or as raised by the cluster client when reading replicas
     */
    public ScaleDecision checkScale(String featureId) {
        ScaleConfig config = getScaleConfig(featureId);
        int current = cluster.getReplicas(config.deploymentName(), config.namespace());
        List<InstanceSnapshot> instances = registry.getServicesByType(config.serviceType());

        Instant now = clock.instant();
        ScaleMetrics fleet = sample(featureId, instances, now);
        ScaleDecision decision = decide(config, fleet, current, now, settings.rpsCeiling());

        if (!decision.requiresChange()) {
            log.debug("Scale check: feature={}, replicas={}, reason={}", featureId, current, decision.reason());
            return decision;
        }
        return apply(config, decision, now, false);
    }

    /**
     * Runs {@link #checkScale(String)} for every configured feature. A failing
     * feature is logged and does not stop the others.
     */
    public List<ScaleDecision> checkAll() {
        List<ScaleDecision> decisions = new ArrayList<>();
        for (ScaleConfig config : listScaleConfigs()) {
            try {
                decisions.add(checkScale(config.featureId()));
            } catch (RuntimeException e) {
                log.warn("Scale check failed: feature={}, error={}", config.featureId(), e.getMessage());
            }
        }
        return decisions;
    }

    /**
     * Pure scaling rule.
     */
    static ScaleDecision decide(ScaleConfig config, ScaleMetrics fleet, int current, Instant now, double rpsCeiling) {
        String featureId = config.featureId();

        if (shouldScaleUp(config, fleet, current, rpsCeiling)) {
            if (withinCooldown(config.lastScaleUp(), config.scaleUpCooldown(), now)) {
                return ScaleDecision.none(featureId, current, fleet, "scale up cooldown");
            }
            int target = Math.min(current + 1, config.maxInstances());
            String reason = String.format(Locale.ROOT, "cpu usage: %.2f%%, queue: %d, rps: %.2f",
                    fleet.cpuUsage(), fleet.queueSize(), fleet.requestsPerSecond());
            return new ScaleDecision(featureId, ScaleAction.SCALE_UP, current, target, fleet, reason, false);
        }

        if (shouldScaleDown(config, fleet, current)) {
            if (withinCooldown(config.lastScaleDown(), config.scaleDownCooldown(), now)) {
                return ScaleDecision.none(featureId, current, fleet, "scale down cooldown");
            }
            int target = Math.max(current - 1, config.minInstances());
            if (target == 0) {
                if (fleet.idleSeconds() < config.idleTimeout().toSeconds()) {
                    return ScaleDecision.none(featureId, current, fleet, "awaiting idle timeout before scale to zero");
                }
                return new ScaleDecision(featureId, ScaleAction.SCALE_TO_ZERO, current, 0, fleet,
                        "idle timeout, scale to zero", false);
            }
            String reason = String.format(Locale.ROOT, "low utilization: cpu=%.2f%%, idle=%ds",
                    fleet.cpuUsage(), fleet.idleSeconds());
            return new ScaleDecision(featureId, ScaleAction.SCALE_DOWN, current, target, fleet, reason, false);
        }

        return ScaleDecision.none(featureId, current, fleet, "no scale needed");
    }

    private static boolean shouldScaleUp(ScaleConfig config, ScaleMetrics fleet, int current, double rpsCeiling) {
        if (current >= config.maxInstances()) {
            return false;
        }
        return fleet.cpuUsage() > config.targetCpu()
                || fleet.queueSize() > config.targetQueueSize()
                || fleet.requestsPerSecond() > rpsCeiling;
    }

    private static boolean shouldScaleDown(ScaleConfig config, ScaleMetrics fleet, int current) {
        if (current <= config.minInstances()) {
            return false;
        }
        if (fleet.idleSeconds() >= config.idleTimeout().toSeconds()) {
            return true;
        }
        return fleet.cpuUsage() < config.targetCpu() / 2 && fleet.queueSize() == 0;
    }

    private static boolean withinCooldown(Instant last, Duration cooldown, Instant now) {
        return last != null && Duration.between(last, now).compareTo(cooldown) < 0;
    }

    private ScaleMetrics sample(String featureId, List<InstanceSnapshot> instances, Instant now) {
        double cpu = 0;
        double memory = 0;
        double gpu = 0;
        int queue = 0;
        long processed = 0;
        for (InstanceSnapshot instance : instances) {
            InstanceMetrics m = instance.metrics();
            cpu += m.cpuUsage();
            memory += m.memoryUsage();
            gpu += m.gpuUsage();
            queue += m.queueSize();
            processed += m.processedCount();
        }
        int count = instances.size();
        if (count > 0) {
            cpu /= count;
            memory /= count;
            gpu /= count;
        }

        double rps;
        long idleSeconds;
        lock.writeLock().lock();
        try {
            ActivityTracker tracker = trackers.get(featureId);
            if (tracker == null) {
                tracker = new ActivityTracker(processed, now);
                trackers.put(featureId, tracker);
            }
            long delta = Math.max(0, processed - tracker.lastProcessed);
            double elapsed = Duration.between(tracker.lastSampleAt, now).toMillis() / 1000.0;
            rps = elapsed > 0 ? delta / elapsed : 0.0;
            if (queue > 0 || delta > 0) {
                tracker.lastActivityAt = now;
            }
            tracker.lastProcessed = processed;
            tracker.lastSampleAt = now;
            idleSeconds = Duration.between(tracker.lastActivityAt, now).toSeconds();
        } finally {
            lock.writeLock().unlock();
        }

        return new ScaleMetrics(count, cpu, memory, gpu, queue, rps, idleSeconds);
    }

    private ScaleDecision apply(ScaleConfig config, ScaleDecision decision, Instant now, boolean propagateFailure) {
        try {
            cluster.setReplicas(config.deploymentName(), config.namespace(), decision.targetReplicas());
        } catch (ControlPlaneException e) {
            if (propagateFailure) {
                throw e;
            }
            log.warn("Scale action failed: feature={}, action={}, target={}, error={}",
                    config.featureId(), decision.action().wireName(), decision.targetReplicas(), e.getMessage());
            return decision;
        }

        boolean up = decision.action() == ScaleAction.SCALE_UP;
        lock.writeLock().lock();
        try {
            ScaleConfig stored = configs.get(config.featureId());
            if (stored != null) {
                configs.put(config.featureId(), up ? stored.withLastScaleUp(now) : stored.withLastScaleDown(now));
            }
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Feature scaled: feature={}, action={}, from={}, to={}, reason={}",
                config.featureId(), decision.action().wireName(), decision.currentReplicas(),
                decision.targetReplicas(), decision.reason());
        metrics.incrementScaleAction(config.featureId(), decision.action().wireName());
        events.publish(new ScaleEvent(config.featureId(), decision.action(), decision.currentReplicas(),
                decision.targetReplicas(), decision.reason(), now));
        return decision.markApplied();
    }

    // ==================== MANUAL ACTIONS ====================

    /**
     * Sets a feature's replicas to zero immediately, ignoring cooldowns.
     *
     * @throws ControlPlaneException CONFLICT when the feature's minimum is above zero
     */
    public ScaleDecision scaleToZero(String featureId) {
        ScaleConfig config = getScaleConfig(featureId);
        if (config.minInstances() > 0) {
            throw ControlPlaneException.conflict(
                    "Cannot scale " + featureId + " to zero, min instances is " + config.minInstances());
        }
        int current = cluster.getReplicas(config.deploymentName(), config.namespace());
        if (current == 0) {
            return ScaleDecision.none(featureId, 0, ScaleMetrics.EMPTY, "already scaled to zero");
        }
        ScaleDecision decision = new ScaleDecision(featureId, ScaleAction.SCALE_TO_ZERO, current, 0,
                ScaleMetrics.EMPTY, "manual scale to zero", false);
        return apply(config, decision, clock.instant(), true);
    }

    /**
     * Adds {@code count} replicas, bounded by the feature's maximum, ignoring cooldowns.
     */
    public ScaleDecision scaleUp(String featureId, int count) {
        if (count < 1) {
            throw ControlPlaneException.validation("Scale up count must be >= 1: " + count);
        }
        ScaleConfig config = getScaleConfig(featureId);
        int current = cluster.getReplicas(config.deploymentName(), config.namespace());
        int target = Math.min(current + count, config.maxInstances());
        if (target <= current) {
            return ScaleDecision.none(featureId, current, ScaleMetrics.EMPTY, "already at max instances");
        }
        ScaleDecision decision = new ScaleDecision(featureId, ScaleAction.SCALE_UP, current, target,
                ScaleMetrics.EMPTY, "manual scale up by " + count, false);
        return apply(config, decision, clock.instant(), true);
    }

    // ==================== CONFIGURATION ====================

    /**
     * Adds or replaces a feature's scale config. Cooldown timestamps of an
     * existing config are kept.
     */
    public ScaleConfig updateScaleConfig(ScaleConfig config) {
        ScaleConfig stored;
        lock.writeLock().lock();
        try {
            ScaleConfig previous = configs.get(config.featureId());
            stored = previous != null ? config.withTimestampsOf(previous) : config;
            configs.put(config.featureId(), stored);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Scale config updated: feature={}, min={}, max={}, targetCpu={}, targetQueue={}",
                stored.featureId(), stored.minInstances(), stored.maxInstances(),
                stored.targetCpu(), stored.targetQueueSize());
        return stored;
    }

    public ScaleConfig getScaleConfig(String featureId) {
        lock.readLock().lock();
        try {
            ScaleConfig config = configs.get(featureId);
            if (config == null) {
                throw ControlPlaneException.notFound("No scale config for feature: " + featureId);
            }
            return config;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ScaleConfig> listScaleConfigs() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(configs.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public EventWatch<ScaleEvent> watchScaleEvents() {
        return events.watch();
    }

    @Override
    public void close() {
        scaleLoop.close();
        events.close();
        cluster.close();
        log.info("AutoScaler stopped");
    }

    // Guarded by the component lock
    private static final class ActivityTracker {
        private long lastProcessed;
        private Instant lastSampleAt;
        private Instant lastActivityAt;

        private ActivityTracker(long processed, Instant now) {
            this.lastProcessed = processed;
            this.lastSampleAt = now;
            this.lastActivityAt = now;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ServiceRegistry registry;
        private ClusterClient cluster;
        private MetricsRegistry metrics;
        private ScalerSettings settings = ScalerSettings.defaults();
        private Clock clock = Clock.systemUTC();
        private boolean loopEnabled = true;
        private int ringBufferSize = 128;
        private int watchCapacity = 10;
        private String waitStrategy = "blocking";

        public Builder registry(ServiceRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder cluster(ClusterClient cluster) {
            this.cluster = cluster;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder settings(ScalerSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * When disabled, scaling only happens through explicit calls.
         */
        public Builder loopEnabled(boolean loopEnabled) {
            this.loopEnabled = loopEnabled;
            return this;
        }

        public Builder events(int ringBufferSize, int watchCapacity, String waitStrategy) {
            this.ringBufferSize = ringBufferSize;
            this.watchCapacity = watchCapacity;
            this.waitStrategy = waitStrategy;
            return this;
        }

        public AutoScaler build() {
            if (registry == null) {
                throw new IllegalStateException("ServiceRegistry is required");
            }
            if (cluster == null) {
                throw new IllegalStateException("ClusterClient is required");
            }
            if (metrics == null) {
                metrics = MetricsRegistry.inMemory();
            }
            return new AutoScaler(this);
        }
    }
}
