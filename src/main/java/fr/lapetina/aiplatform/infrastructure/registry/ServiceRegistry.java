package fr.lapetina.aiplatform.infrastructure.registry;

import fr.lapetina.aiplatform.domain.exception.ControlPlaneException;
import fr.lapetina.aiplatform.domain.model.HealthState;
import fr.lapetina.aiplatform.domain.model.InstanceMetrics;
import fr.lapetina.aiplatform.domain.model.InstanceSnapshot;
import fr.lapetina.aiplatform.domain.model.ServiceInstance;
import fr.lapetina.aiplatform.infrastructure.config.ControlPlaneConfig;
import fr.lapetina.aiplatform.infrastructure.event.EventStream;
import fr.lapetina.aiplatform.infrastructure.event.EventWatch;
import fr.lapetina.aiplatform.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.aiplatform.infrastructure.scheduling.ScheduledLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Authoritative in-memory view of the self-hosted fleet.
 *
 * Owns every {@link ServiceInstance} behind a single read-write lock:
 * lookups take the read lock, registration, heartbeats, shutdown and the
 * timeout sweep take the write lock. Callers only ever receive
 * {@link InstanceSnapshot}s. Persistence runs on a background executor and
 * never blocks the calling thread.
 *
 * Health transitions:
 * - Heartbeat: HEALTHY/DEGRADED/UNHEALTHY to HEALTHY or DEGRADED by error rate
 * - Timeout sweep: to UNHEALTHY after repeated missed windows
 * - Shutdown: to DRAINING
 * - Termination confirmation: DRAINING to TERMINATED
 */
public final class ServiceRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    static final String SHUTDOWN_MESSAGE = "Shutdown accepted. Complete in-flight requests.";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ServiceInstance> services = new LinkedHashMap<>();
    private final Map<String, Deque<ConfigUpdate>> pendingConfig = new LinkedHashMap<>();

    private final ServiceStore store;
    private final Executor persistenceExecutor;
    private final ExecutorService ownedExecutor;
    private final EventStream<InstanceSnapshot> heartbeatStream;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private final RegistrySettings settings;
    private final ScheduledLoop sweepLoop;

    private ServiceRegistry(Builder builder) {
        this.store = builder.store;
        this.clock = builder.clock;
        this.settings = builder.settings;
        this.metrics = builder.metrics;
        if (builder.persistenceExecutor != null) {
            this.persistenceExecutor = builder.persistenceExecutor;
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "registry-persistence");
                t.setDaemon(true);
                return t;
            });
            this.persistenceExecutor = ownedExecutor;
        }
        this.heartbeatStream = new EventStream<>("heartbeats",
                builder.ringBufferSize, builder.watchCapacity, builder.waitStrategy);
        this.sweepLoop = new ScheduledLoop("registry-sweep", settings.sweepInterval(), this::sweep);

        for (HealthState state : HealthState.values()) {
            metrics.registerInstanceGauge(state, () -> countByState(state));
        }
        metrics.registerDroppedEvents(heartbeatStream.getName(), heartbeatStream::getDroppedCount);

        log.info("ServiceRegistry created: heartbeatInterval={}, timeout={}, missThreshold={}, errorRateThreshold={}",
                settings.heartbeatInterval(), settings.heartbeatTimeout(),
                settings.missedHeartbeatThreshold(), settings.errorRateThreshold());
    }

    /**
     * Loads persisted instances and starts the heartbeat stream and timeout sweep.
     */
    public void start() {
        loadFromStore();
        heartbeatStream.start();
        sweepLoop.start();
        log.info("ServiceRegistry started: services={}", size());
    }

    // ==================== REGISTRATION ====================

    /**
     * Registers an instance, or updates it in place when the same identity
     * registers again. A new token is issued on every call.
     */
    public RegistrationResult register(RegistrationRequest request) {
        validate(request);

        String serviceId = computeServiceId(request.serviceType(), request.hostname(), request.ip(), request.port());
        String token = UUID.randomUUID().toString();
        Instant now = clock.instant();
        ServiceRecord record;

        lock.writeLock().lock();
        try {
            ServiceInstance existing = services.get(serviceId);
            if (existing != null && !existing.getState().isTerminal()) {
                HealthState previous = existing.getState();
                existing.updateRegistration(
                        request.version(), request.hostname(), request.ip(), request.port(),
                        request.capabilities(), request.resources(), request.performance(),
                        token, now
                );
                log.info("Service re-registered: serviceId={}, type={}, previousState={}",
                        serviceId, request.serviceType(), previous);
                record = new ServiceRecord(existing.snapshot(), token);
            } else {
                ServiceInstance instance = ServiceInstance.builder()
                        .id(serviceId)
                        .serviceType(request.serviceType())
                        .version(request.version())
                        .hostname(request.hostname())
                        .ip(request.ip())
                        .port(request.port())
                        .capabilities(request.capabilities())
                        .resources(request.resources())
                        .performance(request.performance())
                        .token(token)
                        .registeredAt(now)
                        .build();
                services.put(serviceId, instance);
                log.info("Service registered: serviceId={}, type={}, endpoint={}",
                        serviceId, request.serviceType(), instance.snapshot().baseUri());
                record = new ServiceRecord(instance.snapshot(), token);
            }
        } finally {
            lock.writeLock().unlock();
        }

        persistAsync(record);
        return new RegistrationResult(serviceId, (int) settings.heartbeatInterval().toSeconds(), token);
    }

    private static void validate(RegistrationRequest request) {
        if (request == null) {
            throw ControlPlaneException.validation("Registration request is required");
        }
        if (request.serviceType() == null || request.serviceType().isBlank()) {
            throw ControlPlaneException.validation("service_type is required");
        }
        boolean noHost = request.hostname() == null || request.hostname().isBlank();
        boolean noIp = request.ip() == null || request.ip().isBlank();
        if (noHost && noIp) {
            throw ControlPlaneException.validation("hostname or ip is required");
        }
        if (request.port() < 1 || request.port() > 65535) {
            throw ControlPlaneException.validation("port must be between 1 and 65535: " + request.port());
        }
    }

    /**
     * Derives a stable id from the instance's network identity, so that a
     * restarted process registering again maps onto the same entry.
     */
    public static String computeServiceId(String serviceType, String hostname, String ip, int port) {
        String identity = serviceType + "|" + nullToEmpty(hostname) + "|" + nullToEmpty(ip) + "|" + port;
        String digest = UUID.nameUUIDFromBytes(identity.getBytes(StandardCharsets.UTF_8)).toString();
        return serviceType + "-" + digest.substring(0, 8);
    }

    // ==================== HEARTBEAT ====================

    /**
     * Records a heartbeat and re-evaluates health from the reported error rate.
     *
     * @throws ControlPlaneException NOT_FOUND for unknown ids, UNAUTHORIZED for a bad token
     */
    public HeartbeatResult heartbeat(HeartbeatRequest request) {
        InstanceMetrics reported;
        try {
            reported = request.toMetrics();
        } catch (IllegalArgumentException e) {
            throw ControlPlaneException.validation(e.getMessage());
        }
        Instant now = clock.instant();
        InstanceSnapshot snapshot;
        String token;
        HealthState previous;
        ConfigUpdate update;

        lock.writeLock().lock();
        try {
            ServiceInstance instance = requireLive(request.serviceId());
            if (!tokenMatches(instance.getToken(), request.token())) {
                throw ControlPlaneException.unauthorized("Invalid token for service: " + request.serviceId());
            }

            previous = instance.getState();
            instance.recordHeartbeat(reported, now);
            instance.setState(evaluateHealth(previous, reported));

            update = pollPendingConfig(instance.getId());
            snapshot = instance.snapshot();
            token = instance.getToken();
        } finally {
            lock.writeLock().unlock();
        }

        if (previous != snapshot.state()) {
            log.info("Service health changed: serviceId={}, previousState={}, newState={}, errorRate={}",
                    snapshot.id(), previous, snapshot.state(), String.format("%.3f", snapshot.metrics().errorRate()));
            metrics.incrementHealthTransition(snapshot.state());
        }
        log.debug("Heartbeat accepted: serviceId={}, state={}, load={}, queue={}",
                snapshot.id(), snapshot.state(), snapshot.metrics().load(), snapshot.metrics().queueSize());

        metrics.incrementHeartbeat(snapshot.serviceType());
        heartbeatStream.publish(snapshot);
        persistAsync(new ServiceRecord(snapshot, token));

        return new HeartbeatResult(snapshot.state().wireName(), update, snapshot.drainRequested());
    }

    private HealthState evaluateHealth(HealthState current, InstanceMetrics reported) {
        if (current == HealthState.DRAINING) {
            return current;
        }
        if (reported.processedCount() > 0 && reported.errorRate() > settings.errorRateThreshold()) {
            return HealthState.DEGRADED;
        }
        return HealthState.HEALTHY;
    }

    private static boolean tokenMatches(String expected, String presented) {
        if (expected == null || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8)
        );
    }

    // ==================== SHUTDOWN ====================

    /**
     * Moves an instance to DRAINING. Its next heartbeat reports {@code drainRequested}.
     */
    public ShutdownResult shutdown(String serviceId, String reason) {
        ServiceRecord record;
        HealthState previous;

        lock.writeLock().lock();
        try {
            ServiceInstance instance = requireLive(serviceId);
            previous = instance.getState();
            if (previous != HealthState.DRAINING) {
                instance.requestDrain(reason);
            }
            record = new ServiceRecord(instance.snapshot(), instance.getToken());
        } finally {
            lock.writeLock().unlock();
        }

        if (previous != HealthState.DRAINING) {
            log.info("Service draining: serviceId={}, previousState={}, reason={}", serviceId, previous, reason);
            metrics.incrementHealthTransition(HealthState.DRAINING);
            persistAsync(record);
        }
        return new ShutdownResult((int) settings.shutdownGracePeriod().toSeconds(), SHUTDOWN_MESSAGE);
    }

    /**
     * Records that a draining instance has exited. TERMINATED is final.
     */
    public void confirmTerminated(String serviceId) {
        ServiceRecord record;
        lock.writeLock().lock();
        try {
            ServiceInstance instance = requireLive(serviceId);
            if (instance.getState() != HealthState.DRAINING) {
                throw ControlPlaneException.conflict(
                        "Service must be draining before termination: " + serviceId + " is " + instance.getState());
            }
            instance.setState(HealthState.TERMINATED);
            pendingConfig.remove(serviceId);
            record = new ServiceRecord(instance.snapshot(), instance.getToken());
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Service terminated: serviceId={}", serviceId);
        metrics.incrementHealthTransition(HealthState.TERMINATED);
        persistAsync(record);
    }

    // ==================== CONFIG PUSH ====================

    /**
     * Queues a configuration update for delivery on the instance's next heartbeat.
     *
     * @throws ControlPlaneException UNAVAILABLE when the instance already has too many pending updates
     */
    public void pushConfig(String serviceId, ConfigUpdate update) {
        lock.writeLock().lock();
        try {
            requireLive(serviceId);
            Deque<ConfigUpdate> queue = pendingConfig.computeIfAbsent(serviceId, id -> new ArrayDeque<>());
            if (queue.size() >= settings.pendingConfigLimit()) {
                throw ControlPlaneException.unavailable("Pending config queue full for service: " + serviceId);
            }
            queue.addLast(update);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Config update queued: serviceId={}, version={}", serviceId, update.version());
    }

    // Caller holds the write lock
    private ConfigUpdate pollPendingConfig(String serviceId) {
        Deque<ConfigUpdate> queue = pendingConfig.get(serviceId);
        if (queue == null) {
            return null;
        }
        ConfigUpdate update = queue.pollFirst();
        if (queue.isEmpty()) {
            pendingConfig.remove(serviceId);
        }
        return update;
    }

    // ==================== QUERIES ====================

    /**
     * Healthy instances of a type, the only ones new requests are dispatched to.
     */
    public List<InstanceSnapshot> getHealthyServices(String serviceType) {
        return query(i -> i.getServiceType().equals(serviceType) && i.getState() == HealthState.HEALTHY);
    }

    /**
     * Healthy and degraded instances of a type, for capacity aggregation.
     */
    public List<InstanceSnapshot> getServicesByType(String serviceType) {
        return query(i -> i.getServiceType().equals(serviceType)
                && (i.getState() == HealthState.HEALTHY || i.getState() == HealthState.DEGRADED));
    }

    public Optional<InstanceSnapshot> getService(String serviceId) {
        lock.readLock().lock();
        try {
            ServiceInstance instance = services.get(serviceId);
            return instance != null ? Optional.of(instance.snapshot()) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Lists non-terminated instances, optionally restricted to one type.
     */
    public ServiceListing listServices(String serviceType) {
        List<InstanceSnapshot> matching = query(i -> !i.getState().isTerminal()
                && (serviceType == null || serviceType.isBlank() || i.getServiceType().equals(serviceType)));

        int healthy = 0;
        int degraded = 0;
        int unhealthy = 0;
        int draining = 0;
        for (InstanceSnapshot s : matching) {
            switch (s.state()) {
                case HEALTHY -> healthy++;
                case DEGRADED -> degraded++;
                case UNHEALTHY -> unhealthy++;
                case DRAINING -> draining++;
                default -> {
                }
            }
        }
        return new ServiceListing(matching, healthy, degraded, unhealthy, draining);
    }

    public int countByState(HealthState state) {
        lock.readLock().lock();
        try {
            int count = 0;
            for (ServiceInstance instance : services.values()) {
                if (instance.getState() == state) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return services.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<InstanceSnapshot> query(Predicate<ServiceInstance> filter) {
        lock.readLock().lock();
        try {
            List<InstanceSnapshot> result = new ArrayList<>();
            for (ServiceInstance instance : services.values()) {
                if (filter.test(instance)) {
                    result.add(instance.snapshot());
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Opens a watch over accepted heartbeats. Close it to stop receiving.
     */
    public EventWatch<InstanceSnapshot> watchHeartbeats() {
        return heartbeatStream.watch();
    }

    // ==================== TIMEOUT SWEEP ====================

    /**
     * One pass of heartbeat timeout detection.
     *
     * Every monitored instance whose last heartbeat is older than the timeout
     * gets one more missed heartbeat; reaching the threshold marks it UNHEALTHY.
     *
     * @return number of instances newly marked UNHEALTHY
     */
    public int sweep() {
        Instant now = clock.instant();
        List<ServiceRecord> changed = new ArrayList<>();

        lock.writeLock().lock();
        try {
            for (ServiceInstance instance : services.values()) {
                if (!instance.getState().isMonitored()) {
                    continue;
                }
                Duration silence = Duration.between(instance.getLastHeartbeat(), now);
                if (silence.compareTo(settings.heartbeatTimeout()) <= 0) {
                    continue;
                }
                int missed = instance.recordMissedHeartbeat();
                if (missed >= settings.missedHeartbeatThreshold() && instance.getState() != HealthState.UNHEALTHY) {
                    HealthState previous = instance.getState();
                    instance.setState(HealthState.UNHEALTHY);
                    changed.add(new ServiceRecord(instance.snapshot(), instance.getToken()));
                    log.warn("Service marked unhealthy: serviceId={}, previousState={}, missedHeartbeats={}, silenceSeconds={}",
                            instance.getId(), previous, missed, silence.toSeconds());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        for (ServiceRecord record : changed) {
            metrics.incrementHealthTransition(HealthState.UNHEALTHY);
            persistAsync(record);
        }
        return changed.size();
    }

    // ==================== PERSISTENCE ====================

    private void loadFromStore() {
        List<ServiceRecord> records;
        try {
            records = store.loadAll();
        } catch (RuntimeException e) {
            log.error("Failed to load services from store, starting empty", e);
            return;
        }

        int loaded = 0;
        lock.writeLock().lock();
        try {
            for (ServiceRecord record : records) {
                if (!services.containsKey(record.instance().id())) {
                    services.put(record.instance().id(), ServiceInstance.restore(record.instance(), record.token()));
                    loaded++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Services loaded from store: count={}", loaded);
    }

    private void persistAsync(ServiceRecord record) {
        String serviceId = record.instance().id();
        try {
            CompletableFuture.runAsync(() -> store.save(record), persistenceExecutor)
                    .exceptionally(ex -> {
                        log.warn("Failed to persist service: serviceId={}, error={}", serviceId, ex.getMessage());
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Persistence executor rejected write: serviceId={}", serviceId);
        }
    }

    // Caller holds the lock
    private ServiceInstance requireLive(String serviceId) {
        ServiceInstance instance = serviceId != null ? services.get(serviceId) : null;
        if (instance == null || instance.getState().isTerminal()) {
            throw ControlPlaneException.notFound("Service not found: " + serviceId);
        }
        return instance;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    public RegistrySettings getSettings() {
        return settings;
    }

    @Override
    public void close() {
        sweepLoop.close();
        heartbeatStream.close();
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
        log.info("ServiceRegistry stopped");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ServiceStore store = new InMemoryServiceStore();
        private Executor persistenceExecutor;
        private MetricsRegistry metrics;
        private Clock clock = Clock.systemUTC();
        private RegistrySettings settings = RegistrySettings.defaults();
        private int ringBufferSize = 128;
        private int watchCapacity = 10;
        private String waitStrategy = "blocking";

        public Builder store(ServiceStore store) {
            this.store = store;
            return this;
        }

        /**
         * Executor for fire-and-forget persistence writes. When unset the
         * registry owns a single daemon thread.
         */
        public Builder persistenceExecutor(Executor executor) {
            this.persistenceExecutor = executor;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder settings(RegistrySettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder events(int ringBufferSize, int watchCapacity, String waitStrategy) {
            this.ringBufferSize = ringBufferSize;
            this.watchCapacity = watchCapacity;
            this.waitStrategy = waitStrategy;
            return this;
        }

        /**
         * Configures settings and event buffers from the loaded configuration.
         */
        public Builder fromConfig(ControlPlaneConfig config) {
            this.settings = config.getRegistry().toSettings();
            ControlPlaneConfig.EventsConfig events = config.getEvents();
            return events(events.getRingBufferSize(), events.getWatchCapacity(), events.getWaitStrategy());
        }

        public ServiceRegistry build() {
            if (metrics == null) {
                metrics = MetricsRegistry.inMemory();
            }
            return new ServiceRegistry(this);
        }
    }
}
