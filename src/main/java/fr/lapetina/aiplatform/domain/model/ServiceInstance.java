package fr.lapetina.aiplatform.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A registered self-hosted instance.
 *
 * Mutable and NOT thread-safe: instances are owned by the service registry,
 * which guards every read and write with its own lock. Everything handed out
 * of the registry is an {@link InstanceSnapshot}.
 */
public final class ServiceInstance {
    private final String id;
    private final String serviceType;
    private final Instant registeredAt;

    private String version;
    private String hostname;
    private String ip;
    private int port;
    private Capabilities capabilities;
    private Resources resources;
    private Performance performance;
    private String token;

    private HealthState state;
    private Instant lastHeartbeat;
    private int missedHeartbeats;
    private boolean drainRequested;
    private String drainReason;
    private InstanceMetrics metrics;

    private ServiceInstance(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Service ID is required");
        this.serviceType = Objects.requireNonNull(builder.serviceType, "Service type is required");
        this.registeredAt = Objects.requireNonNull(builder.registeredAt, "Registration time is required");
        this.version = builder.version;
        this.hostname = builder.hostname;
        this.ip = builder.ip;
        this.port = builder.port;
        this.capabilities = builder.capabilities;
        this.resources = builder.resources;
        this.performance = builder.performance;
        this.token = builder.token;
        this.state = builder.state;
        this.lastHeartbeat = builder.lastHeartbeat != null ? builder.lastHeartbeat : builder.registeredAt;
        this.missedHeartbeats = builder.missedHeartbeats;
        this.drainRequested = builder.drainRequested;
        this.metrics = builder.metrics;
    }

    public String getId() {
        return id;
    }

    public String getServiceType() {
        return serviceType;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    public String getVersion() {
        return version;
    }

    public String getHostname() {
        return hostname;
    }

    public String getIp() {
        return ip;
    }

    public int getPort() {
        return port;
    }

    public String getToken() {
        return token;
    }

    public HealthState getState() {
        return state;
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }

    public int getMissedHeartbeats() {
        return missedHeartbeats;
    }

    public boolean isDrainRequested() {
        return drainRequested;
    }

    public InstanceMetrics getMetrics() {
        return metrics;
    }

    /**
     * Applies a re-registration of the same process identity.
     */
    public void updateRegistration(
            String version,
            String hostname,
            String ip,
            int port,
            Capabilities capabilities,
            Resources resources,
            Performance performance,
            String token,
            Instant now
    ) {
        this.version = version;
        this.hostname = hostname;
        this.ip = ip;
        this.port = port;
        this.capabilities = capabilities;
        this.resources = resources;
        this.performance = performance;
        this.token = token;
        this.state = HealthState.HEALTHY;
        this.drainRequested = false;
        this.drainReason = null;
        this.lastHeartbeat = now;
        this.missedHeartbeats = 0;
    }

    /**
     * Records a heartbeat: resets the miss counter and stores the reported metrics.
     */
    public void recordHeartbeat(InstanceMetrics metrics, Instant now) {
        this.metrics = metrics;
        this.lastHeartbeat = now;
        this.missedHeartbeats = 0;
    }

    /**
     * Increments the consecutive-miss counter, returning the new value.
     */
    public int recordMissedHeartbeat() {
        return ++missedHeartbeats;
    }

    public void setState(HealthState state) {
        this.state = state;
    }

    public void requestDrain(String reason) {
        this.state = HealthState.DRAINING;
        this.drainRequested = true;
        this.drainReason = reason;
    }

    public String getDrainReason() {
        return drainReason;
    }

    public InstanceSnapshot snapshot() {
        return new InstanceSnapshot(
                id, serviceType, version, hostname, ip, port,
                capabilities, resources, performance,
                state, metrics, registeredAt, lastHeartbeat,
                missedHeartbeats, drainRequested
        );
    }

    @Override
    public String toString() {
        return "ServiceInstance{" +
                "id='" + id + '\'' +
                ", type=" + serviceType +
                ", endpoint=" + (ip != null && !ip.isBlank() ? ip : hostname) + ":" + port +
                ", state=" + state +
                ", missed=" + missedHeartbeats +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Rebuilds a mutable instance from a persisted snapshot.
     */
    public static ServiceInstance restore(InstanceSnapshot snapshot, String token) {
        return builder()
                .id(snapshot.id())
                .serviceType(snapshot.serviceType())
                .version(snapshot.version())
                .hostname(snapshot.hostname())
                .ip(snapshot.ip())
                .port(snapshot.port())
                .capabilities(snapshot.capabilities())
                .resources(snapshot.resources())
                .performance(snapshot.performance())
                .token(token)
                .state(snapshot.state())
                .registeredAt(snapshot.registeredAt())
                .lastHeartbeat(snapshot.lastHeartbeat())
                .missedHeartbeats(snapshot.missedHeartbeats())
                .drainRequested(snapshot.drainRequested())
                .metrics(snapshot.metrics())
                .build();
    }

    public static final class Builder {
        private String id;
        private String serviceType;
        private String version = "";
        private String hostname = "";
        private String ip = "";
        private int port;
        private Capabilities capabilities = Capabilities.NONE;
        private Resources resources = Resources.NONE;
        private Performance performance = Performance.UNKNOWN;
        private String token;
        private HealthState state = HealthState.HEALTHY;
        private Instant registeredAt;
        private Instant lastHeartbeat;
        private int missedHeartbeats;
        private boolean drainRequested;
        private InstanceMetrics metrics = InstanceMetrics.EMPTY;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder serviceType(String serviceType) {
            this.serviceType = serviceType;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder ip(String ip) {
            this.ip = ip;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder capabilities(Capabilities capabilities) {
            this.capabilities = capabilities != null ? capabilities : Capabilities.NONE;
            return this;
        }

        public Builder resources(Resources resources) {
            this.resources = resources != null ? resources : Resources.NONE;
            return this;
        }

        public Builder performance(Performance performance) {
            this.performance = performance != null ? performance : Performance.UNKNOWN;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder state(HealthState state) {
            this.state = state;
            return this;
        }

        public Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public Builder missedHeartbeats(int missedHeartbeats) {
            this.missedHeartbeats = missedHeartbeats;
            return this;
        }

        public Builder drainRequested(boolean drainRequested) {
            this.drainRequested = drainRequested;
            return this;
        }

        public Builder metrics(InstanceMetrics metrics) {
            this.metrics = metrics != null ? metrics : InstanceMetrics.EMPTY;
            return this;
        }

        public ServiceInstance build() {
            return new ServiceInstance(this);
        }
    }
}
