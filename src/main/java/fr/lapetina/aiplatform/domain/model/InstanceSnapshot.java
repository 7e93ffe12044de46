package fr.lapetina.aiplatform.domain.model;

import java.net.URI;
import java.time.Instant;

/**
 * Immutable point-in-time view of a {@link ServiceInstance}.
 */
public record InstanceSnapshot(
        String id,
        String serviceType,
        String version,
        String hostname,
        String ip,
        int port,
        Capabilities capabilities,
        Resources resources,
        Performance performance,
        HealthState state,
        InstanceMetrics metrics,
        Instant registeredAt,
        Instant lastHeartbeat,
        int missedHeartbeats,
        boolean drainRequested
) {

    /**
     * Base URI of the instance, preferring the IP address over the hostname.
     */
    public URI baseUri() {
        String host = ip != null && !ip.isBlank() ? ip : hostname;
        return URI.create("http://" + host + ":" + port);
    }
}
