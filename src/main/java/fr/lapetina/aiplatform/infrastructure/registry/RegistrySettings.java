package fr.lapetina.aiplatform.infrastructure.registry;

import java.time.Duration;

/**
 * Timing and threshold knobs of the service registry.
 */
public record RegistrySettings(
        Duration heartbeatInterval,
        Duration heartbeatTimeout,
        int missedHeartbeatThreshold,
        Duration sweepInterval,
        double errorRateThreshold,
        Duration shutdownGracePeriod,
        int pendingConfigLimit
) {

    public static RegistrySettings defaults() {
        return new RegistrySettings(
                Duration.ofSeconds(30),
                Duration.ofSeconds(90),
                3,
                Duration.ofSeconds(10),
                0.10,
                Duration.ofSeconds(30),
                16
        );
    }
}
