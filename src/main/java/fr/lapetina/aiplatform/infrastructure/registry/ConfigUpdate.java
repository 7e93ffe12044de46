package fr.lapetina.aiplatform.infrastructure.registry;

import java.time.Instant;
import java.util.Map;

/**
 * Out-of-band configuration pushed to one instance through its next heartbeat.
 */
public record ConfigUpdate(String version, Map<String, Object> settings, Instant issuedAt) {

    public ConfigUpdate {
        settings = settings != null ? Map.copyOf(settings) : Map.of();
    }
}
