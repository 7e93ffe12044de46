package fr.lapetina.aiplatform.infrastructure.registry;

import fr.lapetina.aiplatform.domain.model.InstanceSnapshot;

/**
 * Persisted form of a registered instance: its snapshot and current token.
 */
public record ServiceRecord(InstanceSnapshot instance, String token) {
}
