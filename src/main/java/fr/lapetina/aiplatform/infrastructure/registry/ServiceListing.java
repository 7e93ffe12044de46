package fr.lapetina.aiplatform.infrastructure.registry;

import fr.lapetina.aiplatform.domain.model.InstanceSnapshot;

import java.util.List;

/**
 * Registered instances matching a listing filter, with per-state counts.
 */
public record ServiceListing(
        List<InstanceSnapshot> services,
        int healthy,
        int degraded,
        int unhealthy,
        int draining
) {
    public ServiceListing {
        services = List.copyOf(services);
    }

    public int total() {
        return services.size();
    }
}
