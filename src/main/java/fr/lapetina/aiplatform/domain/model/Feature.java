package fr.lapetina.aiplatform.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * A named AI capability with its candidate providers.
 */
public record Feature(
        String id,
        String name,
        String category,
        String description,
        boolean enabled,
        List<ProviderConfig> providers,
        RoutingPolicy routing,
        CostConfig cost
) {
    public Feature {
        Objects.requireNonNull(id, "Feature ID is required");
        providers = providers != null ? List.copyOf(providers) : List.of();
        routing = routing != null ? routing : RoutingPolicy.DEFAULT;
        cost = cost != null ? cost : CostConfig.FREE;
        if (name == null || name.isBlank()) {
            name = id;
        }
    }

    /**
     * Service type that self-hosted instances of this feature register under.
     */
    public String instanceType() {
        return category != null && !category.isBlank() ? category : id;
    }
}
