package fr.lapetina.aiplatform.domain.strategy;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory for provider selection strategies, keyed by the name used in
 * a feature's routing configuration.
 */
public final class StrategyFactory {

    private static final Map<String, Supplier<ProviderSelectionStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("priority", PriorityStrategy::new);
        register("weighted", WeightedStrategy::new);
        register("cost_based", CostBasedStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name     Strategy name (used in configuration)
     * @param supplier Factory for creating strategy instances
     */
    public static void register(String name, Supplier<ProviderSelectionStrategy> supplier) {
        REGISTRY.put(name.toLowerCase(), supplier);
    }

    /**
     * Creates a strategy by name.
     *
     * @return Strategy instance, or empty if the name is unknown
     */
    public static Optional<ProviderSelectionStrategy> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<ProviderSelectionStrategy> supplier = REGISTRY.get(name.toLowerCase());
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    /**
     * Creates a strategy by name, falling back to {@code priority} when the
     * name is missing or unknown.
     */
    public static ProviderSelectionStrategy createOrDefault(String name) {
        return create(name).orElseGet(PriorityStrategy::new);
    }

    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
