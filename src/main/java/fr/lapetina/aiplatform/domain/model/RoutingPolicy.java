package fr.lapetina.aiplatform.domain.model;

/**
 * Provider selection policy of a feature.
 *
 * Timeout and retry values are declarative: they are carried for providers
 * and clients that honour them, routing itself only applies {@code fallbackEnabled}.
 */
public record RoutingPolicy(
        String strategy,
        boolean fallbackEnabled,
        int timeoutSeconds,
        int maxRetries,
        long retryBackoffMs
) {
    public static final String DEFAULT_STRATEGY = "priority";

    public static final RoutingPolicy DEFAULT = new RoutingPolicy(DEFAULT_STRATEGY, true, 60, 0, 0);

    public RoutingPolicy {
        if (strategy == null || strategy.isBlank()) {
            strategy = DEFAULT_STRATEGY;
        }
    }
}
