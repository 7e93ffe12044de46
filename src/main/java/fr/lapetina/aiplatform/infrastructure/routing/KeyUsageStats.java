package fr.lapetina.aiplatform.infrastructure.routing;

import java.time.Instant;

/**
 * Accumulated usage of one API key since startup.
 */
public record KeyUsageStats(
        long requests,
        long failures,
        long tokens,
        long images,
        double cost,
        Instant lastUsedAt
) {

    public static final KeyUsageStats EMPTY = new KeyUsageStats(0, 0, 0, 0, 0.0, null);

    KeyUsageStats add(KeyUsage usage) {
        return new KeyUsageStats(
                requests + 1,
                failures + (usage.success() ? 0 : 1),
                tokens + usage.tokensInput() + usage.tokensOutput(),
                images + usage.images(),
                cost + usage.cost(),
                usage.timestamp()
        );
    }
}
