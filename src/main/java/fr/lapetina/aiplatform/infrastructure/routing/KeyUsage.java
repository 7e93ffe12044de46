package fr.lapetina.aiplatform.infrastructure.routing;

import java.time.Instant;

/**
 * One use of an API key, reported after the vendor call returns or fails.
 */
public record KeyUsage(
        String requestId,
        String feature,
        int tokensInput,
        int tokensOutput,
        int images,
        double cost,
        boolean success,
        Instant timestamp
) {
}
