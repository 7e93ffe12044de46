package fr.lapetina.aiplatform.infrastructure.scaler;

import java.time.Instant;

public record ScaleEvent(
        String featureId,
        ScaleAction action,
        int current,
        int target,
        String reason,
        Instant timestamp
) {
}
