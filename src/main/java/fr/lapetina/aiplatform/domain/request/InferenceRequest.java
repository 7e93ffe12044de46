package fr.lapetina.aiplatform.domain.request;

import java.util.Objects;
import java.util.UUID;

/**
 * Envelope around a typed request: who asked, for which feature, under which id.
 */
public record InferenceRequest(
        String requestId,
        String feature,
        String tenantId,
        String traceId,
        FeatureRequest payload
) {
    public InferenceRequest {
        Objects.requireNonNull(payload, "Request payload is required");
        if (requestId == null || requestId.isBlank()) {
            requestId = newRequestId();
        }
        if (feature == null || feature.isBlank()) {
            feature = payload.kind().defaultFeature();
        }
    }

    public static InferenceRequest of(String feature, FeatureRequest payload) {
        return new InferenceRequest(null, feature, null, null, payload);
    }

    public InferenceRequest withPayload(FeatureRequest newPayload) {
        return new InferenceRequest(requestId, feature, tenantId, traceId, newPayload);
    }

    public static String newRequestId() {
        return "req-" + UUID.randomUUID();
    }
}
