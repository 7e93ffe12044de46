package fr.lapetina.aiplatform.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Result of a routed inference request.
 * Immutable and thread-safe.
 */
public record InferenceResponse(
        String requestId,
        String feature,
        String status,
        ProviderType providerType,
        String providerId,
        String instanceId,
        String text,
        List<GeneratedImage> images,
        int tokensInput,
        int tokensOutput,
        double cost,
        boolean fallbackUsed,
        Instant receivedAt,
        Instant dispatchedAt,
        Instant completedAt
) {
    public static final String STATUS_SUCCESS = "success";

    public InferenceResponse {
        Objects.requireNonNull(requestId, "Request ID is required");
        images = images != null ? List.copyOf(images) : List.of();
        if (status == null) {
            status = STATUS_SUCCESS;
        }
    }

    public int imageCount() {
        return images.size();
    }

    /**
     * Time spent resolving, filtering and selecting before the provider call.
     */
    public long selectionMs() {
        return between(receivedAt, dispatchedAt);
    }

    /**
     * Time spent in the provider call, fallback attempts included.
     */
    public long executionMs() {
        return between(dispatchedAt, completedAt);
    }

    public long totalMs() {
        return between(receivedAt, completedAt);
    }

    private static long between(Instant from, Instant to) {
        if (from == null || to == null) {
            return 0;
        }
        return Duration.between(from, to).toMillis();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String feature;
        private String status = STATUS_SUCCESS;
        private ProviderType providerType;
        private String providerId;
        private String instanceId;
        private String text;
        private List<GeneratedImage> images;
        private int tokensInput;
        private int tokensOutput;
        private double cost;
        private boolean fallbackUsed;
        private Instant receivedAt;
        private Instant dispatchedAt;
        private Instant completedAt;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder feature(String feature) {
            this.feature = feature;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder providerType(ProviderType providerType) {
            this.providerType = providerType;
            return this;
        }

        public Builder providerId(String providerId) {
            this.providerId = providerId;
            return this;
        }

        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder images(List<GeneratedImage> images) {
            this.images = images;
            return this;
        }

        public Builder tokensInput(int tokensInput) {
            this.tokensInput = tokensInput;
            return this;
        }

        public Builder tokensOutput(int tokensOutput) {
            this.tokensOutput = tokensOutput;
            return this;
        }

        public Builder cost(double cost) {
            this.cost = cost;
            return this;
        }

        public Builder fallbackUsed(boolean fallbackUsed) {
            this.fallbackUsed = fallbackUsed;
            return this;
        }

        public Builder receivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        public Builder dispatchedAt(Instant dispatchedAt) {
            this.dispatchedAt = dispatchedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public InferenceResponse build() {
            return new InferenceResponse(
                    requestId, feature, status, providerType, providerId, instanceId,
                    text, images, tokensInput, tokensOutput, cost, fallbackUsed,
                    receivedAt, dispatchedAt, completedAt
            );
        }
    }
}
