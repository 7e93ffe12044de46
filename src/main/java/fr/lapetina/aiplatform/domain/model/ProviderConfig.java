package fr.lapetina.aiplatform.domain.model;

import java.util.Map;
import java.util.Objects;

/**
 * One candidate way of serving a feature.
 *
 * Lower {@code priority} is preferred. {@code weight} is the traffic share
 * under weighted routing. Vendor, service, model and endpoint only matter
 * for third-party providers; instance bounds only for self-hosted ones.
 */
public record ProviderConfig(
        String id,
        ProviderType type,
        boolean enabled,
        int priority,
        int weight,
        String vendor,
        String service,
        String model,
        String endpoint,
        int minInstances,
        int maxInstances,
        Map<String, String> extra
) {
    public ProviderConfig {
        Objects.requireNonNull(id, "Provider ID is required");
        Objects.requireNonNull(type, "Provider type is required");
        if (type == ProviderType.THIRD_PARTY && (vendor == null || vendor.isBlank())) {
            throw new IllegalArgumentException("Third-party provider " + id + " requires a vendor");
        }
        if (weight < 0) {
            throw new IllegalArgumentException("Weight must not be negative: " + id);
        }
        extra = extra != null ? Map.copyOf(extra) : Map.of();
    }

    public boolean isSelfHosted() {
        return type == ProviderType.SELF_HOSTED;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private ProviderType type = ProviderType.SELF_HOSTED;
        private boolean enabled = true;
        private int priority = 1;
        private int weight = 1;
        private String vendor;
        private String service;
        private String model;
        private String endpoint;
        private int minInstances;
        private int maxInstances = 1;
        private Map<String, String> extra;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(ProviderType type) {
            this.type = type;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder vendor(String vendor) {
            this.vendor = vendor;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder minInstances(int minInstances) {
            this.minInstances = minInstances;
            return this;
        }

        public Builder maxInstances(int maxInstances) {
            this.maxInstances = maxInstances;
            return this;
        }

        public Builder extra(Map<String, String> extra) {
            this.extra = extra;
            return this;
        }

        public ProviderConfig build() {
            return new ProviderConfig(id, type, enabled, priority, weight, vendor, service,
                    model, endpoint, minInstances, maxInstances, extra);
        }
    }
}
