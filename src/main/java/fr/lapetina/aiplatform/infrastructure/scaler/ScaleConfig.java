package fr.lapetina.aiplatform.infrastructure.scaler;

import java.time.Duration;
import java.time.Instant;

/**
 * Scaling bounds and targets for one feature, with the time of the last
 * applied action in each direction.
 *
 * @param serviceType     registry type whose instances are measured, defaults to the feature id
 * @param targetCpu       mean CPU percentage above which the fleet scales up
 * @param targetQueueSize summed queue depth above which the fleet scales up
 */
public record ScaleConfig(
        String featureId,
        String serviceType,
        int minInstances,
        int maxInstances,
        double targetCpu,
        double targetMemory,
        int targetQueueSize,
        Duration idleTimeout,
        Duration scaleUpCooldown,
        Duration scaleDownCooldown,
        String deploymentName,
        String namespace,
        Instant lastScaleUp,
        Instant lastScaleDown
) {

    public static final String DEFAULT_NAMESPACE = "ai-platform";

    public ScaleConfig {
        if (featureId == null || featureId.isBlank()) {
            throw new IllegalArgumentException("Scale config feature id is required");
        }
        if (minInstances < 0 || maxInstances < minInstances) {
            throw new IllegalArgumentException(
                    "Invalid instance bounds for " + featureId + ": min=" + minInstances + ", max=" + maxInstances);
        }
        if (serviceType == null || serviceType.isBlank()) {
            serviceType = featureId;
        }
        if (deploymentName == null || deploymentName.isBlank()) {
            deploymentName = featureId.replace('_', '-') + "-inference";
        }
        if (namespace == null || namespace.isBlank()) {
            namespace = DEFAULT_NAMESPACE;
        }
        idleTimeout = idleTimeout != null ? idleTimeout : Duration.ofMinutes(15);
        scaleUpCooldown = scaleUpCooldown != null ? scaleUpCooldown : Duration.ofSeconds(60);
        scaleDownCooldown = scaleDownCooldown != null ? scaleDownCooldown : Duration.ofMinutes(5);
    }

    ScaleConfig withLastScaleUp(Instant at) {
        return new ScaleConfig(featureId, serviceType, minInstances, maxInstances, targetCpu, targetMemory,
                targetQueueSize, idleTimeout, scaleUpCooldown, scaleDownCooldown, deploymentName, namespace,
                at, lastScaleDown);
    }

    ScaleConfig withLastScaleDown(Instant at) {
        return new ScaleConfig(featureId, serviceType, minInstances, maxInstances, targetCpu, targetMemory,
                targetQueueSize, idleTimeout, scaleUpCooldown, scaleDownCooldown, deploymentName, namespace,
                lastScaleUp, at);
    }

    ScaleConfig withTimestampsOf(ScaleConfig previous) {
        return new ScaleConfig(featureId, serviceType, minInstances, maxInstances, targetCpu, targetMemory,
                targetQueueSize, idleTimeout, scaleUpCooldown, scaleDownCooldown, deploymentName, namespace,
                previous.lastScaleUp, previous.lastScaleDown);
    }

    public static Builder builder(String featureId) {
        return new Builder(featureId);
    }

    public static final class Builder {
        private final String featureId;
        private String serviceType;
        private int minInstances = 0;
        private int maxInstances = 1;
        private double targetCpu = 70;
        private double targetMemory = 80;
        private int targetQueueSize = 50;
        private Duration idleTimeout;
        private Duration scaleUpCooldown;
        private Duration scaleDownCooldown;
        private String deploymentName;
        private String namespace;

        private Builder(String featureId) {
            this.featureId = featureId;
        }

        public Builder serviceType(String serviceType) {
            this.serviceType = serviceType;
            return this;
        }

        public Builder instances(int min, int max) {
            this.minInstances = min;
            this.maxInstances = max;
            return this;
        }

        public Builder targetCpu(double targetCpu) {
            this.targetCpu = targetCpu;
            return this;
        }

        public Builder targetMemory(double targetMemory) {
            this.targetMemory = targetMemory;
            return this;
        }

        public Builder targetQueueSize(int targetQueueSize) {
            this.targetQueueSize = targetQueueSize;
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder cooldowns(Duration up, Duration down) {
            this.scaleUpCooldown = up;
            this.scaleDownCooldown = down;
            return this;
        }

        public Builder deployment(String namespace, String deploymentName) {
            this.namespace = namespace;
            this.deploymentName = deploymentName;
            return this;
        }

        public ScaleConfig build() {
            return new ScaleConfig(featureId, serviceType, minInstances, maxInstances, targetCpu, targetMemory,
                    targetQueueSize, idleTimeout, scaleUpCooldown, scaleDownCooldown, deploymentName, namespace,
                    null, null);
        }
    }
}
