package fr.lapetina.aiplatform.infrastructure.scaler;

/**
 * Fleet metrics aggregated over a feature's healthy and degraded instances.
 *
 * @param queueSize   summed queue depth
 * @param idleSeconds time since the fleet last showed activity
 */
public record ScaleMetrics(
        int instanceCount,
        double cpuUsage,
        double memoryUsage,
        double gpuUsage,
        int queueSize,
        double requestsPerSecond,
        long idleSeconds
) {

    public static final ScaleMetrics EMPTY = new ScaleMetrics(0, 0, 0, 0, 0, 0, 0);
}
