package fr.lapetina.aiplatform.domain.model;

/**
 * Live load figures reported by an instance on each heartbeat.
 *
 * Utilisation values are percentages in the range 0-100.
 */
public record InstanceMetrics(
        double load,
        int queueSize,
        long processedCount,
        long errorCount,
        double cpuUsage,
        double gpuUsage,
        double memoryUsage
) {

    public static final InstanceMetrics EMPTY = new InstanceMetrics(0, 0, 0, 0, 0, 0, 0);

    public InstanceMetrics {
        if (queueSize < 0 || processedCount < 0 || errorCount < 0) {
            throw new IllegalArgumentException("Counters must not be negative");
        }
    }

    /**
     * Error ratio over the processed count, zero when nothing was processed.
     */
    public double errorRate() {
        if (processedCount <= 0) {
            return 0.0;
        }
        return (double) errorCount / processedCount;
    }
}
