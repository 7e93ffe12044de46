package fr.lapetina.aiplatform.infrastructure.registry;

import fr.lapetina.aiplatform.domain.model.InstanceMetrics;

import java.time.Instant;

/**
 * Periodic liveness and load report of an instance.
 */
public record HeartbeatRequest(
        String serviceId,
        String token,
        Instant timestamp,
        double load,
        int queueSize,
        long processedCount,
        long errorCount,
        double cpuUsage,
        double gpuUsage,
        double memoryUsage
) {

    public InstanceMetrics toMetrics() {
        return new InstanceMetrics(load, queueSize, processedCount, errorCount, cpuUsage, gpuUsage, memoryUsage);
    }
}
