package fr.lapetina.aiplatform.domain.model;

/**
 * Hardware an instance runs on.
 */
public record Resources(int gpuMemoryMb, int gpuCount, double cpuCores, int memoryMb) {

    public static final Resources NONE = new Resources(0, 0, 0, 0);
}
