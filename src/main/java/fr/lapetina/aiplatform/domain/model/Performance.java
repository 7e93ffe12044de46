package fr.lapetina.aiplatform.domain.model;

/**
 * Self-declared performance envelope of an instance.
 */
public record Performance(long estimatedLatencyMs, int throughputPerMinute, int warmupTimeSeconds) {

    public static final Performance UNKNOWN = new Performance(0, 0, 0);
}
