package fr.lapetina.aiplatform.infrastructure.registry;

/**
 * Registry answer to a heartbeat.
 *
 * @param status         {@code healthy}, {@code degraded} or {@code draining}
 * @param configUpdate   pending configuration push for this instance, or null
 * @param drainRequested true once shutdown has been requested
 */
public record HeartbeatResult(String status, ConfigUpdate configUpdate, boolean drainRequested) {
}
