package fr.lapetina.aiplatform.infrastructure.registry;

/**
 * Identity and credentials handed to a registered instance.
 */
public record RegistrationResult(String serviceId, int heartbeatIntervalSeconds, String token) {
}
