package fr.lapetina.aiplatform.infrastructure.registry;

public record ShutdownResult(int gracePeriodSeconds, String message) {
}
