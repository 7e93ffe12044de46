package fr.lapetina.aiplatform.api.dto;

public record ShutdownRequest(String reason) {
}
