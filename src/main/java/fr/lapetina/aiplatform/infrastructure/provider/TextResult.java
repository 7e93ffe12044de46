package fr.lapetina.aiplatform.infrastructure.provider;

public record TextResult(String text, int tokensInput, int tokensOutput, String model) {
}
