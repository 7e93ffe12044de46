package fr.lapetina.aiplatform.domain.model;

/**
 * One image produced by a provider, either as a URL or inline base64.
 */
public record GeneratedImage(String url, String base64, int width, int height, Long seed) {
}
