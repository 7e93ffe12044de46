package fr.lapetina.aiplatform.infrastructure.provider;

import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.aiplatform.domain.exception.ProviderException;
import fr.lapetina.aiplatform.domain.model.GeneratedImage;
import fr.lapetina.aiplatform.domain.request.FeatureKind;
import fr.lapetina.aiplatform.domain.request.TextGenerationRequest;
import fr.lapetina.aiplatform.domain.request.TextToImageRequest;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Client for OpenAI-compatible APIs: chat completions and image generation.
 */
public final class OpenAiProvider implements Provider {

    public static final String VENDOR = "openai";

    private static final String DEFAULT_ENDPOINT = "https://api.openai.com";
    private static final String DEFAULT_TEXT_MODEL = "gpt-4o-mini";
    private static final String DEFAULT_IMAGE_MODEL = "dall-e-3";

    private final ProviderSettings settings;
    private final JsonHttpCaller http;
    private final String endpoint;

    public OpenAiProvider(ProviderSettings settings) {
        if (settings.apiKey() == null || settings.apiKey().isBlank()) {
            throw new IllegalArgumentException("OpenAI provider requires an API key");
        }
        this.settings = settings;
        this.http = new JsonHttpCaller(Duration.ofSeconds(10));
        String base = settings.endpoint() != null && !settings.endpoint().isBlank()
                ? settings.endpoint()
                : DEFAULT_ENDPOINT;
        this.endpoint = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    @Override
    public String getName() {
        return VENDOR;
    }

    @Override
    public Set<FeatureKind> capabilities() {
        return EnumSet.of(FeatureKind.TEXT_GENERATION, FeatureKind.TEXT_TO_IMAGE);
    }

    @Override
    public TextResult generateText(TextGenerationRequest request) {
        String model = modelFor(request.model(), DEFAULT_TEXT_MODEL);

        List<Map<String, String>> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(Map.of("role", "system", "content", request.systemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", request.prompt()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        body.put("max_tokens", request.maxTokens());
        body.put("temperature", request.temperature());
        body.put("top_p", request.topP());
        if (request.stop() != null && !request.stop().isEmpty()) {
            body.put("stop", request.stop());
        }

        JsonNode reply = http.post(VENDOR, URI.create(endpoint + "/v1/chat/completions"), body,
                authHeaders(), settings.requestTimeout());

        JsonNode choice = reply.path("choices").path(0);
        if (choice.isMissingNode()) {
            throw new ProviderException(VENDOR, "invalid_response", "Completion returned no choices", false);
        }
        JsonNode usage = reply.path("usage");
        return new TextResult(
                choice.path("message").path("content").asText(""),
                usage.path("prompt_tokens").asInt(0),
                usage.path("completion_tokens").asInt(0),
                reply.path("model").asText(model)
        );
    }

    @Override
    public ImageResult generateImage(TextToImageRequest request) {
        String model = modelFor(request.model(), DEFAULT_IMAGE_MODEL);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", request.prompt());
        body.put("n", request.count());
        body.put("size", request.width() + "x" + request.height());
        if (request.style() != null && !request.style().isBlank()) {
            body.put("style", request.style());
        }

        JsonNode reply = http.post(VENDOR, URI.create(endpoint + "/v1/images/generations"), body,
                authHeaders(), settings.requestTimeout());

        List<GeneratedImage> images = new ArrayList<>();
        for (JsonNode item : reply.path("data")) {
            images.add(new GeneratedImage(
                    item.hasNonNull("url") ? item.get("url").asText() : null,
                    item.hasNonNull("b64_json") ? item.get("b64_json").asText() : null,
                    request.width(),
                    request.height(),
                    request.seed()
            ));
        }
        return new ImageResult(images, model);
    }

    private String modelFor(String requested, String fallback) {
        if (requested != null && !requested.isBlank()) {
            return requested;
        }
        if (settings.model() != null && !settings.model().isBlank()) {
            return settings.model();
        }
        return fallback;
    }

    private Map<String, String> authHeaders() {
        return Map.of("Authorization", "Bearer " + settings.apiKey());
    }
}
