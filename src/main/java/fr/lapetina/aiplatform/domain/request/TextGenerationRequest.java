package fr.lapetina.aiplatform.domain.request;

import java.util.List;

public record TextGenerationRequest(
        String prompt,
        String systemPrompt,
        Integer maxTokens,
        Double temperature,
        Double topP,
        Integer topK,
        List<String> stop,
        String model
) implements FeatureRequest {

    public static final int DEFAULT_MAX_TOKENS = 1000;
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final double DEFAULT_TOP_P = 1.0;

    public TextGenerationRequest {
        stop = stop != null ? List.copyOf(stop) : List.of();
    }

    public static TextGenerationRequest of(String prompt) {
        return new TextGenerationRequest(prompt, null, null, null, null, null, null, null);
    }

    @Override
    public FeatureKind kind() {
        return FeatureKind.TEXT_GENERATION;
    }

    @Override
    public TextGenerationRequest withDefaults() {
        return new TextGenerationRequest(
                prompt,
                systemPrompt,
                maxTokens != null ? maxTokens : DEFAULT_MAX_TOKENS,
                temperature != null ? temperature : DEFAULT_TEMPERATURE,
                topP != null ? topP : DEFAULT_TOP_P,
                topK,
                stop,
                model
        );
    }
}
