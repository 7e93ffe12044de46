package fr.lapetina.aiplatform.domain.request;

public record TextToImageRequest(
        String prompt,
        String negativePrompt,
        Integer width,
        Integer height,
        Integer steps,
        Double guidanceScale,
        Long seed,
        Integer count,
        String style,
        String model
) implements FeatureRequest {

    public static final int DEFAULT_SIZE = 1024;
    public static final int DEFAULT_STEPS = 50;
    public static final double DEFAULT_GUIDANCE = 7.5;

    public static TextToImageRequest of(String prompt) {
        return new TextToImageRequest(prompt, null, null, null, null, null, null, null, null, null);
    }

    @Override
    public FeatureKind kind() {
        return FeatureKind.TEXT_TO_IMAGE;
    }

    @Override
    public TextToImageRequest withDefaults() {
        return new TextToImageRequest(
                prompt,
                negativePrompt,
                width != null ? width : DEFAULT_SIZE,
                height != null ? height : DEFAULT_SIZE,
                steps != null ? steps : DEFAULT_STEPS,
                guidanceScale != null ? guidanceScale : DEFAULT_GUIDANCE,
                seed,
                count != null ? count : 1,
                style,
                model
        );
    }
}
