package fr.lapetina.aiplatform.domain.request;

/**
 * Edits an existing image. {@code image} and {@code mask} are URLs or base64 payloads.
 */
public record ImageEditRequest(
        String image,
        String mask,
        String prompt,
        String negativePrompt,
        Double strength,
        Integer steps,
        Double guidanceScale,
        Long seed,
        Integer count,
        String model
) implements FeatureRequest {

    public static final double DEFAULT_STRENGTH = 0.8;

    @Override
    public FeatureKind kind() {
        return FeatureKind.IMAGE_EDIT;
    }

    @Override
    public ImageEditRequest withDefaults() {
        return new ImageEditRequest(
                image,
                mask,
                prompt,
                negativePrompt,
                strength != null ? strength : DEFAULT_STRENGTH,
                steps != null ? steps : TextToImageRequest.DEFAULT_STEPS,
                guidanceScale != null ? guidanceScale : TextToImageRequest.DEFAULT_GUIDANCE,
                seed,
                count != null ? count : 1,
                model
        );
    }
}
