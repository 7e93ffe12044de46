package fr.lapetina.aiplatform.domain.request;

public record ImageStylizationRequest(
        String image,
        String style,
        Double strength,
        String prompt,
        String model
) implements FeatureRequest {

    @Override
    public FeatureKind kind() {
        return FeatureKind.IMAGE_STYLIZATION;
    }

    @Override
    public ImageStylizationRequest withDefaults() {
        return new ImageStylizationRequest(
                image,
                style,
                strength != null ? strength : ImageEditRequest.DEFAULT_STRENGTH,
                prompt,
                model
        );
    }
}
