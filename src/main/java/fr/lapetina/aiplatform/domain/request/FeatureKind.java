package fr.lapetina.aiplatform.domain.request;

import java.util.Optional;

/**
 * Request variants the platform understands.
 */
public enum FeatureKind {
    TEXT_TO_IMAGE("text-to-image", "text_to_image"),
    IMAGE_EDIT("image-edit", "image_editing"),
    IMAGE_STYLIZATION("image-stylization", "image_stylization"),
    TEXT_GENERATION("text-generation", "text_generation");

    private final String path;
    private final String defaultFeature;

    FeatureKind(String path, String defaultFeature) {
        this.path = path;
        this.defaultFeature = defaultFeature;
    }

    /**
     * URL segment used by the gateway and the self-hosted inference API.
     */
    public String path() {
        return path;
    }

    /**
     * Feature id served when the caller does not name one.
     */
    public String defaultFeature() {
        return defaultFeature;
    }

    public static Optional<FeatureKind> fromPath(String path) {
        for (FeatureKind kind : values()) {
            if (kind.path.equals(path)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
