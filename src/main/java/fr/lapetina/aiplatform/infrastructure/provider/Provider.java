package fr.lapetina.aiplatform.infrastructure.provider;

import fr.lapetina.aiplatform.domain.exception.ProviderException;
import fr.lapetina.aiplatform.domain.request.FeatureKind;
import fr.lapetina.aiplatform.domain.request.ImageEditRequest;
import fr.lapetina.aiplatform.domain.request.ImageStylizationRequest;
import fr.lapetina.aiplatform.domain.request.TextGenerationRequest;
import fr.lapetina.aiplatform.domain.request.TextToImageRequest;

import java.util.Set;

/**
 * A concrete way of executing inference calls: one vendor, or one self-hosted instance.
 *
 * Implementations override the operations they support and advertise them
 * through {@link #capabilities()}. Calls are synchronous and throw
 * {@link ProviderException} on failure.
 */
public interface Provider extends AutoCloseable {

    String getName();

    Set<FeatureKind> capabilities();

    default boolean supports(FeatureKind kind) {
        return capabilities().contains(kind);
    }

    default TextResult generateText(TextGenerationRequest request) {
        throw unsupported(FeatureKind.TEXT_GENERATION);
    }

    default ImageResult generateImage(TextToImageRequest request) {
        throw unsupported(FeatureKind.TEXT_TO_IMAGE);
    }

    default ImageResult editImage(ImageEditRequest request) {
        throw unsupported(FeatureKind.IMAGE_EDIT);
    }

    default ImageResult stylizeImage(ImageStylizationRequest request) {
        throw unsupported(FeatureKind.IMAGE_STYLIZATION);
    }

    default boolean healthCheck() {
        return true;
    }

    @Override
    default void close() {
    }

    private ProviderException unsupported(FeatureKind kind) {
        return new ProviderException(getName(), "unsupported_feature",
                "Provider " + getName() + " does not support " + kind.path(), false);
    }
}
