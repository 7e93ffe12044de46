package fr.lapetina.aiplatform.domain.request;

import fr.lapetina.aiplatform.domain.exception.ControlPlaneException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates typed requests at the gateway boundary and fills in defaults.
 *
 * Validates:
 * - Prompts are present where the variant needs one and within the length limit
 * - Image sizes are within 64..4096 pixels
 * - Sampling parameters are within their ranges
 * - Source images and styles are present for edit and stylization
 */
public final class RequestValidator {

    private static final Logger log = LoggerFactory.getLogger(RequestValidator.class);

    public static final int MIN_IMAGE_SIZE = 64;
    public static final int MAX_IMAGE_SIZE = 4096;
    public static final int MAX_IMAGES_PER_REQUEST = 4;

    private final int maxPromptLength;

    public RequestValidator(int maxPromptLength) {
        this.maxPromptLength = maxPromptLength;
    }

    public RequestValidator() {
        this(8_000);
    }

    /**
     * Validates the request and returns it with defaults applied.
     *
     * @throws ControlPlaneException with kind VALIDATION on the first violation
     */
    public FeatureRequest prepare(FeatureRequest request) {
        if (request == null) {
            throw ControlPlaneException.validation("Request body is required");
        }
        FeatureRequest prepared = request.withDefaults();
        try {
            switch (prepared.kind()) {
                case TEXT_TO_IMAGE -> validate((TextToImageRequest) prepared);
                case IMAGE_EDIT -> validate((ImageEditRequest) prepared);
                case IMAGE_STYLIZATION -> validate((ImageStylizationRequest) prepared);
                case TEXT_GENERATION -> validate((TextGenerationRequest) prepared);
            }
        } catch (ControlPlaneException e) {
            log.warn("Validation failed: kind={}, reason={}", prepared.kind(), e.getMessage());
            throw e;
        }
        return prepared;
    }

    private void validate(TextToImageRequest request) {
        requirePrompt(request.prompt());
        checkSize("width", request.width());
        checkSize("height", request.height());
        checkSteps(request.steps());
        checkGuidance(request.guidanceScale());
        checkCount(request.count());
    }

    private void validate(ImageEditRequest request) {
        requireValue("image", request.image());
        requirePrompt(request.prompt());
        checkRange("strength", request.strength(), 0.0, 1.0);
        checkSteps(request.steps());
        checkGuidance(request.guidanceScale());
        checkCount(request.count());
    }

    private void validate(ImageStylizationRequest request) {
        requireValue("image", request.image());
        requireValue("style", request.style());
        checkRange("strength", request.strength(), 0.0, 1.0);
        if (request.prompt() != null) {
            checkLength(request.prompt());
        }
    }

    private void validate(TextGenerationRequest request) {
        requirePrompt(request.prompt());
        if (request.maxTokens() < 1 || request.maxTokens() > 32_000) {
            throw ControlPlaneException.validation("maxTokens must be between 1 and 32000");
        }
        checkRange("temperature", request.temperature(), 0.0, 2.0);
        checkRange("topP", request.topP(), 0.0, 1.0);
        if (request.topK() != null && request.topK() < 0) {
            throw ControlPlaneException.validation("topK must not be negative");
        }
    }

    private void requirePrompt(String prompt) {
        requireValue("prompt", prompt);
        checkLength(prompt);
    }

    private void checkLength(String prompt) {
        if (prompt.length() > maxPromptLength) {
            throw ControlPlaneException.validation("Prompt exceeds maximum length of " + maxPromptLength);
        }
    }

    private static void requireValue(String field, String value) {
        if (value == null || value.isBlank()) {
            throw ControlPlaneException.validation(field + " is required");
        }
    }

    private static void checkSize(String field, int value) {
        if (value < MIN_IMAGE_SIZE || value > MAX_IMAGE_SIZE) {
            throw ControlPlaneException.validation(
                    field + " must be between " + MIN_IMAGE_SIZE + " and " + MAX_IMAGE_SIZE + ": " + value);
        }
    }

    private static void checkSteps(int steps) {
        if (steps < 1 || steps > 150) {
            throw ControlPlaneException.validation("steps must be between 1 and 150: " + steps);
        }
    }

    private static void checkGuidance(double guidance) {
        checkRange("guidanceScale", guidance, 0.0, 30.0);
    }

    private static void checkCount(int count) {
        if (count < 1 || count > MAX_IMAGES_PER_REQUEST) {
            throw ControlPlaneException.validation(
                    "count must be between 1 and " + MAX_IMAGES_PER_REQUEST + ": " + count);
        }
    }

    private static void checkRange(String field, double value, double min, double max) {
        if (Double.isNaN(value) || value < min || value > max) {
            throw ControlPlaneException.validation(field + " must be between " + min + " and " + max + ": " + value);
        }
    }
}
