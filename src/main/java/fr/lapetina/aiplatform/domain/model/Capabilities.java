package fr.lapetina.aiplatform.domain.model;

import java.util.List;
import java.util.Map;

/**
 * What a self-hosted instance declares it can serve.
 */
public record Capabilities(
        List<String> supportedModels,
        List<String> supportedResolutions,
        int maxBatchSize,
        List<String> supportedFormats,
        List<String> supportedStyles,
        Map<String, Object> custom
) {

    public static final Capabilities NONE = new Capabilities(null, null, 1, null, null, null);

    public Capabilities {
        supportedModels = supportedModels == null ? List.of() : List.copyOf(supportedModels);
        supportedResolutions = supportedResolutions == null ? List.of() : List.copyOf(supportedResolutions);
        supportedFormats = supportedFormats == null ? List.of() : List.copyOf(supportedFormats);
        supportedStyles = supportedStyles == null ? List.of() : List.copyOf(supportedStyles);
        custom = custom == null ? Map.of() : Map.copyOf(custom);
        if (maxBatchSize <= 0) {
            maxBatchSize = 1;
        }
    }
}
