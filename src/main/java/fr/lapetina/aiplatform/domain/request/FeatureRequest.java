package fr.lapetina.aiplatform.domain.request;

/**
 * Typed parameters of one inference call.
 */
public interface FeatureRequest {

    FeatureKind kind();

    /**
     * Returns a copy with every optional parameter filled in.
     */
    FeatureRequest withDefaults();
}
