package fr.lapetina.aiplatform.infrastructure.routing;

import fr.lapetina.aiplatform.domain.model.Feature;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the feature catalogue.
 */
public interface ConfigStore {

    Optional<Feature> getFeature(String id);

    /**
     * Returns every feature declared under the given category, in declaration order.
     */
    List<Feature> getFeaturesByCategory(String category);

    List<Feature> listFeatures();
}
