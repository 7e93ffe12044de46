package fr.lapetina.aiplatform.infrastructure.routing;

import fr.lapetina.aiplatform.domain.model.Feature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Feature catalogue held in memory and replaced wholesale on configuration reload.
 *
 * Readers see either the previous or the new catalogue, never a mix.
 */
public final class StaticConfigStore implements ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(StaticConfigStore.class);

    private volatile Map<String, Feature> features;

    public StaticConfigStore(Collection<Feature> features) {
        this.features = index(features);
    }

    public StaticConfigStore() {
        this(List.of());
    }

    @Override
    public Optional<Feature> getFeature(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(features.get(id));
    }

    @Override
    public List<Feature> getFeaturesByCategory(String category) {
        return features.values().stream()
                .filter(f -> Objects.equals(f.category(), category))
                .toList();
    }

    @Override
    public List<Feature> listFeatures() {
        return List.copyOf(features.values());
    }

    public void replaceAll(Collection<Feature> newFeatures) {
        this.features = index(newFeatures);
        log.info("Feature catalogue replaced: features={}", features.keySet());
    }

    private static Map<String, Feature> index(Collection<Feature> features) {
        Map<String, Feature> indexed = new LinkedHashMap<>();
        for (Feature feature : features) {
            if (indexed.put(feature.id(), feature) != null) {
                throw new IllegalArgumentException("Duplicate feature id: " + feature.id());
            }
        }
        return indexed;
    }
}
