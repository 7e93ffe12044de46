package fr.lapetina.aiplatform.domain.strategy;

import fr.lapetina.aiplatform.domain.model.Feature;
import fr.lapetina.aiplatform.domain.model.ProviderConfig;

import java.util.List;
import java.util.Optional;

/**
 * Strategy interface for picking one provider among a feature's viable candidates.
 *
 * Implementations must be thread-safe: routing calls them inline from
 * every request thread.
 */
public interface ProviderSelectionStrategy {

    /**
     * Returns the name of this strategy as used in feature routing configuration.
     */
    String getName();

    /**
     * Selects a provider.
     *
     * @param candidates Enabled, currently viable providers in configuration order
     * @param feature    The feature being routed, for cost data
     * @return Selected provider, or empty if there are no candidates
     */
    Optional<ProviderConfig> select(List<ProviderConfig> candidates, Feature feature);
}
