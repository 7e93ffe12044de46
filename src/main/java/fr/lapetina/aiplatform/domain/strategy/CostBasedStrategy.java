package fr.lapetina.aiplatform.domain.strategy;

import fr.lapetina.aiplatform.domain.model.Feature;
import fr.lapetina.aiplatform.domain.model.ProviderConfig;

import java.util.List;
import java.util.Optional;

/**
 * Cost-based strategy.
 *
 * A self-hosted candidate always wins. Otherwise the third-party candidate
 * with the lowest configured per-request price is chosen; candidates without
 * a price are ignored, and when no candidate has one the first is used.
 */
public final class CostBasedStrategy implements ProviderSelectionStrategy {

    @Override
    public String getName() {
        return "cost_based";
    }

    @Override
    public Optional<ProviderConfig> select(List<ProviderConfig> candidates, Feature feature) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        for (ProviderConfig candidate : candidates) {
            if (candidate.isSelfHosted()) {
                return Optional.of(candidate);
            }
        }

        ProviderConfig cheapest = null;
        double lowest = Double.MAX_VALUE;
        for (ProviderConfig candidate : candidates) {
            Optional<Double> price = feature.cost().perRequest(candidate.id());
            if (price.isPresent() && price.get() < lowest) {
                lowest = price.get();
                cheapest = candidate;
            }
        }

        return Optional.of(cheapest != null ? cheapest : candidates.get(0));
    }
}
