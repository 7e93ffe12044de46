package fr.lapetina.aiplatform.domain.strategy;

import fr.lapetina.aiplatform.domain.model.Feature;
import fr.lapetina.aiplatform.domain.model.ProviderConfig;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/**
 * Weighted random strategy.
 *
 * Draws a point in [0, totalWeight) and walks the candidates subtracting
 * their weights, so a candidate is chosen with probability weight / totalWeight.
 * When every weight is zero the first candidate is used.
 */
public final class WeightedStrategy implements ProviderSelectionStrategy {

    private final RandomGenerator random;

    public WeightedStrategy() {
        this(null);
    }

    public WeightedStrategy(RandomGenerator random) {
        this.random = random;
    }

    @Override
    public String getName() {
        return "weighted";
    }

    @Override
    public Optional<ProviderConfig> select(List<ProviderConfig> candidates, Feature feature) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        long totalWeight = 0;
        for (ProviderConfig candidate : candidates) {
            totalWeight += candidate.weight();
        }
        if (totalWeight <= 0) {
            return Optional.of(candidates.get(0));
        }

        RandomGenerator rng = random != null ? random : ThreadLocalRandom.current();
        long remaining = rng.nextLong(totalWeight);
        for (ProviderConfig candidate : candidates) {
            remaining -= candidate.weight();
            if (remaining < 0) {
                return Optional.of(candidate);
            }
        }

        // Unreachable while weights are non-negative
        return Optional.of(candidates.get(candidates.size() - 1));
    }
}
