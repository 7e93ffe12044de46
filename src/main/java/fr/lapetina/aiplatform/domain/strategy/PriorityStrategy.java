package fr.lapetina.aiplatform.domain.strategy;

import fr.lapetina.aiplatform.domain.model.Feature;
import fr.lapetina.aiplatform.domain.model.ProviderConfig;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/**
 * Priority strategy.
 *
 * Picks among the candidates sharing the lowest priority value, uniformly
 * at random so equal-priority providers share the load.
 *
 * Thread-safe via ThreadLocalRandom unless a generator is injected.
 */
public final class PriorityStrategy implements ProviderSelectionStrategy {

    private final RandomGenerator random;

    public PriorityStrategy() {
        this(null);
    }

    public PriorityStrategy(RandomGenerator random) {
        this.random = random;
    }

    @Override
    public String getName() {
        return "priority";
    }

    @Override
    public Optional<ProviderConfig> select(List<ProviderConfig> candidates, Feature feature) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        int minPriority = candidates.stream()
                .mapToInt(ProviderConfig::priority)
                .min()
                .getAsInt();

        List<ProviderConfig> best = candidates.stream()
                .filter(p -> p.priority() == minPriority)
                .toList();

        RandomGenerator rng = random != null ? random : ThreadLocalRandom.current();
        return Optional.of(best.get(rng.nextInt(best.size())));
    }
}
