package fr.lapetina.aiplatform.domain.strategy;

import fr.lapetina.aiplatform.domain.model.InstanceSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Picks the self-hosted instance with the lowest reported load, breaking
 * ties on queue depth. Works on snapshots, so it never touches registry state.
 */
public final class LeastLoadedInstanceSelector {

    public Optional<InstanceSnapshot> select(List<InstanceSnapshot> instances) {
        if (instances == null || instances.isEmpty()) {
            return Optional.empty();
        }

        InstanceSnapshot selected = null;
        double minLoad = Double.MAX_VALUE;
        int minQueue = Integer.MAX_VALUE;

        for (InstanceSnapshot instance : instances) {
            double load = instance.metrics().load();
            int queue = instance.metrics().queueSize();
            if (load < minLoad || (load == minLoad && queue < minQueue)) {
                minLoad = load;
                minQueue = queue;
                selected = instance;
            }
        }

        return Optional.ofNullable(selected);
    }
}
