package fr.lapetina.aiplatform.domain.strategy;

import fr.lapetina.aiplatform.domain.model.Capabilities;
import fr.lapetina.aiplatform.domain.model.CostConfig;
import fr.lapetina.aiplatform.domain.model.Feature;
import fr.lapetina.aiplatform.domain.model.HealthState;
import fr.lapetina.aiplatform.domain.model.InstanceMetrics;
import fr.lapetina.aiplatform.domain.model.InstanceSnapshot;
import fr.lapetina.aiplatform.domain.model.Performance;
import fr.lapetina.aiplatform.domain.model.ProviderConfig;
import fr.lapetina.aiplatform.domain.model.ProviderType;
import fr.lapetina.aiplatform.domain.model.Resources;
import fr.lapetina.aiplatform.domain.model.RoutingPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProviderSelectionStrategyTest {

    private Feature feature;

    @BeforeEach
    void setUp() {
        feature = new Feature("text_to_image", "Text to image", "text_to_image", null, true,
                List.of(), RoutingPolicy.DEFAULT,
                new CostConfig(2.5, Map.of("openai_dalle", 0.04, "stability", 0.02)));
    }

    private static ProviderConfig selfHosted(String id, int priority) {
        return ProviderConfig.builder()
                .id(id)
                .type(ProviderType.SELF_HOSTED)
                .priority(priority)
                .build();
    }

    private static ProviderConfig thirdParty(String id, int priority, int weight) {
        return ProviderConfig.builder()
                .id(id)
                .type(ProviderType.THIRD_PARTY)
                .vendor(id)
                .priority(priority)
                .weight(weight)
                .build();
    }

    private static Map<String, Integer> countPicks(ProviderSelectionStrategy strategy,
                                                   List<ProviderConfig> candidates, Feature feature, int picks) {
        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < picks; i++) {
            strategy.select(candidates, feature)
                    .ifPresent(p -> counts.merge(p.id(), 1, Integer::sum));
        }
        return counts;
    }

    @Nested
    @DisplayName("PriorityStrategy")
    class PriorityTests {

        @Test
        @DisplayName("should pick the lowest priority value")
        void shouldPickLowestPriority() {
            List<ProviderConfig> candidates = List.of(
                    thirdParty("openai_dalle", 2, 1),
                    selfHosted("sd_local", 1),
                    thirdParty("stability", 3, 1));

            Optional<ProviderConfig> selected = new PriorityStrategy().select(candidates, feature);

            assertThat(selected).map(ProviderConfig::id).hasValue("sd_local");
        }

        @Test
        @DisplayName("should share load between tied providers")
        void shouldShareTies() {
            List<ProviderConfig> candidates = List.of(
                    thirdParty("a", 1, 1),
                    thirdParty("b", 1, 1),
                    thirdParty("c", 1, 1),
                    thirdParty("d", 2, 1));

            Map<String, Integer> counts = countPicks(new PriorityStrategy(new Random(42)), candidates, feature, 1000);

            // Every tied provider gets traffic, the lower priority one none
            assertThat(counts).containsOnlyKeys("a", "b", "c");
            assertThat(counts.values()).allMatch(c -> c > 200);
        }

        @Test
        @DisplayName("should return empty for no candidates")
        void shouldHandleEmpty() {
            assertThat(new PriorityStrategy().select(List.of(), feature)).isEmpty();
        }
    }

    @Nested
    @DisplayName("WeightedStrategy")
    class WeightedTests {

        @Test
        @DisplayName("should follow the configured weights")
        void shouldFollowWeights() {
            List<ProviderConfig> candidates = List.of(
                    thirdParty("a", 1, 10),
                    thirdParty("b", 1, 30),
                    thirdParty("c", 1, 60));

            Map<String, Integer> counts = countPicks(new WeightedStrategy(new Random(7)), candidates, feature, 10_000);

            assertThat(counts.get("a") / 10_000.0).isCloseTo(0.10, within(0.03));
            assertThat(counts.get("b") / 10_000.0).isCloseTo(0.30, within(0.03));
            assertThat(counts.get("c") / 10_000.0).isCloseTo(0.60, within(0.03));
        }

        @Test
        @DisplayName("should never pick a zero weight provider")
        void shouldSkipZeroWeight() {
            List<ProviderConfig> candidates = List.of(
                    thirdParty("a", 1, 0),
                    thirdParty("b", 1, 5));

            Map<String, Integer> counts = countPicks(new WeightedStrategy(), candidates, feature, 500);

            assertThat(counts).containsOnlyKeys("b");
        }

        @Test
        @DisplayName("should fall back to the first candidate when all weights are zero")
        void shouldUseFirstWhenAllZero() {
            List<ProviderConfig> candidates = List.of(
                    thirdParty("a", 1, 0),
                    thirdParty("b", 1, 0));

            assertThat(new WeightedStrategy().select(candidates, feature))
                    .map(ProviderConfig::id)
                    .hasValue("a");
        }
    }

    @Nested
    @DisplayName("CostBasedStrategy")
    class CostBasedTests {

        private final CostBasedStrategy strategy = new CostBasedStrategy();

        @Test
        @DisplayName("should prefer a self-hosted candidate")
        void shouldPreferSelfHosted() {
            List<ProviderConfig> candidates = List.of(
                    thirdParty("stability", 1, 1),
                    selfHosted("sd_local", 5));

            assertThat(strategy.select(candidates, feature)).map(ProviderConfig::id).hasValue("sd_local");
        }

        @Test
        @DisplayName("should pick the cheapest priced third party")
        void shouldPickCheapest() {
            List<ProviderConfig> candidates = List.of(
                    thirdParty("openai_dalle", 1, 1),
                    thirdParty("unpriced", 1, 1),
                    thirdParty("stability", 2, 1));

            assertThat(strategy.select(candidates, feature)).map(ProviderConfig::id).hasValue("stability");
        }

        @Test
        @DisplayName("should use the first candidate when none is priced")
        void shouldUseFirstWithoutPrices() {
            List<ProviderConfig> candidates = List.of(
                    thirdParty("x", 1, 1),
                    thirdParty("y", 1, 1));

            assertThat(strategy.select(candidates, feature)).map(ProviderConfig::id).hasValue("x");
        }
    }

    @Nested
    @DisplayName("StrategyFactory")
    class FactoryTests {

        @Test
        @DisplayName("should create the built-in strategies by name")
        void shouldCreateBuiltIns() {
            assertThat(StrategyFactory.create("priority")).get().isInstanceOf(PriorityStrategy.class);
            assertThat(StrategyFactory.create("WEIGHTED")).get().isInstanceOf(WeightedStrategy.class);
            assertThat(StrategyFactory.create("cost_based")).get().isInstanceOf(CostBasedStrategy.class);
        }

        @Test
        @DisplayName("should default unknown names to priority")
        void shouldDefaultToPriority() {
            assertThat(StrategyFactory.create("fastest")).isEmpty();
            assertThat(StrategyFactory.createOrDefault("fastest").getName()).isEqualTo("priority");
            assertThat(StrategyFactory.createOrDefault(null).getName()).isEqualTo("priority");
        }

        @Test
        @DisplayName("should accept custom strategies")
        void shouldRegisterCustom() {
            StrategyFactory.register("always_last", () -> new ProviderSelectionStrategy() {
                @Override
                public String getName() {
                    return "always_last";
                }

                @Override
                public Optional<ProviderConfig> select(List<ProviderConfig> candidates, Feature f) {
                    return candidates.isEmpty() ? Optional.empty() : Optional.of(candidates.get(candidates.size() - 1));
                }
            });

            assertThat(StrategyFactory.getRegisteredNames()).contains("always_last");
            assertThat(StrategyFactory.createOrDefault("always_last")
                    .select(List.of(thirdParty("a", 1, 1), thirdParty("b", 1, 1)), feature))
                    .map(ProviderConfig::id)
                    .hasValue("b");
        }
    }

    @Nested
    @DisplayName("LeastLoadedInstanceSelector")
    class LeastLoadedTests {

        private final LeastLoadedInstanceSelector selector = new LeastLoadedInstanceSelector();

        private InstanceSnapshot instance(String id, double load, int queue) {
            return new InstanceSnapshot(id, "text_to_image", "1.0.0", id, "10.0.0.1", 8000,
                    Capabilities.NONE, Resources.NONE, Performance.UNKNOWN, HealthState.HEALTHY,
                    new InstanceMetrics(load, queue, 0, 0, 0, 0, 0),
                    Instant.EPOCH, Instant.EPOCH, 0, false);
        }

        @Test
        @DisplayName("should pick the lowest load")
        void shouldPickLowestLoad() {
            List<InstanceSnapshot> instances = List.of(
                    instance("sd-1", 0.8, 0),
                    instance("sd-2", 0.2, 5),
                    instance("sd-3", 0.5, 0));

            assertThat(selector.select(instances)).map(InstanceSnapshot::id).hasValue("sd-2");
        }

        @Test
        @DisplayName("should break load ties on queue depth")
        void shouldBreakTiesOnQueue() {
            List<InstanceSnapshot> instances = List.of(
                    instance("sd-1", 0.5, 4),
                    instance("sd-2", 0.5, 1));

            assertThat(selector.select(instances)).map(InstanceSnapshot::id).hasValue("sd-2");
        }

        @Test
        @DisplayName("should return empty without instances")
        void shouldHandleEmpty() {
            assertThat(selector.select(List.of())).isEmpty();
        }
    }
}
