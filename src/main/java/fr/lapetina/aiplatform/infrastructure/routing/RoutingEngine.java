package fr.lapetina.aiplatform.infrastructure.routing;

import fr.lapetina.aiplatform.domain.exception.ControlPlaneException;
import fr.lapetina.aiplatform.domain.exception.ProviderException;
import fr.lapetina.aiplatform.domain.model.Feature;
import fr.lapetina.aiplatform.domain.model.GeneratedImage;
import fr.lapetina.aiplatform.domain.model.InferenceResponse;
import fr.lapetina.aiplatform.domain.model.InstanceSnapshot;
import fr.lapetina.aiplatform.domain.model.ProviderConfig;
import fr.lapetina.aiplatform.domain.model.ProviderType;
import fr.lapetina.aiplatform.domain.request.FeatureRequest;
import fr.lapetina.aiplatform.domain.request.ImageEditRequest;
import fr.lapetina.aiplatform.domain.request.ImageStylizationRequest;
import fr.lapetina.aiplatform.domain.request.InferenceRequest;
import fr.lapetina.aiplatform.domain.request.TextGenerationRequest;
import fr.lapetina.aiplatform.domain.request.TextToImageRequest;
import fr.lapetina.aiplatform.domain.strategy.LeastLoadedInstanceSelector;
import fr.lapetina.aiplatform.domain.strategy.ProviderSelectionStrategy;
import fr.lapetina.aiplatform.domain.strategy.StrategyFactory;
import fr.lapetina.aiplatform.infrastructure.budget.CostRecord;
import fr.lapetina.aiplatform.infrastructure.budget.CostTracker;
import fr.lapetina.aiplatform.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.aiplatform.infrastructure.provider.ImageResult;
import fr.lapetina.aiplatform.infrastructure.provider.Provider;
import fr.lapetina.aiplatform.infrastructure.provider.ProviderFactory;
import fr.lapetina.aiplatform.infrastructure.provider.ProviderSettings;
import fr.lapetina.aiplatform.infrastructure.provider.SelfHostedClient;
import fr.lapetina.aiplatform.infrastructure.provider.TextResult;
import fr.lapetina.aiplatform.infrastructure.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Routes an inference request to one provider of its feature.
 *
 * Steps:
 * 1. Resolve the feature by id, else by category
 * 2. Keep enabled providers that can serve right now (a healthy instance
 *    for self-hosted, an active key for third-party)
 * 3. Select one candidate with the feature's strategy
 * 4. Execute, falling back to the remaining candidates in declaration order
 *
 * Routing runs on the caller's thread and holds no lock of its own; each
 * call into the registry or the key manager is a self-contained exchange.
 */
public final class RoutingEngine {

    private static final Logger log = LoggerFactory.getLogger(RoutingEngine.class);

    private final ConfigStore configStore;
    private final ServiceRegistry registry;
    private final KeyManager keyManager;
    private final ProviderFactory providerFactory;
    private final SelfHostedClient selfHostedClient;
    private final CostTracker costTracker;
    private final MetricsRegistry metrics;
    private final Clock clock;
    private final LeastLoadedInstanceSelector instanceSelector = new LeastLoadedInstanceSelector();

    private RoutingEngine(Builder builder) {
        this.configStore = Objects.requireNonNull(builder.configStore, "Config store is required");
        this.registry = Objects.requireNonNull(builder.registry, "Service registry is required");
        this.keyManager = Objects.requireNonNull(builder.keyManager, "Key manager is required");
        this.providerFactory = builder.providerFactory;
        this.selfHostedClient = builder.selfHostedClient;
        this.costTracker = builder.costTracker;
        this.metrics = builder.metrics;
        this.clock = builder.clock;
    }

    public InferenceResponse route(String feature, FeatureRequest payload) {
        return route(InferenceRequest.of(feature, payload));
    }

    public InferenceResponse route(InferenceRequest request) {
        Instant receivedAt = clock.instant();
        Feature feature = resolveFeature(request.feature());
        if (!feature.enabled()) {
            throw ControlPlaneException.unavailable("Feature is disabled: " + feature.id());
        }

        List<ProviderConfig> candidates = filterProviders(feature);
        if (candidates.isEmpty()) {
            log.warn("No available provider: requestId={}, feature={}", request.requestId(), feature.id());
            throw ControlPlaneException.unavailable("No available provider for feature: " + feature.id());
        }

        ProviderSelectionStrategy strategy = StrategyFactory.createOrDefault(feature.routing().strategy());
        ProviderConfig selected = strategy.select(candidates, feature).orElse(candidates.get(0));
        Instant dispatchedAt = clock.instant();

        log.debug("Provider selected: requestId={}, feature={}, provider={}, strategy={}, candidates={}",
                request.requestId(), feature.id(), selected.id(), strategy.getName(), candidates.size());

        try {
            return execute(request, feature, selected, receivedAt, dispatchedAt, false);
        } catch (ControlPlaneException primaryFailure) {
            if (!feature.routing().fallbackEnabled()) {
                throw primaryFailure;
            }
            for (ProviderConfig candidate : candidates) {
                if (candidate.id().equals(selected.id())) {
                    continue;
                }
                try {
                    InferenceResponse response = execute(request, feature, candidate, receivedAt, dispatchedAt, true);
                    metrics.incrementFallback(feature.id());
                    log.info("Request served by fallback: requestId={}, feature={}, failed={}, provider={}",
                            request.requestId(), feature.id(), selected.id(), candidate.id());
                    return response;
                } catch (ControlPlaneException fallbackFailure) {
                    log.warn("Fallback provider failed: requestId={}, feature={}, provider={}, error={}",
                            request.requestId(), feature.id(), candidate.id(), fallbackFailure.getMessage());
                }
            }
            throw primaryFailure;
        }
    }

    /**
     * Providers of the feature that are enabled and currently able to serve,
     * in declaration order.
     */
    public List<ProviderConfig> filterProviders(Feature feature) {
        List<ProviderConfig> available = new ArrayList<>();
        for (ProviderConfig provider : feature.providers()) {
            if (!provider.enabled()) {
                continue;
            }
            if (provider.isSelfHosted()) {
                if (!registry.getHealthyServices(feature.instanceType()).isEmpty()) {
                    available.add(provider);
                }
            } else if (keyManager.getActiveKey(provider.vendor(), serviceOf(provider, feature)).isPresent()) {
                available.add(provider);
            }
        }
        return available;
    }

    private Feature resolveFeature(String featureId) {
        return configStore.getFeature(featureId)
                .or(() -> configStore.getFeaturesByCategory(featureId).stream().findFirst())
                .orElseThrow(() -> ControlPlaneException.notFound("Feature not found: " + featureId));
    }

    private InferenceResponse execute(InferenceRequest request, Feature feature, ProviderConfig provider,
                                      Instant receivedAt, Instant dispatchedAt, boolean fallback) {
        Instant start = clock.instant();
        try {
            InferenceResponse response = provider.isSelfHosted()
                    ? executeSelfHosted(request, feature, provider, receivedAt, dispatchedAt, fallback)
                    : executeThirdParty(request, feature, provider, receivedAt, dispatchedAt, fallback);
            metrics.recordRoute(feature.id(), provider.id(), "success");
            metrics.recordRouteLatency(feature.id(), provider.id(), Duration.between(start, clock.instant()));
            reportCost(request, feature, provider, response);
            return response;
        } catch (ControlPlaneException e) {
            metrics.recordRoute(feature.id(), provider.id(), "failure");
            log.warn("Provider execution failed: requestId={}, feature={}, provider={}, kind={}, error={}",
                    request.requestId(), feature.id(), provider.id(), e.getKind(), e.getMessage());
            throw e;
        }
    }

    private InferenceResponse executeSelfHosted(InferenceRequest request, Feature feature, ProviderConfig provider,
                                                Instant receivedAt, Instant dispatchedAt, boolean fallback) {
        InstanceSnapshot instance = instanceSelector.select(registry.getHealthyServices(feature.instanceType()))
                .orElseThrow(() -> ControlPlaneException.unavailable(
                        "No healthy instance for feature: " + feature.id()));

        Provider client = connect(provider.id(), () -> selfHostedClient.bind(instance));
        Outcome outcome = invoke(client, request.payload(), provider.id());
        Instant completedAt = clock.instant();
        long executionMs = Duration.between(dispatchedAt, completedAt).toMillis();

        return outcome.toResponse(request, feature, provider, fallback)
                .instanceId(instance.id())
                .cost(feature.cost().selfHostedCost(executionMs))
                .receivedAt(receivedAt)
                .dispatchedAt(dispatchedAt)
                .completedAt(completedAt)
                .build();
    }

    private InferenceResponse executeThirdParty(InferenceRequest request, Feature feature, ProviderConfig provider,
                                                Instant receivedAt, Instant dispatchedAt, boolean fallback) {
        ApiKey key = keyManager.getActiveKey(provider.vendor(), serviceOf(provider, feature))
                .orElseThrow(() -> ControlPlaneException.unavailable(
                        "No active key for vendor " + provider.vendor() + " and feature " + feature.id()));
        double cost = feature.cost().perRequest(provider.id()).orElse(0.0);

        Outcome outcome;
        try {
            String secret = keyManager.getPlaintextKey(key);
            Provider client = connect(provider.id(), () -> providerFactory.getOrCreate(new ProviderSettings(
                    provider.vendor(), key.id(), secret,
                    provider.endpoint(), provider.model(), null, provider.extra())));
            outcome = invoke(client, request.payload(), provider.id());
        } catch (ControlPlaneException e) {
            keyManager.recordUsage(key.id(), new KeyUsage(request.requestId(), feature.id(),
                    0, 0, 0, 0.0, false, clock.instant()));
            throw e;
        }
        Instant completedAt = clock.instant();
        keyManager.recordUsage(key.id(), new KeyUsage(request.requestId(), feature.id(),
                outcome.tokensInput(), outcome.tokensOutput(), outcome.images().size(), cost, true, completedAt));

        return outcome.toResponse(request, feature, provider, fallback)
                .cost(cost)
                .receivedAt(receivedAt)
                .dispatchedAt(dispatchedAt)
                .completedAt(completedAt)
                .build();
    }

    /**
     * Builds or binds the client. A failure here is reported like a failed
     * call so the remaining candidates are still tried.
     */
    private static Provider connect(String providerId, Supplier<Provider> binder) {
        try {
            return binder.get();
        } catch (ControlPlaneException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderException(providerId, "provider_init_failed",
                    "Provider " + providerId + " could not be initialized: " + e.getMessage(), false, e);
        }
    }

    private Outcome invoke(Provider provider, FeatureRequest payload, String providerId) {
        try {
            return switch (payload.kind()) {
                case TEXT_GENERATION -> Outcome.of(provider.generateText((TextGenerationRequest) payload));
                case TEXT_TO_IMAGE -> Outcome.of(provider.generateImage((TextToImageRequest) payload));
                case IMAGE_EDIT -> Outcome.of(provider.editImage((ImageEditRequest) payload));
                case IMAGE_STYLIZATION -> Outcome.of(provider.stylizeImage((ImageStylizationRequest) payload));
            };
        } catch (ControlPlaneException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderException(providerId, "provider_failure",
                    "Provider " + providerId + " failed: " + e.getMessage(), true, e);
        }
    }

    private void reportCost(InferenceRequest request, Feature feature, ProviderConfig provider,
                            InferenceResponse response) {
        if (costTracker == null) {
            return;
        }
        try {
            costTracker.recordCost(new CostRecord(
                    request.requestId(),
                    feature.id(),
                    request.tenantId(),
                    provider.id(),
                    CostRecord.costType(provider.type(), provider.vendor()),
                    response.cost(),
                    response.completedAt()
            ));
        } catch (RuntimeException e) {
            log.warn("Failed to record cost: requestId={}, feature={}, error={}",
                    request.requestId(), feature.id(), e.getMessage());
        }
    }

    /**
     * Keys are looked up by the provider's service, or the feature id when none is declared.
     */
    private static String serviceOf(ProviderConfig provider, Feature feature) {
        return provider.service() != null && !provider.service().isBlank() ? provider.service() : feature.id();
    }

    private record Outcome(String text, List<GeneratedImage> images, int tokensInput, int tokensOutput) {

        static Outcome of(TextResult result) {
            return new Outcome(result.text(), List.of(), result.tokensInput(), result.tokensOutput());
        }

        static Outcome of(ImageResult result) {
            return new Outcome(null, result.images(), 0, 0);
        }

        InferenceResponse.Builder toResponse(InferenceRequest request, Feature feature,
                                             ProviderConfig provider, boolean fallback) {
            return InferenceResponse.builder()
                    .requestId(request.requestId())
                    .feature(feature.id())
                    .providerType(provider.type())
                    .providerId(provider.id())
                    .text(text)
                    .images(images)
                    .tokensInput(tokensInput)
                    .tokensOutput(tokensOutput)
                    .fallbackUsed(fallback);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ConfigStore configStore;
        private ServiceRegistry registry;
        private KeyManager keyManager;
        private ProviderFactory providerFactory;
        private SelfHostedClient selfHostedClient;
        private CostTracker costTracker;
        private MetricsRegistry metrics;
        private Clock clock = Clock.systemUTC();

        public Builder configStore(ConfigStore configStore) {
            this.configStore = configStore;
            return this;
        }

        public Builder registry(ServiceRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder keyManager(KeyManager keyManager) {
            this.keyManager = keyManager;
            return this;
        }

        public Builder providerFactory(ProviderFactory providerFactory) {
            this.providerFactory = providerFactory;
            return this;
        }

        public Builder selfHostedClient(SelfHostedClient selfHostedClient) {
            this.selfHostedClient = selfHostedClient;
            return this;
        }

        /**
         * Receives the cost of every served request. Optional.
         */
        public Builder costTracker(CostTracker costTracker) {
            this.costTracker = costTracker;
            return this;
        }

        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public RoutingEngine build() {
            if (providerFactory == null) {
                providerFactory = ProviderFactory.withDefaults();
            }
            if (selfHostedClient == null) {
                selfHostedClient = new SelfHostedClient();
            }
            if (metrics == null) {
                metrics = MetricsRegistry.inMemory();
            }
            return new RoutingEngine(this);
        }
    }
}
