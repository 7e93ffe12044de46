package fr.lapetina.aiplatform;

import fr.lapetina.aiplatform.api.GatewayService;
import fr.lapetina.aiplatform.domain.request.RequestValidator;
import fr.lapetina.aiplatform.infrastructure.budget.AdmissionController;
import fr.lapetina.aiplatform.infrastructure.config.ConfigLoader;
import fr.lapetina.aiplatform.infrastructure.config.ControlPlaneConfig;
import fr.lapetina.aiplatform.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.aiplatform.infrastructure.provider.ProviderFactory;
import fr.lapetina.aiplatform.infrastructure.provider.SelfHostedClient;
import fr.lapetina.aiplatform.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.aiplatform.infrastructure.ratelimit.RateLimiterFactory;
import fr.lapetina.aiplatform.infrastructure.registry.ServiceRegistry;
import fr.lapetina.aiplatform.infrastructure.routing.ConfiguredKeyManager;
import fr.lapetina.aiplatform.infrastructure.routing.RoutingEngine;
import fr.lapetina.aiplatform.infrastructure.routing.StaticConfigStore;
import fr.lapetina.aiplatform.infrastructure.scaler.AutoScaler;
import fr.lapetina.aiplatform.infrastructure.scaler.ClusterClient;
import fr.lapetina.aiplatform.infrastructure.scaler.KubernetesClusterClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Factory for creating a fully-wired control plane from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ControlPlaneFactory factory = ControlPlaneFactory.create("config.yaml").start()) {
 *     InferenceResponse response = factory.getGateway().handle(request);
 * }
 * }</pre>
 */
public class ControlPlaneFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ControlPlaneFactory.class);

    private final ConfigLoader configLoader;
    private final ControlPlaneConfig config;
    private final MetricsRegistry metricsRegistry;
    private final ServiceRegistry serviceRegistry;
    private final AdmissionController admissionController;
    private final AutoScaler autoScaler;
    private final StaticConfigStore configStore;
    private final ConfiguredKeyManager keyManager;
    private final ProviderFactory providerFactory;
    private final SelfHostedClient selfHostedClient;
    private final RateLimiter rateLimiter;
    private final RoutingEngine routingEngine;
    private final GatewayService gateway;
    private final AtomicBoolean started = new AtomicBoolean(false);

    /**
     * @param clusterOverride      cluster client replacing the Kubernetes one, null for the default
     * @param selfHostedOverride   instance client replacing the HTTP one, null for the default
     * @param providerOverride     vendor client factory, null for the built-in vendors
     * @param secretLookup         resolves secret variable names, null for the process environment
     */
    protected ControlPlaneFactory(String configPath,
                                  ClusterClient clusterOverride,
                                  SelfHostedClient selfHostedOverride,
                                  ProviderFactory providerOverride,
                                  Function<String, String> secretLookup) {
        log.info("Initializing ControlPlaneFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.metricsRegistry = createMetricsRegistry();

        ControlPlaneConfig.EventsConfig events = config.getEvents();

        this.serviceRegistry = ServiceRegistry.builder()
                .fromConfig(config)
                .metrics(metricsRegistry)
                .build();

        this.admissionController = AdmissionController.builder()
                .settings(config.getBudget().toSettings())
                .metrics(metricsRegistry)
                .events(events.getRingBufferSize(), events.getWatchCapacity(), events.getWaitStrategy())
                .build();

        this.autoScaler = AutoScaler.builder()
                .registry(serviceRegistry)
                .cluster(clusterOverride != null ? clusterOverride : new KubernetesClusterClient())
                .metrics(metricsRegistry)
                .settings(config.getScaler().toSettings())
                .loopEnabled(config.getScaler().isEnabled())
                .events(events.getRingBufferSize(), events.getWatchCapacity(), events.getWaitStrategy())
                .build();

        this.configStore = new StaticConfigStore(config.toFeatures());
        this.keyManager = new ConfiguredKeyManager(config.toKeys(),
                secretLookup != null ? secretLookup : System::getenv, Clock.systemUTC());
        this.providerFactory = providerOverride != null ? providerOverride : ProviderFactory.withDefaults();
        this.selfHostedClient = selfHostedOverride != null ? selfHostedOverride : createSelfHostedClient();

        ControlPlaneConfig.RateLimitConfig rateLimit = config.getRateLimit();
        this.rateLimiter = RateLimiterFactory.create(
                rateLimit.getAlgorithm(), rateLimit.getDefaultLimitPerMinute(), Clock.systemUTC());
        applyRateLimitOverrides(rateLimit);
        log.info("Using rate limiter: {}", rateLimiter.getName());

        this.routingEngine = RoutingEngine.builder()
                .configStore(configStore)
                .registry(serviceRegistry)
                .keyManager(keyManager)
                .providerFactory(providerFactory)
                .selfHostedClient(selfHostedClient)
                .costTracker(admissionController)
                .metrics(metricsRegistry)
                .build();

        this.gateway = new GatewayService(
                new RequestValidator(config.getServer().getMaxPromptLength()),
                rateLimiter,
                admissionController,
                routingEngine,
                configStore,
                metricsRegistry,
                config.getServer().getDefaultTenant()
        );

        configLoader.addListener(this::onConfigChanged);

        log.info("ControlPlaneFactory initialized: features={}, keys={}",
                configStore.listFeatures().size(), keyManager.listKeys().size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static ControlPlaneFactory create(String configPath) {
        return new ControlPlaneFactory(configPath, null, null, null, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static ControlPlaneFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts every background loop and the configuration watcher. Later calls do nothing.
     */
    public ControlPlaneFactory start() {
        if (started.compareAndSet(false, true)) {
            serviceRegistry.start();
            admissionController.start();
            autoScaler.start();
            configLoader.startWatching();
            log.info("Control plane started");
        }
        return this;
    }

    public ControlPlaneConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ServiceRegistry getServiceRegistry() {
        return serviceRegistry;
    }

    public AdmissionController getAdmissionController() {
        return admissionController;
    }

    public AutoScaler getAutoScaler() {
        return autoScaler;
    }

    public StaticConfigStore getConfigStore() {
        return configStore;
    }

    public ConfiguredKeyManager getKeyManager() {
        return keyManager;
    }

    public RateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public RoutingEngine getRoutingEngine() {
        return routingEngine;
    }

    public GatewayService getGateway() {
        return gateway;
    }

    private MetricsRegistry createMetricsRegistry() {
        ControlPlaneConfig.MetricsConfig metrics = config.getMetrics();
        if (metrics.isEnabled()) {
            return MetricsRegistry.prometheus(metrics.getPrefix());
        }
        return new MetricsRegistry(metrics.getPrefix(), new SimpleMeterRegistry());
    }

    private SelfHostedClient createSelfHostedClient() {
        ControlPlaneConfig.SelfHostedConfig selfHosted = config.getSelfHosted();
        return new SelfHostedClient(
                Duration.ofMillis(selfHosted.getConnectTimeoutMs()),
                Duration.ofMillis(selfHosted.getRequestTimeoutMs()),
                selfHosted.getCircuitBreakerFailureThreshold(),
                Duration.ofMillis(selfHosted.getCircuitBreakerRecoveryMs()),
                Clock.systemUTC()
        );
    }

    private void applyRateLimitOverrides(ControlPlaneConfig.RateLimitConfig rateLimit) {
        for (ControlPlaneConfig.LimitEntry entry : rateLimit.getOverrides()) {
            rateLimiter.setLimit(entry.getTenant(), entry.getFeature(), entry.getLimitPerMinute());
        }
    }

    /**
     * Swaps the feature catalogue, API keys and rate limit overrides.
     * Timing settings, budgets and scale configs keep their startup values.
     */
    private void onConfigChanged(ControlPlaneConfig oldConfig, ControlPlaneConfig newConfig) {
        log.info("Configuration changed, applying updates...");

        configStore.replaceAll(newConfig.toFeatures());
        keyManager.replaceKeys(newConfig.toKeys());
        providerFactory.invalidateClients();

        rateLimiter.clearLimits();
        applyRateLimitOverrides(newConfig.getRateLimit());

        if (oldConfig != null && !oldConfig.getRateLimit().getAlgorithm()
                .equals(newConfig.getRateLimit().getAlgorithm())) {
            log.warn("Rate limit algorithm change requires a restart: current={}, requested={}",
                    rateLimiter.getName(), newConfig.getRateLimit().getAlgorithm());
        }

        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down ControlPlaneFactory...");

        try {
            autoScaler.close();
        } catch (RuntimeException e) {
            log.warn("Error closing autoscaler", e);
        }

        try {
            admissionController.close();
        } catch (RuntimeException e) {
            log.warn("Error closing admission controller", e);
        }

        try {
            serviceRegistry.close();
        } catch (RuntimeException e) {
            log.warn("Error closing service registry", e);
        }

        try {
            selfHostedClient.close();
        } catch (RuntimeException e) {
            log.warn("Error closing self-hosted client", e);
        }

        try {
            providerFactory.close();
        } catch (RuntimeException e) {
            log.warn("Error closing provider factory", e);
        }

        try {
            metricsRegistry.close();
        } catch (RuntimeException e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (RuntimeException e) {
            log.warn("Error closing config loader", e);
        }

        log.info("ControlPlaneFactory shut down");
    }
}
