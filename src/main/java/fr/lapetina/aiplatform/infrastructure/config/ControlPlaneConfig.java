package fr.lapetina.aiplatform.infrastructure.config;

import fr.lapetina.aiplatform.domain.model.CostConfig;
import fr.lapetina.aiplatform.domain.model.Feature;
import fr.lapetina.aiplatform.domain.model.ProviderConfig;
import fr.lapetina.aiplatform.domain.model.ProviderType;
import fr.lapetina.aiplatform.domain.model.RoutingPolicy;
import fr.lapetina.aiplatform.infrastructure.budget.AlertAction;
import fr.lapetina.aiplatform.infrastructure.budget.AlertThreshold;
import fr.lapetina.aiplatform.infrastructure.budget.Budget;
import fr.lapetina.aiplatform.infrastructure.budget.BudgetPeriod;
import fr.lapetina.aiplatform.infrastructure.budget.BudgetSettings;
import fr.lapetina.aiplatform.infrastructure.budget.ScopeType;
import fr.lapetina.aiplatform.infrastructure.ratelimit.RateLimiterFactory;
import fr.lapetina.aiplatform.infrastructure.registry.RegistrySettings;
import fr.lapetina.aiplatform.infrastructure.routing.ApiKey;
import fr.lapetina.aiplatform.infrastructure.routing.ConfiguredKeyManager;
import fr.lapetina.aiplatform.infrastructure.scaler.ScaleConfig;
import fr.lapetina.aiplatform.infrastructure.scaler.ScalerSettings;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the control plane.
 * Designed to be populated from YAML.
 */
public class ControlPlaneConfig {

    private ServerConfig server = new ServerConfig();
    private RegistryConfig registry = new RegistryConfig();
    private BudgetConfig budget = new BudgetConfig();
    private ScalerConfig scaler = new ScalerConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private EventsConfig events = new EventsConfig();
    private SelfHostedConfig selfHosted = new SelfHostedConfig();
    private List<FeatureConfig> features = new ArrayList<>();
    private List<KeyConfig> keys = new ArrayList<>();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public RegistryConfig getRegistry() { return registry; }
    public void setRegistry(RegistryConfig registry) { this.registry = registry; }

    public BudgetConfig getBudget() { return budget; }
    public void setBudget(BudgetConfig budget) { this.budget = budget; }

    public ScalerConfig getScaler() { return scaler; }
    public void setScaler(ScalerConfig scaler) { this.scaler = scaler; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public EventsConfig getEvents() { return events; }
    public void setEvents(EventsConfig events) { this.events = events; }

    public SelfHostedConfig getSelfHosted() { return selfHosted; }
    public void setSelfHosted(SelfHostedConfig selfHosted) { this.selfHosted = selfHosted; }

    public List<FeatureConfig> getFeatures() { return features; }
    public void setFeatures(List<FeatureConfig> features) { this.features = features; }

    public List<KeyConfig> getKeys() { return keys; }
    public void setKeys(List<KeyConfig> keys) { this.keys = keys; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public List<Feature> toFeatures() {
        return features.stream().map(FeatureConfig::toFeature).toList();
    }

    public List<ConfiguredKeyManager.ConfiguredKey> toKeys() {
        return keys.stream().map(KeyConfig::toConfiguredKey).toList();
    }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 16;
        private int maxPromptLength = 8000;
        private String defaultTenant = "default";

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

        public int getMaxPromptLength() { return maxPromptLength; }
        public void setMaxPromptLength(int maxPromptLength) { this.maxPromptLength = maxPromptLength; }

        public String getDefaultTenant() { return defaultTenant; }
        public void setDefaultTenant(String defaultTenant) { this.defaultTenant = defaultTenant; }
    }

    /**
     * Heartbeat and health evaluation configuration.
     */
    public static class RegistryConfig {
        private int heartbeatIntervalSeconds = 30;
        private int heartbeatTimeoutSeconds = 90;
        private int missedHeartbeatThreshold = 3;
        private int sweepIntervalSeconds = 10;
        private double errorRateThreshold = 0.10;
        private int shutdownGracePeriodSeconds = 30;
        private int pendingConfigLimit = 16;

        public int getHeartbeatIntervalSeconds() { return heartbeatIntervalSeconds; }
        public void setHeartbeatIntervalSeconds(int seconds) { this.heartbeatIntervalSeconds = seconds; }

        public int getHeartbeatTimeoutSeconds() { return heartbeatTimeoutSeconds; }
        public void setHeartbeatTimeoutSeconds(int seconds) { this.heartbeatTimeoutSeconds = seconds; }

        public int getMissedHeartbeatThreshold() { return missedHeartbeatThreshold; }
        public void setMissedHeartbeatThreshold(int threshold) { this.missedHeartbeatThreshold = threshold; }

        public int getSweepIntervalSeconds() { return sweepIntervalSeconds; }
        public void setSweepIntervalSeconds(int seconds) { this.sweepIntervalSeconds = seconds; }

        public double getErrorRateThreshold() { return errorRateThreshold; }
        public void setErrorRateThreshold(double threshold) { this.errorRateThreshold = threshold; }

        public int getShutdownGracePeriodSeconds() { return shutdownGracePeriodSeconds; }
        public void setShutdownGracePeriodSeconds(int seconds) { this.shutdownGracePeriodSeconds = seconds; }

        public int getPendingConfigLimit() { return pendingConfigLimit; }
        public void setPendingConfigLimit(int limit) { this.pendingConfigLimit = limit; }

        public RegistrySettings toSettings() {
            return new RegistrySettings(
                    Duration.ofSeconds(heartbeatIntervalSeconds),
                    Duration.ofSeconds(heartbeatTimeoutSeconds),
                    missedHeartbeatThreshold,
                    Duration.ofSeconds(sweepIntervalSeconds),
                    errorRateThreshold,
                    Duration.ofSeconds(shutdownGracePeriodSeconds),
                    pendingConfigLimit
            );
        }
    }

    /**
     * Budget reconciliation and default budgets.
     * When no budget is listed the built-in defaults are seeded.
     */
    public static class BudgetConfig {
        private int reconcileIntervalSeconds = 60;
        private List<BudgetEntry> budgets = new ArrayList<>();

        public int getReconcileIntervalSeconds() { return reconcileIntervalSeconds; }
        public void setReconcileIntervalSeconds(int seconds) { this.reconcileIntervalSeconds = seconds; }

        public List<BudgetEntry> getBudgets() { return budgets; }
        public void setBudgets(List<BudgetEntry> budgets) { this.budgets = budgets; }

        public BudgetSettings toSettings() {
            Duration interval = Duration.ofSeconds(reconcileIntervalSeconds);
            if (budgets == null || budgets.isEmpty()) {
                return new BudgetSettings(interval, BudgetSettings.defaults().defaultBudgets());
            }
            return new BudgetSettings(interval, budgets.stream().map(BudgetEntry::toBudget).toList());
        }
    }

    public static class BudgetEntry {
        private String name;
        private String scope = "global";
        private String targetId;
        private double amount;
        private String period = "monthly";
        private List<AlertEntry> alerts = new ArrayList<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getScope() { return scope; }
        public void setScope(String scope) { this.scope = scope; }

        public String getTargetId() { return targetId; }
        public void setTargetId(String targetId) { this.targetId = targetId; }

        public double getAmount() { return amount; }
        public void setAmount(double amount) { this.amount = amount; }

        public String getPeriod() { return period; }
        public void setPeriod(String period) { this.period = period; }

        public List<AlertEntry> getAlerts() { return alerts; }
        public void setAlerts(List<AlertEntry> alerts) { this.alerts = alerts; }

        Budget toBudget() {
            List<AlertThreshold> thresholds = alerts == null || alerts.isEmpty()
                    ? null
                    : alerts.stream().map(AlertEntry::toThreshold).toList();
            return new Budget(null, name, ScopeType.fromString(scope), targetId, amount,
                    BudgetPeriod.fromString(period), null, thresholds, null, null);
        }
    }

    public static class AlertEntry {
        private double at;
        private String action = "notify";
        private boolean enabled = true;

        public double getAt() { return at; }
        public void setAt(double at) { this.at = at; }

        public String getAction() { return action; }
        public void setAction(String action) { this.action = action; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        AlertThreshold toThreshold() {
            return new AlertThreshold(at, AlertAction.fromString(action), enabled);
        }
    }

    /**
     * Autoscaler configuration.
     * When no feature is listed the built-in scale configs apply.
     */
    public static class ScalerConfig {
        private boolean enabled = true;
        private int loopIntervalSeconds = 30;
        private double rpsCeiling = ScalerSettings.DEFAULT_RPS_CEILING;
        private String namespace = ScaleConfig.DEFAULT_NAMESPACE;
        private List<ScaleEntry> features = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getLoopIntervalSeconds() { return loopIntervalSeconds; }
        public void setLoopIntervalSeconds(int seconds) { this.loopIntervalSeconds = seconds; }

        public double getRpsCeiling() { return rpsCeiling; }
        public void setRpsCeiling(double rpsCeiling) { this.rpsCeiling = rpsCeiling; }

        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) { this.namespace = namespace; }

        public List<ScaleEntry> getFeatures() { return features; }
        public void setFeatures(List<ScaleEntry> features) { this.features = features; }

        public ScalerSettings toSettings() {
            List<ScaleConfig> configs = features == null || features.isEmpty()
                    ? ScalerSettings.defaultConfigs()
                    : features.stream().map(f -> f.toScaleConfig(namespace)).toList();
            return new ScalerSettings(Duration.ofSeconds(loopIntervalSeconds), rpsCeiling, configs);
        }
    }

    public static class ScaleEntry {
        private String feature;
        private String serviceType;
        private int minInstances = 0;
        private int maxInstances = 1;
        private double targetCpu = 70;
        private double targetMemory = 80;
        private int targetQueueSize = 50;
        private int idleTimeoutSeconds = 900;
        private int scaleUpCooldownSeconds = 60;
        private int scaleDownCooldownSeconds = 300;
        private String deployment;

        public String getFeature() { return feature; }
        public void setFeature(String feature) { this.feature = feature; }

        public String getServiceType() { return serviceType; }
        public void setServiceType(String serviceType) { this.serviceType = serviceType; }

        public int getMinInstances() { return minInstances; }
        public void setMinInstances(int minInstances) { this.minInstances = minInstances; }

        public int getMaxInstances() { return maxInstances; }
        public void setMaxInstances(int maxInstances) { this.maxInstances = maxInstances; }

        public double getTargetCpu() { return targetCpu; }
        public void setTargetCpu(double targetCpu) { this.targetCpu = targetCpu; }

        public double getTargetMemory() { return targetMemory; }
        public void setTargetMemory(double targetMemory) { this.targetMemory = targetMemory; }

        public int getTargetQueueSize() { return targetQueueSize; }
        public void setTargetQueueSize(int targetQueueSize) { this.targetQueueSize = targetQueueSize; }

        public int getIdleTimeoutSeconds() { return idleTimeoutSeconds; }
        public void setIdleTimeoutSeconds(int seconds) { this.idleTimeoutSeconds = seconds; }

        public int getScaleUpCooldownSeconds() { return scaleUpCooldownSeconds; }
        public void setScaleUpCooldownSeconds(int seconds) { this.scaleUpCooldownSeconds = seconds; }

        public int getScaleDownCooldownSeconds() { return scaleDownCooldownSeconds; }
        public void setScaleDownCooldownSeconds(int seconds) { this.scaleDownCooldownSeconds = seconds; }

        public String getDeployment() { return deployment; }
        public void setDeployment(String deployment) { this.deployment = deployment; }

        ScaleConfig toScaleConfig(String namespace) {
            return ScaleConfig.builder(feature)
                    .serviceType(serviceType)
                    .instances(minInstances, maxInstances)
                    .targetCpu(targetCpu)
                    .targetMemory(targetMemory)
                    .targetQueueSize(targetQueueSize)
                    .idleTimeout(Duration.ofSeconds(idleTimeoutSeconds))
                    .cooldowns(Duration.ofSeconds(scaleUpCooldownSeconds), Duration.ofSeconds(scaleDownCooldownSeconds))
                    .deployment(namespace, deployment)
                    .build();
        }
    }

    /**
     * Per tenant and feature rate limiting.
     */
    public static class RateLimitConfig {
        private String algorithm = "sliding-window";
        private int defaultLimitPerMinute = RateLimiterFactory.DEFAULT_LIMIT_PER_MINUTE;
        private List<LimitEntry> overrides = new ArrayList<>();

        public String getAlgorithm() { return algorithm; }
        public void setAlgorithm(String algorithm) { this.algorithm = algorithm; }

        public int getDefaultLimitPerMinute() { return defaultLimitPerMinute; }
        public void setDefaultLimitPerMinute(int limit) { this.defaultLimitPerMinute = limit; }

        public List<LimitEntry> getOverrides() { return overrides; }
        public void setOverrides(List<LimitEntry> overrides) { this.overrides = overrides; }
    }

    public static class LimitEntry {
        private String tenant;
        private String feature;
        private int limitPerMinute;

        public String getTenant() { return tenant; }
        public void setTenant(String tenant) { this.tenant = tenant; }

        public String getFeature() { return feature; }
        public void setFeature(String feature) { this.feature = feature; }

        public int getLimitPerMinute() { return limitPerMinute; }
        public void setLimitPerMinute(int limitPerMinute) { this.limitPerMinute = limitPerMinute; }
    }

    /**
     * LMAX Disruptor buffers behind the heartbeat, alert and scale event streams.
     */
    public static class EventsConfig {
        private int ringBufferSize = 128;
        private int watchCapacity = 10;
        private String waitStrategy = "blocking";

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public int getWatchCapacity() { return watchCapacity; }
        public void setWatchCapacity(int watchCapacity) { this.watchCapacity = watchCapacity; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * HTTP client settings for self-hosted instances.
     */
    public static class SelfHostedConfig {
        private long connectTimeoutMs = 5000;
        private long requestTimeoutMs = 120000;
        private int circuitBreakerFailureThreshold = 5;
        private long circuitBreakerRecoveryMs = 30000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public int getCircuitBreakerFailureThreshold() { return circuitBreakerFailureThreshold; }
        public void setCircuitBreakerFailureThreshold(int threshold) { this.circuitBreakerFailureThreshold = threshold; }

        public long getCircuitBreakerRecoveryMs() { return circuitBreakerRecoveryMs; }
        public void setCircuitBreakerRecoveryMs(long ms) { this.circuitBreakerRecoveryMs = ms; }
    }

    /**
     * A feature of the catalogue and its providers.
     */
    public static class FeatureConfig {
        private String id;
        private String name;
        private String category;
        private String description;
        private boolean enabled = true;
        private List<ProviderEntry> providers = new ArrayList<>();
        private RoutingEntry routing = new RoutingEntry();
        private CostEntry cost = new CostEntry();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public List<ProviderEntry> getProviders() { return providers; }
        public void setProviders(List<ProviderEntry> providers) { this.providers = providers; }

        public RoutingEntry getRouting() { return routing; }
        public void setRouting(RoutingEntry routing) { this.routing = routing; }

        public CostEntry getCost() { return cost; }
        public void setCost(CostEntry cost) { this.cost = cost; }

        Feature toFeature() {
            return new Feature(id, name, category, description, enabled,
                    providers.stream().map(ProviderEntry::toProviderConfig).toList(),
                    routing != null ? routing.toPolicy() : null,
                    cost != null ? cost.toCostConfig() : null);
        }
    }

    public static class ProviderEntry {
        private String id;
        private String type = "self_hosted";
        private boolean enabled = true;
        private int priority = 1;
        private int weight = 1;
        private String vendor;
        private String service;
        private String model;
        private String endpoint;
        private int minInstances;
        private int maxInstances = 1;
        private Map<String, String> extra = new HashMap<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public int getWeight() { return weight; }
        public void setWeight(int weight) { this.weight = weight; }

        public String getVendor() { return vendor; }
        public void setVendor(String vendor) { this.vendor = vendor; }

        public String getService() { return service; }
        public void setService(String service) { this.service = service; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public int getMinInstances() { return minInstances; }
        public void setMinInstances(int minInstances) { this.minInstances = minInstances; }

        public int getMaxInstances() { return maxInstances; }
        public void setMaxInstances(int maxInstances) { this.maxInstances = maxInstances; }

        public Map<String, String> getExtra() { return extra; }
        public void setExtra(Map<String, String> extra) { this.extra = extra; }

        ProviderConfig toProviderConfig() {
            return new ProviderConfig(id, ProviderType.fromString(type), enabled, priority, weight,
                    vendor, service, model, endpoint, minInstances, maxInstances, extra);
        }
    }

    public static class RoutingEntry {
        private String strategy = RoutingPolicy.DEFAULT_STRATEGY;
        private boolean fallbackEnabled = true;
        private int timeoutSeconds = 60;
        private int maxRetries = 0;
        private long retryBackoffMs = 0;

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public boolean isFallbackEnabled() { return fallbackEnabled; }
        public void setFallbackEnabled(boolean fallbackEnabled) { this.fallbackEnabled = fallbackEnabled; }

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getRetryBackoffMs() { return retryBackoffMs; }
        public void setRetryBackoffMs(long retryBackoffMs) { this.retryBackoffMs = retryBackoffMs; }

        RoutingPolicy toPolicy() {
            return new RoutingPolicy(strategy, fallbackEnabled, timeoutSeconds, maxRetries, retryBackoffMs);
        }
    }

    public static class CostEntry {
        private double selfHostedPerHour;
        private Map<String, Double> thirdPartyPerRequest = new HashMap<>();

        public double getSelfHostedPerHour() { return selfHostedPerHour; }
        public void setSelfHostedPerHour(double selfHostedPerHour) { this.selfHostedPerHour = selfHostedPerHour; }

        public Map<String, Double> getThirdPartyPerRequest() { return thirdPartyPerRequest; }
        public void setThirdPartyPerRequest(Map<String, Double> prices) { this.thirdPartyPerRequest = prices; }

        CostConfig toCostConfig() {
            return new CostConfig(selfHostedPerHour, thirdPartyPerRequest);
        }
    }

    /**
     * A vendor API key. The secret is read from {@code secretEnv}, never from this file.
     */
    public static class KeyConfig {
        private String id;
        private String vendor;
        private String service;
        private String alias;
        private String tier = "primary";
        private boolean enabled = true;
        private String secretEnv;
        private String expiresAt;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getVendor() { return vendor; }
        public void setVendor(String vendor) { this.vendor = vendor; }

        public String getService() { return service; }
        public void setService(String service) { this.service = service; }

        public String getAlias() { return alias; }
        public void setAlias(String alias) { this.alias = alias; }

        public String getTier() { return tier; }
        public void setTier(String tier) { this.tier = tier; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getSecretEnv() { return secretEnv; }
        public void setSecretEnv(String secretEnv) { this.secretEnv = secretEnv; }

        public String getExpiresAt() { return expiresAt; }
        public void setExpiresAt(String expiresAt) { this.expiresAt = expiresAt; }

        ConfiguredKeyManager.ConfiguredKey toConfiguredKey() {
            ApiKey key = new ApiKey(id, vendor, service, alias, ApiKey.Tier.fromString(tier), enabled,
                    null, expiresAt != null ? Instant.parse(expiresAt) : null);
            return new ConfiguredKeyManager.ConfiguredKey(key, secretEnv);
        }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "ai_platform";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
