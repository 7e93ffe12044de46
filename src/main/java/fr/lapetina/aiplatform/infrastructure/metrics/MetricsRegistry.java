package fr.lapetina.aiplatform.infrastructure.metrics;

import fr.lapetina.aiplatform.domain.model.HealthState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Routed request counters and latency per feature and provider
 * - Fallback, budget rejection and rate limit counters
 * - Heartbeat and scale action counters
 * - Instance gauges per health state and dropped event gauges per stream
 * - JVM metrics and Prometheus exposition when backed by Prometheus
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final MeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix, MeterRegistry registry) {
        this.prefix = prefix;
        this.registry = registry;
        log.info("MetricsRegistry initialized: prefix={}, backend={}", prefix, registry.getClass().getSimpleName());
    }

    /**
     * Creates a Prometheus-backed registry with JVM metrics bound.
     */
    public static MetricsRegistry prometheus(String prefix) {
        PrometheusMeterRegistry prometheus = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        new JvmMemoryMetrics().bindTo(prometheus);
        new JvmGcMetrics().bindTo(prometheus);
        new JvmThreadMetrics().bindTo(prometheus);
        new ProcessorMetrics().bindTo(prometheus);
        return new MetricsRegistry(prefix, prometheus);
    }

    /**
     * Creates an in-memory registry, used where nothing scrapes the meters.
     */
    public static MetricsRegistry inMemory() {
        return new MetricsRegistry("ai_platform", new SimpleMeterRegistry());
    }

    /**
     * Counts a routed request by outcome ({@code success} or {@code failure}).
     */
    public void recordRoute(String feature, String providerId, String outcome) {
        counter("route_requests_total", "Routed inference requests",
                "feature", feature, "provider", providerId, "outcome", outcome).increment();
    }

    public void recordRouteLatency(String feature, String providerId, Duration latency) {
        String key = "route_latency:" + feature + ":" + providerId;
        timers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_route_latency")
                        .description("Provider execution latency")
                        .tag("feature", feature)
                        .tag("provider", providerId)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void incrementFallback(String feature) {
        counter("route_fallbacks_total", "Requests served by a fallback provider",
                "feature", feature).increment();
    }

    public void incrementBudgetRejection(String scopeType) {
        counter("budget_rejections_total", "Requests rejected by a budget",
                "scope", scopeType).increment();
    }

    public void incrementRateLimited(String feature) {
        counter("rate_limited_total", "Requests rejected by the rate limiter",
                "feature", feature).increment();
    }

    public void incrementHeartbeat(String serviceType) {
        counter("heartbeats_total", "Heartbeats accepted", "type", serviceType).increment();
    }

    public void incrementHealthTransition(HealthState to) {
        counter("health_transitions_total", "Instance health transitions",
                "state", to.wireName()).increment();
    }

    public void incrementScaleAction(String feature, String action) {
        counter("scale_actions_total", "Scale actions applied",
                "feature", feature, "action", action).increment();
    }

    public void addCost(String feature, double amount) {
        counter("cost_total", "Accumulated inference cost", "feature", feature).increment(amount);
    }

    /**
     * Registers a gauge counting instances in the given health state.
     */
    public void registerInstanceGauge(HealthState state, Supplier<Number> count) {
        Gauge.builder(prefix + "_instances", count, s -> s.get().doubleValue())
                .description("Registered instances by health state")
                .tag("state", state.wireName())
                .register(registry);
    }

    /**
     * Registers a gauge reporting events dropped by a notification stream.
     */
    public void registerDroppedEvents(String stream, Supplier<Number> dropped) {
        Gauge.builder(prefix + "_events_dropped", dropped, s -> s.get().doubleValue())
                .description("Events dropped because a stream was full")
                .tag("stream", stream)
                .register(registry);
    }

    private Counter counter(String name, String description, String... tags) {
        String key = name + ":" + String.join(":", tags);
        return counters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_" + name)
                        .description(description)
                        .tags(tags)
                        .register(registry)
        );
    }

    /**
     * Returns the Prometheus scrape output, or an empty string for other backends.
     */
    public String scrape() {
        if (registry instanceof PrometheusMeterRegistry) {
            return ((PrometheusMeterRegistry) registry).scrape();
        }
        return "";
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
