package fr.lapetina.aiplatform.api;

import fr.lapetina.aiplatform.domain.exception.ControlPlaneException;
import fr.lapetina.aiplatform.domain.model.Feature;
import fr.lapetina.aiplatform.domain.model.InferenceResponse;
import fr.lapetina.aiplatform.domain.request.FeatureRequest;
import fr.lapetina.aiplatform.domain.request.InferenceRequest;
import fr.lapetina.aiplatform.domain.request.RequestValidator;
import fr.lapetina.aiplatform.infrastructure.budget.AdmissionController;
import fr.lapetina.aiplatform.infrastructure.budget.BudgetCheckResult;
import fr.lapetina.aiplatform.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.aiplatform.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.aiplatform.infrastructure.routing.ConfigStore;
import fr.lapetina.aiplatform.infrastructure.routing.RoutingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Admission pipeline in front of routing.
 *
 * Validation, rate limiting and the budget check all run before any
 * provider is contacted; a rejection at any stage ends the request.
 */
public final class GatewayService {

    private static final Logger log = LoggerFactory.getLogger(GatewayService.class);

    private final RequestValidator validator;
    private final RateLimiter rateLimiter;
    private final AdmissionController admission;
    private final RoutingEngine routing;
    private final ConfigStore configStore;
    private final MetricsRegistry metrics;
    private final String defaultTenant;

    public GatewayService(RequestValidator validator, RateLimiter rateLimiter, AdmissionController admission,
                          RoutingEngine routing, ConfigStore configStore, MetricsRegistry metrics,
                          String defaultTenant) {
        this.validator = validator;
        this.rateLimiter = rateLimiter;
        this.admission = admission;
        this.routing = routing;
        this.configStore = configStore;
        this.metrics = metrics;
        this.defaultTenant = defaultTenant;
    }

    /**
     * Validates, admits and routes one request.
     *
     * @throws ControlPlaneException VALIDATION, NOT_FOUND, RATE_LIMITED or BUDGET_EXCEEDED on rejection,
     *                               otherwise whatever routing raises
     */
    public InferenceResponse handle(InferenceRequest request) {
        FeatureRequest prepared = validator.prepare(request.payload());
        String tenant = request.tenantId() != null && !request.tenantId().isBlank()
                ? request.tenantId()
                : defaultTenant;
        InferenceRequest admitted = new InferenceRequest(
                request.requestId(), request.feature(), tenant, request.traceId(), prepared);
        String feature = admitted.feature();
        // Unknown names never reach the limiter, which keeps state per feature name
        Feature resolved = resolveFeature(feature)
                .orElseThrow(() -> ControlPlaneException.notFound("Feature not found: " + feature));

        if (!rateLimiter.allow(tenant, feature)) {
            metrics.incrementRateLimited(feature);
            log.warn("Request rate limited: requestId={}, tenant={}, feature={}, limit={}",
                    admitted.requestId(), tenant, feature, rateLimiter.getLimit(tenant, feature));
            throw ControlPlaneException.rateLimited(
                    "Rate limit exceeded for tenant " + tenant + " on " + feature);
        }

        // Admission is checked against the worst-case per-request price
        BudgetCheckResult check = admission.checkBudget(feature, tenant, resolved.cost().highestPerRequest());
        if (!check.allowed()) {
            throw ControlPlaneException.budgetExceeded(check.reason());
        }

        InferenceResponse response = routing.route(admitted);
        log.info("Request served: requestId={}, feature={}, provider={}, fallback={}, totalMs={}",
                response.requestId(), response.feature(), response.providerId(),
                response.fallbackUsed(), response.totalMs());
        return response;
    }

    private Optional<Feature> resolveFeature(String feature) {
        return configStore.getFeature(feature)
                .or(() -> configStore.getFeaturesByCategory(feature).stream().findFirst());
    }
}
