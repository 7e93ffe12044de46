package fr.lapetina.aiplatform.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.aiplatform.api.dto.ErrorResponse;
import fr.lapetina.aiplatform.api.dto.InferenceResult;
import fr.lapetina.aiplatform.api.dto.ShutdownRequest;
import fr.lapetina.aiplatform.domain.exception.ControlPlaneException;
import fr.lapetina.aiplatform.domain.model.ErrorKind;
import fr.lapetina.aiplatform.domain.model.HealthState;
import fr.lapetina.aiplatform.domain.model.InferenceResponse;
import fr.lapetina.aiplatform.domain.request.FeatureKind;
import fr.lapetina.aiplatform.domain.request.FeatureRequest;
import fr.lapetina.aiplatform.domain.request.ImageEditRequest;
import fr.lapetina.aiplatform.domain.request.ImageStylizationRequest;
import fr.lapetina.aiplatform.domain.request.InferenceRequest;
import fr.lapetina.aiplatform.domain.request.TextGenerationRequest;
import fr.lapetina.aiplatform.domain.request.TextToImageRequest;
import fr.lapetina.aiplatform.infrastructure.budget.AdmissionController;
import fr.lapetina.aiplatform.infrastructure.budget.Budget;
import fr.lapetina.aiplatform.infrastructure.budget.BudgetInfo;
import fr.lapetina.aiplatform.infrastructure.budget.ScopeType;
import fr.lapetina.aiplatform.infrastructure.budget.Spending;
import fr.lapetina.aiplatform.infrastructure.config.ConfigLoader;
import fr.lapetina.aiplatform.infrastructure.config.ControlPlaneConfig;
import fr.lapetina.aiplatform.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.aiplatform.infrastructure.registry.HeartbeatRequest;
import fr.lapetina.aiplatform.infrastructure.registry.RegistrationRequest;
import fr.lapetina.aiplatform.infrastructure.registry.ServiceRegistry;
import fr.lapetina.aiplatform.infrastructure.scaler.AutoScaler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /api/v1/services/register - Register a self-hosted instance
 * - POST /api/v1/services/{id}/heartbeat - Report liveness and metrics
 * - POST /api/v1/services/{id}/shutdown - Request a graceful drain
 * - GET /api/v1/services - List instances, optional ?type= filter
 * - GET /api/v1/services/{id} - One instance
 * - POST /api/v1/inference/{text-to-image|image-edit|image-stylization|text-generation}
 * - GET /api/v1/budgets - Budgets with their current spend, optional ?scope= filter
 * - GET /api/v1/scaling - Scale configs
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 * - POST /admin/reload - Reload configuration
 *
 * Bodies are JSON in snake case. Failures use the {@link ErrorResponse} envelope.
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    static final String TENANT_HEADER = "X-Tenant-ID";
    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String TRACE_ID_HEADER = "X-Trace-ID";

    private static final Map<FeatureKind, Class<? extends FeatureRequest>> PAYLOAD_TYPES = Map.of(
            FeatureKind.TEXT_TO_IMAGE, TextToImageRequest.class,
            FeatureKind.IMAGE_EDIT, ImageEditRequest.class,
            FeatureKind.IMAGE_STYLIZATION, ImageStylizationRequest.class,
            FeatureKind.TEXT_GENERATION, TextGenerationRequest.class
    );

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final GatewayService gateway;
    private final ServiceRegistry registry;
    private final AdmissionController admission;
    private final AutoScaler scaler;
    private final MetricsRegistry metricsRegistry;
    private final ConfigLoader configLoader;
    private final Instant startedAt = Instant.now();

    public HttpServer(
            ControlPlaneConfig.ServerConfig config,
            GatewayService gateway,
            ServiceRegistry registry,
            AdmissionController admission,
            AutoScaler scaler,
            MetricsRegistry metricsRegistry,
            ConfigLoader configLoader
    ) throws IOException {
        this.gateway = gateway;
        this.registry = registry;
        this.admission = admission;
        this.scaler = scaler;
        this.metricsRegistry = metricsRegistry;
        this.configLoader = configLoader;
        this.objectMapper = createObjectMapper();

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(config.getHost(), config.getPort()), config.getBacklog()
        );

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(config.getWorkerThreads(), r -> {
            Thread t = new Thread(r, "http-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/api/v1/services", new ServicesHandler());
        server.createContext("/api/v1/inference/", new InferenceHandler());
        server.createContext("/api/v1/budgets", new BudgetsHandler());
        server.createContext("/api/v1/scaling", new ScalingHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured on {}:{}", config.getHost(), config.getPort());
    }

    static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    /**
     * Bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    /**
     * Common request scaffolding: request id in the MDC, error mapping, MDC cleanup.
     */
    private abstract class JsonHandler implements HttpHandler {

        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            String requestId = exchange.getRequestHeaders().getFirst(REQUEST_ID_HEADER);
            if (requestId == null || requestId.isBlank()) {
                requestId = InferenceRequest.newRequestId();
            }
            MDC.put("requestId", requestId);
            try {
                serve(exchange, requestId);
            } catch (ControlPlaneException e) {
                logFailure(e);
                sendError(exchange, e.getKind(), e.getMessage(), requestId);
            } catch (JsonProcessingException e) {
                log.warn("Malformed request body: path={}, error={}",
                        exchange.getRequestURI().getPath(), e.getOriginalMessage());
                sendError(exchange, ErrorKind.VALIDATION, "Malformed JSON body: " + e.getOriginalMessage(), requestId);
            } catch (RuntimeException e) {
                log.error("Error handling request: path={}", exchange.getRequestURI().getPath(), e);
                sendError(exchange, ErrorKind.INTERNAL, "Internal server error", requestId);
            } finally {
                MDC.clear();
                exchange.close();
            }
        }

        abstract void serve(HttpExchange exchange, String requestId) throws IOException;

        private void logFailure(ControlPlaneException e) {
            if (e.getKind().getHttpStatus() >= 500) {
                log.warn("Request failed: kind={}, error={}", e.getKind(), e.getMessage());
            } else {
                log.debug("Request rejected: kind={}, error={}", e.getKind(), e.getMessage());
            }
        }
    }

    // ==================== SERVICES HANDLER ====================

    private class ServicesHandler extends JsonHandler {
        @Override
        void serve(HttpExchange exchange, String requestId) throws IOException {
            String method = exchange.getRequestMethod();
            List<String> segments = segments(exchange, "/api/v1/services");

            if (segments.isEmpty() && "GET".equalsIgnoreCase(method)) {
                String type = queryParams(exchange).get("type");
                sendJson(exchange, 200, registry.listServices(type));
            } else if (segments.size() == 1 && "register".equals(segments.get(0)) && "POST".equalsIgnoreCase(method)) {
                RegistrationRequest request = readBody(exchange, RegistrationRequest.class);
                sendJson(exchange, 200, registry.register(request));
            } else if (segments.size() == 1 && "GET".equalsIgnoreCase(method)) {
                String id = segments.get(0);
                sendJson(exchange, 200, registry.getService(id)
                        .orElseThrow(() -> ControlPlaneException.notFound("Service not found: " + id)));
            } else if (segments.size() == 2 && "heartbeat".equals(segments.get(1)) && "POST".equalsIgnoreCase(method)) {
                sendJson(exchange, 200, registry.heartbeat(heartbeatFor(segments.get(0), exchange)));
            } else if (segments.size() == 2 && "shutdown".equals(segments.get(1)) && "POST".equalsIgnoreCase(method)) {
                ShutdownRequest request = readOptionalBody(exchange, ShutdownRequest.class);
                String reason = request != null ? request.reason() : null;
                sendJson(exchange, 200, registry.shutdown(segments.get(0), reason));
            } else {
                sendError(exchange, ErrorKind.NOT_FOUND, "No route for " + method + " "
                        + exchange.getRequestURI().getPath(), requestId);
            }
        }

        private HeartbeatRequest heartbeatFor(String serviceId, HttpExchange exchange) throws IOException {
            HeartbeatRequest body = readBody(exchange, HeartbeatRequest.class);
            if (body.serviceId() != null && !body.serviceId().equals(serviceId)) {
                throw ControlPlaneException.validation("Service id in body does not match the path");
            }
            return new HeartbeatRequest(serviceId, body.token(), body.timestamp(), body.load(),
                    body.queueSize(), body.processedCount(), body.errorCount(),
                    body.cpuUsage(), body.gpuUsage(), body.memoryUsage());
        }
    }

    // ==================== INFERENCE HANDLER ====================

    private class InferenceHandler extends JsonHandler {
        @Override
        void serve(HttpExchange exchange, String requestId) throws IOException {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, ErrorKind.VALIDATION, "Method Not Allowed", requestId);
                return;
            }
            List<String> segments = segments(exchange, "/api/v1/inference");
            FeatureKind kind = segments.size() == 1 ? FeatureKind.fromPath(segments.get(0)).orElse(null) : null;
            if (kind == null) {
                sendError(exchange, ErrorKind.NOT_FOUND, "Unknown inference endpoint: "
                        + exchange.getRequestURI().getPath(), requestId);
                return;
            }

            JsonNode body;
            try (InputStream is = exchange.getRequestBody()) {
                body = objectMapper.readTree(is);
            }
            if (body == null || !body.isObject()) {
                throw ControlPlaneException.validation("Request body must be a JSON object");
            }
            JsonNode featureNode = ((ObjectNode) body).remove("feature");
            String feature = featureNode != null && !featureNode.isNull() ? featureNode.asText() : null;
            FeatureRequest payload = objectMapper.treeToValue(body, PAYLOAD_TYPES.get(kind));

            InferenceRequest request = new InferenceRequest(
                    requestId,
                    feature,
                    exchange.getRequestHeaders().getFirst(TENANT_HEADER),
                    exchange.getRequestHeaders().getFirst(TRACE_ID_HEADER),
                    payload
            );
            InferenceResponse response = gateway.handle(request);
            sendJson(exchange, 200, InferenceResult.from(response));
        }
    }

    // ==================== BUDGETS HANDLER ====================

    private class BudgetsHandler extends JsonHandler {
        @Override
        void serve(HttpExchange exchange, String requestId) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, ErrorKind.VALIDATION, "Method Not Allowed", requestId);
                return;
            }
            String scope = queryParams(exchange).get("scope");
            ScopeType scopeType;
            try {
                scopeType = scope != null ? ScopeType.fromString(scope) : null;
            } catch (IllegalArgumentException e) {
                throw ControlPlaneException.validation(e.getMessage());
            }

            List<Map<String, Object>> budgets = new ArrayList<>();
            for (Budget budget : admission.listBudgets(scopeType)) {
                double used = admission.getSpending(budget.id()).map(Spending::amount).orElse(0.0);
                BudgetInfo info = BudgetInfo.of(budget, used);
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("id", budget.id());
                entry.put("name", budget.name());
                entry.put("scope", budget.scopeType().wireName());
                entry.put("target_id", budget.targetId());
                entry.put("period", budget.period().wireName());
                entry.put("amount", budget.amount());
                entry.put("used", info.used());
                entry.put("remaining", info.remaining());
                entry.put("percentage", info.percentage());
                budgets.add(entry);
            }
            sendJson(exchange, 200, Map.of("budgets", budgets));
        }
    }

    // ==================== SCALING HANDLER ====================

    private class ScalingHandler extends JsonHandler {
        @Override
        void serve(HttpExchange exchange, String requestId) throws IOException {
            if (scaler == null) {
                sendError(exchange, ErrorKind.UNAVAILABLE, "Autoscaler is disabled", requestId);
                return;
            }
            List<String> segments = segments(exchange, "/api/v1/scaling");
            if (segments.isEmpty() && "GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendJson(exchange, 200, Map.of("configs", scaler.listScaleConfigs()));
            } else if (segments.size() == 1 && "GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendJson(exchange, 200, scaler.getScaleConfig(segments.get(0)));
            } else {
                sendError(exchange, ErrorKind.NOT_FOUND, "No route for " + exchange.getRequestMethod() + " "
                        + exchange.getRequestURI().getPath(), requestId);
            }
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler extends JsonHandler {
        @Override
        void serve(HttpExchange exchange, String requestId) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, ErrorKind.VALIDATION, "Method Not Allowed", requestId);
                return;
            }

            Map<String, Object> services = new LinkedHashMap<>();
            for (HealthState state : HealthState.values()) {
                services.put(state.wireName(), registry.countByState(state));
            }

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "UP");
            health.put("timestamp", Instant.now());
            health.put("started_at", startedAt);
            health.put("services", services);
            sendJson(exchange, 200, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler extends JsonHandler {
        @Override
        void serve(HttpExchange exchange, String requestId) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, ErrorKind.VALIDATION, "Method Not Allowed", requestId);
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler extends JsonHandler {
        @Override
        void serve(HttpExchange exchange, String requestId) throws IOException {
            String path = exchange.getRequestURI().getPath();
            if (path.equals("/admin/reload") && "POST".equalsIgnoreCase(exchange.getRequestMethod())
                    && configLoader != null) {
                ControlPlaneConfig newConfig = configLoader.reload();
                sendJson(exchange, 200, Map.of(
                        "message", "Configuration reloaded",
                        "features", newConfig.getFeatures().size()
                ));
            } else {
                sendError(exchange, ErrorKind.NOT_FOUND, "Not Found", requestId);
            }
        }
    }

    // ==================== HELPER METHODS ====================

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        T body = readOptionalBody(exchange, type);
        if (body == null) {
            throw ControlPlaneException.validation("Request body is required");
        }
        return body;
    }

    private <T> T readOptionalBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            byte[] bytes = is.readAllBytes();
            if (bytes.length == 0) {
                return null;
            }
            return objectMapper.readValue(bytes, type);
        }
    }

    /**
     * Path segments after the given prefix, empty segments removed.
     */
    static List<String> segments(HttpExchange exchange, String prefix) {
        String path = exchange.getRequestURI().getPath();
        String rest = path.length() > prefix.length() ? path.substring(prefix.length()) : "";
        List<String> segments = new ArrayList<>();
        for (String segment : rest.split("/")) {
            if (!segment.isEmpty()) {
                segments.add(URLDecoder.decode(segment, StandardCharsets.UTF_8));
            }
        }
        return segments;
    }

    static Map<String, String> queryParams(HttpExchange exchange) {
        Map<String, String> params = new LinkedHashMap<>();
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null || query.isEmpty()) {
            return params;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                params.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                        URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
            }
        }
        return params;
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, ErrorKind kind, String message, String requestId)
            throws IOException {
        sendJson(exchange, kind.getHttpStatus(), ErrorResponse.of(kind, message, requestId));
    }
}
