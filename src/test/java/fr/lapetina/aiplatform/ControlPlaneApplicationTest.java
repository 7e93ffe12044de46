package fr.lapetina.aiplatform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.aiplatform.integration.TestControlPlaneFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Exercises the HTTP surface against a control plane with stub providers.
 */
class ControlPlaneApplicationTest {

    private static final String REGISTRATION = """
            {
              "service_type": "text_to_image",
              "version": "1.2.0",
              "hostname": "sd-node-1",
              "ip": "127.0.0.1",
              "port": 9000,
              "capabilities": {"supported_models": ["sdxl"], "max_batch_size": 4},
              "resources": {"gpu_memory_mb": 24576, "gpu_count": 1, "cpu_cores": 8, "memory_mb": 32768}
            }
            """;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    private ControlPlaneApplication app;

    @BeforeEach
    void setUp() throws Exception {
        app = new ControlPlaneApplication(TestControlPlaneFactory.create());
        app.start();
    }

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.close();
        }
    }

    @Test
    @DisplayName("should report health with instance counts")
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.get("status").asText()).isEqualTo("UP");
        assertThat(body.get("services").get("healthy").asInt()).isZero();
    }

    @Test
    @DisplayName("should register an instance and accept its heartbeat")
    void shouldRegisterAndHeartbeat() throws Exception {
        HttpResponse<String> registered = post("/api/v1/services/register", REGISTRATION, null);
        assertThat(registered.statusCode()).isEqualTo(200);
        JsonNode registration = mapper.readTree(registered.body());
        String serviceId = registration.get("service_id").asText();
        String token = registration.get("token").asText();
        assertThat(serviceId).startsWith("text_to_image-");
        assertThat(registration.get("heartbeat_interval_seconds").asInt()).isEqualTo(30);

        String heartbeat = """
                {"token": "%s", "load": 0.4, "queue_size": 2, "processed_count": 100, "error_count": 1,
                 "cpu_usage": 55.0, "gpu_usage": 70.0, "memory_usage": 40.0}
                """.formatted(token);
        HttpResponse<String> beat = post("/api/v1/services/" + serviceId + "/heartbeat", heartbeat, null);
        assertThat(beat.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(beat.body()).get("status").asText()).isEqualTo("healthy");

        JsonNode listing = mapper.readTree(get("/api/v1/services?type=text_to_image").body());
        assertThat(listing.get("healthy").asInt()).isEqualTo(1);
        assertThat(listing.get("services").get(0).get("id").asText()).isEqualTo(serviceId);
    }

    @Test
    @DisplayName("should reject a heartbeat with a wrong token")
    void shouldRejectHeartbeatWithWrongToken() throws Exception {
        String serviceId = mapper.readTree(post("/api/v1/services/register", REGISTRATION, null).body())
                .get("service_id").asText();

        HttpResponse<String> beat = post("/api/v1/services/" + serviceId + "/heartbeat",
                "{\"token\": \"forged\"}", null);

        assertThat(beat.statusCode()).isEqualTo(401);
        assertThat(mapper.readTree(beat.body()).get("code").asInt()).isEqualTo(1002);
    }

    @Test
    @DisplayName("should serve text generation")
    void shouldServeTextGeneration() throws Exception {
        HttpResponse<String> response = post("/api/v1/inference/text-generation",
                "{\"prompt\": \"Say hello\", \"max_tokens\": 50}", "acme");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.get("provider_id").asText()).isEqualTo("stub_chat");
        assertThat(body.get("provider_type").asText()).isEqualTo("third_party");
        assertThat(body.get("text").asText()).isEqualTo("stub text");
        assertThat(body.get("usage").get("tokens_output").asInt()).isEqualTo(34);
    }

    @Test
    @DisplayName("should map validation failures to 400")
    void shouldMapValidationFailure() throws Exception {
        HttpResponse<String> response = post("/api/v1/inference/text-to-image",
                "{\"prompt\": \"a red bicycle\", \"width\": 10}", "acme");

        assertThat(response.statusCode()).isEqualTo(400);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.get("error").asText()).isEqualTo("validation");
        assertThat(body.get("request_id").asText()).isNotBlank();
    }

    @Test
    @DisplayName("should map rate limiting to 429")
    void shouldMapRateLimiting() throws Exception {
        post("/api/v1/inference/text-generation", "{\"prompt\": \"one\"}", "limited");
        post("/api/v1/inference/text-generation", "{\"prompt\": \"two\"}", "limited");

        HttpResponse<String> response = post("/api/v1/inference/text-generation",
                "{\"prompt\": \"three\"}", "limited");

        assertThat(response.statusCode()).isEqualTo(429);
        assertThat(mapper.readTree(response.body()).get("error").asText()).isEqualTo("rate_limited");
    }

    @Test
    @DisplayName("should answer 404 for an unknown inference endpoint")
    void shouldAnswerNotFoundForUnknownEndpoint() throws Exception {
        HttpResponse<String> response = post("/api/v1/inference/video", "{\"prompt\": \"x\"}", "acme");

        assertThat(response.statusCode()).isEqualTo(404);
    }

    @Test
    @DisplayName("should list budgets with their spend")
    void shouldListBudgets() throws Exception {
        HttpResponse<String> response = get("/api/v1/budgets?scope=global");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode budget = mapper.readTree(response.body()).get("budgets").get(0);
        assertThat(budget.get("id").asText()).isEqualTo("global");
        assertThat(budget.get("amount").asDouble()).isEqualTo(100.0);
        assertThat(budget.get("used").asDouble()).isZero();
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .timeout(Duration.ofSeconds(10))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String json, String tenant)
            throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri(path))
                .timeout(Duration.ofSeconds(10))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json));
        if (tenant != null) {
            builder.header("X-Tenant-ID", tenant);
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + app.getPort() + path);
    }
}
