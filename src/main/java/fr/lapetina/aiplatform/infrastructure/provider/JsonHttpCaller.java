package fr.lapetina.aiplatform.infrastructure.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.aiplatform.domain.exception.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

/**
 * Blocking JSON-over-HTTP POST shared by the provider clients.
 *
 * Failures become {@link ProviderException}: 429, 5xx and I/O errors are
 * retryable, other 4xx are not.
 */
final class JsonHttpCaller {

    private static final Logger log = LoggerFactory.getLogger(JsonHttpCaller.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    JsonHttpCaller(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = objectMapper();
    }

    static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    ObjectMapper mapper() {
        return objectMapper;
    }

    JsonNode post(String providerId, URI uri, Object body, Map<String, String> headers, Duration timeout) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(providerId, "serialization_error",
                    "Failed to serialize request: " + e.getOriginalMessage(), false, e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload));
        headers.forEach(builder::header);

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new ProviderException(providerId, "timeout", "Request timed out: " + uri, true, e);
        } catch (ConnectException e) {
            throw new ProviderException(providerId, "connection_refused", "Connection refused: " + uri, true, e);
        } catch (IOException e) {
            throw new ProviderException(providerId, "io_error", "I/O error calling " + uri + ": " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(providerId, "interrupted", "Interrupted calling " + uri, false, e);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            try {
                return objectMapper.readTree(response.body());
            } catch (JsonProcessingException e) {
                throw new ProviderException(providerId, "invalid_response",
                        "Unparseable response from " + uri, false, e);
            }
        }

        boolean retryable = status == 429 || status >= 500;
        String message = errorMessage(response.body(), status);
        log.warn("Provider call failed: providerId={}, uri={}, status={}, retryable={}",
                providerId, uri, status, retryable);
        throw new ProviderException(providerId, "http_" + status, message, retryable);
    }

    private String errorMessage(String body, int status) {
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode error = node.path("error");
            if (error.isTextual()) {
                return error.asText();
            }
            if (error.path("message").isTextual()) {
                return error.path("message").asText();
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Error body is not JSON: status={}", status);
        }
        return "HTTP " + status;
    }
}
