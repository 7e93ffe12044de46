package fr.lapetina.aiplatform.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import fr.lapetina.aiplatform.domain.exception.ProviderException;
import fr.lapetina.aiplatform.domain.model.GeneratedImage;
import fr.lapetina.aiplatform.domain.model.InstanceSnapshot;
import fr.lapetina.aiplatform.domain.request.FeatureKind;
import fr.lapetina.aiplatform.domain.request.ImageEditRequest;
import fr.lapetina.aiplatform.domain.request.ImageStylizationRequest;
import fr.lapetina.aiplatform.domain.request.TextGenerationRequest;
import fr.lapetina.aiplatform.domain.request.TextToImageRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HTTP client for self-hosted inference instances.
 *
 * An instance exposes {@code POST /v1/<feature-path>} taking the typed
 * request as snake_case JSON and answering with text and/or images.
 * Each instance gets its own circuit breaker.
 */
public class SelfHostedClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SelfHostedClient.class);

    private final JsonHttpCaller http;
    private final Map<String, CircuitBreaker> circuitBreakers = new ConcurrentHashMap<>();
    private final Duration requestTimeout;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    public SelfHostedClient(Duration connectTimeout, Duration requestTimeout, int failureThreshold,
                            Duration recoveryTimeout, Clock clock) {
        this.http = new JsonHttpCaller(connectTimeout);
        this.requestTimeout = requestTimeout;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    public SelfHostedClient() {
        this(Duration.ofSeconds(5), Duration.ofSeconds(120), 5, Duration.ofSeconds(30), Clock.systemUTC());
    }

    /**
     * Returns a provider executing calls against the given instance.
     */
    public Provider bind(InstanceSnapshot instance) {
        return new InstanceProvider(instance);
    }

    public CircuitBreaker getCircuitBreaker(String instanceId) {
        return circuitBreakers.computeIfAbsent(instanceId, id ->
                new CircuitBreaker(id, failureThreshold, recoveryTimeout, 3, clock));
    }

    @Override
    public void close() {
        circuitBreakers.clear();
    }

    record InstanceReply(String text, List<GeneratedImage> images, int tokensInput, int tokensOutput, String model) {
    }

    private final class InstanceProvider implements Provider {

        private final InstanceSnapshot instance;

        private InstanceProvider(InstanceSnapshot instance) {
            this.instance = instance;
        }

        @Override
        public String getName() {
            return instance.id();
        }

        @Override
        public Set<FeatureKind> capabilities() {
            return EnumSet.allOf(FeatureKind.class);
        }

        @Override
        public TextResult generateText(TextGenerationRequest request) {
            InstanceReply reply = call(FeatureKind.TEXT_GENERATION, request);
            return new TextResult(reply.text(), reply.tokensInput(), reply.tokensOutput(), reply.model());
        }

        @Override
        public ImageResult generateImage(TextToImageRequest request) {
            InstanceReply reply = call(FeatureKind.TEXT_TO_IMAGE, request);
            return new ImageResult(reply.images(), reply.model());
        }

        @Override
        public ImageResult editImage(ImageEditRequest request) {
            InstanceReply reply = call(FeatureKind.IMAGE_EDIT, request);
            return new ImageResult(reply.images(), reply.model());
        }

        @Override
        public ImageResult stylizeImage(ImageStylizationRequest request) {
            InstanceReply reply = call(FeatureKind.IMAGE_STYLIZATION, request);
            return new ImageResult(reply.images(), reply.model());
        }

        @Override
        public boolean healthCheck() {
            return getCircuitBreaker(instance.id()).allowRequest();
        }

        private InstanceReply call(FeatureKind kind, Object body) {
            CircuitBreaker breaker = getCircuitBreaker(instance.id());
            if (!breaker.allowRequest()) {
                throw new ProviderException(instance.id(), "circuit_open",
                        "Circuit breaker is open for instance: " + instance.id(), true);
            }

            URI uri = instance.baseUri().resolve("/v1/" + kind.path());
            log.debug("Calling instance: instanceId={}, uri={}", instance.id(), uri);
            JsonNode node;
            try {
                node = http.post(instance.id(), uri, body, Map.of(), requestTimeout);
            } catch (ProviderException e) {
                if (e.isRetryable()) {
                    breaker.recordFailure();
                }
                throw e;
            }
            breaker.recordSuccess();

            try {
                return http.mapper().treeToValue(node, InstanceReply.class);
            } catch (JsonProcessingException e) {
                throw new ProviderException(instance.id(), "invalid_response",
                        "Unexpected response shape from instance " + instance.id(), false, e);
            }
        }
    }
}
