package fr.lapetina.aiplatform.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.aiplatform.domain.model.GeneratedImage;
import fr.lapetina.aiplatform.domain.model.InferenceResponse;

import java.time.Instant;
import java.util.List;

/**
 * Wire form of a routed inference response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InferenceResult(
        String requestId,
        String feature,
        String status,
        String providerType,
        String providerId,
        String instanceId,
        String text,
        List<GeneratedImage> images,
        Usage usage,
        double cost,
        boolean fallbackUsed,
        Timing timing,
        Instant completedAt
) {

    public record Usage(int tokensInput, int tokensOutput, int images) {
    }

    public record Timing(long selectionMs, long executionMs, long totalMs) {
    }

    public static InferenceResult from(InferenceResponse response) {
        return new InferenceResult(
                response.requestId(),
                response.feature(),
                response.status(),
                response.providerType() != null ? response.providerType().wireName() : null,
                response.providerId(),
                response.instanceId(),
                response.text(),
                response.images().isEmpty() ? null : response.images(),
                new Usage(response.tokensInput(), response.tokensOutput(), response.imageCount()),
                response.cost(),
                response.fallbackUsed(),
                new Timing(response.selectionMs(), response.executionMs(), response.totalMs()),
                response.completedAt()
        );
    }
}
