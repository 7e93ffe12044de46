package fr.lapetina.aiplatform.infrastructure.budget;

import fr.lapetina.aiplatform.domain.model.ProviderType;

import java.time.Instant;

/**
 * One billed request.
 *
 * @param costType {@code self_hosted} or {@code third_party_<vendor>}
 */
public record CostRecord(
        String requestId,
        String feature,
        String tenantId,
        String providerId,
        String costType,
        double amount,
        Instant timestamp
) {

    public static String costType(ProviderType type, String vendor) {
        if (type == ProviderType.SELF_HOSTED) {
            return "self_hosted";
        }
        return "third_party_" + vendor;
    }
}
