package fr.lapetina.aiplatform.infrastructure.provider;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Map;

/**
 * Everything needed to build a third-party provider client.
 *
 * @param apiKey plaintext secret, never logged
 */
public record ProviderSettings(
        String vendor,
        String keyId,
        String apiKey,
        String endpoint,
        String model,
        Duration requestTimeout,
        Map<String, String> extra
) {

    public ProviderSettings {
        if (vendor == null || vendor.isBlank()) {
            throw new IllegalArgumentException("Provider vendor is required");
        }
        requestTimeout = requestTimeout != null ? requestTimeout : Duration.ofSeconds(60);
        extra = extra != null ? Map.copyOf(extra) : Map.of();
    }

    /**
     * Identifies the client slot for these settings. The secret is not part
     * of it, so a rotated secret lands on the same slot.
     */
    String cacheKey() {
        return vendor + "|" + keyId + "|" + endpoint + "|" + model;
    }

    /**
     * Short SHA-256 digest of the secret, safe to keep next to a cached client.
     */
    String secretFingerprint() {
        if (apiKey == null) {
            return "";
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(apiKey.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return "ProviderSettings{vendor='" + vendor + "', keyId='" + keyId
                + "', endpoint='" + endpoint + "', model='" + model + "'}";
    }
}
