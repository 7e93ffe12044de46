package fr.lapetina.aiplatform.infrastructure.routing;

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata of a vendor API key. The secret itself is only handed out by
 * {@link KeyManager#getPlaintextKey(ApiKey)}.
 */
public record ApiKey(
        String id,
        String vendor,
        String service,
        String alias,
        Tier tier,
        boolean enabled,
        Instant createdAt,
        Instant expiresAt
) {

    /**
     * Precedence class of a key; lower ordinal is tried first.
     */
    public enum Tier {
        PRIMARY,
        BACKUP,
        OVERFLOW;

        public static Tier fromString(String value) {
            if (value == null || value.isBlank()) {
                return PRIMARY;
            }
            return valueOf(value.trim().toUpperCase());
        }
    }

    public ApiKey {
        Objects.requireNonNull(id, "Key ID is required");
        Objects.requireNonNull(vendor, "Key vendor is required");
        tier = tier != null ? tier : Tier.PRIMARY;
        createdAt = createdAt != null ? createdAt : Instant.EPOCH;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    /**
     * A key with no service applies to every service of its vendor.
     */
    public boolean covers(String vendor, String service) {
        return this.vendor.equalsIgnoreCase(vendor)
                && (this.service == null || this.service.isBlank() || this.service.equals(service));
    }
}
