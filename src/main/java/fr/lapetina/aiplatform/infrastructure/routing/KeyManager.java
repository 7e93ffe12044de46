package fr.lapetina.aiplatform.infrastructure.routing;

import java.util.Optional;

/**
 * Source of vendor API keys for the third-party path.
 */
public interface KeyManager {

    /**
     * Returns the usable key of highest precedence for a vendor and service.
     */
    Optional<ApiKey> getActiveKey(String vendor, String service);

    /**
     * Resolves the secret of a key.
     *
     * @throws fr.lapetina.aiplatform.domain.exception.ControlPlaneException UNAVAILABLE when the secret cannot be read
     */
    String getPlaintextKey(ApiKey key);

    void recordUsage(String keyId, KeyUsage usage);
}
