package fr.lapetina.aiplatform.infrastructure.registry;

import fr.lapetina.aiplatform.domain.model.Capabilities;
import fr.lapetina.aiplatform.domain.model.Performance;
import fr.lapetina.aiplatform.domain.model.Resources;

/**
 * Registration call of a self-hosted instance.
 */
public record RegistrationRequest(
        String serviceType,
        String version,
        String hostname,
        String ip,
        int port,
        Capabilities capabilities,
        Resources resources,
        Performance performance
) {
}
