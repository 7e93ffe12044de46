package fr.lapetina.aiplatform.infrastructure.scaler;

/**
 * Replica control for the deployments backing self-hosted features.
 *
 * Implementations throw {@link fr.lapetina.aiplatform.domain.exception.ControlPlaneException}
 * with NOT_FOUND for a missing deployment and UNAVAILABLE when the cluster cannot be reached.
 */
public interface ClusterClient extends AutoCloseable {

    int getReplicas(String deployment, String namespace);

    void setReplicas(String deployment, String namespace, int replicas);

    @Override
    default void close() {
    }
}
