package fr.lapetina.aiplatform.infrastructure.scaler;

import fr.lapetina.aiplatform.domain.exception.ControlPlaneException;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ClusterClient} over the Kubernetes API. Uses in-cluster or kubeconfig
 * credentials as resolved by the fabric8 client.
 */
public final class KubernetesClusterClient implements ClusterClient {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClusterClient.class);

    private final KubernetesClient client;

    public KubernetesClusterClient() {
        this(new KubernetesClientBuilder().build());
    }

    public KubernetesClusterClient(KubernetesClient client) {
        this.client = client;
        log.info("Kubernetes cluster client initialized: master={}", client.getMasterUrl());
    }

    @Override
    public int getReplicas(String deployment, String namespace) {
        Deployment current = fetch(deployment, namespace);
        Integer replicas = current.getSpec() != null ? current.getSpec().getReplicas() : null;
        return replicas != null ? replicas : 0;
    }

    @Override
    public void setReplicas(String deployment, String namespace, int replicas) {
        fetch(deployment, namespace);
        try {
            client.apps().deployments()
                    .inNamespace(namespace)
                    .withName(deployment)
                    .scale(replicas);
            log.info("Deployment scaled: namespace={}, deployment={}, replicas={}", namespace, deployment, replicas);
        } catch (KubernetesClientException e) {
            throw ControlPlaneException.unavailable(
                    "Failed to scale deployment " + namespace + "/" + deployment + ": " + e.getMessage(), e);
        }
    }

    private Deployment fetch(String deployment, String namespace) {
        Deployment current;
        try {
            current = client.apps().deployments()
                    .inNamespace(namespace)
                    .withName(deployment)
                    .get();
        } catch (KubernetesClientException e) {
            throw ControlPlaneException.unavailable(
                    "Failed to read deployment " + namespace + "/" + deployment + ": " + e.getMessage(), e);
        }
        if (current == null) {
            throw ControlPlaneException.notFound("Deployment not found: " + namespace + "/" + deployment);
        }
        return current;
    }

    @Override
    public void close() {
        client.close();
        log.info("Kubernetes cluster client closed");
    }
}
