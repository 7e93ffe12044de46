package fr.lapetina.aiplatform;

import fr.lapetina.aiplatform.api.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the AI platform control plane.
 */
public class ControlPlaneApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ControlPlaneApplication.class);

    private final ControlPlaneFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public ControlPlaneApplication(String configPath) throws Exception {
        this(ControlPlaneFactory.create(configPath));
    }

    ControlPlaneApplication(ControlPlaneFactory factory) throws Exception {
        log.info("Starting AI platform control plane...");

        this.factory = factory.start();

        this.httpServer = new HttpServer(
                factory.getConfig().getServer(),
                factory.getGateway(),
                factory.getServiceRegistry(),
                factory.getAdmissionController(),
                factory.getAutoScaler(),
                factory.getMetricsRegistry(),
                factory.getConfigLoader()
        );

        log.info("Control plane initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Control plane started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public ControlPlaneFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    @Override
    public void close() {
        log.info("Shutting down control plane...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Control plane shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            ControlPlaneApplication app = new ControlPlaneApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start control plane", e);
            System.exit(1);
        }
    }
}
