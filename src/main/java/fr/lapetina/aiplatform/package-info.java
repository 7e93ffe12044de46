/**
 * AI Platform Control Plane - admission, routing and capacity management for AI inference.
 *
 * <p>This library fronts a fleet of self-hosted inference instances and third-party vendor APIs.
 * Requests pass validation, rate limiting and a budget check before the routing engine picks a
 * provider for the requested feature.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aiplatform.ControlPlaneFactory} - Main entry point for creating
 *       a fully-wired control plane from YAML configuration</li>
 *   <li>{@link fr.lapetina.aiplatform.ControlPlaneApplication} - Standalone HTTP server
 *       exposing the registry, inference, budget and scaling endpoints</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (ControlPlaneFactory factory = ControlPlaneFactory.create("config.yaml").start()) {
 *     InferenceRequest request = InferenceRequest.of("text_to_image",
 *             TextToImageRequest.of("a red bicycle"));
 *     InferenceResponse response = factory.getGateway().handle(request);
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Service registry with heartbeat-driven health states</li>
 *   <li>Hierarchical budgets with alert thresholds</li>
 *   <li>Priority, weighted and cost-based provider selection with fallback</li>
 *   <li>Queue and utilisation driven autoscaling, including scale to zero</li>
 *   <li>Hot-reload of features, keys and rate limits</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.aiplatform.ControlPlaneFactory
 * @see fr.lapetina.aiplatform.api.GatewayService
 */
package fr.lapetina.aiplatform;
