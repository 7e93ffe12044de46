/**
 * Configuration loading and hot-reload support.
 *
 * <p>YAML files are parsed by SnakeYAML into {@link fr.lapetina.aiplatform.infrastructure.config.ControlPlaneConfig},
 * then converted into the settings records of each component.
 *
 * <h2>Hot-Reload</h2>
 * <p>When the configuration file changes, listeners receive the old and new trees. The control plane
 * swaps the feature catalogue, API keys and rate limits; timing settings require a restart.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog, worker threads)</li>
 *   <li>{@code registry} - Heartbeat interval, timeout and error rate threshold</li>
 *   <li>{@code budget} - Reconciliation interval and default budgets</li>
 *   <li>{@code scaler} - Scale loop and per-feature scale configs</li>
 *   <li>{@code rateLimit} - Algorithm, default limit and overrides</li>
 *   <li>{@code events} - Ring buffer and watcher queue sizes</li>
 *   <li>{@code selfHosted} - Instance HTTP client and circuit breaker</li>
 *   <li>{@code features} - Feature catalogue with providers, routing and cost</li>
 *   <li>{@code keys} - Vendor API keys and the variables holding their secrets</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.aiplatform.infrastructure.config;
