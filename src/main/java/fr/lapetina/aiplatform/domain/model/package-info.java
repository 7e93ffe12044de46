/**
 * Domain model classes for the feature catalogue and the self-hosted fleet.
 *
 * <p>Everything in this package is an immutable record or enum and safe to share between threads.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aiplatform.domain.model.Feature} - A servable capability with its providers, routing policy and cost</li>
 *   <li>{@link fr.lapetina.aiplatform.domain.model.ProviderConfig} - One self-hosted or third-party way of serving a feature</li>
 *   <li>{@link fr.lapetina.aiplatform.domain.model.ServiceInstance} - A registered self-hosted instance</li>
 *   <li>{@link fr.lapetina.aiplatform.domain.model.InstanceSnapshot} - Read-only view of an instance handed to callers</li>
 *   <li>{@link fr.lapetina.aiplatform.domain.model.HealthState} - Instance health states (HEALTHY, DEGRADED, UNHEALTHY, ...)</li>
 *   <li>{@link fr.lapetina.aiplatform.domain.model.ErrorKind} - Categorized error kinds with their HTTP status</li>
 * </ul>
 *
 * @see fr.lapetina.aiplatform.domain.model.Feature
 */
package fr.lapetina.aiplatform.domain.model;
