/**
 * Provider selection strategies for routing a feature request.
 *
 * <p>Strategies follow the Strategy pattern and are stateless apart from their random source,
 * so one instance serves every request thread.
 *
 * <h2>Available Strategies</h2>
 * <table border="1">
 *   <tr><th>Strategy</th><th>Description</th></tr>
 *   <tr><td>{@code priority}</td><td>Lowest priority value wins, ties broken at random</td></tr>
 *   <tr><td>{@code weighted}</td><td>Random pick proportional to provider weights</td></tr>
 *   <tr><td>{@code cost_based}</td><td>Self-hosted first, then the cheapest third-party price</td></tr>
 * </table>
 *
 * <h2>Custom Strategies</h2>
 * <p>Implement {@link fr.lapetina.aiplatform.domain.strategy.ProviderSelectionStrategy} and register
 * with {@link fr.lapetina.aiplatform.domain.strategy.StrategyFactory}.
 *
 * <p>{@link fr.lapetina.aiplatform.domain.strategy.LeastLoadedInstanceSelector} then picks the
 * instance once a self-hosted provider has been chosen.
 *
 * @see fr.lapetina.aiplatform.domain.strategy.StrategyFactory
 */
package fr.lapetina.aiplatform.domain.strategy;
