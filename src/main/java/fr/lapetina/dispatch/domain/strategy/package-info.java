/**
 * Capability interface, keyed registry and configuration-driven factory for strategies.
 *
 * <p>A {@link fr.lapetina.dispatch.domain.strategy.Strategy} is one interchangeable behavior.
 * The {@link fr.lapetina.dispatch.domain.strategy.StrategyRegistry} replaces a string-keyed
 * conditional: adding a behavior is a new {@code register} call, never an edit of existing
 * dispatch code.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * StrategyRegistry<Double, Double> registry = new StrategyRegistry<>();
 * registry.register("percentage", new PercentageDiscountStrategy(0.10));
 * registry.register("fixed", new FixedDiscountStrategy(15));
 *
 * double discount = registry.resolve("percentage").apply(100.0); // 10.0
 * registry.resolve("unknown");                                   // StrategyNotFoundException
 * }</pre>
 *
 * @see fr.lapetina.dispatch.domain.strategy.Strategy
 * @see fr.lapetina.dispatch.domain.strategy.StrategyRegistry
 * @see fr.lapetina.dispatch.domain.strategy.StrategyFactory
 */
package fr.lapetina.dispatch.domain.strategy;
