/**
 * Strategy Dispatch - pluggable strategy registry and dispatcher.
 *
 * <p>Behavior is delegated to interchangeable strategies, either injected into a
 * {@link fr.lapetina.dispatch.dispatcher.Dispatcher} at construction time or selected per call by
 * key through a {@link fr.lapetina.dispatch.dispatcher.KeyedDispatcher}.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.dispatch.DispatchFactory} - wires registry and dispatchers from YAML</li>
 *   <li>{@link fr.lapetina.dispatch.StrategyDispatchApplication} - command-line entry point</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * StrategyRegistry<Double, Double> registry = new StrategyRegistry<>();
 * registry.register("percentage", new PercentageDiscountStrategy(0.10));
 *
 * Dispatcher<Double, Double> dispatcher = new Dispatcher<>(registry.resolve("percentage"));
 * dispatcher.process(100.0); // 10.0
 * }</pre>
 *
 * @see fr.lapetina.dispatch.domain.strategy.StrategyRegistry
 * @see fr.lapetina.dispatch.dispatcher.Dispatcher
 */
package fr.lapetina.dispatch;
