/**
 * Coordinators that delegate work to strategies without knowing their concrete type.
 *
 * <ul>
 *   <li>{@link fr.lapetina.dispatch.dispatcher.Dispatcher} - bound to one strategy, injected at construction</li>
 *   <li>{@link fr.lapetina.dispatch.dispatcher.KeyedDispatcher} - selects the strategy per call by registry key</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Dispatcher<Double, Double> checkout = new Dispatcher<>(registry.resolve("percentage"));
 * checkout.process(100.0);                            // 10.0
 * checkout.setStrategy(registry.resolve("fixed"));
 * checkout.process(100.0);                            // 15.0
 * }</pre>
 */
package fr.lapetina.dispatch.dispatcher;
