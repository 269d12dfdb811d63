package fr.lapetina.dispatch.dispatcher;

import fr.lapetina.dispatch.domain.exception.MissingBindingException;
import fr.lapetina.dispatch.domain.strategy.StrategyRegistry;

/**
 * Dispatcher that picks its strategy per call from a registry.
 *
 * {@code process(key, input)} is exactly {@code registry.resolve(key).apply(input)}.
 * Registrations made after construction are visible to later calls.
 *
 * @param <I> input type
 * @param <O> output type
 */
public final class KeyedDispatcher<I, O> {

    private final StrategyRegistry<I, O> registry;

    /**
     * @throws MissingBindingException if registry is null
     */
    public KeyedDispatcher(StrategyRegistry<I, O> registry) {
        if (registry == null) {
            throw new MissingBindingException("Keyed dispatcher requires a strategy registry");
        }
        this.registry = registry;
    }

    /**
     * Resolves the strategy for the key and applies it to the input.
     *
     * @throws fr.lapetina.dispatch.domain.exception.StrategyNotFoundException if the key is unknown
     */
    public O process(String key, I input) {
        return registry.resolve(key).apply(input);
    }

    /**
     * Returns a dispatcher bound to the strategy currently registered under the key.
     * Later re-registrations of the key do not affect the returned dispatcher.
     */
    public Dispatcher<I, O> dispatcherFor(String key) {
        return new Dispatcher<>(registry.resolve(key));
    }

    public StrategyRegistry<I, O> getRegistry() {
        return registry;
    }
}
