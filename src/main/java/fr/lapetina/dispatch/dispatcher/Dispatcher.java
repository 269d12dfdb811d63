package fr.lapetina.dispatch.dispatcher;

import fr.lapetina.dispatch.domain.exception.MissingBindingException;
import fr.lapetina.dispatch.domain.strategy.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Coordinator that forwards every call to its bound strategy.
 *
 * The strategy is supplied by the caller and never constructed here. {@link #process}
 * neither inspects the strategy nor catches what it throws: the result and any
 * exception reach the caller unchanged.
 *
 * The binding can be swapped at runtime; a swap only affects calls that start after it.
 *
 * @param <I> input type
 * @param <O> output type
 */
public final class Dispatcher<I, O> {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final AtomicReference<Strategy<I, O>> strategyRef;

    /**
     * @throws MissingBindingException if strategy is null
     */
    public Dispatcher(Strategy<I, O> strategy) {
        this.strategyRef = new AtomicReference<>(requireBinding(strategy));
    }

    /**
     * Applies the bound strategy to the input.
     */
    public O process(I input) {
        return strategyRef.get().apply(input);
    }

    public Strategy<I, O> getStrategy() {
        return strategyRef.get();
    }

    /**
     * Binds a different strategy.
     *
     * @return The previously bound strategy
     * @throws MissingBindingException if strategy is null; the current binding is kept
     */
    public Strategy<I, O> setStrategy(Strategy<I, O> strategy) {
        Strategy<I, O> old = strategyRef.getAndSet(requireBinding(strategy));
        log.info("Dispatcher strategy changed: {} -> {}", old.getName(), strategy.getName());
        return old;
    }

    private static <I, O> Strategy<I, O> requireBinding(Strategy<I, O> strategy) {
        if (strategy == null) {
            throw new MissingBindingException("Dispatcher requires a strategy");
        }
        return strategy;
    }

    @Override
    public String toString() {
        return "Dispatcher{strategy=" + strategyRef.get().getName() + "}";
    }
}
