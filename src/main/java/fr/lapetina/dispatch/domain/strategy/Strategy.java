package fr.lapetina.dispatch.domain.strategy;

import java.util.Objects;
import java.util.function.Function;

/**
 * Capability interface implemented by every interchangeable unit of behavior.
 *
 * Implementations should be immutable once constructed: a single instance may be
 * registered under several keys and bound to several dispatchers at the same time,
 * and will then be called from multiple threads concurrently.
 *
 * @param <I> input value type (e.g. an amount)
 * @param <O> output value type, {@link Void} for side-effect-only strategies
 */
@FunctionalInterface
public interface Strategy<I, O> {

    /**
     * Applies this strategy to the given input.
     *
     * @param input The domain value to process
     * @return The computed value
     * @throws fr.lapetina.dispatch.domain.exception.InvalidInputException if the input is outside
     *         the range this strategy accepts
     */
    O apply(I input);

    /**
     * Returns the name of this strategy for logging and metrics.
     */
    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Wraps a function as a strategy with a readable name.
     *
     * @param name Name reported by {@link #getName()}
     * @param function Behavior to delegate to
     */
    static <I, O> Strategy<I, O> named(String name, Function<I, O> function) {
        Objects.requireNonNull(name, "Strategy name is required");
        Objects.requireNonNull(function, "Strategy function is required");
        return new Strategy<>() {
            @Override
            public O apply(I input) {
                return function.apply(input);
            }

            @Override
            public String getName() {
                return name;
            }

            @Override
            public String toString() {
                return "Strategy[" + name + "]";
            }
        };
    }
}
