package fr.lapetina.dispatch.infrastructure.metrics;

import fr.lapetina.dispatch.domain.exception.DispatchException;
import fr.lapetina.dispatch.domain.model.ErrorType;
import fr.lapetina.dispatch.domain.strategy.Strategy;

import java.time.Duration;
import java.util.Objects;

/**
 * Decorator that records invocation metrics around another strategy.
 *
 * Results and exceptions pass through untouched; failures are counted and rethrown.
 *
 * @param <I> input type
 * @param <O> output type
 */
public final class MeteredStrategy<I, O> implements Strategy<I, O> {

    private final String key;
    private final Strategy<I, O> delegate;
    private final MetricsRegistry metrics;

    public MeteredStrategy(String key, Strategy<I, O> delegate, MetricsRegistry metrics) {
        this.key = Objects.requireNonNull(key, "Strategy key is required");
        this.delegate = Objects.requireNonNull(delegate, "Delegate strategy is required");
        this.metrics = Objects.requireNonNull(metrics, "Metrics registry is required");
    }

    @Override
    public O apply(I input) {
        long start = System.nanoTime();
        try {
            O result = delegate.apply(input);
            metrics.incrementInvocationCount(key, MetricsRegistry.OUTCOME_SUCCESS);
            return result;
        } catch (RuntimeException e) {
            metrics.incrementInvocationCount(key, MetricsRegistry.OUTCOME_FAILURE);
            metrics.incrementErrorCount(key, errorTypeOf(e));
            throw e;
        } finally {
            metrics.recordLatency(key, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private static ErrorType errorTypeOf(RuntimeException e) {
        return e instanceof DispatchException dispatchException
                ? dispatchException.getErrorType()
                : ErrorType.INTERNAL_ERROR;
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    public Strategy<I, O> getDelegate() {
        return delegate;
    }

    @Override
    public String toString() {
        return "MeteredStrategy{key=" + key + ", delegate=" + delegate + "}";
    }
}
