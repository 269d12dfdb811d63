package fr.lapetina.dispatch.infrastructure.metrics;

import fr.lapetina.dispatch.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Invocation counters per strategy key and outcome
 * - Error counters per strategy key and error type
 * - Latency timers per strategy key
 * - A gauge of registered strategies
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> invocationCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();

    private final AtomicInteger registeredStrategies = new AtomicInteger(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        Gauge.builder(prefix + "_registered_strategies", registeredStrategies, AtomicInteger::get)
                .description("Number of strategies currently registered")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("strategy_dispatch");
    }

    /**
     * Increments the invocation counter for a strategy key and outcome.
     */
    public void incrementInvocationCount(String strategyKey, String outcome) {
        String key = strategyKey + ":" + outcome;
        invocationCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_strategy_invocations_total")
                        .description("Total number of strategy invocations")
                        .tag("strategy", strategyKey)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    /**
     * Increments the error counter for a strategy key and error type.
     */
    public void incrementErrorCount(String strategyKey, ErrorType errorType) {
        String key = strategyKey + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_strategy_errors_total")
                        .description("Total number of strategy errors")
                        .tag("strategy", strategyKey)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Records how long one strategy invocation took.
     */
    public void recordLatency(String strategyKey, Duration latency) {
        latencyTimers.computeIfAbsent(strategyKey, k ->
                Timer.builder(prefix + "_strategy_latency")
                        .description("Strategy invocation latency")
                        .tag("strategy", strategyKey)
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Updates the registered strategy gauge.
     */
    public void setRegisteredStrategies(int value) {
        registeredStrategies.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public void close() {
        registry.close();
    }
}
