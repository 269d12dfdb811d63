package fr.lapetina.dispatch;

import fr.lapetina.dispatch.dispatcher.Dispatcher;
import fr.lapetina.dispatch.dispatcher.KeyedDispatcher;
import fr.lapetina.dispatch.domain.exception.MissingBindingException;
import fr.lapetina.dispatch.domain.strategy.Strategy;
import fr.lapetina.dispatch.domain.strategy.StrategyFactory;
import fr.lapetina.dispatch.domain.strategy.StrategyRegistry;
import fr.lapetina.dispatch.domain.strategy.discount.DiscountStrategies;
import fr.lapetina.dispatch.infrastructure.config.ConfigLoader;
import fr.lapetina.dispatch.infrastructure.config.ConfigLoader.ConfigurationException;
import fr.lapetina.dispatch.infrastructure.config.DispatchConfig;
import fr.lapetina.dispatch.infrastructure.metrics.MeteredStrategy;
import fr.lapetina.dispatch.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Composition root: builds a registry and dispatchers from YAML configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (DispatchFactory factory = DispatchFactory.create("dispatch.yaml")) {
 *     double discount = factory.getKeyedDispatcher().process("percentage", 100.0);
 * }
 * }</pre>
 *
 * On reload, strategies are rebuilt and re-registered, keys that disappeared are
 * unregistered and the default dispatcher is rebound. A configuration that fails
 * validation is rejected before anything is changed, and the config loader keeps
 * reporting the configuration in use. The metrics prefix is read once, at construction.
 */
public class DispatchFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatchFactory.class);

    private final ConfigLoader configLoader;
    private final StrategyFactory<Double, Double> strategyFactory;
    private final StrategyRegistry<Double, Double> registry;
    private final KeyedDispatcher<Double, Double> keyedDispatcher;
    private final MetricsRegistry metricsRegistry;

    private volatile DispatchConfig config;
    private volatile Dispatcher<Double, Double> defaultDispatcher;

    protected DispatchFactory(String configPath, StrategyFactory<Double, Double> strategyFactory) {
        log.info("Initializing DispatchFactory from config: {}", configPath);

        this.strategyFactory = Objects.requireNonNull(strategyFactory, "Strategy factory is required");
        this.configLoader = new ConfigLoader(configPath);
        DispatchConfig initial;
        try {
            initial = configLoader.load();
        } catch (RuntimeException e) {
            configLoader.close();
            throw e;
        }

        DispatchConfig.MetricsConfig metricsConfig =
                initial.getMetrics() != null ? initial.getMetrics() : new DispatchConfig.MetricsConfig();
        this.metricsRegistry = new MetricsRegistry(metricsConfig.getPrefix());
        this.registry = new StrategyRegistry<>();
        this.registry.addListener(event -> metricsRegistry.setRegisteredStrategies(registry.size()));
        this.keyedDispatcher = new KeyedDispatcher<>(registry);

        try {
            applyConfig(initial);
            configLoader.addListener(this::onConfigChanged);
        } catch (RuntimeException e) {
            close();
            throw e;
        }

        log.info("DispatchFactory initialized with strategies {}", registry.keys());
    }

    /**
     * Creates a factory from the configuration file, with the built-in discount types.
     */
    public static DispatchFactory create(String configPath) {
        return new DispatchFactory(configPath, DiscountStrategies.factory());
    }

    /**
     * Creates a factory from the configuration file, with caller-supplied strategy types.
     */
    public static DispatchFactory create(String configPath, StrategyFactory<Double, Double> strategyFactory) {
        return new DispatchFactory(configPath, strategyFactory);
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public DispatchFactory start() {
        configLoader.startWatching();
        return this;
    }

    public StrategyRegistry<Double, Double> getRegistry() {
        return registry;
    }

    public KeyedDispatcher<Double, Double> getKeyedDispatcher() {
        return keyedDispatcher;
    }

    /**
     * Returns the dispatcher bound to the configured default strategy.
     *
     * @throws MissingBindingException if the configuration names no default strategy
     */
    public Dispatcher<Double, Double> getDispatcher() {
        Dispatcher<Double, Double> dispatcher = defaultDispatcher;
        if (dispatcher == null) {
            throw new MissingBindingException("No defaultStrategy configured");
        }
        return dispatcher;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public DispatchConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private void onConfigChanged(DispatchConfig oldConfig, DispatchConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying updates...");
        applyConfig(newConfig);
        log.info("Configuration updates applied, strategies {}", registry.keys());
    }

    private synchronized void applyConfig(DispatchConfig newConfig) {
        Map<String, Strategy<Double, Double>> built = buildStrategies(newConfig);

        String prefix = newConfig.getMetrics() != null ? newConfig.getMetrics().getPrefix() : null;
        if (prefix != null && !prefix.equals(metricsRegistry.getPrefix())) {
            log.warn("Metrics prefix change {} -> {} requires a restart, keeping {}",
                    metricsRegistry.getPrefix(), prefix, metricsRegistry.getPrefix());
        }

        String defaultKey = newConfig.getDefaultStrategy();
        if (defaultKey != null && !built.containsKey(defaultKey)) {
            throw new ConfigurationException("Default strategy '" + defaultKey + "' is not configured");
        }

        built.forEach(registry::register);
        for (String key : registry.keys()) {
            if (!built.containsKey(key)) {
                registry.unregister(key);
            }
        }

        if (defaultKey == null) {
            defaultDispatcher = null;
        } else if (defaultDispatcher == null) {
            defaultDispatcher = new Dispatcher<>(registry.resolve(defaultKey));
        } else {
            defaultDispatcher.setStrategy(registry.resolve(defaultKey));
        }

        this.config = newConfig;
    }

    private Map<String, Strategy<Double, Double>> buildStrategies(DispatchConfig newConfig) {
        Map<String, Strategy<Double, Double>> built = new LinkedHashMap<>();
        boolean metered = newConfig.getMetrics() != null && newConfig.getMetrics().isEnabled();
        List<DispatchConfig.StrategyConfig> entries =
                newConfig.getStrategies() != null ? newConfig.getStrategies() : List.of();

        for (DispatchConfig.StrategyConfig strategyConfig : entries) {
            String key = strategyConfig.getKey();
            if (key == null || key.isBlank()) {
                throw new ConfigurationException("Strategy entry without a key (type=" + strategyConfig.getType() + ")");
            }
            if (!strategyConfig.isEnabled()) {
                log.debug("Skipping disabled strategy: {}", key);
                continue;
            }
            if (built.containsKey(key)) {
                throw new ConfigurationException("Duplicate strategy key: " + key);
            }

            Strategy<Double, Double> strategy;
            try {
                strategy = strategyFactory.create(strategyConfig.getType(), strategyConfig.getParameters())
                        .orElseThrow(() -> new ConfigurationException(
                                "Unknown strategy type '" + strategyConfig.getType() + "' for key " + key
                                        + ", known types " + strategyFactory.getRegisteredTypes()));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid parameters for strategy " + key + ": " + e.getMessage(), e);
            }

            built.put(key, metered ? new MeteredStrategy<>(key, strategy, metricsRegistry) : strategy);
        }
        return built;
    }

    @Override
    public void close() {
        log.info("Shutting down DispatchFactory...");

        try {
            configLoader.close();
        } catch (RuntimeException e) {
            log.warn("Error closing config loader", e);
        }

        try {
            metricsRegistry.close();
        } catch (RuntimeException e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("DispatchFactory shut down");
    }
}
