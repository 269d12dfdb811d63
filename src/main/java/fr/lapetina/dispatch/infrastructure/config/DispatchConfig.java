package fr.lapetina.dispatch.infrastructure.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for strategy wiring.
 * Designed to be populated from YAML.
 */
public class DispatchConfig {

    private String defaultStrategy;
    private List<StrategyConfig> strategies = new ArrayList<>();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public String getDefaultStrategy() { return defaultStrategy; }
    public void setDefaultStrategy(String defaultStrategy) { this.defaultStrategy = defaultStrategy; }

    public List<StrategyConfig> getStrategies() { return strategies; }
    public void setStrategies(List<StrategyConfig> strategies) { this.strategies = strategies; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * A strategy to build and register under a key.
     */
    public static class StrategyConfig {
        private String key;
        private String type;
        private boolean enabled = true;
        private Map<String, Object> parameters = new HashMap<>();

        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Map<String, Object> getParameters() { return parameters; }
        public void setParameters(Map<String, Object> parameters) { this.parameters = parameters; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "strategy_dispatch";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
