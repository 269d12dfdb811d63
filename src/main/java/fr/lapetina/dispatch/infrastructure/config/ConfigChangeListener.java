package fr.lapetina.dispatch.infrastructure.config;

/**
 * Listener interface for configuration changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called when configuration has been reloaded.
     *
     * @param oldConfig The previous configuration (null on initial load)
     * @param newConfig The new configuration
     * @throws ConfigLoader.ConfigurationException to reject the new configuration; the loader
     *         then keeps the previous one and stops notifying further listeners
     */
    void onConfigChanged(DispatchConfig oldConfig, DispatchConfig newConfig);
}
