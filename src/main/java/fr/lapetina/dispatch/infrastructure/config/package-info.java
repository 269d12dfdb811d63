/**
 * YAML configuration for strategy wiring, with reload support.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.dispatch.infrastructure.config.DispatchConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.dispatch.infrastructure.config.ConfigLoader} - YAML loading and file watching</li>
 *   <li>{@link fr.lapetina.dispatch.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code defaultStrategy} - key bound to the default dispatcher</li>
 *   <li>{@code strategies} - key, type, enabled flag and type-specific parameters</li>
 *   <li>{@code metrics} - Prometheus metrics switch and name prefix</li>
 * </ul>
 */
package fr.lapetina.dispatch.infrastructure.config;
