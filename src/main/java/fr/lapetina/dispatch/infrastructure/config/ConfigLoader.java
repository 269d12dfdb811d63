package fr.lapetina.dispatch.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads {@link DispatchConfig} from YAML.
 *
 * The path is tried on the file system first, then on the classpath.
 * Listeners are told about every successful load; a file watcher can
 * trigger reloads when the file changes on disk.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<DispatchConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(DispatchConfig.class, new LoaderOptions()));
    }

    /**
     * Loads configuration from file or classpath and notifies listeners.
     *
     * @throws ConfigurationException if the file is missing or cannot be parsed,
     *         or a listener rejected it; the current configuration is then kept
     */
    public DispatchConfig load() {
        return apply(loadFromPath());
    }

    /**
     * Loads configuration from an input stream and notifies listeners.
     *
     * @throws ConfigurationException if the stream cannot be parsed or a listener rejected it
     */
    public DispatchConfig loadFromStream(InputStream inputStream) {
        return apply(parse(inputStream, "stream"));
    }

    private DispatchConfig apply(DispatchConfig config) {
        DispatchConfig previous = currentConfig.getAndSet(config);
        try {
            notifyListeners(previous, config);
        } catch (ConfigurationException e) {
            // A listener rejected the new configuration
            currentConfig.compareAndSet(config, previous);
            throw e;
        }
        return config;
    }

    private DispatchConfig loadFromPath() {
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                lastModified = Files.getLastModifiedTime(configPath).toMillis();
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private DispatchConfig parse(InputStream is, String source) {
        try {
            DispatchConfig config = yaml.load(is);
            // An empty document yields null
            return config != null ? config : new DispatchConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns the most recently loaded configuration, or null before the first load.
     */
    public DispatchConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Reloads the configuration, keeping the current one if the reload fails.
     */
    public DispatchConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    /**
     * Starts watching the configuration file for changes.
     * Does nothing when the configuration came from the classpath.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "dispatch-config-watcher");
                t.setDaemon(true);
                return t;
            });
            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to start config watcher for: " + configPath, e);
        }
    }

    private void checkForChanges() {
        WatchKey key = watchService.poll();
        if (key == null) {
            return;
        }

        try {
            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed != null && changed.equals(configPath.getFileName())
                        && Files.getLastModifiedTime(configPath).toMillis() > lastModified) {
                    log.info("Configuration file changed, reloading...");
                    reload();
                }
            }
        } catch (IOException e) {
            log.error("Error checking for config changes", e);
        } finally {
            key.reset();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(DispatchConfig oldConfig, DispatchConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (ConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
