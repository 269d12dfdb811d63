package fr.lapetina.dispatch.domain.strategy;

import fr.lapetina.dispatch.domain.exception.StrategyNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Keyed lookup table of strategies.
 *
 * Adding a behavior is a {@link #register} call; nothing in this class
 * changes when a new strategy appears. Keys are matched exactly
 * (case-sensitive), and a second registration under the same key replaces the first.
 *
 * Thread-safe. A registration happens-before any resolve that observes it.
 *
 * @param <I> input type of the registered strategies
 * @param <O> output type of the registered strategies
 */
public final class StrategyRegistry<I, O> {

    private static final Logger log = LoggerFactory.getLogger(StrategyRegistry.class);

    private final Map<String, Strategy<I, O>> strategies = new ConcurrentHashMap<>();
    private final List<Consumer<RegistryEvent<I, O>>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a strategy, replacing any strategy already held under that key.
     */
    public void register(String key, Strategy<I, O> strategy) {
        Objects.requireNonNull(key, "Strategy key is required");
        Objects.requireNonNull(strategy, "Strategy is required");

        Strategy<I, O> previous = strategies.put(key, strategy);
        if (previous == null) {
            log.info("Strategy registered: key={}, strategy={}", key, strategy.getName());
            notifyListeners(new RegistryEvent<>(RegistryEvent.Type.ADDED, key, strategy));
        } else if (previous != strategy) {
            log.info("Strategy replaced: key={}, {} -> {}", key, previous.getName(), strategy.getName());
            notifyListeners(new RegistryEvent<>(RegistryEvent.Type.REPLACED, key, strategy));
        } else {
            log.debug("Strategy re-registered unchanged: key={}", key);
        }
    }

    /**
     * Returns the strategy registered under the key.
     *
     * @throws StrategyNotFoundException if nothing is registered under the key
     */
    public Strategy<I, O> resolve(String key) {
        Strategy<I, O> strategy = key != null ? strategies.get(key) : null;
        if (strategy == null) {
            throw new StrategyNotFoundException(key);
        }
        return strategy;
    }

    /**
     * Looks up a strategy without failing, for callers that choose their own fallback.
     */
    public Optional<Strategy<I, O>> find(String key) {
        return key != null ? Optional.ofNullable(strategies.get(key)) : Optional.empty();
    }

    /**
     * Removes the strategy registered under the key.
     */
    public Optional<Strategy<I, O>> unregister(String key) {
        Strategy<I, O> removed = key != null ? strategies.remove(key) : null;
        if (removed != null) {
            log.info("Strategy unregistered: key={}, strategy={}", key, removed.getName());
            notifyListeners(new RegistryEvent<>(RegistryEvent.Type.REMOVED, key, removed));
        }
        return Optional.ofNullable(removed);
    }

    public boolean contains(String key) {
        return key != null && strategies.containsKey(key);
    }

    /**
     * Returns a snapshot of the registered keys.
     */
    public Set<String> keys() {
        return Set.copyOf(strategies.keySet());
    }

    public int size() {
        return strategies.size();
    }

    /**
     * Removes every registered strategy, notifying listeners once per key.
     */
    public void clear() {
        for (String key : new ArrayList<>(strategies.keySet())) {
            unregister(key);
        }
    }

    public void addListener(Consumer<RegistryEvent<I, O>> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryEvent<I, O>> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RegistryEvent<I, O> event) {
        for (Consumer<RegistryEvent<I, O>> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Error notifying registry listener for key {}", event.key(), e);
            }
        }
    }

    /**
     * Event for registry changes.
     */
    public record RegistryEvent<I, O>(Type type, String key, Strategy<I, O> strategy) {
        public enum Type {
            ADDED,
            REPLACED,
            REMOVED
        }
    }
}
