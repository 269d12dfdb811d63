package fr.lapetina.dispatch.domain.strategy;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Builds strategies from a type name and a parameter map, typically read from configuration.
 *
 * One instance per composition root; there is no global registry of types.
 *
 * @param <I> input type of the produced strategies
 * @param <O> output type of the produced strategies
 */
public final class StrategyFactory<I, O> {

    private final Map<String, Function<Map<String, Object>, Strategy<I, O>>> providers =
            new ConcurrentHashMap<>();

    /**
     * Registers a provider for a strategy type.
     *
     * @param type Type name (used in configuration)
     * @param provider Builds a strategy from its parameters
     */
    public StrategyFactory<I, O> register(String type, Function<Map<String, Object>, Strategy<I, O>> provider) {
        Objects.requireNonNull(type, "Strategy type is required");
        Objects.requireNonNull(provider, "Strategy provider is required");
        providers.put(type, provider);
        return this;
    }

    /**
     * Creates a strategy by type.
     *
     * @param type Type name from configuration
     * @param parameters Provider parameters, may be null
     * @return Strategy instance, or empty if the type is unknown
     * @throws IllegalArgumentException if the provider rejects the parameters
     */
    public Optional<Strategy<I, O>> create(String type, Map<String, Object> parameters) {
        Function<Map<String, Object>, Strategy<I, O>> provider = type != null ? providers.get(type) : null;
        if (provider == null) {
            return Optional.empty();
        }
        return Optional.of(provider.apply(parameters != null ? parameters : Map.of()));
    }

    /**
     * Returns all registered type names.
     */
    public Set<String> getRegisteredTypes() {
        return Set.copyOf(providers.keySet());
    }
}
