package fr.lapetina.dispatch.domain.exception;

import fr.lapetina.dispatch.domain.model.ErrorType;

/**
 * Thrown when a registry is asked for a key it does not hold.
 */
public final class StrategyNotFoundException extends DispatchException {

    private final String key;

    public StrategyNotFoundException(String key) {
        super(ErrorType.STRATEGY_NOT_FOUND, "No strategy registered for key: " + key);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
