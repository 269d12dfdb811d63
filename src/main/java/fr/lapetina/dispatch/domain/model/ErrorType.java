package fr.lapetina.dispatch.domain.model;

/**
 * Error taxonomy for strategy dispatch.
 * Lets calling code tell a bad input apart from a wiring mistake.
 */
public enum ErrorType {
    /** A strategy rejected its input (negative amount, null value, etc.) */
    INVALID_INPUT,

    /** No strategy is registered under the requested key */
    STRATEGY_NOT_FOUND,

    /** A dispatcher was built or rebound without a strategy */
    MISSING_BINDING,

    /** Anything a strategy threw that is not part of this taxonomy */
    INTERNAL_ERROR
}
