package fr.lapetina.dispatch.domain.exception;

import fr.lapetina.dispatch.domain.model.ErrorType;

/**
 * Thrown by a strategy when the value it receives is outside its accepted range.
 */
public final class InvalidInputException extends DispatchException {

    private final transient Object input;

    public InvalidInputException(Object input, String message) {
        super(ErrorType.INVALID_INPUT, "Invalid input " + input + ": " + message);
        this.input = input;
    }

    /**
     * Returns the rejected value, possibly null.
     */
    public Object getInput() {
        return input;
    }
}
