package fr.lapetina.dispatch.domain.exception;

import fr.lapetina.dispatch.domain.model.ErrorType;

import java.util.Objects;

/**
 * Base class for every failure raised by the dispatch core.
 *
 * Unchecked: the core never catches these itself, it only lets them
 * travel to the caller of {@code process} or {@code resolve}.
 */
public abstract class DispatchException extends RuntimeException {

    private final ErrorType errorType;

    protected DispatchException(ErrorType errorType, String message) {
        super(message);
        this.errorType = Objects.requireNonNull(errorType, "Error type is required");
    }

    protected DispatchException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = Objects.requireNonNull(errorType, "Error type is required");
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
