package fr.lapetina.dispatch.domain.exception;

import fr.lapetina.dispatch.domain.model.ErrorType;

/**
 * Thrown when a dispatcher is given no strategy to delegate to.
 * This is a wiring error and is raised eagerly, at construction or rebind time.
 */
public final class MissingBindingException extends DispatchException {

    public MissingBindingException(String message) {
        super(ErrorType.MISSING_BINDING, message);
    }
}
