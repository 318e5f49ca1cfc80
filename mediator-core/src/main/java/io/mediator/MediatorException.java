package io.mediator;

/**
 * Base class for failures raised by the mediator itself, as opposed to exceptions
 * thrown by handler logic, which reach the caller unchanged.
 */
public class MediatorException extends RuntimeException {

    public MediatorException(String message) {
        super(message);
    }

    public MediatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
