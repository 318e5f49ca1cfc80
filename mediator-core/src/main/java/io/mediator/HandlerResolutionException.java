package io.mediator;

/**
 * Thrown when handler lookup fails for a reason other than a missing or ambiguous
 * registration, e.g. the factory itself throws or returns an object that is not a
 * handler.
 */
public final class HandlerResolutionException extends MediatorException {

    public HandlerResolutionException(String message) {
        super(message);
    }

    public HandlerResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
