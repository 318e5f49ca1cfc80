package io.mediator;

/**
 * Thrown when no handler is registered for a request's concrete type.
 *
 * <p>Never retried by the mediator.
 */
public final class HandlerNotFoundException extends MediatorException {
    private final Class<?> requestType;

    public HandlerNotFoundException(Class<?> requestType) {
        super("No handler registered for request type " + requestType.getName());
        this.requestType = requestType;
    }

    public Class<?> requestType() {
        return requestType;
    }
}
