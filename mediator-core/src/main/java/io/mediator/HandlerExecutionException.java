package io.mediator;

/**
 * Carries a checked exception thrown by a handler out of the blocking
 * {@link Mediator#send(Request)} call.
 *
 * <p>Unchecked exceptions are never wrapped. The asynchronous variants complete
 * their futures with the original exception instead.
 */
public final class HandlerExecutionException extends MediatorException {

    public HandlerExecutionException(Class<?> messageType, Throwable cause) {
        super("Handler for " + messageType.getName() + " failed: " + cause, cause);
    }
}
