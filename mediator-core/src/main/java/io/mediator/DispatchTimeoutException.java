package io.mediator;

import java.time.Duration;

/**
 * Thrown by the timed {@code send}/{@code publish} variants when the handlers did not
 * complete in time. Handlers already running are not interrupted or rolled back.
 */
public final class DispatchTimeoutException extends MediatorException {

    public DispatchTimeoutException(Class<?> messageType, Duration timeout) {
        super("Dispatch of " + messageType.getName() + " did not complete within " + timeout);
    }
}
