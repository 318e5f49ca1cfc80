package io.mediator;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Single entry point for sending requests and publishing notifications.
 *
 * <h2>Requests</h2>
 * <p>{@link #send(Request)} resolves the one handler registered for the request's
 * concrete class and returns its response. A missing handler raises
 * {@link HandlerNotFoundException}, more than one raises
 * {@link HandlerAmbiguityException}. Exceptions thrown by the handler reach the
 * caller unchanged (checked ones wrapped in {@link HandlerExecutionException} by the
 * blocking variant only).
 *
 * <h2>Notifications</h2>
 * <p>{@link #publish(Notification)} invokes every handler registered for the
 * notification's class or one of its supertypes, possibly concurrently, and returns
 * once all of them have completed. Having no handler is not an error. If any handler
 * fails, the others still run to completion and a {@link PublishException} reports
 * all failures.
 *
 * <p>Implementations keep no state between dispatches.
 *
 * @see io.mediator.dispatch.DefaultMediator
 */
public interface Mediator {

    /**
     * Sends a request to its handler and waits for the response.
     *
     * @param request the request
     * @param <R>     the response type
     * @return the handler's response, unchanged
     * @throws HandlerNotFoundException   if no handler is registered
     * @throws HandlerAmbiguityException  if more than one handler is registered
     * @throws HandlerResolutionException if handler lookup fails otherwise
     * @throws HandlerExecutionException  if the handler failed with a checked exception
     */
    <R> R send(Request<R> request);

    /**
     * Sends a request and waits at most {@code timeout} for the response.
     *
     * @param request the request
     * @param timeout maximum time to wait
     * @param <R>     the response type
     * @return the handler's response
     * @throws DispatchTimeoutException if the handler did not complete in time
     */
    <R> R send(Request<R> request, Duration timeout);

    /**
     * Sends a request without blocking.
     *
     * <p>The future completes exceptionally with the original exception on any
     * failure, including resolution failures. Cancelling it stops waiting for the
     * handler but does not undo work the handler already started.
     *
     * @param request the request
     * @param <R>     the response type
     * @return a future completing with the handler's response
     */
    <R> CompletableFuture<R> sendAsync(Request<R> request);

    /**
     * Publishes a notification and waits until every handler has completed.
     *
     * @param notification the notification
     * @throws PublishException           if at least one handler failed
     * @throws HandlerResolutionException if handler lookup fails
     */
    void publish(Notification notification);

    /**
     * Publishes a notification and waits at most {@code timeout} for its handlers.
     *
     * @param notification the notification
     * @param timeout      maximum time to wait
     * @throws DispatchTimeoutException if the handlers did not complete in time
     */
    void publish(Notification notification, Duration timeout);

    /**
     * Publishes a notification without blocking.
     *
     * @param notification the notification
     * @return a future completing once all handlers completed, or exceptionally with
     *     a {@link PublishException}
     */
    CompletableFuture<Void> publishAsync(Notification notification);
}
