package io.mediator;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Handles one concrete {@link Request} type and produces its response.
 *
 * <p>The returned stage may already be complete (synchronous handlers) or complete
 * later on another thread (asynchronous handlers). Failures are reported either by
 * throwing from {@code handle} or by completing the stage exceptionally; the mediator
 * treats both the same way and hands the original exception to the caller.
 *
 * <p>For handlers with purely synchronous logic, extend {@link SyncRequestHandler}
 * or use {@link #sync(Body)}.
 *
 * @param <Q> the request type
 * @param <R> the response type
 * @see Mediator#send(Request)
 */
@FunctionalInterface
public interface RequestHandler<Q extends Request<R>, R> {

    /**
     * Handles the request.
     *
     * @param request the request, never null
     * @return a stage completing with the response
     */
    CompletionStage<R> handle(Q request);

    /**
     * Adapts a synchronous function into a request handler. Exceptions thrown by
     * {@code body} complete the returned stage exceptionally.
     *
     * @param body the handler logic
     * @param <Q>  the request type
     * @param <R>  the response type
     * @return a handler running {@code body} on the dispatching thread
     */
    static <Q extends Request<R>, R> RequestHandler<Q, R> sync(Body<Q, R> body) {
        return request -> {
            try {
                return CompletableFuture.completedFuture(body.apply(request));
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    @FunctionalInterface
    interface Body<Q, R> {
        R apply(Q request) throws Exception;
    }
}
