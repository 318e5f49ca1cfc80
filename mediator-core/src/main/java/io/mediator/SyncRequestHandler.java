package io.mediator;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Base class for request handlers whose logic is a plain synchronous transform.
 *
 * <p>Subclasses implement {@link #handleCore}; this class adapts it to the
 * {@link RequestHandler} contract.
 *
 * <pre>{@code
 * public final class GetUserHandler extends SyncRequestHandler<GetUser, User> {
 *     protected User handleCore(GetUser request) {
 *         return users.find(request.userId());
 *     }
 * }
 * }</pre>
 *
 * @param <Q> the request type
 * @param <R> the response type
 */
public abstract class SyncRequestHandler<Q extends Request<R>, R> implements RequestHandler<Q, R> {

    @Override
    public final CompletionStage<R> handle(Q request) {
        try {
            return CompletableFuture.completedFuture(handleCore(request));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Computes the response.
     *
     * @param request the request
     * @return the response
     * @throws Exception if handling fails; the exception reaches the caller of
     *     {@link Mediator#send(Request)}
     */
    protected abstract R handleCore(Q request) throws Exception;
}
