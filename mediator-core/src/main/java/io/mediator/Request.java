package io.mediator;

/**
 * A message that asks for an action to be performed and expects exactly one response.
 *
 * <p>Each concrete request class is served by exactly one {@link RequestHandler}.
 * Requests with no meaningful result use {@link Unit} as their response type.
 *
 * <pre>{@code
 * record GetUser(String userId) implements Request<User> {}
 *
 * User user = mediator.send(new GetUser("u-42"));
 * }</pre>
 *
 * @param <R> the response type
 * @see Mediator#send(Request)
 * @see RequestHandler
 */
public interface Request<R> {
}
