package io.mediator;

/**
 * Response type for requests that produce no value.
 *
 * <pre>{@code
 * record DeleteUser(String userId) implements Request<Unit> {}
 *
 * registry.registerRequestHandler(DeleteUser.class, RequestHandler.sync(cmd -> {
 *     users.delete(cmd.userId());
 *     return Unit.VALUE;
 * }));
 * }</pre>
 */
public enum Unit {
    VALUE;

    @Override
    public String toString() {
        return "()";
    }
}
