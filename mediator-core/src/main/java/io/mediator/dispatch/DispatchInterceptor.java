package io.mediator.dispatch;

/**
 * Cross-cutting hook around every {@code send} and {@code publish}.
 *
 * <p>Interceptors run once per dispatch, not once per handler:
 * <ol>
 *   <li>{@link #beforeDispatch} in registration order</li>
 *   <li>handler resolution and invocation</li>
 *   <li>{@link #afterDispatch} in reverse registration order, after the last handler
 *       completed</li>
 * </ol>
 *
 * <p>If {@code beforeDispatch} throws, no handler runs and the dispatch fails with
 * that exception. {@code afterDispatch} exceptions are logged but swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * DefaultMediator.builder()
 *     .handlerFactory(registry)
 *     .interceptor(DispatchInterceptor.before(message ->
 *         audit.log(message.getClass().getSimpleName())))
 *     .interceptor(DispatchInterceptor.after((message, error) -> {
 *         if (error != null) alerts.raise(message, error);
 *     }))
 *     .build();
 * }</pre>
 */
public interface DispatchInterceptor {

    /**
     * Called before the handlers are resolved.
     *
     * @param message the request or notification about to be dispatched
     * @throws Exception to abort the dispatch
     */
    default void beforeDispatch(Object message) throws Exception {
    }

    /**
     * Called once the dispatch finished.
     *
     * @param message the request or notification that was dispatched
     * @param error   null on success, otherwise the failure reported to the caller
     */
    default void afterDispatch(Object message, Throwable error) {
    }

    /**
     * Creates an interceptor with only a beforeDispatch hook.
     */
    static DispatchInterceptor before(BeforeHook hook) {
        return new DispatchInterceptor() {
            @Override
            public void beforeDispatch(Object message) throws Exception {
                hook.accept(message);
            }
        };
    }

    /**
     * Creates an interceptor with only an afterDispatch hook.
     */
    static DispatchInterceptor after(AfterHook hook) {
        return new DispatchInterceptor() {
            @Override
            public void afterDispatch(Object message, Throwable error) {
                hook.accept(message, error);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(Object message) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(Object message, Throwable error);
    }
}
