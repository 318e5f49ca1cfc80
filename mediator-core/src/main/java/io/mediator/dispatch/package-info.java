/**
 * Dispatch engine.
 *
 * <p>{@link io.mediator.dispatch.DefaultMediator} resolves handlers per dispatch, awaits
 * a single request handler or all notification handlers, and reports every failure to
 * the caller. {@link io.mediator.dispatch.DispatchInterceptor} adds cross-cutting hooks.
 *
 * @see io.mediator.dispatch.DefaultMediator
 * @see io.mediator.dispatch.DispatchInterceptor
 */
package io.mediator.dispatch;
