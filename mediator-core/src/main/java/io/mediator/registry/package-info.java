/**
 * Explicit handler registration.
 *
 * <p>Request handlers are keyed by exact request class; notification handlers match
 * every notification assignable to the type they were registered for.
 *
 * @see io.mediator.registry.DefaultHandlerRegistry
 */
package io.mediator.registry;
