package io.mediator.spi;

import io.mediator.HandlerAmbiguityException;

/**
 * Resolves the single request handler registered for a request type.
 *
 * <p>Implementations bridge the mediator to whatever owns the handlers: the
 * built-in {@link io.mediator.registry.DefaultHandlerRegistry}, a dependency
 * injection container, or a hand-written lookup. Resolution must be a pure lookup.
 *
 * @see MultiInstanceFactory
 */
@FunctionalInterface
public interface SingleInstanceFactory {

    /**
     * Returns the handler for {@code requestType}.
     *
     * @param requestType the concrete request class
     * @return the handler, or {@code null} if none is registered
     * @throws HandlerAmbiguityException if more than one handler is registered
     */
    Object getInstance(Class<?> requestType);
}
