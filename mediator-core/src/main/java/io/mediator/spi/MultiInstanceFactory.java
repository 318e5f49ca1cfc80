package io.mediator.spi;

import java.util.List;

/**
 * Resolves every notification handler applicable to a notification type.
 *
 * @see SingleInstanceFactory
 */
@FunctionalInterface
public interface MultiInstanceFactory {

    /**
     * Returns the handlers for {@code notificationType}, including handlers registered
     * for its supertypes where the implementation supports it.
     *
     * @param notificationType the concrete notification class
     * @return the handlers, possibly empty, never null
     */
    List<?> getInstances(Class<?> notificationType);
}
