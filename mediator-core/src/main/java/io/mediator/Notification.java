package io.mediator;

/**
 * A message announcing something that already happened.
 *
 * <p>Notifications carry no response. Any number of {@link NotificationHandler}s,
 * including none, may be registered for a notification type.
 *
 * @see Mediator#publish(Notification)
 * @see NotificationHandler
 */
public interface Notification {
}
