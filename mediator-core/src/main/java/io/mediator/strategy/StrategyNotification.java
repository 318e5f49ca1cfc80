package io.mediator.strategy;

import io.mediator.Notification;

/**
 * A notification exposing the {@link Strategy} to run when it is handled.
 *
 * <p>Register one {@link StrategyNotificationHandler} for this interface and every
 * implementing notification type is covered.
 */
public interface StrategyNotification extends Notification {

    Strategy strategy();
}
