package io.mediator.strategy;

import io.mediator.Mediator;

/**
 * Follow-up behavior carried by a {@link StrategyNotification}.
 *
 * <p>A strategy is created together with its notification, applied once by
 * {@link StrategyNotificationHandler} and then discarded. It receives the mediator so
 * it can send further requests the notification machinery knows nothing about.
 *
 * <p>Strategies may run concurrently with other handlers of the same notification.
 */
@FunctionalInterface
public interface Strategy {

    /**
     * Performs the follow-up work.
     *
     * @param mediator the mediator that published the notification
     * @throws Exception if the work fails; reported through the publish result
     */
    void apply(Mediator mediator) throws Exception;
}
