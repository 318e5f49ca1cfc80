/**
 * Notifications that carry their own follow-up behavior.
 *
 * <p>A {@link io.mediator.strategy.StrategyNotification} embeds a
 * {@link io.mediator.strategy.Strategy}. A single generic
 * {@link io.mediator.strategy.StrategyNotificationHandler} applies it with the mediator,
 * so one notification can trigger any number of further requests without the mediator
 * or the notification handler knowing about them in advance.
 *
 * @see io.mediator.strategy.SendRequestsStrategy
 */
package io.mediator.strategy;
