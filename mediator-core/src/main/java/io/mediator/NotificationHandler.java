package io.mediator;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Reacts to a {@link Notification}.
 *
 * <p>A handler registered for a supertype or interface receives every notification
 * assignable to it. Handlers of the same notification may run concurrently and in
 * any order.
 *
 * @param <N> the notification type
 * @see Mediator#publish(Notification)
 * @see SyncNotificationHandler
 */
@FunctionalInterface
public interface NotificationHandler<N extends Notification> {

    /**
     * Handles the notification.
     *
     * @param notification the notification, never null
     * @return a stage completing when handling is done
     */
    CompletionStage<Void> handle(N notification);

    /**
     * Adapts a synchronous consumer into a notification handler.
     *
     * @param body the handler logic
     * @param <N>  the notification type
     * @return a handler running {@code body} on the invoking thread
     */
    static <N extends Notification> NotificationHandler<N> sync(Body<N> body) {
        return notification -> {
            try {
                body.accept(notification);
                return CompletableFuture.completedFuture(null);
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    @FunctionalInterface
    interface Body<N> {
        void accept(N notification) throws Exception;
    }
}
