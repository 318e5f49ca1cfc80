package io.mediator;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Base class for notification handlers with synchronous logic.
 *
 * @param <N> the notification type
 */
public abstract class SyncNotificationHandler<N extends Notification> implements NotificationHandler<N> {

    @Override
    public final CompletionStage<Void> handle(N notification) {
        try {
            handleCore(notification);
            return CompletableFuture.completedFuture(null);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    protected abstract void handleCore(N notification) throws Exception;
}
