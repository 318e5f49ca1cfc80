package io.mediator.strategy;

import io.mediator.Mediator;
import io.mediator.NotificationHandler;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Generic handler applying the {@link Strategy} embedded in any {@link StrategyNotification}.
 *
 * <p>The handler knows nothing about the concrete notification or the requests its
 * strategy sends, so one registration serves the whole notification family:
 *
 * <pre>{@code
 * registry.registerNotificationHandler(StrategyNotification.class,
 *     new StrategyNotificationHandler<>(mediator));
 * }</pre>
 *
 * <p>With an executor the strategy runs as a background task and the returned stage
 * completes when it finishes; without one it runs on the invoking thread.
 *
 * @param <N> the notification type
 */
public class StrategyNotificationHandler<N extends StrategyNotification> implements NotificationHandler<N> {
    protected final Mediator mediator;
    private final Executor executor;

    public StrategyNotificationHandler(Mediator mediator) {
        this.mediator = Objects.requireNonNull(mediator, "mediator");
        this.executor = null;
    }

    public StrategyNotificationHandler(Mediator mediator, Executor executor) {
        this.mediator = Objects.requireNonNull(mediator, "mediator");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public CompletionStage<Void> handle(N notification) {
        Strategy strategy = notification.strategy();
        if (strategy == null) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    notification.getClass().getName() + " returned a null strategy"));
        }
        if (executor == null) {
            return apply(strategy);
        }
        CompletableFuture<Void> completion = new CompletableFuture<>();
        try {
            executor.execute(() -> apply(strategy).whenComplete((ignored, error) -> {
                if (error != null) {
                    completion.completeExceptionally(error);
                } else {
                    completion.complete(null);
                }
            }));
        } catch (RejectedExecutionException e) {
            completion.completeExceptionally(e);
        }
        return completion;
    }

    private CompletableFuture<Void> apply(Strategy strategy) {
        try {
            strategy.apply(mediator);
            return CompletableFuture.completedFuture(null);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
