package io.mediator.dispatch;

import io.mediator.DispatchTimeoutException;
import io.mediator.HandlerExecutionException;
import io.mediator.HandlerNotFoundException;
import io.mediator.HandlerResolutionException;
import io.mediator.Mediator;
import io.mediator.MediatorException;
import io.mediator.Notification;
import io.mediator.NotificationHandler;
import io.mediator.PublishException;
import io.mediator.Request;
import io.mediator.RequestHandler;
import io.mediator.spi.MetricsExporter;
import io.mediator.spi.MultiInstanceFactory;
import io.mediator.spi.SingleInstanceFactory;
import io.mediator.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link Mediator} resolving handlers through a {@link SingleInstanceFactory}
 * and a {@link MultiInstanceFactory}.
 *
 * <p>By default notification handlers are invoked one after another on the publishing
 * thread; asynchronous handlers still overlap because only their invocation is
 * sequential. Configure {@link Builder#publishExecutor(Executor)} or
 * {@link Builder#publishParallelism(int)} to fan out invocations concurrently.
 * Either way {@code publish} completes only after every handler completed, and a
 * failing handler never prevents its siblings from running. A handler that publishes
 * again while running on the publish executor has the nested handlers invoked on its
 * own thread, so a bounded pool cannot starve on its own nested publishes.
 *
 * <p>Exceptions thrown by the {@link MetricsExporter} are logged at {@code WARNING}
 * and never affect the dispatch outcome.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and holds no
 * state between dispatches. {@link #close()} only matters when the mediator owns a
 * publish pool ({@code publishParallelism > 0}).
 *
 * @see Builder
 * @see DispatchInterceptor
 */
public final class DefaultMediator implements Mediator, AutoCloseable {
    private static final Logger logger = Logger.getLogger(DefaultMediator.class.getName());

    private final SingleInstanceFactory singleInstanceFactory;
    private final MultiInstanceFactory multiInstanceFactory;
    private final List<DispatchInterceptor> interceptors;
    private final MetricsExporter metrics;
    private final Executor publishExecutor;
    private final ExecutorService ownedPool;
    private final long shutdownTimeoutMs;
    private final ThreadLocal<Boolean> delivering = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private DefaultMediator(Builder builder) {
        this.singleInstanceFactory = Objects.requireNonNull(builder.singleInstanceFactory, "singleInstanceFactory");
        this.multiInstanceFactory = Objects.requireNonNull(builder.multiInstanceFactory, "multiInstanceFactory");
        this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.shutdownTimeoutMs = builder.shutdownTimeoutMs;

        if (builder.publishParallelism < 0) {
            throw new IllegalArgumentException("publishParallelism must be >= 0");
        }
        if (builder.shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException("shutdownTimeoutMs must be >= 0");
        }
        if (builder.publishParallelism > 0 && builder.publishExecutor != null) {
            throw new IllegalArgumentException("publishExecutor and publishParallelism are mutually exclusive");
        }

        if (builder.publishParallelism > 0) {
            this.ownedPool = Executors.newFixedThreadPool(builder.publishParallelism,
                    new DaemonThreadFactory("mediator-publish-"));
            this.publishExecutor = ownedPool;
        } else {
            this.ownedPool = null;
            this.publishExecutor = builder.publishExecutor;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public <R> R send(Request<R> request) {
        return await(request, sendAsync(request), null);
    }

    @Override
    public <R> R send(Request<R> request, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        return await(request, sendAsync(request), timeout);
    }

    @Override
    public <R> CompletableFuture<R> sendAsync(Request<R> request) {
        Objects.requireNonNull(request, "request");
        CompletableFuture<R> result = new CompletableFuture<>();

        int entered = 0;
        try {
            for (DispatchInterceptor interceptor : interceptors) {
                interceptor.beforeDispatch(request);
                entered++;
            }
        } catch (Exception e) {
            report(() -> metrics.incrementSendFailure());
            fail(request, result, e, entered);
            return result;
        }

        RequestHandler<Request<R>, R> handler;
        try {
            handler = resolveRequestHandler(request.getClass());
        } catch (MediatorException e) {
            report(() -> metrics.incrementSendUnhandled());
            fail(request, result, e, entered);
            return result;
        }

        final int depth = entered;
        final long startNanos = System.nanoTime();
        invoke(() -> handler.handle(request)).whenComplete((value, error) -> {
            report(() -> metrics.recordHandlerDurationMs(elapsedMs(startNanos)));
            Throwable cause = unwrap(error);
            if (cause == null) {
                report(() -> metrics.incrementSendSuccess());
                runAfterDispatch(request, null, depth);
                result.complete(value);
            } else {
                report(() -> metrics.incrementSendFailure());
                fail(request, result, cause, depth);
            }
        });
        return result;
    }

    @Override
    public void publish(Notification notification) {
        await(notification, publishAsync(notification), null);
    }

    @Override
    public void publish(Notification notification, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        await(notification, publishAsync(notification), timeout);
    }

    @Override
    public CompletableFuture<Void> publishAsync(Notification notification) {
        Objects.requireNonNull(notification, "notification");
        CompletableFuture<Void> result = new CompletableFuture<>();

        int entered = 0;
        try {
            for (DispatchInterceptor interceptor : interceptors) {
                interceptor.beforeDispatch(notification);
                entered++;
            }
        } catch (Exception e) {
            report(() -> metrics.incrementPublishFailure());
            fail(notification, result, e, entered);
            return result;
        }

        List<NotificationHandler<Notification>> handlers;
        try {
            handlers = resolveNotificationHandlers(notification.getClass());
        } catch (MediatorException e) {
            report(() -> metrics.incrementPublishFailure());
            fail(notification, result, e, entered);
            return result;
        }
        int fanOut = handlers.size();
        report(() -> metrics.recordPublishFanOut(fanOut));

        final int depth = entered;
        if (handlers.isEmpty()) {
            report(() -> metrics.incrementPublishSuccess());
            runAfterDispatch(notification, null, depth);
            result.complete(null);
            return result;
        }

        List<CompletableFuture<Throwable>> outcomes = new ArrayList<>(handlers.size());
        for (NotificationHandler<Notification> handler : handlers) {
            outcomes.add(deliver(handler, notification));
        }
        CompletableFuture.allOf(outcomes.toArray(new CompletableFuture<?>[0])).thenRun(() -> {
            List<Throwable> failures = new ArrayList<>();
            for (CompletableFuture<Throwable> outcome : outcomes) {
                Throwable failure = outcome.join();
                if (failure != null) {
                    failures.add(failure);
                }
            }
            if (failures.isEmpty()) {
                report(() -> metrics.incrementPublishSuccess());
                runAfterDispatch(notification, null, depth);
                result.complete(null);
            } else {
                report(() -> metrics.incrementPublishFailure());
                fail(notification, result,
                        new PublishException(notification.getClass(), handlers.size(), failures), depth);
            }
        });
        return result;
    }

    /**
     * Runs one notification handler, on the publish executor when one is configured.
     * The returned future always completes normally: with {@code null} on success,
     * otherwise with the handler's failure.
     */
    private CompletableFuture<Throwable> deliver(NotificationHandler<Notification> handler,
                                                 Notification notification) {
        CompletableFuture<Throwable> outcome = new CompletableFuture<>();
        Runnable task = () -> {
            long startNanos = System.nanoTime();
            invoke(() -> handler.handle(notification)).whenComplete((ignored, error) -> {
                report(() -> metrics.recordHandlerDurationMs(elapsedMs(startNanos)));
                outcome.complete(unwrap(error));
            });
        };
        // A handler publishing from a delivery thread must not queue behind itself.
        if (publishExecutor == null || delivering.get()) {
            task.run();
        } else {
            try {
                publishExecutor.execute(() -> {
                    delivering.set(Boolean.TRUE);
                    try {
                        task.run();
                    } finally {
                        delivering.remove();
                    }
                });
            } catch (RejectedExecutionException e) {
                outcome.complete(e);
            }
        }
        return outcome;
    }

    private static <T> CompletionStage<T> invoke(HandlerCall<T> call) {
        try {
            return Objects.requireNonNull(call.call(), "handler returned a null CompletionStage");
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    @FunctionalInterface
    private interface HandlerCall<T> {
        CompletionStage<T> call();
    }

    @SuppressWarnings("unchecked")
    private <R> RequestHandler<Request<R>, R> resolveRequestHandler(Class<?> requestType) {
        Object instance;
        try {
            instance = singleInstanceFactory.getInstance(requestType);
        } catch (MediatorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new HandlerResolutionException(
                    "Failed to resolve handler for request type " + requestType.getName(), e);
        }
        if (instance == null) {
            throw new HandlerNotFoundException(requestType);
        }
        if (!(instance instanceof RequestHandler)) {
            throw new HandlerResolutionException("Resolved " + instance.getClass().getName()
                    + " for request type " + requestType.getName() + ", which is not a RequestHandler");
        }
        return (RequestHandler<Request<R>, R>) instance;
    }

    @SuppressWarnings("unchecked")
    private List<NotificationHandler<Notification>> resolveNotificationHandlers(Class<?> notificationType) {
        List<?> instances;
        try {
            instances = multiInstanceFactory.getInstances(notificationType);
        } catch (MediatorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new HandlerResolutionException(
                    "Failed to resolve handlers for notification type " + notificationType.getName(), e);
        }
        if (instances == null) {
            throw new HandlerResolutionException(
                    "Handler factory returned null for notification type " + notificationType.getName());
        }
        List<NotificationHandler<Notification>> handlers = new ArrayList<>(instances.size());
        for (Object instance : instances) {
            if (!(instance instanceof NotificationHandler)) {
                throw new HandlerResolutionException("Resolved "
                        + (instance == null ? "null" : instance.getClass().getName())
                        + " for notification type " + notificationType.getName()
                        + ", which is not a NotificationHandler");
            }
            handlers.add((NotificationHandler<Notification>) instance);
        }
        return handlers;
    }

    private void fail(Object message, CompletableFuture<?> result, Throwable error, int entered) {
        if (logger.isLoggable(Level.FINE)) {
            logger.log(Level.FINE, "Dispatch of " + message.getClass().getName() + " failed", error);
        }
        runAfterDispatch(message, error, entered);
        result.completeExceptionally(error);
    }

    private void report(Runnable call) {
        try {
            call.run();
        } catch (RuntimeException ex) {
            logger.log(Level.WARNING, "Metrics exporter failed", ex);
        }
    }

    private void runAfterDispatch(Object message, Throwable error, int count) {
        for (int i = count - 1; i >= 0; i--) {
            try {
                interceptors.get(i).afterDispatch(message, error);
            } catch (Exception ex) {
                logger.log(Level.WARNING, "Interceptor afterDispatch failed", ex);
            }
        }
    }

    private static <T> T await(Object message, CompletableFuture<T> future, Duration timeout) {
        try {
            return timeout == null
                    ? future.get()
                    : future.get(saturatedNanos(timeout), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw propagate(message, e.getCause());
        } catch (TimeoutException e) {
            future.cancel(false);
            throw new DispatchTimeoutException(message.getClass(), timeout);
        } catch (InterruptedException e) {
            future.cancel(false);
            Thread.currentThread().interrupt();
            throw new MediatorException("Interrupted while dispatching " + message.getClass().getName(), e);
        }
    }

    private static long saturatedNanos(Duration timeout) {
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return timeout.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    private static RuntimeException propagate(Object message, Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new HandlerExecutionException(message.getClass(), cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static long elapsedMs(long startNanos) {
        return Math.max(0, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }

    /**
     * Shuts down the owned publish pool, waiting up to the configured shutdown timeout
     * for running handlers. Has no effect when no pool is owned.
     */
    @Override
    public void close() {
        if (ownedPool == null) {
            return;
        }
        ownedPool.shutdown();
        try {
            if (!ownedPool.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.log(Level.WARNING, "Shutdown timeout exceeded; interrupting publish workers");
                ownedPool.shutdownNow();
                ownedPool.awaitTermination(5, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            ownedPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /** Builder for {@link DefaultMediator}. */
    public static final class Builder {
        private SingleInstanceFactory singleInstanceFactory;
        private MultiInstanceFactory multiInstanceFactory;
        private final List<DispatchInterceptor> interceptors = new ArrayList<>();
        private MetricsExporter metrics;
        private Executor publishExecutor;
        private int publishParallelism;
        private long shutdownTimeoutMs = 5000;

        private Builder() {}

        /**
         * Uses one object for both request and notification handler resolution, e.g. a
         * {@link io.mediator.registry.DefaultHandlerRegistry}.
         *
         * @param factory the handler factory
         * @param <F>     a type implementing both factory interfaces
         * @return this builder
         */
        public <F extends SingleInstanceFactory & MultiInstanceFactory> Builder handlerFactory(F factory) {
            this.singleInstanceFactory = factory;
            this.multiInstanceFactory = factory;
            return this;
        }

        /**
         * Sets the factory resolving request handlers.
         *
         * <p><b>Required</b> unless {@link #handlerFactory} is used.
         *
         * @param singleInstanceFactory the factory
         * @return this builder
         */
        public Builder singleInstanceFactory(SingleInstanceFactory singleInstanceFactory) {
            this.singleInstanceFactory = singleInstanceFactory;
            return this;
        }

        /**
         * Sets the factory resolving notification handlers.
         *
         * <p><b>Required</b> unless {@link #handlerFactory} is used.
         *
         * @param multiInstanceFactory the factory
         * @return this builder
         */
        public Builder multiInstanceFactory(MultiInstanceFactory multiInstanceFactory) {
            this.multiInstanceFactory = multiInstanceFactory;
            return this;
        }

        /**
         * Appends a dispatch interceptor.
         *
         * @param interceptor the interceptor to add
         * @return this builder
         */
        public Builder interceptor(DispatchInterceptor interceptor) {
            this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
            return this;
        }

        /**
         * Appends multiple dispatch interceptors in list order.
         *
         * @param interceptors the interceptors to add
         * @return this builder
         */
        public Builder interceptors(List<DispatchInterceptor> interceptors) {
            Objects.requireNonNull(interceptors, "interceptors");
            for (DispatchInterceptor interceptor : interceptors) {
                interceptor(interceptor);
            }
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets an externally managed executor on which notification handlers are invoked.
         * The mediator never shuts it down.
         *
         * <p>Optional. Mutually exclusive with {@link #publishParallelism(int)}.
         *
         * @param publishExecutor the executor
         * @return this builder
         */
        public Builder publishExecutor(Executor publishExecutor) {
            this.publishExecutor = publishExecutor;
            return this;
        }

        /**
         * Makes the mediator own a fixed pool of daemon threads used to invoke
         * notification handlers concurrently.
         *
         * <p>Optional. Defaults to {@code 0}: handlers are invoked on the publishing thread.
         *
         * @param publishParallelism number of publish worker threads, &ge; 0
         * @return this builder
         */
        public Builder publishParallelism(int publishParallelism) {
            this.publishParallelism = publishParallelism;
            return this;
        }

        /**
         * Sets how long {@link DefaultMediator#close()} waits for running handlers.
         *
         * <p>Optional. Defaults to {@code 5000} ms.
         *
         * @param shutdownTimeoutMs timeout in milliseconds
         * @return this builder
         */
        public Builder shutdownTimeoutMs(long shutdownTimeoutMs) {
            this.shutdownTimeoutMs = shutdownTimeoutMs;
            return this;
        }

        /**
         * Builds the mediator.
         *
         * @return a new {@link DefaultMediator}
         * @throws NullPointerException     if a handler factory is missing
         * @throws IllegalArgumentException if a numeric option is negative or both
         *     {@code publishExecutor} and {@code publishParallelism} are set
         */
        public DefaultMediator build() {
            return new DefaultMediator(this);
        }
    }
}
