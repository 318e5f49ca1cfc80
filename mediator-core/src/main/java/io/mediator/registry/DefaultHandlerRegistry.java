package io.mediator.registry;

import io.mediator.HandlerAmbiguityException;
import io.mediator.Notification;
import io.mediator.NotificationHandler;
import io.mediator.Request;
import io.mediator.RequestHandler;
import io.mediator.spi.MultiInstanceFactory;
import io.mediator.spi.SingleInstanceFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Thread-safe, explicit handler registry backing both factory interfaces.
 *
 * <p>Handlers are registered either as instances (shared by every dispatch) or as
 * suppliers invoked on each resolution. The registry performs no scanning and
 * manages no lifetimes.
 *
 * <h2>Lookup rules</h2>
 * <ul>
 *   <li>Request handlers are looked up by the exact request class. Registering two
 *       handlers for one request class is allowed, but dispatching that request then
 *       fails with {@link HandlerAmbiguityException}.</li>
 *   <li>Notification handlers registered for a class or interface receive every
 *       notification assignable to it, in registration order. Registering a handler
 *       for a marker interface such as {@link io.mediator.strategy.StrategyNotification}
 *       applies it to the whole family of notifications implementing it.</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultHandlerRegistry registry = new DefaultHandlerRegistry()
 *     .registerRequestHandler(GetUser.class, new GetUserHandler(users))
 *     .registerRequestHandlerFactory(DeleteUser.class, () -> new DeleteUserHandler(users))
 *     .registerNotificationHandler(UserDeleted.class, NotificationHandler.sync(e -> cache.evict(e.userId())))
 *     .registerNotificationHandler(Notification.class, NotificationHandler.sync(audit::record));
 *
 * Mediator mediator = DefaultMediator.builder().handlerFactory(registry).build();
 * }</pre>
 *
 * @see SingleInstanceFactory
 * @see MultiInstanceFactory
 */
public final class DefaultHandlerRegistry implements SingleInstanceFactory, MultiInstanceFactory {

    private final Map<Class<?>, CopyOnWriteArrayList<Registration>> requestHandlers = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Registration> notificationHandlers = new CopyOnWriteArrayList<>();

    /**
     * Registers a handler instance for a request type.
     *
     * @param requestType the concrete request class
     * @param handler     the handler
     * @param <Q>         the request type
     * @param <R>         the response type
     * @return this registry for chaining
     */
    public <Q extends Request<R>, R> DefaultHandlerRegistry registerRequestHandler(
            Class<Q> requestType, RequestHandler<Q, R> handler) {
        Objects.requireNonNull(handler, "handler");
        return addRequestRegistration(requestType, new Registration(requestType, () -> handler,
                handler.getClass().getName()));
    }

    /**
     * Registers a supplier creating a handler for a request type on every resolution.
     *
     * @param requestType the concrete request class
     * @param factory     supplies the handler
     * @param <Q>         the request type
     * @param <R>         the response type
     * @return this registry for chaining
     */
    public <Q extends Request<R>, R> DefaultHandlerRegistry registerRequestHandlerFactory(
            Class<Q> requestType, Supplier<? extends RequestHandler<Q, R>> factory) {
        Objects.requireNonNull(factory, "factory");
        return addRequestRegistration(requestType, new Registration(requestType, factory::get,
                "factory " + factory.getClass().getName()));
    }

    /**
     * Registers a handler instance for a notification type and all its subtypes.
     *
     * @param notificationType the notification class or interface
     * @param handler          the handler
     * @param <N>              the notification type
     * @return this registry for chaining
     */
    public <N extends Notification> DefaultHandlerRegistry registerNotificationHandler(
            Class<N> notificationType, NotificationHandler<N> handler) {
        Objects.requireNonNull(notificationType, "notificationType");
        Objects.requireNonNull(handler, "handler");
        notificationHandlers.add(new Registration(notificationType, () -> handler,
                handler.getClass().getName()));
        return this;
    }

    /**
     * Registers a supplier creating a notification handler on every resolution.
     *
     * @param notificationType the notification class or interface
     * @param factory          supplies the handler
     * @param <N>              the notification type
     * @return this registry for chaining
     */
    public <N extends Notification> DefaultHandlerRegistry registerNotificationHandlerFactory(
            Class<N> notificationType, Supplier<? extends NotificationHandler<N>> factory) {
        Objects.requireNonNull(notificationType, "notificationType");
        Objects.requireNonNull(factory, "factory");
        notificationHandlers.add(new Registration(notificationType, factory::get,
                "factory " + factory.getClass().getName()));
        return this;
    }

    private DefaultHandlerRegistry addRequestRegistration(Class<?> requestType, Registration registration) {
        Objects.requireNonNull(requestType, "requestType");
        requestHandlers.computeIfAbsent(requestType, ignored -> new CopyOnWriteArrayList<>()).add(registration);
        return this;
    }

    /**
     * Returns the handler registered for exactly {@code requestType}.
     *
     * @throws HandlerAmbiguityException if more than one handler is registered
     */
    @Override
    public Object getInstance(Class<?> requestType) {
        List<Registration> registrations = requestHandlers.get(requestType);
        if (registrations == null || registrations.isEmpty()) {
            return null;
        }
        // snapshot: a concurrent registration must not slip in between the size check and get
        Object[] snapshot = registrations.toArray();
        if (snapshot.length > 1) {
            List<String> candidates = new ArrayList<>(snapshot.length);
            for (Object registration : snapshot) {
                candidates.add(((Registration) registration).description());
            }
            throw new HandlerAmbiguityException(requestType, candidates);
        }
        return ((Registration) snapshot[0]).create();
    }

    /**
     * Returns the handlers registered for {@code notificationType} or any of its
     * supertypes, in registration order.
     */
    @Override
    public List<?> getInstances(Class<?> notificationType) {
        List<Object> result = new ArrayList<>();
        for (Registration registration : notificationHandlers) {
            if (registration.messageType().isAssignableFrom(notificationType)) {
                result.add(registration.create());
            }
        }
        return Collections.unmodifiableList(result);
    }

    private record Registration(Class<?> messageType, Supplier<?> supplier, String description) {
        Object create() {
            return supplier.get();
        }
    }
}
