/**
 * Root API of the mediator: an in-process dispatcher routing requests to exactly one
 * handler and notifications to any number of handlers.
 *
 * <h2>Core Design</h2>
 * <p>Application code talks to a {@link io.mediator.Mediator} only. Handlers are looked
 * up per dispatch through two narrow SPIs, {@link io.mediator.spi.SingleInstanceFactory}
 * and {@link io.mediator.spi.MultiInstanceFactory}, so the mediator never owns handler
 * instances and works with any dependency-resolution system. The built-in
 * {@linkplain io.mediator.registry.DefaultHandlerRegistry registry} implements both.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>mediator-core</b>: messages, handlers, mediator, registry, strategies (zero external deps)</li>
 *   <li><b>mediator-micrometer</b>: optional Micrometer metrics bridge</li>
 *   <li><b>mediator-spring-adapter</b>: handler factories backed by a Spring bean factory</li>
 *   <li><b>mediator-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * record Ping(String message) implements Request<String> {}
 * record Pinged(String message) implements Notification {}
 *
 * var registry = new DefaultHandlerRegistry()
 *     .registerRequestHandler(Ping.class, RequestHandler.sync(ping -> ping.message() + " Pong"))
 *     .registerNotificationHandler(Pinged.class, NotificationHandler.sync(e -> log.info(e.message())));
 *
 * try (var mediator = DefaultMediator.builder().handlerFactory(registry).build()) {
 *     String pong = mediator.send(new Ping("Ping"));
 *     mediator.publish(new Pinged(pong));
 * }
 * }</pre>
 *
 * @see io.mediator.Mediator
 * @see io.mediator.Request
 * @see io.mediator.Notification
 * @see io.mediator.RequestHandler
 * @see io.mediator.NotificationHandler
 */
package io.mediator;
