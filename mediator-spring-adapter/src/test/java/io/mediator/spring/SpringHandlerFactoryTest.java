package io.mediator.spring;

import io.mediator.HandlerAmbiguityException;
import io.mediator.HandlerNotFoundException;
import io.mediator.HandlerResolutionException;
import io.mediator.Mediator;
import io.mediator.Notification;
import io.mediator.NotificationHandler;
import io.mediator.Request;
import io.mediator.RequestHandler;
import io.mediator.SyncRequestHandler;
import io.mediator.dispatch.DefaultMediator;
import io.mediator.strategy.SendRequestsStrategy;
import io.mediator.strategy.Strategy;
import io.mediator.strategy.StrategyNotification;
import io.mediator.strategy.StrategyNotificationHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;
import org.springframework.core.annotation.Order;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpringHandlerFactoryTest {

    record Ping(String message) implements Request<String> {}

    record Pong(String message) implements Request<String> {}

    record Count(int value) implements Request<Integer> {}

    interface AuditEvent extends Notification {}

    record Pinged(String message) implements AuditEvent {}

    record Ponged(String message) implements Notification {}

    record PingRequested(String message, Strategy strategy) implements StrategyNotification {}

    private AnnotationConfigApplicationContext context;

    @AfterEach
    void tearDown() {
        if (context != null) {
            context.close();
        }
    }

    // ── Request handlers ────────────────────────────────────────────

    @Test
    void resolvesRequestHandlerByGenericType() {
        context = new AnnotationConfigApplicationContext(RequestHandlers.class);
        SpringHandlerFactory factory = new SpringHandlerFactory(context);

        assertSame(context.getBean("pingHandler"), factory.getInstance(Ping.class));
        assertSame(context.getBean("countHandler"), factory.getInstance(Count.class));
    }

    @Test
    void returnsNullWhenNoBeanMatches() {
        context = new AnnotationConfigApplicationContext(RequestHandlers.class);
        SpringHandlerFactory factory = new SpringHandlerFactory(context);

        assertNull(factory.getInstance(Pong.class));
    }

    @Test
    void reportsAmbiguityWithCandidateBeanNames() {
        context = new AnnotationConfigApplicationContext(RequestHandlers.class, DuplicatePingHandler.class);
        SpringHandlerFactory factory = new SpringHandlerFactory(context);

        HandlerAmbiguityException ex = assertThrows(HandlerAmbiguityException.class,
                () -> factory.getInstance(Ping.class));

        assertEquals(Ping.class, ex.requestType());
        assertTrue(ex.candidates().contains("pingHandler"));
        assertTrue(ex.candidates().contains("anotherPingHandler"));
    }

    @Test
    void rejectsTypeThatIsNotARequest() {
        context = new AnnotationConfigApplicationContext(RequestHandlers.class);
        SpringHandlerFactory factory = new SpringHandlerFactory(context);

        assertThrows(HandlerResolutionException.class, () -> factory.getInstance(String.class));
    }

    @Test
    void prototypeHandlerIsCreatedPerLookup() {
        context = new AnnotationConfigApplicationContext(PrototypeHandlers.class);
        SpringHandlerFactory factory = new SpringHandlerFactory(context);

        assertNotSame(factory.getInstance(Ping.class), factory.getInstance(Ping.class));
    }

    // ── Notification handlers ───────────────────────────────────────

    @Test
    void collectsHandlersForNotificationAndItsSupertypes() {
        context = new AnnotationConfigApplicationContext(NotificationHandlers.class);
        SpringHandlerFactory factory = new SpringHandlerFactory(context);

        List<?> pinged = factory.getInstances(Pinged.class);
        List<?> ponged = factory.getInstances(Ponged.class);

        assertEquals(List.of(context.getBean("everything"), context.getBean("audit"), context.getBean("pinged")),
                pinged);
        assertEquals(List.of(context.getBean("everything")), ponged);
    }

    @Test
    void honorsOrderAnnotation() {
        context = new AnnotationConfigApplicationContext(OrderedHandlers.class);
        SpringHandlerFactory factory = new SpringHandlerFactory(context);

        assertEquals(List.of(context.getBean("first"), context.getBean("second")),
                factory.getInstances(Ponged.class));
    }

    @Test
    void returnsEmptyListWithoutHandlers() {
        context = new AnnotationConfigApplicationContext(RequestHandlers.class);
        SpringHandlerFactory factory = new SpringHandlerFactory(context);

        assertTrue(factory.getInstances(Ponged.class).isEmpty());
    }

    // ── Mediator over Spring beans ──────────────────────────────────

    @Test
    void mediatorDispatchesToBeans() {
        context = new AnnotationConfigApplicationContext(RequestHandlers.class);
        Mediator mediator = context.getBean(Mediator.class);

        assertEquals("Ping Pong", mediator.send(new Ping("Ping")));
        assertEquals(42, mediator.send(new Count(41)));
        assertThrows(HandlerNotFoundException.class, () -> mediator.send(new Pong("Pong")));
    }

    @Test
    void strategyHandlerBeanSendsFollowUpRequests() {
        context = new AnnotationConfigApplicationContext(StrategyHandlers.class);
        Mediator mediator = context.getBean(Mediator.class);
        StringWriter output = context.getBean(StringWriter.class);

        mediator.publish(new PingRequested("Ping", SendRequestsStrategy.repeat(2, i -> new Ping("Ping" + i))));

        List<String> lines = Arrays.asList(output.toString().split(System.lineSeparator()));
        assertTrue(lines.contains("Ping2"));
    }

    @Test
    void nullBeanFactoryThrows() {
        assertThrows(NullPointerException.class, () -> new SpringHandlerFactory(null));
    }

    // ── Configurations ──────────────────────────────────────────────

    @Configuration
    static class MediatorConfig {
        @Bean
        SpringHandlerFactory springHandlerFactory(ListableBeanFactory beanFactory) {
            return new SpringHandlerFactory(beanFactory);
        }

        @Bean(destroyMethod = "close")
        DefaultMediator mediator(SpringHandlerFactory handlerFactory) {
            return DefaultMediator.builder().handlerFactory(handlerFactory).build();
        }
    }

    @Configuration
    static class RequestHandlers extends MediatorConfig {
        @Bean
        RequestHandler<Ping, String> pingHandler() {
            return RequestHandler.sync(ping -> ping.message() + " Pong");
        }

        @Bean
        RequestHandler<Count, Integer> countHandler() {
            return RequestHandler.sync(count -> count.value() + 1);
        }
    }

    @Configuration
    static class DuplicatePingHandler {
        @Bean
        RequestHandler<Ping, String> anotherPingHandler() {
            return RequestHandler.sync(Ping::message);
        }
    }

    @Configuration
    static class PrototypeHandlers {
        @Bean
        @Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
        PingHandler pingHandler() {
            return new PingHandler();
        }
    }

    static final class PingHandler extends SyncRequestHandler<Ping, String> {
        @Override
        protected String handleCore(Ping request) {
            return request.message();
        }
    }

    @Configuration
    static class NotificationHandlers {
        @Bean
        NotificationHandler<Notification> everything() {
            return NotificationHandler.sync(n -> {});
        }

        @Bean
        NotificationHandler<AuditEvent> audit() {
            return NotificationHandler.sync(n -> {});
        }

        @Bean
        NotificationHandler<Pinged> pinged() {
            return NotificationHandler.sync(n -> {});
        }
    }

    @Configuration
    static class OrderedHandlers {
        @Bean
        @Order(2)
        NotificationHandler<Ponged> second() {
            return NotificationHandler.sync(n -> {});
        }

        @Bean
        @Order(1)
        NotificationHandler<Ponged> first() {
            return NotificationHandler.sync(n -> {});
        }
    }

    @Configuration
    static class StrategyHandlers extends MediatorConfig {
        @Bean
        StringWriter output() {
            return new StringWriter();
        }

        @Bean
        RequestHandler<Ping, String> pingHandler(StringWriter output) {
            PrintWriter writer = new PrintWriter(output, true);
            return RequestHandler.sync(ping -> {
                writer.println(ping.message());
                return ping.message();
            });
        }

        @Bean
        StrategyNotificationHandler<StrategyNotification> strategyNotificationHandler(Mediator mediator) {
            return new StrategyNotificationHandler<>(mediator);
        }
    }
}
