package io.mediator.strategy;

import io.mediator.HandlerNotFoundException;
import io.mediator.Request;
import io.mediator.RequestHandler;
import io.mediator.dispatch.DefaultMediator;
import io.mediator.registry.DefaultHandlerRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SendRequestsStrategyTest {

    record Ping(String message) implements Request<String> {}

    record Pong(String message) implements Request<String> {}

    @Test
    void repeatBuildsRequestsForOneBasedIndices() {
        SendRequestsStrategy strategy = SendRequestsStrategy.repeat(3, i -> new Ping("Ping" + i));

        assertEquals(List.of(new Ping("Ping1"), new Ping("Ping2"), new Ping("Ping3")), strategy.requests());
    }

    @Test
    void repeatWithZeroCountSendsNothing() {
        assertTrue(SendRequestsStrategy.repeat(0, i -> new Ping("Ping" + i)).requests().isEmpty());
    }

    @Test
    void repeatValidatesArguments() {
        assertThrows(IllegalArgumentException.class, () -> SendRequestsStrategy.repeat(-1, i -> new Ping("x")));
        assertThrows(NullPointerException.class, () -> SendRequestsStrategy.repeat(1, null));
        assertThrows(NullPointerException.class, () -> SendRequestsStrategy.repeat(1, i -> null));
    }

    @Test
    void requestsAreImmutable() {
        SendRequestsStrategy strategy = SendRequestsStrategy.of(new Ping("Ping"));

        assertThrows(UnsupportedOperationException.class, () -> strategy.requests().clear());
    }

    @Test
    void sendsRequestsInOrder() throws Exception {
        List<String> sent = new CopyOnWriteArrayList<>();
        RequestHandler<Ping, String> pingHandler = RequestHandler.sync(ping -> {
            sent.add(ping.message());
            return ping.message();
        });
        RequestHandler<Pong, String> pongHandler = RequestHandler.sync(pong -> {
            sent.add(pong.message());
            return pong.message();
        });
        DefaultMediator mediator = DefaultMediator.builder()
                .handlerFactory(new DefaultHandlerRegistry()
                        .registerRequestHandler(Ping.class, pingHandler)
                        .registerRequestHandler(Pong.class, pongHandler))
                .build();

        SendRequestsStrategy.of(new Ping("a"), new Pong("b"), new Ping("c")).apply(mediator);

        assertEquals(List.of("a", "b", "c"), sent);
    }

    @Test
    void stopsAtFirstFailure() {
        List<String> sent = new CopyOnWriteArrayList<>();
        RequestHandler<Ping, String> pingHandler = RequestHandler.sync(ping -> {
            sent.add(ping.message());
            return ping.message();
        });
        DefaultMediator mediator = DefaultMediator.builder()
                .handlerFactory(new DefaultHandlerRegistry().registerRequestHandler(Ping.class, pingHandler))
                .build();

        SendRequestsStrategy strategy = SendRequestsStrategy.of(new Ping("a"), new Pong("b"), new Ping("c"));

        assertThrows(HandlerNotFoundException.class, () -> strategy.apply(mediator));
        assertEquals(List.of("a"), sent);
    }
}
