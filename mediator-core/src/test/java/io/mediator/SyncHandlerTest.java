package io.mediator;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncHandlerTest {

    record Ping(String message) implements Request<String> {}

    record Pinged(String message) implements Notification {}

    static final class PongHandler extends SyncRequestHandler<Ping, String> {
        @Override
        protected String handleCore(Ping request) {
            return request.message() + " Pong";
        }
    }

    static final class FailingHandler extends SyncRequestHandler<Ping, String> {
        private final Exception failure;

        FailingHandler(Exception failure) {
            this.failure = failure;
        }

        @Override
        protected String handleCore(Ping request) throws Exception {
            throw failure;
        }
    }

    static final class RecordingNotificationHandler extends SyncNotificationHandler<Pinged> {
        final AtomicReference<Pinged> seen = new AtomicReference<>();

        @Override
        protected void handleCore(Pinged notification) {
            seen.set(notification);
        }
    }

    // ── Request handlers ────────────────────────────────────────────

    @Test
    void requestHandlerCompletesWithResult() {
        CompletableFuture<String> result = new PongHandler().handle(new Ping("Ping")).toCompletableFuture();

        assertTrue(result.isDone());
        assertEquals("Ping Pong", result.join());
    }

    @Test
    void requestHandlerFailureBecomesFailedStage() {
        IOException failure = new IOException("disk");

        CompletableFuture<String> result = new FailingHandler(failure).handle(new Ping("Ping")).toCompletableFuture();

        CompletionException ex = assertThrows(CompletionException.class, result::join);
        assertSame(failure, ex.getCause());
    }

    @Test
    void lambdaRequestHandlerCatchesCheckedExceptions() {
        IOException failure = new IOException("disk");
        RequestHandler<Ping, String> handler = RequestHandler.sync(ping -> {
            throw failure;
        });

        CompletableFuture<String> result = handler.handle(new Ping("Ping")).toCompletableFuture();

        assertSame(failure, assertThrows(CompletionException.class, result::join).getCause());
    }

    // ── Notification handlers ───────────────────────────────────────

    @Test
    void notificationHandlerCompletesAfterBody() {
        RecordingNotificationHandler handler = new RecordingNotificationHandler();
        Pinged pinged = new Pinged("Ping");

        CompletableFuture<Void> result = handler.handle(pinged).toCompletableFuture();

        assertTrue(result.isDone());
        assertSame(pinged, handler.seen.get());
    }

    @Test
    void lambdaNotificationHandlerCatchesCheckedExceptions() {
        IOException failure = new IOException("disk");
        NotificationHandler<Pinged> handler = NotificationHandler.sync(n -> {
            throw failure;
        });

        CompletableFuture<Void> result = handler.handle(new Pinged("Ping")).toCompletableFuture();

        assertSame(failure, assertThrows(CompletionException.class, result::join).getCause());
    }

    @Test
    void unitPrintsAsEmptyTuple() {
        assertEquals("()", Unit.VALUE.toString());
    }
}
