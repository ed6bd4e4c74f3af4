package in.sessiongate.session;

import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.domain.common.GatewayException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SendDispatcher.
 *
 * Tests:
 * - Sends run one at a time in arrival order
 * - Timeout, failure and pass-through error mapping
 * - Full queue rejection and shutdown of queued sends
 */
class SendDispatcherTest {

    private SendDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.shutdown();
        }
    }

    private static GatewayException failure(CompletableFuture<?> future) {
        CompletionException e = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(GatewayException.class, e.getCause());
        return (GatewayException) e.getCause();
    }

    @Test
    void testSendsRunInOrder() {
        dispatcher = new SendDispatcher("test", 16, 1_000);
        List<Integer> order = new CopyOnWriteArrayList<>();

        CompletableFuture<String> last = null;
        for (int i = 0; i < 5; i++) {
            int n = i;
            last = dispatcher.submit(() -> {
                order.add(n);
                return CompletableFuture.completedFuture("id-" + n);
            });
        }

        assertEquals("id-4", last.join());
        assertEquals(List.of(0, 1, 2, 3, 4), order, "Sends must run in submission order");
    }

    @Test
    void testTimeout() {
        dispatcher = new SendDispatcher("test", 4, 50);

        CompletableFuture<String> result = dispatcher.submit(CompletableFuture::new);

        assertEquals(ErrorCode.SEND_TIMEOUT, failure(result).getErrorCode());
    }

    @Test
    void testFailureMapsToSendFailed() {
        dispatcher = new SendDispatcher("test", 4, 1_000);

        CompletableFuture<String> result = dispatcher.submit(
            () -> CompletableFuture.failedFuture(new IllegalStateException("socket write failed")));

        GatewayException e = failure(result);
        assertEquals(ErrorCode.SEND_FAILED, e.getErrorCode());
        assertEquals("socket write failed", e.getMessage());
    }

    @Test
    void testGatewayExceptionPassesThrough() {
        dispatcher = new SendDispatcher("test", 4, 1_000);

        CompletableFuture<String> result = dispatcher.submit(() -> CompletableFuture.failedFuture(
            new GatewayException(ErrorCode.WHATSAPP_NOT_FOUND, "unknown recipient")));

        assertEquals(ErrorCode.WHATSAPP_NOT_FOUND, failure(result).getErrorCode());
    }

    @Test
    void testFullQueueRejects() {
        dispatcher = new SendDispatcher("test", 1, 10_000);
        CompletableFuture<String> blocker = new CompletableFuture<>();

        CompletableFuture<String> running = dispatcher.submit(() -> blocker);
        CompletableFuture<String> queued = dispatcher.submit(() -> CompletableFuture.completedFuture("queued"));

        GatewayException e = assertThrows(GatewayException.class,
            () -> dispatcher.submit(() -> CompletableFuture.completedFuture("rejected")));
        assertEquals(ErrorCode.SEND_QUEUE_FULL, e.getErrorCode());
        assertEquals(1, dispatcher.queued());

        blocker.complete("first");
        assertEquals("first", running.join());
        assertEquals("queued", queued.join());
    }

    @Test
    void testShutdownFailsQueuedSends() {
        dispatcher = new SendDispatcher("test", 4, 10_000);
        CompletableFuture<String> running = dispatcher.submit(CompletableFuture::new);
        CompletableFuture<String> queued = dispatcher.submit(() -> CompletableFuture.completedFuture("never"));

        dispatcher.shutdown();

        assertEquals(ErrorCode.SOCKET_UNAVAILABLE, failure(queued).getErrorCode());
        assertEquals(ErrorCode.SOCKET_UNAVAILABLE, failure(running).getErrorCode());
        assertThrows(GatewayException.class,
            () -> dispatcher.submit(() -> CompletableFuture.completedFuture("late")), "Rejected after shutdown");
    }
}
