package in.sessiongate.session;

import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.domain.common.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Serializes the sends of one session.
 *
 * A single consumer thread drains a bounded queue in arrival order and waits
 * for each socket operation (up to the send timeout) before starting the next.
 * A full queue rejects immediately.
 */
public class SendDispatcher {
    private static final Logger log = LoggerFactory.getLogger(SendDispatcher.class);

    private final String sessionId;
    private final long sendTimeoutMs;
    private final ThreadPoolExecutor executor;

    public SendDispatcher(String sessionId, int queueCapacity, long sendTimeoutMs) {
        this.sessionId = sessionId;
        this.sendTimeoutMs = sendTimeoutMs;
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity), r -> {
                Thread t = new Thread(r, "send-" + sessionId);
                t.setDaemon(true);
                return t;
            });
    }

    /**
     * Queue a socket operation.
     *
     * @param operation started on the dispatcher thread; its future is awaited there
     * @return future completing with the operation's result, or with a
     *         {@link GatewayException} (send_timeout, send_failed, socket_unavailable)
     * @throws GatewayException send_queue_full when the queue is full or the dispatcher is shut down
     */
    public <T> CompletableFuture<T> submit(Supplier<CompletableFuture<T>> operation) {
        SendTask<T> task = new SendTask<>(operation);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("[DISPATCH] {} send rejected, queue full ({} waiting)", sessionId, executor.getQueue().size());
            throw new GatewayException(ErrorCode.SEND_QUEUE_FULL, "send queue full");
        }
        return task.result;
    }

    public int queued() {
        return executor.getQueue().size();
    }

    /**
     * Stop the consumer. Queued sends fail with socket_unavailable.
     */
    public void shutdown() {
        List<Runnable> dropped = executor.shutdownNow();
        for (Runnable r : dropped) {
            if (r instanceof SendTask<?> task) {
                task.result.completeExceptionally(
                    new GatewayException(ErrorCode.SOCKET_UNAVAILABLE, "session " + sessionId + " stopped"));
            }
        }
        if (!dropped.isEmpty()) {
            log.info("[DISPATCH] {} shut down, failed {} queued sends", sessionId, dropped.size());
        }
    }

    private final class SendTask<T> implements Runnable {
        private final Supplier<CompletableFuture<T>> operation;
        private final CompletableFuture<T> result = new CompletableFuture<>();

        SendTask(Supplier<CompletableFuture<T>> operation) {
            this.operation = operation;
        }

        @Override
        public void run() {
            try {
                T value = operation.get().get(sendTimeoutMs, TimeUnit.MILLISECONDS);
                result.complete(value);
            } catch (TimeoutException e) {
                log.warn("[DISPATCH] {} send timed out after {} ms", sessionId, sendTimeoutMs);
                result.completeExceptionally(new GatewayException(ErrorCode.SEND_TIMEOUT, "send timeout"));
            } catch (ExecutionException e) {
                result.completeExceptionally(classify(e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result.completeExceptionally(
                    new GatewayException(ErrorCode.SOCKET_UNAVAILABLE, "session " + sessionId + " stopped"));
            } catch (RuntimeException e) {
                result.completeExceptionally(classify(e));
            }
        }
    }

    private GatewayException classify(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof GatewayException ge) {
            return ge;
        }
        log.warn("[DISPATCH] {} send failed: {}", sessionId, cause.toString());
        return new GatewayException(ErrorCode.SEND_FAILED, cause.getMessage() == null ? "send failed" : cause.getMessage(), cause);
    }
}
