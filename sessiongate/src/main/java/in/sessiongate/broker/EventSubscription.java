package in.sessiongate.broker;

import in.sessiongate.domain.event.BrokerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One live stream subscriber: a bounded queue drained to its sink by the broker flusher.
 * A full queue drops its oldest event.
 */
public final class EventSubscription implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventSubscription.class);

    private final String id;
    private final String instanceId;
    private final EventSink sink;
    private final BlockingQueue<BrokerEvent> queue;
    private final Consumer<EventSubscription> onClose;

    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> keepaliveTask;

    EventSubscription(String id, String instanceId, EventSink sink, int capacity,
                      Consumer<EventSubscription> onClose) {
        this.id = id;
        this.instanceId = instanceId;
        this.sink = sink;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.onClose = onClose;
    }

    public String getId() {
        return id;
    }

    public long getDropped() {
        return dropped.get();
    }

    public long getDelivered() {
        return delivered.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    boolean accepts(BrokerEvent event) {
        return instanceId == null || instanceId.equals(event.instanceId());
    }

    /**
     * @return true when an older event was dropped to make room
     */
    boolean offer(BrokerEvent event) {
        if (queue.offer(event)) {
            return false;
        }
        queue.poll();
        queue.offer(event);
        dropped.incrementAndGet();
        return true;
    }

    /**
     * Attach the keepalive timer; cancelled at once when the subscription already closed.
     */
    void setKeepaliveTask(ScheduledFuture<?> task) {
        this.keepaliveTask = task;
        if (closed.get()) {
            task.cancel(false);
        }
    }

    synchronized void flush() {
        if (closed.get() || queue.isEmpty()) return;
        List<BrokerEvent> batch = new ArrayList<>(queue.size());
        queue.drainTo(batch);
        try {
            for (BrokerEvent event : batch) {
                sink.deliver(event);
                delivered.incrementAndGet();
            }
        } catch (RuntimeException e) {
            log.info("[STREAM] {} delivery failed, closing: {}", id, e.toString());
            close();
        }
    }

    synchronized void keepalive() {
        if (closed.get()) return;
        try {
            sink.keepalive();
        } catch (RuntimeException e) {
            log.info("[STREAM] {} keepalive failed, closing: {}", id, e.toString());
            close();
        }
    }

    /**
     * Tear down the subscription: cancel keepalive, unregister, release the sink. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        ScheduledFuture<?> task = keepaliveTask;
        if (task != null) {
            task.cancel(false);
        }
        queue.clear();
        onClose.accept(this);
        try {
            sink.close();
        } catch (RuntimeException e) {
            log.debug("[STREAM] {} sink close failed: {}", id, e.toString());
        }
    }
}
