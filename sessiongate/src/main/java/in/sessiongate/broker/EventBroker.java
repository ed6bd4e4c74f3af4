package in.sessiongate.broker;

import in.sessiongate.domain.event.BrokerEvent;
import in.sessiongate.domain.event.Delivery;
import in.sessiongate.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Append-only, sequenced event log with live fan-out.
 *
 * Features:
 * - Single writer of the sequence: strictly increasing, never reused
 * - Bounded ring of the newest events, oldest evicted first
 * - Resumable subscriptions: backlog replay after a last-seen id, then live tail
 * - Per-subscriber bounded queues (drop-oldest) drained by one flusher thread
 * - Keepalive per subscriber
 * - Append listeners (webhook dispatcher) notified outside the broker monitor
 *
 * Usage:
 * <pre>
 * EventBroker broker = new EventBroker(200, 512, 15_000, metrics, Clock.systemUTC());
 * broker.start();
 * broker.append(BrokerEvent.draft(EventType.QR, "sales", EventDirection.SYSTEM, payload));
 * EventSubscription sub = broker.subscribe(lastEventId, null, sink);
 * </pre>
 */
public class EventBroker {
    private static final Logger log = LoggerFactory.getLogger(EventBroker.class);

    /**
     * Observer of appended events.
     */
    public interface Listener {
        void onEvent(BrokerEvent event);
    }

    private final int capacity;
    private final int subscriberQueueCapacity;
    private final long keepaliveMs;
    private final GatewayMetrics metrics;
    private final Clock clock;

    // Ring (insertion order = sequence order), guarded by this
    private final LinkedHashMap<String, BrokerEvent> ring = new LinkedHashMap<>();
    private long sequence = 0;
    private Long lastEventAt;
    private Long lastAckAt;

    private final Set<EventSubscription> subscriptions = ConcurrentHashMap.newKeySet();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "broker-flusher");
        t.setDaemon(true);
        return t;
    });
    private volatile int flushMs = 50;

    public EventBroker(int capacity, int subscriberQueueCapacity, long keepaliveMs,
                       GatewayMetrics metrics, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Backlog capacity must be positive");
        }
        this.capacity = capacity;
        this.subscriberQueueCapacity = subscriberQueueCapacity;
        this.keepaliveMs = keepaliveMs;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void setFlushMs(int flushMs) {
        this.flushMs = Math.max(5, flushMs);
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(this::flushAll, flushMs, flushMs, TimeUnit.MILLISECONDS);
        log.info("[BROKER] Started (backlog {}, flush {} ms, keepalive {} ms)", capacity, flushMs, keepaliveMs);
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    // ═══════════════════════════════════════════════════════════════
    // APPEND
    // ═══════════════════════════════════════════════════════════════

    /**
     * Assign the next sequence and a fresh id, retain, and fan out.
     */
    public BrokerEvent append(BrokerEvent draft) {
        BrokerEvent event;
        synchronized (this) {
            long now = clock.millis();
            event = draft.sequenced(UUID.randomUUID().toString(), ++sequence, now);
            ring.put(event.id(), event);
            lastEventAt = now;
            evictOverflow();

            for (EventSubscription sub : subscriptions) {
                if (sub.accepts(event) && sub.offer(event)) {
                    metrics.recordStreamDropped(1);
                }
            }
        }

        metrics.recordBrokerEvent(event.type());
        for (Listener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("[BROKER] Listener failed for event {} ({}): {}", event.sequence(), event.type(), e.getMessage(), e);
            }
        }
        return event;
    }

    private void evictOverflow() {
        Iterator<BrokerEvent> it = ring.values().iterator();
        while (ring.size() > capacity && it.hasNext()) {
            it.next();
            it.remove();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // SUBSCRIBE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Subscribe with backlog replay.
     *
     * @param lastEventId last event id (or sequence number) the client saw; replay starts
     *                    after it, or from the oldest retained event when null, unknown or evicted
     * @param instanceId  session filter, null for all
     */
    public EventSubscription subscribe(String lastEventId, String instanceId, EventSink sink) {
        EventSubscription sub = new EventSubscription(UUID.randomUUID().toString(), instanceId, sink,
            subscriberQueueCapacity, this::unregister);
        int replayed = 0;
        synchronized (this) {
            long after = resolveCursor(lastEventId);
            for (BrokerEvent event : ring.values()) {
                if (event.sequence() > after && sub.accepts(event)) {
                    sub.offer(event);
                    replayed++;
                }
            }
            metrics.recordSubscriberOpened();
            subscriptions.add(sub);
        }
        sub.setKeepaliveTask(scheduler.scheduleAtFixedRate(sub::keepalive, keepaliveMs, keepaliveMs, TimeUnit.MILLISECONDS));
        log.info("[BROKER] Subscriber {} (instance={}, lastEventId={}, replay={})",
            sub.getId(), instanceId, lastEventId, replayed);
        return sub;
    }

    // Caller holds the monitor.
    private long resolveCursor(String lastEventId) {
        if (lastEventId == null || lastEventId.isBlank()) {
            return 0;
        }
        BrokerEvent known = ring.get(lastEventId);
        if (known != null) {
            return known.sequence();
        }
        try {
            long seq = Long.parseLong(lastEventId.trim());
            BrokerEvent oldest = ring.isEmpty() ? null : ring.values().iterator().next();
            // a sequence older than the ring replays everything retained
            return oldest != null && seq < oldest.sequence() ? 0 : seq;
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private void unregister(EventSubscription sub) {
        if (subscriptions.remove(sub)) {
            metrics.recordSubscriberClosed();
            log.info("[BROKER] Subscriber {} closed (delivered={}, dropped={})",
                sub.getId(), sub.getDelivered(), sub.getDropped());
        }
    }

    private void flushAll() {
        for (EventSubscription sub : subscriptions) {
            try {
                sub.flush();
            } catch (RuntimeException e) {
                log.warn("[BROKER] Flush failed for {}: {}", sub.getId(), e.toString());
                sub.close();
            }
        }
    }

    public int getSubscriberCount() {
        return subscriptions.size();
    }

    // ═══════════════════════════════════════════════════════════════
    // BOOKKEEPING
    // ═══════════════════════════════════════════════════════════════

    /**
     * Replace the delivery state of a retained event.
     *
     * @return the updated event, or null when it was evicted
     */
    public synchronized BrokerEvent updateDelivery(String eventId, Delivery delivery) {
        BrokerEvent current = ring.get(eventId);
        if (current == null) {
            return null;
        }
        BrokerEvent updated = current.withDelivery(delivery);
        ring.put(eventId, updated);
        return updated;
    }

    /**
     * Mark events acknowledged. Bookkeeping only; replay and delivery are unaffected.
     */
    public AckResult ack(List<String> ids) {
        return ack(ids, null);
    }

    /**
     * Acknowledge only events of one session; ids of other sessions are reported missing.
     *
     * @param instanceId owning session, null for any
     */
    public synchronized AckResult ack(List<String> ids, String instanceId) {
        List<String> acknowledged = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String id : ids) {
            BrokerEvent current = id == null ? null : ring.get(id);
            if (current == null || (instanceId != null && !instanceId.equals(current.instanceId()))) {
                missing.add(id);
                continue;
            }
            if (!current.acknowledged()) {
                ring.put(id, current.acknowledge());
            }
            acknowledged.add(id);
        }
        if (!acknowledged.isEmpty()) {
            lastAckAt = clock.millis();
        }
        return new AckResult(acknowledged, missing);
    }

    public synchronized BrokerEvent get(String eventId) {
        return ring.get(eventId);
    }

    /**
     * Events matching the query in ascending sequence.
     */
    public synchronized EventPage list(EventQuery query) {
        int limit = query.effectiveLimit();
        List<BrokerEvent> page = new ArrayList<>(Math.min(limit, ring.size()));
        boolean more = false;
        for (BrokerEvent event : ring.values()) {
            if (!query.matches(event)) continue;
            if (page.size() == limit) {
                more = true;
                break;
            }
            page.add(event);
        }
        Long next = more ? page.get(page.size() - 1).sequence() : null;
        return new EventPage(page, next);
    }

    /**
     * Newest retained events first.
     *
     * @param instanceId session filter, null for all
     */
    public synchronized List<BrokerEvent> recent(int limit, String instanceId) {
        int max = Math.max(1, Math.min(limit, EventQuery.MAX_LIMIT));
        List<BrokerEvent> all = new ArrayList<>(ring.values());
        Collections.reverse(all);
        List<BrokerEvent> result = new ArrayList<>(max);
        for (BrokerEvent event : all) {
            if (instanceId != null && !instanceId.equals(event.instanceId())) continue;
            result.add(event);
            if (result.size() == max) break;
        }
        return result;
    }

    public synchronized BrokerStats stats() {
        int pending = 0;
        for (BrokerEvent event : ring.values()) {
            if (!event.acknowledged()) pending++;
        }
        return new BrokerStats(pending, ring.size(), lastEventAt, lastAckAt, sequence);
    }

    public synchronized long lastSequence() {
        return sequence;
    }

    /**
     * Close every subscription and stop the flusher.
     */
    public void close() {
        for (EventSubscription sub : List.copyOf(subscriptions)) {
            sub.close();
        }
        scheduler.shutdownNow();
        log.info("[BROKER] Closed at sequence {}", lastSequence());
    }
}
