package in.sessiongate.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * In-flight message statuses of one session.
 *
 * Features:
 * - Live buckets "0".."5": every tracked id counts in exactly one bucket
 * - Terminal statuses (0 or at least 3) leave the ledger immediately, folded into totals
 * - Non-terminal entries older than the TTL are swept periodically
 * - Ack waiters resolve with the first status update, or null at their deadline
 * - The last {@value #RECENT_FINAL_CAPACITY} finalized statuses stay visible to late waiters
 * - Rolling ack latency (dispatch to first status of 2 or more)
 *
 * Status updates are monotonic: a code not greater than the current one only
 * refreshes updatedAt, except FAILED which is accepted from any live status.
 */
public class StatusLedger {
    private static final Logger log = LoggerFactory.getLogger(StatusLedger.class);

    /**
     * Observer of applied updates. Called outside the ledger monitor.
     */
    public interface Listener {
        /**
         * @param previous     status before the update, null when the id was untracked
         * @param ackLatencyMs latency sample folded by this update, null when none
         * @param finalized    true when the update removed the entry
         */
        void onStatusApplied(String messageId, Integer previous, int status, Long ackLatencyMs, boolean finalized);
    }

    public record StatusEntry(int status, long updatedAt) {}

    public record AckStats(long totalMs, long samples, Long lastMs, Long avgMs) {}

    private record AckWaiter(CompletableFuture<Integer> future, ScheduledFuture<?> timer) {}

    static final int RECENT_FINAL_CAPACITY = 1024;

    private final String sessionId;
    private final long ttlMs;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Listener listener;

    private final Map<String, StatusEntry> entries = new HashMap<>();
    private final Map<String, Long> ackSentAt = new HashMap<>();
    private final Map<String, AckWaiter> waiters = new HashMap<>();

    // Terminal statuses applied by updates, oldest evicted first
    private final Map<String, Integer> recentFinal = new LinkedHashMap<>(64, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Integer> eldest) {
            return size() > RECENT_FINAL_CAPACITY;
        }
    };

    private final long[] live = new long[StatusCodes.MAX + 1];
    private final long[] totals = new long[StatusCodes.MAX + 1];

    private long latencyTotalMs = 0;
    private long latencyCount = 0;
    private Long latencyLastMs = null;

    private ScheduledFuture<?> sweepTask;
    private boolean closed = false;

    public StatusLedger(String sessionId, long ttlMs, Clock clock,
                        ScheduledExecutorService scheduler, Listener listener) {
        this.sessionId = sessionId;
        this.ttlMs = ttlMs;
        this.clock = clock;
        this.scheduler = scheduler;
        this.listener = listener;
    }

    /**
     * Start the periodic sweep.
     */
    public synchronized void start(long sweepIntervalMs) {
        if (sweepTask != null || closed) return;
        sweepTask = scheduler.scheduleAtFixedRate(this::sweepSafely,
            sweepIntervalMs, sweepIntervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a dispatched message as pending and start its ack-latency clock.
     */
    public synchronized void trackSent(String messageId) {
        long now = clock.millis();
        StatusEntry existing = entries.get(messageId);
        if ((existing != null && existing.status() > StatusCodes.PENDING) || recentFinal.containsKey(messageId)) {
            // status arrived before the send result
            return;
        }
        if (existing == null) {
            live[StatusCodes.PENDING]++;
        }
        entries.put(messageId, new StatusEntry(StatusCodes.PENDING, now));
        ackSentAt.put(messageId, now);
    }

    /**
     * Apply a normalized status code.
     *
     * @return true when the status advanced
     */
    public boolean applyStatus(String messageId, int status) {
        if (!StatusCodes.isValid(status)) {
            return false;
        }

        Integer previous;
        Long latency = null;
        boolean finalized = false;
        AckWaiter waiter;

        synchronized (this) {
            if (closed) return false;
            long now = clock.millis();
            StatusEntry entry = entries.get(messageId);
            previous = entry == null ? null : entry.status();

            Integer finalStatus = entry == null ? recentFinal.get(messageId) : null;
            if (finalStatus != null && status <= finalStatus) {
                // duplicate or late update of a finalized message
                return false;
            }

            if (previous != null && status <= previous && status != StatusCodes.FAILED) {
                entries.put(messageId, new StatusEntry(previous, now));
                return false;
            }

            if (previous != null) {
                live[previous]--;
            }
            live[status]++;
            entries.put(messageId, new StatusEntry(status, now));

            if (status >= StatusCodes.SERVER_ACK) {
                Long sentAt = ackSentAt.remove(messageId);
                if (sentAt != null) {
                    latency = Math.max(0, now - sentAt);
                    latencyTotalMs += latency;
                    latencyCount++;
                    latencyLastMs = latency;
                }
            }

            if (StatusCodes.isTerminal(status)) {
                remove(messageId);
                recentFinal.put(messageId, status);
                finalized = true;
            }

            waiter = waiters.remove(messageId);
            if (waiter != null) {
                waiter.timer().cancel(false);
            }
        }

        if (waiter != null) {
            waiter.future().complete(status);
        }
        if (listener != null) {
            listener.onStatusApplied(messageId, previous, status, latency, finalized);
        }
        return true;
    }

    /**
     * Wait for the first status update of a message.
     * A second call for the same id shares the pending waiter.
     * Resolves immediately when the message already reached server ack
     * or was finalized by an earlier update.
     *
     * @return future completing with the status, or null after {@code timeoutMs}
     */
    public synchronized CompletableFuture<Integer> waitForAck(String messageId, long timeoutMs) {
        StatusEntry entry = entries.get(messageId);
        if (entry != null && entry.status() >= StatusCodes.SERVER_ACK) {
            return CompletableFuture.completedFuture(entry.status());
        }
        Integer finalStatus = recentFinal.get(messageId);
        if (finalStatus != null) {
            return CompletableFuture.completedFuture(finalStatus);
        }
        if (closed || timeoutMs <= 0) {
            return CompletableFuture.completedFuture(null);
        }

        AckWaiter existing = waiters.get(messageId);
        if (existing != null) {
            return existing.future();
        }

        CompletableFuture<Integer> future = new CompletableFuture<>();
        ScheduledFuture<?> timer = scheduler.schedule(() -> expireWaiter(messageId, future),
            timeoutMs, TimeUnit.MILLISECONDS);
        waiters.put(messageId, new AckWaiter(future, timer));
        return future;
    }

    private void expireWaiter(String messageId, CompletableFuture<Integer> future) {
        synchronized (this) {
            AckWaiter current = waiters.get(messageId);
            if (current != null && current.future() == future) {
                waiters.remove(messageId);
            }
        }
        future.complete(null);
    }

    /**
     * Remove terminal and expired entries.
     *
     * @return number of entries removed
     */
    public synchronized int sweep() {
        long now = clock.millis();
        List<String> expired = new ArrayList<>();
        for (Map.Entry<String, StatusEntry> e : entries.entrySet()) {
            StatusEntry entry = e.getValue();
            if (StatusCodes.isTerminal(entry.status()) || now - entry.updatedAt() >= ttlMs) {
                expired.add(e.getKey());
            }
        }
        expired.forEach(this::remove);
        int removed = expired.size();
        if (removed > 0) {
            log.debug("[LEDGER] {} swept {} entries, {} remaining", sessionId, removed, entries.size());
        }
        return removed;
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.warn("[LEDGER] {} sweep failed: {}", sessionId, e.toString());
        }
    }

    // Caller holds the monitor.
    private void remove(String messageId) {
        StatusEntry entry = entries.remove(messageId);
        if (entry == null) return;
        live[entry.status()]--;
        totals[entry.status()]++;
        ackSentAt.remove(messageId);
    }

    /**
     * Resolve every outstanding waiter with null and cancel its timer.
     *
     * @return number of waiters released
     */
    public int releaseWaiters() {
        List<AckWaiter> pending;
        synchronized (this) {
            pending = new ArrayList<>(waiters.values());
            waiters.clear();
        }
        for (AckWaiter waiter : pending) {
            waiter.timer().cancel(false);
            waiter.future().complete(null);
        }
        if (!pending.isEmpty()) {
            log.info("[LEDGER] {} released {} ack waiters", sessionId, pending.size());
        }
        return pending.size();
    }

    /**
     * Stop the sweep and release all waiters. Later updates are ignored.
     */
    public void close() {
        synchronized (this) {
            if (closed) return;
            closed = true;
            if (sweepTask != null) {
                sweepTask.cancel(false);
                sweepTask = null;
            }
        }
        releaseWaiters();
    }

    // ═══════════════════════════════════════════════════════════════
    // READ ACCESS
    // ═══════════════════════════════════════════════════════════════

    public synchronized StatusEntry statusOf(String messageId) {
        return entries.get(messageId);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized int waiterCount() {
        return waiters.size();
    }

    public synchronized long liveCount(int status) {
        return live[status];
    }

    public synchronized long totalCount(int status) {
        return totals[status];
    }

    /**
     * Live buckets keyed "0".."5".
     */
    public synchronized Map<String, Long> liveBuckets() {
        return buckets(live);
    }

    /**
     * Finalized counts keyed "0".."5".
     */
    public synchronized Map<String, Long> totalBuckets() {
        return buckets(totals);
    }

    public synchronized AckStats ackStats() {
        Long avg = latencyCount == 0 ? null : Math.round((double) latencyTotalMs / latencyCount);
        return new AckStats(latencyTotalMs, latencyCount, latencyLastMs, avg);
    }

    private static Map<String, Long> buckets(long[] counts) {
        Map<String, Long> result = new LinkedHashMap<>();
        for (int i = 0; i < counts.length; i++) {
            result.put(String.valueOf(i), counts[i]);
        }
        return result;
    }
}
