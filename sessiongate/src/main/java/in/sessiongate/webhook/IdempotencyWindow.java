package in.sessiongate.webhook;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;

/**
 * Recently seen idempotency keys.
 *
 * Keys expire after the TTL. When the window exceeds its size the oldest
 * tenth is trimmed.
 */
public class IdempotencyWindow {

    private final long ttlMs;
    private final int maxEntries;
    private final Clock clock;

    // key -> first seen (epoch millis), insertion ordered
    private final LinkedHashMap<String, Long> seen = new LinkedHashMap<>();

    public IdempotencyWindow(long ttlMs, int maxEntries, Clock clock) {
        if (ttlMs <= 0 || maxEntries <= 0) {
            throw new IllegalArgumentException("TTL and size must be positive");
        }
        this.ttlMs = ttlMs;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    /**
     * Record a key.
     *
     * @return true when the key is new, false for a duplicate inside the window
     */
    public synchronized boolean register(String key) {
        long now = clock.millis();
        expire(now);
        if (seen.containsKey(key)) {
            return false;
        }
        seen.put(key, now);
        if (seen.size() > maxEntries) {
            trimOldest(Math.max(1, maxEntries / 10));
        }
        return true;
    }

    public synchronized int size() {
        return seen.size();
    }

    private void expire(long now) {
        Iterator<Long> it = seen.values().iterator();
        while (it.hasNext()) {
            if (now - it.next() < ttlMs) {
                break;
            }
            it.remove();
        }
    }

    private void trimOldest(int count) {
        Iterator<String> it = seen.keySet().iterator();
        for (int i = 0; i < count && it.hasNext(); i++) {
            it.next();
            it.remove();
        }
    }
}
