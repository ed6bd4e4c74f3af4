package in.sessiongate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Short-lived opaque tokens letting browsers open streams without the API key.
 *
 * Features:
 * - 32 random bytes, base64url without padding
 * - Fixed TTL (at least 30 s)
 * - At most {@value #MAX_TOKENS} live tokens; the oldest is evicted first
 * - Expired tokens pruned every minute
 */
public class StreamTokenService {
    private static final Logger log = LoggerFactory.getLogger(StreamTokenService.class);

    public static final int MAX_TOKENS = 2000;
    public static final long MIN_TTL_MS = 30_000;
    public static final long PRUNE_INTERVAL_MS = 60_000;

    public record StreamToken(String token, long expiresAt, long ttlSeconds) {}

    private final long ttlMs;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final LinkedHashMap<String, Long> tokens = new LinkedHashMap<>();
    private ScheduledFuture<?> pruneTask;

    public StreamTokenService(long ttlMs, Clock clock) {
        this.ttlMs = Math.max(MIN_TTL_MS, ttlMs);
        this.clock = clock;
    }

    public synchronized void start(ScheduledExecutorService scheduler) {
        if (pruneTask != null) return;
        pruneTask = scheduler.scheduleAtFixedRate(this::prune, PRUNE_INTERVAL_MS, PRUNE_INTERVAL_MS, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (pruneTask != null) {
            pruneTask.cancel(false);
            pruneTask = null;
        }
    }

    public synchronized StreamToken issue() {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        long expiresAt = clock.millis() + ttlMs;
        tokens.put(token, expiresAt);

        Iterator<String> oldest = tokens.keySet().iterator();
        while (tokens.size() > MAX_TOKENS && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
        return new StreamToken(token, expiresAt, ttlMs / 1000);
    }

    public synchronized boolean isValid(String token) {
        if (token == null || token.isEmpty()) return false;
        Long expiresAt = tokens.get(token);
        if (expiresAt == null) return false;
        if (expiresAt <= clock.millis()) {
            tokens.remove(token);
            return false;
        }
        return true;
    }

    public synchronized int prune() {
        long now = clock.millis();
        int before = tokens.size();
        tokens.entrySet().removeIf(e -> e.getValue() <= now);
        int removed = before - tokens.size();
        if (removed > 0) {
            log.debug("[AUTH] Pruned {} expired stream tokens", removed);
        }
        return removed;
    }

    public synchronized int size() {
        return tokens.size();
    }
}
