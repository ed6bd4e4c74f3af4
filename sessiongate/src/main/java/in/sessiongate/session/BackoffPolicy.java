package in.sessiongate.session;

import java.time.Duration;

/**
 * Exponential reconnect backoff for one session.
 *
 * Features:
 * - The delay handed out is the current delay, capped at the maximum
 * - Each handed-out delay doubles the next one, up to the cap
 * - Reset to the initial delay after a successful open
 *
 * Usage:
 * <pre>
 * BackoffPolicy backoff = BackoffPolicy.builder()
 *     .initialDelay(Duration.ofSeconds(1))
 *     .maxDelay(Duration.ofSeconds(30))
 *     .build();
 *
 * scheduler.schedule(this::reconnect, backoff.nextDelay().toMillis(), TimeUnit.MILLISECONDS);
 * // on open
 * backoff.reset();
 * </pre>
 */
public class BackoffPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    private Duration currentDelay;
    private int scheduledCount = 0;

    private BackoffPolicy(Duration initialDelay, Duration maxDelay, double multiplier) {
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.currentDelay = initialDelay;
    }

    /**
     * Delay to use for the reconnect being scheduled now. Advances the backoff.
     */
    public synchronized Duration nextDelay() {
        Duration delay = currentDelay.compareTo(maxDelay) > 0 ? maxDelay : currentDelay;
        long next = (long) (currentDelay.toMillis() * multiplier);
        currentDelay = Duration.ofMillis(Math.min(next, maxDelay.toMillis()));
        scheduledCount++;
        return delay;
    }

    /**
     * Delay the next call to {@link #nextDelay()} would return.
     */
    public synchronized Duration currentDelay() {
        return currentDelay;
    }

    public synchronized void reset() {
        currentDelay = initialDelay;
        scheduledCount = 0;
    }

    /**
     * Reconnects scheduled since the last reset.
     */
    public synchronized int getScheduledCount() {
        return scheduledCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BackoffPolicy of(long initialMs, long maxMs) {
        return builder()
            .initialDelay(Duration.ofMillis(initialMs))
            .maxDelay(Duration.ofMillis(maxMs))
            .build();
    }

    public static class Builder {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;

        public Builder initialDelay(Duration initialDelay) {
            if (initialDelay.isNegative() || initialDelay.isZero()) {
                throw new IllegalArgumentException("Initial delay must be positive");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            if (maxDelay.isNegative() || maxDelay.isZero()) {
                throw new IllegalArgumentException("Max delay must be positive");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier <= 1.0) {
                throw new IllegalArgumentException("Multiplier must be greater than 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public BackoffPolicy build() {
            if (initialDelay.compareTo(maxDelay) > 0) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            return new BackoffPolicy(initialDelay, maxDelay, multiplier);
        }
    }
}
