package in.sessiongate.session;

/**
 * Per-session tuning shared by every session of the registry.
 *
 * Usage:
 * <pre>
 * SessionSettings settings = SessionSettings.builder()
 *     .rateLimit(20, 15_000)
 *     .reconnect(1_000, 30_000)
 *     .build();
 * </pre>
 */
public record SessionSettings(
    int rateMaxSends,
    long rateWindowMs,
    long sendTimeoutMs,
    int sendQueueCapacity,
    long statusTtlMs,
    long statusSweepIntervalMs,
    long reconnectMinMs,
    long reconnectMaxMs,
    long qrTtlFirstMs,
    long qrTtlNextMs
) {
    public static SessionSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int rateMaxSends = 20;
        private long rateWindowMs = 15_000;
        private long sendTimeoutMs = 25_000;
        private int sendQueueCapacity = 64;
        private long statusTtlMs = 600_000;
        private long statusSweepIntervalMs = 60_000;
        private long reconnectMinMs = 1_000;
        private long reconnectMaxMs = 30_000;
        private long qrTtlFirstMs = 60_000;
        private long qrTtlNextMs = 20_000;

        public Builder rateLimit(int maxSends, long windowMs) {
            if (maxSends <= 0) {
                throw new IllegalArgumentException("Rate max sends must be positive");
            }
            if (windowMs <= 0) {
                throw new IllegalArgumentException("Rate window must be positive");
            }
            this.rateMaxSends = maxSends;
            this.rateWindowMs = windowMs;
            return this;
        }

        public Builder sendTimeoutMs(long sendTimeoutMs) {
            if (sendTimeoutMs <= 0) {
                throw new IllegalArgumentException("Send timeout must be positive");
            }
            this.sendTimeoutMs = sendTimeoutMs;
            return this;
        }

        public Builder sendQueueCapacity(int capacity) {
            if (capacity <= 0) {
                throw new IllegalArgumentException("Send queue capacity must be positive");
            }
            this.sendQueueCapacity = capacity;
            return this;
        }

        public Builder statusTtlMs(long statusTtlMs) {
            if (statusTtlMs <= 0) {
                throw new IllegalArgumentException("Status TTL must be positive");
            }
            this.statusTtlMs = statusTtlMs;
            return this;
        }

        public Builder statusSweepIntervalMs(long intervalMs) {
            if (intervalMs <= 0) {
                throw new IllegalArgumentException("Sweep interval must be positive");
            }
            this.statusSweepIntervalMs = intervalMs;
            return this;
        }

        public Builder reconnect(long minMs, long maxMs) {
            if (minMs <= 0 || maxMs <= 0) {
                throw new IllegalArgumentException("Reconnect delays must be positive");
            }
            if (minMs > maxMs) {
                throw new IllegalArgumentException("Initial delay cannot exceed max delay");
            }
            this.reconnectMinMs = minMs;
            this.reconnectMaxMs = maxMs;
            return this;
        }

        public Builder qrTtl(long firstMs, long nextMs) {
            if (firstMs <= 0 || nextMs <= 0) {
                throw new IllegalArgumentException("QR TTL must be positive");
            }
            this.qrTtlFirstMs = firstMs;
            this.qrTtlNextMs = nextMs;
            return this;
        }

        public SessionSettings build() {
            return new SessionSettings(rateMaxSends, rateWindowMs, sendTimeoutMs, sendQueueCapacity,
                statusTtlMs, statusSweepIntervalMs, reconnectMinMs, reconnectMaxMs, qrTtlFirstMs, qrTtlNextMs);
        }
    }
}
