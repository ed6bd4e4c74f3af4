package in.sessiongate.domain.event;

/**
 * Webhook delivery outcome attached to a broker event.
 *
 * @param lastAttemptAt epoch millis of the latest attempt, null before the first
 * @param lastStatus    HTTP status of the latest attempt, null when no response arrived
 * @param lastError     error text of the latest failed attempt
 */
public record Delivery(
    DeliveryState state,
    int attempts,
    int maxAttempts,
    Long lastAttemptAt,
    Integer lastStatus,
    String lastError
) {
    public static Delivery pending(int maxAttempts) {
        return new Delivery(DeliveryState.PENDING, 0, maxAttempts, null, null, null);
    }

    public Delivery succeeded(int attempt, long at, int status) {
        return new Delivery(DeliveryState.SUCCESS, attempt, maxAttempts, at, status, null);
    }

    /**
     * Record a failed attempt; becomes FAILED once {@code attempt} reaches {@code maxAttempts}.
     */
    public Delivery failedAttempt(int attempt, long at, Integer status, String error) {
        DeliveryState next = attempt >= maxAttempts ? DeliveryState.FAILED : DeliveryState.RETRY;
        return new Delivery(next, attempt, maxAttempts, at, status, error);
    }
}
