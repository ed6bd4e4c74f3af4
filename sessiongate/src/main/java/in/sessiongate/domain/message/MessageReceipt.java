package in.sessiongate.domain.message;

import java.util.List;

/**
 * Per-recipient receipt reported by the socket for an outbound message.
 */
public record MessageReceipt(
    Long receiptTimestamp,
    Long readTimestamp,
    Long playedTimestamp,
    List<String> pendingDeviceJids,
    List<String> deliveredDeviceJids
) {
    public MessageReceipt {
        pendingDeviceJids = pendingDeviceJids == null ? List.of() : List.copyOf(pendingDeviceJids);
        deliveredDeviceJids = deliveredDeviceJids == null ? List.of() : List.copyOf(deliveredDeviceJids);
    }

    /**
     * Highest status the receipt proves, or null when it proves nothing.
     * played → 5, read → 4, delivered device → 3, receipt timestamp → 2, pending device → 1.
     */
    public Integer deriveStatus() {
        if (positive(playedTimestamp)) return 5;
        if (positive(readTimestamp)) return 4;
        if (hasAny(deliveredDeviceJids)) return 3;
        if (positive(receiptTimestamp)) return 2;
        if (hasAny(pendingDeviceJids)) return 1;
        return null;
    }

    private static boolean positive(Long value) {
        return value != null && value > 0;
    }

    private static boolean hasAny(List<String> jids) {
        return jids.stream().anyMatch(j -> j != null && !j.isBlank());
    }
}
