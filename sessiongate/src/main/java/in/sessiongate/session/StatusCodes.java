package in.sessiongate.session;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;
import java.util.Map;

/**
 * Message status ladder: 0 failed, 1 pending, 2 server ack, 3 delivered, 4 read, 5 played.
 */
public final class StatusCodes {

    public static final int FAILED = 0;
    public static final int PENDING = 1;
    public static final int SERVER_ACK = 2;
    public static final int DELIVERED = 3;
    public static final int READ = 4;
    public static final int PLAYED = 5;

    public static final int MAX = PLAYED;

    private static final Map<String, Integer> BY_NAME = Map.ofEntries(
        Map.entry("ERROR", FAILED),
        Map.entry("FAILED", FAILED),
        Map.entry("PENDING", PENDING),
        Map.entry("QUEUED", PENDING),
        Map.entry("SENT", PENDING),
        Map.entry("SERVER_ACK", SERVER_ACK),
        Map.entry("ACK", SERVER_ACK),
        Map.entry("DELIVERY_ACK", DELIVERED),
        Map.entry("DELIVERED", DELIVERED),
        Map.entry("READ", READ),
        Map.entry("PLAYED", PLAYED)
    );

    private static final String[] OBJECT_KEYS = {"status", "code", "value"};

    public static boolean isTerminal(int status) {
        return status == FAILED || status >= DELIVERED;
    }

    public static boolean isValid(int status) {
        return status >= FAILED && status <= MAX;
    }

    /**
     * Normalize a platform status (number, numeric string, name, or object
     * carrying status/code/value) to a ladder code. Null when unrecognized.
     */
    public static Integer normalize(JsonNode raw) {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return null;
        }
        if (raw.isNumber()) {
            return checked(raw.asInt());
        }
        if (raw.isTextual()) {
            return normalize(raw.asText());
        }
        if (raw.isObject()) {
            for (String key : OBJECT_KEYS) {
                Integer result = normalize(raw.get(key));
                if (result != null) {
                    return result;
                }
            }
        }
        return null;
    }

    public static Integer normalize(String raw) {
        if (raw == null) return null;
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) return null;
        double number;
        try {
            number = Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return BY_NAME.get(trimmed.toUpperCase(Locale.ROOT));
        }
        // NaN and Infinity parse but are not statuses
        return Double.isFinite(number) ? checked((int) number) : null;
    }

    private static Integer checked(int status) {
        return isValid(status) ? status : null;
    }

    private StatusCodes() {}
}
