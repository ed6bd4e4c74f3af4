package in.sessiongate.util;

import java.util.Arrays;
import java.util.List;

/**
 * Environment lookups: process environment first, then system properties, then the default.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static long getLong(String key, long defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Positive long, or the default when missing, unparsable or not positive.
     */
    public static long getPositiveLong(String key, long defaultValue) {
        long value = getLong(key, defaultValue);
        return value > 0 ? value : defaultValue;
    }

    /**
     * Comma-separated list with blanks removed.
     */
    public static List<String> getList(String key, String defaultValue) {
        String value = get(key, defaultValue);
        if (value == null) return List.of();
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private Env() {}
}
