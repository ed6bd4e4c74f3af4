package in.sessiongate.security;

import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.domain.common.GatewayException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Request field validation and normalization.
 */
public final class InputValidator {

    public static final int MAX_NAME_LENGTH = 80;
    public static final int MAX_NOTE_LENGTH = 280;
    public static final String USER_JID_SUFFIX = "@s.whatsapp.net";

    private static final Pattern E164_BR = Pattern.compile("^55\\d{10,11}$");
    private static final Pattern LOCAL_BR = Pattern.compile("^\\d{10,11}$");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w]+");

    /**
     * Brazilian E.164 digits for a phone number, or null when it cannot be normalized.
     * 55 + 10..11 digits is kept; 10..11 local digits get the 55 prefix.
     */
    public static String normalizePhone(String value) {
        if (value == null) return null;
        String digits = NON_DIGITS.matcher(value).replaceAll("");
        if (E164_BR.matcher(digits).matches()) return digits;
        if (LOCAL_BR.matcher(digits).matches()) return "55" + digits;
        return null;
    }

    /**
     * Recipient JID. Values containing '@' are full JIDs and pass through.
     *
     * @throws GatewayException invalid_recipient
     */
    public static String toJid(String to) {
        if (to == null || to.isBlank()) {
            throw new GatewayException(ErrorCode.INVALID_RECIPIENT, "recipient is required");
        }
        String trimmed = to.trim();
        if (trimmed.contains("@")) {
            return trimmed;
        }
        String phone = normalizePhone(trimmed);
        if (phone == null) {
            throw new GatewayException(ErrorCode.INVALID_RECIPIENT, "invalid recipient: " + trimmed);
        }
        return phone + USER_JID_SUFFIX;
    }

    /**
     * Trimmed session display name.
     *
     * @throws GatewayException name_empty or name_invalid
     */
    public static String sessionName(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new GatewayException(ErrorCode.NAME_EMPTY, "name must not be empty");
        }
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new GatewayException(ErrorCode.NAME_INVALID, "name exceeds " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    /**
     * Trimmed note, cut to {@value #MAX_NOTE_LENGTH} characters. Null becomes empty.
     */
    public static String note(String note) {
        if (note == null) return "";
        String trimmed = note.trim();
        return trimmed.length() > MAX_NOTE_LENGTH ? trimmed.substring(0, MAX_NOTE_LENGTH) : trimmed;
    }

    /**
     * Lowercase slug with runs of non-word characters collapsed to '-', or null when nothing remains.
     */
    public static String slug(String value) {
        if (value == null) return null;
        String slug = NON_WORD.matcher(value.toLowerCase(Locale.ROOT)).replaceAll("-");
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') start++;
        while (end > start && slug.charAt(end - 1) == '-') end--;
        slug = slug.substring(start, end);
        return slug.isEmpty() ? null : slug;
    }

    /**
     * Ack wait in milliseconds, clamped to [0, 60000].
     */
    public static long waitAckMs(long requested) {
        return Math.max(0, Math.min(requested, 60_000));
    }

    private InputValidator() {}
}
