package in.sessiongate.domain.common;

/**
 * Caller-facing error classification: HTTP status plus stable wire code.
 */
public enum ErrorCode {
    // Validation (400)
    INVALID_JSON(400, "invalid_json"),
    INVALID_REQUEST(400, "invalid_request"),
    INVALID_RECIPIENT(400, "invalid_recipient"),
    INVALID_MESSAGE(400, "invalid_message"),
    NAME_INVALID(400, "name_invalid"),
    NAME_EMPTY(400, "name_empty"),
    NOTE_INVALID(400, "note_invalid"),
    NO_UPDATES(400, "no_updates"),
    IDS_REQUIRED(400, "ids_required"),
    DEFAULT_INSTANCE_PROTECTED(400, "default_instance_protected"),

    // Auth (401)
    UNAUTHORIZED(401, "unauthorized"),
    INVALID_SIGNATURE(401, "invalid_signature"),

    // Lookup (404)
    INSTANCE_NOT_FOUND(404, "instance_not_found"),
    QR_UNAVAILABLE(404, "qr_unavailable"),
    ROUTE_NOT_FOUND(404, "not_found"),
    WHATSAPP_NOT_FOUND(404, "whatsapp_not_found"),

    // Conflict (409)
    INSTANCE_EXISTS(409, "instance_exists"),

    // Admission (429)
    RATE_LIMIT_EXCEEDED(429, "rate_limit_exceeded"),

    // Socket (5xx)
    SEND_FAILED(502, "send_failed"),
    SOCKET_UNAVAILABLE(503, "socket_unavailable"),
    SEND_QUEUE_FULL(503, "send_queue_full"),
    SEND_TIMEOUT(504, "send_timeout"),

    // Internal (500)
    PERSISTENCE_FAILED(500, "persistence_failed"),
    INTERNAL_ERROR(500, "internal_error");

    private final int httpStatus;
    private final String code;

    ErrorCode(int httpStatus, String code) {
        this.httpStatus = httpStatus;
        this.code = code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String code() {
        return code;
    }
}
