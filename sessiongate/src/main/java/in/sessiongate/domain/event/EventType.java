package in.sessiongate.domain.event;

/**
 * Broker event types.
 * Session-scoped events carry the session id; system events may be global.
 */
public enum EventType {
    // ═══════════════════════════════════════════════════════════════
    // CONNECTION (system, session-scoped)
    // ═══════════════════════════════════════════════════════════════

    CONNECTION_UPDATE,
    QR,
    PAIRING_CODE,

    // ═══════════════════════════════════════════════════════════════
    // MESSAGES
    // ═══════════════════════════════════════════════════════════════

    MESSAGE_INBOUND,
    MESSAGE_OUTBOUND,
    MESSAGE_STATUS,

    // ═══════════════════════════════════════════════════════════════
    // SESSION LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    SESSION_CREATED,
    SESSION_UPDATED,
    SESSION_DELETED,
    SESSION_RESET,

    // ═══════════════════════════════════════════════════════════════
    // WEBHOOKS
    // ═══════════════════════════════════════════════════════════════

    WEBHOOK_DELIVERY,   // terminal outbound failure, surfaced to operators
    WEBHOOK_INBOUND
}
