package in.sessiongate.domain.event;

/**
 * Event scope determines which stream filters see the event.
 */
public enum EventScope {
    /**
     * GLOBAL: not tied to a session.
     * Examples: WEBHOOK_INBOUND without a session id
     */
    GLOBAL,

    /**
     * SESSION: produced by or about a single session.
     * Examples: QR, CONNECTION_UPDATE, MESSAGE_OUTBOUND
     */
    SESSION
}
