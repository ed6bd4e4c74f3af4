package in.sessiongate.domain.session;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Connection state of one chat session.
 */
public enum ConnectionState {
    CONNECTING("connecting"),
    OPEN("open"),
    CLOSE("close"),
    QR_TIMEOUT("qr_timeout");

    private final String wire;

    ConnectionState(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
