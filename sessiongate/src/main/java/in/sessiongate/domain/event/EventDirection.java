package in.sessiongate.domain.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventDirection {
    INBOUND("inbound"),
    OUTBOUND("outbound"),
    SYSTEM("system");

    private final String wire;

    EventDirection(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /**
     * Parse a query value; null for anything unrecognized.
     */
    public static EventDirection fromWire(String value) {
        if (value == null) return null;
        for (EventDirection d : values()) {
            if (d.wire.equalsIgnoreCase(value.trim())) {
                return d;
            }
        }
        return null;
    }
}
