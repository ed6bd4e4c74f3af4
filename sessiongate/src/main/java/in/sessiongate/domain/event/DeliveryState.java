package in.sessiongate.domain.event;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Webhook delivery lifecycle: pending → success | retry → ... → success | failed.
 */
public enum DeliveryState {
    PENDING("pending"),
    RETRY("retry"),
    SUCCESS("success"),
    FAILED("failed");

    private final String wire;

    DeliveryState(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
