package in.sessiongate.domain.message;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageKind {
    TEXT("text"),
    IMAGE("image"),
    VIDEO("video"),
    AUDIO("audio"),
    DOCUMENT("document"),
    BUTTONS("buttons"),
    LIST("list"),
    POLL("poll");

    private final String wire;

    MessageKind(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean isMedia() {
        return this == IMAGE || this == VIDEO || this == AUDIO || this == DOCUMENT;
    }

    /**
     * Media kind for a request {@code type} value, or null.
     */
    public static MessageKind mediaKind(String value) {
        if (value == null) return null;
        for (MessageKind kind : values()) {
            if (kind.isMedia() && kind.wire.equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        return null;
    }
}
