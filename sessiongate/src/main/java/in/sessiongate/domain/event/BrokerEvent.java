package in.sessiongate.domain.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Immutable, sequenced broker event.
 * Updates (ack, delivery) produce a copy that replaces the stored instance.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BrokerEvent(
    String id,
    long sequence,
    EventType type,

    // Scoping
    String instanceId,       // null for GLOBAL
    EventDirection direction,

    // Payload
    JsonNode payload,

    // Metadata
    long createdAt,          // epoch millis
    boolean acknowledged,
    Delivery delivery        // null unless forwarded by webhook
) {
    /**
     * Unsequenced draft passed to {@code EventBroker.append}.
     */
    public static BrokerEvent draft(EventType type, String instanceId, EventDirection direction, JsonNode payload) {
        return new BrokerEvent(null, 0, type, instanceId, direction, payload, 0, false, null);
    }

    @JsonProperty("scope")
    public EventScope scope() {
        return instanceId == null ? EventScope.GLOBAL : EventScope.SESSION;
    }

    public BrokerEvent sequenced(String newId, long newSequence, long at) {
        return new BrokerEvent(newId, newSequence, type, instanceId, direction, payload, at, acknowledged, delivery);
    }

    public BrokerEvent acknowledge() {
        return new BrokerEvent(id, sequence, type, instanceId, direction, payload, createdAt, true, delivery);
    }

    public BrokerEvent withDelivery(Delivery newDelivery) {
        return new BrokerEvent(id, sequence, type, instanceId, direction, payload, createdAt, acknowledged, newDelivery);
    }
}
