package in.sessiongate.broker;

import in.sessiongate.domain.event.BrokerEvent;
import in.sessiongate.domain.event.EventDirection;
import in.sessiongate.domain.event.EventType;

/**
 * Filter for {@link EventBroker#list(EventQuery)}. Null fields match everything.
 *
 * @param after  exclusive sequence cursor
 * @param limit  page size, clamped to [1, {@value #MAX_LIMIT}]
 */
public record EventQuery(
    String instanceId,
    EventType type,
    EventDirection direction,
    Long after,
    Integer limit,
    boolean includeAcknowledged
) {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    public static EventQuery all() {
        return new EventQuery(null, null, null, null, null, false);
    }

    public int effectiveLimit() {
        if (limit == null || limit <= 0) return DEFAULT_LIMIT;
        return Math.min(limit, MAX_LIMIT);
    }

    boolean matches(BrokerEvent event) {
        if (instanceId != null && !instanceId.equals(event.instanceId())) return false;
        if (type != null && type != event.type()) return false;
        if (direction != null && direction != event.direction()) return false;
        if (after != null && event.sequence() <= after) return false;
        return includeAcknowledged || !event.acknowledged();
    }
}
