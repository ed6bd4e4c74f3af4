package in.sessiongate.broker;

import in.sessiongate.domain.event.BrokerEvent;

import java.util.List;

/**
 * @param nextCursor sequence to pass as {@code after} for the next page, null when exhausted
 */
public record EventPage(List<BrokerEvent> events, Long nextCursor) {
}
