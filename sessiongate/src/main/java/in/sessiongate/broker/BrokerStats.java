package in.sessiongate.broker;

/**
 * @param pending retained events not yet acknowledged
 * @param total   retained events
 */
public record BrokerStats(int pending, int total, Long lastEventAt, Long lastAckAt, long lastSequence) {
}
