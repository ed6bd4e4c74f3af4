package in.sessiongate.broker;

import in.sessiongate.domain.event.BrokerEvent;

/**
 * Transport end of one stream subscription (SSE connection, WebSocket channel).
 * Calls for one subscription never overlap.
 */
public interface EventSink {

    /**
     * @throws RuntimeException when the transport is gone; the subscription is then closed
     */
    void deliver(BrokerEvent event);

    void keepalive();

    /**
     * Release the transport. Called once, after the subscription is torn down.
     */
    void close();
}
