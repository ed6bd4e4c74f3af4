package in.sessiongate.metrics;

import in.sessiongate.domain.event.EventType;
import in.sessiongate.domain.message.MessageKind;
import in.sessiongate.domain.session.ConnectionState;

/**
 * Gateway metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Sends by message kind and rate-limit rejections
 * - Ack latency and status transitions
 * - Reconnects and connection state changes
 * - Broker append volume, stream subscribers and drops
 * - Webhook attempts (outbound) and inbound webhook results
 */
public interface GatewayMetrics {

    void recordMessageSent(MessageKind kind);

    void recordRateLimitRejection();

    /**
     * Record the time between dispatch and the first server-ack or better.
     *
     * @param latencyMs latency in milliseconds
     */
    void recordAckLatency(long latencyMs);

    void recordStatusUpdate(int status);

    void recordReconnectScheduled();

    void recordConnectionState(ConnectionState state);

    void setSessionCount(int count);

    void recordBrokerEvent(EventType type);

    void recordSubscriberOpened();

    void recordSubscriberClosed();

    void recordStreamDropped(long count);

    /**
     * Record one outbound webhook attempt.
     *
     * @param outcome success, retry or failed
     */
    void recordWebhookAttempt(String outcome);

    void recordWebhookFailed();

    /**
     * Record an inbound webhook.
     *
     * @param result accepted, duplicate or rejected
     */
    void recordInboundWebhook(String result);
}
