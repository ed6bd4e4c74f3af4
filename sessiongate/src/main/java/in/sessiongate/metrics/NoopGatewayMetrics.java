package in.sessiongate.metrics;

import in.sessiongate.domain.event.EventType;
import in.sessiongate.domain.message.MessageKind;
import in.sessiongate.domain.session.ConnectionState;

/**
 * Metrics sink that records nothing. Used by tests and embedded setups.
 */
public final class NoopGatewayMetrics implements GatewayMetrics {

    public static final NoopGatewayMetrics INSTANCE = new NoopGatewayMetrics();

    private NoopGatewayMetrics() {}

    @Override public void recordMessageSent(MessageKind kind) {}
    @Override public void recordRateLimitRejection() {}
    @Override public void recordAckLatency(long latencyMs) {}
    @Override public void recordStatusUpdate(int status) {}
    @Override public void recordReconnectScheduled() {}
    @Override public void recordConnectionState(ConnectionState state) {}
    @Override public void setSessionCount(int count) {}
    @Override public void recordBrokerEvent(EventType type) {}
    @Override public void recordSubscriberOpened() {}
    @Override public void recordSubscriberClosed() {}
    @Override public void recordStreamDropped(long count) {}
    @Override public void recordWebhookAttempt(String outcome) {}
    @Override public void recordWebhookFailed() {}
    @Override public void recordInboundWebhook(String result) {}
}
