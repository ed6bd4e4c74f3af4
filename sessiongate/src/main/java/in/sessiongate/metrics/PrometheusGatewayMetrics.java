package in.sessiongate.metrics;

import in.sessiongate.domain.event.EventType;
import in.sessiongate.domain.message.MessageKind;
import in.sessiongate.domain.session.ConnectionState;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

/**
 * Prometheus implementation of GatewayMetrics.
 *
 * Key Metrics:
 * - gateway_messages_sent_total{type} - Dispatched sends by message kind
 * - gateway_rate_limit_rejections_total - Sends refused by the rate window
 * - gateway_ack_latency_seconds - Dispatch to first server ack
 * - gateway_status_updates_total{status} - Applied status codes 0..5
 * - gateway_connection_state_changes_total{state} - Connection transitions
 * - gateway_webhook_attempts_total{outcome} - Outbound webhook attempts
 *
 * Usage:
 * <pre>
 * PrometheusGatewayMetrics metrics = new PrometheusGatewayMetrics(new CollectorRegistry());
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusGatewayMetrics implements GatewayMetrics {

    private final CollectorRegistry registry;

    // Send path
    private final Counter messagesSent;
    private final Counter rateLimitRejections;
    private final Histogram ackLatency;
    private final Counter statusUpdates;

    // Connections
    private final Counter reconnectsScheduled;
    private final Counter connectionStateChanges;
    private final Gauge sessions;

    // Broker / streaming
    private final Counter brokerEvents;
    private final Gauge streamSubscribers;
    private final Counter streamDropped;

    // Webhooks
    private final Counter webhookAttempts;
    private final Counter webhookFailed;
    private final Counter inboundWebhooks;

    public PrometheusGatewayMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusGatewayMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.messagesSent = Counter.build()
            .name("gateway_messages_sent_total")
            .help("Total number of messages dispatched to session sockets")
            .labelNames("type")
            .register(registry);

        this.rateLimitRejections = Counter.build()
            .name("gateway_rate_limit_rejections_total")
            .help("Total number of sends rejected by the rate window")
            .register(registry);

        this.ackLatency = Histogram.build()
            .name("gateway_ack_latency_seconds")
            .help("Latency between dispatch and first server ack in seconds")
            .buckets(0.1, 0.25, 0.5, 1.0, 2.0, 5.0, 10.0, 30.0)
            .register(registry);

        this.statusUpdates = Counter.build()
            .name("gateway_status_updates_total")
            .help("Total number of applied message status updates")
            .labelNames("status")
            .register(registry);

        this.reconnectsScheduled = Counter.build()
            .name("gateway_reconnects_scheduled_total")
            .help("Total number of scheduled session reconnects")
            .register(registry);

        this.connectionStateChanges = Counter.build()
            .name("gateway_connection_state_changes_total")
            .help("Total number of session connection state changes")
            .labelNames("state")
            .register(registry);

        this.sessions = Gauge.build()
            .name("gateway_sessions")
            .help("Number of registered sessions")
            .register(registry);

        this.brokerEvents = Counter.build()
            .name("gateway_broker_events_total")
            .help("Total number of events appended to the broker")
            .labelNames("type")
            .register(registry);

        this.streamSubscribers = Gauge.build()
            .name("gateway_stream_subscribers")
            .help("Number of live stream subscribers")
            .register(registry);

        this.streamDropped = Counter.build()
            .name("gateway_stream_dropped_events_total")
            .help("Total number of events dropped from full subscriber queues")
            .register(registry);

        this.webhookAttempts = Counter.build()
            .name("gateway_webhook_attempts_total")
            .help("Total number of outbound webhook attempts")
            .labelNames("outcome")
            .register(registry);

        this.webhookFailed = Counter.build()
            .name("gateway_webhook_failed_total")
            .help("Total number of webhook deliveries that exhausted their attempts")
            .register(registry);

        this.inboundWebhooks = Counter.build()
            .name("gateway_inbound_webhooks_total")
            .help("Total number of inbound webhooks by result")
            .labelNames("result")
            .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void recordMessageSent(MessageKind kind) {
        messagesSent.labels(kind.wire()).inc();
    }

    @Override
    public void recordRateLimitRejection() {
        rateLimitRejections.inc();
    }

    @Override
    public void recordAckLatency(long latencyMs) {
        ackLatency.observe(latencyMs / 1000.0);
    }

    @Override
    public void recordStatusUpdate(int status) {
        statusUpdates.labels(String.valueOf(status)).inc();
    }

    @Override
    public void recordReconnectScheduled() {
        reconnectsScheduled.inc();
    }

    @Override
    public void recordConnectionState(ConnectionState state) {
        connectionStateChanges.labels(state.wire()).inc();
    }

    @Override
    public void setSessionCount(int count) {
        sessions.set(count);
    }

    @Override
    public void recordBrokerEvent(EventType type) {
        brokerEvents.labels(type.name()).inc();
    }

    @Override
    public void recordSubscriberOpened() {
        streamSubscribers.inc();
    }

    @Override
    public void recordSubscriberClosed() {
        streamSubscribers.dec();
    }

    @Override
    public void recordStreamDropped(long count) {
        if (count > 0) {
            streamDropped.inc(count);
        }
    }

    @Override
    public void recordWebhookAttempt(String outcome) {
        webhookAttempts.labels(outcome).inc();
    }

    @Override
    public void recordWebhookFailed() {
        webhookFailed.inc();
    }

    @Override
    public void recordInboundWebhook(String result) {
        inboundWebhooks.labels(result).inc();
    }
}
