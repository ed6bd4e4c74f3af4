package in.sessiongate.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.sessiongate.broker.EventBroker;
import in.sessiongate.domain.event.BrokerEvent;
import in.sessiongate.domain.event.Delivery;
import in.sessiongate.domain.event.DeliveryState;
import in.sessiongate.domain.event.EventDirection;
import in.sessiongate.domain.event.EventType;
import in.sessiongate.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Forwards selected broker events to an outbound webhook.
 *
 * Features:
 * - Body {eventId, sequence, event, instanceId, direction, timestamp, payload}
 * - HMAC-SHA256 signature header, event id header, optional x-api-key
 * - Linear backoff (step × attempt, capped at 60 s) up to maxAttempts
 * - Delivery state written back to the broker event: pending → success | retry → failed
 * - A terminal failure appends a system WEBHOOK_DELIVERY event
 *
 * Usage:
 * <pre>
 * WebhookDispatcher dispatcher = WebhookDispatcher.builder(broker)
 *     .url("https://hooks.example.com/in")
 *     .secret(secret)
 *     .events(EnumSet.of(EventType.MESSAGE_INBOUND))
 *     .build();
 * broker.addListener(dispatcher);
 * </pre>
 */
public final class WebhookDispatcher implements EventBroker.Listener {
    private static final Logger log = LoggerFactory.getLogger(WebhookDispatcher.class);

    public static final String EVENT_ID_HEADER = "X-Event-Id";
    public static final String API_KEY_HEADER = "x-api-key";
    static final long MAX_BACKOFF_MS = 60_000;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final EventBroker broker;
    private final URI url;
    private final String apiKey;
    private final WebhookSigner signer;
    private final int maxAttempts;
    private final long backoffStepMs;
    private final Duration timeout;
    private final Set<EventType> events;
    private final HttpClient httpClient;
    private final GatewayMetrics metrics;
    private final Clock clock;

    private final ScheduledExecutorService retryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "webhook-retry");
        t.setDaemon(true);
        return t;
    });

    private WebhookDispatcher(Builder b) {
        this.broker = b.broker;
        this.url = URI.create(b.url);
        this.apiKey = b.apiKey;
        this.signer = b.secret == null || b.secret.isEmpty() ? null : new WebhookSigner(b.secret);
        this.maxAttempts = b.maxAttempts;
        this.backoffStepMs = b.backoffStepMs;
        this.timeout = Duration.ofMillis(b.timeoutMs);
        this.events = b.events.isEmpty() ? EnumSet.noneOf(EventType.class) : EnumSet.copyOf(b.events);
        this.httpClient = b.httpClient != null ? b.httpClient
            : HttpClient.newBuilder().connectTimeout(this.timeout).build();
        this.metrics = b.metrics;
        this.clock = b.clock;
        log.info("[WEBHOOK] Forwarding {} to {} (maxAttempts={}, signed={})",
            events, url, maxAttempts, signer != null);
    }

    @Override
    public void onEvent(BrokerEvent event) {
        // delivery reports are never forwarded, a failing endpoint would feed itself
        if (event.type() == EventType.WEBHOOK_DELIVERY || !events.contains(event.type())) {
            return;
        }
        byte[] body;
        try {
            body = MAPPER.writeValueAsBytes(envelope(event));
        } catch (JsonProcessingException e) {
            log.error("[WEBHOOK] Cannot serialize event {}: {}", event.id(), e.getMessage(), e);
            return;
        }
        Delivery delivery = Delivery.pending(maxAttempts);
        broker.updateDelivery(event.id(), delivery);
        attempt(event, body, 1, delivery);
    }

    static ObjectNode envelope(BrokerEvent event) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("eventId", event.id());
        node.put("sequence", event.sequence());
        node.put("event", event.type().name());
        node.put("instanceId", event.instanceId());
        node.put("direction", event.direction().wire());
        node.put("timestamp", Instant.ofEpochMilli(event.createdAt()).toString());
        node.set("payload", event.payload());
        return node;
    }

    private void attempt(BrokerEvent event, byte[] body, int attempt, Delivery current) {
        HttpRequest.Builder request = HttpRequest.newBuilder(url)
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .header(EVENT_ID_HEADER, event.id())
            .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        if (signer != null) {
            request.header(WebhookSigner.HEADER, signer.sign(body));
        }
        if (apiKey != null && !apiKey.isEmpty()) {
            request.header(API_KEY_HEADER, apiKey);
        }

        httpClient.sendAsync(request.build(), HttpResponse.BodyHandlers.discarding())
            .whenComplete((response, error) -> {
                try {
                    onResult(event, body, attempt, current, response, error);
                } catch (RuntimeException e) {
                    log.error("[WEBHOOK] Result handling failed for {}: {}", event.id(), e.getMessage(), e);
                }
            });
    }

    private void onResult(BrokerEvent event, byte[] body, int attempt, Delivery current,
                          HttpResponse<Void> response, Throwable error) {
        long now = clock.millis();
        if (error == null && response.statusCode() >= 200 && response.statusCode() < 300) {
            broker.updateDelivery(event.id(), current.succeeded(attempt, now, response.statusCode()));
            metrics.recordWebhookAttempt("success");
            log.debug("[WEBHOOK] {} #{} delivered on attempt {}", event.type(), event.sequence(), attempt);
            return;
        }

        Integer status = response != null ? response.statusCode() : null;
        String reason = error != null ? String.valueOf(error.getMessage()) : "HTTP " + status;
        Delivery next = current.failedAttempt(attempt, now, status, reason);
        broker.updateDelivery(event.id(), next);

        if (next.state() == DeliveryState.FAILED) {
            metrics.recordWebhookAttempt("failed");
            metrics.recordWebhookFailed();
            log.error("[WEBHOOK] {} #{} failed after {} attempts: {}",
                event.type(), event.sequence(), attempt, reason);
            reportFailure(event, next);
            return;
        }

        metrics.recordWebhookAttempt("retry");
        long delay = backoffFor(attempt);
        log.warn("[WEBHOOK] {} #{} attempt {} failed ({}), retrying in {} ms",
            event.type(), event.sequence(), attempt, reason, delay);
        try {
            retryScheduler.schedule(() -> attempt(event, body, attempt + 1, next), delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("[WEBHOOK] Dispatcher stopped, abandoning {} after attempt {}", event.id(), attempt);
        }
    }

    long backoffFor(int attempt) {
        return Math.min(backoffStepMs * attempt, MAX_BACKOFF_MS);
    }

    private void reportFailure(BrokerEvent event, Delivery delivery) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("eventId", event.id());
        payload.put("sequence", event.sequence());
        payload.put("event", event.type().name());
        payload.put("url", url.toString());
        payload.put("attempts", delivery.attempts());
        if (delivery.lastStatus() != null) {
            payload.put("lastStatus", delivery.lastStatus());
        } else {
            payload.putNull("lastStatus");
        }
        payload.put("lastError", delivery.lastError());
        broker.append(BrokerEvent.draft(EventType.WEBHOOK_DELIVERY, event.instanceId(), EventDirection.SYSTEM, payload));
    }

    public void shutdown() {
        retryScheduler.shutdownNow();
        log.info("[WEBHOOK] Dispatcher stopped");
    }

    public static Builder builder(EventBroker broker) {
        return new Builder(broker);
    }

    public static final class Builder {
        private final EventBroker broker;
        private String url;
        private String apiKey;
        private String secret;
        private int maxAttempts = 5;
        private long backoffStepMs = 2_000;
        private long timeoutMs = 5_000;
        private Set<EventType> events = EnumSet.of(
            EventType.MESSAGE_INBOUND, EventType.MESSAGE_OUTBOUND, EventType.MESSAGE_STATUS);
        private HttpClient httpClient;
        private GatewayMetrics metrics;
        private Clock clock = Clock.systemUTC();

        private Builder(EventBroker broker) {
            this.broker = broker;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder secret(String secret) {
            this.secret = secret;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoffStepMs(long backoffStepMs) {
            if (backoffStepMs <= 0) {
                throw new IllegalArgumentException("backoffStepMs must be positive");
            }
            this.backoffStepMs = backoffStepMs;
            return this;
        }

        public Builder timeoutMs(long timeoutMs) {
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("timeoutMs must be positive");
            }
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder events(Set<EventType> events) {
            this.events = events;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder metrics(GatewayMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public WebhookDispatcher build() {
            if (broker == null) {
                throw new IllegalArgumentException("broker is required");
            }
            if (url == null || !(url.startsWith("http://") || url.startsWith("https://"))) {
                throw new IllegalArgumentException("Webhook URL must be http(s): " + url);
            }
            if (metrics == null) {
                throw new IllegalArgumentException("metrics is required");
            }
            return new WebhookDispatcher(this);
        }
    }
}
