package in.sessiongate.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.sessiongate.broker.EventBroker;
import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.domain.common.GatewayException;
import in.sessiongate.domain.event.BrokerEvent;
import in.sessiongate.domain.event.EventDirection;
import in.sessiongate.domain.event.EventType;
import in.sessiongate.metrics.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Accepts signed webhooks from third parties into the event log, at most once per idempotency key.
 */
public class InboundWebhookProcessor {
    private static final Logger log = LoggerFactory.getLogger(InboundWebhookProcessor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String IDEMPOTENCY_HEADER = "X-Idempotency-Key";

    /**
     * @param duplicate true when the key was already seen and nothing was appended
     */
    public record Result(boolean duplicate, String idempotencyKey, BrokerEvent event) {}

    private final WebhookVerifier verifier;
    private final IdempotencyWindow window;
    private final EventBroker broker;
    private final String defaultInstanceId;
    private final GatewayMetrics metrics;

    public InboundWebhookProcessor(WebhookVerifier verifier, IdempotencyWindow window, EventBroker broker,
                                   String defaultInstanceId, GatewayMetrics metrics) {
        this.verifier = verifier;
        this.window = window;
        this.broker = broker;
        this.defaultInstanceId = defaultInstanceId;
        this.metrics = metrics;
    }

    /**
     * @param rawBody        exact request bytes, as signed by the sender
     * @param signature      {@code X-Signature-256} header, may be null
     * @param idempotencyKey {@code X-Idempotency-Key} header, may be null
     * @param eventIdHeader  {@code X-Event-Id} header, may be null
     * @throws GatewayException invalid_signature or invalid_json
     */
    public Result process(byte[] rawBody, String signature, String idempotencyKey, String eventIdHeader) {
        if (!verifier.verify(rawBody, signature)) {
            metrics.recordInboundWebhook("rejected");
            log.warn("[WEBHOOK] Inbound signature mismatch ({} bytes)", rawBody.length);
            throw new GatewayException(ErrorCode.INVALID_SIGNATURE, "Signature verification failed");
        }

        JsonNode body;
        try {
            body = rawBody.length == 0 ? MAPPER.createObjectNode() : MAPPER.readTree(rawBody);
        } catch (IOException e) {
            metrics.recordInboundWebhook("rejected");
            throw new GatewayException(ErrorCode.INVALID_JSON, "Body is not valid JSON");
        }

        String key = resolveKey(idempotencyKey, eventIdHeader, body, rawBody);
        if (!window.register(key)) {
            metrics.recordInboundWebhook("duplicate");
            log.info("[WEBHOOK] Duplicate inbound {}", key);
            return new Result(true, key, null);
        }

        String instanceId = text(body, "instanceId");
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("idempotencyKey", key);
        payload.set("body", body);
        BrokerEvent event = broker.append(BrokerEvent.draft(EventType.WEBHOOK_INBOUND,
            instanceId != null ? instanceId : defaultInstanceId, EventDirection.INBOUND, payload));
        metrics.recordInboundWebhook("accepted");
        log.info("[WEBHOOK] Inbound accepted as event #{} (key={})", event.sequence(), key);
        return new Result(false, key, event);
    }

    /**
     * First present of: idempotency header, event id header, body eventId, body id, sha256 of the body.
     */
    static String resolveKey(String idempotencyKey, String eventIdHeader, JsonNode body, byte[] rawBody) {
        if (idempotencyKey != null && !idempotencyKey.isBlank()) return idempotencyKey.trim();
        if (eventIdHeader != null && !eventIdHeader.isBlank()) return eventIdHeader.trim();
        String fromBody = text(body, "eventId");
        if (fromBody == null) fromBody = text(body, "id");
        if (fromBody != null) return fromBody;
        return "sha256:" + sha256Hex(rawBody);
    }

    private static String text(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) return null;
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    private static String sha256Hex(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
