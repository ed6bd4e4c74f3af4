package in.sessiongate.transport.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import in.sessiongate.webhook.InboundWebhookProcessor;
import in.sessiongate.webhook.WebhookDispatcher;
import in.sessiongate.webhook.WebhookSigner;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HeaderMap;

/**
 * POST /webhooks/inbound. Authenticated by signature instead of API key.
 * New deliveries answer 202, duplicates 200 with {@code duplicate: true}.
 */
public final class InboundWebhookHandler {

    private final InboundWebhookProcessor processor;

    public InboundWebhookHandler(InboundWebhookProcessor processor) {
        this.processor = processor;
    }

    public void handle(HttpServerExchange exchange) {
        byte[] raw = HttpJson.readRaw(exchange);
        HeaderMap headers = exchange.getRequestHeaders();
        InboundWebhookProcessor.Result result = processor.process(raw,
            headers.getFirst(WebhookSigner.HEADER),
            headers.getFirst(InboundWebhookProcessor.IDEMPOTENCY_HEADER),
            headers.getFirst(WebhookDispatcher.EVENT_ID_HEADER));

        ObjectNode body = HttpJson.MAPPER.createObjectNode();
        body.put("ok", true);
        body.put("idempotencyKey", result.idempotencyKey());
        if (result.duplicate()) {
            body.put("duplicate", true);
            HttpJson.send(exchange, 200, body);
            return;
        }
        body.put("duplicate", false);
        body.put("eventId", result.event().id());
        body.put("sequence", result.event().sequence());
        HttpJson.send(exchange, 202, body);
    }
}
