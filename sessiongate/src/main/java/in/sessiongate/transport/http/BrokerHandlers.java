package in.sessiongate.transport.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import in.sessiongate.broker.BrokerStats;
import in.sessiongate.broker.EventBroker;
import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.domain.common.GatewayException;
import in.sessiongate.domain.message.OutboundMessage;
import in.sessiongate.domain.message.SentMessage;
import in.sessiongate.session.ConnectionSupervisor;
import in.sessiongate.session.QrChallenge;
import in.sessiongate.session.Session;
import in.sessiongate.session.SessionRegistry;
import io.undertow.server.HttpServerExchange;

import java.time.Clock;
import java.time.Instant;

/**
 * Single-session broker surface: global event log, text sends and the broker session lifecycle.
 * Routes without an explicit {@code instanceId} act on the configured broker session.
 */
public final class BrokerHandlers {

    private final SessionRegistry registry;
    private final EventBroker broker;
    private final String brokerInstanceId;
    private final String serviceName;
    private final Clock clock;
    private final long startedAt;

    public BrokerHandlers(SessionRegistry registry, EventBroker broker, String brokerInstanceId,
                          String serviceName, Clock clock) {
        this.registry = registry;
        this.broker = broker;
        this.brokerInstanceId = brokerInstanceId;
        this.serviceName = serviceName;
        this.clock = clock;
        this.startedAt = clock.millis();
    }

    /**
     * GET /health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode body = HttpJson.MAPPER.createObjectNode();
        body.put("status", "ok");
        body.put("service", serviceName);
        body.put("ts", Instant.ofEpochMilli(clock.millis()).toString());
        body.put("uptimeSeconds", (clock.millis() - startedAt) / 1000);
        body.put("sessions", registry.size());
        BrokerStats stats = broker.stats();
        body.put("lastSequence", stats.lastSequence());
        body.put("subscribers", broker.getSubscriberCount());
        HttpJson.ok(exchange, body);
    }

    /**
     * GET /events?instanceId&type&direction&after&limit&includeAcknowledged
     */
    public void events(HttpServerExchange exchange) {
        HttpJson.ok(exchange, broker.list(SessionHandlers.query(exchange, HttpJson.query(exchange, "instanceId"))));
    }

    /**
     * POST /events/ack {ids}
     */
    public void ack(HttpServerExchange exchange) {
        HttpJson.ok(exchange, broker.ack(SessionHandlers.ids(HttpJson.readObject(exchange))));
    }

    /**
     * GET /events/stats
     */
    public void stats(HttpServerExchange exchange) {
        HttpJson.ok(exchange, broker.stats());
    }

    /**
     * POST /messages {instanceId?, to, text, waitAckMs?}
     */
    public void sendMessage(HttpServerExchange exchange) {
        ObjectNode body = HttpJson.readObject(exchange);
        String instanceId = instanceId(body.hasNonNull("instanceId") ? body.get("instanceId").asText() : null);
        String to = HttpJson.text(body, "to");
        if (to == null) {
            throw new GatewayException(ErrorCode.INVALID_RECIPIENT, "to is required");
        }
        OutboundMessage message = OutboundMessage.text(HttpJson.text(body, "text"));
        registry.getOrCreate(instanceId);
        SentMessage sent = registry.send(instanceId, to, message, HttpJson.waitAckMs(body));
        HttpJson.send(exchange, 201, SessionHandlers.sentBody(sent));
    }

    /**
     * POST /session/connect {instanceId?}
     */
    public void connect(HttpServerExchange exchange) {
        ObjectNode body = HttpJson.readObject(exchange);
        String instanceId = instanceId(HttpJson.text(body, "instanceId"));
        registry.getOrCreate(instanceId);
        Session session = registry.start(instanceId);
        HttpJson.ok(exchange, sessionStatus(session));
    }

    /**
     * POST /session/logout {instanceId?, wipe?}
     * Logs out, then restarts for a fresh pairing cycle; {@code wipe} also erases credentials.
     */
    public void logout(HttpServerExchange exchange) {
        ObjectNode body = HttpJson.readObject(exchange);
        String instanceId = instanceId(HttpJson.text(body, "instanceId"));
        boolean wipe = body.path("wipe").asBoolean(false);

        registry.logout(instanceId);
        if (wipe) {
            registry.wipe(instanceId);
        } else {
            registry.start(instanceId);
        }
        ObjectNode response = HttpJson.MAPPER.createObjectNode();
        response.put("id", instanceId);
        response.put("removed", wipe);
        HttpJson.ok(exchange, response);
    }

    /**
     * GET /session/status?instanceId
     */
    public void status(HttpServerExchange exchange) {
        Session session = registry.get(instanceId(HttpJson.query(exchange, "instanceId")));
        HttpJson.ok(exchange, sessionStatus(session));
    }

    private static ObjectNode sessionStatus(Session session) {
        ConnectionSupervisor.Snapshot connection = session.connection();
        QrChallenge qr = session.currentQr();
        Session.Summary summary = session.summary();
        ObjectNode body = HttpJson.MAPPER.createObjectNode();
        body.put("id", session.getId());
        body.put("name", summary.name());
        body.put("connected", summary.connected());
        body.put("state", connection.state().wire());
        body.put("user", connection.accountJid());
        body.put("qr", qr == null ? null : qr.challenge());
        ObjectNode metrics = body.putObject("metrics");
        metrics.put("sent", summary.sent());
        metrics.put("rateWindow", summary.rateInWindow());
        return body;
    }

    private String instanceId(String requested) {
        return requested == null || requested.isBlank() ? brokerInstanceId : requested.trim();
    }
}
