package in.sessiongate.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.sessiongate.broker.EventBroker;
import in.sessiongate.broker.EventQuery;
import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.domain.common.GatewayException;
import in.sessiongate.domain.event.EventDirection;
import in.sessiongate.domain.event.EventType;
import in.sessiongate.domain.message.OutboundMessage;
import in.sessiongate.domain.message.SentMessage;
import in.sessiongate.security.StreamTokenService;
import in.sessiongate.session.QrChallenge;
import in.sessiongate.session.Session;
import in.sessiongate.session.SessionRegistry;
import in.sessiongate.session.StatusCodes;
import in.sessiongate.session.StatusLedger;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Handlers for the {@code /instances} routes.
 */
public final class SessionHandlers {
    private final SessionRegistry registry;
    private final EventBroker broker;
    private final StreamTokenService tokens;
    private final QrImageRenderer qrRenderer;

    public SessionHandlers(SessionRegistry registry, EventBroker broker, StreamTokenService tokens,
                           QrImageRenderer qrRenderer) {
        this.registry = registry;
        this.broker = broker;
        this.tokens = tokens;
        this.qrRenderer = qrRenderer;
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * POST /instances {name?, note?}
     */
    public void create(HttpServerExchange exchange) {
        ObjectNode body = HttpJson.readObject(exchange);
        Session session = registry.create(HttpJson.text(body, "name"), HttpJson.text(body, "note"));
        HttpJson.send(exchange, 201, session.summary());
    }

    /**
     * GET /instances
     */
    public void list(HttpServerExchange exchange) {
        List<Session.Summary> summaries = registry.list().stream().map(Session::summary).toList();
        HttpJson.ok(exchange, summaries);
    }

    /**
     * GET /instances/{iid}
     */
    public void get(HttpServerExchange exchange) {
        HttpJson.ok(exchange, session(exchange).summary());
    }

    /**
     * PATCH /instances/{iid} {name?, note?}
     */
    public void patch(HttpServerExchange exchange) {
        ObjectNode body = HttpJson.readObject(exchange);
        String name = body.hasNonNull("name") ? body.get("name").asText() : null;
        String note = null;
        if (body.has("note")) {
            JsonNode raw = body.get("note");
            if (!raw.isNull() && !raw.isTextual()) {
                throw new GatewayException(ErrorCode.NOTE_INVALID, "note must be a string");
            }
            note = raw.isNull() ? "" : raw.asText();
        }
        Session session = registry.patch(iid(exchange), name, note);
        HttpJson.ok(exchange, session.summary());
    }

    /**
     * DELETE /instances/{iid}?removeCredentials&forceLogout
     */
    public void delete(HttpServerExchange exchange) {
        String id = iid(exchange);
        registry.delete(id, HttpJson.queryBool(exchange, "removeCredentials"), HttpJson.queryBool(exchange, "forceLogout"));
        HttpJson.ok(exchange, HttpJson.okMessage("Session " + id + " deleted"));
    }

    public void reconnect(HttpServerExchange exchange) {
        registry.reconnect(iid(exchange));
        HttpJson.ok(exchange, HttpJson.okMessage("Reconnecting"));
    }

    public void logout(HttpServerExchange exchange) {
        registry.logout(iid(exchange));
        HttpJson.ok(exchange, HttpJson.okMessage("Logged out"));
    }

    /**
     * POST /instances/{iid}/session/reset
     */
    public void reset(HttpServerExchange exchange) {
        Path backup = registry.reset(iid(exchange));
        ObjectNode body = HttpJson.okMessage("Credentials backed up, restarting for a new QR");
        if (backup != null) {
            body.put("backup", backup.getFileName().toString());
        } else {
            body.putNull("backup");
        }
        HttpJson.ok(exchange, body);
    }

    /**
     * POST /instances/{iid}/session/wipe
     */
    public void wipe(HttpServerExchange exchange) {
        registry.wipe(iid(exchange));
        HttpJson.ok(exchange, HttpJson.okMessage("Credentials erased, restarting for a new QR"));
    }

    // ═══════════════════════════════════════════════════════════════
    // PAIRING
    // ═══════════════════════════════════════════════════════════════

    /**
     * GET /instances/{iid}/qr.png
     */
    public void qrPng(HttpServerExchange exchange) {
        QrChallenge qr = requireQr(exchange);
        byte[] png = qrRenderer.renderPng(qr.challenge());
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "image/png");
        exchange.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-store");
        exchange.getResponseSender().send(ByteBuffer.wrap(png));
    }

    /**
     * GET /instances/{iid}/qr
     */
    public void qrJson(HttpServerExchange exchange) {
        QrChallenge qr = requireQr(exchange);
        ObjectNode body = HttpJson.MAPPER.createObjectNode();
        body.put("qr", qr.challenge());
        body.put("qrVersion", qr.version());
        body.put("expiresAt", qr.expiresAt());
        body.put("attempt", qr.attempt());
        HttpJson.ok(exchange, body);
    }

    /**
     * POST /instances/{iid}/pair {phoneNumber}
     */
    public void pair(HttpServerExchange exchange) {
        ObjectNode body = HttpJson.readObject(exchange);
        String phone = HttpJson.text(body, "phoneNumber");
        if (phone == null) {
            throw new GatewayException(ErrorCode.INVALID_REQUEST, "phoneNumber is required");
        }
        String code = registry.pairingCode(iid(exchange), phone);
        ObjectNode response = HttpJson.MAPPER.createObjectNode();
        response.put("pairingCode", code);
        HttpJson.ok(exchange, response);
    }

    private QrChallenge requireQr(HttpServerExchange exchange) {
        QrChallenge qr = session(exchange).currentQr();
        if (qr == null) {
            throw new GatewayException(ErrorCode.QR_UNAVAILABLE, "No QR available");
        }
        return qr;
    }

    // ═══════════════════════════════════════════════════════════════
    // MESSAGING
    // ═══════════════════════════════════════════════════════════════

    public void sendText(HttpServerExchange exchange) {
        send(exchange, body -> OutboundMessage.text(HttpJson.text(body, "message")));
    }

    public void sendMedia(HttpServerExchange exchange) {
        send(exchange, OutboundMessage::media);
    }

    public void sendButtons(HttpServerExchange exchange) {
        send(exchange, OutboundMessage::buttons);
    }

    public void sendList(HttpServerExchange exchange) {
        send(exchange, OutboundMessage::list);
    }

    public void sendPoll(HttpServerExchange exchange) {
        send(exchange, OutboundMessage::poll);
    }

    private void send(HttpServerExchange exchange, Function<JsonNode, OutboundMessage> builder) {
        String id = iid(exchange);
        ObjectNode body = HttpJson.readObject(exchange);
        String to = HttpJson.text(body, "to");
        if (to == null) {
            throw new GatewayException(ErrorCode.INVALID_RECIPIENT, "to is required");
        }
        OutboundMessage message = builder.apply(body);
        SentMessage sent = registry.send(id, to, message, HttpJson.waitAckMs(body));
        HttpJson.send(exchange, 201, sentBody(sent));
    }

    static ObjectNode sentBody(SentMessage sent) {
        ObjectNode body = HttpJson.MAPPER.createObjectNode();
        body.put("id", sent.messageId());
        body.put("messageId", sent.messageId());
        body.put("to", sent.jid());
        body.put("type", sent.kind().wire());
        body.put("status", sent.ack() != null ? sent.ack() : StatusCodes.PENDING);
        if (sent.ack() != null) {
            body.put("ack", sent.ack());
        } else {
            body.putNull("ack");
        }
        body.put("timestamp", sent.timestamp());
        return body;
    }

    /**
     * POST /instances/{iid}/exists {to}
     */
    public void exists(HttpServerExchange exchange) {
        ObjectNode body = HttpJson.readObject(exchange);
        String to = HttpJson.text(body, "to");
        if (to == null) {
            throw new GatewayException(ErrorCode.INVALID_RECIPIENT, "to is required");
        }
        HttpJson.ok(exchange, session(exchange).exists(to));
    }

    /**
     * GET /instances/{iid}/status?id=
     */
    public void status(HttpServerExchange exchange) {
        Session session = session(exchange);
        String messageId = HttpJson.query(exchange, "id");
        if (messageId == null) {
            throw new GatewayException(ErrorCode.INVALID_REQUEST, "id is required");
        }
        StatusLedger.StatusEntry entry = session.statusOf(messageId);
        ObjectNode body = HttpJson.MAPPER.createObjectNode();
        body.put("id", messageId);
        if (entry == null) {
            body.putNull("status");
        } else {
            body.put("status", entry.status());
            body.put("updatedAt", entry.updatedAt());
        }
        HttpJson.ok(exchange, body);
    }

    /**
     * GET /instances/{iid}/metrics
     */
    public void metrics(HttpServerExchange exchange) {
        Session session = session(exchange);
        ObjectNode body = HttpJson.MAPPER.valueToTree(session.metricsView());
        body.put("id", session.getId());
        body.put("ts", Instant.now().toString());
        HttpJson.ok(exchange, body);
    }

    // ═══════════════════════════════════════════════════════════════
    // EVENTS
    // ═══════════════════════════════════════════════════════════════

    /**
     * GET /instances/{iid}/events?type&direction&after&limit&includeAcknowledged
     */
    public void events(HttpServerExchange exchange) {
        String id = session(exchange).getId();
        HttpJson.ok(exchange, broker.list(query(exchange, id)));
    }

    /**
     * POST /instances/{iid}/events/ack {ids}; ids owned by another session come back as missing
     */
    public void ackEvents(HttpServerExchange exchange) {
        String id = session(exchange).getId();
        HttpJson.ok(exchange, broker.ack(ids(HttpJson.readObject(exchange)), id));
    }

    /**
     * POST /instances/stream-token
     */
    public void streamToken(HttpServerExchange exchange) {
        HttpJson.ok(exchange, tokens.issue());
    }

    static EventQuery query(HttpServerExchange exchange, String instanceId) {
        String typeName = HttpJson.query(exchange, "type");
        EventType type = null;
        if (typeName != null) {
            try {
                type = EventType.valueOf(typeName.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new GatewayException(ErrorCode.INVALID_REQUEST, "unknown event type: " + typeName);
            }
        }
        String directionName = HttpJson.query(exchange, "direction");
        EventDirection direction = null;
        if (directionName != null) {
            direction = EventDirection.fromWire(directionName);
            if (direction == null) {
                throw new GatewayException(ErrorCode.INVALID_REQUEST, "unknown direction: " + directionName);
            }
        }
        Long limit = HttpJson.queryLong(exchange, "limit");
        return new EventQuery(instanceId, type, direction, HttpJson.queryLong(exchange, "after"),
            limit == null ? null : (int) Math.max(0, Math.min(limit, EventQuery.MAX_LIMIT)),
            HttpJson.queryBool(exchange, "includeAcknowledged"));
    }

    static List<String> ids(JsonNode body) {
        JsonNode ids = body.get("ids");
        if (ids == null || !ids.isArray() || ids.isEmpty()) {
            throw new GatewayException(ErrorCode.IDS_REQUIRED, "ids must be a non-empty array");
        }
        List<String> out = new ArrayList<>(ids.size());
        ids.forEach(node -> out.add(node.asText()));
        return out;
    }

    private Session session(HttpServerExchange exchange) {
        return registry.get(iid(exchange));
    }

    private static String iid(HttpServerExchange exchange) {
        String id = HttpJson.pathParam(exchange, "iid");
        if (id == null) {
            throw new GatewayException(ErrorCode.INSTANCE_NOT_FOUND, "instance id missing");
        }
        return id;
    }
}
