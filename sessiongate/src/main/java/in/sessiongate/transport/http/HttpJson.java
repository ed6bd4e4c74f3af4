package in.sessiongate.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.domain.common.GatewayException;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Deque;

/**
 * JSON request/response helpers shared by the HTTP handlers.
 * Handlers run behind a BlockingHandler, so bodies are read from the input stream.
 */
public final class HttpJson {

    public static final String CONTENT_TYPE_JSON = "application/json; charset=utf-8";

    public static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private HttpJson() {}

    public static byte[] readRaw(HttpServerExchange exchange) {
        if (!exchange.isBlocking()) {
            exchange.startBlocking();
        }
        try {
            return exchange.getInputStream().readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read request body", e);
        }
    }

    /**
     * @return the body as an object, an empty object when the body is empty
     * @throws GatewayException invalid_json, or invalid_request when the body is not an object
     */
    public static ObjectNode readObject(HttpServerExchange exchange) {
        byte[] raw = readRaw(exchange);
        if (raw.length == 0) {
            return MAPPER.createObjectNode();
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(raw);
        } catch (IOException e) {
            throw new GatewayException(ErrorCode.INVALID_JSON, "Body is not valid JSON");
        }
        if (node == null || node.isMissingNode()) {
            return MAPPER.createObjectNode();
        }
        if (!node.isObject()) {
            throw new GatewayException(ErrorCode.INVALID_REQUEST, "Body must be a JSON object");
        }
        return (ObjectNode) node;
    }

    public static void send(HttpServerExchange exchange, int status, Object body) {
        String json;
        try {
            json = MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Response not serializable", e);
        }
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, CONTENT_TYPE_JSON);
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    public static void ok(HttpServerExchange exchange, Object body) {
        send(exchange, 200, body);
    }

    public static void sendError(HttpServerExchange exchange, ErrorCode code, String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("error", code.code());
        body.put("message", message);
        send(exchange, code.httpStatus(), body);
    }

    public static ObjectNode okMessage(String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("ok", true);
        body.put("message", message);
        return body;
    }

    public static String pathParam(HttpServerExchange exchange, String name) {
        PathTemplateMatch match = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY);
        return match == null ? null : match.getParameters().get(name);
    }

    public static String query(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty()) return null;
        String value = values.peekFirst();
        return value == null || value.isBlank() ? null : value.trim();
    }

    public static Long queryLong(HttpServerExchange exchange, String name) {
        String value = query(exchange, name);
        if (value == null) return null;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new GatewayException(ErrorCode.INVALID_REQUEST, name + " must be a number");
        }
    }

    public static boolean queryBool(HttpServerExchange exchange, String name) {
        String value = query(exchange, name);
        return value != null && (value.equalsIgnoreCase("true") || value.equals("1") || value.equalsIgnoreCase("yes"));
    }

    /**
     * Text field of a body, null when absent or blank.
     */
    public static String text(JsonNode body, String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) return null;
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    public static long waitAckMs(JsonNode body) {
        JsonNode node = body.get("waitAckMs");
        return node == null || !node.canConvertToLong() ? 0 : node.asLong();
    }
}
