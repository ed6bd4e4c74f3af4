package in.sessiongate.bootstrap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import in.sessiongate.config.GatewayConfig;
import in.sessiongate.domain.event.BrokerEvent;
import in.sessiongate.domain.event.EventDirection;
import in.sessiongate.domain.event.EventType;
import in.sessiongate.session.SessionRegistry;
import in.sessiongate.session.SessionSettings;
import in.sessiongate.testing.FakeSocketFactory;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end test of the HTTP surface wired by Gateway.
 *
 * Tests:
 * - Open paths and API key enforcement
 * - Session create, list and lookup errors
 * - Sending through an open session
 * - Per-session event acknowledgement
 * - CORS preflight and unknown routes
 */
@DisplayName("Gateway HTTP Surface")
public class GatewayHttpTest {

    private static final int TEST_PORT = 19292;
    private static final String API_KEY = "test-key";
    private static final String BASE = "http://localhost:" + TEST_PORT;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path sessionDir;

    private FakeSocketFactory factory;
    private Gateway gateway;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        factory = new FakeSocketFactory();
        GatewayConfig config = new GatewayConfig(
            "localhost", TEST_PORT, "sessiongate-test", List.of(API_KEY),
            sessionDir, "broker-test", SessionSettings.defaults(),
            100, 15_000, 64, 60_000,
            null, null, API_KEY, 3, 100, 1_000, EnumSet.of(EventType.MESSAGE_INBOUND), 60_000, 100,
            "ws://localhost:7081/sessions", null);

        gateway = new Gateway(config, factory, new CollectorRegistry(), Clock.systemUTC());
        gateway.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (gateway != null) {
            gateway.stop();
        }
    }

    private HttpResponse<String> get(String path, boolean withKey) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder().uri(URI.create(BASE + path)).GET();
        if (withKey) {
            request.header("x-api-key", API_KEY);
        }
        return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String json) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(BASE + path))
            .header("x-api-key", API_KEY)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json))
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return MAPPER.readTree(response.body());
    }

    @Test
    public void testHealthIsOpen() throws Exception {
        HttpResponse<String> response = get("/health", false);

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertEquals("ok", body.get("status").asText());
        assertEquals("sessiongate-test", body.get("service").asText());
        assertEquals(1, body.get("sessions").asInt(), "Default session is created on start");
    }

    @Test
    public void testMetricsIsOpen() throws Exception {
        HttpResponse<String> response = get("/metrics", false);

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("gateway_"), "Gateway metrics should be exported");
    }

    @Test
    public void testMissingApiKeyRejected() throws Exception {
        HttpResponse<String> response = get("/instances", false);

        assertEquals(401, response.statusCode());
        assertEquals("unauthorized", json(response).get("error").asText());
    }

    @Test
    public void testCreateAndListSessions() throws Exception {
        HttpResponse<String> created = post("/instances", "{\"name\":\"Sales\",\"note\":\"main line\"}");

        assertEquals(201, created.statusCode(), created.body());
        assertEquals("sales", json(created).get("id").asText());

        HttpResponse<String> list = get("/instances", true);
        assertEquals(200, list.statusCode());
        JsonNode sessions = json(list);
        assertEquals(2, sessions.size());
        assertEquals(2, gateway.getRegistry().size());
        assertTrue(gateway.getBroker().recent(50, null).stream()
                .anyMatch(e -> e.type() == EventType.SESSION_CREATED && "sales".equals(e.instanceId())),
            "Creation should be published on the broker");

        HttpResponse<String> duplicate = post("/instances", "{\"name\":\"sales\"}");
        assertEquals(409, duplicate.statusCode());
        assertEquals("instance_exists", json(duplicate).get("error").asText());
    }

    @Test
    public void testUnknownInstance() throws Exception {
        HttpResponse<String> response = get("/instances/nope", true);

        assertEquals(404, response.statusCode());
        assertEquals("instance_not_found", json(response).get("error").asText());
    }

    @Test
    public void testUnknownRoute() throws Exception {
        HttpResponse<String> response = get("/nothing-here", true);

        assertEquals(404, response.statusCode());
        assertEquals("not_found", json(response).get("error").asText());
    }

    @Test
    public void testInvalidJsonBody() throws Exception {
        HttpResponse<String> response = post("/instances", "{not json");

        assertEquals(400, response.statusCode());
        assertEquals("invalid_json", json(response).get("error").asText());
    }

    @Test
    @DisplayName("Send text through an open session returns 201 with message id")
    public void testSendTextThroughOpenSession() throws Exception {
        factory.latest(SessionRegistry.DEFAULT_SESSION_ID).emitOpen("5511900000000@s.whatsapp.net");

        HttpResponse<String> response = post("/instances/default/send-text",
            "{\"to\":\"5511987654321\",\"message\":\"hello\"}");

        assertEquals(201, response.statusCode(), response.body());
        JsonNode body = json(response);
        assertEquals("MSG-default-1", body.get("messageId").asText());
        assertEquals("5511987654321@s.whatsapp.net", body.get("to").asText());
        assertTrue(body.get("ack").isNull(), "No ack was requested");
    }

    @Test
    @DisplayName("Send before the socket opens is rejected with 503")
    public void testSendWhileDisconnected() throws Exception {
        HttpResponse<String> response = post("/instances/default/send-text",
            "{\"to\":\"5511987654321\",\"message\":\"hello\"}");

        assertEquals(503, response.statusCode());
        assertEquals("socket_unavailable", json(response).get("error").asText());
    }

    @Test
    @DisplayName("Per-session ack only acknowledges that session's events")
    public void testSessionAckIgnoresOtherSessionsEvents() throws Exception {
        assertEquals(201, post("/instances", "{\"name\":\"sales\"}").statusCode());
        BrokerEvent own = gateway.getBroker().append(BrokerEvent.draft(EventType.MESSAGE_INBOUND, "sales",
            EventDirection.INBOUND, JsonNodeFactory.instance.objectNode()));
        BrokerEvent foreign = gateway.getBroker().append(BrokerEvent.draft(EventType.MESSAGE_INBOUND, "default",
            EventDirection.INBOUND, JsonNodeFactory.instance.objectNode()));

        HttpResponse<String> response = post("/instances/sales/events/ack",
            "{\"ids\":[\"" + own.id() + "\",\"" + foreign.id() + "\"]}");

        assertEquals(200, response.statusCode(), response.body());
        JsonNode body = json(response);
        assertEquals(1, body.get("acknowledged").size());
        assertEquals(own.id(), body.get("acknowledged").get(0).asText());
        assertEquals(foreign.id(), body.get("missing").get(0).asText(), "Foreign event reported missing");
        assertFalse(gateway.getBroker().get(foreign.id()).acknowledged(), "Foreign event left pending");
    }

    @Test
    public void testDefaultSessionCannotBeDeleted() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(BASE + "/instances/default"))
            .header("x-api-key", API_KEY)
            .DELETE()
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(400, response.statusCode());
        assertEquals("default_instance_protected", json(response).get("error").asText());
    }

    @Test
    public void testCorsPreflight() throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(BASE + "/instances"))
            .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
            .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        assertEquals(204, response.statusCode(), "Preflight needs no API key");
        assertEquals("*", response.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
    }
}
