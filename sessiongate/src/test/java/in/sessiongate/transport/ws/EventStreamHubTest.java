package in.sessiongate.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import in.sessiongate.broker.EventBroker;
import in.sessiongate.domain.event.BrokerEvent;
import in.sessiongate.domain.event.EventDirection;
import in.sessiongate.domain.event.EventType;
import in.sessiongate.metrics.NoopGatewayMetrics;
import in.sessiongate.security.ApiKeyVerifier;
import in.sessiongate.security.StreamAccessPolicy;
import in.sessiongate.security.StreamTokenService;
import in.sessiongate.testing.Await;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the WebSocket event stream.
 *
 * Tests:
 * - Ack frame first, then replay after ?lastEventId= in order
 * - Ping answered with pong
 * - Rejection without credentials
 * - Subscription released when the client closes
 */
public class EventStreamHubTest {

    private static final int TEST_PORT = 19494;
    private static final String API_KEY = "stream-key";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EventBroker broker;
    private Undertow server;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        broker = new EventBroker(50, 16, 60_000, NoopGatewayMetrics.INSTANCE, Clock.systemUTC());
        broker.setFlushMs(10);
        broker.start();
        StreamAccessPolicy access = new StreamAccessPolicy(new ApiKeyVerifier(List.of(API_KEY)),
            new StreamTokenService(60_000, Clock.systemUTC()));
        EventStreamHub hub = new EventStreamHub(broker, access);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.routing().get("/ws", hub.websocketHandler()))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
        if (broker != null) {
            broker.close();
        }
    }

    /**
     * Collects whole text frames.
     */
    private static final class FrameCollector implements WebSocket.Listener {
        final BlockingQueue<JsonNode> frames = new LinkedBlockingQueue<>();
        volatile boolean closed;
        private final StringBuilder partial = new StringBuilder();

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            closed = true;
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            closed = true;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                try {
                    frames.add(MAPPER.readTree(partial.toString()));
                } catch (Exception e) {
                    throw new IllegalStateException("Unparsable frame: " + partial, e);
                } finally {
                    partial.setLength(0);
                }
            }
            webSocket.request(1);
            return null;
        }

        JsonNode next() throws InterruptedException {
            JsonNode frame = frames.poll(5, TimeUnit.SECONDS);
            assertNotNull(frame, "No frame received in time");
            return frame;
        }
    }

    private BrokerEvent append(String instanceId) {
        return broker.append(BrokerEvent.draft(EventType.MESSAGE_INBOUND, instanceId, EventDirection.INBOUND,
            JsonNodeFactory.instance.objectNode()));
    }

    private WebSocket connect(String query, boolean withKey, FrameCollector collector) {
        WebSocket.Builder builder = httpClient.newWebSocketBuilder();
        if (withKey) {
            builder.header("x-api-key", API_KEY);
        }
        return builder.buildAsync(URI.create("ws://localhost:" + TEST_PORT + "/ws" + query), collector)
            .join();
    }

    @Test
    public void testAckThenReplayAfterLastEventId() throws Exception {
        BrokerEvent e1 = append("default");
        BrokerEvent e2 = append("default");
        BrokerEvent e3 = append("default");
        FrameCollector collector = new FrameCollector();

        WebSocket ws = connect("?lastEventId=" + e1.id(), true, collector);

        JsonNode ack = collector.next();
        assertEquals("ack", ack.get("type").asText(), "First frame acknowledges the subscription");
        assertEquals(e1.id(), ack.get("lastEventId").asText());
        assertEquals(e3.sequence(), ack.get("lastSequence").asLong());

        JsonNode first = collector.next();
        JsonNode second = collector.next();
        assertEquals("event", first.get("type").asText());
        assertEquals(e2.id(), first.get("event").get("id").asText(), "Replay starts after the cursor");
        assertEquals(e3.id(), second.get("event").get("id").asText());

        ws.sendClose(WebSocket.NORMAL_CLOSURE, "done").join();
        Await.until(() -> broker.getSubscriberCount() == 0, 5_000, "subscription released after close");
    }

    @Test
    public void testPingAnsweredWithPong() throws Exception {
        FrameCollector collector = new FrameCollector();
        WebSocket ws = connect("", true, collector);
        assertEquals("ack", collector.next().get("type").asText());

        ws.sendText("{\"action\":\"ping\",\"nonce\":\"n-1\"}", true).join();

        JsonNode pong = collector.next();
        assertEquals("pong", pong.get("type").asText());
        assertEquals("n-1", pong.get("nonce").asText());
        ws.sendClose(WebSocket.NORMAL_CLOSURE, "done").join();
    }

    @Test
    public void testRejectedWithoutCredentials() throws Exception {
        append("default");
        FrameCollector collector = new FrameCollector();

        connect("", false, collector);

        Await.until(() -> collector.closed, 5_000, "unauthenticated channel closed by the server");
        JsonNode frame = collector.frames.poll();
        if (frame != null) {
            assertEquals("error", frame.get("type").asText(), "Only an error frame precedes the close");
        }
        assertTrue(collector.frames.isEmpty(), "No events reach a rejected client");
        assertEquals(0, broker.getSubscriberCount(), "Rejected clients never subscribe");
    }
}
