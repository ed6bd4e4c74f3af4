package in.sessiongate.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.sessiongate.broker.EventBroker;
import in.sessiongate.broker.EventSink;
import in.sessiongate.broker.EventSubscription;
import in.sessiongate.domain.event.BrokerEvent;
import in.sessiongate.security.StreamAccessPolicy;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Undertow-native WebSocket tail of the broker with:
 * - Stream token ({@code ?token=}) or API key header authentication
 * - Resume after {@code ?lastEventId=}, session filter {@code ?instanceId=}
 * - One broker subscription per channel, torn down on close or error
 * - Client {@code {"action":"ping"}} answered with a pong frame
 *
 * Frames: {@code {"type":"event","event":{...}}}, {@code {"type":"keepalive","ts":...}},
 * {@code {"type":"ack",...}}, {@code {"type":"error","error":...}}.
 */
public final class EventStreamHub {
    private static final Logger log = LoggerFactory.getLogger(EventStreamHub.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final EventBroker broker;
    private final StreamAccessPolicy access;

    // Channel -> subscription
    private final ConcurrentMap<WebSocketChannel, EventSubscription> channels = new ConcurrentHashMap<>();

    public EventStreamHub(EventBroker broker, StreamAccessPolicy access) {
        this.broker = broker;
        this.access = access;
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                Map<String, List<String>> query = exchange.getRequestParameters();
                String token = first(query, "token");
                String apiKey = exchange.getRequestHeader("x-api-key");

                if (!access.allows(token, apiKey)) {
                    log.warn("[STREAM] WS rejected: invalid token from {}", channel.getSourceAddress());
                    sendError(channel, "Invalid or missing token");
                    closeQuietly(channel);
                    return;
                }

                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                        handleClientMessage(ch, message.getData());
                    }

                    @Override
                    protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                        cleanup(ch);
                        super.onCloseMessage(cm, ch);
                    }

                    @Override
                    protected void onError(WebSocketChannel ch, Throwable error) {
                        log.warn("[STREAM] WS error: {}", error.toString());
                        cleanup(ch);
                    }
                });
                channel.addCloseTask(ch -> cleanup(ch));
                channel.resumeReceives();

                String lastEventId = first(query, "lastEventId");
                String instanceId = first(query, "instanceId");
                sendAck(channel, lastEventId, instanceId);
                EventSubscription subscription = broker.subscribe(lastEventId, instanceId, new ChannelSink(channel));
                channels.put(channel, subscription);
                log.info("[STREAM] WS connected: {} (subscription={})", channel.getSourceAddress(), subscription.getId());
            }
        });
    }

    private static String first(Map<String, List<String>> query, String name) {
        List<String> values = query.get(name);
        if (values == null || values.isEmpty()) return null;
        String value = values.get(0);
        return value == null || value.isBlank() ? null : value;
    }

    private void handleClientMessage(WebSocketChannel channel, String raw) {
        try {
            JsonNode msg = MAPPER.readTree(raw);
            String action = msg.path("action").asText("");
            if ("ping".equals(action)) {
                ObjectNode pong = MAPPER.createObjectNode();
                pong.put("type", "pong");
                pong.put("nonce", msg.path("nonce").asText(""));
                pong.put("ts", Instant.now().toString());
                sendDirect(channel, pong);
            } else {
                sendError(channel, "Unknown action: " + action);
            }
        } catch (JsonProcessingException e) {
            sendError(channel, "Invalid JSON: " + e.getOriginalMessage());
        }
    }

    private void sendAck(WebSocketChannel channel, String lastEventId, String instanceId) {
        ObjectNode ack = MAPPER.createObjectNode();
        ack.put("type", "ack");
        ack.put("lastEventId", lastEventId);
        ack.put("instanceId", instanceId);
        ack.put("lastSequence", broker.lastSequence());
        sendDirect(channel, ack);
    }

    private void sendError(WebSocketChannel channel, String error) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", "error");
        node.put("error", error);
        sendDirect(channel, node);
    }

    private static void sendDirect(WebSocketChannel channel, JsonNode frame) {
        WebSockets.sendText(frame.toString(), channel, null);
    }

    private void cleanup(WebSocketChannel channel) {
        EventSubscription subscription = channels.remove(channel);
        if (subscription != null) {
            subscription.close();
            log.info("[STREAM] WS disconnected: {} (subscription={})", channel.getSourceAddress(), subscription.getId());
        }
        closeQuietly(channel);
    }

    private static void closeQuietly(WebSocketChannel channel) {
        if (!channel.isOpen()) return;
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("[STREAM] WS close failed: {}", e.toString());
        }
    }

    /**
     * Writes broker events to one WebSocket channel.
     */
    private final class ChannelSink implements EventSink {
        private final WebSocketChannel channel;

        private ChannelSink(WebSocketChannel channel) {
            this.channel = channel;
        }

        @Override
        public void deliver(BrokerEvent event) {
            requireOpen();
            ObjectNode frame = MAPPER.createObjectNode();
            frame.put("type", "event");
            frame.set("event", toJson(event));
            sendDirect(channel, frame);
        }

        @Override
        public void keepalive() {
            requireOpen();
            ObjectNode frame = MAPPER.createObjectNode();
            frame.put("type", "keepalive");
            frame.put("ts", Instant.now().toString());
            sendDirect(channel, frame);
        }

        @Override
        public void close() {
            channels.remove(channel);
            closeQuietly(channel);
        }

        private void requireOpen() {
            if (!channel.isOpen()) {
                throw new IllegalStateException("WebSocket channel closed");
            }
        }
    }

    private static JsonNode toJson(BrokerEvent event) {
        return MAPPER.valueToTree(event);
    }
}
