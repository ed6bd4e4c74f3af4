package in.sessiongate.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.sessiongate.broker.EventBroker;
import in.sessiongate.broker.EventSink;
import in.sessiongate.broker.EventSubscription;
import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.domain.event.BrokerEvent;
import in.sessiongate.security.StreamAccessPolicy;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.sse.ServerSentEventConnection;
import io.undertow.server.handlers.sse.ServerSentEventConnectionCallback;
import io.undertow.server.handlers.sse.ServerSentEventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.Deque;
import java.util.Map;

/**
 * GET /stream: Server-Sent Events tail of the broker.
 *
 * Frames carry {@code id} (event id), {@code event} (type) and the event JSON as data.
 * Resumes after {@code Last-Event-ID} or {@code ?lastEventId=}; {@code ?instanceId=} filters one session.
 */
public final class SseStreamHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(SseStreamHandler.class);

    static final String KEEPALIVE_EVENT = "keepalive";

    private final EventBroker broker;
    private final StreamAccessPolicy access;
    private final ServerSentEventHandler sse;

    public SseStreamHandler(EventBroker broker, StreamAccessPolicy access) {
        this.broker = broker;
        this.access = access;
        this.sse = new ServerSentEventHandler(new Callback());
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String token = HttpJson.query(exchange, "token");
        String apiKey = exchange.getRequestHeaders().getFirst(ApiKeyAuthHandler.API_KEY_HEADER);
        if (!access.allows(token, apiKey)) {
            log.warn("[STREAM] SSE rejected from {}", exchange.getSourceAddress());
            HttpJson.sendError(exchange, ErrorCode.UNAUTHORIZED, "Invalid or missing stream token");
            return;
        }
        sse.handleRequest(exchange);
    }

    private final class Callback implements ServerSentEventConnectionCallback {
        @Override
        public void connected(ServerSentEventConnection connection, String lastEventId) {
            Map<String, Deque<String>> query = connection.getQueryParameters();
            String resumeFrom = lastEventId != null && !lastEventId.isBlank() ? lastEventId : first(query, "lastEventId");
            String instanceId = first(query, "instanceId");

            EventSubscription subscription = broker.subscribe(resumeFrom, instanceId, new SseSink(connection));
            connection.addCloseTask(closed -> subscription.close());
        }
    }

    private static String first(Map<String, Deque<String>> query, String name) {
        Deque<String> values = query.get(name);
        if (values == null || values.isEmpty()) return null;
        String value = values.peekFirst();
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * Writes broker events to one SSE connection.
     */
    static final class SseSink implements EventSink {
        private final ServerSentEventConnection connection;

        SseSink(ServerSentEventConnection connection) {
            this.connection = connection;
        }

        @Override
        public void deliver(BrokerEvent event) {
            requireOpen();
            String data;
            try {
                data = HttpJson.MAPPER.writeValueAsString(event);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Event not serializable: " + event.id(), e);
            }
            connection.send(data, event.type().name(), event.id(), null);
        }

        @Override
        public void keepalive() {
            requireOpen();
            connection.send("{\"ts\":\"" + Instant.now() + "\"}", KEEPALIVE_EVENT, null, null);
        }

        @Override
        public void close() {
            if (!connection.isOpen()) return;
            try {
                connection.close();
            } catch (IOException e) {
                log.debug("[STREAM] SSE close failed: {}", e.toString());
            }
        }

        private void requireOpen() {
            if (!connection.isOpen()) {
                throw new IllegalStateException("SSE connection closed");
            }
        }
    }
}
