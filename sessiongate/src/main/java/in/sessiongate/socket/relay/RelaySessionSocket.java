package in.sessiongate.socket.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.sessiongate.domain.message.MessageReceipt;
import in.sessiongate.domain.message.OutboundMessage;
import in.sessiongate.socket.SessionSocket;
import in.sessiongate.socket.SessionSocketListener;
import in.sessiongate.socket.SocketException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Session socket hosted by a relay sidecar.
 *
 * The sidecar owns the chat-platform connection; this side speaks JSON frames:
 * <pre>
 * sidecar → gateway  {type: qr|open|close|message|status|receipt|result, ...}
 * gateway → sidecar  {op: open|send|exists|pair|logout, requestId, ...}
 * </pre>
 * Commands complete when the {@code result} frame with the same requestId arrives.
 * Outgoing frames are chained so that a text frame is never sent while another is in flight.
 */
public final class RelaySessionSocket implements SessionSocket {
    private static final Logger log = LoggerFactory.getLogger(RelaySessionSocket.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String sessionId;
    private final String credentialsDir;
    private final URI uri;
    private final HttpClient httpClient;
    private final SessionSocketListener listener;

    private final Map<String, CompletableFuture<JSONObject>> pending = new ConcurrentHashMap<>();
    private final AtomicLong requestSeq = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean closeReported = new AtomicBoolean(false);

    // Completes with the connected socket; each send is chained after the previous one
    private final CompletableFuture<WebSocket> connected = new CompletableFuture<>();
    private CompletableFuture<WebSocket> sendChain = connected;

    public RelaySessionSocket(String sessionId, String credentialsDir, URI uri,
                              HttpClient httpClient, SessionSocketListener listener) {
        this.sessionId = sessionId;
        this.credentialsDir = credentialsDir;
        this.uri = uri;
        this.httpClient = httpClient;
        this.listener = listener;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public void open() {
        log.info("[RELAY {}] Connecting to {}", sessionId, maskUrl(uri.toString()));
        httpClient.newWebSocketBuilder()
            .buildAsync(uri, new FrameListener())
            .whenComplete((ws, err) -> {
                if (err != null) {
                    log.warn("[RELAY {}] Connect failed: {}", sessionId, err.toString());
                    connected.completeExceptionally(err);
                    failPending(err);
                    reportClose(0, "relay unreachable: " + err.getMessage(), false);
                    return;
                }
                if (closed.get()) {
                    ws.abort();
                    return;
                }
                connected.complete(ws);
                JSONObject hello = new JSONObject()
                    .put("op", "open")
                    .put("sessionId", sessionId)
                    .put("credentialsDir", credentialsDir);
                sendFrame(hello);
            });
    }

    // ═══════════════════════════════════════════════════════════════
    // COMMANDS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<String> send(String jid, OutboundMessage message) {
        JSONObject frame = new JSONObject()
            .put("jid", jid)
            .put("kind", message.kind().wire())
            .put("content", new JSONObject(message.content().toString()));
        return request("send", frame, result -> {
            String id = result.optString("messageId", null);
            if (id == null || id.isBlank()) {
                throw new SocketException(sessionId, "relay returned no message id");
            }
            return id;
        });
    }

    @Override
    public CompletableFuture<Boolean> exists(String jid) {
        return request("exists", new JSONObject().put("jid", jid), result -> result.optBoolean("exists", false));
    }

    @Override
    public CompletableFuture<String> requestPairingCode(String phoneNumber) {
        return request("pair", new JSONObject().put("phone", phoneNumber), result -> {
            String code = result.optString("code", null);
            if (code == null || code.isBlank()) {
                throw new SocketException(sessionId, "relay returned no pairing code");
            }
            return code;
        });
    }

    @Override
    public CompletableFuture<Void> logout() {
        return request("logout", new JSONObject(), result -> null);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        failPending(new SocketException(sessionId, "socket closed"));
        WebSocket ws = connected.getNow(null);
        if (ws != null) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye")
                .exceptionally(e -> {
                    log.debug("[RELAY {}] Close frame failed: {}", sessionId, e.toString());
                    return null;
                });
        } else {
            connected.cancel(false);
        }
        log.info("[RELAY {}] Closed", sessionId);
    }

    private <T> CompletableFuture<T> request(String op, JSONObject frame, Function<JSONObject, T> mapper) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new SocketException(sessionId, "socket closed"));
        }
        String requestId = sessionId + "-" + requestSeq.incrementAndGet();
        CompletableFuture<JSONObject> result = new CompletableFuture<>();
        pending.put(requestId, result);
        frame.put("op", op).put("requestId", requestId);
        sendFrame(frame).whenComplete((ws, err) -> {
            if (err != null) {
                pending.remove(requestId);
                result.completeExceptionally(new SocketException(sessionId, op + " not sent", err));
            }
        });
        return result.thenApply(mapper);
    }

    private synchronized CompletableFuture<WebSocket> sendFrame(JSONObject frame) {
        String text = frame.toString();
        sendChain = sendChain.thenCompose(ws -> ws.sendText(text, true));
        return sendChain;
    }

    private void failPending(Throwable cause) {
        for (String id : List.copyOf(pending.keySet())) {
            CompletableFuture<JSONObject> future = pending.remove(id);
            if (future != null) {
                future.completeExceptionally(cause);
            }
        }
    }

    private void reportClose(int statusCode, String reason, boolean loggedOut) {
        if (closeReported.compareAndSet(false, true) && !closed.get()) {
            listener.onClose(statusCode, reason, loggedOut);
        }
    }

    int pendingCount() {
        return pending.size();
    }

    // ═══════════════════════════════════════════════════════════════
    // FRAMES
    // ═══════════════════════════════════════════════════════════════

    /**
     * Dispatch one sidecar frame. Unknown or malformed frames are logged and ignored.
     */
    void handleFrame(String json) {
        if (closed.get()) return;
        JSONObject o;
        try {
            o = new JSONObject(json);
        } catch (JSONException e) {
            log.warn("[RELAY {}] Unparseable frame: {}", sessionId, e.getMessage());
            return;
        }

        String type = o.optString("type", "");
        switch (type) {
            case "qr" -> {
                String qr = o.optString("qr", null);
                if (qr != null && !qr.isBlank()) {
                    listener.onQr(qr);
                }
            }
            case "open" -> listener.onOpen(o.optString("jid", null));
            case "close" -> {
                boolean loggedOut = o.optBoolean("loggedOut", false);
                failPending(new SocketException(sessionId, "connection closed"));
                reportClose(o.optInt("statusCode", 0), o.optString("reason", "closed"), loggedOut);
            }
            case "message" -> {
                JSONObject message = o.optJSONObject("message");
                if (message != null) {
                    listener.onInbound(toJsonNode(message));
                }
            }
            case "status" -> {
                String id = o.optString("id", null);
                Object status = o.opt("status");
                if (id != null && status != null) {
                    listener.onStatus(id, toJsonNode(new JSONObject().put("status", status)).get("status"));
                }
            }
            case "receipt" -> {
                String id = o.optString("id", null);
                JSONObject r = o.optJSONObject("receipt");
                if (id != null && r != null) {
                    listener.onReceipt(id, toReceipt(r));
                }
            }
            case "result" -> completeRequest(o);
            default -> log.debug("[RELAY {}] Ignoring frame type '{}'", sessionId, type);
        }
    }

    private void completeRequest(JSONObject o) {
        String requestId = o.optString("requestId", null);
        CompletableFuture<JSONObject> future = requestId == null ? null : pending.remove(requestId);
        if (future == null) {
            log.debug("[RELAY {}] Result for unknown request {}", sessionId, requestId);
            return;
        }
        if (o.optBoolean("ok", false)) {
            JSONObject value = o.optJSONObject("value");
            future.complete(value != null ? value : new JSONObject());
        } else {
            future.completeExceptionally(new SocketException(sessionId, o.optString("error", "relay request failed")));
        }
    }

    private static MessageReceipt toReceipt(JSONObject r) {
        return new MessageReceipt(
            optLong(r, "receiptTimestamp"),
            optLong(r, "readTimestamp"),
            optLong(r, "playedTimestamp"),
            strings(r.optJSONArray("pendingDeviceJids")),
            strings(r.optJSONArray("deliveredDeviceJids"))
        );
    }

    private static Long optLong(JSONObject o, String key) {
        if (!o.has(key) || o.isNull(key)) return null;
        long v = o.optLong(key, 0L);
        return v == 0L ? null : v;
    }

    private static List<String> strings(JSONArray array) {
        List<String> out = new ArrayList<>();
        if (array == null) return out;
        for (int i = 0; i < array.length(); i++) {
            String s = array.optString(i, null);
            if (s != null) out.add(s);
        }
        return out;
    }

    private JsonNode toJsonNode(JSONObject o) {
        try {
            return MAPPER.readTree(o.toString());
        } catch (IOException e) {
            throw new SocketException(sessionId, "frame not convertible", e);
        }
    }

    static String maskUrl(String url) {
        if (url == null) return "null";
        int tokenIdx = url.indexOf("token=");
        if (tokenIdx < 0) return url;
        int endIdx = url.indexOf('&', tokenIdx);
        if (endIdx < 0) endIdx = url.length();
        return url.substring(0, tokenIdx + 6) + "***" + url.substring(endIdx);
    }

    private final class FrameListener implements WebSocket.Listener {
        private final StringBuilder buf = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            log.info("[RELAY {}] Connected", sessionId);
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buf.append(data);
            if (last) {
                String msg = buf.toString();
                buf.setLength(0);
                try {
                    handleFrame(msg);
                } catch (RuntimeException e) {
                    log.error("[RELAY {}] Frame handling failed: {}", sessionId, e.getMessage(), e);
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.warn("[RELAY {}] Disconnected: {} {}", sessionId, statusCode, reason);
            failPending(new SocketException(sessionId, "relay disconnected"));
            reportClose(statusCode, reason, false);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.error("[RELAY {}] WebSocket error", sessionId, error);
            failPending(error);
            reportClose(0, String.valueOf(error.getMessage()), false);
        }
    }
}
