package in.sessiongate.testing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import in.sessiongate.domain.message.MessageReceipt;
import in.sessiongate.domain.message.OutboundMessage;
import in.sessiongate.socket.SessionSocket;
import in.sessiongate.socket.SessionSocketListener;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory socket driven by the test: emit platform events, inspect sent messages.
 */
public final class FakeSocket implements SessionSocket {

    public record Sent(String jid, OutboundMessage message, String messageId) {}

    private final String sessionId;
    private final SessionSocketListener listener;
    private final AtomicInteger ids = new AtomicInteger();

    public final List<Sent> sent = new CopyOnWriteArrayList<>();
    public final Set<String> unknownJids = ConcurrentHashMap.newKeySet();
    public volatile boolean opened;
    public volatile boolean closed;
    public volatile boolean loggedOut;
    public volatile String pairingCode = "ABCD-1234";
    public volatile CompletableFuture<String> nextSendResult;

    public FakeSocket(String sessionId, SessionSocketListener listener) {
        this.sessionId = sessionId;
        this.listener = listener;
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public void open() {
        opened = true;
    }

    @Override
    public CompletableFuture<String> send(String jid, OutboundMessage message) {
        CompletableFuture<String> override = nextSendResult;
        if (override != null) {
            nextSendResult = null;
            return override;
        }
        String id = "MSG-" + sessionId + "-" + ids.incrementAndGet();
        sent.add(new Sent(jid, message, id));
        return CompletableFuture.completedFuture(id);
    }

    @Override
    public CompletableFuture<Boolean> exists(String jid) {
        return CompletableFuture.completedFuture(!unknownJids.contains(jid));
    }

    @Override
    public CompletableFuture<String> requestPairingCode(String phoneNumber) {
        return CompletableFuture.completedFuture(pairingCode);
    }

    @Override
    public CompletableFuture<Void> logout() {
        loggedOut = true;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void close() {
        closed = true;
    }

    // Platform side

    public void emitQr(String challenge) {
        listener.onQr(challenge);
    }

    public void emitOpen(String jid) {
        listener.onOpen(jid);
    }

    public void emitClose(int code, String reason, boolean loggedOutByPlatform) {
        listener.onClose(code, reason, loggedOutByPlatform);
    }

    public void emitStatus(String messageId, int status) {
        listener.onStatus(messageId, IntNode.valueOf(status));
    }

    public void emitStatus(String messageId, JsonNode raw) {
        listener.onStatus(messageId, raw);
    }

    public void emitReceipt(String messageId, MessageReceipt receipt) {
        listener.onReceipt(messageId, receipt);
    }

    public void emitInbound(JsonNode message) {
        listener.onInbound(message);
    }
}
