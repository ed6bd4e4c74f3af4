package in.sessiongate.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.sessiongate.broker.EventBroker;
import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.domain.common.GatewayException;
import in.sessiongate.domain.event.BrokerEvent;
import in.sessiongate.domain.event.EventDirection;
import in.sessiongate.domain.event.EventType;
import in.sessiongate.domain.message.MessageReceipt;
import in.sessiongate.domain.message.OutboundMessage;
import in.sessiongate.domain.message.SentMessage;
import in.sessiongate.domain.session.ConnectionState;
import in.sessiongate.domain.session.SessionIndexEntry;
import in.sessiongate.domain.session.SessionMetadata;
import in.sessiongate.metrics.GatewayMetrics;
import in.sessiongate.security.InputValidator;
import in.sessiongate.socket.SessionSocket;
import in.sessiongate.socket.SessionSocketFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One chat session: connection supervisor, status ledger, rate window and
 * serialized send path, plus its durable metadata.
 *
 * Socket events are republished to the {@link EventBroker}:
 * - CONNECTION_UPDATE, QR (system)
 * - MESSAGE_INBOUND (inbound)
 * - MESSAGE_OUTBOUND, MESSAGE_STATUS (outbound)
 */
public class Session implements ConnectionSupervisor.Listener, StatusLedger.Listener {
    private static final Logger log = LoggerFactory.getLogger(Session.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public record ExistsResult(String jid, boolean exists) {}

    private final String id;
    private final Path dir;
    private final SessionSettings settings;
    private final EventBroker broker;
    private final GatewayMetrics gatewayMetrics;
    private final Clock clock;

    private final ConnectionSupervisor supervisor;
    private final StatusLedger ledger;
    private final RateWindow rateWindow;
    private final SessionMetrics metrics;
    private final SendDispatcher dispatcher;

    // Durable metadata, guarded by this
    private String name;
    private String phoneNumber;
    private SessionMetadata metadata;

    public Session(SessionIndexEntry entry, SessionSettings settings, SessionSocketFactory socketFactory,
                   ScheduledExecutorService scheduler, EventBroker broker, GatewayMetrics gatewayMetrics,
                   Clock clock) {
        this.id = entry.id();
        this.dir = Path.of(entry.dir());
        this.name = entry.name();
        this.phoneNumber = entry.phoneNumber();
        this.metadata = entry.metadata();
        this.settings = settings;
        this.broker = broker;
        this.gatewayMetrics = gatewayMetrics;
        this.clock = clock;

        this.rateWindow = new RateWindow(settings.rateMaxSends(), settings.rateWindowMs(), clock);
        this.metrics = new SessionMetrics(clock);
        this.ledger = new StatusLedger(id, settings.statusTtlMs(), clock, scheduler, this);
        this.dispatcher = new SendDispatcher(id, settings.sendQueueCapacity(), settings.sendTimeoutMs());
        this.supervisor = new ConnectionSupervisor(id, dir, socketFactory, scheduler, clock, settings,
            this, gatewayMetrics);
    }

    public String getId() {
        return id;
    }

    public Path getDir() {
        return dir;
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    public void start() {
        ledger.start(settings.statusSweepIntervalMs());
        supervisor.start();
    }

    /**
     * Close the socket and release ack waiters. The session can be started again.
     */
    public void stop() {
        supervisor.stop();
        ledger.releaseWaiters();
    }

    /**
     * Stop for good: also stops the sweep and fails queued sends.
     */
    public void shutdown() {
        supervisor.stop();
        ledger.close();
        dispatcher.shutdown();
    }

    public void reconnect() {
        supervisor.reconnect();
    }

    public CompletableFuture<Void> logout() {
        return supervisor.logout();
    }

    /**
     * Request a pairing code for phone-number login. Blocks up to the send timeout.
     */
    public String requestPairingCode(String phone) {
        String normalized = InputValidator.normalizePhone(phone);
        if (normalized == null) {
            throw new GatewayException(ErrorCode.INVALID_RECIPIENT, "invalid phone number: " + phone);
        }
        String code = await(supervisor.requestPairingCode(normalized));
        synchronized (this) {
            phoneNumber = normalized;
        }
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("phoneNumber", normalized);
        payload.put("pairingCode", code);
        append(EventType.PAIRING_CODE, EventDirection.SYSTEM, payload);
        log.info("[SESSION] {} pairing code issued for {}", id, normalized);
        return code;
    }

    // ═══════════════════════════════════════════════════════════════
    // SEND PATH
    // ═══════════════════════════════════════════════════════════════

    /**
     * Admission-controlled send. Blocks until the socket accepts the message and,
     * with {@code waitAckMs > 0}, until the first status or the wait deadline.
     *
     * @throws GatewayException invalid_recipient, socket_unavailable, rate_limit_exceeded,
     *                          send_queue_full, whatsapp_not_found, send_timeout, send_failed
     */
    public SentMessage send(String to, OutboundMessage message, long waitAckMs) {
        String jid = InputValidator.toJid(to);
        SessionSocket socket = supervisor.requireOpenSocket();

        if (!rateWindow.allow()) {
            gatewayMetrics.recordRateLimitRejection();
            log.warn("[SESSION] {} rate limit hit ({} per {} ms)", id, rateWindow.getMaxSends(), rateWindow.getWindowMs());
            throw new GatewayException(ErrorCode.RATE_LIMIT_EXCEEDED,
                "rate limit exceeded: " + rateWindow.getMaxSends() + " sends per " + rateWindow.getWindowMs() + " ms");
        }

        // group and broadcast JIDs skip the registration lookup
        boolean lookup = jid.endsWith(InputValidator.USER_JID_SUFFIX);
        CompletableFuture<String> dispatched = dispatcher.submit(() -> (lookup
                ? socket.exists(jid)
                : CompletableFuture.completedFuture(Boolean.TRUE)).thenCompose(found -> {
            if (!Boolean.TRUE.equals(found)) {
                return CompletableFuture.<String>failedFuture(
                    new GatewayException(ErrorCode.WHATSAPP_NOT_FOUND, "recipient not on the platform: " + jid));
            }
            return socket.send(jid, message);
        }));
        String messageId = join(dispatched);

        long now = clock.millis();
        ledger.trackSent(messageId);
        metrics.recordSent(messageId, message.kind());
        gatewayMetrics.recordMessageSent(message.kind());
        metrics.snapshot(ledger, rateWindow, false);

        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("messageId", messageId);
        payload.put("to", jid);
        payload.put("type", message.kind().wire());
        payload.set("content", message.content());
        payload.put("timestamp", now);
        append(EventType.MESSAGE_OUTBOUND, EventDirection.OUTBOUND, payload);
        log.debug("[SESSION] {} sent {} {} to {}", id, message.kind().wire(), messageId, jid);

        SentMessage sent = new SentMessage(messageId, jid, message.kind(), now, null);
        long wait = InputValidator.waitAckMs(waitAckMs);
        if (wait > 0) {
            Integer ack = ledger.waitForAck(messageId, wait).join();
            return sent.withAck(ack);
        }
        return sent;
    }

    public ExistsResult exists(String to) {
        String jid = InputValidator.toJid(to);
        SessionSocket socket = supervisor.requireOpenSocket();
        Boolean found = await(socket.exists(jid));
        return new ExistsResult(jid, Boolean.TRUE.equals(found));
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(settings.sendTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new GatewayException(ErrorCode.SEND_TIMEOUT, "send timeout");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(ErrorCode.SOCKET_UNAVAILABLE, "interrupted");
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    private static RuntimeException unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof GatewayException ge) {
            return ge;
        }
        return new GatewayException(ErrorCode.SEND_FAILED,
            cause.getMessage() == null ? cause.toString() : cause.getMessage(), cause);
    }

    // ═══════════════════════════════════════════════════════════════
    // SUPERVISOR EVENTS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public void onConnectionUpdate(ConnectionUpdate update) {
        append(EventType.CONNECTION_UPDATE, EventDirection.SYSTEM, MAPPER.valueToTree(update));
    }

    @Override
    public void onQr(QrChallenge qr) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("qrVersion", qr.version());
        payload.put("expiresAt", qr.expiresAt());
        payload.put("attempt", qr.attempt());
        append(EventType.QR, EventDirection.SYSTEM, payload);
    }

    @Override
    public void onInbound(JsonNode message) {
        append(EventType.MESSAGE_INBOUND, EventDirection.INBOUND, message);
    }

    @Override
    public void onStatus(String messageId, JsonNode rawStatus) {
        Integer status = StatusCodes.normalize(rawStatus);
        if (status == null) {
            log.debug("[SESSION] {} unrecognized status {} for {}", id, rawStatus, messageId);
            return;
        }
        ledger.applyStatus(messageId, status);
    }

    @Override
    public void onReceipt(String messageId, MessageReceipt receipt) {
        Integer status = receipt.deriveStatus();
        if (status != null) {
            ledger.applyStatus(messageId, status);
        }
    }

    @Override
    public void onStatusApplied(String messageId, Integer previous, int status, Long ackLatencyMs, boolean finalized) {
        metrics.recordStatus(messageId, status);
        gatewayMetrics.recordStatusUpdate(status);
        if (ackLatencyMs != null) {
            gatewayMetrics.recordAckLatency(ackLatencyMs);
        }
        metrics.snapshot(ledger, rateWindow, true);

        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("messageId", messageId);
        payload.put("status", status);
        if (previous != null) {
            payload.put("previous", previous);
        }
        if (ackLatencyMs != null) {
            payload.put("ackLatencyMs", ackLatencyMs);
        }
        payload.put("final", finalized);
        append(EventType.MESSAGE_STATUS, EventDirection.OUTBOUND, payload);
    }

    private void append(EventType type, EventDirection direction, JsonNode payload) {
        broker.append(BrokerEvent.draft(type, id, direction, payload));
    }

    // ═══════════════════════════════════════════════════════════════
    // METADATA
    // ═══════════════════════════════════════════════════════════════

    public synchronized String getName() {
        return name;
    }

    public synchronized SessionMetadata getMetadata() {
        return metadata;
    }

    public synchronized String getPhoneNumber() {
        return phoneNumber;
    }

    synchronized void setName(String name) {
        this.name = name;
    }

    synchronized void setMetadata(SessionMetadata metadata) {
        this.metadata = metadata;
    }

    public synchronized SessionIndexEntry toEntry() {
        return new SessionIndexEntry(id, name, dir.toString(), phoneNumber, metadata);
    }

    // ═══════════════════════════════════════════════════════════════
    // VIEWS
    // ═══════════════════════════════════════════════════════════════

    public ConnectionSupervisor.Snapshot connection() {
        return supervisor.snapshot();
    }

    public QrChallenge currentQr() {
        return supervisor.currentQr();
    }

    public StatusLedger.StatusEntry statusOf(String messageId) {
        return ledger.statusOf(messageId);
    }

    /**
     * Summary for list and get routes.
     */
    public record Summary(
        String id,
        String name,
        String phoneNumber,
        ConnectionSupervisor.Snapshot connection,
        boolean connected,
        SessionMetadata metadata,
        long sent,
        Map<String, Long> statusCounts,
        int rateInWindow,
        int sendQueue
    ) {}

    public Summary summary() {
        ConnectionSupervisor.Snapshot connection = supervisor.snapshot();
        SessionIndexEntry entry = toEntry();
        return new Summary(id, entry.name(), entry.phoneNumber(), connection,
            connection.state() == ConnectionState.OPEN,
            entry.metadata(), metrics.getSent(), ledger.liveBuckets(), rateWindow.inWindow(), dispatcher.queued());
    }

    /**
     * Per-session metrics for the metrics route.
     */
    public record MetricsView(
        long sent,
        Map<String, Long> sentByType,
        Map<String, Long> statusCounts,
        Map<String, Long> finalized,
        SessionMetrics.Last last,
        StatusLedger.AckStats ack,
        int inFlight,
        RateView rate,
        List<SessionMetrics.TimelinePoint> timeline
    ) {}

    public record RateView(int inWindow, int limit, long windowMs) {}

    public MetricsView metricsView() {
        return new MetricsView(metrics.getSent(), metrics.getSentByType(), ledger.liveBuckets(),
            ledger.totalBuckets(), metrics.getLast(), ledger.ackStats(), ledger.size(),
            new RateView(rateWindow.inWindow(), rateWindow.getMaxSends(), rateWindow.getWindowMs()),
            metrics.getTimeline());
    }

    StatusLedger ledger() {
        return ledger;
    }
}
