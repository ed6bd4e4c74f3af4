package in.sessiongate.session;

import com.fasterxml.jackson.databind.JsonNode;
import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.domain.common.GatewayException;
import in.sessiongate.domain.message.MessageReceipt;
import in.sessiongate.domain.session.ConnectionState;
import in.sessiongate.metrics.GatewayMetrics;
import in.sessiongate.socket.SessionSocket;
import in.sessiongate.socket.SessionSocketFactory;
import in.sessiongate.socket.SessionSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns the socket of one session and drives its connection state machine.
 *
 * States:
 * - CONNECTING: socket created, waiting for open or a QR scan
 * - OPEN: ready to send
 * - CLOSE: disconnected; auto-reconnect unless stopped or logged out
 * - QR_TIMEOUT: the current QR challenge expired unconsumed
 *
 * Every socket belongs to a generation. Events from an older generation and
 * reconnects scheduled for one are ignored.
 *
 * Lock order: supervisor, then anything its listener touches.
 */
public class ConnectionSupervisor {
    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    /**
     * Receiver of everything the supervisor observes.
     */
    public interface Listener {
        void onConnectionUpdate(ConnectionUpdate update);

        void onQr(QrChallenge qr);

        void onInbound(JsonNode message);

        void onStatus(String messageId, JsonNode rawStatus);

        void onReceipt(String messageId, MessageReceipt receipt);
    }

    /**
     * Point-in-time view for status routes.
     */
    public record Snapshot(
        ConnectionState state,
        long generation,
        boolean stopping,
        boolean loggedOut,
        int qrVersion,
        Long qrExpiresAt,
        int pairingAttempts,
        String lastError,
        String accountJid,
        Long connectedAt,
        long reconnectDelayMs
    ) {}

    private final String sessionId;
    private final Path credentialsDir;
    private final SessionSocketFactory socketFactory;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final BackoffPolicy backoff;
    private final long qrTtlFirstMs;
    private final long qrTtlNextMs;
    private final Listener listener;
    private final GatewayMetrics metrics;

    // Socket
    private SessionSocket socket;
    private long generation = 0;
    private ConnectionState state = ConnectionState.CLOSE;
    private boolean stopping = true;
    private boolean loggedOut = false;

    // QR
    private String lastChallenge;
    private int qrVersion = 0;
    private long qrExpiresAt = 0;
    private int pairingAttempts = 0;

    // Diagnostics
    private String lastError;
    private String accountJid;
    private Long connectedAt;

    // Timers
    private ScheduledFuture<?> reconnectTask;
    private ScheduledFuture<?> qrExpiryTask;

    public ConnectionSupervisor(String sessionId, Path credentialsDir, SessionSocketFactory socketFactory,
                                ScheduledExecutorService scheduler, Clock clock, SessionSettings settings,
                                Listener listener, GatewayMetrics metrics) {
        this.sessionId = sessionId;
        this.credentialsDir = credentialsDir;
        this.socketFactory = socketFactory;
        this.scheduler = scheduler;
        this.clock = clock;
        this.backoff = BackoffPolicy.of(settings.reconnectMinMs(), settings.reconnectMaxMs());
        this.qrTtlFirstMs = settings.qrTtlFirstMs();
        this.qrTtlNextMs = settings.qrTtlNextMs();
        this.listener = listener;
        this.metrics = metrics;
    }

    // ═══════════════════════════════════════════════════════════════
    // COMMANDS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Open a socket from the stored credentials. No-op when one is already live.
     */
    public synchronized void start() {
        if (socket != null) {
            return;
        }
        stopping = false;
        loggedOut = false;
        openSocket();
    }

    /**
     * Drop the current socket and open a fresh one immediately.
     */
    public synchronized void reconnect() {
        cancelReconnect();
        stopping = false;
        loggedOut = false;
        closeSocket();
        openSocket();
    }

    /**
     * Close the socket without logging out and cancel all timers.
     * Late events of the closed socket are ignored.
     */
    public synchronized void stop() {
        stopping = true;
        cancelReconnect();
        cancelQrExpiry();
        generation++;
        closeSocket();
        if (state != ConnectionState.CLOSE) {
            changeState(new ConnectionUpdate(ConnectionState.CLOSE, null, "stopped", loggedOut, null, null));
        }
    }

    /**
     * Log the account out. Terminal: no auto-reconnect until {@link #start()} or {@link #reconnect()}.
     */
    public CompletableFuture<Void> logout() {
        SessionSocket current;
        synchronized (this) {
            stopping = true;
            cancelReconnect();
            current = socket;
        }
        if (current == null) {
            markLoggedOut(null);
            return CompletableFuture.completedFuture(null);
        }
        return current.logout().handle((ignored, error) -> {
            if (error != null) {
                log.warn("[SUPERVISOR] {} logout failed: {}", sessionId, error.toString());
            }
            markLoggedOut(error == null ? null : error.getMessage());
            return null;
        });
    }

    private synchronized void markLoggedOut(String error) {
        loggedOut = true;
        lastError = error;
        cancelQrExpiry();
        generation++;
        closeSocket();
        lastChallenge = null;
        changeState(new ConnectionUpdate(ConnectionState.CLOSE, null, "logged out", true, null, null));
    }

    public CompletableFuture<String> requestPairingCode(String phoneNumber) {
        return requireSocket().requestPairingCode(phoneNumber);
    }

    /**
     * Live socket in OPEN state.
     *
     * @throws GatewayException socket_unavailable otherwise
     */
    public synchronized SessionSocket requireOpenSocket() {
        if (socket == null || state != ConnectionState.OPEN) {
            throw new GatewayException(ErrorCode.SOCKET_UNAVAILABLE,
                "session " + sessionId + " is not connected (" + state.wire() + ")");
        }
        return socket;
    }

    /**
     * Live socket in any state.
     */
    public synchronized SessionSocket requireSocket() {
        if (socket == null) {
            throw new GatewayException(ErrorCode.SOCKET_UNAVAILABLE, "session " + sessionId + " has no socket");
        }
        return socket;
    }

    // ═══════════════════════════════════════════════════════════════
    // READ ACCESS
    // ═══════════════════════════════════════════════════════════════

    public synchronized ConnectionState getState() {
        return state;
    }

    /**
     * Current QR challenge, or null when connected or none was issued.
     */
    public synchronized QrChallenge currentQr() {
        if (lastChallenge == null || state == ConnectionState.OPEN) {
            return null;
        }
        return new QrChallenge(lastChallenge, qrVersion, qrExpiresAt, pairingAttempts);
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(state, generation, stopping, loggedOut, qrVersion,
            qrExpiresAt == 0 ? null : qrExpiresAt, pairingAttempts, lastError, accountJid,
            connectedAt, backoff.currentDelay().toMillis());
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNALS (caller holds the monitor)
    // ═══════════════════════════════════════════════════════════════

    private void openSocket() {
        generation++;
        long gen = generation;
        changeState(ConnectionUpdate.of(ConnectionState.CONNECTING));
        try {
            socket = socketFactory.create(sessionId, credentialsDir, new GenerationListener(gen));
            socket.open();
            log.info("[SUPERVISOR] {} connecting (generation {})", sessionId, gen);
        } catch (RuntimeException e) {
            log.error("[SUPERVISOR] {} socket open failed: {}", sessionId, e.getMessage(), e);
            lastError = e.getMessage();
            socket = null;
            changeState(new ConnectionUpdate(ConnectionState.CLOSE, null, e.getMessage(), false, null, null));
            scheduleReconnect();
        }
    }

    private void closeSocket() {
        if (socket == null) return;
        SessionSocket closing = socket;
        socket = null;
        try {
            closing.close();
        } catch (RuntimeException e) {
            log.warn("[SUPERVISOR] {} socket close failed: {}", sessionId, e.toString());
        }
    }

    private void scheduleReconnect() {
        if (stopping || loggedOut) return;
        cancelReconnect();
        Duration delay = backoff.nextDelay();
        long gen = generation;
        reconnectTask = scheduler.schedule(() -> reconnectIfCurrent(gen), delay.toMillis(), TimeUnit.MILLISECONDS);
        metrics.recordReconnectScheduled();
        log.info("[SUPERVISOR] {} reconnect in {} ms", sessionId, delay.toMillis());
    }

    private synchronized void reconnectIfCurrent(long gen) {
        if (stopping || loggedOut || generation != gen) {
            log.debug("[SUPERVISOR] {} stale reconnect for generation {} ignored", sessionId, gen);
            return;
        }
        reconnectTask = null;
        openSocket();
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    private void cancelQrExpiry() {
        if (qrExpiryTask != null) {
            qrExpiryTask.cancel(false);
            qrExpiryTask = null;
        }
    }

    private void changeState(ConnectionUpdate update) {
        state = update.state();
        metrics.recordConnectionState(state);
        listener.onConnectionUpdate(update);
    }

    // ═══════════════════════════════════════════════════════════════
    // SOCKET EVENTS
    // ═══════════════════════════════════════════════════════════════

    private synchronized void handleQr(long gen, String challenge) {
        if (gen != generation || challenge == null || challenge.equals(lastChallenge)) {
            return;
        }
        lastChallenge = challenge;
        qrVersion++;
        long ttl = qrVersion == 1 ? qrTtlFirstMs : qrTtlNextMs;
        qrExpiresAt = clock.millis() + ttl;
        pairingAttempts++;

        if (state == ConnectionState.QR_TIMEOUT) {
            changeState(ConnectionUpdate.of(ConnectionState.CONNECTING));
        }

        cancelQrExpiry();
        int version = qrVersion;
        qrExpiryTask = scheduler.schedule(() -> expireQr(gen, version, challenge), ttl, TimeUnit.MILLISECONDS);

        log.info("[SUPERVISOR] {} QR v{} issued, expires in {} ms", sessionId, version, ttl);
        listener.onQr(new QrChallenge(challenge, version, qrExpiresAt, pairingAttempts));
    }

    private synchronized void expireQr(long gen, int version, String challenge) {
        if (gen != generation || version != qrVersion || !challenge.equals(lastChallenge)
                || state == ConnectionState.OPEN || state == ConnectionState.QR_TIMEOUT) {
            return;
        }
        qrExpiryTask = null;
        log.info("[SUPERVISOR] {} QR v{} expired", sessionId, version);
        changeState(new ConnectionUpdate(ConnectionState.QR_TIMEOUT, null, "qr expired", false, null, null));
    }

    private synchronized void handleOpen(long gen, String jid) {
        if (gen != generation) return;
        backoff.reset();
        cancelQrExpiry();
        lastChallenge = null;
        qrExpiresAt = 0;
        pairingAttempts = 0;
        lastError = null;
        accountJid = jid;
        connectedAt = clock.millis();
        log.info("[SUPERVISOR] {} open as {}", sessionId, jid);
        changeState(new ConnectionUpdate(ConnectionState.OPEN, null, null, false, jid, null));
    }

    private synchronized void handleClose(long gen, int statusCode, String reason, boolean wasLoggedOut) {
        if (gen != generation) return;
        socket = null;
        cancelQrExpiry();
        lastError = reason;
        connectedAt = null;

        if (wasLoggedOut) {
            loggedOut = true;
            lastChallenge = null;
            log.warn("[SUPERVISOR] {} logged out by platform (code {}); re-pair required", sessionId, statusCode);
            changeState(new ConnectionUpdate(ConnectionState.CLOSE, statusCode, reason, true, null, null));
            return;
        }

        Long reconnectIn = stopping ? null : backoff.currentDelay().toMillis();
        log.warn("[SUPERVISOR] {} closed (code {}, reason {})", sessionId, statusCode, reason);
        changeState(new ConnectionUpdate(ConnectionState.CLOSE, statusCode, reason, false, null, reconnectIn));
        scheduleReconnect();
    }

    private boolean isCurrent(long gen) {
        synchronized (this) {
            return gen == generation;
        }
    }

    /**
     * Socket listener bound to one generation.
     */
    private final class GenerationListener implements SessionSocketListener {
        private final long gen;

        GenerationListener(long gen) {
            this.gen = gen;
        }

        @Override
        public void onQr(String challenge) {
            handleQr(gen, challenge);
        }

        @Override
        public void onOpen(String accountJid) {
            handleOpen(gen, accountJid);
        }

        @Override
        public void onClose(int statusCode, String reason, boolean loggedOut) {
            handleClose(gen, statusCode, reason, loggedOut);
        }

        @Override
        public void onInbound(JsonNode message) {
            if (isCurrent(gen)) listener.onInbound(message);
        }

        @Override
        public void onStatus(String messageId, JsonNode rawStatus) {
            if (isCurrent(gen)) listener.onStatus(messageId, rawStatus);
        }

        @Override
        public void onReceipt(String messageId, MessageReceipt receipt) {
            if (isCurrent(gen)) listener.onReceipt(messageId, receipt);
        }
    }
}
