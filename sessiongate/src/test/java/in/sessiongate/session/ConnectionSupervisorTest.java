package in.sessiongate.session;

import com.fasterxml.jackson.databind.JsonNode;
import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.domain.common.GatewayException;
import in.sessiongate.domain.message.MessageReceipt;
import in.sessiongate.domain.session.ConnectionState;
import in.sessiongate.metrics.NoopGatewayMetrics;
import in.sessiongate.testing.Await;
import in.sessiongate.testing.FakeSocket;
import in.sessiongate.testing.FakeSocketFactory;
import in.sessiongate.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConnectionSupervisor.
 *
 * Tests:
 * - Connect, open and close transitions
 * - Auto-reconnect with backoff, none after logout or stop
 * - Generation guard against late events of replaced sockets
 * - QR versioning and expiry
 */
class ConnectionSupervisorTest {

    private static final String SESSION = "sales";

    private final List<ConnectionUpdate> updates = new CopyOnWriteArrayList<>();
    private final List<QrChallenge> qrs = new CopyOnWriteArrayList<>();
    private final List<String> statuses = new CopyOnWriteArrayList<>();

    private FakeSocketFactory factory;
    private ScheduledExecutorService scheduler;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        factory = new FakeSocketFactory();
        scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "supervisor-test");
            t.setDaemon(true);
            return t;
        });
        clock = new MutableClock(1_700_000_000_000L);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private ConnectionSupervisor supervisor(SessionSettings settings) {
        ConnectionSupervisor.Listener listener = new ConnectionSupervisor.Listener() {
            @Override
            public void onConnectionUpdate(ConnectionUpdate update) {
                updates.add(update);
            }

            @Override
            public void onQr(QrChallenge qr) {
                qrs.add(qr);
            }

            @Override
            public void onInbound(JsonNode message) {
            }

            @Override
            public void onStatus(String messageId, JsonNode rawStatus) {
                statuses.add(messageId);
            }

            @Override
            public void onReceipt(String messageId, MessageReceipt receipt) {
            }
        };
        return new ConnectionSupervisor(SESSION, Path.of("target", "creds", SESSION), factory, scheduler,
            clock, settings, listener, NoopGatewayMetrics.INSTANCE);
    }

    private ConnectionSupervisor supervisor() {
        return supervisor(SessionSettings.builder().reconnect(20, 200).build());
    }

    @Test
    void testStartOpensSocket() {
        ConnectionSupervisor supervisor = supervisor();

        supervisor.start();

        assertEquals(1, factory.count(SESSION));
        assertTrue(factory.latest(SESSION).opened, "Socket should be opened");
        assertEquals(ConnectionState.CONNECTING, supervisor.getState());

        supervisor.start();
        assertEquals(1, factory.count(SESSION), "Start with a live socket is a no-op");
    }

    @Test
    void testOpenTransition() {
        ConnectionSupervisor supervisor = supervisor();
        supervisor.start();

        factory.latest(SESSION).emitOpen("5511999999999@s.whatsapp.net");

        assertEquals(ConnectionState.OPEN, supervisor.getState());
        assertSame(factory.latest(SESSION), supervisor.requireOpenSocket());
        ConnectionSupervisor.Snapshot snapshot = supervisor.snapshot();
        assertEquals("5511999999999@s.whatsapp.net", snapshot.accountJid());
        assertEquals(clock.millis(), snapshot.connectedAt());
        assertEquals(ConnectionState.OPEN, updates.get(updates.size() - 1).state());
    }

    @Test
    void testRequireOpenSocketWhileConnecting() {
        ConnectionSupervisor supervisor = supervisor();
        supervisor.start();

        GatewayException e = assertThrows(GatewayException.class, supervisor::requireOpenSocket);
        assertEquals(ErrorCode.SOCKET_UNAVAILABLE, e.getErrorCode());
    }

    @Test
    void testCloseSchedulesReconnect() {
        ConnectionSupervisor supervisor = supervisor();
        supervisor.start();
        factory.latest(SESSION).emitOpen("jid");

        factory.latest(SESSION).emitClose(428, "connection lost", false);

        ConnectionUpdate closed = updates.get(updates.size() - 1);
        assertEquals(ConnectionState.CLOSE, closed.state());
        assertEquals(428, closed.statusCode());
        assertNotNull(closed.reconnectInMs(), "Close should announce the reconnect delay");

        Await.until(() -> factory.count(SESSION) == 2, 2_000, "reconnect should open a second socket");
        assertEquals(ConnectionState.CONNECTING, supervisor.getState());
    }

    @Test
    void testPlatformLogoutIsTerminal() throws Exception {
        ConnectionSupervisor supervisor = supervisor();
        supervisor.start();
        factory.latest(SESSION).emitOpen("jid");

        factory.latest(SESSION).emitClose(401, "logged out", true);

        Thread.sleep(150);
        assertEquals(1, factory.count(SESSION), "No reconnect after a platform logout");
        assertTrue(supervisor.snapshot().loggedOut());
        assertTrue(updates.get(updates.size() - 1).loggedOut());

        supervisor.start();
        assertEquals(2, factory.count(SESSION), "Explicit start opens a fresh socket");
        assertFalse(supervisor.snapshot().loggedOut());
    }

    @Test
    void testLogoutCommand() {
        ConnectionSupervisor supervisor = supervisor();
        supervisor.start();
        FakeSocket socket = factory.latest(SESSION);
        socket.emitOpen("jid");

        supervisor.logout().join();

        assertTrue(socket.loggedOut, "Socket asked to log out");
        assertTrue(socket.closed, "Socket closed after logout");
        assertEquals(ConnectionState.CLOSE, supervisor.getState());
        assertTrue(supervisor.snapshot().loggedOut());
    }

    @Test
    void testStaleGenerationIgnored() {
        ConnectionSupervisor supervisor = supervisor();
        supervisor.start();
        FakeSocket first = factory.latest(SESSION);

        supervisor.reconnect();
        FakeSocket second = factory.latest(SESSION);

        assertNotSame(first, second);
        assertTrue(first.closed, "Replaced socket is closed");

        first.emitOpen("late");
        first.emitStatus("m1", 2);
        assertEquals(ConnectionState.CONNECTING, supervisor.getState(), "Late open from old socket ignored");
        assertTrue(statuses.isEmpty(), "Late status from old socket ignored");

        second.emitOpen("jid");
        second.emitStatus("m2", 2);
        assertEquals(ConnectionState.OPEN, supervisor.getState());
        assertEquals(List.of("m2"), statuses);
    }

    @Test
    void testStopCancelsReconnect() throws Exception {
        ConnectionSupervisor supervisor = supervisor();
        supervisor.start();
        FakeSocket socket = factory.latest(SESSION);
        socket.emitOpen("jid");

        supervisor.stop();

        assertTrue(socket.closed);
        assertEquals(ConnectionState.CLOSE, supervisor.getState());
        socket.emitClose(500, "late close", false);
        Thread.sleep(150);
        assertEquals(1, factory.count(SESSION), "Stopped supervisor must not reconnect");
    }

    @Test
    void testSocketCreationFailureRetries() {
        factory.failWith = new IllegalStateException("relay down");
        ConnectionSupervisor supervisor = supervisor();

        supervisor.start();

        assertEquals(ConnectionState.CLOSE, supervisor.getState());
        assertEquals("relay down", supervisor.snapshot().lastError());

        factory.failWith = null;
        Await.until(() -> factory.count(SESSION) == 1, 2_000, "retry after a failed socket creation");
    }

    @Test
    void testQrVersioning() {
        ConnectionSupervisor supervisor = supervisor(SessionSettings.builder().qrTtl(60_000, 20_000).build());
        supervisor.start();
        FakeSocket socket = factory.latest(SESSION);

        socket.emitQr("challenge-1");
        socket.emitQr("challenge-1");
        socket.emitQr("challenge-2");

        assertEquals(2, qrs.size(), "Repeated challenge is not re-issued");
        assertEquals(1, qrs.get(0).version());
        assertEquals(clock.millis() + 60_000, qrs.get(0).expiresAt(), "First QR uses the first TTL");
        assertEquals(2, qrs.get(1).version());
        assertEquals(clock.millis() + 20_000, qrs.get(1).expiresAt(), "Later QRs use the shorter TTL");

        QrChallenge current = supervisor.currentQr();
        assertEquals("challenge-2", current.challenge());
        assertEquals(2, current.attempt());

        socket.emitOpen("jid");
        assertNull(supervisor.currentQr(), "No QR once connected");
        assertEquals(0, supervisor.snapshot().pairingAttempts(), "Open resets pairing attempts");
    }

    @Test
    void testQrExpiry() {
        ConnectionSupervisor supervisor = supervisor(SessionSettings.builder().qrTtl(40, 60_000).build());
        supervisor.start();

        factory.latest(SESSION).emitQr("challenge-1");

        Await.until(() -> supervisor.getState() == ConnectionState.QR_TIMEOUT, 2_000, "QR should expire");

        factory.latest(SESSION).emitQr("challenge-2");
        assertEquals(ConnectionState.CONNECTING, supervisor.getState(), "A fresh QR leaves QR_TIMEOUT");
    }
}
