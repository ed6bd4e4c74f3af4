package in.sessiongate.socket.relay;

import com.fasterxml.jackson.databind.JsonNode;
import in.sessiongate.domain.message.MessageReceipt;
import in.sessiongate.socket.SessionSocketListener;
import in.sessiongate.socket.SocketException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RelaySessionSocket frame handling and RelaySocketFactory addressing.
 *
 * Tests:
 * - Sidecar frames dispatched to the listener
 * - Command results matched by requestId
 * - Close reported once, pending commands failed
 * - Token masking and relay URIs
 */
@ExtendWith(MockitoExtension.class)
class RelaySessionSocketTest {

    @Mock
    private SessionSocketListener listener;

    private RelaySessionSocket socket;

    @BeforeEach
    void setUp() {
        socket = new RelaySessionSocket("sales", "/data/sessions/sales",
            URI.create("ws://localhost:1/sales"), HttpClient.newHttpClient(), listener);
    }

    @Test
    void testQrAndOpenFrames() {
        socket.handleFrame("{\"type\":\"qr\",\"qr\":\"2@abc\"}");
        socket.handleFrame("{\"type\":\"qr\",\"qr\":\"\"}");
        socket.handleFrame("{\"type\":\"open\",\"jid\":\"5511@s.whatsapp.net\"}");

        verify(listener).onQr("2@abc");
        verify(listener).onOpen("5511@s.whatsapp.net");
        verifyNoMoreInteractions(listener);
    }

    @Test
    void testMessageFrame() {
        socket.handleFrame("{\"type\":\"message\",\"message\":{\"from\":\"5511@s.whatsapp.net\",\"text\":\"hi\"}}");

        ArgumentCaptor<JsonNode> captor = ArgumentCaptor.forClass(JsonNode.class);
        verify(listener).onInbound(captor.capture());
        assertEquals("hi", captor.getValue().get("text").asText());
    }

    @Test
    void testStatusFrame() {
        socket.handleFrame("{\"type\":\"status\",\"id\":\"MSG1\",\"status\":3}");
        socket.handleFrame("{\"type\":\"status\",\"id\":\"MSG2\",\"status\":\"READ\"}");

        ArgumentCaptor<JsonNode> captor = ArgumentCaptor.forClass(JsonNode.class);
        verify(listener).onStatus(eq("MSG1"), captor.capture());
        assertEquals(3, captor.getValue().asInt());
        verify(listener).onStatus(eq("MSG2"), captor.capture());
        assertEquals("READ", captor.getValue().asText());
    }

    @Test
    void testReceiptFrame() {
        socket.handleFrame("{\"type\":\"receipt\",\"id\":\"MSG1\",\"receipt\":{\"readTimestamp\":1700000000,"
            + "\"deliveredDeviceJids\":[\"a@s.whatsapp.net\"]}}");

        ArgumentCaptor<MessageReceipt> captor = ArgumentCaptor.forClass(MessageReceipt.class);
        verify(listener).onReceipt(eq("MSG1"), captor.capture());
        MessageReceipt receipt = captor.getValue();
        assertEquals(1_700_000_000L, receipt.readTimestamp());
        assertNull(receipt.receiptTimestamp());
        assertEquals(List.of("a@s.whatsapp.net"), receipt.deliveredDeviceJids());
        assertEquals(4, receipt.deriveStatus());
    }

    @Test
    void testMalformedFramesIgnored() {
        socket.handleFrame("not json");
        socket.handleFrame("{\"type\":\"unknown\"}");
        socket.handleFrame("{\"type\":\"status\"}");

        verifyNoInteractions(listener);
    }

    @Test
    void testCommandResultMatched() {
        CompletableFuture<Boolean> exists = socket.exists("5511@s.whatsapp.net");
        CompletableFuture<String> code = socket.requestPairingCode("5511987654321");
        assertEquals(2, socket.pendingCount());

        socket.handleFrame("{\"type\":\"result\",\"requestId\":\"sales-2\",\"ok\":true,\"value\":{\"code\":\"WXYZ-1234\"}}");
        socket.handleFrame("{\"type\":\"result\",\"requestId\":\"sales-1\",\"ok\":true,\"value\":{\"exists\":true}}");

        assertEquals("WXYZ-1234", code.join());
        assertTrue(exists.join());
        assertEquals(0, socket.pendingCount());
    }

    @Test
    void testCommandErrorResult() {
        CompletableFuture<String> code = socket.requestPairingCode("5511987654321");

        socket.handleFrame("{\"type\":\"result\",\"requestId\":\"sales-1\",\"ok\":false,\"error\":\"not allowed\"}");

        CompletionException e = assertThrows(CompletionException.class, code::join);
        assertInstanceOf(SocketException.class, e.getCause());
        assertEquals("not allowed", e.getCause().getMessage());
    }

    @Test
    void testMissingPairingCodeFails() {
        CompletableFuture<String> code = socket.requestPairingCode("5511987654321");

        socket.handleFrame("{\"type\":\"result\",\"requestId\":\"sales-1\",\"ok\":true}");

        CompletionException e = assertThrows(CompletionException.class, code::join);
        assertInstanceOf(SocketException.class, e.getCause());
    }

    @Test
    void testCloseFrameReportedOnce() {
        CompletableFuture<Boolean> pending = socket.exists("5511@s.whatsapp.net");

        socket.handleFrame("{\"type\":\"close\",\"statusCode\":401,\"reason\":\"logged out\",\"loggedOut\":true}");
        socket.handleFrame("{\"type\":\"close\",\"statusCode\":428,\"reason\":\"again\"}");

        verify(listener, times(1)).onClose(anyInt(), anyString(), anyBoolean());
        verify(listener).onClose(401, "logged out", true);
        assertTrue(pending.isCompletedExceptionally(), "Pending commands fail on close");
    }

    @Test
    void testClosedSocketIgnoresFrames() {
        socket.close();
        socket.close();

        socket.handleFrame("{\"type\":\"open\",\"jid\":\"x\"}");

        verify(listener, never()).onOpen(any());
        CompletableFuture<Boolean> late = socket.exists("x");
        assertTrue(late.isCompletedExceptionally(), "Commands after close fail");
    }

    @Test
    void testMaskUrl() {
        assertEquals("ws://relay/sales?token=***", RelaySessionSocket.maskUrl("ws://relay/sales?token=abc"));
        assertEquals("ws://relay/sales?token=***&x=1", RelaySessionSocket.maskUrl("ws://relay/sales?token=abc&x=1"));
        assertEquals("ws://relay/sales", RelaySessionSocket.maskUrl("ws://relay/sales"));
        assertEquals("null", RelaySessionSocket.maskUrl(null));
    }

    @Test
    void testFactoryUri() {
        RelaySocketFactory factory = new RelaySocketFactory("ws://relay:8090/sessions/", "t o/k");

        assertEquals(URI.create("ws://relay:8090/sessions/sales%20team?token=t+o%2Fk"), factory.uriFor("sales team"));
        assertEquals(URI.create("ws://relay:8090/sessions/sales"),
            new RelaySocketFactory("ws://relay:8090/sessions", null).uriFor("sales"));
        assertThrows(IllegalArgumentException.class, () -> new RelaySocketFactory(" ", null));
    }
}
