package in.sessiongate.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.sessiongate.broker.EventBroker;
import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.domain.common.GatewayException;
import in.sessiongate.domain.event.BrokerEvent;
import in.sessiongate.domain.event.EventDirection;
import in.sessiongate.domain.event.EventType;
import in.sessiongate.metrics.GatewayMetrics;
import in.sessiongate.metrics.NoopGatewayMetrics;
import in.sessiongate.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for InboundWebhookProcessor.
 *
 * Tests:
 * - Signed body appended as WEBHOOK_INBOUND
 * - Bad signature and bad JSON rejected
 * - Duplicates by header and by body hash
 * - Idempotency key resolution order
 */
@ExtendWith(MockitoExtension.class)
class InboundWebhookProcessorTest {

    private static final String SECRET = "s3cret";

    @Mock
    private GatewayMetrics metrics;

    private EventBroker broker;
    private InboundWebhookProcessor processor;
    private final WebhookSigner signer = new WebhookSigner(SECRET);
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(1_700_000_000_000L);
        broker = new EventBroker(100, 16, 60_000, NoopGatewayMetrics.INSTANCE, clock);
        processor = new InboundWebhookProcessor(new WebhookVerifier(SECRET),
            new IdempotencyWindow(600_000, 1_000, clock), broker, "default", metrics);
    }

    @AfterEach
    void tearDown() {
        broker.close();
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testAcceptedEventAppended() {
        byte[] body = bytes("{\"instanceId\":\"sales\",\"order\":42}");

        InboundWebhookProcessor.Result result = processor.process(body, signer.sign(body), "key-1", null);

        assertFalse(result.duplicate());
        assertEquals("key-1", result.idempotencyKey());
        BrokerEvent event = result.event();
        assertEquals(EventType.WEBHOOK_INBOUND, event.type());
        assertEquals(EventDirection.INBOUND, event.direction());
        assertEquals("sales", event.instanceId(), "Session taken from the body");
        assertEquals(42, event.payload().get("body").get("order").asInt());
        assertEquals(1, broker.lastSequence());
        verify(metrics).recordInboundWebhook("accepted");
    }

    @Test
    void testDefaultInstance() {
        byte[] body = bytes("{\"order\":1}");

        BrokerEvent event = processor.process(body, signer.sign(body), null, null).event();

        assertEquals("default", event.instanceId());
    }

    @Test
    void testBadSignatureRejected() {
        byte[] body = bytes("{\"order\":1}");
        String forged = new WebhookSigner("wrong").sign(body);

        GatewayException e = assertThrows(GatewayException.class, () -> processor.process(body, forged, null, null));

        assertEquals(ErrorCode.INVALID_SIGNATURE, e.getErrorCode());
        assertEquals(0, broker.lastSequence(), "Nothing appended");
        verify(metrics).recordInboundWebhook("rejected");
    }

    @Test
    void testInvalidJsonRejected() {
        byte[] body = bytes("{not json");

        GatewayException e = assertThrows(GatewayException.class,
            () -> processor.process(body, signer.sign(body), null, null));

        assertEquals(ErrorCode.INVALID_JSON, e.getErrorCode());
    }

    @Test
    void testDuplicateByHeader() {
        byte[] first = bytes("{\"a\":1}");
        byte[] second = bytes("{\"a\":2}");

        processor.process(first, signer.sign(first), "same-key", null);
        InboundWebhookProcessor.Result result = processor.process(second, signer.sign(second), "same-key", null);

        assertTrue(result.duplicate());
        assertNull(result.event());
        assertEquals(1, broker.lastSequence(), "Duplicate not appended");
        verify(metrics).recordInboundWebhook("duplicate");
    }

    @Test
    void testDuplicateByBodyHash() {
        byte[] body = bytes("{\"a\":1}");

        processor.process(body, signer.sign(body), null, null);
        InboundWebhookProcessor.Result again = processor.process(body, signer.sign(body), null, null);

        assertTrue(again.duplicate(), "Identical body without keys is a duplicate");
        assertTrue(again.idempotencyKey().startsWith("sha256:"));
    }

    @Test
    void testKeyResolutionOrder() throws Exception {
        byte[] raw = bytes("{\"eventId\":\"body-evt\",\"id\":\"body-id\"}");

        assertEquals("hdr", InboundWebhookProcessor.resolveKey(" hdr ", "evt", mapper.readTree(raw), raw));
        assertEquals("evt", InboundWebhookProcessor.resolveKey(null, "evt", mapper.readTree(raw), raw));
        assertEquals("body-evt", InboundWebhookProcessor.resolveKey(null, " ", mapper.readTree(raw), raw));
        assertEquals("body-id", InboundWebhookProcessor.resolveKey(null, null, mapper.readTree("{\"id\":\"body-id\"}"), raw));
        assertEquals("sha256:" + "44136fa355b3678a1146ad16f7e8649e94fb4fc21fe77e8310c060f61caaff8a",
            InboundWebhookProcessor.resolveKey(null, null, mapper.readTree("{}"), bytes("{}")));
    }
}
