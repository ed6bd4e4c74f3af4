package in.sessiongate.webhook;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WebhookSigner and WebhookVerifier.
 *
 * Tests:
 * - Known HMAC-SHA256 vector
 * - Verification of matching, tampered and malformed signatures
 * - Verification skipped without a secret
 */
class WebhookSignerTest {

    private static final byte[] BODY = "The quick brown fox jumps over the lazy dog".getBytes(StandardCharsets.UTF_8);
    private static final String EXPECTED = "sha256=f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8";

    @Test
    void testKnownVector() {
        assertEquals(EXPECTED, new WebhookSigner("key").sign(BODY));
    }

    @Test
    void testEmptySecretRejected() {
        assertThrows(IllegalArgumentException.class, () -> new WebhookSigner(""));
        assertThrows(IllegalArgumentException.class, () -> new WebhookSigner(null));
    }

    @Test
    void testVerifyMatching() {
        WebhookVerifier verifier = new WebhookVerifier("key");

        assertTrue(verifier.isEnabled());
        assertTrue(verifier.verify(BODY, EXPECTED));
        assertTrue(verifier.verify(BODY, "  " + EXPECTED.toUpperCase() + " "), "Case and padding are tolerated");
    }

    @Test
    void testVerifyRejectsMismatch() {
        WebhookVerifier verifier = new WebhookVerifier("key");
        byte[] tampered = "The quick brown fox jumps over the lazy cat".getBytes(StandardCharsets.UTF_8);

        assertFalse(verifier.verify(tampered, EXPECTED), "Tampered body");
        assertFalse(verifier.verify(BODY, null), "Missing header");
        assertFalse(verifier.verify(BODY, EXPECTED.substring(7)), "Missing prefix");
        assertFalse(verifier.verify(BODY, EXPECTED.substring(0, EXPECTED.length() - 2)), "Truncated digest");
        assertFalse(new WebhookVerifier("other").verify(BODY, EXPECTED), "Wrong secret");
    }

    @Test
    void testVerifySkippedWithoutSecret() {
        WebhookVerifier verifier = new WebhookVerifier("");

        assertFalse(verifier.isEnabled());
        assertTrue(verifier.verify(BODY, null));
    }
}
