package in.sessiongate.webhook;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;

/**
 * Verifies inbound {@code X-Signature-256} headers by recomputing the HMAC over the raw body.
 * Without a secret verification is skipped.
 */
public final class WebhookVerifier {

    private final WebhookSigner signer;

    /**
     * @param secret shared secret, null or empty to skip verification
     */
    public WebhookVerifier(String secret) {
        this.signer = secret == null || secret.isEmpty() ? null : new WebhookSigner(secret);
    }

    public boolean isEnabled() {
        return signer != null;
    }

    /**
     * @return true when the header matches, or when no secret is configured
     */
    public boolean verify(byte[] rawBody, String header) {
        if (signer == null) {
            return true;
        }
        if (header == null) {
            return false;
        }
        String presented = header.trim().toLowerCase(Locale.ROOT);
        if (!presented.startsWith(WebhookSigner.PREFIX)
                || presented.length() != WebhookSigner.PREFIX.length() + 64) {
            return false;
        }
        String expected = signer.sign(rawBody);
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.US_ASCII),
            presented.getBytes(StandardCharsets.US_ASCII));
    }
}
