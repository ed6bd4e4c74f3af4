package in.sessiongate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Constant-time check of a presented {@code x-api-key} against the configured keys.
 * With no keys configured every request is accepted.
 */
public final class ApiKeyVerifier {
    private static final Logger log = LoggerFactory.getLogger(ApiKeyVerifier.class);

    private final List<byte[]> keys;

    public ApiKeyVerifier(List<String> apiKeys) {
        this.keys = apiKeys.stream()
            .map(k -> k.getBytes(StandardCharsets.UTF_8))
            .toList();
        if (keys.isEmpty()) {
            log.warn("[AUTH] API_KEY is empty: control plane is UNAUTHENTICATED");
        }
    }

    public boolean isEnabled() {
        return !keys.isEmpty();
    }

    public boolean isAuthorized(String presented) {
        if (keys.isEmpty()) {
            return true;
        }
        if (presented == null || presented.isEmpty()) {
            return false;
        }
        byte[] candidate = presented.getBytes(StandardCharsets.UTF_8);
        boolean match = false;
        for (byte[] key : keys) {
            // no early exit
            match |= MessageDigest.isEqual(key, candidate);
        }
        return match;
    }
}
