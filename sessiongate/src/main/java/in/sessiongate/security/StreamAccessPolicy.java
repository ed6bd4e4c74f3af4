package in.sessiongate.security;

/**
 * Stream endpoints accept either a short-lived stream token or an API key.
 */
public final class StreamAccessPolicy {

    private final ApiKeyVerifier apiKeys;
    private final StreamTokenService tokens;

    public StreamAccessPolicy(ApiKeyVerifier apiKeys, StreamTokenService tokens) {
        this.apiKeys = apiKeys;
        this.tokens = tokens;
    }

    public boolean allows(String token, String apiKey) {
        if (!apiKeys.isEnabled()) {
            return true;
        }
        if (token != null && tokens.isValid(token)) {
            return true;
        }
        return apiKey != null && apiKeys.isAuthorized(apiKey);
    }
}
