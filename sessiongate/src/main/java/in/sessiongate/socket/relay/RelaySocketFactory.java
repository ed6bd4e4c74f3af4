package in.sessiongate.socket.relay;

import in.sessiongate.socket.SessionSocket;
import in.sessiongate.socket.SessionSocketFactory;
import in.sessiongate.socket.SessionSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Opens relay sockets at {@code <relayUrl>/<sessionId>?token=<token>}.
 */
public final class RelaySocketFactory implements SessionSocketFactory {
    private static final Logger log = LoggerFactory.getLogger(RelaySocketFactory.class);

    private final String relayUrl;
    private final String token;
    private final HttpClient httpClient;

    public RelaySocketFactory(String relayUrl, String token) {
        if (relayUrl == null || relayUrl.isBlank()) {
            throw new IllegalArgumentException("Relay URL must not be empty");
        }
        this.relayUrl = relayUrl.endsWith("/") ? relayUrl.substring(0, relayUrl.length() - 1) : relayUrl;
        this.token = token;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        log.info("[RELAY] Socket factory targeting {}", this.relayUrl);
    }

    @Override
    public SessionSocket create(String sessionId, Path credentialsDir, SessionSocketListener listener) {
        return new RelaySessionSocket(sessionId, credentialsDir.toAbsolutePath().toString(),
            uriFor(sessionId), httpClient, listener);
    }

    URI uriFor(String sessionId) {
        StringBuilder url = new StringBuilder(relayUrl)
            .append('/')
            .append(URLEncoder.encode(sessionId, StandardCharsets.UTF_8).replace("+", "%20"));
        if (token != null && !token.isBlank()) {
            url.append("?token=").append(URLEncoder.encode(token, StandardCharsets.UTF_8));
        }
        return URI.create(url.toString());
    }
}
