package in.sessiongate.transport.http;

import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.security.ApiKeyVerifier;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HttpString;

import java.util.Set;

/**
 * Requires a valid {@code x-api-key} header except on open paths.
 */
public final class ApiKeyAuthHandler implements HttpHandler {

    public static final HttpString API_KEY_HEADER = HttpString.tryFromString("x-api-key");

    private final ApiKeyVerifier verifier;
    private final Set<String> openPaths;
    private final HttpHandler next;

    public ApiKeyAuthHandler(ApiKeyVerifier verifier, Set<String> openPaths, HttpHandler next) {
        this.verifier = verifier;
        this.openPaths = Set.copyOf(openPaths);
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        if (openPaths.contains(exchange.getRequestPath())
                || verifier.isAuthorized(exchange.getRequestHeaders().getFirst(API_KEY_HEADER))) {
            next.handleRequest(exchange);
            return;
        }
        HttpJson.sendError(exchange, ErrorCode.UNAUTHORIZED, "Missing or invalid API key");
    }
}
