package in.sessiongate.transport.http;

import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.domain.common.GatewayException;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;

/**
 * Translates exceptions escaping the API handlers into {@code {"error", "message"}} responses.
 */
public final class ErrorMappingHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(ErrorMappingHandler.class);

    private final HttpHandler next;

    public ErrorMappingHandler(HttpHandler next) {
        this.next = next;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        try {
            next.handleRequest(exchange);
        } catch (GatewayException e) {
            if (e.getHttpStatus() >= 500) {
                log.warn("[HTTP] {} {} -> {} {}", exchange.getRequestMethod(), exchange.getRequestPath(),
                    e.getErrorCode().code(), e.getMessage());
            }
            respond(exchange, e.getErrorCode(), e.getMessage());
        } catch (UncheckedIOException e) {
            log.error("[HTTP] {} {} persistence failure: {}", exchange.getRequestMethod(), exchange.getRequestPath(),
                e.getMessage(), e);
            respond(exchange, ErrorCode.PERSISTENCE_FAILED, e.getMessage());
        } catch (Exception e) {
            log.error("[HTTP] {} {} failed: {}", exchange.getRequestMethod(), exchange.getRequestPath(),
                e.getMessage(), e);
            respond(exchange, ErrorCode.INTERNAL_ERROR, "Internal error");
        }
    }

    private static void respond(HttpServerExchange exchange, ErrorCode code, String message) {
        if (exchange.isResponseStarted()) {
            log.warn("[HTTP] Response already started, cannot report {}", code.code());
            exchange.endExchange();
            return;
        }
        HttpJson.sendError(exchange, code, message);
    }
}
