package in.sessiongate.bootstrap;

import in.sessiongate.broker.EventBroker;
import in.sessiongate.config.GatewayConfig;
import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.metrics.PrometheusGatewayMetrics;
import in.sessiongate.metrics.PrometheusMetricsHandler;
import in.sessiongate.security.ApiKeyVerifier;
import in.sessiongate.security.StreamAccessPolicy;
import in.sessiongate.security.StreamTokenService;
import in.sessiongate.session.SessionRegistry;
import in.sessiongate.socket.SessionSocketFactory;
import in.sessiongate.transport.http.ApiKeyAuthHandler;
import in.sessiongate.transport.http.BrokerHandlers;
import in.sessiongate.transport.http.ErrorMappingHandler;
import in.sessiongate.transport.http.HttpJson;
import in.sessiongate.transport.http.InboundWebhookHandler;
import in.sessiongate.transport.http.QrImageRenderer;
import in.sessiongate.transport.http.SessionHandlers;
import in.sessiongate.transport.http.SseStreamHandler;
import in.sessiongate.transport.ws.EventStreamHub;
import in.sessiongate.webhook.IdempotencyWindow;
import in.sessiongate.webhook.InboundWebhookProcessor;
import in.sessiongate.webhook.WebhookDispatcher;
import in.sessiongate.webhook.WebhookVerifier;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires every component of the gateway and owns their lifecycle.
 */
public final class Gateway {
    private static final Logger log = LoggerFactory.getLogger(Gateway.class);

    static final Set<String> OPEN_PATHS = Set.of("/health", "/metrics", "/webhooks/inbound");

    private final GatewayConfig config;
    private final Clock clock;
    private final CollectorRegistry collectorRegistry;
    private final PrometheusGatewayMetrics metrics;
    private final ScheduledExecutorService scheduler;
    private final EventBroker broker;
    private final SessionRegistry registry;
    private final StreamTokenService tokens;
    private final WebhookDispatcher webhookDispatcher;
    private final Undertow server;

    public Gateway(GatewayConfig config, SessionSocketFactory socketFactory, CollectorRegistry collectorRegistry,
                   Clock clock) {
        this.config = config;
        this.clock = clock;
        this.collectorRegistry = collectorRegistry;

        // ═══════════════════════════════════════════════════════════════
        // Core
        // ═══════════════════════════════════════════════════════════════
        this.metrics = new PrometheusGatewayMetrics(collectorRegistry);
        this.scheduler = Executors.newScheduledThreadPool(
            Math.max(2, Runtime.getRuntime().availableProcessors()), daemonThreads("session-timer"));
        this.broker = new EventBroker(config.eventBacklog(), config.streamQueueCapacity(),
            config.streamKeepaliveMs(), metrics, clock);
        this.registry = new SessionRegistry(config.sessionDir(), socketFactory, broker, scheduler,
            config.sessionSettings(), metrics, clock);
        this.tokens = new StreamTokenService(config.streamTokenTtlMs(), clock);

        // ═══════════════════════════════════════════════════════════════
        // Webhooks
        // ═══════════════════════════════════════════════════════════════
        this.webhookDispatcher = config.webhookEnabled() ? WebhookDispatcher.builder(broker)
            .url(config.webhookUrl())
            .apiKey(config.webhookApiKey())
            .secret(config.webhookSecret())
            .maxAttempts(config.webhookMaxAttempts())
            .backoffStepMs(config.webhookBackoffMs())
            .timeoutMs(config.webhookTimeoutMs())
            .events(config.webhookEvents())
            .metrics(metrics)
            .clock(clock)
            .build() : null;
        if (webhookDispatcher != null) {
            broker.addListener(webhookDispatcher);
        } else {
            log.info("[WEBHOOK] WEBHOOK_URL not set, outbound webhooks disabled");
        }
        InboundWebhookProcessor inbound = new InboundWebhookProcessor(
            new WebhookVerifier(config.webhookSecret()),
            new IdempotencyWindow(config.webhookDedupeTtlMs(), config.webhookDedupeMax(), clock),
            broker, config.brokerInstanceId(), metrics);

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        ApiKeyVerifier apiKeys = new ApiKeyVerifier(config.apiKeys());
        StreamAccessPolicy streamAccess = new StreamAccessPolicy(apiKeys, tokens);
        this.server = Undertow.builder()
            .addHttpListener(config.port(), config.host())
            .setHandler(cors(routes(apiKeys, streamAccess, inbound)))
            .build();
    }

    private HttpHandler routes(ApiKeyVerifier apiKeys, StreamAccessPolicy streamAccess,
                               InboundWebhookProcessor inbound) {
        SessionHandlers sessions = new SessionHandlers(registry, broker, tokens, new QrImageRenderer());
        BrokerHandlers brokerApi = new BrokerHandlers(registry, broker, config.brokerInstanceId(),
            config.serviceName(), clock);
        InboundWebhookHandler webhooks = new InboundWebhookHandler(inbound);

        RoutingHandler api = Handlers.routing()
            .get("/health", brokerApi::health)
            .get("/metrics", new PrometheusMetricsHandler(collectorRegistry))
            .post("/webhooks/inbound", webhooks::handle)
            .post("/instances/stream-token", sessions::streamToken)
            .post("/instances", sessions::create)
            .get("/instances", sessions::list)
            .get("/instances/{iid}", sessions::get)
            .add(Methods.PATCH, "/instances/{iid}", sessions::patch)
            .delete("/instances/{iid}", sessions::delete)
            .get("/instances/{iid}/qr.png", sessions::qrPng)
            .get("/instances/{iid}/qr", sessions::qrJson)
            .post("/instances/{iid}/pair", sessions::pair)
            .post("/instances/{iid}/reconnect", sessions::reconnect)
            .post("/instances/{iid}/logout", sessions::logout)
            .post("/instances/{iid}/session/reset", sessions::reset)
            .post("/instances/{iid}/session/wipe", sessions::wipe)
            .get("/instances/{iid}/status", sessions::status)
            .get("/instances/{iid}/events", sessions::events)
            .post("/instances/{iid}/events/ack", sessions::ackEvents)
            .get("/instances/{iid}/metrics", sessions::metrics)
            .post("/instances/{iid}/exists", sessions::exists)
            .post("/instances/{iid}/send-text", sessions::sendText)
            .post("/instances/{iid}/send-media", sessions::sendMedia)
            .post("/instances/{iid}/send-buttons", sessions::sendButtons)
            .post("/instances/{iid}/send-list", sessions::sendList)
            .post("/instances/{iid}/send-poll", sessions::sendPoll)
            .get("/events", brokerApi::events)
            .get("/events/stats", brokerApi::stats)
            .post("/events/ack", brokerApi::ack)
            .post("/messages", brokerApi::sendMessage)
            .post("/session/connect", brokerApi::connect)
            .post("/session/logout", brokerApi::logout)
            .get("/session/status", brokerApi::status)
            .setFallbackHandler(exchange -> HttpJson.sendError(exchange, ErrorCode.ROUTE_NOT_FOUND,
                "No route for " + exchange.getRequestMethod() + " " + exchange.getRequestPath()));

        // Streams stay on the IO thread; everything else may block on sends and acks
        HttpHandler blockingApi = new BlockingHandler(
            new ErrorMappingHandler(new ApiKeyAuthHandler(apiKeys, OPEN_PATHS, api)));

        EventStreamHub hub = new EventStreamHub(broker, streamAccess);
        return Handlers.routing()
            .get("/stream", new SseStreamHandler(broker, streamAccess))
            .get("/ws", hub.websocketHandler())
            .setFallbackHandler(blockingApi);
    }

    private static HttpHandler cors(HttpHandler next) {
        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, PATCH, DELETE, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"),
                    "Content-Type, x-api-key, Last-Event-ID, X-Signature-256, X-Idempotency-Key, X-Event-Id")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().equals(Methods.OPTIONS)) {
                exchange.setStatusCode(204);
                exchange.endExchange();
            } else {
                next.handleRequest(exchange);
            }
        };
    }

    public void start() {
        broker.start();
        tokens.start(scheduler);
        int started = registry.loadAndStartAll();
        server.start();
        log.info("[GATEWAY] {} listening on http://{}:{}/ ({} sessions, auth {})",
            config.serviceName(), config.host(), config.port(), started,
            config.authEnabled() ? "enabled" : "DISABLED");
    }

    /**
     * Stop accepting requests, stop every session, flush nothing further.
     */
    public void stop() {
        log.info("[GATEWAY] Shutting down");
        server.stop();
        registry.stopAll();
        if (webhookDispatcher != null) {
            webhookDispatcher.shutdown();
        }
        tokens.stop();
        broker.close();
        scheduler.shutdownNow();
        log.info("[GATEWAY] Stopped");
    }

    public SessionRegistry getRegistry() {
        return registry;
    }

    public EventBroker getBroker() {
        return broker;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
