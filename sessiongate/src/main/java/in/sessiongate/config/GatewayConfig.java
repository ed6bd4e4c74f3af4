package in.sessiongate.config;

import in.sessiongate.domain.event.EventType;
import in.sessiongate.session.SessionSettings;
import in.sessiongate.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Process configuration resolved once at startup from the environment.
 */
public record GatewayConfig(
    // Server
    String host,
    int port,
    String serviceName,
    List<String> apiKeys,

    // Sessions
    Path sessionDir,
    String brokerInstanceId,
    SessionSettings sessionSettings,

    // Broker / streaming
    int eventBacklog,
    long streamKeepaliveMs,
    int streamQueueCapacity,
    long streamTokenTtlMs,

    // Webhooks
    String webhookUrl,
    String webhookApiKey,
    String webhookSecret,
    int webhookMaxAttempts,
    long webhookBackoffMs,
    long webhookTimeoutMs,
    Set<EventType> webhookEvents,
    long webhookDedupeTtlMs,
    int webhookDedupeMax,

    // Socket relay
    String socketRelayUrl,
    String socketRelayToken
) {
    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    public static final String DEFAULT_WEBHOOK_EVENTS = "MESSAGE_INBOUND,MESSAGE_OUTBOUND,MESSAGE_STATUS";
    public static final long MIN_STREAM_TOKEN_TTL_MS = 30_000;

    public static GatewayConfig fromEnv() {
        List<String> apiKeys = Env.getList("API_KEY", "");

        SessionSettings settings = SessionSettings.builder()
            .rateLimit(Env.getInt("RATE_MAX_SENDS", 20), Env.getPositiveLong("RATE_WINDOW_MS", 15_000))
            .sendTimeoutMs(Env.getPositiveLong("SEND_TIMEOUT_MS", 25_000))
            .sendQueueCapacity(Env.getInt("SEND_QUEUE_CAPACITY", 64))
            .statusTtlMs(Env.getPositiveLong("STATUS_TTL_MS", 600_000))
            .statusSweepIntervalMs(Env.getPositiveLong("STATUS_SWEEP_INTERVAL_MS", 60_000))
            .reconnect(Env.getPositiveLong("RECONNECT_MIN_MS", 1_000), Env.getPositiveLong("RECONNECT_MAX_MS", 30_000))
            .qrTtl(Env.getPositiveLong("QR_TTL_FIRST_MS", 60_000), Env.getPositiveLong("QR_TTL_NEXT_MS", 20_000))
            .build();

        String secret = Env.get("WEBHOOK_HMAC_SECRET", apiKeys.isEmpty() ? null : apiKeys.get(0));

        return new GatewayConfig(
            Env.get("HOST", "0.0.0.0"),
            Env.getInt("PORT", 3000),
            Env.get("SERVICE_NAME", "sessiongate"),
            apiKeys,
            Path.of(Env.get("SESSION_DIR", "./sessions")),
            Env.get("BROKER_INSTANCE_ID", "broker"),
            settings,
            Math.max(1, Env.getInt("EVENT_BACKLOG", 200)),
            Env.getPositiveLong("STREAM_KEEPALIVE_MS", 15_000),
            Math.max(1, Env.getInt("STREAM_QUEUE_CAPACITY", 512)),
            Math.max(MIN_STREAM_TOKEN_TTL_MS, Env.getPositiveLong("STREAM_TOKEN_TTL_MS", 900_000)),
            Env.get("WEBHOOK_URL", null),
            Env.get("WEBHOOK_API_KEY", null),
            secret,
            Math.max(1, Env.getInt("WEBHOOK_MAX_ATTEMPTS", 5)),
            Env.getPositiveLong("WEBHOOK_BACKOFF_MS", 2_000),
            Env.getPositiveLong("WEBHOOK_TIMEOUT_MS", 5_000),
            parseEventTypes(Env.getList("WEBHOOK_EVENTS", DEFAULT_WEBHOOK_EVENTS)),
            Env.getPositiveLong("WEBHOOK_DEDUPE_TTL_MS", 7_200_000),
            Math.max(1, Env.getInt("WEBHOOK_DEDUPE_MAX", 5_000)),
            Env.get("SOCKET_RELAY_URL", "ws://localhost:7081/sessions"),
            Env.get("SOCKET_RELAY_TOKEN", null)
        );
    }

    public boolean authEnabled() {
        return !apiKeys.isEmpty();
    }

    public boolean webhookEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    static Set<EventType> parseEventTypes(List<String> names) {
        Set<EventType> types = EnumSet.noneOf(EventType.class);
        for (String name : names) {
            try {
                types.add(EventType.valueOf(name.trim().toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("[CONFIG] Ignoring unknown webhook event type: {}", name);
            }
        }
        return types;
    }
}
