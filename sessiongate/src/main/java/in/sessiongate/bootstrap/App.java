package in.sessiongate.bootstrap;

import in.sessiongate.config.GatewayConfig;
import in.sessiongate.socket.relay.RelaySocketFactory;
import io.prometheus.client.CollectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {}

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== SessionGate Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        GatewayConfig config = GatewayConfig.fromEnv();
        if (!config.authEnabled()) {
            log.warn("[GATEWAY] API_KEY is empty: every route is open");
        }

        Gateway gateway = new Gateway(config,
            new RelaySocketFactory(config.socketRelayUrl(), config.socketRelayToken()),
            CollectorRegistry.defaultRegistry,
            Clock.systemUTC());

        Runtime.getRuntime().addShutdownHook(new Thread(gateway::stop, "shutdown"));
        gateway.start();
    }
}
