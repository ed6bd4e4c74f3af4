package in.sessiongate.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.sessiongate.broker.EventBroker;
import in.sessiongate.domain.common.ErrorCode;
import in.sessiongate.domain.common.GatewayException;
import in.sessiongate.domain.event.BrokerEvent;
import in.sessiongate.domain.event.EventDirection;
import in.sessiongate.domain.event.EventType;
import in.sessiongate.domain.message.OutboundMessage;
import in.sessiongate.domain.message.SentMessage;
import in.sessiongate.domain.session.SessionIndexEntry;
import in.sessiongate.domain.session.SessionMetadata;
import in.sessiongate.metrics.GatewayMetrics;
import in.sessiongate.security.InputValidator;
import in.sessiongate.socket.SessionSocketFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Owns every session and the durable index.
 *
 * Every mutation persists the index before reporting success; a failed write
 * rolls the in-memory change back and surfaces persistence_failed.
 *
 * Usage:
 * <pre>
 * SessionRegistry registry = new SessionRegistry(baseDir, socketFactory, broker, scheduler,
 *     SessionSettings.defaults(), metrics, Clock.systemUTC());
 * registry.loadAndStartAll();
 * Session session = registry.create("Sales", "main line");
 * </pre>
 */
public class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULT_SESSION_ID = "default";

    private static final DateTimeFormatter BACKUP_STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final Path baseDir;
    private final SessionIndexStore store;
    private final SessionSocketFactory socketFactory;
    private final EventBroker broker;
    private final ScheduledExecutorService scheduler;
    private final SessionSettings settings;
    private final GatewayMetrics metrics;
    private final Clock clock;

    private final LinkedHashMap<String, Session> sessions = new LinkedHashMap<>();

    public SessionRegistry(Path baseDir, SessionSocketFactory socketFactory, EventBroker broker,
                           ScheduledExecutorService scheduler, SessionSettings settings,
                           GatewayMetrics metrics, Clock clock) {
        this.baseDir = baseDir;
        this.store = new SessionIndexStore(baseDir);
        this.socketFactory = socketFactory;
        this.broker = broker;
        this.scheduler = scheduler;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // STARTUP
    // ═══════════════════════════════════════════════════════════════

    /**
     * Reload the index and start every session. One failing session does not stop the others.
     * An empty index gets a {@value #DEFAULT_SESSION_ID} session.
     *
     * @return number of sessions started
     */
    public int loadAndStartAll() {
        List<Session> loaded = new ArrayList<>();
        synchronized (this) {
            List<SessionIndexEntry> entries = store.load();
            for (SessionIndexEntry entry : entries) {
                if (entry.id() == null || sessions.containsKey(entry.id())) {
                    log.warn("[REGISTRY] Skipping invalid or duplicate index entry: {}", entry.id());
                    continue;
                }
                Session session = newSession(entry);
                sessions.put(entry.id(), session);
                loaded.add(session);
            }
            if (sessions.isEmpty()) {
                Session session = newSession(newEntry(DEFAULT_SESSION_ID, DEFAULT_SESSION_ID, ""));
                sessions.put(DEFAULT_SESSION_ID, session);
                persistOrRollback(() -> sessions.remove(DEFAULT_SESSION_ID));
                loaded.add(session);
            }
            metrics.setSessionCount(sessions.size());
        }

        int started = 0;
        for (Session session : loaded) {
            try {
                session.start();
                started++;
            } catch (RuntimeException e) {
                log.error("[REGISTRY] Failed to start session {}: {}", session.getId(), e.getMessage(), e);
            }
        }
        log.info("[REGISTRY] Started {}/{} sessions", started, loaded.size());
        return started;
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Register and start a session. The id is the slug of the name, or a random id when unnamed.
     *
     * @throws GatewayException instance_exists, name_empty, name_invalid, persistence_failed
     */
    public Session create(String name, String note) {
        String displayName = name == null ? null : InputValidator.sessionName(name);
        String id = displayName == null ? null : InputValidator.slug(displayName);
        Session session;
        synchronized (this) {
            if (id == null) {
                id = UUID.randomUUID().toString();
            }
            if (sessions.containsKey(id)) {
                throw new GatewayException(ErrorCode.INSTANCE_EXISTS, "session already exists: " + id);
            }
            String sessionId = id;
            session = newSession(newEntry(id, displayName == null ? id : displayName, InputValidator.note(note)));
            sessions.put(id, session);
            persistOrRollback(() -> sessions.remove(sessionId));
            metrics.setSessionCount(sessions.size());
        }

        appendLifecycle(EventType.SESSION_CREATED, session, null);
        log.info("[REGISTRY] Created session {} ({})", session.getId(), session.getName());
        startQuietly(session);
        return session;
    }

    /**
     * Session with the given id, created (named after the id) when absent.
     */
    public Session getOrCreate(String id) {
        synchronized (this) {
            Session existing = sessions.get(id);
            if (existing != null) {
                return existing;
            }
        }
        try {
            return create(id, null);
        } catch (GatewayException e) {
            if (e.getErrorCode() == ErrorCode.INSTANCE_EXISTS) {
                return get(id);
            }
            throw e;
        }
    }

    /**
     * Re-open a registered session from its stored credentials.
     */
    public Session start(String id) {
        Session session = get(id);
        session.start();
        return session;
    }

    /**
     * Stop and unregister a session.
     *
     * @param removeCredentials erase the credential directory
     * @param forceLogout       log the account out first (best effort)
     * @throws GatewayException instance_not_found, default_instance_protected, persistence_failed
     */
    public void delete(String id, boolean removeCredentials, boolean forceLogout) {
        if (DEFAULT_SESSION_ID.equals(id)) {
            throw new GatewayException(ErrorCode.DEFAULT_INSTANCE_PROTECTED, "the default session cannot be deleted");
        }
        Session session = get(id);

        if (forceLogout) {
            try {
                session.logout().get(settings.sendTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.warn("[REGISTRY] {} logout timed out during delete", id);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[REGISTRY] {} logout interrupted during delete", id);
            } catch (Exception e) {
                log.warn("[REGISTRY] {} logout failed during delete: {}", id, e.toString());
            }
        }

        synchronized (this) {
            if (sessions.remove(id) == null) {
                throw new GatewayException(ErrorCode.INSTANCE_NOT_FOUND, "session not found: " + id);
            }
            persistOrRollback(() -> sessions.put(id, session));
            metrics.setSessionCount(sessions.size());
        }

        session.shutdown();
        if (removeCredentials) {
            try {
                deleteRecursively(session.getDir());
            } catch (UncheckedIOException e) {
                log.error("[REGISTRY] {} credentials not removed: {}", id, e.getMessage(), e);
            }
        }
        appendLifecycle(EventType.SESSION_DELETED, session, payload -> {
            payload.put("removeCredentials", removeCredentials);
            payload.put("forceLogout", forceLogout);
        });
        log.info("[REGISTRY] Deleted session {} (removeCredentials={}, forceLogout={})", id, removeCredentials, forceLogout);
    }

    /**
     * Update the display name and/or note.
     *
     * @throws GatewayException no_updates, name_empty, name_invalid, instance_not_found, persistence_failed
     */
    public Session patch(String id, String name, String note) {
        if (name == null && note == null) {
            throw new GatewayException(ErrorCode.NO_UPDATES, "nothing to update");
        }
        String newName = name == null ? null : InputValidator.sessionName(name);
        String newNote = note == null ? null : InputValidator.note(note);

        Session session;
        synchronized (this) {
            session = get(id);
            String previousName = session.getName();
            SessionMetadata previousMetadata = session.getMetadata();
            Instant now = clock.instant();

            if (newName != null) {
                session.setName(newName);
            }
            session.setMetadata(newNote != null
                ? previousMetadata.withNote(newNote, now)
                : previousMetadata.touched(now));

            persistOrRollback(() -> {
                session.setName(previousName);
                session.setMetadata(previousMetadata);
            });
        }
        appendLifecycle(EventType.SESSION_UPDATED, session, null);
        return session;
    }

    public void reconnect(String id) {
        get(id).reconnect();
    }

    /**
     * Log the account out. Blocks up to the send timeout.
     */
    public void logout(String id) {
        Session session = get(id);
        try {
            session.logout().get(settings.sendTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new GatewayException(ErrorCode.SEND_TIMEOUT, "logout timeout");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(ErrorCode.SOCKET_UNAVAILABLE, "interrupted");
        } catch (Exception e) {
            throw new GatewayException(ErrorCode.SEND_FAILED, "logout failed: " + e.getMessage(), e);
        }
    }

    /**
     * Stop, move credentials to {@code <dir>.bak-<stamp>}, restart with a fresh pairing cycle.
     *
     * @return backup directory, null when there were no credentials
     */
    public Path reset(String id) {
        Session session = get(id);
        session.stop();
        Path backup = null;
        Path dir = session.getDir();
        try {
            if (Files.exists(dir)) {
                backup = dir.resolveSibling(dir.getFileName() + ".bak-" + BACKUP_STAMP.format(clock.instant()));
                Files.move(dir, backup);
            }
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new GatewayException(ErrorCode.PERSISTENCE_FAILED, "credential backup failed: " + e.getMessage(), e);
        } finally {
            session.start();
        }
        Path backupDir = backup;
        appendLifecycle(EventType.SESSION_RESET, session, payload -> {
            payload.put("mode", "reset");
            if (backupDir != null) {
                payload.put("backup", backupDir.toString());
            }
        });
        log.info("[REGISTRY] Reset session {} (backup {})", id, backup);
        return backup;
    }

    /**
     * Stop, erase credentials, restart with a fresh pairing cycle.
     */
    public void wipe(String id) {
        Session session = get(id);
        session.stop();
        try {
            deleteRecursively(session.getDir());
            Files.createDirectories(session.getDir());
        } catch (IOException | UncheckedIOException e) {
            throw new GatewayException(ErrorCode.PERSISTENCE_FAILED, "credential wipe failed: " + e.getMessage(), e);
        } finally {
            session.start();
        }
        appendLifecycle(EventType.SESSION_RESET, session, payload -> payload.put("mode", "wipe"));
        log.info("[REGISTRY] Wiped session {}", id);
    }

    /**
     * Request a pairing code and remember the phone number in the index.
     */
    public String pairingCode(String id, String phoneNumber) {
        Session session = get(id);
        String code = session.requestPairingCode(phoneNumber);
        synchronized (this) {
            try {
                persist();
            } catch (GatewayException e) {
                log.warn("[REGISTRY] {} phone number not persisted: {}", id, e.getMessage());
            }
        }
        return code;
    }

    public SentMessage send(String id, String to, OutboundMessage message, long waitAckMs) {
        return get(id).send(to, message, waitAckMs);
    }

    // ═══════════════════════════════════════════════════════════════
    // LOOKUP
    // ═══════════════════════════════════════════════════════════════

    /**
     * @throws GatewayException instance_not_found
     */
    public synchronized Session get(String id) {
        Session session = id == null ? null : sessions.get(id);
        if (session == null) {
            throw new GatewayException(ErrorCode.INSTANCE_NOT_FOUND, "session not found: " + id);
        }
        return session;
    }

    public synchronized Optional<Session> find(String id) {
        return Optional.ofNullable(id == null ? null : sessions.get(id));
    }

    public synchronized List<Session> list() {
        return new ArrayList<>(sessions.values());
    }

    public synchronized int size() {
        return sessions.size();
    }

    /**
     * Stop every session (process shutdown). The index is left as is.
     */
    public void stopAll() {
        List<Session> all = list();
        for (Session session : all) {
            try {
                session.shutdown();
            } catch (RuntimeException e) {
                log.warn("[REGISTRY] Failed to stop session {}: {}", session.getId(), e.toString());
            }
        }
        log.info("[REGISTRY] Stopped {} sessions", all.size());
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNALS
    // ═══════════════════════════════════════════════════════════════

    private Session newSession(SessionIndexEntry entry) {
        return new Session(entry, settings, socketFactory, scheduler, broker, metrics, clock);
    }

    private SessionIndexEntry newEntry(String id, String name, String note) {
        Path dir = baseDir.resolve(id);
        return new SessionIndexEntry(id, name, dir.toString(), null, SessionMetadata.created(note, clock.instant()));
    }

    // Caller holds the monitor.
    private void persist() {
        List<SessionIndexEntry> entries = sessions.values().stream().map(Session::toEntry).toList();
        try {
            store.save(entries);
        } catch (UncheckedIOException e) {
            log.error("[REGISTRY] Index write failed: {}", e.getMessage(), e);
            throw new GatewayException(ErrorCode.PERSISTENCE_FAILED, "failed to persist session index", e);
        }
    }

    // Caller holds the monitor.
    private void persistOrRollback(Runnable rollback) {
        try {
            persist();
        } catch (GatewayException e) {
            rollback.run();
            throw e;
        }
    }

    private void startQuietly(Session session) {
        try {
            session.start();
        } catch (RuntimeException e) {
            log.error("[REGISTRY] Failed to start session {}: {}", session.getId(), e.getMessage(), e);
        }
    }

    private void appendLifecycle(EventType type, Session session, Consumer<ObjectNode> extra) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("id", session.getId());
        payload.put("name", session.getName());
        if (extra != null) {
            extra.accept(payload);
        }
        broker.append(BrokerEvent.draft(type, session.getId(), EventDirection.SYSTEM, payload));
    }

    private static void deleteRecursively(Path dir) {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + dir, e);
        }
    }
}
