package in.sessiongate.session;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.sessiongate.domain.session.SessionIndexEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Durable session index ({@code instances.json}).
 * Writes go to a temp file that atomically replaces the index.
 */
public class SessionIndexStore {
    private static final Logger log = LoggerFactory.getLogger(SessionIndexStore.class);

    public static final String INDEX_FILE = "instances.json";

    private static final TypeReference<List<SessionIndexEntry>> ENTRIES = new TypeReference<>() {};

    private final Path indexFile;
    private final ObjectMapper mapper;

    public SessionIndexStore(Path baseDir) {
        this.indexFile = baseDir.resolve(INDEX_FILE);
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return persisted entries, empty when the index does not exist yet
     */
    public synchronized List<SessionIndexEntry> load() {
        if (!Files.exists(indexFile)) {
            return List.of();
        }
        try {
            List<SessionIndexEntry> entries = mapper.readValue(indexFile.toFile(), ENTRIES);
            log.info("[INDEX] Loaded {} sessions from {}", entries.size(), indexFile);
            return entries;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + indexFile, e);
        }
    }

    public synchronized void save(List<SessionIndexEntry> entries) {
        Path tmp = indexFile.resolveSibling(INDEX_FILE + ".tmp");
        try {
            Files.createDirectories(indexFile.getParent());
            mapper.writeValue(tmp.toFile(), entries);
            try {
                Files.move(tmp, indexFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, indexFile, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("[INDEX] Saved {} sessions", entries.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + indexFile, e);
        }
    }
}
