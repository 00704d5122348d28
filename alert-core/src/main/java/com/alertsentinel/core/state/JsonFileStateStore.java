package com.alertsentinel.core.state;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores the pipeline state as a single JSON document.
 *
 * <pre>
 * {
 *   "fingerprints": { "3f2a...": "2026-05-01T10:00:00Z" },
 *   "alert_timestamps": [ "2026-05-01T10:01:00Z" ],
 *   "stats": { "total_received": 12, "total_sent": 3, ... }
 * }
 * </pre>
 *
 * <p>
 * Missing parent directories are created on save. Each save writes a sibling
 * temp file and moves it over the target so a crash mid-write leaves the
 * previous snapshot intact.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonFileStateStore implements StateStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileStateStore.class);

    private final Path file;
    private final ObjectMapper mapper;

    /**
     * @param file target JSON file; must not be {@code null}
     */
    public JsonFileStateStore(Path file) {
        this.file = Objects.requireNonNull(file, "State file path must not be null");
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public Optional<StateSnapshot> load() throws IOException {
        if (!Files.exists(file)) {
            LOG.debug("No state file at {} – cold start", file);
            return Optional.empty();
        }
        StateSnapshot snapshot = mapper.readValue(file.toFile(), StateSnapshot.class);
        LOG.info("Loaded alert state from {}: {}", file, snapshot);
        return Optional.ofNullable(snapshot);
    }

    @Override
    public void save(StateSnapshot snapshot) throws IOException {
        Objects.requireNonNull(snapshot, "Snapshot must not be null");
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), snapshot);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    }

    public Path getFile() {
        return file;
    }
}
