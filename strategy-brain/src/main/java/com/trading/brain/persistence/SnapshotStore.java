package com.trading.brain.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * JSON snapshot files in one directory. Writes go to {@code <name>.tmp} first and are then
 * renamed over the target, so readers never observe a half-written file.
 *
 * Errors are returned as {@link LoadResult} / {@link SaveResult}, never thrown.
 */
public final class SnapshotStore {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Path directory;

    public SnapshotStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Path getDirectory() {
        return directory;
    }

    public Path resolve(String fileName) {
        return directory.resolve(fileName);
    }

    public <T> LoadResult<T> load(String fileName, Class<T> type) {
        Path path = resolve(fileName);
        if (!Files.exists(path)) {
            return new LoadResult.Missing<>(path);
        }
        try {
            T value = MAPPER.readValue(path.toFile(), type);
            if (value == null) {
                return new LoadResult.Failed<>(path, new IOException("Snapshot is empty"));
            }
            return new LoadResult.Loaded<>(path, value);
        } catch (IOException | RuntimeException e) {
            return new LoadResult.Failed<>(path, e);
        }
    }

    public SaveResult save(String fileName, Object snapshot) {
        Path path = resolve(fileName);
        Path tmp = resolve(fileName + ".tmp");
        try {
            Files.createDirectories(directory);
            byte[] json = MAPPER.writeValueAsBytes(snapshot);
            Files.write(tmp, json);
            moveIntoPlace(tmp, path);
            return new SaveResult.Saved(path, json.length);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            return new SaveResult.Failed(path, e);
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    static ObjectMapper mapper() {
        return MAPPER;
    }
}
