package com.suhana.common;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * JSON persistence and whole-file atomic rewrites.
 * Every write goes to a temp file in the target's directory and is then renamed over the target,
 * so a crash leaves either the old or the new content, never a torn file.
 */
public final class PersistenceUtils {
    private static final Logger logger = LoggerFactory.getLogger(PersistenceUtils.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private PersistenceUtils() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serializes {@code value} as JSON and atomically replaces {@code target}.
     * Missing parent directories are created.
     */
    public static void saveJson(Object value, Path target) throws IOException {
        Objects.requireNonNull(value, "Object cannot be null");
        Objects.requireNonNull(target, "File path cannot be null");
        writeAtomically(target, MAPPER.writeValueAsBytes(value));
        logger.debug("Saved JSON to {}", target);
    }

    public static <T> T loadJson(Path source, TypeReference<T> type) throws IOException {
        Objects.requireNonNull(source, "File path cannot be null");
        Objects.requireNonNull(type, "Expected type cannot be null");
        if (!Files.isRegularFile(source)) {
            logger.warn("File does not exist: {}", source);
            throw new IOException("File does not exist: " + source);
        }
        try {
            T value = MAPPER.readValue(source.toFile(), type);
            logger.debug("Loaded JSON from {}", source);
            return value;
        } catch (IOException e) {
            logger.error("Failed to load JSON from {}", source, e);
            throw new IOException("Failed to load JSON from " + source, e);
        }
    }

    /**
     * Writes {@code data} to a temp file next to {@code target}, then moves it over the target.
     * Falls back to a plain replacing move where the filesystem has no atomic rename.
     */
    public static void writeAtomically(Path target, byte[] data) throws IOException {
        Objects.requireNonNull(target, "File path cannot be null");
        Objects.requireNonNull(data, "data");
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);

        Path tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
        try {
            Files.write(tmp, data);
            try {
                Files.move(tmp, target,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move unsupported for {}, using replacing move", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
