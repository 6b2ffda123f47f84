package com.suhana.common;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class PersistenceUtilsTest {
    @TempDir
    Path tempDir;

    @Test
    void saveAndLoadJsonList() throws IOException {
        Path file = tempDir.resolve("keys.json");
        List<Map<String, String>> original = List.of(
                Map.of("key", "AAAA", "timestamp", "2026-01-01T00:00:00Z"),
                Map.of("key", "BBBB", "timestamp", "2025-12-01T00:00:00Z"));

        PersistenceUtils.saveJson(original, file);
        List<Map<String, String>> loaded = PersistenceUtils.loadJson(file, new TypeReference<>() {});

        assertEquals(original, loaded, "Round-tripped list mismatch");
    }

    @Test
    void writeAtomicallyReplacesContentAndLeavesNoTempFiles() throws IOException {
        Path file = tempDir.resolve("nested/data.bin");
        PersistenceUtils.writeAtomically(file, "first".getBytes(StandardCharsets.UTF_8));
        PersistenceUtils.writeAtomically(file, "second".getBytes(StandardCharsets.UTF_8));

        assertEquals("second", Files.readString(file));
        try (Stream<Path> s = Files.list(file.getParent())) {
            assertEquals(1, s.count(), "Temp file should have been moved or removed");
        }
    }

    @Test
    void loadMissingFileThrows() {
        Path file = tempDir.resolve("nofile.json");
        assertThrows(IOException.class,
                () -> PersistenceUtils.loadJson(file, new TypeReference<List<Object>>() {}),
                "Expected IOException for missing file");
    }

    @Test
    void loadCorruptFileThrows() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "corrupted data");
        assertThrows(IOException.class,
                () -> PersistenceUtils.loadJson(file, new TypeReference<List<Object>>() {}));
    }

    @Test
    void saveJsonCreatesMissingParentDirectories() throws IOException {
        Path file = tempDir.resolve("config/encryption_keys/current_keys.json");

        PersistenceUtils.saveJson(List.of(Map.of("key", "AAAA")), file);

        assertTrue(Files.isRegularFile(file));
        assertEquals("[{\"key\":\"AAAA\"}]", Files.readString(file));
    }
}
