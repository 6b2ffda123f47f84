package com.suhana.key;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.type.TypeReference;
import com.suhana.common.FsPaths;
import com.suhana.common.PersistenceUtils;
import com.suhana.crypto.KeyUtils;
import com.suhana.crypto.SecureKeyDeletion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * On-disk key store: a JSON array of {@code {"key": base64, "timestamp": ISO-8601}}, newest first.
 * Every save is a whole-file rewrite through a temp file and an atomic rename.
 *
 * The per-installation password salt lives in a sibling {@code .salt} file.
 */
public class KeyStoreFile {
    private static final Logger logger = LoggerFactory.getLogger(KeyStoreFile.class);

    static final int SALT_BYTES = 16;
    private static final TypeReference<List<StoredKey>> STORED_KEYS = new TypeReference<>() {};

    private final Path file;
    private final Path saltFile;
    private final SecureRandom random = new SecureRandom();

    public KeyStoreFile(Path file) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath().normalize();
        this.saltFile = FsPaths.saltFileFor(this.file);
    }

    public Path getFile() {
        return file;
    }

    public Path getSaltFile() {
        return saltFile;
    }

    public boolean exists() {
        return Files.isRegularFile(file);
    }

    /**
     * Reads the ring.
     *
     * @throws IOException if the file is missing, unreadable, not the expected JSON, or holds an invalid entry
     */
    public KeyRing load() throws IOException {
        List<StoredKey> stored = PersistenceUtils.loadJson(file, STORED_KEYS);
        if (stored == null) throw new IOException("Key store is empty: " + file);

        List<KeyRecord> keys = new ArrayList<>(stored.size());
        for (int i = 0; i < stored.size(); i++) {
            StoredKey s = stored.get(i);
            if (s == null || s.key == null || s.timestamp == null) {
                throw new IOException("Key store entry " + i + " is incomplete: " + file);
            }
            byte[] raw = null;
            try {
                raw = Base64.getDecoder().decode(s.key);
                keys.add(new KeyRecord(KeyUtils.fromBytes(raw), parseTimestamp(s.timestamp)));
            } catch (IllegalArgumentException | DateTimeParseException e) {
                throw new IOException("Key store entry " + i + " is invalid: " + file, e);
            } finally {
                SecureKeyDeletion.wipeBytes(raw);
            }
        }
        logger.debug("Read {} keys from {}", keys.size(), file);
        return KeyRing.of(keys);
    }

    public void save(KeyRing ring) throws IOException {
        List<StoredKey> out = new ArrayList<>(ring.size());
        for (KeyRecord k : ring) {
            out.add(new StoredKey(
                    Base64.getEncoder().encodeToString(k.getSecret().getEncoded()),
                    k.getCreatedAt().toString()));
        }
        PersistenceUtils.saveJson(out, file);
        logger.info("Saved {} encryption keys to {}", ring.size(), file);
    }

    /** Returns the installation's password salt, creating and persisting a random one on first use. */
    public byte[] loadOrCreateSalt() throws IOException {
        if (Files.isRegularFile(saltFile)) {
            String encoded = Files.readString(saltFile, StandardCharsets.US_ASCII).trim();
            try {
                byte[] salt = Base64.getDecoder().decode(encoded);
                if (salt.length >= SALT_BYTES) return salt;
            } catch (IllegalArgumentException e) {
                throw new IOException("Password salt file is corrupt: " + saltFile, e);
            }
            throw new IOException("Password salt file is too short: " + saltFile);
        }
        byte[] salt = new byte[SALT_BYTES];
        random.nextBytes(salt);
        PersistenceUtils.writeAtomically(saltFile,
                Base64.getEncoder().encodeToString(salt).getBytes(StandardCharsets.US_ASCII));
        logger.info("Created password salt {}", saltFile);
        return salt;
    }

    /** ISO-8601 instant, or a zone-less local date-time interpreted in the system zone. */
    static Instant parseTimestamp(String ts) {
        try {
            return Instant.parse(ts);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(ts).atZone(ZoneId.systemDefault()).toInstant();
        }
    }

    @JsonPropertyOrder({"key", "timestamp"})
    static final class StoredKey {
        @JsonProperty("key")
        final String key;

        @JsonProperty("timestamp")
        final String timestamp;

        @JsonCreator
        StoredKey(@JsonProperty("key") String key, @JsonProperty("timestamp") String timestamp) {
            this.key = key;
            this.timestamp = timestamp;
        }
    }
}
