package com.suhana.key;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.suhana.common.DecryptionException;
import com.suhana.common.EncryptionException;
import com.suhana.common.FileAccessException;
import com.suhana.common.FsPaths;
import com.suhana.common.KeyInitializationException;
import com.suhana.common.KeyStoreException;
import com.suhana.common.PersistenceUtils;
import com.suhana.common.SuhanaCryptoException;
import com.suhana.config.CryptoConfig;
import com.suhana.crypto.EncryptionUtils;
import com.suhana.crypto.KeyUtils;
import com.suhana.crypto.SealedToken;
import com.suhana.crypto.SecureKeyDeletion;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * At-rest encryption under a rotating ring of AES-256-GCM keys.
 *
 * Key source, in order of precedence:
 *  - a password: a key is derived with PBKDF2 and the installation's random salt;
 *  - an existing key store file;
 *  - otherwise a fresh random key, persisted to the key store.
 *
 * New tokens are always sealed under the primary key. Decryption tries every key in the ring,
 * newest first, so tokens survive rotations until their key is evicted by the size cap.
 *
 * Not safe for concurrent rotation from several processes sharing one key store file;
 * callers must serialize rotation externally.
 */
public class EncryptionManager {
    private static final Logger logger = LoggerFactory.getLogger(EncryptionManager.class);

    static final int PBKDF2_ITERATIONS = 100_000;

    private final KeyStoreFile store;
    private final KeyRotationPolicy policy;
    private final int maxKeys;
    private final List<Path> reencryptDirs;
    private final String reencryptPattern;
    private final Clock clock;

    private final Counter encryptions;
    private final Counter decryptFailures;
    private final Counter rotations;
    private final Timer reencryptTimer;

    private volatile KeyRing ring = KeyRing.empty();

    /** Key store at {@code keyStoreFile}, default rotation settings. */
    public EncryptionManager(Path keyStoreFile) {
        this(keyStoreFile, null, new CryptoConfig.KeysConfig(), Clock.systemUTC(), null);
    }

    public EncryptionManager(Path keyStoreFile, char[] password) {
        this(keyStoreFile, password, new CryptoConfig.KeysConfig(), Clock.systemUTC(), null);
    }

    /** Key store location and rotation settings taken from {@code config}. */
    public EncryptionManager(CryptoConfig config, char[] password) {
        this(null, password, config.getKeys(), Clock.systemUTC(), null);
    }

    /**
     * @param keyStoreFile explicit key store; null uses {@code keys.keyFile}, then the default location
     * @param password     derive the primary key from this password; null to load or generate
     * @param keys         rotation interval, ring size, re-encryption directories
     * @param clock        time source for key timestamps and rotation checks
     * @param metrics      meter registry; null for a private in-memory registry
     */
    public EncryptionManager(Path keyStoreFile,
                             char[] password,
                             CryptoConfig.KeysConfig keys,
                             Clock clock,
                             MeterRegistry metrics) {
        Objects.requireNonNull(keys, "keys");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.store = new KeyStoreFile(resolveStoreFile(keyStoreFile, keys));
        this.policy = new KeyRotationPolicy(keys.getRotationInterval());
        this.maxKeys = keys.getMaxKeys();
        this.reencryptPattern = validGlob(keys.getReencryptPattern());
        List<Path> dirs = new ArrayList<>();
        for (String d : keys.getReencryptDirs()) dirs.add(FsPaths.resolve(d));
        this.reencryptDirs = List.copyOf(dirs);

        MeterRegistry registry = (metrics != null) ? metrics : new SimpleMeterRegistry();
        this.encryptions = registry.counter("suhana.crypto.encryptions");
        this.decryptFailures = registry.counter("suhana.crypto.decrypt.failures");
        this.rotations = registry.counter("suhana.crypto.rotations");
        this.reencryptTimer = Timer.builder("suhana.crypto.reencrypt.directory").register(registry);

        initRing(password);
        checkRotation();
    }

    private static String validGlob(String pattern) {
        try {
            FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            return pattern;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid re-encryption pattern: " + pattern, e);
        }
    }

    private static Path resolveStoreFile(Path explicit, CryptoConfig.KeysConfig keys) {
        if (explicit != null) return explicit.toAbsolutePath().normalize();
        String configured = keys.getKeyFile();
        return (configured != null) ? FsPaths.resolve(configured) : FsPaths.keyStoreFile();
    }

    /* ======================== Initialization ======================== */

    private synchronized void initRing(char[] password) {
        KeyRing loaded = store.exists() ? loadOrEmpty() : KeyRing.empty();
        KeyRing next = loaded;
        try {
            if (password != null) {
                byte[] salt = store.loadOrCreateSalt();
                KeyRecord derived = new KeyRecord(
                        KeyUtils.pbkdf2(password, salt, PBKDF2_ITERATIONS, EncryptionUtils.KEY_BITS),
                        clock.instant());
                if (!loaded.isEmpty() && KeyUtils.sameKey(loaded.primary().getSecret(), derived.getSecret())) {
                    logger.info("Password-derived key is already primary in {}", store.getFile());
                } else {
                    next = loaded.prepend(derived, maxKeys);
                    logger.info("Derived new encryption key from password");
                }
            } else if (loaded.isEmpty()) {
                next = KeyRing.empty().prepend(KeyRecord.generate(clock), maxKeys);
                logger.info("Generated new encryption key");
            }
            if (next != loaded) store.save(next);
        } catch (GeneralSecurityException | IOException e) {
            throw new KeyInitializationException("Failed to initialize encryption keys at " + store.getFile(), e);
        }

        if (next.isEmpty()) {
            throw new KeyInitializationException("No usable encryption key at " + store.getFile());
        }
        this.ring = next;
        logger.info("Encryption manager ready: {} keys, primary created {}",
                next.size(), next.primary().getCreatedAt());
    }

    /** A corrupt or unreadable store falls back to a freshly generated key. */
    private KeyRing loadOrEmpty() {
        try {
            KeyRing loaded = store.load();
            logger.info("Loaded {} encryption keys from {}", loaded.size(), store.getFile());
            return loaded;
        } catch (IOException e) {
            logger.error("Error loading encryption keys from {}, generating a new key", store.getFile(), e);
            return KeyRing.empty();
        }
    }

    private void checkRotation() {
        try {
            if (isRotationDue()) {
                logger.info("Key rotation needed - primary key has expired");
                rotateKeys(maxKeys);
            }
        } catch (SuhanaCryptoException e) {
            logger.error("Automatic key rotation failed; continuing with existing keys", e);
        }
    }

    /* ======================== Key lifecycle ======================== */

    public boolean isRotationDue() {
        return policy.isDue(ring.primary(), clock.instant());
    }

    /** Rotates keeping the configured number of keys, then re-encrypts the configured directories. */
    public KeyRecord rotateKeys() {
        return rotateKeys(maxKeys);
    }

    public KeyRecord rotateKeys(int maxKeys) {
        return rotateKeys(maxKeys, reencryptDirs);
    }

    /**
     * Generates a new primary key, keeps at most {@code maxKeys} keys and persists the ring.
     * All-or-nothing: if generation or persistence fails the current ring stays active and the
     * error propagates. Re-encryption of {@code dirs} runs afterwards and is best-effort.
     */
    public KeyRecord rotateKeys(int maxKeys, List<Path> dirs) {
        if (maxKeys < 1) throw new IllegalArgumentException("maxKeys must be positive");

        KeyRecord fresh;
        synchronized (this) {
            KeyRing current = ring;
            try {
                fresh = KeyRecord.generate(clock);
            } catch (GeneralSecurityException e) {
                throw new KeyInitializationException("Key generation failed during rotation", e);
            }
            KeyRing next = current.prepend(fresh, maxKeys);
            try {
                store.save(next);
            } catch (IOException e) {
                throw new KeyStoreException("Failed to persist rotated keys to " + store.getFile(), e);
            }
            ring = next;
            rotations.increment();

            int evicted = current.size() + 1 - next.size();
            logger.info("Rotated encryption keys, now using {} keys ({} evicted)", next.size(), evicted);
        }

        if (dirs != null && !dirs.isEmpty()) {
            ReencryptReport report = reencryptDirectories(dirs);
            logger.info("Reencryption after key rotation: {}/{} files successfully reencrypted",
                    report.successCount, report.totalCount);
        }
        return fresh;
    }

    public KeyRecord getPrimaryKey() {
        return ring.primary();
    }

    public int getKeyCount() {
        return ring.size();
    }

    public KeyRing getKeyRing() {
        return ring;
    }

    public Path getKeyStoreFile() {
        return store.getFile();
    }

    /* ======================== Values ======================== */

    public byte[] encrypt(String value) {
        Objects.requireNonNull(value, "value");
        return seal(value.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] encrypt(byte[] value) {
        Objects.requireNonNull(value, "value");
        return seal(value);
    }

    /** Serializes the record as JSON before sealing it. */
    public byte[] encrypt(Map<String, ?> record) {
        Objects.requireNonNull(record, "record");
        return seal(toJson(record));
    }

    /**
     * Strings and byte arrays are sealed as is; anything else is serialized as JSON first.
     * Only JSON objects are recognized again by {@link #decrypt}; other JSON values decrypt to text.
     */
    public byte[] encryptObject(Object value) {
        Objects.requireNonNull(value, "value");
        if (value instanceof String) return encrypt((String) value);
        if (value instanceof byte[]) return encrypt((byte[]) value);
        return seal(toJson(value));
    }

    /**
     * Tries every key in the ring, newest first.
     *
     * @throws DecryptionException if no key authenticates the token
     */
    public DecryptedValue decrypt(byte[] token) {
        return new DecryptedValue(open(token));
    }

    public String decryptToString(byte[] token) {
        return new String(open(token), StandardCharsets.UTF_8);
    }

    public byte[] decryptToBytes(byte[] token) {
        return open(token);
    }

    private byte[] seal(byte[] plaintext) {
        KeyRing current = ring;
        if (current.isEmpty()) {
            throw new EncryptionException("Encryption key not initialized");
        }
        try {
            byte[] token = SealedToken.seal(plaintext, current.primary().getSecret());
            encryptions.increment();
            return token;
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Error encrypting data", e);
        }
    }

    private byte[] open(byte[] token) {
        Objects.requireNonNull(token, "token");
        KeyRing current = ring;
        for (KeyRecord key : current) {
            Optional<byte[]> plain = KeyUtils.tryOpen(token, key.getSecret());
            if (plain.isPresent()) return plain.get();
        }
        decryptFailures.increment();
        throw new DecryptionException("No key in the ring authenticates this token (tried "
                + current.size() + " keys)");
    }

    private static byte[] toJson(Object value) {
        try {
            return PersistenceUtils.mapper().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new EncryptionException("Value cannot be serialized as JSON: " + value.getClass().getName(), e);
        }
    }

    /* ======================== Files ======================== */

    /**
     * Writes {@code file}'s encrypted content to {@code file + ".enc"}. The original is kept.
     */
    public Path encryptFile(Path file) {
        byte[] token = seal(readExisting(file));
        Path target = FsPaths.encryptedPathFor(file);
        write(target, token);
        logger.debug("Encrypted {} -> {}", file, target);
        return target;
    }

    /**
     * Writes the plaintext of {@code encryptedFile}; {@code .enc} is stripped, otherwise {@code .dec} is appended.
     */
    public Path decryptFile(Path encryptedFile) {
        byte[] plain = open(readExisting(encryptedFile));
        Path target = FsPaths.decryptedPathFor(encryptedFile);
        try {
            write(target, plain);
        } finally {
            SecureKeyDeletion.wipeBytes(plain);
        }
        logger.debug("Decrypted {} -> {}", encryptedFile, target);
        return target;
    }

    /**
     * Re-seals {@code file} under the primary key, replacing it atomically.
     * Plaintext stays in memory. Never throws: failures are logged and reported as {@code false}.
     */
    public boolean reencryptFile(Path file) {
        byte[] plain = null;
        try {
            plain = open(readExisting(file));
            write(file, seal(plain));
            logger.info("Successfully re-encrypted file {} with the primary key", file);
            return true;
        } catch (RuntimeException e) {
            logger.error("Error re-encrypting file {}", file, e);
            return false;
        } finally {
            SecureKeyDeletion.wipeBytes(plain);
        }
    }

    public ReencryptReport reencryptDirectory(Path dir) {
        return reencryptDirectory(dir, reencryptPattern);
    }

    /**
     * Re-encrypts every regular file in {@code dir} matching the glob, one at a time.
     * A missing or empty directory, or an invalid glob, yields {@code (0, 0)}.
     */
    public ReencryptReport reencryptDirectory(Path dir, String globPattern) {
        Objects.requireNonNull(dir, "dir");
        if (!Files.isDirectory(dir)) {
            logger.warn("Directory not found: {}", dir);
            return ReencryptReport.empty();
        }

        long t0 = System.nanoTime();
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir, globPattern)) {
            for (Path p : ds) {
                if (Files.isRegularFile(p)) files.add(p);
            }
        } catch (IOException e) {
            logger.error("Error listing directory {}", dir, e);
            return ReencryptReport.empty();
        } catch (IllegalArgumentException e) {
            logger.error("Invalid re-encryption pattern '{}' for {}", globPattern, dir, e);
            return ReencryptReport.empty();
        }
        files.sort(null);

        if (files.isEmpty()) {
            logger.info("No encrypted files found in {}", dir);
            return ReencryptReport.empty();
        }

        int success = 0;
        for (Path f : files) {
            if (reencryptFile(f)) success++;
        }
        long elapsedNs = System.nanoTime() - t0;
        reencryptTimer.record(elapsedNs, TimeUnit.NANOSECONDS);

        ReencryptReport report = new ReencryptReport(success, files.size(), TimeUnit.NANOSECONDS.toMillis(elapsedNs));
        logger.info("Re-encrypted {}/{} files in {}", success, files.size(), dir);
        return report;
    }

    public ReencryptReport reencryptDirectories(List<Path> dirs) {
        ReencryptReport total = ReencryptReport.empty();
        for (Path dir : dirs) {
            logger.info("Reencrypting files in {}", dir);
            total = total.plus(reencryptDirectory(dir));
        }
        return total;
    }

    private static byte[] readExisting(Path file) {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new FileAccessException(file, "File not found");
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new FileAccessException(file, "Failed to read file", e);
        }
    }

    private static void write(Path target, byte[] data) {
        try {
            PersistenceUtils.writeAtomically(target, data);
        } catch (IOException e) {
            throw new FileAccessException(target, "Failed to write file", e);
        }
    }
}
