package com.suhana.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Configuration for the crypto subsystem.
 *
 * - Loaded from JSON via {@link #load(String, boolean)}.
 * - Cached per absolute/real path.
 * - Exposes nested config blocks: keys (at-rest encryption) and stream (batching thresholds).
 *
 * Passwords are never read from this file; they are handed to the key manager directly.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CryptoConfig {

    private static final int  MAX_KEYS_LIMIT     = 1024;
    private static final long MAX_ROTATION_DAYS  = 10L * 365L;
    private static final int  MAX_STREAM_TOKENS  = 100_000;
    private static final int  MAX_STREAM_BYTES   = 16 * 1024 * 1024;
    private static final long MAX_STREAM_DELAY   = 60_000L;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Per-path cache for loaded configs. */
    private static final ConcurrentMap<String, CryptoConfig> configCache = new ConcurrentHashMap<>();

    @JsonProperty("keys")
    private KeysConfig keys = new KeysConfig();

    @JsonProperty("stream")
    private StreamConfig stream = new StreamConfig();

    /* ======================== Static loading API ======================== */

    public static CryptoConfig load(String path, boolean refresh) throws ConfigLoadException {
        Objects.requireNonNull(path, "Config path cannot be null");
        String key;
        try {
            Path p = Paths.get(path).toAbsolutePath().normalize();
            try {
                p = p.toRealPath();
            } catch (IOException ignore) {
                // fall back to normalized absolute path
            }
            key = p.toString();
        } catch (Exception e) {
            throw new ConfigLoadException("Invalid config path: " + path, e);
        }

        if (!refresh) {
            CryptoConfig cached = configCache.get(key);
            if (cached != null) return cached;
        }

        CryptoConfig cfg;
        try {
            Path p = Paths.get(key);
            if (!Files.isRegularFile(p) || !Files.isReadable(p)) {
                throw new IOException("Config file not found or not readable: " + key);
            }
            cfg = MAPPER.readValue(p.toFile(), CryptoConfig.class);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read/parse CryptoConfig from " + key, e);
        }
        if (cfg.keys == null) cfg.keys = new KeysConfig();
        if (cfg.stream == null) cfg.stream = new StreamConfig();

        configCache.put(key, cfg);
        return cfg;
    }

    public static void clearCache() {
        configCache.clear();
    }

    public KeysConfig getKeys() {
        return keys;
    }

    public StreamConfig getStream() {
        return stream;
    }

    /* ======================== Nested config types ======================== */

    /** At-rest key management. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KeysConfig {
        /** Key store path; relative paths resolve against the base dir. Null means the default location. */
        @JsonProperty("keyFile")
        public String keyFile;

        @JsonProperty("rotationDays")
        public long rotationDays = 90L;

        @JsonProperty("maxKeys")
        public int maxKeys = 5;

        /** Directories re-encrypted after every rotation. */
        @JsonProperty("reencryptDirs")
        public List<String> reencryptDirs = new ArrayList<>();

        @JsonProperty("reencryptPattern")
        public String reencryptPattern = "*.enc";

        public String getKeyFile() {
            return (keyFile == null || keyFile.isBlank()) ? null : keyFile;
        }

        public Duration getRotationInterval() {
            return Duration.ofDays(clamp(rotationDays, 1L, MAX_ROTATION_DAYS));
        }

        public int getMaxKeys() {
            return clamp(maxKeys, 1, MAX_KEYS_LIMIT);
        }

        public List<String> getReencryptDirs() {
            return reencryptDirs == null ? List.of() : List.copyOf(reencryptDirs);
        }

        public String getReencryptPattern() {
            return (reencryptPattern == null || reencryptPattern.isBlank()) ? "*.enc" : reencryptPattern;
        }
    }

    /** Adaptive batching thresholds for the encrypted token stream. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StreamConfig {
        @JsonProperty("maxTokens")
        public int maxTokens = 20;

        @JsonProperty("maxBytes")
        public int maxBytes = 2048;

        @JsonProperty("maxDelayMs")
        public long maxDelayMs = 40L;

        public int getMaxTokens() {
            return clamp(maxTokens, 1, MAX_STREAM_TOKENS);
        }

        public int getMaxBytes() {
            return clamp(maxBytes, 1, MAX_STREAM_BYTES);
        }

        public long getMaxDelayMs() {
            return clamp(maxDelayMs, 0L, MAX_STREAM_DELAY);
        }
    }

    /* ======================== Helper methods ======================== */

    private static int clamp(int v, int min, int max) {
        if (v < min) return min;
        if (v > max) return max;
        return v;
    }

    private static long clamp(long v, long min, long max) {
        if (v < min) return min;
        if (v > max) return max;
        return v;
    }

    /* ======================== Exception type ======================== */

    public static class ConfigLoadException extends Exception {
        public ConfigLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
