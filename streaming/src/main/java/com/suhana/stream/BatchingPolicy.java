package com.suhana.stream;

import com.suhana.config.CryptoConfig;

import java.util.concurrent.TimeUnit;

/**
 * Flush thresholds for the stream encoder. A batch is flushed as soon as any one is reached.
 */
public final class BatchingPolicy {
    public static final int DEFAULT_MAX_TOKENS = 20;
    public static final int DEFAULT_MAX_BYTES = 2048;
    public static final long DEFAULT_MAX_DELAY_MS = 40L;

    private final int maxTokens;
    private final int maxBytes;
    private final long maxDelayNanos;

    public BatchingPolicy(int maxTokens, int maxBytes, long maxDelayMs) {
        if (maxTokens < 1) throw new IllegalArgumentException("maxTokens must be >= 1");
        if (maxBytes < 1) throw new IllegalArgumentException("maxBytes must be >= 1");
        if (maxDelayMs < 0) throw new IllegalArgumentException("maxDelayMs must be >= 0");
        this.maxTokens = maxTokens;
        this.maxBytes = maxBytes;
        this.maxDelayNanos = TimeUnit.MILLISECONDS.toNanos(maxDelayMs);
    }

    public static BatchingPolicy defaults() {
        return new BatchingPolicy(DEFAULT_MAX_TOKENS, DEFAULT_MAX_BYTES, DEFAULT_MAX_DELAY_MS);
    }

    public static BatchingPolicy from(CryptoConfig.StreamConfig config) {
        return new BatchingPolicy(config.getMaxTokens(), config.getMaxBytes(), config.getMaxDelayMs());
    }

    /** Size triggers: fragment count or buffered UTF-8 bytes. */
    boolean sizeReached(int tokens, int bytes) {
        return tokens >= maxTokens || bytes >= maxBytes;
    }

    boolean delayReached(long elapsedNanos) {
        return elapsedNanos >= maxDelayNanos;
    }

    public int getMaxTokens() { return maxTokens; }
    public int getMaxBytes() { return maxBytes; }
    public long getMaxDelayMs() { return TimeUnit.NANOSECONDS.toMillis(maxDelayNanos); }

    @Override
    public String toString() {
        return "BatchingPolicy{maxTokens=" + maxTokens + ", maxBytes=" + maxBytes
                + ", maxDelayMs=" + getMaxDelayMs() + "}";
    }
}
