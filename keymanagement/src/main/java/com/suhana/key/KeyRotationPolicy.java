package com.suhana.key;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Settings governing when key rotation should occur.
 */
public class KeyRotationPolicy {
    public static final Duration DEFAULT_INTERVAL = Duration.ofDays(90);

    private final Duration rotationInterval;

    public KeyRotationPolicy(Duration rotationInterval) {
        Objects.requireNonNull(rotationInterval, "rotationInterval");
        if (rotationInterval.isZero() || rotationInterval.isNegative()) {
            throw new IllegalArgumentException("rotationInterval must be positive");
        }
        this.rotationInterval = rotationInterval;
    }

    public Duration getRotationInterval() {
        return rotationInterval;
    }

    /** True once the primary key is strictly older than the rotation interval. */
    public boolean isDue(KeyRecord primary, Instant now) {
        return primary.ageAt(now).compareTo(rotationInterval) > 0;
    }
}
