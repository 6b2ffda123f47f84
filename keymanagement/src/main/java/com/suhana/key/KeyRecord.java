package com.suhana.key;

import com.suhana.crypto.EncryptionUtils;

import javax.crypto.SecretKey;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * KeyRecord: one symmetric key in the ring.
 *
 * secret     = 256-bit AES key
 * createdAt  = when the key was generated or derived
 *
 * Immutable once created.
 */
public final class KeyRecord {
    private final SecretKey secret;
    private final Instant createdAt;

    public KeyRecord(SecretKey secret, Instant createdAt) {
        this.secret = Objects.requireNonNull(secret, "secret cannot be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt cannot be null");
    }

    /** New random key stamped with {@code clock}'s current instant. */
    public static KeyRecord generate(Clock clock) throws GeneralSecurityException {
        return new KeyRecord(EncryptionUtils.generateKey(), clock.instant());
    }

    public SecretKey getSecret() {
        return secret;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Duration ageAt(Instant now) {
        return Duration.between(createdAt, now);
    }

    @Override
    public String toString() {
        return "KeyRecord{created=" + createdAt + "}";
    }
}
