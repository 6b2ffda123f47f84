package com.suhana.crypto;

import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Key/crypto helpers shared by the key manager and the stream deriver.
 */
public final class KeyUtils {
    private static final String PBKDF2_ALGO = "PBKDF2WithHmacSHA256";

    private KeyUtils() {}

    /**
     * Attempts to open a sealed token with a single key.
     * Empty on any authentication or format failure; callers try the next key.
     */
    public static Optional<byte[]> tryOpen(byte[] token, SecretKey key) {
        try {
            return Optional.of(SealedToken.open(token, key));
        } catch (GeneralSecurityException | IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    /** Builds an AES SecretKey from raw bytes. */
    public static SecretKey fromBytes(byte[] rawKeyBytes) {
        if (rawKeyBytes == null || (rawKeyBytes.length != 16 && rawKeyBytes.length != 24 && rawKeyBytes.length != 32)) {
            throw new IllegalArgumentException("Invalid AES key length: " + (rawKeyBytes == null ? 0 : rawKeyBytes.length));
        }
        return new SecretKeySpec(rawKeyBytes, EncryptionUtils.KEY_ALGO);
    }

    /** PBKDF2-HMAC-SHA256 into an AES key of {@code bits} length. */
    public static SecretKey pbkdf2(char[] password, byte[] salt, int iterations, int bits) throws GeneralSecurityException {
        PBEKeySpec spec = new PBEKeySpec(password, salt, iterations, bits);
        byte[] raw = null;
        try {
            raw = SecretKeyFactory.getInstance(PBKDF2_ALGO).generateSecret(spec).getEncoded();
            return new SecretKeySpec(raw, EncryptionUtils.KEY_ALGO);
        } finally {
            spec.clearPassword();
            SecureKeyDeletion.wipeBytes(raw);
        }
    }

    public static byte[] sha256(byte[] data) throws GeneralSecurityException {
        return MessageDigest.getInstance("SHA-256").digest(data);
    }

    /** Constant-time key material comparison. */
    public static boolean sameKey(SecretKey a, SecretKey b) {
        if (a == null || b == null) return false;
        return MessageDigest.isEqual(a.getEncoded(), b.getEncoded());
    }
}
