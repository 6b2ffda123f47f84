package com.suhana.crypto;

import javax.crypto.SecretKey;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Objects;

/**
 * Opaque at-rest token: {@code [0x01][12-byte IV][ciphertext || 16-byte tag]}.
 *
 * The token carries no key identifier. Holders of several keys find the right one by trial,
 * which is what keeps tokens decryptable across rotations without extra framing.
 */
public final class SealedToken {
    public static final byte VERSION = 0x01;
    private static final int HEADER = 1 + EncryptionUtils.GCM_IV_LENGTH;
    private static final int MIN_LENGTH = HEADER + EncryptionUtils.GCM_TAG_LENGTH_BITS / 8;

    private SealedToken() {}

    public static byte[] seal(byte[] plaintext, SecretKey key) throws GeneralSecurityException {
        byte[] iv = EncryptionUtils.generateIV();
        byte[] ct = EncryptionUtils.encrypt(plaintext, iv, key, null);
        return ByteBuffer.allocate(HEADER + ct.length)
                .put(VERSION)
                .put(iv)
                .put(ct)
                .array();
    }

    public static byte[] open(byte[] token, SecretKey key) throws GeneralSecurityException {
        Objects.requireNonNull(token, "token");
        if (token.length < MIN_LENGTH) {
            throw new GeneralSecurityException("Token too short: " + token.length + " bytes");
        }
        if (token[0] != VERSION) {
            throw new GeneralSecurityException("Unsupported token version: " + token[0]);
        }
        byte[] iv = Arrays.copyOfRange(token, 1, HEADER);
        byte[] ct = Arrays.copyOfRange(token, HEADER, token.length);
        return EncryptionUtils.decrypt(ct, iv, key, null);
    }
}
