package com.suhana.crypto;

import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Best-effort wiping of key material held in byte arrays.
 *
 * SecretKeySpec keeps its own copy of the key, and getEncoded() returns a clone, so
 * only arrays we own can be overwritten. Evicted keys are otherwise dropped from every
 * in-memory ring and left to the GC.
 */
public final class SecureKeyDeletion {
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private SecureKeyDeletion() {}

    /**
     * Overwrites a byte array: random, zeros, ones, zeros.
     *
     * @param data the byte array to wipe (may be null)
     */
    public static void wipeBytes(byte[] data) {
        if (data == null || data.length == 0) return;

        SECURE_RANDOM.nextBytes(data);
        Arrays.fill(data, (byte) 0);
        Arrays.fill(data, (byte) 0xFF);
        Arrays.fill(data, (byte) 0);
    }
}
