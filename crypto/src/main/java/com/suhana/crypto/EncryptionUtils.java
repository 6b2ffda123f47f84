package com.suhana.crypto;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Low-level AES-256-GCM encryption/decryption utilities.
 * Ciphertexts carry the 16-byte authentication tag appended, per JCE convention.
 */
public final class EncryptionUtils {
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    public static final String KEY_ALGO = "AES";
    public static final int KEY_BITS = 256;
    public static final int GCM_IV_LENGTH = 12; // Recommended length for AES-GCM
    public static final int GCM_TAG_LENGTH_BITS = 128;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Logger logger = LoggerFactory.getLogger(EncryptionUtils.class);

    private EncryptionUtils() {}

    /** Securely generates a 12-byte IV for AES-GCM. */
    public static byte[] generateIV() {
        byte[] iv = new byte[GCM_IV_LENGTH];
        SECURE_RANDOM.nextBytes(iv);
        return iv;
    }

    /** Fresh random 256-bit AES key. */
    public static SecretKey generateKey() throws GeneralSecurityException {
        KeyGenerator kg = KeyGenerator.getInstance(KEY_ALGO);
        kg.init(KEY_BITS, SECURE_RANDOM);
        return new SecretKeySpec(kg.generateKey().getEncoded(), KEY_ALGO);
    }

    /** Encrypts bytes using AES-GCM with optional AAD. */
    public static byte[] encrypt(byte[] plaintext, byte[] iv, SecretKey key, byte[] aad) throws GeneralSecurityException {
        validateParams(plaintext, iv, key);
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, iv));
        if (aad != null && aad.length > 0) cipher.updateAAD(aad);
        logger.trace("Encrypting {} bytes", plaintext.length);
        return cipher.doFinal(plaintext);
    }

    /**
     * Decrypts AES-GCM ciphertext with optional AAD.
     *
     * @throws javax.crypto.AEADBadTagException if the key, IV, AAD or ciphertext do not authenticate
     */
    public static byte[] decrypt(byte[] ciphertext, byte[] iv, SecretKey key, byte[] aad) throws GeneralSecurityException {
        validateParams(ciphertext, iv, key);
        if (ciphertext.length < GCM_TAG_LENGTH_BITS / 8) {
            throw new GeneralSecurityException("Ciphertext too short");
        }
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH_BITS, iv));
        if (aad != null && aad.length > 0) cipher.updateAAD(aad);
        return cipher.doFinal(ciphertext);
    }

    private static void validateParams(byte[] input, byte[] iv, SecretKey key) {
        Objects.requireNonNull(input, "Plaintext or ciphertext cannot be null");
        Objects.requireNonNull(iv, "IV cannot be null");
        Objects.requireNonNull(key, "SecretKey cannot be null");
        if (iv.length != GCM_IV_LENGTH) {
            throw new IllegalArgumentException("IV length must be " + GCM_IV_LENGTH + " bytes");
        }
    }
}
