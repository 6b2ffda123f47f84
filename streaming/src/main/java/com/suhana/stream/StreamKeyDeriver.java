package com.suhana.stream;

import com.suhana.common.KeyInitializationException;
import com.suhana.crypto.HkdfSha256;
import com.suhana.crypto.KeyUtils;
import com.suhana.crypto.SecureKeyDeletion;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Objects;

/**
 * Derives the per-conversation stream key from a shared secret.
 *
 * salt = SHA-256("chat-stream-v1:" + conversationId)
 * key  = HKDF-SHA256(sharedSecret, salt, info = "e2ee-stream/aes-gcm", 32 bytes)
 *
 * The same (secret, conversation id) pair always yields the same key.
 */
public final class StreamKeyDeriver {
    static final String SALT_PREFIX = "chat-stream-v1:";
    static final String INFO = "e2ee-stream/aes-gcm";
    static final int KEY_LENGTH = 32;

    private StreamKeyDeriver() {}

    public static StreamCipher derive(byte[] sharedSecret, String conversationId) {
        Objects.requireNonNull(sharedSecret, "sharedSecret");
        Objects.requireNonNull(conversationId, "conversationId");
        byte[] okm = null;
        try {
            byte[] salt = KeyUtils.sha256((SALT_PREFIX + conversationId).getBytes(StandardCharsets.UTF_8));
            okm = HkdfSha256.derive(sharedSecret, salt, INFO.getBytes(StandardCharsets.UTF_8), KEY_LENGTH);
            return new StreamCipher(KeyUtils.fromBytes(okm));
        } catch (GeneralSecurityException e) {
            throw new KeyInitializationException("Failed to derive stream key for conversation " + conversationId, e);
        } finally {
            SecureKeyDeletion.wipeBytes(okm);
        }
    }
}
