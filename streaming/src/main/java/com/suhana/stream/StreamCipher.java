package com.suhana.stream;

import com.suhana.crypto.EncryptionUtils;

import javax.crypto.SecretKey;
import java.security.GeneralSecurityException;
import java.util.Objects;

/**
 * AES-256-GCM bound to one derived stream key. 96-bit nonces, 128-bit tags.
 */
public final class StreamCipher {
    private final SecretKey key;

    StreamCipher(SecretKey key) {
        this.key = Objects.requireNonNull(key, "key");
    }

    /** Fresh random IV plus the ciphertext (tag appended). */
    public Sealed seal(byte[] plaintext, byte[] aad) throws GeneralSecurityException {
        byte[] iv = EncryptionUtils.generateIV();
        return new Sealed(iv, EncryptionUtils.encrypt(plaintext, iv, key, aad));
    }

    public byte[] open(byte[] iv, byte[] ciphertext, byte[] aad) throws GeneralSecurityException {
        return EncryptionUtils.decrypt(ciphertext, iv, key, aad);
    }

    /** Raw key bytes; used to compare derivations. */
    byte[] keyBytes() {
        return key.getEncoded();
    }

    public static final class Sealed {
        private final byte[] iv;
        private final byte[] ciphertext;

        Sealed(byte[] iv, byte[] ciphertext) {
            this.iv = iv;
            this.ciphertext = ciphertext;
        }

        public byte[] getIv() { return iv; }
        public byte[] getCiphertext() { return ciphertext; }
    }
}
