package com.suhana.crypto;

import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

import static org.junit.jupiter.api.Assertions.*;

class SealedTokenTest {

    @Test
    void sealOpenRoundTrip() throws GeneralSecurityException {
        SecretKey key = EncryptionUtils.generateKey();
        byte[] plain = "hello secret".getBytes(StandardCharsets.UTF_8);

        byte[] token = SealedToken.seal(plain, key);

        assertEquals(SealedToken.VERSION, token[0]);
        assertEquals(1 + 12 + plain.length + 16, token.length);
        assertArrayEquals(plain, SealedToken.open(token, key));
    }

    @Test
    void sameInputProducesDifferentTokens() throws GeneralSecurityException {
        SecretKey key = EncryptionUtils.generateKey();
        byte[] plain = {1, 2, 3};
        assertFalse(java.util.Arrays.equals(SealedToken.seal(plain, key), SealedToken.seal(plain, key)));
    }

    @Test
    void flippedBitIsRejected() throws GeneralSecurityException {
        SecretKey key = EncryptionUtils.generateKey();
        byte[] token = SealedToken.seal("abc".getBytes(), key);
        token[token.length - 1] ^= 0x01;
        assertThrows(GeneralSecurityException.class, () -> SealedToken.open(token, key));
    }

    @Test
    void truncatedOrForeignTokensAreRejected() throws GeneralSecurityException {
        SecretKey key = EncryptionUtils.generateKey();
        assertThrows(GeneralSecurityException.class, () -> SealedToken.open(new byte[10], key));

        byte[] token = SealedToken.seal("abc".getBytes(), key);
        token[0] = 0x7f;
        assertThrows(GeneralSecurityException.class, () -> SealedToken.open(token, key));
    }

    @Test
    void tryOpenReturnsEmptyForWrongKey() throws GeneralSecurityException {
        byte[] token = SealedToken.seal("x".getBytes(), EncryptionUtils.generateKey());
        assertTrue(KeyUtils.tryOpen(token, EncryptionUtils.generateKey()).isEmpty());
    }
}
