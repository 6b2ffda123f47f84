package com.suhana.stream;

import com.suhana.common.EncryptionException;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.Objects;

/**
 * Sender-side state of one conversation stream: derived cipher and packet counter.
 * Never persisted.
 */
public final class StreamSession {
    private final String conversationId;
    private final StreamCipher cipher;
    private long seq;

    public StreamSession(byte[] sharedSecret, String conversationId) {
        this(StreamKeyDeriver.derive(sharedSecret, conversationId), conversationId);
    }

    StreamSession(StreamCipher cipher, String conversationId) {
        this.cipher = Objects.requireNonNull(cipher, "cipher");
        this.conversationId = Objects.requireNonNull(conversationId, "conversationId");
    }

    /** Seals {@code text} as the next packet. */
    public Packet seal(String text) {
        long next = seq + 1;
        String aad = PacketCodec.aadFor(conversationId, next);
        StreamCipher.Sealed sealed;
        try {
            sealed = cipher.seal(text.getBytes(StandardCharsets.UTF_8), aad.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to seal stream packet " + next, e);
        }
        seq = next;
        Base64.Encoder b64 = Base64.getEncoder();
        return new Packet(Packet.TYPE_CIPHERTEXT, next,
                b64.encodeToString(sealed.getIv()), b64.encodeToString(sealed.getCiphertext()), aad);
    }

    public String getConversationId() {
        return conversationId;
    }

    /** Sequence number of the last packet sealed; 0 before the first. */
    public long getSeq() {
        return seq;
    }
}
