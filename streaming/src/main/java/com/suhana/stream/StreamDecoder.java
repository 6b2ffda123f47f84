package com.suhana.stream;

import com.suhana.common.DecryptionException;
import com.suhana.crypto.EncryptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.Objects;

/**
 * Receiver side of a conversation stream.
 *
 * The AAD is recomputed from this decoder's own conversation id and the packet's {@code seq};
 * the packet's {@code aad} field must match it. Packets must arrive with {@code seq = 1, 2, 3, ...};
 * replays, gaps and reordering are rejected. A rejected packet does not advance the sequence.
 */
public class StreamDecoder {
    private static final Logger logger = LoggerFactory.getLogger(StreamDecoder.class);

    private final String conversationId;
    private final StreamCipher cipher;
    private long lastSeq;

    public StreamDecoder(byte[] sharedSecret, String conversationId) {
        this.conversationId = Objects.requireNonNull(conversationId, "conversationId");
        this.cipher = StreamKeyDeriver.derive(sharedSecret, conversationId);
    }

    /**
     * Decodes one NDJSON line into the plaintext of its batch.
     *
     * @throws DecryptionException if the packet is malformed, out of order or fails authentication
     */
    public String decode(String line) {
        return decode(PacketCodec.parse(line));
    }

    public String decode(Packet packet) {
        Objects.requireNonNull(packet, "packet");
        if (!Packet.TYPE_CIPHERTEXT.equals(packet.getType())) {
            throw new DecryptionException("Unknown packet type: " + packet.getType());
        }
        if (packet.getSeq() == null || packet.getIv() == null
                || packet.getCiphertext() == null || packet.getAad() == null) {
            throw new DecryptionException("Packet is missing required fields");
        }

        long seq = packet.getSeq();
        if (seq != lastSeq + 1) {
            throw new DecryptionException("Unexpected seq " + seq + ", expected " + (lastSeq + 1));
        }
        String aad = PacketCodec.aadFor(conversationId, seq);
        if (!aad.equals(packet.getAad())) {
            throw new DecryptionException("AAD mismatch for seq " + seq);
        }

        byte[] iv = base64(packet.getIv(), "iv");
        byte[] ciphertext = base64(packet.getCiphertext(), "ciphertext");
        if (iv.length != EncryptionUtils.GCM_IV_LENGTH) {
            throw new DecryptionException("Invalid IV length " + iv.length + " for seq " + seq);
        }

        byte[] plain;
        try {
            plain = cipher.open(iv, ciphertext, aad.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            logger.warn("Rejected stream packet seq={} for conversation {}", seq, conversationId);
            throw new DecryptionException("Packet " + seq + " failed authentication", e);
        }
        lastSeq = seq;
        return new String(plain, StandardCharsets.UTF_8);
    }

    /** Sequence number of the last accepted packet; 0 before the first. */
    public long getLastSeq() {
        return lastSeq;
    }

    private static byte[] base64(String value, String field) {
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Field '" + field + "' is not valid base64", e);
        }
    }
}
