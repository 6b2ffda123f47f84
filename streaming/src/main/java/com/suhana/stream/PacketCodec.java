package com.suhana.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.suhana.common.DecryptionException;
import com.suhana.common.EncryptionException;

import java.util.Objects;

/**
 * NDJSON framing: one compact JSON object per packet, terminated by {@code \n}.
 */
public final class PacketCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

    private PacketCodec() {}

    /** {@code cid=<conversationId>;seq=<seq>} */
    public static String aadFor(String conversationId, long seq) {
        Objects.requireNonNull(conversationId, "conversationId");
        return "cid=" + conversationId + ";seq=" + seq;
    }

    public static String toLine(Packet packet) {
        try {
            return MAPPER.writeValueAsString(packet) + "\n";
        } catch (JsonProcessingException e) {
            throw new EncryptionException("Failed to serialize packet " + packet.getSeq(), e);
        }
    }

    /**
     * Parses one line (a trailing newline is allowed).
     *
     * @throws DecryptionException if the line is not a packet object
     */
    public static Packet parse(String line) {
        Objects.requireNonNull(line, "line");
        try {
            Packet p = MAPPER.readValue(line.trim(), Packet.class);
            if (p == null) throw new DecryptionException("Empty packet line");
            return p;
        } catch (JsonProcessingException e) {
            throw new DecryptionException("Malformed packet: " + e.getOriginalMessage(), e);
        }
    }
}
