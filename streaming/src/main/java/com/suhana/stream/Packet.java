package com.suhana.stream;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One encrypted batch on the wire.
 *
 * type       = always "ciphertext"
 * seq        = 1-based, one per packet within a session
 * iv         = base64 of the 12-byte AES-GCM nonce
 * ciphertext = base64 of ciphertext || tag
 * aad        = "cid=<conversationId>;seq=<seq>", bound into the AEAD
 */
@JsonPropertyOrder({"type", "seq", "iv", "ciphertext", "aad"})
public final class Packet {
    public static final String TYPE_CIPHERTEXT = "ciphertext";

    private final String type;
    private final Long seq;
    private final String iv;
    private final String ciphertext;
    private final String aad;

    @JsonCreator
    public Packet(@JsonProperty("type") String type,
                  @JsonProperty("seq") Long seq,
                  @JsonProperty("iv") String iv,
                  @JsonProperty("ciphertext") String ciphertext,
                  @JsonProperty("aad") String aad) {
        this.type = type;
        this.seq = seq;
        this.iv = iv;
        this.ciphertext = ciphertext;
        this.aad = aad;
    }

    @JsonProperty("type")
    public String getType() { return type; }

    @JsonProperty("seq")
    public Long getSeq() { return seq; }

    @JsonProperty("iv")
    public String getIv() { return iv; }

    @JsonProperty("ciphertext")
    public String getCiphertext() { return ciphertext; }

    @JsonProperty("aad")
    public String getAad() { return aad; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Packet)) return false;
        Packet p = (Packet) o;
        return Objects.equals(type, p.type) && Objects.equals(seq, p.seq) && Objects.equals(iv, p.iv)
                && Objects.equals(ciphertext, p.ciphertext) && Objects.equals(aad, p.aad);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, seq, iv, ciphertext, aad);
    }

    @Override
    public String toString() {
        return "Packet{seq=" + seq + ", aad=" + aad + "}";
    }
}
