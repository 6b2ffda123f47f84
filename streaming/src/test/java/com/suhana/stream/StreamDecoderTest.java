package com.suhana.stream;

import com.suhana.common.DecryptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StreamDecoder Unit Tests")
public class StreamDecoderTest {

    private static final byte[] SECRET = "decoder-secret".getBytes(StandardCharsets.UTF_8);
    private static final String CID = "c1";

    private List<String> lines;
    private StreamDecoder decoder;

    @BeforeEach
    public void setUp() {
        StreamEncoder enc = new StreamEncoder(SECRET, CID, new BatchingPolicy(1, 2048, 60_000));
        lines = new ArrayList<>();
        enc.stream(List.of("first", "second", "third").iterator(), lines::add);
        decoder = new StreamDecoder(SECRET, CID);
    }

    private static String flipFirstByte(String b64) {
        byte[] raw = Base64.getDecoder().decode(b64);
        raw[0] ^= 0x01;
        return Base64.getEncoder().encodeToString(raw);
    }

    @Test
    @DisplayName("Test in-order packets decode")
    public void testDecodeInOrder() {
        assertEquals("first", decoder.decode(lines.get(0)));
        assertEquals("second", decoder.decode(lines.get(1)));
        assertEquals("third", decoder.decode(lines.get(2)));
        assertEquals(3, decoder.getLastSeq());
    }

    @Test
    @DisplayName("Test tampered ciphertext is rejected")
    public void testTamperedCiphertext() {
        Packet p = PacketCodec.parse(lines.get(0));
        Packet bad = new Packet(p.getType(), p.getSeq(), p.getIv(), flipFirstByte(p.getCiphertext()), p.getAad());

        assertThrows(DecryptionException.class, () -> decoder.decode(bad));
        assertEquals(0, decoder.getLastSeq());
        assertEquals("first", decoder.decode(p));
    }

    @Test
    @DisplayName("Test tampered iv is rejected")
    public void testTamperedIv() {
        Packet p = PacketCodec.parse(lines.get(0));
        Packet bad = new Packet(p.getType(), p.getSeq(), flipFirstByte(p.getIv()), p.getCiphertext(), p.getAad());

        assertThrows(DecryptionException.class, () -> decoder.decode(bad));
    }

    @Test
    @DisplayName("Test tampered aad is rejected")
    public void testTamperedAad() {
        Packet p = PacketCodec.parse(lines.get(0));

        assertThrows(DecryptionException.class, () -> decoder.decode(
                new Packet(p.getType(), p.getSeq(), p.getIv(), p.getCiphertext(), "cid=c1;seq=2")));
        assertThrows(DecryptionException.class, () -> decoder.decode(
                new Packet(p.getType(), p.getSeq(), p.getIv(), p.getCiphertext(), "cid=other;seq=1")));
    }

    @Test
    @DisplayName("Test packet moved to another seq fails authentication")
    public void testSeqRelabelled() {
        decoder.decode(lines.get(0));
        Packet third = PacketCodec.parse(lines.get(2));
        Packet relabelled = new Packet(third.getType(), 2L, third.getIv(), third.getCiphertext(), "cid=c1;seq=2");

        assertThrows(DecryptionException.class, () -> decoder.decode(relabelled));
    }

    @Test
    @DisplayName("Test replay, gap and reordering are rejected")
    public void testSequenceEnforced() {
        assertThrows(DecryptionException.class, () -> decoder.decode(lines.get(1)));
        decoder.decode(lines.get(0));
        assertThrows(DecryptionException.class, () -> decoder.decode(lines.get(0)));
        assertThrows(DecryptionException.class, () -> decoder.decode(lines.get(2)));
        assertEquals("second", decoder.decode(lines.get(1)));
    }

    @Test
    @DisplayName("Test wrong secret or conversation cannot decode")
    public void testWrongKey() {
        StreamDecoder wrongSecret = new StreamDecoder("other".getBytes(StandardCharsets.UTF_8), CID);
        StreamDecoder wrongCid = new StreamDecoder(SECRET, "c2");

        assertThrows(DecryptionException.class, () -> wrongSecret.decode(lines.get(0)));
        assertThrows(DecryptionException.class, () -> wrongCid.decode(lines.get(0)));
    }

    @Test
    @DisplayName("Test malformed packets are rejected")
    public void testMalformed() {
        Packet p = PacketCodec.parse(lines.get(0));

        assertThrows(DecryptionException.class, () -> decoder.decode("not json"));
        assertThrows(DecryptionException.class, () -> decoder.decode("{\"type\":\"ciphertext\"}"));
        assertThrows(DecryptionException.class, () -> decoder.decode(
                new Packet("plaintext", p.getSeq(), p.getIv(), p.getCiphertext(), p.getAad())));
        assertThrows(DecryptionException.class, () -> decoder.decode(
                new Packet(p.getType(), p.getSeq(), "AAAA", p.getCiphertext(), p.getAad())));
        assertThrows(DecryptionException.class, () -> decoder.decode(
                new Packet(p.getType(), p.getSeq(), "***", p.getCiphertext(), p.getAad())));
    }
}
