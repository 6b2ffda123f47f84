package com.suhana.stream;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

class StreamKeyDeriverTest {

    private static final byte[] SECRET = "k".repeat(32).getBytes(StandardCharsets.UTF_8);

    @Test
    void knownAnswerVector() {
        byte[] secret = "shared-secret-for-tests".getBytes(StandardCharsets.UTF_8);

        assertEquals("b30cb6878300447606276a023f05d92410b8b5feaeb7a3ff93dc137af98704aa",
                HexFormat.of().formatHex(StreamKeyDeriver.derive(secret, "conv-42").keyBytes()));
    }

    @Test
    void derivationIsDeterministic() {
        assertArrayEquals(StreamKeyDeriver.derive(SECRET, "abc").keyBytes(),
                StreamKeyDeriver.derive(SECRET, "abc").keyBytes());
    }

    @Test
    void keyDependsOnConversationAndSecret() {
        byte[] a = StreamKeyDeriver.derive(SECRET, "abc").keyBytes();

        assertFalse(java.util.Arrays.equals(a, StreamKeyDeriver.derive(SECRET, "abd").keyBytes()));
        assertFalse(java.util.Arrays.equals(a,
                StreamKeyDeriver.derive("other".getBytes(StandardCharsets.UTF_8), "abc").keyBytes()));
        assertEquals(32, a.length);
    }

    @Test
    void emptySecretIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> StreamKeyDeriver.derive(new byte[0], "abc"));
    }
}
