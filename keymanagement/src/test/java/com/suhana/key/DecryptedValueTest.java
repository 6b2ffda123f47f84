package com.suhana.key;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecryptedValueTest {

    private static DecryptedValue of(String s) {
        return new DecryptedValue(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void jsonObjectIsRecord() {
        DecryptedValue v = of("  {\"a\":1,\"b\":\"two\"}");

        assertTrue(v.isRecord());
        assertEquals(Map.of("a", 1, "b", "two"), v.value());
    }

    @Test
    void plainTextIsText() {
        DecryptedValue v = of("hello secret");

        assertFalse(v.isRecord());
        assertTrue(v.asRecord().isEmpty());
        assertEquals("hello secret", v.value());
    }

    @Test
    void brokenJsonFallsBackToText() {
        DecryptedValue v = of("{not json");

        assertFalse(v.isRecord());
        assertEquals("{not json", v.value());
    }

    @Test
    void textAfterJsonObjectKeepsWholeText() {
        DecryptedValue v = of("{\"a\":1} and the rest");

        assertFalse(v.isRecord());
        assertEquals("{\"a\":1} and the rest", v.value());
    }

    @Test
    void jsonArrayIsNotRecord() {
        assertEquals("[1,2]", of("[1,2]").value());
    }

    @Test
    void bytesAreCopied() {
        byte[] raw = {1, 2, 3};
        DecryptedValue v = new DecryptedValue(raw);

        byte[] out = v.asBytes();
        out[0] = 9;

        assertArrayEquals(new byte[]{1, 2, 3}, v.asBytes());
        assertFalse(v.toString().contains("1, 2, 3"));
    }
}
