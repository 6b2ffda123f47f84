package com.suhana.stream;

import com.suhana.config.CryptoConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BatchingPolicyTest {

    @Test
    void fromConfigUsesDefaults() {
        BatchingPolicy p = BatchingPolicy.from(new CryptoConfig.StreamConfig());

        assertEquals(20, p.getMaxTokens());
        assertEquals(2048, p.getMaxBytes());
        assertEquals(40, p.getMaxDelayMs());
    }

    @Test
    void triggers() {
        BatchingPolicy p = new BatchingPolicy(2, 10, 40);

        assertFalse(p.sizeReached(1, 9));
        assertTrue(p.sizeReached(2, 0));
        assertTrue(p.sizeReached(0, 10));
        assertFalse(p.delayReached(39_999_999L));
        assertTrue(p.delayReached(40_000_000L));
    }

    @Test
    void invalidThresholdsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BatchingPolicy(0, 10, 40));
        assertThrows(IllegalArgumentException.class, () -> new BatchingPolicy(1, 0, 40));
        assertThrows(IllegalArgumentException.class, () -> new BatchingPolicy(1, 10, -1));
    }
}
