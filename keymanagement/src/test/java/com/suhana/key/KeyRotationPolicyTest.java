package com.suhana.key;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class KeyRotationPolicyTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    @Test
    void dueOnlyAfterInterval() throws Exception {
        KeyRecord key = KeyRecord.generate(Clock.fixed(T0, ZoneOffset.UTC));
        KeyRotationPolicy policy = new KeyRotationPolicy(Duration.ofDays(90));

        assertFalse(policy.isDue(key, T0));
        assertFalse(policy.isDue(key, T0.plus(Duration.ofDays(90))));
        assertTrue(policy.isDue(key, T0.plus(Duration.ofDays(90)).plusSeconds(1)));
    }

    @Test
    void defaultIntervalIsNinetyDays() {
        assertEquals(Duration.ofDays(90), KeyRotationPolicy.DEFAULT_INTERVAL);
    }
}
