/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.cueclock.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.time.Duration;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link RuntimeConfig}.
 */
class RuntimeConfigTest {

    @Test
    void testDefaults() {
        RuntimeConfig config = RuntimeConfig.defaults();

        assertEquals(Duration.ofSeconds(1), config.pollInterval());
        assertEquals(Duration.ofSeconds(10), config.internalCallTimeout());
        assertEquals(Duration.ofSeconds(2), config.companionTimeout());
        assertEquals("http://127.0.0.1:8888", config.companionBaseUrl());
        assertFalse(config.debug());
    }

    @Test
    void testOutOfRangeValuesAreClamped() {
        RuntimeConfig config = new RuntimeConfig(Duration.ofSeconds(600), Duration.ZERO, " 10.0.0.7 ", 9000,
                Duration.ofSeconds(90), true);

        assertEquals(Duration.ofSeconds(60), config.pollInterval());
        assertEquals(Duration.ofSeconds(1), config.internalCallTimeout());
        assertEquals(Duration.ofSeconds(30), config.companionTimeout());
        assertEquals("http://10.0.0.7:9000", config.companionBaseUrl());
    }

    @Test
    void testInvalidPortFallsBackToDefault() {
        assertEquals(8888, new RuntimeConfig(null, null, null, 0, null, false).companionPort());
        assertEquals(8888, new RuntimeConfig(null, null, null, 70000, null, false).companionPort());
    }

    @Test
    void testEqualValuesAreEqual() {
        assertEquals(new RuntimeConfig(Duration.ofSeconds(5), null, "", 8888, null, false), new RuntimeConfig(
                Duration.ofSeconds(5), Duration.ofSeconds(10), "127.0.0.1", 8888, Duration.ofSeconds(2), false));
    }
}
