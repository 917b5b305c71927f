package com.testbed.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TestbedConfigTest {

    @Test
    void builder_appliesDefaults() {
        TestbedConfig config = TestbedConfig.builder().build();

        assertEquals(Path.of("/var/tmp/testbed"), config.getWorkdirRoot());
        assertEquals(Path.of("/opt/testbed/plugins"), config.getPluginsDir());
        assertNull(config.getScriptsDir());
        assertFalse(config.isExitFirst());
        assertEquals("5m", config.getDefaultDuration());
    }

    @Test
    void builder_blankDurationFallsBackToDefault() {
        TestbedConfig config = TestbedConfig.builder().defaultDuration("  ").exitFirst(true).build();

        assertEquals(TestbedConfig.DEFAULT_DURATION, config.getDefaultDuration());
        assertTrue(config.isExitFirst());
    }
}
