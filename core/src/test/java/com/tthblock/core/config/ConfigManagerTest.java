package com.tthblock.core.config;

import com.tthblock.test.TestBase;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.nio.file.Files;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigManager
 */
class ConfigManagerTest extends TestBase {

    @Test
    void testConfigLoad() {
        ConfigManager manager = new ConfigManager(tempDir.toFile());

        assertNotNull(manager.getConfig(), "Configuration should not be null");
        assertTrue(manager.getConfigFile().exists(), "Defaults should be written");
        assertEquals("blocklists", manager.getConfig().blocklistDir);
        assertEquals(60, manager.getConfig().updateIntervalMinutes);
        assertEquals(3, manager.getConfig().syncAttempts);
    }

    @Test
    void testBlocklistToggleSurvivesReload() {
        ConfigManager manager = new ConfigManager(tempDir.toFile());
        manager.getConfig().setBlocklistEnabled("remote.json", false);
        manager.saveConfig();

        ConfigManager reopened = new ConfigManager(tempDir.toFile());

        assertFalse(reopened.getConfig().isBlocklistEnabled("remote.json"));
        assertTrue(reopened.getConfig().isBlocklistEnabled("unknown.json"), "Unknown lists default to enabled");
    }

    @Test
    void testInvalidJsonFallsBackToDefaults() throws Exception {
        File file = new File(tempDir.toFile(), "config.json");
        Files.writeString(file.toPath(), "{ \"updateIntervalMinutes\": ");

        ConfigManager manager = new ConfigManager(tempDir.toFile());

        assertEquals(60, manager.getConfig().updateIntervalMinutes);
        assertTrue(Files.readString(file.toPath()).contains("updateIntervalMinutes"), "Defaults should be rewritten");
    }

    @Test
    void testEmptyFileFallsBackToDefaults() throws Exception {
        Files.writeString(tempDir.resolve("config.json"), "");

        ConfigManager manager = new ConfigManager(tempDir.toFile());

        assertNotNull(manager.getConfig());
        assertNotNull(manager.getConfig().blocklists);
    }

    @Test
    void testReloadPicksUpManualEdit() throws Exception {
        ConfigManager manager = new ConfigManager(tempDir.toFile());
        Files.writeString(manager.getConfigFile().toPath(), "{ \"updateIntervalMinutes\": 15 }");

        manager.reload();

        assertEquals(15, manager.getConfig().updateIntervalMinutes);
        assertNotNull(manager.getConfig().blocklists);
    }
}
