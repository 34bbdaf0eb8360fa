package com.tthblock.core.config;

import com.tthblock.api.BlocklistSettings;
import com.tthblock.core.blocklist.SourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * {@link BlocklistSettings} backed by config.json.
 */
public class ConfigBlocklistSettings implements BlocklistSettings {
    private static final Logger logger = LoggerFactory.getLogger(ConfigBlocklistSettings.class);

    private final ConfigManager configManager;

    public ConfigBlocklistSettings(ConfigManager configManager) {
        this.configManager = configManager;
    }

    @Override
    public boolean isEnabled(String sourceName) {
        Configuration config = configManager.getConfig();
        if (config == null) throw new IllegalStateException("Configuration is not available");
        return config.isBlocklistEnabled(sourceName);
    }

    @Override
    public int getUpdateIntervalMinutes() {
        Configuration config = configManager.getConfig();
        if (config == null) return 60;
        return Math.max(ConfigValidator.MIN_UPDATE_INTERVAL_MINUTES, config.updateIntervalMinutes);
    }

    @Override
    public void registerKnownSources(Collection<String> sourceNames) {
        Configuration config = configManager.getConfig();
        if (config == null) {
            logger.warn("Configuration is not available, cannot register {}", sourceNames);
            return;
        }
        boolean changed = false;
        for (String name : sourceNames) {
            changed |= config.addBlocklistIfAbsent(name, true);
        }
        if (changed) configManager.saveConfig();
    }

    @Override
    public void registerNewSources(Collection<String> sourceNames) {
        Configuration config = configManager.getConfig();
        if (config == null) {
            logger.warn("Configuration is not available, cannot register {}", sourceNames);
            return;
        }
        boolean changed = false;
        for (String name : sourceNames) {
            // Die interne Liste wird nie automatisch abgeschaltet
            boolean enabled = config.autoEnableNewBlocklists || SourceRegistry.INTERNAL_BLOCKLIST.equals(name);
            if (config.addBlocklistIfAbsent(name, enabled)) {
                logger.info("✨ New blocklist discovered: {} (enabled: {})", name, enabled);
                changed = true;
            }
        }
        if (changed) configManager.saveConfig();
    }
}
