package com.tthblock.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class ConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    private final File configFile;
    private final Gson gson;
    private volatile Configuration configuration;

    public ConfigManager(File toolsDir) {
        // Liegt zentral im tools-Ordner
        this.configFile = new File(toolsDir, "config.json");
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        load();
    }

    public Configuration getConfig() {
        return configuration;
    }

    public File getConfigFile() {
        return configFile;
    }

    public synchronized void saveConfig() {
        File parent = configFile.getParentFile();
        if (parent != null && !parent.exists()) parent.mkdirs();
        Configuration current = this.configuration;
        if (current == null) {
            logger.warn("No configuration loaded, nothing to save");
            return;
        }
        try (Writer writer = Files.newBufferedWriter(configFile.toPath(), StandardCharsets.UTF_8)) {
            // Toggles werden parallel gelesen und geschrieben
            synchronized (current) {
                gson.toJson(current, writer);
            }
            logger.debug("Configuration saved to disk.");
        } catch (IOException e) {
            logger.error("Failed to save config", e);
        }
    }

    public void updateConfig(Configuration newConfig) {
        this.configuration = newConfig;
        saveConfig();
    }

    /**
     * Re-reads config.json, e.g. after the file was edited by hand.
     */
    public synchronized void reload() {
        load();
    }

    private void load() {
        if (!configFile.exists()) {
            configuration = new Configuration();
            logger.info("No config file found. Created default configuration.");
            saveConfig(); // Defaults schreiben
            return;
        }

        try (Reader r = new FileReader(configFile, StandardCharsets.UTF_8)) {
            Configuration loaded = gson.fromJson(r, Configuration.class);
            if (loaded == null) {
                logger.warn("Config file {} is empty, recreating with defaults", configFile);
                configuration = new Configuration();
                saveConfig();
                return;
            }
            if (loaded.blocklists == null) loaded.blocklists = new java.util.LinkedHashMap<>();
            configuration = loaded;
            logger.info("Configuration loaded.");
        } catch (JsonParseException e) {
            logger.error("Invalid JSON in config file {}, resetting to defaults", configFile, e);
            configuration = new Configuration();
            saveConfig();
        } catch (IOException e) {
            logger.error("Failed to load configuration, using defaults", e);
            configuration = new Configuration();
        }
    }
}
