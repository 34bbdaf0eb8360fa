package com.tthblock.core.config;

import java.util.LinkedHashMap;
import java.util.Map;

public class Configuration {
    // --- Haupteinstellungen ---
    public String blocklistDir = "blocklists";

    // --- Remote Updates ---
    public int updateIntervalMinutes = 60;
    public int syncAttempts = 3;
    public long syncRetryDelayMillis = 1000;
    public int httpTimeoutSeconds = 30;

    // --- Directory Watcher ---
    public boolean watchEnabled = true;
    public long watchDebounceMillis = 2000;

    // --- Blocklist Steuerung (Aktivieren/Deaktivieren) ---
    // Key = Dateiname (z.B. "internal_blocklist.json"), Value = Aktiviert.
    // Zugriff nur über die synchronisierten Methoden, gelesen wird von mehreren Threads
    public Map<String, Boolean> blocklists = new LinkedHashMap<>();

    // Neu entdeckte Dateien sofort laden?
    public boolean autoEnableNewBlocklists = true;

    public synchronized boolean isBlocklistEnabled(String name) {
        Boolean enabled = blocklists.get(name);
        return enabled == null || enabled;
    }

    public synchronized void setBlocklistEnabled(String name, boolean enabled) {
        blocklists.put(name, enabled);
    }

    /**
     * Adds a toggle for {@code name} unless one exists already.
     *
     * @return true if the toggle was added
     */
    public synchronized boolean addBlocklistIfAbsent(String name, boolean enabled) {
        if (blocklists.containsKey(name)) return false;
        blocklists.put(name, enabled);
        return true;
    }

    public synchronized boolean hasBlocklistToggle(String name) {
        return blocklists.containsKey(name);
    }
}
