package com.tthblock.api;

import java.util.Collection;

/**
 * Read side of the host's settings store, as far as the blocklist core needs it.
 */
public interface BlocklistSettings {

    /**
     * Whether the named source should be loaded. Unknown names are enabled.
     */
    boolean isEnabled(String sourceName);

    /**
     * Interval of the remote update timer in minutes, never below 1.
     */
    int getUpdateIntervalMinutes();

    /**
     * Called at start-up with the sources already on disk. Sources without a toggle
     * get one that is switched on.
     */
    void registerKnownSources(Collection<String> sourceNames);

    /**
     * Called when the directory watcher finds source files that were not known before,
     * so the host can surface them as new toggles.
     */
    void registerNewSources(Collection<String> sourceNames);
}
