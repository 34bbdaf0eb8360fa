package com.tthblock.core.blocklist;

import com.google.gson.JsonParseException;
import com.tthblock.api.NotificationSink;
import com.tthblock.api.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * The set of blocked TTHs, i.e. the union of all enabled sources, plus a reverse index
 * of which source contributed which TTH.
 * <p>
 * Readers are lock-free: they look at an immutable {@link Snapshot} which writers
 * replace as a whole. Writers (full reload, per-source reconciliation, incremental
 * appends) are serialized on one lock, build the next snapshot from the current one
 * and publish it with a single reference swap. A reader therefore sees a source either
 * fully old or fully new.
 */
public class MembershipCache {
    private static final Logger logger = LoggerFactory.getLogger(MembershipCache.class);

    static final class Snapshot {
        static final Snapshot EMPTY = new Snapshot(Collections.emptySet(), Collections.emptyMap());

        final Set<String> blocked;
        final Map<String, Set<String>> bySource;

        Snapshot(Set<String> blocked, Map<String, Set<String>> bySource) {
            this.blocked = blocked;
            this.bySource = bySource;
        }

        /**
         * Copy with the contribution of {@code name} replaced by {@code fresh}
         * (or dropped if {@code fresh} is null). TTHs that another source still
         * contributes stay blocked.
         */
        Snapshot replace(String name, Set<String> fresh) {
            Map<String, Set<String>> nextBySource = new LinkedHashMap<>(bySource);
            Set<String> old = nextBySource.remove(name);
            Set<String> nextBlocked = new HashSet<>(blocked);
            if (old != null) {
                for (String tth : old) {
                    if (!containedElsewhere(nextBySource, tth)) nextBlocked.remove(tth);
                }
            }
            if (fresh != null) {
                nextBySource.put(name, Collections.unmodifiableSet(fresh));
                nextBlocked.addAll(fresh);
            }
            return new Snapshot(Collections.unmodifiableSet(nextBlocked), Collections.unmodifiableMap(nextBySource));
        }

        private static boolean containedElsewhere(Map<String, Set<String>> bySource, String tth) {
            for (Set<String> ids : bySource.values()) {
                if (ids.contains(tth)) return true;
            }
            return false;
        }
    }

    private final SourceRegistry registry;
    private final NotificationSink notifier;
    private final Predicate<BlocklistSource> defaultEnabled;

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);
    private final Object writeLock = new Object();

    // Stand der Datei beim letzten Laden, nur unter writeLock benutzt
    private final Map<String, FileStamp> processedStamps = new HashMap<>();

    public MembershipCache(SourceRegistry registry, NotificationSink notifier, Predicate<BlocklistSource> defaultEnabled) {
        this.registry = registry;
        this.notifier = notifier;
        this.defaultEnabled = defaultEnabled;
    }

    // --- Read path ---

    /**
     * O(1) membership test against the current snapshot. Never blocks.
     */
    public boolean query(String tth) {
        return tth != null && snapshot.get().blocked.contains(tth);
    }

    public int size() {
        return snapshot.get().blocked.size();
    }

    public Set<String> getSourceIds(String name) {
        Set<String> ids = snapshot.get().bySource.get(name);
        return ids == null ? Collections.emptySet() : ids;
    }

    public boolean isLoaded(String name) {
        return snapshot.get().bySource.containsKey(name);
    }

    public Collection<String> getLoadedSources() {
        return snapshot.get().bySource.keySet();
    }

    /**
     * Change token (version or updated_at) of the source as last loaded or fetched.
     */
    public String getVersionToken(String name) {
        return registry.getVersionToken(name);
    }

    // --- Write path ---

    public void fullReload() {
        fullReload(defaultEnabled);
    }

    /**
     * Rebuilds the whole cache from the registry's known sources. Meant for start-up
     * and for wholesale settings changes; steady-state updates go through
     * {@link #reconcileOne(String, Predicate)}.
     */
    public void fullReload(Predicate<BlocklistSource> enabled) {
        synchronized (writeLock) {
            Snapshot next = Snapshot.EMPTY;
            processedStamps.clear();
            for (BlocklistSource source : registry.getSources()) {
                if (!isEnabled(source, enabled)) {
                    logger.info("Blocklist {} disabled in settings, skipping load", source.getName());
                    continue;
                }
                FileStamp stamp = FileStamp.of(source.getPath());
                Set<String> ids = loadIds(source);
                if (ids == null) continue;
                next = next.replace(source.getName(), ids);
                if (stamp != null) processedStamps.put(source.getName(), stamp);
            }
            snapshot.set(next);
            logger.info("Blocklist cache loaded: {} TTH(s) from {} source(s)", next.blocked.size(), next.bySource.size());
        }
    }

    public boolean reconcileOne(String name) {
        return reconcileOne(name, defaultEnabled);
    }

    /**
     * Brings one source up to date: its previous contribution is removed and, if the file
     * still exists, is valid and the source is enabled, it is parsed and merged again.
     * Both steps are published as one snapshot.
     * <p>
     * A request is a no-op if the file stamp has not changed since the last load and the
     * loaded state already matches the enabled state.
     *
     * @return true if the source was (re)loaded
     */
    public boolean reconcileOne(String name, Predicate<BlocklistSource> enabled) {
        synchronized (writeLock) {
            Snapshot current = snapshot.get();
            boolean loaded = current.bySource.containsKey(name);

            FileStamp onDisk = FileStamp.of(registry.pathOf(name));
            BlocklistSource known = registry.getSource(name);
            if (loaded && onDisk != null && known != null && onDisk.equals(processedStamps.get(name))
                    && isEnabled(known, enabled)) {
                logger.debug("Skipping reload for {}: no change since last update ({})", name, onDisk);
                return false;
            }

            BlocklistSource source = registry.refresh(name);
            Set<String> fresh = null;
            FileStamp stamp = null;
            if (source == null) {
                logger.debug("Blocklist {} is missing or invalid, not reloaded", name);
            } else if (!isEnabled(source, enabled)) {
                logger.info("Blocklist {} is disabled, not reloaded", name);
            } else {
                stamp = FileStamp.of(source.getPath());
                fresh = loadIds(source);
            }

            if (fresh == null && !loaded) {
                processedStamps.remove(name);
                return false;
            }

            Snapshot next = current.replace(name, fresh);
            snapshot.set(next);
            if (fresh != null && stamp != null) {
                processedStamps.put(name, stamp);
            } else {
                processedStamps.remove(name);
            }
            if (loaded) {
                logger.info("Unloaded {} TTH(s) from {}", current.bySource.get(name).size(), name);
            }
            return fresh != null;
        }
    }

    /**
     * Drops the contribution of a source without looking at its file, e.g. after the
     * file was deleted or failed a re-scan.
     *
     * @return true if the source had been loaded
     */
    public boolean unload(String name) {
        synchronized (writeLock) {
            Snapshot current = snapshot.get();
            Set<String> old = current.bySource.get(name);
            processedStamps.remove(name);
            if (old == null) return false;
            snapshot.set(current.replace(name, null));
            logger.info("Unloaded {} TTH(s) from {}", old.size(), name);
            return true;
        }
    }

    /**
     * Folds TTHs that were just written to a source's file into the cache without
     * re-reading the file. Only possible while the source is loaded.
     *
     * @param stamp the file's stamp right after the write
     * @return false if the source is not loaded and needs a regular reconciliation instead
     */
    public boolean addToSource(String name, Collection<String> tths, FileStamp stamp) {
        synchronized (writeLock) {
            Snapshot current = snapshot.get();
            Set<String> existing = current.bySource.get(name);
            if (existing == null) return false;
            Set<String> merged = new HashSet<>(existing);
            merged.addAll(tths);
            snapshot.set(current.replace(name, merged));
            if (stamp != null) processedStamps.put(name, stamp);
            return true;
        }
    }

    private Set<String> loadIds(BlocklistSource source) {
        String name = source.getName();
        try {
            BlocklistDocument doc = BlocklistDocument.from(BlocklistFiles.read(source.getPath()));
            if (!doc.hasEntryArray()) {
                logger.error("Invalid format in {}, skipping", name);
                notifier.post(Severity.ERROR, "Invalid format in blocklist " + name + ": 'tths' is not an array");
                return null;
            }
            Set<String> ids = new HashSet<>(doc.validTths(name));
            registry.setVersionToken(name, doc.getChangeToken());
            logger.info("Loaded {} TTH(s) from {} blocklist {} (version: {}, description: {})",
                    ids.size(), source.getTypeLabel(), name,
                    doc.getVersion() == null ? "none" : doc.getVersion(),
                    doc.getDescription() == null ? "none" : doc.getDescription());
            return ids;
        } catch (IOException | JsonParseException e) {
            logger.error("Failed to load blocklist {}", name, e);
            notifier.post(Severity.ERROR, "Failed to load blocklist " + name + ": " + e.getMessage());
            return null;
        }
    }

    private boolean isEnabled(BlocklistSource source, Predicate<BlocklistSource> enabled) {
        try {
            return enabled.test(source);
        } catch (RuntimeException e) {
            logger.error("Settings unavailable for {}, treating it as disabled", source.getName(), e);
            notifier.post(Severity.ERROR, "Settings are invalid, skipping blocklist " + source.getName());
            return false;
        }
    }
}
