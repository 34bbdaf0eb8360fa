package com.tthblock.core.blocklist;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.tthblock.api.BlocklistSettings;
import com.tthblock.api.NotificationSink;
import com.tthblock.api.Severity;
import com.tthblock.common.util.TthValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Appends TTHs picked by the user to the internal (writable) blocklist and makes them
 * effective immediately.
 */
public class InternalBlocklistEditor {
    private static final Logger logger = LoggerFactory.getLogger(InternalBlocklistEditor.class);

    private final SourceRegistry registry;
    private final MembershipCache cache;
    private final BlocklistSettings settings;
    private final NotificationSink notifier;

    public InternalBlocklistEditor(SourceRegistry registry, MembershipCache cache, BlocklistSettings settings,
                                   NotificationSink notifier) {
        this.registry = registry;
        this.cache = cache;
        this.settings = settings;
        this.notifier = notifier;
    }

    public AppendResult appendIdentifiers(List<String> tths) {
        List<BlocklistEntry> entries = new ArrayList<>();
        for (String tth : tths) entries.add(BlocklistEntry.of(tth));
        return appendEntries(entries);
    }

    public synchronized AppendResult appendEntries(List<BlocklistEntry> newEntries) {
        String name = registry.getInternalName();
        boolean enabled;
        try {
            enabled = settings.isEnabled(name);
        } catch (RuntimeException e) {
            logger.error("Settings object is invalid, cannot add to blocklist", e);
            notifier.post(Severity.ERROR, "Cannot add TTHs to blocklist: settings are invalid");
            return AppendResult.of(AppendResult.Status.FAILED);
        }
        if (!enabled) {
            logger.info("Internal blocklist is disabled, skipping TTH addition");
            notifier.post(Severity.WARNING, "Internal blocklist is disabled. Enable it in the settings to add TTHs");
            return AppendResult.of(AppendResult.Status.DISABLED);
        }

        String now = Instant.now().toString();
        List<BlocklistEntry> accepted = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (BlocklistEntry entry : newEntries) {
            if (entry == null) continue;
            String tth = entry.getTth();
            if (!TthValidator.isValid(tth)) {
                logger.warn(TthValidator.describeInvalid(tth));
                continue;
            }
            if (cache.query(tth) || !seen.add(tth)) {
                logger.info("TTH {} already in blocklist, skipping", tth);
                continue;
            }
            accepted.add(entry.withTimestamp(now));
        }

        if (accepted.isEmpty()) {
            logger.info("No valid TTHs to add");
            notifier.post(Severity.WARNING, "No valid TTHs to add. Ensure selected items are files and fully loaded");
            return AppendResult.of(AppendResult.Status.NOTHING_ADDED);
        }

        Path path = registry.getInternalPath();
        JsonObject root = readOrDefault(path);
        JsonArray tths = root.getAsJsonArray("tths");
        List<String> added = new ArrayList<>();
        for (BlocklistEntry entry : accepted) {
            tths.add(entry.toJson());
            added.add(entry.getTth());
        }
        root.addProperty("updated_at", now);

        try {
            BlocklistFiles.write(path, root);
        } catch (IOException e) {
            logger.error("Failed to write blocklist file {}", path, e);
            notifier.post(Severity.ERROR, "Failed to write to internal blocklist: " + e.getMessage());
            return AppendResult.of(AppendResult.Status.FAILED);
        }

        FileStamp stamp = FileStamp.of(path);
        registry.recordWrite(name, stamp);
        if (!cache.addToSource(name, added, stamp)) {
            // Liste war noch nicht geladen: normaler Abgleich
            cache.reconcileOne(name);
        }

        logger.info("Added {} TTH(s) to {}", added.size(), path);
        notifier.post(Severity.INFO, "Added " + added.size() + " TTH(s) to internal blocklist: " + String.join(", ", added));
        return AppendResult.added(added);
    }

    private JsonObject readOrDefault(Path path) {
        JsonObject def = BlocklistDocument.createDefault(true, SourceRegistry.baseName(registry.getInternalName()));
        if (!Files.exists(path)) return def;
        try {
            String text = Files.readString(path);
            if (text.trim().isEmpty()) return def;
            JsonObject root = BlocklistFiles.parse(text);
            JsonElement tths = root.get("tths");
            if (tths == null || !tths.isJsonArray()) {
                logger.warn("Invalid blocklist format in {}, resetting tths", path);
                root.add("tths", new JsonArray());
            }
            return root;
        } catch (IOException | JsonParseException e) {
            logger.warn("Could not read {}, starting from the default structure", path, e);
            return def;
        }
    }
}
