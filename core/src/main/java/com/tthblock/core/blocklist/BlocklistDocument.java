package com.tthblock.core.blocklist;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.tthblock.common.util.TthValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Typed, lenient view of a blocklist JSON file:
 * <pre>
 * { "url": ..., "version": ..., "updated_at": ..., "description": ..., "tths": [ {"tth": ...}, ... ] }
 * </pre>
 * Fields of the wrong type read as absent. A "tths" member that is not an array
 * reads as {@code null} entries so callers can tell "empty" from "malformed".
 */
public class BlocklistDocument {
    private static final Logger logger = LoggerFactory.getLogger(BlocklistDocument.class);

    public static final String DEFAULT_VERSION = "1.0.0";

    private final String url;
    private final String version;
    private final String updatedAt;
    private final String description;
    private final List<BlocklistEntry> entries;

    BlocklistDocument(String url, String version, String updatedAt, String description, List<BlocklistEntry> entries) {
        this.url = url;
        this.version = version;
        this.updatedAt = updatedAt;
        this.description = description;
        this.entries = entries;
    }

    public static BlocklistDocument from(JsonObject root) {
        List<BlocklistEntry> entries = null;
        JsonElement tths = root.get("tths");
        if (tths != null && tths.isJsonArray()) {
            entries = new ArrayList<>();
            for (JsonElement el : tths.getAsJsonArray()) {
                if (!el.isJsonObject()) continue;
                JsonObject item = el.getAsJsonObject();
                String tth = optString(item, "tth");
                if (tth == null || tth.isEmpty()) continue;
                entries.add(new BlocklistEntry(tth, optString(item, "comment"), optString(item, "timestamp")));
            }
        }
        return new BlocklistDocument(
                optString(root, "url"),
                optString(root, "version"),
                optString(root, "updated_at"),
                optString(root, "description"),
                entries);
    }

    /**
     * Minimal valid structure written for new, empty or corrupt files.
     */
    public static JsonObject createDefault(boolean internal, String baseName) {
        JsonObject root = new JsonObject();
        if (internal) {
            root.addProperty("url", BlocklistUrls.INTERNAL);
        } else {
            root.add("url", JsonNull.INSTANCE);
        }
        root.addProperty("version", internal ? BlocklistUrls.INTERNAL : DEFAULT_VERSION);
        root.addProperty("updated_at", Instant.now().toString());
        root.addProperty("description", internal ? BlocklistUrls.INTERNAL : baseName);
        root.add("tths", new JsonArray());
        return root;
    }

    static String optString(JsonObject obj, String key) {
        JsonElement el = obj.get(key);
        if (el == null || el.isJsonNull() || !el.isJsonPrimitive()) return null;
        return el.getAsString();
    }

    public String getUrl() {
        return url;
    }

    public String getVersion() {
        return version;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }

    public String getDescription() {
        return description;
    }

    public boolean hasEntryArray() {
        return entries != null;
    }

    public List<BlocklistEntry> getEntries() {
        return entries == null ? Collections.emptyList() : Collections.unmodifiableList(entries);
    }

    /**
     * Token used to detect a real content change: a non-empty version wins over updated_at.
     */
    public String getChangeToken() {
        return changeToken(version, updatedAt);
    }

    static String changeToken(String version, String updatedAt) {
        if (version != null && !version.isEmpty()) return version;
        if (updatedAt != null && !updatedAt.isEmpty()) return updatedAt;
        return null;
    }

    public boolean hasValidTth() {
        for (BlocklistEntry e : getEntries()) {
            if (TthValidator.isValid(e.getTth())) return true;
        }
        return false;
    }

    /**
     * The valid identifiers in file order. Invalid ones are logged and dropped.
     */
    public Set<String> validTths(String sourceName) {
        Set<String> result = new LinkedHashSet<>();
        for (BlocklistEntry e : getEntries()) {
            if (TthValidator.isValid(e.getTth())) {
                result.add(e.getTth());
            } else {
                logger.warn("[{}] {}", sourceName, TthValidator.describeInvalid(e.getTth()));
            }
        }
        return result;
    }
}
