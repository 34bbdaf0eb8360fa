package com.tthblock.core.blocklist;

import com.google.gson.JsonObject;

/**
 * One line of a blocklist's "tths" array. Only the TTH reaches the cache,
 * comment and timestamp stay in the file.
 */
public class BlocklistEntry {
    private final String tth;
    private final String comment;
    private final String timestamp;

    public BlocklistEntry(String tth, String comment, String timestamp) {
        this.tth = tth;
        this.comment = comment;
        this.timestamp = timestamp;
    }

    public static BlocklistEntry of(String tth) {
        return new BlocklistEntry(tth, "", null);
    }

    public String getTth() {
        return tth;
    }

    public String getComment() {
        return comment;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public BlocklistEntry withTimestamp(String newTimestamp) {
        return new BlocklistEntry(tth, comment == null ? "" : comment, newTimestamp);
    }

    JsonObject toJson() {
        JsonObject obj = new JsonObject();
        obj.addProperty("tth", tth);
        obj.addProperty("comment", comment == null ? "" : comment);
        if (timestamp != null) obj.addProperty("timestamp", timestamp);
        return obj;
    }

    @Override
    public String toString() {
        return tth;
    }
}
