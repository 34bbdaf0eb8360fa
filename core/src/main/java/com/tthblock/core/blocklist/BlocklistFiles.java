package com.tthblock.core.blocklist;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reading and writing blocklist files.
 * <p>
 * Writes go to a work file next to the target which is then moved over it, so readers
 * (and the directory watcher) never see a half-written list. The work file does not end
 * in ".json" and is therefore never picked up as a source.
 */
public final class BlocklistFiles {
    static final String WORK_SUFFIX = ".tthblock-new";

    private static final Gson COMPACT = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();
    private static final Gson PRETTY = new GsonBuilder().serializeNulls().disableHtmlEscaping().setPrettyPrinting().create();

    private BlocklistFiles() {
    }

    /**
     * Parses a blocklist file.
     *
     * @throws IOException        if the file cannot be read
     * @throws JsonParseException if it is not well-formed JSON or not a JSON object
     */
    public static JsonObject read(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static JsonObject parse(String text) {
        JsonElement root = JsonParser.parseString(text);
        if (!root.isJsonObject()) {
            throw new JsonParseException("Top level element is not an object");
        }
        return root.getAsJsonObject();
    }

    public static void write(Path path, JsonObject root) throws IOException {
        Path work = path.resolveSibling(path.getFileName().toString() + WORK_SUFFIX);
        try (Writer w = Files.newBufferedWriter(work, StandardCharsets.UTF_8)) {
            w.write(format(root));
        } catch (IOException e) {
            Files.deleteIfExists(work);
            throw e;
        }
        try {
            Files.move(work, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(work, path, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(work);
            throw e;
        }
    }

    /**
     * Pretty prints {@code root} with two-space indentation, except that every element
     * of the "tths" array is kept on a single line. Large lists stay diffable that way.
     */
    public static String format(JsonObject root) {
        StringBuilder sb = new StringBuilder("{\n");
        List<Map.Entry<String, JsonElement>> members = new ArrayList<>(root.entrySet());
        for (int i = 0; i < members.size(); i++) {
            String key = members.get(i).getKey();
            JsonElement value = members.get(i).getValue();
            sb.append("  ").append(COMPACT.toJson(key)).append(": ");
            if ("tths".equals(key) && value.isJsonArray()) {
                appendEntries(sb, value.getAsJsonArray());
            } else {
                sb.append(PRETTY.toJson(value).replace("\n", "\n  "));
            }
            if (i < members.size() - 1) sb.append(',');
            sb.append('\n');
        }
        return sb.append("}\n").toString();
    }

    private static void appendEntries(StringBuilder sb, JsonArray entries) {
        if (entries.size() == 0) {
            sb.append("[]");
            return;
        }
        sb.append("[\n");
        for (int i = 0; i < entries.size(); i++) {
            sb.append("    ").append(COMPACT.toJson(entries.get(i)));
            if (i < entries.size() - 1) sb.append(',');
            sb.append('\n');
        }
        sb.append("  ]");
    }
}
