package com.tthblock.core.blocklist;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.tthblock.api.NotificationSink;
import com.tthblock.api.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Knows which blocklist files exist in the blocklist directory and whether they are
 * structurally usable. Also keeps the per-source bookkeeping of the remote update
 * (entity tag, version token) and the stamp of the last write this process made itself.
 */
public class SourceRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SourceRegistry.class);

    public static final String INTERNAL_BLOCKLIST = "internal_blocklist.json";
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final NotificationSink notifier;

    // Austausch als Ganzes, Leser sehen immer einen vollständigen Stand
    private volatile Map<String, BlocklistSource> sources = Collections.emptyMap();

    private final Map<String, String> etags = new ConcurrentHashMap<>();
    private final Map<String, String> versionTokens = new ConcurrentHashMap<>();
    private final Map<String, FileStamp> ownWrites = new ConcurrentHashMap<>();
    // Stand der Datei, zu dem der Fehler schon gemeldet wurde
    private final Map<String, FileStamp> reportedInvalid = new ConcurrentHashMap<>();
    private static final FileStamp UNREADABLE = new FileStamp(-1, -1);

    public SourceRegistry(Path directory, NotificationSink notifier) {
        this.directory = directory;
        this.notifier = notifier;
    }

    public Path getDirectory() {
        return directory;
    }

    public String getInternalName() {
        return INTERNAL_BLOCKLIST;
    }

    public Path getInternalPath() {
        return directory.resolve(INTERNAL_BLOCKLIST);
    }

    public Path pathOf(String name) {
        return directory.resolve(name);
    }

    public static boolean isSourceFileName(String fileName) {
        return fileName != null && fileName.endsWith(SUFFIX) && fileName.length() > SUFFIX.length();
    }

    // --- Scan ---

    /**
     * Lists every "*.json" file of the blocklist directory and validates it. Invalid files
     * are left on disk but excluded from the result. The writable source is created first
     * if it does not exist yet. The result replaces the registry's known set.
     */
    public synchronized List<BlocklistSource> scanSources() {
        ensureDirectory();
        ensureInternalSource();

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) files.add(p);
            }
        } catch (IOException e) {
            logger.error("Failed to read blocklist directory {}", directory, e);
            notifier.post(Severity.ERROR, "Failed to read blocklist directory: " + e.getMessage());
            return new ArrayList<>(sources.values());
        }
        files.sort(null);
        reportedInvalid.keySet().retainAll(files.stream().map(p -> p.getFileName().toString()).collect(Collectors.toSet()));

        Map<String, BlocklistSource> found = new LinkedHashMap<>();
        for (Path file : files) {
            BlocklistSource source = describe(file);
            if (source != null) found.put(source.getName(), source);
        }
        sources = Collections.unmodifiableMap(found);

        logger.info("Found valid blocklist files: {}", found.isEmpty() ? "none" : String.join(", ", found.keySet()));
        return new ArrayList<>(found.values());
    }

    /**
     * Re-validates one source and updates its descriptor.
     *
     * @return the fresh descriptor, or null if the file is gone or no longer valid
     */
    public synchronized BlocklistSource refresh(String name) {
        Path file = pathOf(name);
        BlocklistSource source = Files.isRegularFile(file) ? describe(file) : null;
        Map<String, BlocklistSource> next = new LinkedHashMap<>(sources);
        if (source == null) {
            if (!Files.isRegularFile(file)) reportedInvalid.remove(name);
            next.remove(name);
        } else {
            next.put(name, source);
        }
        sources = Collections.unmodifiableMap(next);
        return source;
    }

    private BlocklistSource describe(Path file) {
        ValidationResult result = validateSource(file);
        if (!result.isValid()) return null;
        FileStamp stamp = FileStamp.of(file);
        if (stamp == null) return null;
        String name = file.getFileName().toString();
        if (reportedInvalid.remove(name) != null) {
            logger.info("Blocklist {} is valid again", name);
        }
        String token = BlocklistDocument.changeToken(result.getVersion(), result.getUpdatedAt());
        if (token != null) versionTokens.putIfAbsent(name, token);
        return new BlocklistSource(name, file, result, stamp, INTERNAL_BLOCKLIST.equals(name));
    }

    // --- Validation ---

    /**
     * Checks that a file can serve as a blocklist. Empty and unparsable files are reset to
     * the default structure (a repair, reported as an error for the unparsable case) and
     * count as valid. Files without an acceptable origin URL are treated as local read-only.
     * With an acceptable URL, "tths" must be an array and, when non-empty, hold at least
     * one valid TTH.
     */
    public ValidationResult validateSource(Path file) {
        String fileName = file.getFileName().toString();
        boolean internal = INTERNAL_BLOCKLIST.equals(fileName);

        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            reportInvalid(file, "Failed to read blocklist " + fileName + ": " + e.getMessage());
            return ValidationResult.invalid(null, BlocklistDocument.DEFAULT_VERSION, Instant.now().toString(), "");
        }

        if (text.trim().isEmpty()) {
            logger.info("Blocklist {} is empty, initializing", file);
            ValidationResult reset = resetToDefault(file, internal);
            if (reset.isValid()) {
                notifier.post(Severity.INFO, "Blocklist " + fileName + " was empty and has been initialized");
            }
            return reset;
        }

        JsonObject root;
        try {
            root = BlocklistFiles.parse(text);
        } catch (JsonParseException e) {
            logger.error("Failed to validate blocklist {}: {}", file, e.getMessage());
            notifier.post(Severity.ERROR, "Failed to validate blocklist " + fileName + ": " + e.getMessage()
                    + ". Resetting to default");
            return resetToDefault(file, internal);
        }

        BlocklistDocument doc = BlocklistDocument.from(root);
        String version = doc.getVersion() != null ? doc.getVersion() : BlocklistDocument.DEFAULT_VERSION;
        String updatedAt = doc.getUpdatedAt() != null ? doc.getUpdatedAt() : Instant.now().toString();
        String description = doc.getDescription() != null ? doc.getDescription() : baseName(fileName);

        if (!BlocklistUrls.isAcceptable(doc.getUrl())) {
            if (internal) {
                // Die interne Liste muss "Internal" tragen, sonst wird sie neu angelegt
                return repairInternal(file, "origin is " + doc.getUrl());
            }
            logger.debug("Treating {} as local read-only blocklist (URL: {})", fileName,
                    doc.getUrl() == null ? "none" : doc.getUrl());
            return new ValidationResult(true, null, version, updatedAt, description);
        }

        if (!doc.hasEntryArray()) {
            if (internal) return repairInternal(file, "'tths' is not an array");
            reportInvalid(file, "Invalid format in blocklist " + fileName + ": 'tths' is not an array");
            return ValidationResult.invalid(doc.getUrl(), version, updatedAt, description);
        }

        if (!doc.getEntries().isEmpty() && !doc.hasValidTth()) {
            reportInvalid(file, "No valid TTHs found in blocklist " + fileName);
            return ValidationResult.invalid(doc.getUrl(), version, updatedAt, description);
        }

        return new ValidationResult(true, doc.getUrl(), version, updatedAt, description);
    }

    /**
     * Reports a file that stays excluded, once per file stamp. A rewrite is reported anew.
     */
    private void reportInvalid(Path file, String message) {
        FileStamp stamp = FileStamp.of(file);
        if (stamp == null) stamp = UNREADABLE;
        FileStamp previous = reportedInvalid.put(file.getFileName().toString(), stamp);
        if (stamp.equals(previous)) {
            logger.debug("Still invalid, already reported: {}", message);
            return;
        }
        logger.error(message);
        notifier.post(Severity.ERROR, message);
    }

    private ValidationResult repairInternal(Path file, String reason) {
        logger.warn("Invalid format in {} ({}), initializing", file, reason);
        ValidationResult reset = resetToDefault(file, true);
        if (reset.isValid()) {
            notifier.post(Severity.ERROR, "Invalid format in internal blocklist, reset to default");
        }
        return reset;
    }

    private ValidationResult resetToDefault(Path file, boolean internal) {
        String fileName = file.getFileName().toString();
        JsonObject def = BlocklistDocument.createDefault(internal, baseName(fileName));
        try {
            BlocklistFiles.write(file, def);
            logger.info("Reset {} to default structure", file);
            BlocklistDocument doc = BlocklistDocument.from(def);
            return new ValidationResult(true, doc.getUrl(), doc.getVersion(), doc.getUpdatedAt(), doc.getDescription());
        } catch (IOException e) {
            logger.error("Failed to reset blocklist {}", file, e);
            notifier.post(Severity.ERROR, "Failed to reset blocklist " + fileName + ": " + e.getMessage());
            return ValidationResult.invalid(null, BlocklistDocument.DEFAULT_VERSION, Instant.now().toString(), "");
        }
    }

    private void ensureDirectory() {
        if (Files.isDirectory(directory)) return;
        try {
            Files.createDirectories(directory);
            logger.info("Created blocklist directory: {}", directory);
        } catch (IOException e) {
            logger.error("Failed to create blocklist directory {}", directory, e);
            notifier.post(Severity.ERROR, "Failed to create blocklist directory: " + e.getMessage());
        }
    }

    private void ensureInternalSource() {
        Path internal = getInternalPath();
        if (Files.exists(internal) || !Files.isDirectory(directory)) return;
        try {
            BlocklistFiles.write(internal, BlocklistDocument.createDefault(true, baseName(INTERNAL_BLOCKLIST)));
            logger.info("Internal blocklist not found, created {}", internal);
            notifier.post(Severity.INFO, "Internal blocklist not found, created default");
        } catch (IOException e) {
            logger.error("Failed to create internal blocklist {}", internal, e);
            notifier.post(Severity.ERROR, "Failed to create internal blocklist: " + e.getMessage());
        }
    }

    static String baseName(String fileName) {
        return fileName.endsWith(SUFFIX) ? fileName.substring(0, fileName.length() - SUFFIX.length()) : fileName;
    }

    // --- Lookup ---

    public BlocklistSource getSource(String name) {
        return sources.get(name);
    }

    public Collection<BlocklistSource> getSources() {
        return sources.values();
    }

    public Map<String, BlocklistSource> snapshot() {
        return sources;
    }

    public List<BlocklistSource> getRemoteSources() {
        return sources.values().stream().filter(BlocklistSource::isRemote).collect(Collectors.toList());
    }

    // --- Remote bookkeeping ---

    public String getEtag(String name) {
        return etags.get(name);
    }

    public void setEtag(String name, String etag) {
        if (etag == null || etag.isEmpty()) {
            etags.remove(name);
        } else {
            etags.put(name, etag);
        }
    }

    public String getVersionToken(String name) {
        return versionTokens.get(name);
    }

    public void setVersionToken(String name, String token) {
        if (token == null) {
            versionTokens.remove(name);
        } else {
            versionTokens.put(name, token);
        }
    }

    /**
     * Remembers the stamp of a file this process has just written, so the directory
     * watcher can tell its own writes apart from external edits.
     */
    public void recordWrite(String name, FileStamp stamp) {
        if (stamp != null) ownWrites.put(name, stamp);
    }

    public FileStamp getRecordedWrite(String name) {
        return ownWrites.get(name);
    }
}
