package com.tthblock.core.blocklist;

import java.nio.file.Path;

/**
 * Immutable descriptor of one blocklist file as seen by the last scan or refresh.
 * The name is the file name including ".json" and identifies the source everywhere.
 */
public final class BlocklistSource {
    private final String name;
    private final Path path;
    private final String url;
    private final String version;
    private final String updatedAt;
    private final String description;
    private final FileStamp stamp;
    private final boolean internal;

    BlocklistSource(String name, Path path, ValidationResult meta, FileStamp stamp, boolean internal) {
        this.name = name;
        this.path = path;
        this.url = meta.getUrl();
        this.version = meta.getVersion();
        this.updatedAt = meta.getUpdatedAt();
        this.description = meta.getDescription();
        this.stamp = stamp;
        this.internal = internal;
    }

    public String getName() {
        return name;
    }

    public Path getPath() {
        return path;
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

    public FileStamp getStamp() {
        return stamp;
    }

    /**
     * The one source that in-application edits go to.
     */
    public boolean isInternal() {
        return internal;
    }

    public boolean isRemote() {
        return !internal && BlocklistUrls.isRemote(url);
    }

    public String getChangeToken() {
        return BlocklistDocument.changeToken(version, updatedAt);
    }

    public String getTypeLabel() {
        if (internal) return "internal";
        return isRemote() ? "remote" : "local read-only";
    }

    @Override
    public String toString() {
        return name + " (" + getTypeLabel() + ")";
    }
}
