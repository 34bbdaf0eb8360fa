package com.tthblock.core.blocklist;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Last-modified time plus size of a file. Two stamps match only if both do,
 * which catches rewrites within the file system's timestamp granularity.
 */
public final class FileStamp {
    private final long lastModifiedMillis;
    private final long size;

    public FileStamp(long lastModifiedMillis, long size) {
        this.lastModifiedMillis = lastModifiedMillis;
        this.size = size;
    }

    /**
     * @return the current stamp, or null if the file does not exist or cannot be read.
     */
    public static FileStamp of(Path path) {
        try {
            if (!Files.isRegularFile(path)) return null;
            return new FileStamp(Files.getLastModifiedTime(path).toMillis(), Files.size(path));
        } catch (IOException e) {
            return null;
        }
    }

    public long getSize() {
        return size;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileStamp)) return false;
        FileStamp that = (FileStamp) o;
        return lastModifiedMillis == that.lastModifiedMillis && size == that.size;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lastModifiedMillis, size);
    }

    @Override
    public String toString() {
        return "mtime=" + lastModifiedMillis + ", size=" + size;
    }
}
