package com.tthblock.core.blocklist;

import java.util.Collections;
import java.util.List;

/**
 * What {@link InternalBlocklistEditor#appendEntries} did.
 */
public final class AppendResult {

    public enum Status {
        /** At least one TTH was written. */
        ADDED,
        /** Nothing new: all candidates were invalid or already blocked. */
        NOTHING_ADDED,
        /** The internal blocklist is switched off in the settings. */
        DISABLED,
        /** Settings unavailable or the file could not be written. */
        FAILED
    }

    private final Status status;
    private final List<String> addedTths;

    private AppendResult(Status status, List<String> addedTths) {
        this.status = status;
        this.addedTths = addedTths;
    }

    static AppendResult added(List<String> tths) {
        return new AppendResult(Status.ADDED, Collections.unmodifiableList(tths));
    }

    static AppendResult of(Status status) {
        return new AppendResult(status, Collections.emptyList());
    }

    public Status getStatus() {
        return status;
    }

    public int getAddedCount() {
        return addedTths.size();
    }

    public List<String> getAddedTths() {
        return addedTths;
    }

    @Override
    public String toString() {
        return status + " " + addedTths;
    }
}
