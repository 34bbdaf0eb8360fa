package com.tthblock.core.sync;

/**
 * Outcome of one scheduled update of one remote source.
 */
public enum SyncResult {
    /** New content written and reconciled. */
    UPDATED,
    /** Server answered 304. */
    NOT_MODIFIED,
    /** Body fetched but its version token equals the stored one. */
    UNCHANGED,
    /** Not fetched: internal, disabled or unacceptable URL. */
    SKIPPED,
    /** All attempts failed; last known content stays active. */
    FAILED
}
