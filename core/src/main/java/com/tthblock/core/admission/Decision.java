package com.tthblock.core.admission;

/**
 * Answer of the admission check for one queued file.
 */
public final class Decision {
    private static final Decision ALLOW = new Decision(true, null, null);

    private final boolean allowed;
    private final String reasonId;
    private final String message;

    private Decision(boolean allowed, String reasonId, String message) {
        this.allowed = allowed;
        this.reasonId = reasonId;
        this.message = message;
    }

    public static Decision allow() {
        return ALLOW;
    }

    public static Decision deny(String reasonId, String message) {
        return new Decision(false, reasonId, message);
    }

    public boolean isAllowed() {
        return allowed;
    }

    /** Machine readable reason, null when allowed. */
    public String getReasonId() {
        return reasonId;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return allowed ? "ALLOW" : "DENY(" + reasonId + ": " + message + ")";
    }
}
