package com.tthblock.api;

/**
 * Channel for user-facing events (the host's event log, a chat, the console).
 * Implementations must not throw; a failed delivery is their own concern.
 */
@FunctionalInterface
public interface NotificationSink {
    void post(Severity severity, String text);
}
