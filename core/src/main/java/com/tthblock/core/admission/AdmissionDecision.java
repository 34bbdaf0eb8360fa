package com.tthblock.core.admission;

import com.tthblock.api.NotificationSink;
import com.tthblock.api.QueueAdmissionHook;
import com.tthblock.api.Severity;
import com.tthblock.core.blocklist.MembershipCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hook into the download queue: a file whose TTH is blocked is refused.
 * <p>
 * Only reads the current cache snapshot. If anything goes wrong the file is let
 * through; a broken filter must never stall the queue.
 */
public class AdmissionDecision implements QueueAdmissionHook {
    private static final Logger logger = LoggerFactory.getLogger(AdmissionDecision.class);

    public static final String REASON_BLOCKED = "blocked_tth";
    public static final String MESSAGE_BLOCKED = "Download skipped: TTH is blocked";

    private final MembershipCache cache;
    private final NotificationSink notifier;

    public AdmissionDecision(MembershipCache cache, NotificationSink notifier) {
        this.cache = cache;
        this.notifier = notifier;
    }

    @Override
    public Decision decide(String tth, String displayName) {
        try {
            if (tth == null || tth.isEmpty()) return Decision.allow();
            if (!cache.query(tth)) return Decision.allow();
        } catch (RuntimeException e) {
            logger.error("Error checking TTH {}, letting the download through", tth, e);
            notifyQuietly(Severity.ERROR, "Error checking blocklist for TTH " + tth + ": " + e.getMessage());
            return Decision.allow();
        }

        logger.info("🚫 Blocked download for file '{}' (TTH: {})", displayName, tth);
        notifyQuietly(Severity.WARNING, "Blocked download for file '" + displayName + "' (TTH: " + tth + ")");
        return Decision.deny(REASON_BLOCKED, MESSAGE_BLOCKED);
    }

    private void notifyQuietly(Severity severity, String text) {
        try {
            notifier.post(severity, text);
        } catch (RuntimeException e) {
            logger.warn("Failed to post notification: {}", text, e);
        }
    }
}
