package com.tthblock.core;

import com.tthblock.api.NotificationSink;
import com.tthblock.api.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sink for hosts without their own event log: notifications end up in the log.
 */
public class LoggingNotificationSink implements NotificationSink {
    private static final Logger logger = LoggerFactory.getLogger("Notifications");

    @Override
    public void post(Severity severity, String text) {
        switch (severity) {
            case ERROR:
                logger.error("❌ {}", text);
                break;
            case WARNING:
                logger.warn("⚠️ {}", text);
                break;
            default:
                logger.info("ℹ️ {}", text);
        }
    }
}
