package com.tthblock.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * ConfigValidator - Validates configuration on startup.
 * Errors abort the start, warnings are logged and the offending value is clamped.
 */
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);

    public static final int MIN_UPDATE_INTERVAL_MINUTES = 1;

    public static class ValidationError {
        public final String message;
        public final String severity; // ERROR, WARNING

        public ValidationError(String message, String severity) {
            this.message = message;
            this.severity = severity;
        }

        @Override
        public String toString() {
            return "[" + severity + "] " + message;
        }
    }

    /**
     * Validate configuration and return list of errors/warnings
     */
    public List<ValidationError> validate(Configuration config, File baseDir) {
        List<ValidationError> errors = new ArrayList<>();

        // 1. Blocklist directory
        validateBlocklistDir(config, baseDir, errors);

        // 2. Update timer
        validateUpdateInterval(config, errors);

        // 3. Retry & debounce
        validateTimings(config, errors);

        return errors;
    }

    private void validateBlocklistDir(Configuration config, File baseDir, List<ValidationError> errors) {
        if (config.blocklistDir == null || config.blocklistDir.isBlank()) {
            errors.add(new ValidationError("No blocklist directory configured", "ERROR"));
            return;
        }
        File dir = resolve(baseDir, config.blocklistDir);
        if (!dir.exists()) {
            if (!dir.mkdirs()) {
                errors.add(new ValidationError("Cannot create blocklist directory: " + dir, "ERROR"));
            } else {
                logger.info("✅ Created blocklist directory: {}", dir);
            }
        } else if (!dir.isDirectory()) {
            errors.add(new ValidationError("Blocklist path is not a directory: " + dir, "ERROR"));
        }
    }

    private void validateUpdateInterval(Configuration config, List<ValidationError> errors) {
        if (config.updateIntervalMinutes < MIN_UPDATE_INTERVAL_MINUTES) {
            errors.add(new ValidationError(
                    "Update interval " + config.updateIntervalMinutes + " min is below the minimum, using "
                            + MIN_UPDATE_INTERVAL_MINUTES,
                    "WARNING"));
            config.updateIntervalMinutes = MIN_UPDATE_INTERVAL_MINUTES;
        }
    }

    private void validateTimings(Configuration config, List<ValidationError> errors) {
        if (config.syncAttempts < 1) {
            errors.add(new ValidationError("syncAttempts must be at least 1, using 1", "WARNING"));
            config.syncAttempts = 1;
        }
        if (config.syncRetryDelayMillis < 0) {
            errors.add(new ValidationError("syncRetryDelayMillis is negative, using 0", "WARNING"));
            config.syncRetryDelayMillis = 0;
        }
        if (config.watchDebounceMillis < 0) {
            errors.add(new ValidationError("watchDebounceMillis is negative, using 0", "WARNING"));
            config.watchDebounceMillis = 0;
        }
        if (config.httpTimeoutSeconds < 1) {
            errors.add(new ValidationError("httpTimeoutSeconds must be positive, using 30", "WARNING"));
            config.httpTimeoutSeconds = 30;
        }
    }

    public static File resolve(File baseDir, String path) {
        File f = new File(path);
        return f.isAbsolute() || baseDir == null ? f : new File(baseDir, path);
    }

    /**
     * Validate and report errors to logger.
     * Throws IllegalStateException if critical errors found.
     */
    public void validateAndReport(Configuration config, File baseDir) {
        List<ValidationError> errors = validate(config, baseDir);

        int errorCount = 0;
        int warningCount = 0;

        for (ValidationError error : errors) {
            if (error.severity.equals("ERROR")) {
                logger.error("❌ Config Error: {}", error.message);
                errorCount++;
            } else {
                logger.warn("⚠️  Config Warning: {}", error.message);
                warningCount++;
            }
        }

        if (errorCount > 0 || warningCount > 0) {
            logger.warn("📋 Configuration validation: {} errors, {} warnings", errorCount, warningCount);
        } else {
            logger.info("✅ Configuration validation passed");
        }

        if (errorCount > 0) {
            throw new IllegalStateException(
                    String.format("Configuration validation failed with %d error(s). Fix config and restart.",
                            errorCount));
        }
    }
}
