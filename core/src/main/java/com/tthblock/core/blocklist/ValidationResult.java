package com.tthblock.core.blocklist;

/**
 * Outcome of {@link SourceRegistry#validateSource}.
 */
public final class ValidationResult {
    private final boolean valid;
    private final String url;
    private final String version;
    private final String updatedAt;
    private final String description;

    ValidationResult(boolean valid, String url, String version, String updatedAt, String description) {
        this.valid = valid;
        this.url = url;
        this.version = version;
        this.updatedAt = updatedAt;
        this.description = description;
    }

    static ValidationResult invalid(String url, String version, String updatedAt, String description) {
        return new ValidationResult(false, url, version, updatedAt, description);
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * Origin URL; null for local read-only sources, "Internal" for the writable one.
     */
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

    @Override
    public String toString() {
        return "ValidationResult{valid=" + valid + ", url=" + url + ", version=" + version + "}";
    }
}
