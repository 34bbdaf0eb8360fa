package com.tthblock.core.sync;

/**
 * Successful HTTP exchange: either 304 Not Modified or a body with its entity tag.
 */
public final class FetchResult {
    private static final FetchResult NOT_MODIFIED = new FetchResult(true, null, null, null);

    private final boolean notModified;
    private final String body;
    private final String etag;
    private final String contentType;

    private FetchResult(boolean notModified, String body, String etag, String contentType) {
        this.notModified = notModified;
        this.body = body;
        this.etag = etag;
        this.contentType = contentType;
    }

    public static FetchResult notModified() {
        return NOT_MODIFIED;
    }

    public static FetchResult ok(String body, String etag, String contentType) {
        return new FetchResult(false, body, etag, contentType);
    }

    public boolean isNotModified() {
        return notModified;
    }

    public String getBody() {
        return body;
    }

    public String getEtag() {
        return etag;
    }

    public String getContentType() {
        return contentType;
    }
}
