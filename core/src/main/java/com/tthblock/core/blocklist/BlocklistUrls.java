package com.tthblock.core.blocklist;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Decides which origin URLs are worth fetching. Only raw file hosting is accepted,
 * an ordinary web page would hand back HTML instead of a blocklist.
 */
public final class BlocklistUrls {
    public static final String INTERNAL = "Internal";

    private BlocklistUrls() {
    }

    public static boolean isAcceptable(String url) {
        if (url == null) return false;
        if (INTERNAL.equals(url)) return true;
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || !uri.isAbsolute()) return false;
            boolean http = scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https");
            String host = uri.getHost() == null ? "" : uri.getHost();
            String path = uri.getPath() == null ? "" : uri.getPath();
            boolean raw = host.contains("raw.githubusercontent.com") || path.contains("/raw/");
            return http && raw;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /**
     * True for a fetchable remote origin, i.e. acceptable and not the writable marker.
     */
    public static boolean isRemote(String url) {
        return url != null && !INTERNAL.equals(url) && isAcceptable(url);
    }
}
