package com.tthblock.core.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * Conditional GET of a remote blocklist.
 */
public class BlocklistFetcher {
    private static final Logger logger = LoggerFactory.getLogger(BlocklistFetcher.class);
    private static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (compatible) TthBlocklistFilter/1.0";

    private final HttpClient client;
    private final Duration timeout;

    public BlocklistFetcher(Duration timeout) {
        this.client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(timeout)
                .build();
        this.timeout = timeout;
    }

    /**
     * @param etag entity tag of the last successful fetch, sent as If-None-Match; may be null
     */
    public FetchResult fetch(String url, String etag) throws RetryableFetchException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("User-Agent", DEFAULT_USER_AGENT)
                .GET();
        if (etag != null && !etag.isEmpty()) {
            builder.header("If-None-Match", etag);
        }

        HttpResponse<String> response;
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RetryableFetchException("Network error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RetryableFetchException("Interrupted while fetching", e);
        }

        int status = response.statusCode();
        logger.debug("Response for {}: HTTP {} {}", url, status, response.headers().map());
        if (status == 304) {
            return FetchResult.notModified();
        }
        if (status < 200 || status >= 300) {
            throw new RetryableFetchException("HTTP " + status);
        }
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        String mediaType = contentType.toLowerCase(Locale.ROOT);
        if (!mediaType.contains("application/json") && !mediaType.contains("text/plain")) {
            throw new RetryableFetchException("Invalid content type: " + contentType
                    + ", expected application/json or text/plain");
        }
        return FetchResult.ok(response.body(), response.headers().firstValue("ETag").orElse(null), contentType);
    }
}
