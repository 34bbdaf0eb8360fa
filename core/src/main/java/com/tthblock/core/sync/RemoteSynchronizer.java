package com.tthblock.core.sync;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.tthblock.api.BlocklistSettings;
import com.tthblock.api.NotificationSink;
import com.tthblock.api.Severity;
import com.tthblock.core.blocklist.BlocklistDocument;
import com.tthblock.core.blocklist.BlocklistFiles;
import com.tthblock.core.blocklist.BlocklistSource;
import com.tthblock.core.blocklist.BlocklistUrls;
import com.tthblock.core.blocklist.FileStamp;
import com.tthblock.core.blocklist.MembershipCache;
import com.tthblock.core.blocklist.SourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the local mirrors of remote blocklists up to date on a timer.
 * <p>
 * Per tick every enabled remote source is fetched in turn with a bounded number of
 * attempts. A source is only rewritten when its version token changed; the HTTP status
 * alone is not trusted because caching CDNs hand out stale 200 responses. When all
 * attempts fail the last known content stays active.
 */
public class RemoteSynchronizer {
    private static final Logger logger = LoggerFactory.getLogger(RemoteSynchronizer.class);

    private final SourceRegistry registry;
    private final MembershipCache cache;
    private final BlocklistFetcher fetcher;
    private final BlocklistSettings settings;
    private final NotificationSink notifier;
    private final int attempts;
    private final long retryDelayMillis;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "BlocklistSync");
        t.setDaemon(true);
        return t;
    });
    private final Set<String> reportedInvalidUrls = ConcurrentHashMap.newKeySet();

    private ScheduledFuture<?> updateTask;
    private boolean stopped = false;

    public RemoteSynchronizer(SourceRegistry registry, MembershipCache cache, BlocklistFetcher fetcher,
                              BlocklistSettings settings, NotificationSink notifier,
                              int attempts, long retryDelayMillis) {
        this.registry = registry;
        this.cache = cache;
        this.fetcher = fetcher;
        this.settings = settings;
        this.notifier = notifier;
        this.attempts = Math.max(1, attempts);
        this.retryDelayMillis = Math.max(0, retryDelayMillis);
    }

    // --- Timer ---

    /**
     * (Re)installs the update timer. A previously scheduled timer is cancelled first so
     * there is never more than one timer chain.
     */
    public synchronized void schedule(int intervalMinutes) {
        if (stopped) {
            logger.warn("Synchronizer is stopped, not scheduling updates");
            return;
        }
        if (updateTask != null) {
            updateTask.cancel(false);
            logger.info("Cleared previous update interval");
        }
        long minutes = Math.max(1, intervalMinutes);
        updateTask = scheduler.scheduleAtFixedRate(this::runTick, minutes, minutes, TimeUnit.MINUTES);
        logger.info("Scheduled blocklist updates every {} minutes", minutes);
    }

    public synchronized boolean isScheduled() {
        return updateTask != null && !updateTask.isCancelled();
    }

    /**
     * Cancels the timer. A fetch that is already running finishes on its own.
     */
    public synchronized void stop() {
        stopped = true;
        if (updateTask != null) {
            updateTask.cancel(false);
            updateTask = null;
        }
        scheduler.shutdown();
        logger.info("Remote blocklist updates stopped");
    }

    private void runTick() {
        // Eine Exception hier würde die Wiederholung des Timers beenden
        try {
            syncAll();
        } catch (RuntimeException e) {
            logger.error("Unexpected error during blocklist update", e);
            notifier.post(Severity.ERROR, "Blocklist update failed: " + e.getMessage());
        }
    }

    // --- Update ---

    /**
     * One tick: updates every known source that has an origin URL.
     */
    public Map<String, SyncResult> syncAll() {
        logger.info("Checking for remote blocklist updates");
        Map<String, SyncResult> results = new LinkedHashMap<>();
        for (BlocklistSource source : registry.getSources()) {
            if (source.isInternal() || source.getUrl() == null) continue;
            SyncResult result;
            try {
                result = syncSource(source);
            } catch (RuntimeException e) {
                logger.error("Update of {} failed unexpectedly", source.getName(), e);
                notifier.post(Severity.ERROR, "Failed to update blocklist " + source.getName() + ": " + e.getMessage());
                result = SyncResult.FAILED;
            }
            results.put(source.getName(), result);
        }
        return results;
    }

    public SyncResult syncSource(BlocklistSource source) {
        String name = source.getName();
        String url = source.getUrl();
        if (source.isInternal() || BlocklistUrls.INTERNAL.equals(url)) {
            logger.debug("Skipping update for {} (Internal)", name);
            return SyncResult.SKIPPED;
        }
        if (!BlocklistUrls.isAcceptable(url)) {
            if (reportedInvalidUrls.add(name)) {
                logger.error("Invalid URL for {}: {}, skipping update", name, url);
                notifier.post(Severity.ERROR, "Invalid URL for blocklist " + name + ": " + url);
            }
            return SyncResult.SKIPPED;
        }
        if (!isEnabled(name)) {
            logger.debug("Blocklist {} is disabled, not fetching", name);
            return SyncResult.SKIPPED;
        }

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                logger.info("Fetching {} from {} (attempt {}/{})", name, url, attempt, attempts);
                return fetchOnce(source);
            } catch (RetryableFetchException | IOException e) {
                logger.error("Failed to update {} from {} (attempt {}/{}): {}", name, url, attempt, attempts, e.getMessage());
                if (attempt >= attempts) {
                    notifier.post(Severity.ERROR, "Failed to update blocklist " + name + ": " + e.getMessage());
                    return SyncResult.FAILED;
                }
                if (!sleepBeforeRetry(name)) return SyncResult.FAILED;
            }
        }
        return SyncResult.FAILED;
    }

    private SyncResult fetchOnce(BlocklistSource source) throws RetryableFetchException, IOException {
        String name = source.getName();
        FetchResult response = fetcher.fetch(source.getUrl(), registry.getEtag(name));
        if (response.isNotModified()) {
            logger.info("No changes for {} (HTTP 304: Not Modified)", name);
            return SyncResult.NOT_MODIFIED;
        }

        logger.debug("Received {} chars for {} ({})", response.getBody().length(), name, response.getContentType());
        JsonObject data;
        try {
            data = BlocklistFiles.parse(response.getBody());
        } catch (JsonParseException e) {
            throw new RetryableFetchException("Invalid JSON: " + e.getMessage(), e);
        }
        BlocklistDocument doc = BlocklistDocument.from(data);
        if (!doc.hasEntryArray()) {
            throw new RetryableFetchException("Invalid JSON format: tths not an array");
        }

        String newToken = doc.getChangeToken();
        String oldToken = registry.getVersionToken(name);
        if (newToken != null && newToken.equals(oldToken)) {
            logger.info("No version change for {} (version: {})", name, newToken);
            return SyncResult.UNCHANGED;
        }

        BlocklistFiles.write(source.getPath(), data);
        FileStamp stamp = FileStamp.of(source.getPath());
        registry.recordWrite(name, stamp);
        registry.setEtag(name, response.getEtag());
        registry.setVersionToken(name, newToken);

        cache.reconcileOne(name);

        long size = stamp == null ? 0 : stamp.getSize();
        logger.info("Updated {} from {} (version: {}, size: {} bytes)", name, source.getUrl(),
                newToken == null ? "none" : newToken, size);
        notifier.post(Severity.INFO, "Updated blocklist " + name + " from " + source.getUrl() + " with "
                + doc.getEntries().size() + " TTH(s) (version: " + (newToken == null ? "none" : newToken)
                + ", size: " + size + " bytes)");
        return SyncResult.UPDATED;
    }

    private boolean sleepBeforeRetry(String name) {
        logger.info("Retrying {} in {}ms", name, retryDelayMillis);
        try {
            Thread.sleep(retryDelayMillis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Update of {} interrupted", name);
            return false;
        }
    }

    private boolean isEnabled(String name) {
        try {
            return settings.isEnabled(name);
        } catch (RuntimeException e) {
            logger.error("Settings unavailable for {}, skipping update", name, e);
            notifier.post(Severity.ERROR, "Settings are invalid, skipping update of blocklist " + name);
            return false;
        }
    }
}
