package com.tthblock.core.sync;

import com.tthblock.api.BlocklistSettings;
import com.tthblock.api.NotificationSink;
import com.tthblock.api.Severity;
import com.tthblock.core.blocklist.BlocklistSource;
import com.tthblock.core.blocklist.FileStamp;
import com.tthblock.core.blocklist.MembershipCache;
import com.tthblock.core.blocklist.SourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Watches the blocklist directory for files dropped in, edited or removed by hand.
 * <p>
 * Editors and our own atomic writes produce several raw events per logical change, so
 * events are debounced: every event cancels the pending settle task and schedules a new
 * one. When the directory has been quiet for the debounce window, one settle pass
 * re-scans and reconciles only the sources that actually changed.
 */
public class DirectoryWatcher implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryWatcher.class);

    private final SourceRegistry registry;
    private final MembershipCache cache;
    private final BlocklistSettings settings;
    private final NotificationSink notifier;
    private final long debounceMillis;

    private final ScheduledExecutorService debouncer = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "BlocklistWatchDebounce");
        t.setDaemon(true);
        return t;
    });
    private final AtomicInteger settleCount = new AtomicInteger();
    private final Object rescanLock = new Object();

    // guarded by this
    private ScheduledFuture<?> pending;
    private final Set<String> pendingNames = new TreeSet<>();

    private volatile boolean running = false;
    private WatchService watchService;
    private Thread watchThread;

    public DirectoryWatcher(SourceRegistry registry, MembershipCache cache, BlocklistSettings settings,
                            NotificationSink notifier, long debounceMillis) {
        this.registry = registry;
        this.cache = cache;
        this.settings = settings;
        this.notifier = notifier;
        this.debounceMillis = Math.max(0, debounceMillis);
    }

    public synchronized void start() {
        if (running) return;
        Path dir = registry.getDirectory();
        try {
            watchService = dir.getFileSystem().newWatchService();
            dir.register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_DELETE);
        } catch (IOException e) {
            logger.error("Failed to start blocklist directory watcher", e);
            notifier.post(Severity.ERROR, "Failed to start blocklist directory watcher: " + e.getMessage());
            return;
        }
        running = true;
        watchThread = new Thread(this, "BlocklistWatcher");
        watchThread.setDaemon(true);
        watchThread.start();
        logger.info("Watching blocklist directory: {}", dir);
    }

    public synchronized void stop() {
        running = false;
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
        debouncer.shutdown();
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                logger.warn("Failed to close watch service", e);
            }
        }
        if (watchThread != null) watchThread.interrupt();
        logger.info("Blocklist directory watcher stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Number of settle passes run so far.
     */
    public int getSettleCount() {
        return settleCount.get();
    }

    @Override
    public void run() {
        while (running) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                break;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    onChange(null);
                    continue;
                }
                Object context = event.context();
                String name = context == null ? null : context.toString();
                if (SourceRegistry.isSourceFileName(name)) {
                    logger.debug("Raw event {} for {}", event.kind().name(), name);
                    onChange(name);
                }
            }

            if (!key.reset()) {
                if (running) {
                    logger.error("Blocklist directory {} is no longer accessible", registry.getDirectory());
                    notifier.post(Severity.ERROR, "Blocklist directory is no longer accessible, stopped watching");
                }
                break;
            }
        }
    }

    /**
     * Registers a change and (re)starts the quiet-period timer.
     *
     * @param fileName the changed file, or null if unknown (event overflow)
     */
    public synchronized void onChange(String fileName) {
        if (debouncer.isShutdown()) return;
        if (fileName != null) pendingNames.add(fileName);
        if (pending != null) pending.cancel(false);
        pending = debouncer.schedule(this::settleSafely, debounceMillis, TimeUnit.MILLISECONDS);
    }

    private void settleSafely() {
        List<String> names;
        synchronized (this) {
            names = new ArrayList<>(pendingNames);
            pendingNames.clear();
            pending = null;
        }
        try {
            logger.info("Detected change in blocklist directory: {}", names.isEmpty() ? "unknown" : String.join(", ", names));
            settle();
        } catch (RuntimeException e) {
            logger.error("Error in blocklist directory handler", e);
            notifier.post(Severity.ERROR, "Error processing blocklist change for " + String.join(", ", names)
                    + ": " + e.getMessage());
        }
    }

    /**
     * One reconciliation pass after the directory settled.
     */
    void settle() {
        settleCount.incrementAndGet();
        rescan();
    }

    /**
     * Re-scans the directory and reconciles what changed since the last scan: new files
     * are announced and loaded, edited files reloaded, vanished ones dropped. Also used
     * outside the debounce, e.g. when the settings are reloaded.
     */
    public void rescan() {
        synchronized (rescanLock) {
            rescanLocked();
        }
    }

    private void rescanLocked() {
        Map<String, BlocklistSource> before = registry.snapshot();
        List<BlocklistSource> after = registry.scanSources();

        List<String> added = new ArrayList<>();
        for (BlocklistSource source : after) {
            if (!before.containsKey(source.getName())) added.add(source.getName());
        }

        if (!added.isEmpty()) {
            logger.info("New blocklists detected: {}", String.join(", ", added));
            try {
                settings.registerNewSources(added);
            } catch (RuntimeException e) {
                logger.error("Failed to register new blocklists in settings", e);
            }
            notifier.post(Severity.INFO, "New blocklists detected: " + String.join(", ", added)
                    + ". Enable them in the settings if needed");
            for (String name : added) cache.reconcileOne(name);
        }

        for (BlocklistSource source : after) {
            BlocklistSource old = before.get(source.getName());
            if (old == null) continue;
            FileStamp stamp = source.getStamp();
            if (stamp.equals(old.getStamp())) continue;
            if (stamp.equals(registry.getRecordedWrite(source.getName()))) {
                logger.debug("Skipping reload for {}: written by this process ({})", source.getName(), stamp);
                continue;
            }
            cache.reconcileOne(source.getName());
        }

        for (String name : before.keySet()) {
            boolean stillThere = after.stream().anyMatch(s -> s.getName().equals(name));
            if (!stillThere) {
                logger.info("Blocklist {} disappeared or became invalid, unloading", name);
                cache.unload(name);
            }
        }
    }
}
