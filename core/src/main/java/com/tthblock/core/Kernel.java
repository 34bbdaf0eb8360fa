package com.tthblock.core;

import com.tthblock.api.BlocklistSettings;
import com.tthblock.api.CommandHandler;
import com.tthblock.api.NotificationSink;
import com.tthblock.api.QueueAdmissionHook;
import com.tthblock.api.Severity;
import com.tthblock.core.admission.AdmissionDecision;
import com.tthblock.core.blocklist.BlocklistSource;
import com.tthblock.core.blocklist.InternalBlocklistEditor;
import com.tthblock.core.blocklist.MembershipCache;
import com.tthblock.core.blocklist.SourceRegistry;
import com.tthblock.core.config.ConfigBlocklistSettings;
import com.tthblock.core.config.ConfigManager;
import com.tthblock.core.config.ConfigValidator;
import com.tthblock.core.config.Configuration;
import com.tthblock.core.sync.BlocklistFetcher;
import com.tthblock.core.sync.DirectoryWatcher;
import com.tthblock.core.sync.RemoteSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires the blocklist components together and owns their lifecycle.
 */
public class Kernel {
    private static final Logger logger = LoggerFactory.getLogger(Kernel.class);

    private final File baseDir;
    private final NotificationSink notifier;

    private final ConfigManager configManager;
    private final BlocklistSettings settings;
    private final SourceRegistry registry;
    private final MembershipCache cache;
    private final InternalBlocklistEditor editor;
    private final RemoteSynchronizer synchronizer;
    private final DirectoryWatcher watcher;
    private final AdmissionDecision admission;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<String, CommandHandler> commandRegistry = new ConcurrentHashMap<>();

    public Kernel(File baseDir, NotificationSink notifier) {
        this.baseDir = baseDir;
        this.notifier = notifier;
        File toolsDir = new File(baseDir, "tools");
        if (!toolsDir.exists())
            toolsDir.mkdirs();

        this.configManager = new ConfigManager(toolsDir);
        this.settings = new ConfigBlocklistSettings(configManager);
        Configuration config = configManager.getConfig();

        File blocklistDir = ConfigValidator.resolve(baseDir, config.blocklistDir == null ? "blocklists" : config.blocklistDir);
        this.registry = new SourceRegistry(blocklistDir.toPath(), notifier);
        this.cache = new MembershipCache(registry, notifier, source -> settings.isEnabled(source.getName()));
        this.editor = new InternalBlocklistEditor(registry, cache, settings, notifier);
        this.synchronizer = new RemoteSynchronizer(registry, cache,
                new BlocklistFetcher(Duration.ofSeconds(Math.max(1, config.httpTimeoutSeconds))),
                settings, notifier, config.syncAttempts, config.syncRetryDelayMillis);
        this.watcher = new DirectoryWatcher(registry, cache, settings, notifier, config.watchDebounceMillis);
        this.admission = new AdmissionDecision(cache, notifier);
    }

    public void start() {
        if (running.getAndSet(true))
            return;
        logger.info("⚛️ Kernel booting...");

        new ConfigValidator().validateAndReport(configManager.getConfig(), baseDir);

        List<BlocklistSource> sources = registry.scanSources();
        List<String> names = new ArrayList<>();
        for (BlocklistSource source : sources) names.add(source.getName());
        settings.registerKnownSources(names);

        cache.fullReload();

        if (configManager.getConfig().watchEnabled) {
            watcher.start();
        } else {
            logger.info("Directory watcher disabled in configuration");
        }
        synchronizer.schedule(settings.getUpdateIntervalMinutes());

        logger.info("✅ Kernel active. {} TTH(s) blocked from {} source(s)", cache.size(), cache.getLoadedSources().size());
        notifier.post(Severity.INFO, "TTH blocklist filter started with " + cache.size() + " blocked TTH(s)");
    }

    public void stop() {
        if (!running.getAndSet(false))
            return;
        logger.info("🛑 Kernel shutting down...");
        watcher.stop();
        synchronizer.stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Applies changed settings (toggles, interval): re-reads config.json, picks up files
     * that appeared in the meantime, rebuilds the cache and reinstalls the update timer.
     */
    public void onSettingsChanged() {
        logger.info("Settings changed, reloading blocklists");
        configManager.reload();
        if (running.get()) {
            watcher.rescan();
        } else {
            registry.scanSources();
        }
        cache.fullReload();
        if (running.get()) {
            synchronizer.schedule(settings.getUpdateIntervalMinutes());
        }
    }

    // --- Command API ---

    public void registerCommand(String cmd, CommandHandler handler) {
        commandRegistry.put(cmd.toLowerCase(), handler);
    }

    public Map<String, CommandHandler> getCommandRegistry() {
        return commandRegistry;
    }

    /**
     * Dispatches one console line like "/check ABC... name".
     *
     * @return false if the command is unknown
     */
    public boolean handleCommand(String line) {
        if (line == null || line.isBlank())
            return false;
        String[] parts = line.trim().split("\\s+");
        String cmd = parts[0].toLowerCase();
        CommandHandler handler = commandRegistry.get(cmd);
        if (handler == null) {
            logger.warn("Unknown command: {}", cmd);
            return false;
        }
        try {
            handler.handle(cmd, Arrays.copyOfRange(parts, 1, parts.length));
        } catch (RuntimeException e) {
            logger.error("Command {} failed", cmd, e);
            notifier.post(Severity.ERROR, "Command " + cmd + " failed: " + e.getMessage());
        }
        return true;
    }

    public void notify(Severity severity, String text) {
        notifier.post(severity, text);
    }

    // --- Getters ---
    public ConfigManager getConfigManager() {
        return configManager;
    }

    public BlocklistSettings getSettings() {
        return settings;
    }

    public SourceRegistry getRegistry() {
        return registry;
    }

    public MembershipCache getCache() {
        return cache;
    }

    public InternalBlocklistEditor getEditor() {
        return editor;
    }

    public RemoteSynchronizer getSynchronizer() {
        return synchronizer;
    }

    public DirectoryWatcher getWatcher() {
        return watcher;
    }

    public QueueAdmissionHook getAdmission() {
        return admission;
    }
}
