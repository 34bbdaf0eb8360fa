package com.tthblock.core.command;

import com.tthblock.api.Severity;
import com.tthblock.core.Kernel;
import com.tthblock.core.admission.Decision;
import com.tthblock.core.blocklist.AppendResult;
import com.tthblock.core.blocklist.BlocklistSource;
import com.tthblock.core.blocklist.MembershipCache;
import com.tthblock.core.sync.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Map;

/**
 * Console commands for the blocklist: add, check, inspect, update.
 */
public class BlocklistCommands {
    private static final Logger logger = LoggerFactory.getLogger(BlocklistCommands.class);
    private final Kernel kernel;

    public BlocklistCommands(Kernel kernel) {
        this.kernel = kernel;
    }

    public void register() {
        kernel.registerCommand("/help", this::handleHelp);
        kernel.registerCommand("/block", this::handleBlock);
        kernel.registerCommand("/check", this::handleCheck);
        kernel.registerCommand("/status", this::handleStatus);
        kernel.registerCommand("/sync", this::handleSync);
        kernel.registerCommand("/reload", this::handleReload);
    }

    // =================================================================================
    // PUBLIC API (String Rückgabe, z.B. für Tests)
    // =================================================================================

    public String getStatusText() {
        MembershipCache cache = kernel.getCache();
        StringBuilder sb = new StringBuilder("📊 BLOCKLIST STATUS\n");
        sb.append("Blocked TTHs: ").append(cache.size()).append("\n");
        for (BlocklistSource source : kernel.getRegistry().getSources()) {
            boolean loaded = cache.isLoaded(source.getName());
            String token = cache.getVersionToken(source.getName());
            sb.append(loaded ? "✅ " : "⏸️ ")
                    .append(source.getName())
                    .append(" [").append(source.getTypeLabel()).append("] ")
                    .append(cache.getSourceIds(source.getName()).size()).append(" TTH(s)")
                    .append(token == null ? "" : ", version " + token)
                    .append("\n");
        }
        return sb.toString();
    }

    public String getHelpText() {
        return "📚 Commands\n" +
                "/block <tth...>      add TTHs to the internal blocklist\n" +
                "/check <tth> [name]  test whether a download would be allowed\n" +
                "/status              loaded blocklists\n" +
                "/sync                check remote blocklists now\n" +
                "/reload              re-read config.json and all blocklists";
    }

    public String executeBlock(String[] args) {
        if (args.length < 1)
            return "⚠️ Syntax: /block <tth> [tth...]";
        AppendResult result = kernel.getEditor().appendIdentifiers(Arrays.asList(args));
        switch (result.getStatus()) {
            case ADDED:
                return "🚫 Added " + result.getAddedCount() + " TTH(s)";
            case DISABLED:
                return "⏸️ Internal blocklist is disabled";
            case NOTHING_ADDED:
                return "ℹ️ Nothing added";
            default:
                return "❌ Failed to add TTHs";
        }
    }

    public String executeCheck(String[] args) {
        if (args.length < 1)
            return "⚠️ Syntax: /check <tth> [name]";
        String name = args.length > 1 ? String.join(" ", Arrays.copyOfRange(args, 1, args.length)) : args[0];
        Decision decision = kernel.getAdmission().decide(args[0], name);
        return decision.isAllowed() ? "✅ Allowed: " + args[0] : "🚫 " + decision.getMessage();
    }

    public String executeSync() {
        Map<String, SyncResult> results = kernel.getSynchronizer().syncAll();
        if (results.isEmpty())
            return "ℹ️ No remote blocklists configured";
        StringBuilder sb = new StringBuilder("🔄 Remote update\n");
        results.forEach((name, result) -> sb.append(name).append(": ").append(result).append("\n"));
        return sb.toString();
    }

    // =================================================================================
    // HANDLERS
    // =================================================================================

    private void handleHelp(String c, String[] a) {
        reply(getHelpText());
    }

    private void handleBlock(String c, String[] a) {
        reply(executeBlock(a));
    }

    private void handleCheck(String c, String[] a) {
        reply(executeCheck(a));
    }

    private void handleStatus(String c, String[] a) {
        reply(getStatusText());
    }

    private void handleSync(String c, String[] a) {
        reply(executeSync());
    }

    private void handleReload(String c, String[] a) {
        kernel.onSettingsChanged();
        reply("🔁 Reloaded: " + kernel.getCache().size() + " TTH(s) blocked");
    }

    private void reply(String text) {
        logger.debug("Reply: {}", text);
        kernel.notify(Severity.INFO, text);
    }
}
