package com.tthblock;

import com.tthblock.core.Kernel;
import com.tthblock.core.LoggingNotificationSink;
import com.tthblock.core.command.BlocklistCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.text.SimpleDateFormat;
import java.util.Date;

public class Main {
    // Logger erst initialisieren NACHDEM Streams umgebogen wurden
    private static Logger logger;

    public static void main(String[] args) {
        setupGlobalLogging();

        logger = LoggerFactory.getLogger(Main.class);
        logger.info("🚀 Starting TTH Blocklist Filter...");
        logger.info("📄 Log File: logs/latest.log (und session-*.log)");

        File baseDir = new File(args.length > 0 ? args[0] : ".");
        Kernel kernel = new Kernel(baseDir, new LoggingNotificationSink());
        new BlocklistCommands(kernel).register();
        Runtime.getRuntime().addShutdownHook(new Thread(kernel::stop, "Shutdown"));

        try {
            kernel.start();
        } catch (Exception e) {
            logger.error("CRITICAL FAILURE during startup", e);
            System.exit(1);
        }

        logger.info("Service running. Type /help for commands.");
        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) continue;
                if (!kernel.handleCommand(line)) {
                    logger.warn("Unknown command, try /help");
                }
            }
            // stdin zu (z.B. als Dienst gestartet): weiterlaufen
            logger.info("Console closed. Joining main thread.");
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            logger.warn("Main thread interrupted. Exiting...");
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            logger.error("Console input failed", e);
        }
    }

    /**
     * Leitet System.out und System.err in Dateien um, BEVOR irgendwas anderes passiert.
     */
    private static void setupGlobalLogging() {
        try {
            File logDir = new File("logs");
            if (!logDir.exists()) logDir.mkdirs();

            String timeStamp = new SimpleDateFormat("yyyy-MM-dd_HH-mm-ss").format(new Date());
            File sessionLog = new File(logDir, "session-" + timeStamp + ".log");
            File latestLog = new File(logDir, "latest.log");

            FileOutputStream sessionStream = new FileOutputStream(sessionLog);
            FileOutputStream latestStream = new FileOutputStream(latestLog); // Überschreibt latest.log

            // Konsole + SessionFile + LatestFile
            MultiOutputStream multiOut = new MultiOutputStream(System.out, sessionStream, latestStream);
            MultiOutputStream multiErr = new MultiOutputStream(System.err, sessionStream, latestStream);

            System.setOut(new PrintStream(multiOut, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(multiErr, true, StandardCharsets.UTF_8));

        } catch (IOException e) {
            System.err.println("FATAL: Konnte Logging nicht initialisieren: " + e.getMessage());
        }
    }

    // Output an mehrere Ziele (Tee-Prinzip)
    static class MultiOutputStream extends OutputStream {
        private final OutputStream[] streams;

        MultiOutputStream(OutputStream... streams) {
            this.streams = streams;
        }

        @Override
        public void write(int b) throws IOException {
            for (OutputStream s : streams) s.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            for (OutputStream s : streams) s.write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            for (OutputStream s : streams) s.flush();
        }

        @Override
        public void close() throws IOException {
            for (OutputStream s : streams) s.close();
        }
    }
}
