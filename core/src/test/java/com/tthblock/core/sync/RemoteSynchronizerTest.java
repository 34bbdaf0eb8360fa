package com.tthblock.core.sync;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.tthblock.api.Severity;
import com.tthblock.core.blocklist.BlocklistDocument;
import com.tthblock.core.blocklist.BlocklistFiles;
import com.tthblock.core.blocklist.FileStamp;
import com.tthblock.core.blocklist.MembershipCache;
import com.tthblock.core.blocklist.SourceRegistry;
import com.tthblock.test.TestBase;
import com.tthblock.test.TestSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RemoteSynchronizerTest extends TestBase {

    private static final class Reply {
        final int status;
        final String body;
        final String contentType;
        final String etag;

        Reply(int status, String body, String contentType, String etag) {
            this.status = status;
            this.body = body;
            this.contentType = contentType;
            this.etag = etag;
        }
    }

    private final Deque<Reply> replies = new ConcurrentLinkedDeque<>();
    private volatile Reply fallback;
    private final List<String> ifNoneMatch = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger requests = new AtomicInteger();

    private HttpServer server;
    private Path dir;
    private Path remoteFile;
    private SourceRegistry registry;
    private TestSettings settings;
    private MembershipCache cache;
    private RemoteSynchronizer synchronizer;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/raw/list.json", this::serve);
        server.start();
        String url = "http://127.0.0.1:" + server.getAddress().getPort() + "/raw/list.json";

        dir = tempDir.resolve("blocklists");
        remoteFile = writeFile(dir, "remote.json", blocklistJson(url, "1", tth(1)));
        registry = new SourceRegistry(dir, notifications);
        settings = new TestSettings();
        cache = new MembershipCache(registry, notifications, s -> settings.isEnabled(s.getName()));
        registry.scanSources();
        cache.fullReload();
        synchronizer = new RemoteSynchronizer(registry, cache, new BlocklistFetcher(Duration.ofSeconds(5)),
                settings, notifications, 3, 10);
        notifications.clear();
    }

    @AfterEach
    void stopServer() {
        synchronizer.stop();
        server.stop(0);
    }

    private void serve(HttpExchange exchange) throws IOException {
        requests.incrementAndGet();
        String sent = exchange.getRequestHeaders().getFirst("If-None-Match");
        ifNoneMatch.add(sent);
        Reply reply = replies.poll();
        if (reply == null) reply = fallback;

        if (reply.etag != null && reply.etag.equals(sent)) {
            exchange.sendResponseHeaders(304, -1);
            exchange.close();
            return;
        }
        byte[] bytes = reply.body.getBytes(StandardCharsets.UTF_8);
        if (reply.contentType != null) exchange.getResponseHeaders().add("Content-Type", reply.contentType);
        if (reply.etag != null) exchange.getResponseHeaders().add("ETag", reply.etag);
        exchange.sendResponseHeaders(reply.status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private String remoteJson(String version, String... tths) {
        return blocklistJson("http://127.0.0.1:" + server.getAddress().getPort() + "/raw/list.json", version, tths);
    }

    @Test
    void testNewVersionIsWrittenAndLoaded() throws Exception {
        fallback = new Reply(200, remoteJson("2", tth(2), tth(3)), "application/json; charset=utf-8", "\"v2\"");

        Map<String, SyncResult> results = synchronizer.syncAll();

        assertEquals(Map.of("remote.json", SyncResult.UPDATED), results);
        assertFalse(cache.query(tth(1)));
        assertTrue(cache.query(tth(2)));
        assertTrue(cache.query(tth(3)));
        assertEquals("\"v2\"", registry.getEtag("remote.json"));
        assertEquals("2", registry.getVersionToken("remote.json"));
        assertEquals("2", BlocklistDocument.from(BlocklistFiles.read(remoteFile)).getVersion());
        assertEquals(FileStamp.of(remoteFile), registry.getRecordedWrite("remote.json"));
        assertTrue(notifications.contains(Severity.INFO, "Updated blocklist remote.json"));
    }

    @Test
    void testContentTypeIsMatchedCaseInsensitively() {
        fallback = new Reply(200, remoteJson("2", tth(2)), "Application/JSON; Charset=UTF-8", null);

        assertEquals(SyncResult.UPDATED, synchronizer.syncSource(registry.getSource("remote.json")));
        assertEquals(1, requests.get());
        assertTrue(cache.query(tth(2)));
    }

    @Test
    void testUnexpectedContentTypeIsRetriedThenReported() {
        fallback = new Reply(200, remoteJson("2", tth(2)), "text/html", null);

        assertEquals(SyncResult.FAILED, synchronizer.syncSource(registry.getSource("remote.json")));
        assertEquals(3, requests.get());
        assertTrue(notifications.contains(Severity.ERROR, "Invalid content type"));
        assertTrue(cache.query(tth(1)));
    }

    @Test
    void testEtagIsSentAndNotModifiedIsNoOp() {
        fallback = new Reply(200, remoteJson("2", tth(2)), "application/json", "\"v2\"");
        assertEquals(SyncResult.UPDATED, synchronizer.syncSource(registry.getSource("remote.json")));
        FileStamp afterUpdate = FileStamp.of(remoteFile);

        SyncResult second = synchronizer.syncSource(registry.getSource("remote.json"));

        assertEquals(SyncResult.NOT_MODIFIED, second);
        assertNull(ifNoneMatch.get(0));
        assertEquals("\"v2\"", ifNoneMatch.get(1));
        assertEquals(afterUpdate, FileStamp.of(remoteFile));
        assertTrue(cache.query(tth(2)));
    }

    @Test
    void testSameVersionIsNotRewritten() {
        FileStamp before = FileStamp.of(remoteFile);
        fallback = new Reply(200, remoteJson("1", tth(1), tth(9)), "text/plain", null);

        assertEquals(SyncResult.UNCHANGED, synchronizer.syncSource(registry.getSource("remote.json")));

        assertEquals(before, FileStamp.of(remoteFile));
        assertTrue(cache.query(tth(1)));
        assertFalse(cache.query(tth(9)));
    }

    @Test
    void testThreeFailuresKeepPriorContent() {
        fallback = new Reply(500, "boom", "text/plain", null);

        Map<String, SyncResult> results = synchronizer.syncAll();

        assertEquals(SyncResult.FAILED, results.get("remote.json"));
        assertEquals(3, requests.get());
        assertTrue(cache.query(tth(1)), "stale but valid content stays active");
        assertEquals(1, notifications.count(Severity.ERROR));
        assertTrue(notifications.contains(Severity.ERROR, "HTTP 500"));

        // der nächste Lauf versucht es unabhängig davon erneut
        fallback = new Reply(200, remoteJson("2", tth(2)), "application/json", null);
        assertEquals(SyncResult.UPDATED, synchronizer.syncAll().get("remote.json"));
    }

    @Test
    void testRecoversWithinRetryBudget() {
        replies.add(new Reply(503, "busy", "text/plain", null));
        replies.add(new Reply(200, "<html>not a list</html>", "text/html", null));
        fallback = new Reply(200, remoteJson("2", tth(2)), "application/json", null);

        assertEquals(SyncResult.UPDATED, synchronizer.syncSource(registry.getSource("remote.json")));

        assertEquals(3, requests.get());
        assertEquals(0, notifications.count(Severity.ERROR));
    }

    @Test
    void testMalformedBodyIsRetryable() {
        replies.add(new Reply(200, "{ \"tths\": ", "application/json", null));
        replies.add(new Reply(200, "{ \"tths\": \"none\" }", "application/json", null));
        fallback = new Reply(200, "[]", "application/json", null);

        assertEquals(SyncResult.FAILED, synchronizer.syncSource(registry.getSource("remote.json")));

        assertEquals(3, requests.get());
        assertTrue(cache.query(tth(1)));
        assertEquals(1, notifications.count(Severity.ERROR));
    }

    @Test
    void testDisabledSourceIsNotFetched() {
        settings.disable("remote.json");
        fallback = new Reply(200, remoteJson("2", tth(2)), "application/json", null);

        assertEquals(SyncResult.SKIPPED, synchronizer.syncAll().get("remote.json"));
        assertEquals(0, requests.get());
    }

    @Test
    void testInternalSourceIsSkipped() {
        assertEquals(SyncResult.SKIPPED, synchronizer.syncSource(registry.getSource(SourceRegistry.INTERNAL_BLOCKLIST)));
        assertFalse(synchronizer.syncAll().containsKey(SourceRegistry.INTERNAL_BLOCKLIST));
        assertEquals(0, requests.get());
    }

    @Test
    void testScheduleReplacesTimer() {
        assertFalse(synchronizer.isScheduled());
        synchronizer.schedule(60);
        assertTrue(synchronizer.isScheduled());
        synchronizer.schedule(0);
        assertTrue(synchronizer.isScheduled());

        synchronizer.stop();

        assertFalse(synchronizer.isScheduled());
        synchronizer.schedule(5);
        assertFalse(synchronizer.isScheduled(), "a stopped synchronizer stays stopped");
    }
}
