package com.tthblock.core.blocklist;

import com.tthblock.api.Severity;
import com.tthblock.test.TestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceRegistryTest extends TestBase {
    private static final String RAW_URL = "https://raw.githubusercontent.com/example/lists/main/list.json";

    private Path dir;
    private SourceRegistry registry;

    @BeforeEach
    void createRegistry() {
        dir = tempDir.resolve("blocklists");
        registry = new SourceRegistry(dir, notifications);
    }

    @Test
    void testEmptyDirectoryYieldsOnlyInternalSource() throws Exception {
        List<BlocklistSource> sources = registry.scanSources();

        assertEquals(1, sources.size());
        BlocklistSource internal = sources.get(0);
        assertEquals(SourceRegistry.INTERNAL_BLOCKLIST, internal.getName());
        assertTrue(internal.isInternal());
        assertFalse(internal.isRemote());
        assertEquals("Internal", internal.getUrl());
        assertTrue(Files.isRegularFile(dir.resolve(SourceRegistry.INTERNAL_BLOCKLIST)));
        assertTrue(BlocklistDocument.from(BlocklistFiles.read(registry.getInternalPath())).getEntries().isEmpty());
        assertTrue(notifications.contains(Severity.INFO, "Internal blocklist not found"));
    }

    @Test
    void testReadOnlySourceWithOneMalformedEntryIsValid() throws Exception {
        writeFile(dir, "local.json", blocklistJson(null, "1.0", tth(1), "AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA"));

        registry.scanSources();
        BlocklistSource local = registry.getSource("local.json");

        assertNotNull(local);
        assertNull(local.getUrl());
        assertEquals("local read-only", local.getTypeLabel());
        assertEquals("1.0", local.getChangeToken());
        assertEquals(0, notifications.count(Severity.ERROR));
    }

    @Test
    void testEmptyFileIsInitialized() throws Exception {
        writeFile(dir, "empty.json", "");

        registry.scanSources();

        BlocklistSource empty = registry.getSource("empty.json");
        assertNotNull(empty);
        assertEquals(BlocklistDocument.DEFAULT_VERSION, empty.getVersion());
        assertEquals("empty", empty.getDescription());
        assertTrue(notifications.contains(Severity.INFO, "empty.json was empty"));
        assertTrue(BlocklistDocument.from(BlocklistFiles.read(dir.resolve("empty.json"))).hasEntryArray());
    }

    @Test
    void testCorruptFileIsResetAndReported() throws Exception {
        writeFile(dir, "broken.json", "{ \"url\": \"" + RAW_URL + "\", \"tths\": [");

        registry.scanSources();

        assertNotNull(registry.getSource("broken.json"));
        assertTrue(notifications.contains(Severity.ERROR, "Failed to validate blocklist broken.json"));
        assertTrue(BlocklistDocument.from(BlocklistFiles.read(dir.resolve("broken.json"))).getEntries().isEmpty());
    }

    @Test
    void testRemoteSourceWithoutArrayIsExcluded() throws Exception {
        writeFile(dir, "remote.json", "{\"url\": \"" + RAW_URL + "\", \"tths\": {}}");

        List<BlocklistSource> sources = registry.scanSources();

        assertTrue(sources.stream().noneMatch(s -> s.getName().equals("remote.json")));
        assertTrue(Files.exists(dir.resolve("remote.json")), "invalid files stay on disk");
        assertTrue(notifications.contains(Severity.ERROR, "remote.json"));
    }

    @Test
    void testInvalidSourceIsReportedOncePerFileVersion() throws Exception {
        String broken = "{\"url\": \"" + RAW_URL + "\", \"tths\": \"nope\"}";
        writeFile(dir, "remote.json", broken);

        registry.scanSources();
        registry.scanSources();
        registry.scanSources();
        assertEquals(1, notifications.count(Severity.ERROR));

        // Neu geschrieben, aber immer noch kaputt
        writeFile(dir, "remote.json", broken + " ");
        registry.scanSources();
        registry.scanSources();
        assertEquals(2, notifications.count(Severity.ERROR));
    }

    @Test
    void testSourceBrokenAgainAfterRepairIsReportedAgain() throws Exception {
        String broken = "{\"url\": \"" + RAW_URL + "\", \"tths\": \"nope\"}";
        writeFile(dir, "remote.json", broken);
        registry.scanSources();

        writeFile(dir, "remote.json", blocklistJson(RAW_URL, "1", tth(1)));
        registry.scanSources();
        assertNotNull(registry.getSource("remote.json"));

        writeFile(dir, "remote.json", broken);
        registry.scanSources();
        registry.scanSources();

        assertNull(registry.getSource("remote.json"));
        assertEquals(2, notifications.count(Severity.ERROR));
    }

    @Test
    void testRemoteSourceWithOnlyInvalidTthsIsExcluded() throws Exception {
        writeFile(dir, "remote.json", blocklistJson(RAW_URL, "1", "NOT-A-TTH"));

        registry.scanSources();

        assertNull(registry.getSource("remote.json"));
        assertTrue(notifications.contains(Severity.ERROR, "No valid TTHs found in blocklist remote.json"));
    }

    @Test
    void testRemoteSourceIsClassified() throws Exception {
        writeFile(dir, "remote.json", blocklistJson(RAW_URL, "3", tth(5)));

        registry.scanSources();

        BlocklistSource remote = registry.getSource("remote.json");
        assertTrue(remote.isRemote());
        assertEquals(RAW_URL, remote.getUrl());
        assertEquals(List.of(remote), registry.getRemoteSources());
        assertEquals("3", registry.getVersionToken("remote.json"));
    }

    @Test
    void testInternalSourceWithForeignOriginIsRepaired() throws Exception {
        writeFile(dir, SourceRegistry.INTERNAL_BLOCKLIST, blocklistJson("https://example.com/list", "1", tth(1)));

        registry.scanSources();

        BlocklistSource internal = registry.getSource(SourceRegistry.INTERNAL_BLOCKLIST);
        assertNotNull(internal);
        assertEquals("Internal", internal.getUrl());
        assertTrue(notifications.contains(Severity.ERROR, "internal blocklist"));
    }

    @Test
    void testRefreshDropsVanishedSource() throws Exception {
        Path file = writeFile(dir, "local.json", blocklistJson(null, "1", tth(1)));
        registry.scanSources();
        assertNotNull(registry.getSource("local.json"));

        Files.delete(file);

        assertNull(registry.refresh("local.json"));
        assertNull(registry.getSource("local.json"));
    }

    @Test
    void testUrlAcceptability() {
        assertTrue(BlocklistUrls.isAcceptable("Internal"));
        assertTrue(BlocklistUrls.isAcceptable(RAW_URL));
        assertTrue(BlocklistUrls.isAcceptable("http://git.example.org/lists/raw/main/list.json"));
        assertFalse(BlocklistUrls.isAcceptable("https://example.com/list.json"));
        assertFalse(BlocklistUrls.isAcceptable("ftp://raw.githubusercontent.com/list.json"));
        assertFalse(BlocklistUrls.isAcceptable("raw.githubusercontent.com/list.json"));
        assertFalse(BlocklistUrls.isAcceptable(null));
        assertFalse(BlocklistUrls.isRemote("Internal"));
    }

    @Test
    void testOnlyJsonFilesAreSources() throws Exception {
        writeFile(dir, "notes.txt", "hello");
        writeFile(dir, "local.json" + BlocklistFiles.WORK_SUFFIX, blocklistJson(null, "1", tth(1)));

        List<BlocklistSource> sources = registry.scanSources();

        assertEquals(1, sources.size());
        assertFalse(SourceRegistry.isSourceFileName("notes.txt"));
        assertFalse(SourceRegistry.isSourceFileName(".json"));
        assertTrue(SourceRegistry.isSourceFileName("a.json"));
    }
}
