package org.normharvest;

import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.normharvest.config.CrawlConfig;
import org.normharvest.config.HarvestConfig;
import org.normharvest.config.SourceConfig;
import org.normharvest.config.StorageConfig;
import org.normharvest.source.SourceAdapter;
import org.normharvest.source.SourceFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class HarvestTest {
    @TempDir
    Path tempDir;

    private final List<Integer> visitedYears = new CopyOnWriteArrayList<>();

    private HarvestConfig config(@Nullable String saveDir, int yearStart, int yearEnd) {
        var source = new SourceConfig(null, 2, false, false, false, false, "http://127.0.0.1:9/", "FAKE",
                null, null, null);
        return new HarvestConfig(new StorageConfig(saveDir, null, 0), new CrawlConfig(yearStart, yearEnd, 2, false),
                null, null, null, null, Map.of("fake", source));
    }

    /**
     * Two documents in 2020, a single unextractable one in 2021.
     */
    private SourceFactory fakeSource() {
        return context -> (year, sink) -> {
            visitedYears.add(year);
            if (year == 2020) {
                for (int i = 1; i <= 2; i++) {
                    sink.accept(DocumentRecord.markdown("Lei " + i + "/2020", year, "Lei", "Em vigor", null,
                            "texto " + i, "https://example.org/lei_" + i + ".pdf", Map.of()));
                }
            } else if (year == 2021) {
                sink.reject(new ErrorRecord("Lei 3/2021", year, "Lei", "Em vigor", null,
                        "https://example.org/lei_3.pdf", "No text", Map.of()));
            }
        };
    }

    private static List<Path> jsonFiles(Path dir) throws IOException {
        if (!Files.exists(dir)) return List.of();
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(p -> p.toString().endsWith(".json")).collect(Collectors.toList());
        }
    }

    @Test
    void harvestsYearsAndResumesFromCheckpoint() throws Exception {
        Path saveDir = tempDir.resolve("data");
        try (var harvest = new Harvest("fake", fakeSource(), config(saveDir.toString(), 2020, 2021), null)) {
            List<DocumentRecord> results = harvest.scrape();
            assertEquals(2, results.size());
            assertTrue(harvest.plan().forced());
            assertEquals(Harvest.State.STOPPED, harvest.state());
            Progress progress = harvest.progress(2021);
            assertEquals(2, progress.accepted());
            assertEquals(1, progress.rejected());
            assertEquals(2, progress.saved());
            assertEquals(1, progress.errorsSaved());
        }
        assertEquals(List.of(2020, 2021), visitedYears);
        assertEquals(2, jsonFiles(saveDir.resolve("FAKE").resolve("2020")).size());
        assertFalse(Files.exists(saveDir.resolve("FAKE").resolve("2021")));
        assertEquals(1, jsonFiles(saveDir.resolve("errors").resolve("FAKE").resolve("2021")).size());

        visitedYears.clear();
        try (var harvest = new Harvest("fake", fakeSource(),
                config(saveDir.toString(), CrawlConfig.DEFAULT_YEAR_START, 2021), null)) {
            harvest.scrape();
            assertFalse(harvest.plan().forced());
            assertEquals(2019, harvest.plan().resumeYear());
        }
        assertEquals(List.of(2019, 2020, 2021), visitedYears);
        assertEquals(2, jsonFiles(saveDir.resolve("FAKE").resolve("2020")).size());
    }

    @Test
    void scrapeWithoutSaveDirFails() throws Exception {
        try (var harvest = new Harvest("fake", fakeSource(), config(null, 2020, 2021), null)) {
            assertNull(harvest.saver());
            assertThrows(IllegalStateException.class, harvest::scrape);
        }
        assertTrue(visitedYears.isEmpty());
    }

    @Test
    void cancelStopsBeforeNextYear() throws Exception {
        Path saveDir = tempDir.resolve("data");
        var harvestRef = new Harvest[1];
        SourceFactory factory = context -> (year, sink) -> {
            visitedYears.add(year);
            sink.accept(DocumentRecord.markdown("Lei 1/" + year, year, "Lei", "Em vigor", null, "texto",
                    "https://example.org/lei_" + year + ".pdf", Map.of()));
            if (year == 2001) harvestRef[0].cancel();
            assertEquals(year < 2001, context.isRunning());
        };
        try (var harvest = new Harvest("fake", factory, config(saveDir.toString(), 2000, 2005), null)) {
            harvestRef[0] = harvest;
            harvest.scrape();
            assertTrue(harvest.isCancelled());
        }
        assertEquals(List.of(2000, 2001), visitedYears);
        assertEquals(2, jsonFiles(saveDir.resolve("FAKE")).size());
    }

    @Test
    void recordsAcceptedAfterCancelAreSaved() throws Exception {
        Path saveDir = tempDir.resolve("data");
        var harvestRef = new Harvest[1];
        SourceFactory factory = context -> (year, sink) -> {
            harvestRef[0].cancel();
            for (int i = 1; i <= 3; i++) {
                sink.accept(DocumentRecord.markdown("Lei " + i + "/" + year, year, "Lei", "Em vigor", null,
                        "texto", "https://example.org/lei_" + i + ".pdf", Map.of()));
            }
        };
        try (var harvest = new Harvest("fake", factory, config(saveDir.toString(), 2000, 2005), null)) {
            harvestRef[0] = harvest;
            assertTrue(harvest.awaitStopped(Duration.ZERO));
            harvest.scrape();
            assertEquals(3, harvest.saver().savedCount());
            assertEquals(0, harvest.saver().pending());
        }
        assertEquals(3, jsonFiles(saveDir.resolve("FAKE").resolve("2000")).size());
    }

    @Test
    void awaitStoppedWaitsForScrapeToReturn() throws Exception {
        Path saveDir = tempDir.resolve("data");
        var inYear = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        SourceFactory factory = context -> (year, sink) -> {
            inYear.countDown();
            release.await();
            sink.accept(DocumentRecord.markdown("Lei 1/" + year, year, "Lei", "Em vigor", null, "texto",
                    "https://example.org/lei_1.pdf", Map.of()));
        };
        try (var harvest = new Harvest("fake", factory, config(saveDir.toString(), 2000, 2005), null)) {
            var scrape = CompletableFuture.supplyAsync(() -> {
                try {
                    return harvest.scrape();
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            });
            assertTrue(inYear.await(5, TimeUnit.SECONDS));
            harvest.cancel();
            assertEquals(Harvest.State.STOPPING, harvest.state());
            assertFalse(harvest.awaitStopped(Duration.ofMillis(100)));

            release.countDown();
            assertTrue(harvest.awaitStopped(Duration.ofSeconds(10)));
            assertEquals(Harvest.State.STOPPED, harvest.state());
            assertEquals(1, scrape.get(5, TimeUnit.SECONDS).size());
        }
        assertEquals(1, jsonFiles(saveDir.resolve("FAKE")).size());
    }

    @Test
    void adapterFailureStillWritesQueuedRecords() throws Exception {
        Path saveDir = tempDir.resolve("data");
        SourceFactory factory = context -> (year, sink) -> {
            sink.accept(DocumentRecord.markdown("Lei 1/" + year, year, "Lei", "Em vigor", null, "texto",
                    "https://example.org/lei_1.pdf", Map.of()));
            throw new IOException("listing failed");
        };
        try (var harvest = new Harvest("fake", factory, config(saveDir.toString(), 2000, 2005), null)) {
            var e = assertThrows(IOException.class, harvest::scrape);
            assertEquals("listing failed", e.getMessage());
            assertEquals(Harvest.State.STOPPED, harvest.state());
        }
        assertEquals(1, jsonFiles(saveDir.resolve("FAKE").resolve("2000")).size());
    }

    @Test
    void unknownSourceIsRejected() {
        assertThrows(RuntimeException.class,
                () -> new Harvest("missing", fakeSource(), config(tempDir.toString(), 2020, 2021), null));
    }

    @Test
    void adapterReceivesConfiguredContext() throws Exception {
        var seen = new SourceAdapter[1];
        SourceFactory factory = context -> {
            assertEquals("fake", context.name());
            assertEquals(2, context.maxWorkers());
            assertEquals("http://127.0.0.1:9/", context.baseUrl());
            assertNull(context.browsers());
            assertFalse(context.extractor().isOcrEnabled());
            assertThrows(IllegalStateException.class, () -> context.loadPage("http://127.0.0.1:9/"));
            seen[0] = (year, sink) -> { };
            return seen[0];
        };
        try (var harvest = new Harvest("fake", factory, config(tempDir.toString(), 2020, 2020), null)) {
            assertNotNull(seen[0]);
            assertEquals("fake", harvest.sourceName());
        }
    }
}
