package org.normharvest;

import org.jetbrains.annotations.Nullable;
import org.normharvest.browser.ChromeDriverFactory;
import org.normharvest.browser.PageLoader;
import org.normharvest.browser.ResourcePool;
import org.normharvest.config.HarvestConfig;
import org.normharvest.config.SourceConfig;
import org.normharvest.extract.DocumentExtractor;
import org.normharvest.extract.LlmPageRecognizer;
import org.normharvest.extract.PageRecognizer;
import org.normharvest.http.BlockDetector;
import org.normharvest.http.EgressRotator;
import org.normharvest.http.ResilientHttpClient;
import org.normharvest.source.SourceAdapter;
import org.normharvest.source.SourceContext;
import org.normharvest.source.SourceFactory;
import org.normharvest.vpn.VpnManager;
import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A harvest of one source over a range of years.
 * <p>
 * Owns the HTTP client, browser pool, VPN manager and extractor the source adapter works with, and the
 * {@link Saver} its records go to. Years are harvested in ascending order starting from the year chosen by
 * {@link HarvestPlan}, so a restarted harvest picks up close to where the previous one stopped.
 */
public class Harvest implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Harvest.class);
    private final String sourceName;
    private final HarvestConfig config;
    private final SourceConfig sourceConfig;
    private final @Nullable Saver saver;
    private final ResilientHttpClient http;
    private final @Nullable VpnManager vpn;
    private final @Nullable ResourcePool<WebDriver> browsers;
    private final DocumentExtractor extractor;
    private final SourceAdapter adapter;
    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final ConcurrentLinkedQueue<DocumentRecord> results = new ConcurrentLinkedQueue<>();
    private final Lock startStopLock = new ReentrantLock();
    private volatile State state = State.STOPPED;
    private volatile boolean cancelled;
    private volatile @Nullable HarvestPlan plan;
    private volatile long startNanos;
    private volatile @Nullable CountDownLatch scrapeDone;

    public enum State {
        STOPPED, RUNNING, STOPPING
    }

    public Harvest(String sourceName, SourceFactory factory, HarvestConfig config) throws IOException {
        this(sourceName, factory, config, LlmPageRecognizer.fromConfig(config.llm()));
    }

    Harvest(String sourceName, SourceFactory factory, HarvestConfig config, @Nullable PageRecognizer recognizer)
            throws IOException {
        this.sourceName = sourceName;
        this.config = config;
        this.sourceConfig = config.source(sourceName);
        int maxWorkers = sourceConfig.maxWorkersOr(config.crawl().maxWorkers());

        Path savePath = config.storage().savePath();
        if (savePath != null) {
            String subdir = sourceConfig.saveSubdir();
            Path errorPath = config.storage().errorPath();
            this.saver = new Saver(subdir == null ? savePath : savePath.resolve(subdir),
                    subdir == null ? errorPath : errorPath.resolve(subdir),
                    config.storage().maxPathLength());
        } else {
            this.saver = null;
        }

        VpnManager vpn = null;
        ResourcePool<WebDriver> browsers = null;
        ResilientHttpClient http = null;
        try {
            if (sourceConfig.useVpn()) {
                vpn = new VpnManager(config.vpn());
            }
            EgressRotator egress = vpn != null ? vpn : EgressRotator.NONE;
            var blockDetector = new BlockDetector(sourceConfig.blockMarkers());
            http = new ResilientHttpClient(config.http(), sourceConfig.useSession(), blockDetector, egress);
            PageLoader pageLoader = null;
            if (sourceConfig.useBrowser()) {
                int size = sourceConfig.multipleBrowsers() ? maxWorkers : 1;
                browsers = new ResourcePool<>(size, new ChromeDriverFactory(config.browser()),
                        ChromeDriverFactory::quit);
                pageLoader = new PageLoader(config.browser(), blockDetector, egress);
            }
            this.extractor = new DocumentExtractor(http, recognizer, maxWorkers);
            var context = new SourceContext(sourceName, sourceConfig, http, extractor, browsers, pageLoader, egress,
                    maxWorkers, () -> !cancelled);
            this.adapter = factory.create(context);
        } catch (IOException | RuntimeException e) {
            if (browsers != null) browsers.close();
            if (vpn != null) vpn.close();
            if (http != null) http.close();
            throw e;
        }
        this.vpn = vpn;
        this.browsers = browsers;
        this.http = http;
    }

    /**
     * Harvests every year of the plan, then waits until the saver has written everything.
     *
     * @return the records accepted during this run
     * @throws IllegalStateException if no save directory is configured or the harvest is already running
     * @throws Exception             whatever aborted the source adapter; queued records are still written
     */
    public List<DocumentRecord> scrape() throws Exception {
        if (saver == null) {
            throw new IllegalStateException("Saver is not initialized: set storage.saveDir or SAVE_DIR");
        }
        var done = new CountDownLatch(1);
        startStopLock.lock();
        try {
            if (state != State.STOPPED || cancelled) throw new IllegalStateException("Harvest is " + state);
            state = State.RUNNING;
            scrapeDone = done;
        } finally {
            startStopLock.unlock();
        }

        startNanos = System.nanoTime();
        saver.start();
        try {
            HarvestPlan plan = HarvestPlan.plan(config.crawl().yearStart(), sourceConfig.firstYear(),
                    config.crawl().yearEndOrCurrent(), saver.checkpoint());
            this.plan = plan;
            if (plan.forced()) {
                log.info("Starting {} from {} (forced)", sourceName, plan.resumeYear());
            } else if (plan.resumeYear() > plan.yearStart()) {
                log.info("Resuming {} from {}", sourceName, plan.resumeYear());
            } else {
                log.info("Starting {} from {}", sourceName, plan.resumeYear());
            }

            var sink = new Sink();
            for (int year : plan.years()) {
                if (cancelled) break;
                Progress before = progress(year);
                adapter.scrapeYear(year, sink);
                Progress delta = progress(year).minus(before);
                log.atInfo().addKeyValue("source", sourceName).addKeyValue("year", year)
                        .log("{} {}: {} documents, {} errors in {}s (total {} documents, {} errors)",
                                sourceName, year, delta.accepted(), delta.rejected(), delta.elapsed().toSeconds(),
                                accepted.get(), rejected.get());
            }
        } finally {
            stopSaver();
            state = State.STOPPED;
            done.countDown();
        }
        log.info("Finished {}: {} documents, {} errors", sourceName, accepted.get(), rejected.get());
        return new ArrayList<>(results);
    }

    private class Sink implements RecordSink {
        @Override
        public void accept(DocumentRecord record) {
            saver.enqueueSuccess(record);
            results.add(record);
            accepted.incrementAndGet();
        }

        @Override
        public void reject(ErrorRecord record) {
            saver.enqueueError(record);
            rejected.incrementAndGet();
        }
    }

    /**
     * Stops issuing years. The year in progress runs to the end of its current fan-out, then {@link #scrape()}
     * stops the saver and returns. Safe to call from a shutdown hook and more than once.
     */
    public void cancel() {
        cancelled = true;
        if (state == State.RUNNING) state = State.STOPPING;
    }

    /**
     * Waits for a running {@link #scrape()} to return.
     *
     * @return false if it was still running after {@code timeout}
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        CountDownLatch done = scrapeDone;
        return done == null || done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void stopSaver() {
        if (saver != null) saver.close();
    }

    public Progress progress(int year) {
        Duration elapsed = startNanos == 0 ? Duration.ZERO : Duration.ofNanos(System.nanoTime() - startNanos);
        return new Progress(sourceName, year, accepted.get(), rejected.get(),
                saver == null ? 0 : saver.savedCount(),
                saver == null ? 0 : saver.errorsSavedCount(),
                saver == null ? 0 : saver.failedWriteCount(),
                elapsed);
    }

    public State state() {
        return state;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public @Nullable HarvestPlan plan() {
        return plan;
    }

    public @Nullable Saver saver() {
        return saver;
    }

    public String sourceName() {
        return sourceName;
    }

    @Override
    public void close() {
        startStopLock.lock();
        try {
            stopSaver();
            if (browsers != null) {
                try {
                    browsers.close();
                } catch (Exception e) {
                    log.error("Failed to close browsers", e);
                }
            }
            if (vpn != null) {
                try {
                    vpn.close();
                } catch (Exception e) {
                    log.error("Failed to disconnect VPN", e);
                }
            }
            http.close();
        } finally {
            startStopLock.unlock();
        }
    }
}
