package org.normharvest.source;

import org.jetbrains.annotations.Nullable;
import org.normharvest.browser.PageLoader;
import org.normharvest.browser.ResourcePool;
import org.normharvest.config.SourceConfig;
import org.normharvest.extract.DocumentExtractor;
import org.normharvest.http.EgressRotator;
import org.normharvest.http.ResilientHttpClient;
import org.normharvest.util.Workers;
import org.openqa.selenium.WebDriver;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.function.BooleanSupplier;

/**
 * Everything the engine lends a source adapter.
 *
 * @param name       source name, used for thread names and log messages
 * @param config     the source's settings
 * @param http       HTTP client, in session mode if the source asked for it
 * @param extractor  HTML/PDF to markdown conversion
 * @param browsers   Chrome sessions, null unless the source uses a browser
 * @param pageLoader block-aware page loading for {@code browsers}
 * @param egress     egress rotation, a no-op unless the source uses the VPN
 * @param maxWorkers bound for every fan-out
 * @param running    false once the harvest has been cancelled
 */
public record SourceContext(
        String name,
        SourceConfig config,
        ResilientHttpClient http,
        DocumentExtractor extractor,
        @Nullable ResourcePool<WebDriver> browsers,
        @Nullable PageLoader pageLoader,
        EgressRotator egress,
        int maxWorkers,
        BooleanSupplier running) {

    public String baseUrl() {
        return config.baseUrl();
    }

    public boolean isRunning() {
        return running.getAsBoolean();
    }

    /**
     * Runs {@code task} over {@code items} on up to {@link #maxWorkers()} threads and returns the results in input
     * order.
     */
    public <T, R> List<R> fanOut(String stage, Collection<? extends T> items, Workers.Task<? super T, ? extends R> task)
            throws ExecutionException, InterruptedException {
        return Workers.fanOut(name + "-" + stage, maxWorkers, items, task);
    }

    /**
     * Loads a page in a pooled browser session.
     *
     * @return the page source, or null if it could not be loaded
     */
    public @Nullable String loadPage(String url) throws Exception {
        if (browsers == null || pageLoader == null) {
            throw new IllegalStateException("Source " + name + " is not configured with useBrowser");
        }
        return browsers.withResource(driver -> pageLoader.load(driver, url));
    }
}
