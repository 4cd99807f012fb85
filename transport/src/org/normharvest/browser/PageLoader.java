package org.normharvest.browser;

import org.jetbrains.annotations.Nullable;
import org.normharvest.http.BlockDetector;
import org.normharvest.http.EgressRotator;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Loads pages in a browser session, switching egress IP while the site serves its block page.
 */
public class PageLoader {
    private static final Logger log = LoggerFactory.getLogger(PageLoader.class);
    static final int MAX_ATTEMPTS = 3;
    private final BlockDetector blockDetector;
    private final EgressRotator egressRotator;
    private final Duration settleDelay;
    private final int maxRotations;

    public PageLoader(BrowserConfig config, BlockDetector blockDetector, EgressRotator egressRotator) {
        this(blockDetector, egressRotator, config.pageLoadDelay(), config.maxRotations());
    }

    PageLoader(BlockDetector blockDetector, EgressRotator egressRotator, Duration settleDelay, int maxRotations) {
        this.blockDetector = blockDetector;
        this.egressRotator = egressRotator;
        this.settleDelay = settleDelay;
        this.maxRotations = maxRotations;
    }

    /**
     * Navigates {@code driver} to {@code url} and returns the page source.
     *
     * @return the page source, or null if the page could not be loaded or stayed blocked
     */
    public @Nullable String load(WebDriver driver, String url) throws InterruptedException {
        WebDriverException lastError = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                long egressGeneration = egressRotator.generation();
                driver.get(url);
                if (!waitUntilUnblocked(driver, egressGeneration)) {
                    log.warn("Still blocked after {} egress rotations: {}", maxRotations, url);
                    return null;
                }
                settle();
                return driver.getPageSource();
            } catch (WebDriverException e) {
                lastError = e;
                log.warn("Error loading {} (attempt {}/{}): {}", url, attempt, MAX_ATTEMPTS, e.getMessage());
            }
        }
        log.error("Giving up on {}", url, lastError);
        return null;
    }

    /**
     * Rotates egress and reloads for as long as the current page is the block page.
     *
     * @return false if the page is still blocked after the allowed number of rotations
     */
    public boolean waitUntilUnblocked(WebDriver driver) throws InterruptedException {
        return waitUntilUnblocked(driver, egressRotator.generation());
    }

    /**
     * @param egressGeneration the rotation generation read before the current page was requested
     */
    boolean waitUntilUnblocked(WebDriver driver, long egressGeneration) throws InterruptedException {
        long seen = egressGeneration;
        for (int rotation = 0; blockDetector.isBlocked(driver.getPageSource()); rotation++) {
            if (rotation >= maxRotations) return false;
            log.warn("Access blocked, changing egress ({}/{})", rotation + 1, maxRotations);
            egressRotator.rotate(seen);
            seen = egressRotator.generation();
            settle();
            driver.navigate().refresh();
        }
        return true;
    }

    private void settle() throws InterruptedException {
        if (!settleDelay.isZero()) Thread.sleep(settleDelay.toMillis());
    }
}
