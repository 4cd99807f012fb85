package org.normharvest.browser;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.function.Supplier;
import java.util.logging.Level;

/**
 * Starts Chrome sessions configured by a {@link BrowserConfig}.
 */
public class ChromeDriverFactory implements Supplier<WebDriver> {
    private static final Logger log = LoggerFactory.getLogger(ChromeDriverFactory.class);

    static {
        // suppress noisy selenium logging
        java.util.logging.Logger.getLogger("org.openqa.selenium").setLevel(Level.WARNING);
    }

    private final BrowserConfig config;

    public ChromeDriverFactory(BrowserConfig config) {
        this.config = config;
    }

    ChromeOptions options() {
        var options = new ChromeOptions();
        options.addArguments(config.options());
        if (config.executable() != null) {
            options.setBinary(config.executable());
        }
        if (config.extension() != null) {
            File extension = new File(config.extension()).getAbsoluteFile();
            log.info("Loading browser extension from {}", extension);
            options.addExtensions(extension);
        }
        return options;
    }

    @Override
    public WebDriver get() {
        var driver = new ChromeDriver(options());
        log.info("Started browser session {}", driver.getSessionId());
        return driver;
    }

    /**
     * Pool closer for drivers. A session that already died is fine.
     */
    public static void quit(WebDriver driver) {
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.debug("Browser session already gone: {}", e.getMessage());
        }
    }
}
