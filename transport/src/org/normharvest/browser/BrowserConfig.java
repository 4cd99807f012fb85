package org.normharvest.browser;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.normharvest.util.jackson.DurationDeserializer;
import org.normharvest.util.jackson.ShellCommandDeserializer;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for the Chrome sessions used by sources that need a real browser.
 *
 * @param executable    Chrome binary to use instead of the one Selenium finds
 * @param options       command-line options, as a list or a single string
 * @param extension     packed extension (.crx) to load into every session
 * @param pageLoadDelay time to let scripts settle after a page load
 * @param maxRotations  egress rotations to attempt per page load while a block page is shown
 */
public record BrowserConfig(
        @Nullable String executable,
        @JsonDeserialize(using = ShellCommandDeserializer.class)
        List<String> options,
        @Nullable String extension,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration pageLoadDelay,
        int maxRotations
) {
    public static final List<String> DEFAULT_OPTIONS = List.of("--no-sandbox", "--disable-dev-shm-usage",
            "--disable-gpu", "--enable-javascript");

    @JsonCreator
    public BrowserConfig {
        if (options == null) options = DEFAULT_OPTIONS;
        if (pageLoadDelay == null) pageLoadDelay = Duration.ofSeconds(1);
        if (maxRotations <= 0) maxRotations = 10;
    }

    public BrowserConfig() {
        this(null, null, null, null, 0);
    }
}
