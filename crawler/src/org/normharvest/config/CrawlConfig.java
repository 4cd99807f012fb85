package org.normharvest.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jetbrains.annotations.Nullable;

import java.time.Year;

/**
 * Configuration for how the harvest runs.
 *
 * @param yearStart  first year to harvest. Any value other than {@link #DEFAULT_YEAR_START} forces the
 *                   harvest to start there even if earlier output exists
 * @param yearEnd    last year to harvest, the current year when unset
 * @param maxWorkers size of every worker pool, and of the browser pool for sources using several browsers
 * @param verbose    log per-partition progress at debug level
 */
public record CrawlConfig(
        int yearStart,
        @Nullable Integer yearEnd,
        int maxWorkers,
        boolean verbose) {

    public static final int DEFAULT_YEAR_START = 1808;
    public static final int DEFAULT_MAX_WORKERS = 16;

    @JsonCreator
    public CrawlConfig {
        if (yearStart == 0) yearStart = DEFAULT_YEAR_START;
        if (maxWorkers == 0) maxWorkers = DEFAULT_MAX_WORKERS;
    }

    public CrawlConfig() {
        this(0, null, 0, false);
    }

    public int yearEndOrCurrent() {
        return yearEnd != null ? yearEnd : Year.now().getValue();
    }

    @JsonIgnore
    public boolean isForcedStart() {
        return yearStart != DEFAULT_YEAR_START;
    }

    void validate() {
        if (maxWorkers < 1) throw new ConfigException("crawl.maxWorkers must be at least 1, got " + maxWorkers);
        if (yearEndOrCurrent() < yearStart) {
            throw new ConfigException("crawl.yearEnd " + yearEndOrCurrent() + " is before crawl.yearStart " + yearStart);
        }
    }
}
