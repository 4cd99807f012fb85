package org.normharvest;

import org.jetbrains.annotations.Nullable;
import org.normharvest.config.CrawlConfig;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * The years a harvest will visit.
 *
 * @param yearStart  first year of the range
 * @param yearEnd    last year of the range, inclusive
 * @param resumeYear first year actually harvested. Years before it are skipped
 * @param forced     the start year was given explicitly, so existing output was ignored
 */
public record HarvestPlan(int yearStart, int yearEnd, int resumeYear, boolean forced) {

    /**
     * Picks the resume year. An explicit start year (anything but {@link CrawlConfig#DEFAULT_YEAR_START}) wins
     * outright. Otherwise the harvest continues from the checkpoint, but never before the source's first year.
     */
    public static HarvestPlan plan(int requestedStart, int sourceFirstYear, int yearEnd, @Nullable Integer checkpoint) {
        if (requestedStart != CrawlConfig.DEFAULT_YEAR_START) {
            return new HarvestPlan(requestedStart, yearEnd, requestedStart, true);
        }
        int resume = checkpoint == null ? sourceFirstYear : Math.max(checkpoint, sourceFirstYear);
        return new HarvestPlan(sourceFirstYear, yearEnd, resume, false);
    }

    public List<Integer> years() {
        return IntStream.rangeClosed(resumeYear, yearEnd).boxed().collect(Collectors.toList());
    }
}
