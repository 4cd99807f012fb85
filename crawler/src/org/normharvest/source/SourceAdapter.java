package org.normharvest.source;

import org.normharvest.RecordSink;

/**
 * Harvests one government site. Implementations discover the norms published in a year, fetch each one and hand
 * the results to the sink, routing per-document failures to {@link RecordSink#reject} instead of throwing.
 * <p>
 * By convention an adapter builds its search URLs in a {@code formatSearchUrl} method, lists documents in
 * {@code getDocsLinks} and turns one listing entry into a record in {@code getDocData}. Only
 * {@link #scrapeYear} is called by the engine.
 */
public interface SourceAdapter {
    /**
     * @throws Exception if the year cannot be harvested at all. This aborts the harvest
     */
    void scrapeYear(int year, RecordSink sink) throws Exception;
}
