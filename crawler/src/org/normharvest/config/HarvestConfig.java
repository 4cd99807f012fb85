package org.normharvest.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import org.normharvest.browser.BrowserConfig;
import org.normharvest.http.HttpConfig;
import org.normharvest.vpn.VpnConfig;

import java.util.Map;

/**
 * Root configuration, built once by {@link ConfigLoader} and handed to every component.
 *
 * @param storage output locations
 * @param crawl   year range and concurrency
 * @param http    retry behaviour of the HTTP client
 * @param llm     OCR model for scanned PDFs
 * @param vpn     egress rotation
 * @param browser Chrome sessions for sources that need one
 * @param sources per-source settings keyed by source name
 */
public record HarvestConfig(
        StorageConfig storage,
        CrawlConfig crawl,
        HttpConfig http,
        LlmConfig llm,
        VpnConfig vpn,
        BrowserConfig browser,
        Map<String, SourceConfig> sources) {

    @JsonCreator
    public HarvestConfig {
        if (storage == null) storage = new StorageConfig();
        if (crawl == null) crawl = new CrawlConfig();
        if (http == null) http = new HttpConfig();
        if (llm == null) llm = new LlmConfig();
        if (vpn == null) vpn = new VpnConfig();
        if (browser == null) browser = new BrowserConfig();
        if (sources == null) sources = Map.of();
    }

    public HarvestConfig() {
        this(null, null, null, null, null, null, null);
    }

    public SourceConfig source(String name) {
        SourceConfig source = sources.get(name);
        if (source == null) throw new ConfigException("No configuration for source: " + name);
        return source;
    }

    public HarvestConfig validate() {
        crawl.validate();
        sources.forEach((name, source) -> source.validate(name, vpn));
        return this;
    }
}
