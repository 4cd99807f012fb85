package org.normharvest.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import org.jetbrains.annotations.Nullable;
import org.normharvest.vpn.VpnConfig;

import java.util.List;
import java.util.Map;

/**
 * Per-source settings.
 *
 * @param yearStart        first year the source publishes anything. A lower bound for the harvest, not a forced
 *                         start
 * @param maxWorkers       overrides {@link CrawlConfig#maxWorkers()} for this source
 * @param useBrowser       load pages through Chrome instead of plain HTTP
 * @param multipleBrowsers run one browser per worker rather than a single shared one
 * @param useSession       keep cookies across HTTP requests
 * @param useVpn           rotate the egress IP through the VPN when the site blocks us
 * @param baseUrl          site root the adapter builds its URLs from
 * @param saveSubdir       subdirectory of the save and error trees for this source's records
 * @param blockMarkers     body snippets of the page the site serves once it has banned our IP
 * @param boilerplate      static header and footer snippets stripped from converted documents
 * @param options          adapter specific settings
 */
public record SourceConfig(
        @Nullable Integer yearStart,
        @Nullable Integer maxWorkers,
        boolean useBrowser,
        boolean multipleBrowsers,
        boolean useSession,
        boolean useVpn,
        @Nullable String baseUrl,
        @Nullable String saveSubdir,
        List<String> blockMarkers,
        List<String> boilerplate,
        Map<String, String> options) {

    @JsonCreator
    public SourceConfig {
        if (blockMarkers == null) blockMarkers = List.of();
        if (boilerplate == null) boilerplate = List.of();
        if (options == null) options = Map.of();
    }

    public SourceConfig() {
        this(null, null, false, false, false, false, null, null, null, null, null);
    }

    public int firstYear() {
        return yearStart != null ? yearStart : CrawlConfig.DEFAULT_YEAR_START;
    }

    public int maxWorkersOr(int fallback) {
        return maxWorkers != null ? maxWorkers : fallback;
    }

    public String option(String name, String fallback) {
        return options.getOrDefault(name, fallback);
    }

    /**
     * Rejects option combinations that would otherwise be silently ignored.
     */
    public void validate(String name, VpnConfig vpn) {
        if (multipleBrowsers && !useBrowser) {
            throw new ConfigException("sources." + name + ": multipleBrowsers requires useBrowser");
        }
        if (useVpn && !vpn.isConfigured()) {
            throw new ConfigException("sources." + name + ": useVpn requires vpn.configFiles (or OPENVPN_CONFIG_FILES)");
        }
        if (maxWorkers != null && maxWorkers < 1) {
            throw new ConfigException("sources." + name + ": maxWorkers must be at least 1, got " + maxWorkers);
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ConfigException("sources." + name + ": baseUrl is required");
        }
    }
}
