package org.normharvest;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.jetbrains.annotations.Nullable;
import org.normharvest.config.ConfigException;
import org.normharvest.config.ConfigLoader;
import org.normharvest.config.HarvestConfig;
import org.normharvest.source.SourceFactory;
import org.normharvest.source.SourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;

public class NormHarvest {
    private static final Logger log = LoggerFactory.getLogger(NormHarvest.class);
    static final int EXIT_OK = 0;
    static final int EXIT_SETUP_ERROR = 1;
    static final int EXIT_ABORTED = 2;
    private static volatile @Nullable Harvest current;
    private static volatile boolean finished;
    private static final Duration SHUTDOWN_GRACE = Duration.ofMinutes(2);

    public static void main(String[] args) {
        Runtime.getRuntime().addShutdownHook(new Thread(NormHarvest::onShutdown, "shutdown-hook"));
        int status;
        try {
            status = run(args, System.getenv(), SourceRegistry.builtIn(), System.out);
        } catch (Exception e) {
            log.error("Unexpected error", e);
            status = EXIT_ABORTED;
        }
        finished = true;
        System.exit(status);
    }

    /**
     * Ctrl-C: let the year in progress finish its current fan-out and the saver write what is queued, then exit.
     */
    private static void onShutdown() {
        if (finished) return;
        Harvest harvest = current;
        if (harvest != null) {
            System.err.println("Interrupted, saving queued records before exiting...");
            stopAndWait(harvest, SHUTDOWN_GRACE);
            System.err.println("Queued records saved.");
        }
        ((LoggerContext) LoggerFactory.getILoggerFactory()).stop();
        Runtime.getRuntime().halt(EXIT_OK);
    }

    static void stopAndWait(Harvest harvest, Duration grace) {
        harvest.cancel();
        try {
            if (!harvest.awaitStopped(grace)) {
                log.warn("{} still running after {}s, closing it anyway", harvest.sourceName(), grace.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        harvest.close();
    }

    static int run(String[] args, Map<String, String> env, SourceRegistry registry, PrintStream out) {
        Path configFile = null;
        var overrides = JsonNodeFactory.instance.objectNode();
        var sources = new ArrayList<String>();
        boolean dumpConfig = false;
        boolean list = false;

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--config", "-c" -> configFile = Path.of(args[++i]);
                    case "--year-start" -> overrides.withObjectProperty("crawl").put("yearStart", Integer.parseInt(args[++i]));
                    case "--year-end" -> overrides.withObjectProperty("crawl").put("yearEnd", Integer.parseInt(args[++i]));
                    case "--max-workers" -> overrides.withObjectProperty("crawl").put("maxWorkers", Integer.parseInt(args[++i]));
                    case "--verbose", "-v" -> overrides.withObjectProperty("crawl").put("verbose", true);
                    case "--list" -> list = true;
                    case "--dump-config" -> dumpConfig = true;
                    case "--help", "-h" -> {
                        usage(out);
                        return EXIT_OK;
                    }
                    default -> {
                        if (args[i].startsWith("-")) {
                            System.err.println("Unknown option: " + args[i]);
                            return EXIT_SETUP_ERROR;
                        }
                        sources.add(args[i]);
                    }
                }
            }
        } catch (ArrayIndexOutOfBoundsException e) {
            System.err.println("Missing value for option " + args[args.length - 1]);
            return EXIT_SETUP_ERROR;
        } catch (NumberFormatException e) {
            System.err.println("Expected a number: " + e.getMessage());
            return EXIT_SETUP_ERROR;
        }

        var loader = new ConfigLoader();
        HarvestConfig config;
        try {
            config = loader.load(configFile, env, overrides);
        } catch (ConfigException | IOException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_SETUP_ERROR;
        }
        if (config.crawl().verbose()) {
            setVerbose();
        }

        if (dumpConfig) {
            try {
                out.println(loader.dump(config));
            } catch (JsonProcessingException e) {
                log.error("Couldn't render configuration", e);
                return EXIT_SETUP_ERROR;
            }
            return EXIT_OK;
        }
        if (list) {
            for (String name : registry.names()) {
                out.println(name + (config.sources().containsKey(name) ? "" : " (not configured)"));
            }
            return EXIT_OK;
        }
        if (sources.isEmpty()) {
            usage(System.err);
            return EXIT_SETUP_ERROR;
        }

        var factories = new ArrayList<SourceFactory>();
        for (String name : sources) {
            SourceFactory factory = registry.get(name);
            if (factory == null) {
                log.error("Unknown source: {} (available: {})", name, String.join(", ", registry.names()));
                return EXIT_SETUP_ERROR;
            }
            if (!config.sources().containsKey(name)) {
                log.error("No configuration for source {} under sources.{}", name, name);
                return EXIT_SETUP_ERROR;
            }
            factories.add(factory);
        }

        for (int i = 0; i < sources.size(); i++) {
            int status = harvest(sources.get(i), factories.get(i), config);
            if (status != EXIT_OK) return status;
        }
        return EXIT_OK;
    }

    private static int harvest(String name, SourceFactory factory, HarvestConfig config) {
        Harvest harvest = newHarvest(name, factory, config);
        if (harvest == null) return EXIT_SETUP_ERROR;
        current = harvest;
        try (harvest) {
            harvest.scrape();
            if (harvest.isCancelled()) {
                log.warn("Harvest of {} cancelled", name);
                return EXIT_ABORTED;
            }
            return EXIT_OK;
        } catch (IllegalStateException e) {
            log.error("Can't harvest {}: {}", name, e.getMessage());
            return EXIT_SETUP_ERROR;
        } catch (Exception e) {
            log.error("Harvest of {} aborted", name, e);
            return EXIT_ABORTED;
        } finally {
            current = null;
        }
    }

    private static @Nullable Harvest newHarvest(String name, SourceFactory factory, HarvestConfig config) {
        try {
            return new Harvest(name, factory, config);
        } catch (IOException | RuntimeException e) {
            log.error("Couldn't set up {}: {}", name, e.getMessage());
            return null;
        }
    }

    private static void setVerbose() {
        var context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger("org.normharvest").setLevel(Level.DEBUG);
    }

    private static void usage(PrintStream out) {
        out.println("Usage: normharvest [options] SOURCE...");
        out.println("Options:");
        out.println("  -c, --config FILE        YAML configuration merged over the defaults");
        out.println("      --dump-config        Print the effective configuration and exit");
        out.println("  -h, --help");
        out.println("      --list               List the available sources");
        out.println("      --max-workers N      Worker threads per stage");
        out.println("  -v, --verbose            Debug logging");
        out.println("      --year-end YEAR      Last year to harvest (default: current year)");
        out.println("      --year-start YEAR    Start at YEAR even if earlier output exists");
        out.println();
        out.println("Environment: SAVE_DIR, ERROR_LOG_DIR, LLM_API_KEY, PROVIDER_BASE_URL, LLM_MODEL,");
        out.println("  OPENVPN_CONFIG_FILES, OPENVPN_USERNAME, OPENVPN_PASSWORD, HTTP_PROXY,");
        out.println("  YEAR_START, YEAR_END, MAX_WORKERS, VERBOSE");
    }
}
