package org.normharvest.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds a {@link HarvestConfig} from, in increasing precedence, the bundled {@code defaults.yaml}, an optional
 * YAML file, environment variables and command-line overrides.
 */
public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final Pattern LIST_SEPARATOR = Pattern.compile("[," + Pattern.quote(File.pathSeparator) + "]");
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .findAndRegisterModules()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

    public ObjectMapper mapper() {
        return mapper;
    }

    public HarvestConfig load(@Nullable Path configFile, Map<String, String> env, @Nullable JsonNode overrides)
            throws IOException {
        JsonNode tree = defaults();
        if (configFile != null) {
            if (!Files.exists(configFile)) throw new ConfigException("Config file not found: " + configFile);
            log.debug("Loading configuration from {}", configFile);
            JsonNode fileTree = mapper.readTree(configFile.toFile());
            if (fileTree != null && !fileTree.isMissingNode()) {
                tree = deepMerge(tree, fileTree);
            }
        }
        tree = deepMerge(tree, environmentOverrides(env));
        if (overrides != null) {
            tree = deepMerge(tree, overrides);
        }
        HarvestConfig config;
        try {
            config = mapper.treeToValue(tree, HarvestConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid configuration: " + e.getOriginalMessage(), e);
        }
        return config.validate();
    }

    JsonNode defaults() throws IOException {
        try (InputStream stream = ConfigLoader.class.getResourceAsStream("defaults.yaml")) {
            if (stream == null) throw new IOException("defaults.yaml missing from classpath");
            return mapper.readTree(stream);
        }
    }

    /**
     * Maps the recognised environment variables onto the configuration tree.
     */
    ObjectNode environmentOverrides(Map<String, String> env) {
        ObjectNode root = mapper.createObjectNode();
        setIfPresent(env, "SAVE_DIR", value -> root.withObjectProperty("storage").put("saveDir", value));
        setIfPresent(env, "ERROR_LOG_DIR", value -> root.withObjectProperty("storage").put("errorDir", value));
        setIfPresent(env, "LLM_API_KEY", value -> root.withObjectProperty("llm").put("apiKey", value));
        setIfPresent(env, "PROVIDER_BASE_URL", value -> root.withObjectProperty("llm").put("baseUrl", value));
        setIfPresent(env, "LLM_MODEL", value -> root.withObjectProperty("llm").put("model", value));
        setIfPresent(env, "HTTP_PROXY", value -> root.withObjectProperty("http").put("proxy", value));
        setIfPresent(env, "YEAR_START", value -> root.withObjectProperty("crawl").put("yearStart", parseInt("YEAR_START", value)));
        setIfPresent(env, "YEAR_END", value -> root.withObjectProperty("crawl").put("yearEnd", parseInt("YEAR_END", value)));
        setIfPresent(env, "MAX_WORKERS", value -> root.withObjectProperty("crawl").put("maxWorkers", parseInt("MAX_WORKERS", value)));
        setIfPresent(env, "VERBOSE", value -> root.withObjectProperty("crawl").put("verbose", parseBoolean(value)));
        setIfPresent(env, "OPENVPN_CONFIG_FILES", value -> {
            var files = root.withObjectProperty("vpn").putArray("configFiles");
            Arrays.stream(LIST_SEPARATOR.split(value))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(files::add);
        });
        String username = env.get("OPENVPN_USERNAME");
        String password = env.get("OPENVPN_PASSWORD");
        if (username != null && password != null) {
            root.withObjectProperty("vpn").withObjectProperty("defaultCredentials")
                    .put("username", username)
                    .put("password", password);
        } else if (username != null || password != null) {
            log.warn("Ignoring OpenVPN credentials: both OPENVPN_USERNAME and OPENVPN_PASSWORD must be set");
        }
        return root;
    }

    private interface Setter {
        void set(String value);
    }

    private static void setIfPresent(Map<String, String> env, String name, Setter setter) {
        String value = env.get(name);
        if (value != null && !value.isBlank()) setter.set(value.trim());
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigException(name + " must be an integer, got: " + value);
        }
    }

    private static boolean parseBoolean(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "1", "true", "yes", "on" -> true;
            default -> false;
        };
    }

    /**
     * Merges {@code override} into {@code base}. Objects merge key by key, anything else is replaced.
     */
    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }

    /**
     * Renders the effective configuration as YAML with secrets masked.
     */
    public String dump(HarvestConfig config) throws JsonProcessingException {
        ObjectNode tree = mapper.valueToTree(config);
        if (tree.path("llm").has("apiKey")) ((ObjectNode) tree.get("llm")).put("apiKey", "***");
        JsonNode vpn = tree.path("vpn");
        if (vpn.path("defaultCredentials").isObject()) {
            ((ObjectNode) vpn.get("defaultCredentials")).put("password", "***");
        }
        if (vpn.path("credentials").isObject()) {
            vpn.get("credentials").forEach(creds -> {
                if (creds.isObject()) ((ObjectNode) creds).put("password", "***");
            });
        }
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
    }
}
