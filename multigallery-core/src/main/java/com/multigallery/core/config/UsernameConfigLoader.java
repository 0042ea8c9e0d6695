package com.multigallery.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.multigallery.core.site.SiteDescriptor;
import com.multigallery.core.site.SiteRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Loads the username configuration from a JSON file.
 *
 * <p>The file holds a single object mapping site names (any alias, case-insensitive) to
 * usernames:
 * <pre>{@code
 * {
 *   "eka": "Lorem",
 *   "fa": "Ipsum",
 *   "mastodon": "dolor@example.social"
 * }
 * }</pre>
 *
 * <p>Unknown keys are logged and skipped. All other problems are collected and reported
 * together in one {@link ConfigurationException}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * UsernameConfig config = UsernameConfigLoader.load(Paths.get("config.json"), SiteRegistry.defaults());
 * config.username("furaffinity"); // Optional[Ipsum]
 * }</pre>
 */
public class UsernameConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(UsernameConfigLoader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    /**
     * Loads a configuration file.
     *
     * @param configPath path to the JSON file
     * @param registry registry used to resolve site names
     * @return configuration with at least one site
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public static UsernameConfig load(Path configPath, SiteRegistry registry) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigurationException("Configuration file not found: " + configPath, List.of());
        }
        String json;
        try {
            log.debug("Loading configuration from: {}", configPath);
            json = Files.readString(configPath);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration file: " + configPath, e);
        }
        UsernameConfig config = parse(json, configPath.toString(), registry);
        log.info("Loaded configuration from: {} ({} sites)", configPath, config.sites().size());
        return config;
    }

    /**
     * Parses configuration JSON.
     *
     * @param json JSON text
     * @param source name of the source for messages
     * @param registry registry used to resolve site names
     * @return configuration with at least one site
     * @throws ConfigurationException if the JSON is invalid
     */
    public static UsernameConfig parse(String json, String source, SiteRegistry registry) {
        JsonNode root;
        try {
            root = JSON_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid JSON in configuration " + source
                + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Invalid configuration " + source,
                List.of("the configuration must contain a JSON object"));
        }

        Map<String, String> usernames = new LinkedHashMap<>();
        Map<String, String> keysBySite = new LinkedHashMap<>();
        List<String> problems = new ArrayList<>();

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();

            if (!value.isTextual()) {
                problems.add("invalid value for \"" + key + "\": expected string, got "
                    + value.getNodeType().name().toLowerCase(Locale.ROOT));
                continue;
            }
            Optional<SiteDescriptor> site = registry.find(key);
            if (site.isEmpty()) {
                log.warn("Ignoring unknown configuration key \"{}\"", key);
                continue;
            }
            String id = site.get().id();
            String username = value.asText().trim();
            if (keysBySite.containsKey(id)) {
                problems.add("duplicate entry for site \"" + id + "\": \"" + key
                    + "\" collides with \"" + keysBySite.get(id) + "\"");
                continue;
            }
            keysBySite.put(id, key);
            if (username.isEmpty()) {
                problems.add("empty username for \"" + key + "\"");
                continue;
            }
            try {
                site.get().profileUrlOf(username);
            } catch (IllegalArgumentException e) {
                problems.add("invalid username for \"" + key + "\": " + e.getMessage());
                continue;
            }
            usernames.put(id, username);
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid configuration " + source, problems);
        }
        if (usernames.isEmpty()) {
            throw new ConfigurationException("Invalid configuration " + source,
                List.of("no valid sites defined"));
        }
        return UsernameConfig.of(usernames);
    }

    private UsernameConfigLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }
}
