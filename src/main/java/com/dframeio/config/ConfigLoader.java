package com.dframeio.config;

import com.dframeio.exception.ConfigurationException;
import com.dframeio.relational.PlaceholderStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads filter engine configuration from YAML files.
 * <p>
 * Expected layout, every key optional:
 * <pre>
 * filter:
 *   columnar:
 *     residual-split: true
 *   relational:
 *     placeholder-style: QUESTION_MARK
 *     quote-identifiers: true
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static FilterEngineConfig load(String path) {
        log.info("Loading filter configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Parse configuration from a YAML stream.
     *
     * @param inputStream YAML document
     * @return Parsed configuration
     */
    public static FilterEngineConfig load(InputStream inputStream) {
        return parseYaml(inputStream);
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    private static FilterEngineConfig parseYaml(InputStream inputStream) {
        Object document;
        try {
            document = new Yaml().load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML configuration: " + e.getMessage(), e);
        }

        if (document == null) {
            log.warn("Configuration file is empty, using defaults");
            return FilterEngineConfig.defaults();
        }
        Map<String, Object> root = asMap(document, "root");

        // The filter section may sit at the root or under a 'filter' key
        Map<String, Object> filterConfig = root.containsKey("filter")
                ? asMap(root.get("filter"), "filter")
                : root;

        FilterEngineConfig defaults = FilterEngineConfig.defaults();

        Map<String, Object> columnar = section(filterConfig, "columnar");
        boolean residualSplit = getBoolean(columnar, "residual-split", defaults.residualSplit());

        Map<String, Object> relational = section(filterConfig, "relational");
        PlaceholderStyle placeholderStyle = parsePlaceholderStyle(
                getString(relational, "placeholder-style", defaults.placeholderStyle().name()));
        boolean quoteIdentifiers = getBoolean(relational, "quote-identifiers", defaults.quoteIdentifiers());

        FilterEngineConfig config = new FilterEngineConfig(residualSplit, placeholderStyle, quoteIdentifiers);
        log.info("Loaded filter configuration: residualSplit={}, placeholderStyle={}, quoteIdentifiers={}",
                residualSplit, placeholderStyle, quoteIdentifiers);
        return config;
    }

    private static PlaceholderStyle parsePlaceholderStyle(String value) {
        try {
            return PlaceholderStyle.valueOf(value.trim().toUpperCase().replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown placeholder-style '" + value
                    + "'. Use QUESTION_MARK or NUMBERED.", e);
        }
    }

    private static Map<String, Object> section(Map<String, Object> parent, String key) {
        Object value = parent.get(key);
        if (value == null) {
            return Map.of();
        }
        return asMap(value, key);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String key) {
        if (!(value instanceof Map<?, ?>)) {
            throw new ConfigurationException("Configuration section '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(text);
        }
        throw new ConfigurationException("Expected true or false for '" + key + "', got '" + value + "'");
    }
}
