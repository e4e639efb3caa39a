package com.dynamoexpr.config;

import com.dynamoexpr.exception.ConfigurationException;
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
 * Loads expression configuration from YAML files.
 * <pre>
 * dynamo-expr:
 *   parser:
 *     strict-single-statement: true
 *   lexer:
 *     case-insensitive-keywords: true
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String ROOT_KEY = "dynamo-expr";

    private ConfigLoader() {
    }

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static ExpressionConfig load(String path) {
        log.info("Loading expression configuration from: {}", path);

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

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    static ExpressionConfig parseYaml(InputStream inputStream) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(inputStream);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Configuration file is not a valid YAML mapping", e);
        }

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // Settings may sit at the root or under the 'dynamo-expr' key
        Map<String, Object> config = root.containsKey(ROOT_KEY)
                ? getSection(root, ROOT_KEY)
                : root;

        ExpressionConfig defaults = ExpressionConfig.defaults();
        Map<String, Object> parser = getSection(config, "parser");
        Map<String, Object> lexer = getSection(config, "lexer");

        ExpressionConfig result = new ExpressionConfig(
                getBoolean(parser, "strict-single-statement", defaults.strictSingleStatement()),
                getBoolean(lexer, "case-insensitive-keywords", defaults.caseInsensitiveKeywords())
        );
        log.debug("Loaded expression configuration: {}", result);
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getSection(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Section '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw new ConfigurationException("Setting '" + key + "' must be true or false, got: " + value);
    }
}
