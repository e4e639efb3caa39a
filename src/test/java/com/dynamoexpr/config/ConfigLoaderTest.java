package com.dynamoexpr.config;

import com.dynamoexpr.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should load the bundled default configuration")
    void shouldLoadDefaults() {
        ExpressionConfig config = ConfigLoader.load("classpath:dynamo-expr.yaml");

        assertEquals(ExpressionConfig.defaults(), config);
        assertTrue(config.parserOptions().strictSingleStatement());
    }

    @Test
    @DisplayName("Should read settings under the root key")
    void shouldLoadNestedSettings() {
        ExpressionConfig config = ConfigLoader.load("classpath:dynamo-expr-lenient.yaml");

        assertFalse(config.strictSingleStatement());
        assertFalse(config.caseInsensitiveKeywords());
    }

    @Test
    @DisplayName("Should read settings at the document root and default the rest")
    void shouldLoadFlatSettings() {
        ExpressionConfig config = ConfigLoader.load("classpath:dynamo-expr-flat.yaml");

        assertFalse(config.strictSingleStatement());
        assertTrue(config.caseInsensitiveKeywords());
    }

    @Test
    @DisplayName("Should load from the file system")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("expr.yaml");
        Files.writeString(file, "lexer:\n  case-insensitive-keywords: false\n");

        ExpressionConfig config = ConfigLoader.load(file.toString());

        assertTrue(config.strictSingleStatement());
        assertFalse(config.caseInsensitiveKeywords());
    }

    @Test
    @DisplayName("Should reject missing, empty and invalid files")
    void shouldRejectBadFiles() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:does-not-exist.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:dynamo-expr-empty.yaml"));

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:dynamo-expr-invalid.yaml"));
        assertTrue(e.getMessage().contains("strict-single-statement"));
    }

    @Test
    @DisplayName("Should reject documents that are not mappings")
    void shouldRejectNonMapping() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(
                new ByteArrayInputStream("just text".getBytes(StandardCharsets.UTF_8))));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.parseYaml(
                new ByteArrayInputStream("parser: 3".getBytes(StandardCharsets.UTF_8))));
    }
}
