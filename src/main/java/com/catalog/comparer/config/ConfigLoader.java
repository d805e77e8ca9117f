package com.catalog.comparer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads comparison configuration from JSON or YAML files
 */
@Slf4j
public class ConfigLoader {

    static final String DEFAULT_CONFIG = "config.json";
    static final String DEFAULT_YAML_CONFIG = "config.yaml";

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public ConfigLoader() {
        this.jsonMapper = new ObjectMapper();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * Load and validate configuration. A null or empty path means the default file
     * in the current directory.
     *
     * @param filePath Path to a JSON or YAML config file
     * @return validated configuration
     * @throws IOException if the file is missing, unreadable or invalid
     */
    public ComparisonConfig load(String filePath) throws IOException {
        ComparisonConfig config = read(filePath);
        return validated(config, filePath);
    }

    /**
     * Load configuration without validating it, so callers can apply overrides first
     */
    public ComparisonConfig read(String filePath) throws IOException {
        if (filePath == null || filePath.isEmpty()) {
            if (Files.exists(Paths.get(DEFAULT_CONFIG))) {
                log.info("Loading config from current directory: {}", DEFAULT_CONFIG);
                filePath = DEFAULT_CONFIG;
            } else if (Files.exists(Paths.get(DEFAULT_YAML_CONFIG))) {
                log.info("Loading config from current directory: {}", DEFAULT_YAML_CONFIG);
                filePath = DEFAULT_YAML_CONFIG;
            } else {
                throw new IOException("Config file not found: " + DEFAULT_CONFIG);
            }
        }

        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            throw new IOException("Config file not found: " + filePath);
        }
        if (!Files.isRegularFile(path)) {
            throw new IOException("Not a regular file: " + filePath);
        }

        File file = path.toFile();
        String lower = filePath.toLowerCase();
        ComparisonConfig config;
        if (lower.endsWith(".json")) {
            config = loadFromJson(file);
        } else if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            config = loadFromYaml(file);
        } else {
            // Try YAML first, then JSON
            try {
                config = loadFromYaml(file);
            } catch (IOException e) {
                log.debug("Failed to parse as YAML, trying JSON: {}", e.getMessage());
                config = loadFromJson(file);
            }
        }
        if (config == null) {
            throw new IOException("Config file is empty: " + filePath);
        }
        return config;
    }

    /**
     * Validate a configuration, translating validation failures into read failures
     */
    public ComparisonConfig validated(ComparisonConfig config, String source) throws IOException {
        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid config" + (source != null ? " '" + source + "'" : "")
                    + ": " + e.getMessage(), e);
        }
        log.info("Loaded comparison config: key field '{}', {} excluded columns, {} excluded attributes",
                config.getKeyField(), config.getExcludeColumns().size(),
                config.getExcludeAdditionalAttributes().size());
        return config;
    }

    private ComparisonConfig loadFromJson(File file) throws IOException {
        log.debug("Parsing as JSON: {}", file.getName());
        return jsonMapper.readValue(file, ComparisonConfig.class);
    }

    private ComparisonConfig loadFromYaml(File file) throws IOException {
        log.debug("Parsing as YAML: {}", file.getName());
        return yamlMapper.readValue(file, ComparisonConfig.class);
    }
}
