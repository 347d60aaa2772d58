package com.nfv.structmatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nfv.structmatch.comparison.ContainsOptions;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;

/**
 * Loads comparison options from YAML files
 */
@Slf4j
public class ConfigLoader {

    static final String DEFAULT_CONFIG = "comparison-config.yaml";

    private final ObjectMapper yamlMapper;
    private final String workingDirectory;

    public ConfigLoader() {
        this(null);
    }

    /**
     * @param workingDirectory directory searched for comparison-config.yaml, null for the process working directory
     */
    public ConfigLoader(String workingDirectory) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.registerModule(new Jdk8Module());
        this.yamlMapper.registerModule(new JavaTimeModule());
        this.workingDirectory = workingDirectory;
    }

    /**
     * Load options from default classpath resource
     */
    public ContainsOptions loadDefault() {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                log.warn("Default config file '{}' not found, using default options", DEFAULT_CONFIG);
                return ContainsOptions.defaults();
            }

            ContainsOptions options = readOptions(yamlMapper.readValue(is, ContainsOptions.class));
            log.info("Loaded default comparison config with {} ignore paths", options.getIgnorePaths().size());
            return options;

        } catch (Exception e) {
            log.error("Failed to load default config, using default options", e);
            return ContainsOptions.defaults();
        }
    }

    /**
     * Load options from a specific file path
     */
    public ContainsOptions loadFromFile(String filePath) {
        try {
            File configFile = new File(filePath);
            if (!configFile.exists()) {
                log.error("Config file not found: {}", filePath);
                return ContainsOptions.defaults();
            }

            ContainsOptions options = readOptions(yamlMapper.readValue(configFile, ContainsOptions.class));
            log.info("Loaded comparison config from '{}' with {} ignore paths",
                    filePath, options.getIgnorePaths().size());
            return options;

        } catch (Exception e) {
            log.error("Failed to load config from file: {}", filePath, e);
            return ContainsOptions.defaults();
        }
    }

    /**
     * Load options from file path, or use default file in the working directory, or the classpath default
     */
    public ContainsOptions load(String filePath) {
        if (filePath == null || filePath.isEmpty()) {
            String defaultPath = workingDirectory == null
                    ? DEFAULT_CONFIG
                    : Paths.get(workingDirectory, DEFAULT_CONFIG).toString();
            if (Files.exists(Paths.get(defaultPath))) {
                log.info("Loading config from working directory: {}", defaultPath);
                return loadFromFile(defaultPath);
            }
            log.info("No config file in working directory, using default from classpath");
            return loadDefault();
        }

        if (!Files.exists(Paths.get(filePath))) {
            log.warn("Config file '{}' not found, using default options", filePath);
            return ContainsOptions.defaults();
        }

        return loadFromFile(filePath);
    }

    /**
     * An empty YAML document reads as null, and an explicit "ignorePaths:" as a null list
     */
    private static ContainsOptions readOptions(ContainsOptions options) {
        if (options == null) {
            return ContainsOptions.defaults();
        }
        if (options.getIgnorePaths() == null) {
            options.setIgnorePaths(new ArrayList<>());
        }
        return options;
    }
}
