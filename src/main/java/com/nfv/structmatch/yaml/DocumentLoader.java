package com.nfv.structmatch.yaml;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads JSON and YAML documents into raw trees, and renders trees back as JSON or YAML
 */
@Slf4j
public class DocumentLoader {

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public DocumentLoader() {
        this.jsonMapper = new ObjectMapper();
        this.jsonMapper.registerModule(new Jdk8Module());
        this.jsonMapper.registerModule(new JavaTimeModule());
        this.jsonMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.registerModule(new Jdk8Module());
        this.yamlMapper.registerModule(new JavaTimeModule());
        this.yamlMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Load a document file. Files ending in .json are read as JSON, anything else as YAML.
     * A YAML file with several documents is returned as a list of them.
     *
     * @param path Path to the document file
     * @return the decoded tree of maps, lists and scalars
     */
    public Object load(String path) throws IOException {
        Path inputPath = Paths.get(path);
        if (!Files.exists(inputPath)) {
            throw new IOException("Path does not exist: " + path);
        }
        if (Files.isDirectory(inputPath)) {
            throw new IOException("Path is a directory, not a document: " + path);
        }

        File file = inputPath.toFile();
        if (isJsonFile(path)) {
            log.debug("Reading JSON document: {}", path);
            return jsonMapper.readValue(file, Object.class);
        }

        List<Object> documents = parseYamlFile(file);
        log.debug("Read {} YAML documents from {}", documents.size(), path);
        if (documents.isEmpty()) {
            return null;
        }
        return documents.size() == 1 ? documents.get(0) : documents;
    }

    /**
     * Parse YAML file which may contain single or multiple documents
     */
    private List<Object> parseYamlFile(File file) throws IOException {
        List<Object> documents = new ArrayList<>();
        try (MappingIterator<Object> it = yamlMapper.readerFor(Object.class).readValues(file)) {
            while (it.hasNextValue()) {
                Object doc = it.nextValue();
                if (doc != null) {
                    documents.add(doc);
                }
            }
        }
        return documents;
    }

    /**
     * Render a tree in the given output format
     *
     * @param format "json" or "yaml"
     */
    public String render(Object value, String format) throws JsonProcessingException {
        String normalizedFormat = format == null ? "json" : format.toLowerCase(Locale.ROOT);
        switch (normalizedFormat) {
            case "json":
                return jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
            case "yaml":
            case "yml":
                return yamlMapper.writeValueAsString(value);
            default:
                throw new IllegalArgumentException("Unsupported output format: " + format);
        }
    }

    private boolean isJsonFile(String path) {
        return path.toLowerCase(Locale.ROOT).endsWith(".json");
    }
}
