package com.testbed.steps;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.testbed.errors.FileException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * YAML (de)serialization and file access for step state, results and test metadata.
 * Every I/O failure surfaces as {@link FileException}.
 */
public final class StepYaml {

    private static final ObjectMapper MAPPER = new ObjectMapper(
            new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private StepYaml() {
    }

    public static String dump(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + value.getClass().getSimpleName() + " to YAML", e);
        }
    }

    /** Parses a YAML mapping; an empty document yields an empty map. */
    public static Map<String, Object> loadMap(String yaml) {
        if (yaml == null || yaml.isBlank()) return new LinkedHashMap<>();
        try {
            Map<String, Object> map = MAPPER.readValue(yaml, MAP_TYPE);
            return map != null ? map : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid YAML mapping: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads and parses a YAML mapping file.
     *
     * @throws FileException if the file cannot be read or is not a YAML mapping
     */
    public static Map<String, Object> loadMap(Path path) {
        String yaml = read(path);
        if (yaml.isBlank()) return new LinkedHashMap<>();
        try {
            Map<String, Object> map = MAPPER.readValue(yaml, MAP_TYPE);
            return map != null ? map : new LinkedHashMap<>();
        } catch (JsonProcessingException e) {
            throw new FileException(path, "parse", e);
        }
    }

    public static <T> T convert(Object value, TypeReference<T> type) {
        return MAPPER.convertValue(value, type);
    }

    public static String read(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new FileException(path, "read", e);
        }
    }

    /** Writes (or appends to) a text file, creating parent directories as needed. */
    public static void write(Path path, String content, boolean append) {
        try {
            Path parent = path.getParent();
            if (parent != null) Files.createDirectories(parent);
            if (append) {
                Files.writeString(path, content, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } else {
                Files.writeString(path, content);
            }
        } catch (IOException e) {
            throw new FileException(path, "write", e);
        }
    }
}
