package com.llmfactory.common.config;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.llmfactory.common.errors.ConfigLoadError;
import com.llmfactory.common.errors.StoreAccessError;
import com.llmfactory.common.store.ObjectStore;
import com.llmfactory.common.store.StoreLocations;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a flat directory of YAML definition files into a raw, untyped tree
 * keyed by file base name.
 */
@Slf4j
public class ConfigSourceReader {

    public static final Set<String> DEFINITION_EXTENSIONS = Set.of(".yaml", ".yml");

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<LinkedHashMap<String, Object>> RAW_ENTRY = new TypeReference<>() {
    };

    private final ObjectStore store;

    public ConfigSourceReader(ObjectStore store) {
        this.store = store;
    }

    /**
     * Load every definition file directly under {@code location}.
     *
     * @param location    directory path or remote prefix
     * @param description label used in log and error messages ("local directory", "S3 directory")
     * @return raw tree, empty when the directory holds no definition files
     * @throws ConfigLoadError when the location is not a directory, a file cannot be read or parsed, or two
     *                         files share a base name
     */
    public Map<String, Map<String, Object>> readDirectory(String location, String description) {
        List<String> files;
        try {
            if (!store.isDirectory(location)) {
                throw new ConfigLoadError(location, description + " '" + location + "' is not a directory.");
            }
            files = store.list(location, DEFINITION_EXTENSIONS);
        } catch (StoreAccessError e) {
            throw new ConfigLoadError(location, "Failed to list " + description + ": " + e.getMessage(), e);
        }

        Map<String, Map<String, Object>> tree = new LinkedHashMap<>();
        Map<String, String> origins = new LinkedHashMap<>();
        for (String file : files) {
            String key = StoreLocations.baseName(file);
            String previous = origins.putIfAbsent(key, file);
            if (previous != null) {
                throw new ConfigLoadError(file,
                        "Definition '" + key + "' is defined more than once in " + description + " (also " + previous + ")");
            }
            tree.put(key, readFile(file));
        }
        log.debug("Read {} definition file(s) from {} {}", tree.size(), description, location);
        return tree;
    }

    /**
     * Parse one definition file into a raw map.
     */
    Map<String, Object> readFile(String file) {
        byte[] content;
        try {
            content = store.read(file);
        } catch (StoreAccessError e) {
            throw new ConfigLoadError(file, "Failed to read definition file: " + e.getMessage(), e);
        }

        JsonNode node;
        try {
            node = YAML_MAPPER.readTree(content);
        } catch (JsonProcessingException e) {
            JsonLocation loc = e.getLocation();
            int line = loc != null ? loc.getLineNr() : -1;
            int column = loc != null ? loc.getColumnNr() : -1;
            throw new ConfigLoadError(file, line, column,
                    "Failed to parse definition file: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigLoadError(file, "Failed to parse definition file: " + e.getMessage(), e);
        }

        if (node == null || node.isMissingNode() || node.isNull()) {
            return new LinkedHashMap<>();
        }
        if (!node.isObject()) {
            throw new ConfigLoadError(file, "Definition file must contain a mapping, found " + node.getNodeType());
        }
        return YAML_MAPPER.convertValue(node, RAW_ENTRY);
    }
}
