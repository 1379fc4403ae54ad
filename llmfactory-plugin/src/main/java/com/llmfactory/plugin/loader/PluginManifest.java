package com.llmfactory.plugin.loader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * Optional {@code llmfactory.plugin.json} descriptor at the root of a plugin jar.
 */
public final class PluginManifest {

    private PluginManifest() {
    }

    public static final String MANIFEST_FILENAME = "llmfactory.plugin.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Manifest {
        private String id;
        private String name;
        private String description;
        private String version;
        /** Fully qualified name of the model class to register. */
        private String entryClass;
    }

    /**
     * Read the manifest from an open jar.
     *
     * @return the manifest, or empty when the jar carries none
     * @throws IOException when the manifest exists but cannot be read or parsed
     */
    public static Optional<Manifest> read(JarFile jar) throws IOException {
        JarEntry entry = jar.getJarEntry(MANIFEST_FILENAME);
        if (entry == null) {
            return Optional.empty();
        }
        try (InputStream in = jar.getInputStream(entry)) {
            return Optional.of(MAPPER.readValue(in, Manifest.class));
        }
    }
}
