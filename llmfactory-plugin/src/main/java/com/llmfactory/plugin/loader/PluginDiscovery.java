package com.llmfactory.plugin.loader;

import com.llmfactory.common.store.ObjectStore;
import com.llmfactory.common.store.StoreLocations;
import com.llmfactory.plugin.PluginDiagnostic;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Enumerates plugin artifacts in a plugin directory.
 */
public final class PluginDiscovery {

    private PluginDiscovery() {
    }

    public static final Set<String> ARTIFACT_EXTENSIONS = Set.of(".jar");

    // =========================================================================
    // Discovery result types
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PluginCandidate {
        /** Provider key the artifact registers under. */
        private String idHint;
        private String source;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PluginDiscoveryResult {
        @Builder.Default
        private List<PluginCandidate> candidates = new ArrayList<>();
        @Builder.Default
        private List<PluginDiagnostic> diagnostics = new ArrayList<>();
    }

    // =========================================================================
    // Discovery
    // =========================================================================

    /**
     * List the plugin artifacts directly inside {@code location}, in
     * location order. Never throws: store failures and malformed locations
     * become diagnostics.
     */
    public static PluginDiscoveryResult discover(ObjectStore store, String location) {
        List<PluginCandidate> candidates = new ArrayList<>();
        List<PluginDiagnostic> diagnostics = new ArrayList<>();

        try {
            if (!store.isDirectory(location)) {
                diagnostics.add(PluginDiagnostic.warn(location, "plugin location is not a directory"));
                return new PluginDiscoveryResult(candidates, diagnostics);
            }
            for (String artifact : store.list(location, ARTIFACT_EXTENSIONS)) {
                candidates.add(PluginCandidate.builder()
                        .idHint(deriveIdHint(StoreLocations.fileName(artifact)))
                        .source(artifact)
                        .build());
            }
        } catch (RuntimeException e) {
            // Malformed locations surface as IllegalArgumentException or InvalidPathException.
            diagnostics.add(PluginDiagnostic.warn(location, "failed to scan plugin directory: " + e.getMessage()));
        }
        return new PluginDiscoveryResult(candidates, diagnostics);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    static String deriveIdHint(String fileName) {
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return base.toLowerCase(Locale.ROOT);
    }
}
