package com.llmfactory.plugin;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A note produced while discovering or loading plugin artifacts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PluginDiagnostic {
    /** Artifact location, or the plugin directory for location-level problems. */
    private String source;
    private String level; // "info", "warn", "error"
    private String message;

    public static PluginDiagnostic warn(String source, String message) {
        return PluginDiagnostic.builder().source(source).level("warn").message(message).build();
    }

    public static PluginDiagnostic info(String source, String message) {
        return PluginDiagnostic.builder().source(source).level("info").message(message).build();
    }
}
