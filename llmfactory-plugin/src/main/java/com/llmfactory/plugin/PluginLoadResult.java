package com.llmfactory.plugin;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one plugin loading pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PluginLoadResult {
    /** Plugin directory that was scanned, null when none was configured. */
    private String location;
    @Builder.Default
    private List<String> registeredKeys = new ArrayList<>();
    @Builder.Default
    private List<PluginDiagnostic> diagnostics = new ArrayList<>();
}
