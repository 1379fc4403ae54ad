package com.llmfactory.common.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Merge utilities for raw definition trees.
 */
public final class ConfigMerge {

    private ConfigMerge() {
    }

    // =========================================================================
    // Entry merge
    // =========================================================================

    /**
     * Apply the fields of {@code patch} over {@code base}. Every key present in
     * the patch replaces the base value, including keys whose value is null;
     * keys only in the base are kept.
     *
     * @param base  base entry (may be null)
     * @param patch overriding entry (may be null)
     */
    public static Map<String, Object> mergeEntry(Map<String, Object> base, Map<String, Object> patch) {
        Map<String, Object> next = new LinkedHashMap<>();
        if (base != null)
            next.putAll(base);
        if (patch != null)
            next.putAll(patch);
        return next;
    }

    // =========================================================================
    // Tree merge
    // =========================================================================

    /**
     * Merge the remote tree over the local tree, field by field.
     * <ul>
     * <li>key only in local: passed through</li>
     * <li>key only in remote: passed through</li>
     * <li>key in both: remote fields override local fields, local-only fields are kept</li>
     * </ul>
     * Neither input is modified. Local keys keep their order; remote-only keys
     * follow.
     */
    public static Map<String, Map<String, Object>> mergeTrees(
            Map<String, Map<String, Object>> local,
            Map<String, Map<String, Object>> remote) {

        Map<String, Map<String, Object>> merged = new LinkedHashMap<>();
        if (local != null) {
            for (var entry : local.entrySet()) {
                merged.put(entry.getKey(), mergeEntry(entry.getValue(), null));
            }
        }
        if (remote != null) {
            for (var entry : remote.entrySet()) {
                merged.put(entry.getKey(), mergeEntry(merged.get(entry.getKey()), entry.getValue()));
            }
        }
        return merged;
    }
}
