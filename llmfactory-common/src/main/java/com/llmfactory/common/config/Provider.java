package com.llmfactory.common.config;

import java.util.Locale;
import java.util.Optional;

/**
 * Built-in provider keys. Definitions may also name providers registered at
 * runtime, so a provider key is not limited to these values.
 */
public enum Provider {
    BEDROCK("bedrock"),
    OPENAI("openai");

    private final String key;

    Provider(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<Provider> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = normalizeKey(key);
        for (Provider p : values()) {
            if (p.key.equals(normalized)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    /**
     * Normalize a provider key the way the registry stores it.
     */
    public static String normalizeKey(String key) {
        return key.trim().toLowerCase(Locale.ROOT);
    }
}
