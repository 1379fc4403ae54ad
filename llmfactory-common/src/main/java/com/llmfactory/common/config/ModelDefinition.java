package com.llmfactory.common.config;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Validated configuration of a single model. Instances are only produced by
 * {@link ConfigValidation} (or by tests through the builder) and never change.
 */
@Value
@Builder(toBuilder = true)
public class ModelDefinition {

    public static final String DEFAULT_API_KEY_ENV_VAR = "OPENAI_API_KEY";
    public static final int DEFAULT_MAX_TOKENS = 1024;
    public static final double DEFAULT_TEMPERATURE = 0.7;

    String name;
    /** Provider key as written in the definition file. */
    String provider;
    String modelId;
    String regionName;
    String apiKeySecretName;
    @Builder.Default
    String apiKeyEnvVar = DEFAULT_API_KEY_ENV_VAR;
    /** USD per million input tokens. */
    @Builder.Default
    double inputTokenCost = 0.0;
    /** USD per million output tokens. */
    @Builder.Default
    double outputTokenCost = 0.0;
    @Builder.Default
    int maxTokens = DEFAULT_MAX_TOKENS;
    @Builder.Default
    double temperature = DEFAULT_TEMPERATURE;
    String description;

    /**
     * Provider key in registry form (trimmed, lower case).
     */
    public String providerKey() {
        return Provider.normalizeKey(provider);
    }

    /**
     * The built-in provider this definition names, if any.
     */
    public Optional<Provider> builtinProvider() {
        return Provider.fromKey(provider);
    }
}
