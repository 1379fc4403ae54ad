package com.llmfactory.common.config;

import com.llmfactory.common.errors.ConfigValidationError;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts a merged raw tree into a typed {@link ModelCatalog}.
 * Validation is all-or-nothing: every violation across every entry is
 * collected and reported together, and no catalog is produced if any exists.
 */
@Slf4j
public final class ConfigValidation {

    private ConfigValidation() {
    }

    // =========================================================================
    // Field names
    // =========================================================================

    public static final String NAME = "name";
    public static final String PROVIDER = "provider";
    public static final String MODEL_ID = "model_id";
    public static final String REGION_NAME = "region_name";
    public static final String API_KEY_SECRET_NAME = "api_key_secret_name";
    public static final String API_KEY_ENV_VAR = "api_key_env_var";
    public static final String INPUT_TOKEN_COST = "input_token_cost_usd_per_million";
    public static final String OUTPUT_TOKEN_COST = "output_token_cost_usd_per_million";
    public static final String MAX_TOKENS = "max_tokens";
    public static final String TEMPERATURE = "temperature";
    public static final String DESCRIPTION = "description";

    private static final Set<String> KNOWN_FIELDS = Set.of(
            NAME, PROVIDER, MODEL_ID, REGION_NAME, API_KEY_SECRET_NAME, API_KEY_ENV_VAR,
            INPUT_TOKEN_COST, OUTPUT_TOKEN_COST, MAX_TOKENS, TEMPERATURE, DESCRIPTION);

    private static final double MIN_TEMPERATURE = 0.0;
    private static final double MAX_TEMPERATURE = 2.0;

    // =========================================================================
    // Types
    // =========================================================================

    public record ValidationIssue(String path, String message) {
    }

    public record ValidationResult(boolean ok, ModelCatalog catalog, List<ValidationIssue> issues) {
        public static ValidationResult success(ModelCatalog catalog) {
            return new ValidationResult(true, catalog, List.of());
        }

        public static ValidationResult failure(List<ValidationIssue> issues) {
            return new ValidationResult(false, null, List.copyOf(issues));
        }
    }

    // =========================================================================
    // Public API
    // =========================================================================

    /**
     * Validate the merged tree.
     *
     * @param sourceId identifier stored in the resulting catalog
     * @param merged   raw tree keyed by model name
     * @return the catalog
     * @throws ConfigValidationError carrying every violation when any entry is invalid
     */
    public static ModelCatalog validate(String sourceId, Map<String, Map<String, Object>> merged) {
        ValidationResult result = check(sourceId, merged);
        if (!result.ok()) {
            throw new ConfigValidationError(result.issues());
        }
        return result.catalog();
    }

    /**
     * Validate the merged tree without throwing.
     */
    public static ValidationResult check(String sourceId, Map<String, Map<String, Object>> merged) {
        List<ValidationIssue> issues = new ArrayList<>();
        Map<String, ModelDefinition> models = new LinkedHashMap<>();

        if (merged != null) {
            for (var entry : merged.entrySet()) {
                ModelDefinition def = validateEntry(entry.getKey(), entry.getValue(), issues);
                if (def != null) {
                    models.put(entry.getKey(), def);
                }
            }
        }

        if (!issues.isEmpty()) {
            return ValidationResult.failure(issues);
        }
        return ValidationResult.success(new ModelCatalog(sourceId, models));
    }

    // =========================================================================
    // Entry validation
    // =========================================================================

    /**
     * Validate one entry, appending its violations to {@code issues}.
     *
     * @return the definition, or null when the entry has violations
     */
    static ModelDefinition validateEntry(String key, Map<String, Object> raw, List<ValidationIssue> issues) {
        String prefix = "models." + key;
        if (raw == null) {
            issues.add(new ValidationIssue(prefix, "Definition must be a mapping"));
            return null;
        }
        int before = issues.size();

        for (String field : raw.keySet()) {
            if (!KNOWN_FIELDS.contains(field)) {
                log.debug("Ignoring unknown field {}.{}", prefix, field);
            }
        }

        String name = requiredString(raw, NAME, prefix, issues);
        String provider = requiredString(raw, PROVIDER, prefix, issues);
        String modelId = requiredString(raw, MODEL_ID, prefix, issues);
        String region = optionalString(raw, REGION_NAME, prefix, issues);
        String secretName = optionalString(raw, API_KEY_SECRET_NAME, prefix, issues);
        String envVar = optionalString(raw, API_KEY_ENV_VAR, prefix, issues);
        String description = optionalString(raw, DESCRIPTION, prefix, issues);

        Double inputCost = optionalNumber(raw, INPUT_TOKEN_COST, prefix, issues);
        if (inputCost != null && inputCost < 0) {
            issues.add(new ValidationIssue(prefix + "." + INPUT_TOKEN_COST,
                    "must be greater than or equal to 0, got " + inputCost));
        }
        Double outputCost = optionalNumber(raw, OUTPUT_TOKEN_COST, prefix, issues);
        if (outputCost != null && outputCost < 0) {
            issues.add(new ValidationIssue(prefix + "." + OUTPUT_TOKEN_COST,
                    "must be greater than or equal to 0, got " + outputCost));
        }
        Integer maxTokens = optionalInteger(raw, MAX_TOKENS, prefix, issues);
        if (maxTokens != null && maxTokens < 1) {
            issues.add(new ValidationIssue(prefix + "." + MAX_TOKENS,
                    "must be greater than or equal to 1, got " + maxTokens));
        }
        Double temperature = optionalNumber(raw, TEMPERATURE, prefix, issues);
        if (temperature != null && (temperature < MIN_TEMPERATURE || temperature > MAX_TEMPERATURE)) {
            issues.add(new ValidationIssue(prefix + "." + TEMPERATURE,
                    "must be between " + MIN_TEMPERATURE + " and " + MAX_TEMPERATURE + ", got " + temperature));
        }

        if (issues.size() > before) {
            return null;
        }

        ModelDefinition.ModelDefinitionBuilder builder = ModelDefinition.builder()
                .name(name)
                .provider(provider)
                .modelId(modelId)
                .regionName(region)
                .apiKeySecretName(secretName)
                .description(description);
        if (envVar != null)
            builder.apiKeyEnvVar(envVar);
        if (inputCost != null)
            builder.inputTokenCost(inputCost);
        if (outputCost != null)
            builder.outputTokenCost(outputCost);
        if (maxTokens != null)
            builder.maxTokens(maxTokens);
        if (temperature != null)
            builder.temperature(temperature);
        return builder.build();
    }

    // =========================================================================
    // Field readers
    // =========================================================================

    private static String requiredString(Map<String, Object> raw, String field, String prefix,
            List<ValidationIssue> issues) {
        Object value = raw.get(field);
        if (value == null) {
            issues.add(new ValidationIssue(prefix + "." + field, "Field required"));
            return null;
        }
        if (!(value instanceof String s)) {
            issues.add(new ValidationIssue(prefix + "." + field, "must be a string, got " + typeName(value)));
            return null;
        }
        if (s.isBlank()) {
            issues.add(new ValidationIssue(prefix + "." + field, "must not be blank"));
            return null;
        }
        return s;
    }

    private static String optionalString(Map<String, Object> raw, String field, String prefix,
            List<ValidationIssue> issues) {
        Object value = raw.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String s)) {
            issues.add(new ValidationIssue(prefix + "." + field, "must be a string, got " + typeName(value)));
            return null;
        }
        return s;
    }

    private static Double optionalNumber(Map<String, Object> raw, String field, String prefix,
            List<ValidationIssue> issues) {
        Object value = raw.get(field);
        if (value == null) {
            return null;
        }
        Double parsed = null;
        if (value instanceof Number n) {
            parsed = n.doubleValue();
        } else if (value instanceof String s) {
            try {
                parsed = Double.valueOf(s.trim());
            } catch (NumberFormatException ignored) {
                parsed = null;
            }
        }
        if (parsed == null || parsed.isNaN() || parsed.isInfinite()) {
            issues.add(new ValidationIssue(prefix + "." + field, "must be a number, got " + describe(value)));
            return null;
        }
        return parsed;
    }

    private static Integer optionalInteger(Map<String, Object> raw, String field, String prefix,
            List<ValidationIssue> issues) {
        Object value = raw.get(field);
        if (value == null) {
            return null;
        }
        BigDecimal parsed = null;
        if (value instanceof Number n) {
            double asDouble = n.doubleValue();
            if (!Double.isNaN(asDouble) && !Double.isInfinite(asDouble)) {
                parsed = new BigDecimal(n.toString());
            }
        } else if (value instanceof String s) {
            try {
                parsed = new BigDecimal(s.trim());
            } catch (NumberFormatException ignored) {
                parsed = null;
            }
        }
        if (parsed == null) {
            issues.add(new ValidationIssue(prefix + "." + field, "must be an integer, got " + describe(value)));
            return null;
        }
        try {
            return parsed.intValueExact();
        } catch (ArithmeticException e) {
            issues.add(new ValidationIssue(prefix + "." + field, "must be an integer, got " + describe(value)));
            return null;
        }
    }

    private static String describe(Object value) {
        return value instanceof String ? "\"" + value + "\"" : typeName(value);
    }

    private static String typeName(Object value) {
        if (value instanceof Map)
            return "mapping";
        if (value instanceof List)
            return "list";
        if (value instanceof Boolean)
            return "boolean";
        if (value instanceof Number)
            return "number";
        return value.getClass().getSimpleName();
    }
}
