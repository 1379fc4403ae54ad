package com.llmfactory.common.errors;

import com.llmfactory.common.config.ConfigValidation.ValidationIssue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The merged definitions violate the schema. Carries every violation found
 * across every entry, not only the first.
 */
public class ConfigValidationError extends LlmFactoryError {

    private final List<ValidationIssue> issues;

    public ConfigValidationError(List<ValidationIssue> issues) {
        super("Configuration validation failed with " + issues.size() + " issue(s): "
                + issues.stream()
                        .map(i -> i.path() + ": " + i.message())
                        .collect(Collectors.joining("; ")));
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }
}
