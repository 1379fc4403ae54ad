package com.llmfactory.common.errors;

/**
 * Raised when a requested model has no entry in the catalog.
 * Callers catch this to fall back to a default model.
 */
public class ModelNotFoundError extends LlmFactoryError {

    private final String modelName;

    public ModelNotFoundError(String modelName) {
        super("Config for '" + modelName + "' not found.");
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
