package com.llmfactory.common.errors;

/**
 * Raised when the factory is not ready, a provider key is not registered,
 * or a required remote location cannot be resolved.
 */
public class ModelConfigurationError extends LlmFactoryError {

    public ModelConfigurationError(String message) {
        super(message);
    }

    public ModelConfigurationError(String message, Throwable cause) {
        super(message, cause);
    }
}
