package com.llmfactory.common.errors;

import lombok.Getter;

/**
 * No API key could be found for a model, neither in the secret store nor in
 * the environment.
 */
@Getter
public class CredentialNotFoundError extends LlmFactoryError {

    private final String modelName;
    private final String envVar;

    public CredentialNotFoundError(String modelName, String envVar) {
        super("API key for " + modelName + " not found. Set '" + envVar
                + "' or configure 'api_key_secret_name'.");
        this.modelName = modelName;
        this.envVar = envVar;
    }
}
