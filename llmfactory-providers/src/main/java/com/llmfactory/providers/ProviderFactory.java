package com.llmfactory.providers;

import com.llmfactory.common.config.ModelDefinition;

/**
 * Creates model instances for one provider key.
 */
@FunctionalInterface
public interface ProviderFactory {

    /**
     * @param name       catalog key the instance is requested under
     * @param definition validated definition for that key
     */
    LlmModel create(String name, ModelDefinition definition);
}
