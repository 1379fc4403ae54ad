package com.llmfactory.providers;

import com.llmfactory.common.config.ModelDefinition;

/**
 * A ready-to-use client for one configured model.
 */
public interface LlmModel {

    /** Catalog key the instance was created for. */
    String getName();

    ModelDefinition getDefinition();

    /**
     * Send a single user prompt and wait for the completion.
     *
     * @throws com.llmfactory.common.errors.ProviderInvocationError when the call fails
     */
    ChatResult invoke(String prompt);

    /**
     * Cost in USD of {@code tokens} tokens at the definition's per-million
     * price.
     */
    default double calculateCost(long tokens, boolean isInput) {
        double perMillion = isInput ? getDefinition().getInputTokenCost() : getDefinition().getOutputTokenCost();
        return tokens / 1_000_000.0 * perMillion;
    }
}
