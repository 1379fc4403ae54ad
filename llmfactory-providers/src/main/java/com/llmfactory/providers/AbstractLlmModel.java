package com.llmfactory.providers;

import com.llmfactory.common.config.ModelDefinition;

import java.util.Objects;

/**
 * Base class holding the name and definition. Subclasses finish their setup
 * (credentials, clients) in their own constructors so that a model that
 * cannot be used is never handed out.
 */
public abstract class AbstractLlmModel implements LlmModel {

    private final String name;
    private final ModelDefinition definition;

    protected AbstractLlmModel(String name, ModelDefinition definition) {
        this.name = Objects.requireNonNull(name, "name");
        this.definition = Objects.requireNonNull(definition, "definition");
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ModelDefinition getDefinition() {
        return definition;
    }

    protected double costOf(long inputTokens, long outputTokens) {
        return calculateCost(inputTokens, true) + calculateCost(outputTokens, false);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + " -> " + definition.getModelId() + "]";
    }
}
