package com.llmfactory.plugin.fixtures;

import com.llmfactory.common.config.ModelDefinition;
import com.llmfactory.providers.AbstractLlmModel;
import com.llmfactory.providers.ChatResult;

/** Has no (String, ModelDefinition) constructor, so it never qualifies. */
public class NameOnlyModel extends AbstractLlmModel {

    public NameOnlyModel(String name) {
        super(name, ModelDefinition.builder().name(name).provider("x").modelId("x").build());
    }

    @Override
    public ChatResult invoke(String prompt) {
        return ChatResult.builder().build();
    }
}
