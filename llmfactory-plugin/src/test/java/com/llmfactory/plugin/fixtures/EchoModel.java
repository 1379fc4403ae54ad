package com.llmfactory.plugin.fixtures;

import com.llmfactory.common.config.ModelDefinition;
import com.llmfactory.providers.AbstractLlmModel;
import com.llmfactory.providers.ChatResult;

public class EchoModel extends AbstractLlmModel {

    public EchoModel(String name, ModelDefinition definition) {
        super(name, definition);
    }

    @Override
    public ChatResult invoke(String prompt) {
        return ChatResult.builder().text("echo:" + prompt).model(getDefinition().getModelId()).build();
    }
}
