package com.llmfactory.providers.bedrock;

import com.llmfactory.common.config.ModelDefinition;
import com.llmfactory.common.errors.ProviderInvocationError;
import com.llmfactory.providers.AbstractLlmModel;
import com.llmfactory.providers.ChatResult;
import com.llmfactory.providers.ProviderFactory;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.ContentBlock;
import software.amazon.awssdk.services.bedrockruntime.model.ConversationRole;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseRequest;
import software.amazon.awssdk.services.bedrockruntime.model.ConverseResponse;
import software.amazon.awssdk.services.bedrockruntime.model.InferenceConfiguration;
import software.amazon.awssdk.services.bedrockruntime.model.Message;
import software.amazon.awssdk.services.bedrockruntime.model.TokenUsage;

import java.util.stream.Collectors;

/**
 * Chat model served by Amazon Bedrock through the Converse API.
 * Credentials come from the default AWS provider chain; the client is shared
 * and owned by {@link BedrockClients}.
 */
@Slf4j
public class BedrockChatModel extends AbstractLlmModel {

    private final BedrockRuntimeClient client;

    public BedrockChatModel(String name, ModelDefinition definition, BedrockRuntimeClient client) {
        super(name, definition);
        this.client = client;
    }

    /**
     * Factory resolving each model's client from {@code clients} by the
     * definition's region.
     */
    public static ProviderFactory factory(BedrockClients clients) {
        return (name, definition) -> new BedrockChatModel(name, definition,
                clients.forRegion(definition.getRegionName()));
    }

    BedrockRuntimeClient getClient() {
        return client;
    }

    @Override
    public ChatResult invoke(String prompt) {
        ModelDefinition def = getDefinition();
        ConverseRequest request = ConverseRequest.builder()
                .modelId(def.getModelId())
                .messages(Message.builder()
                        .role(ConversationRole.USER)
                        .content(ContentBlock.fromText(prompt))
                        .build())
                .inferenceConfig(InferenceConfiguration.builder()
                        .maxTokens(def.getMaxTokens())
                        .temperature((float) def.getTemperature())
                        .build())
                .build();

        log.debug("Calling Bedrock model {} for {}", def.getModelId(), getName());
        ConverseResponse response;
        try {
            response = client.converse(request);
        } catch (SdkException e) {
            throw new ProviderInvocationError("Bedrock call for " + getName() + " failed: " + e.getMessage(), e);
        }

        String text = "";
        if (response.output() != null && response.output().message() != null) {
            text = response.output().message().content().stream()
                    .filter(block -> block.text() != null)
                    .map(ContentBlock::text)
                    .collect(Collectors.joining());
        }
        TokenUsage usage = response.usage();
        long inputTokens = usage != null && usage.inputTokens() != null ? usage.inputTokens() : 0;
        long outputTokens = usage != null && usage.outputTokens() != null ? usage.outputTokens() : 0;
        return ChatResult.builder()
                .text(text)
                .model(def.getModelId())
                .stopReason(response.stopReasonAsString())
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .cost(costOf(inputTokens, outputTokens))
                .build();
    }
}
