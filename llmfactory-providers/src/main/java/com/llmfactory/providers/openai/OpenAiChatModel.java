package com.llmfactory.providers.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmfactory.common.config.ModelDefinition;
import com.llmfactory.common.errors.ProviderInvocationError;
import com.llmfactory.providers.AbstractLlmModel;
import com.llmfactory.providers.ChatResult;
import com.llmfactory.providers.CredentialResolver;
import com.llmfactory.providers.ProviderFactory;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat model backed by the OpenAI chat completions endpoint.
 * The API key is resolved when the instance is created.
 */
@Slf4j
public class OpenAiChatModel extends AbstractLlmModel {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final OkHttpClient SHARED_CLIENT = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(30))
            .readTimeout(Duration.ofMinutes(5))
            .writeTimeout(Duration.ofSeconds(30))
            .build();

    private final String apiKey;
    private final String baseUrl;
    private final OkHttpClient httpClient;

    public OpenAiChatModel(String name, ModelDefinition definition, CredentialResolver credentials) {
        this(name, definition, credentials, DEFAULT_BASE_URL, SHARED_CLIENT);
    }

    public OpenAiChatModel(String name, ModelDefinition definition, CredentialResolver credentials,
            String baseUrl, OkHttpClient httpClient) {
        super(name, definition);
        this.apiKey = credentials.resolve(definition, true).orElseThrow();
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.httpClient = httpClient;
    }

    public static ProviderFactory factory(CredentialResolver credentials) {
        return factory(credentials, DEFAULT_BASE_URL);
    }

    public static ProviderFactory factory(CredentialResolver credentials, String baseUrl) {
        return (name, definition) -> new OpenAiChatModel(name, definition, credentials, baseUrl, SHARED_CLIENT);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public ChatResult invoke(String prompt) {
        ModelDefinition def = getDefinition();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", def.getModelId());
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        body.put("max_tokens", def.getMaxTokens());
        body.put("temperature", def.getTemperature());

        Request request;
        try {
            request = new Request.Builder()
                    .url(baseUrl + "/chat/completions")
                    .header("content-type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .post(RequestBody.create(MAPPER.writeValueAsString(body), JSON))
                    .build();
        } catch (IOException e) {
            throw new ProviderInvocationError("Failed to encode request for " + getName(), e);
        }

        log.debug("Calling OpenAI model {} for {}", def.getModelId(), getName());
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String json = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new ProviderInvocationError(
                        "OpenAI API error " + response.code() + ": " + json, response.code(), null);
            }
            return parseResponse(json);
        } catch (IOException e) {
            throw new ProviderInvocationError("OpenAI call for " + getName() + " failed: " + e.getMessage(), e);
        }
    }

    private ChatResult parseResponse(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        JsonNode choice = root.path("choices").path(0);
        if (choice.isMissingNode()) {
            throw new ProviderInvocationError("OpenAI response for " + getName() + " has no choices");
        }
        long inputTokens = root.path("usage").path("prompt_tokens").asLong(0);
        long outputTokens = root.path("usage").path("completion_tokens").asLong(0);
        return ChatResult.builder()
                .text(choice.path("message").path("content").asText(""))
                .model(root.path("model").asText(getDefinition().getModelId()))
                .stopReason(choice.path("finish_reason").asText(null))
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .cost(costOf(inputTokens, outputTokens))
                .build();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
