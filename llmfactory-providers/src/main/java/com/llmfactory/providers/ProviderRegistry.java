package com.llmfactory.providers;

import com.llmfactory.common.config.FactorySettings;
import com.llmfactory.common.config.Provider;
import com.llmfactory.providers.bedrock.BedrockChatModel;
import com.llmfactory.providers.bedrock.BedrockClients;
import com.llmfactory.providers.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps provider keys to the factories that build their models.
 * Keys are trimmed and lower-cased on the way in and on lookup.
 * <p>
 * The registry owns the SDK clients its built-in factories share; closing it
 * closes them.
 */
@Slf4j
public class ProviderRegistry implements AutoCloseable {

    private final Map<String, ProviderFactory> factories = new ConcurrentHashMap<>();

    private volatile BedrockClients bedrockClients;

    /**
     * Register the providers that ship with the library, with the default
     * AWS API-call timeout.
     */
    public void registerBuiltins(CredentialResolver credentials) {
        registerBuiltins(credentials, FactorySettings.DEFAULT_AWS_API_CALL_TIMEOUT);
    }

    /**
     * Register the providers that ship with the library.
     *
     * @param awsApiCallTimeout timeout applied to every Bedrock call
     */
    public synchronized void registerBuiltins(CredentialResolver credentials, Duration awsApiCallTimeout) {
        if (bedrockClients != null) {
            bedrockClients.close();
        }
        bedrockClients = new BedrockClients(awsApiCallTimeout);
        register(Provider.OPENAI.key(), OpenAiChatModel.factory(credentials));
        register(Provider.BEDROCK.key(), BedrockChatModel.factory(bedrockClients));
    }

    /**
     * Register a provider, replacing any existing factory for the key.
     *
     * @throws IllegalArgumentException when the key is blank
     */
    public void register(String key, ProviderFactory factory) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Provider key must not be blank");
        }
        String normalized = Provider.normalizeKey(key);
        ProviderFactory previous = factories.put(normalized, factory);
        if (previous != null) {
            log.info("Replaced model provider: {}", normalized);
        } else {
            log.info("Registered model provider: {}", normalized);
        }
    }

    public Optional<ProviderFactory> resolve(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(factories.get(Provider.normalizeKey(key)));
    }

    public boolean hasProvider(String key) {
        return resolve(key).isPresent();
    }

    public Set<String> getProviderKeys() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    public int size() {
        return factories.size();
    }

    public BedrockClients getBedrockClients() {
        return bedrockClients;
    }

    /**
     * Close the shared SDK clients. Factories registered here must not be
     * used afterwards.
     */
    @Override
    public synchronized void close() {
        if (bedrockClients != null) {
            bedrockClients.close();
        }
    }
}
