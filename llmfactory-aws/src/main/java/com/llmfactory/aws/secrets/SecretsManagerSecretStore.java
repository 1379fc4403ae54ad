package com.llmfactory.aws.secrets;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.llmfactory.common.errors.StoreAccessError;
import com.llmfactory.common.store.SecretStore;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;
import software.amazon.awssdk.services.secretsmanager.model.SecretsManagerException;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link SecretStore} backed by AWS Secrets Manager.
 * <p>
 * Found secret strings are cached for a fixed time so that building several
 * models sharing one key costs a single call. Misses are not cached.
 */
@Slf4j
public class SecretsManagerSecretStore implements SecretStore {

    private final Supplier<SecretsManagerClient> secretsManager;
    private final Cache<String, String> cache;

    public SecretsManagerSecretStore(Supplier<SecretsManagerClient> secretsManager, Duration cacheTtl) {
        this.secretsManager = secretsManager;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(64)
                .build();
    }

    @Override
    public Optional<String> getSecret(String secretId) {
        String cached = cache.getIfPresent(secretId);
        if (cached != null) {
            return Optional.of(cached);
        }
        try {
            GetSecretValueResponse response = secretsManager.get()
                    .getSecretValue(GetSecretValueRequest.builder().secretId(secretId).build());
            if (response == null || response.secretString() == null) {
                return Optional.empty();
            }
            cache.put(secretId, response.secretString());
            log.debug("Fetched secret {} from Secrets Manager", secretId);
            return Optional.of(response.secretString());
        } catch (ResourceNotFoundException e) {
            return Optional.empty();
        } catch (SecretsManagerException | SdkClientException e) {
            throw new StoreAccessError("Failed to fetch secret '" + secretId + "': " + e.getMessage(), e);
        }
    }

    /** Drop every cached secret. */
    public void invalidateAll() {
        cache.invalidateAll();
    }
}
