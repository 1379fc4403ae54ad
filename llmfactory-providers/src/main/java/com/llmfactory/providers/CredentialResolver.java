package com.llmfactory.providers;

import com.llmfactory.common.config.ModelDefinition;
import com.llmfactory.common.errors.CredentialNotFoundError;
import com.llmfactory.common.errors.StoreAccessError;
import com.llmfactory.common.store.SecretStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.function.Function;

/**
 * Finds the API key for a definition: the named secret first, then the
 * environment variable.
 */
@Slf4j
public class CredentialResolver {

    private final SecretStore secrets;
    private final Function<String, String> env;

    public CredentialResolver(SecretStore secrets) {
        this(secrets, System::getenv);
    }

    public CredentialResolver(SecretStore secrets, Function<String, String> env) {
        this.secrets = secrets != null ? secrets : SecretStore.none();
        this.env = env;
    }

    /**
     * @param required throw instead of returning empty when nothing is found
     * @throws CredentialNotFoundError when {@code required} and no key is available
     */
    public Optional<String> resolve(ModelDefinition definition, boolean required) {
        String secretName = definition.getApiKeySecretName();
        if (secretName != null && !secretName.isBlank()) {
            try {
                Optional<String> secret = secrets.getSecret(secretName);
                if (secret.isPresent() && !secret.get().isBlank()) {
                    log.debug("Using secret {} for model {}", secretName, definition.getName());
                    return secret;
                }
                log.warn("Secret {} for model {} is missing or empty", secretName, definition.getName());
            } catch (StoreAccessError e) {
                log.warn("Failed to fetch secret {} for model {}: {}", secretName, definition.getName(),
                        e.getMessage());
            }
        }

        String envVar = definition.getApiKeyEnvVar();
        if (envVar != null && !envVar.isBlank()) {
            String value = env.apply(envVar);
            if (value != null && !value.isBlank()) {
                return Optional.of(value);
            }
        }

        if (required) {
            throw new CredentialNotFoundError(definition.getName(), envVar);
        }
        return Optional.empty();
    }
}
