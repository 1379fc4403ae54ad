package com.llmfactory.common.store;

import java.util.Optional;

/**
 * Resolves a secret reference to its string value.
 */
@FunctionalInterface
public interface SecretStore {

    /**
     * @return the secret string, or empty when the secret does not exist
     * @throws com.llmfactory.common.errors.StoreAccessError when the store cannot be queried
     */
    Optional<String> getSecret(String secretId);

    /** A store that holds no secrets. */
    static SecretStore none() {
        return secretId -> Optional.empty();
    }
}
