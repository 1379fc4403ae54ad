package com.llmfactory.providers;

import com.llmfactory.common.config.ModelDefinition;
import com.llmfactory.common.errors.CredentialNotFoundError;
import com.llmfactory.common.errors.StoreAccessError;
import com.llmfactory.common.store.SecretStore;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CredentialResolverTest {

    private static final ModelDefinition WITH_SECRET = ModelDefinition.builder()
            .name("gpt_4o").provider("openai").modelId("gpt-4o")
            .apiKeySecretName("prod/openai")
            .build();

    private static final ModelDefinition ENV_ONLY = ModelDefinition.builder()
            .name("gpt_4o").provider("openai").modelId("gpt-4o")
            .apiKeyEnvVar("MY_KEY")
            .build();

    @Test
    void secretWinsOverEnvironment() {
        CredentialResolver resolver = new CredentialResolver(
                id -> Optional.of("from-secret"), Map.of("OPENAI_API_KEY", "from-env")::get);
        assertEquals(Optional.of("from-secret"), resolver.resolve(WITH_SECRET, true));
    }

    @Test
    void missingSecret_fallsBackToEnvironment() {
        CredentialResolver resolver = new CredentialResolver(
                SecretStore.none(), Map.of("OPENAI_API_KEY", "from-env")::get);
        assertEquals(Optional.of("from-env"), resolver.resolve(WITH_SECRET, true));
    }

    @Test
    void failingSecretStore_fallsBackToEnvironment() {
        CredentialResolver resolver = new CredentialResolver(
                id -> {
                    throw new StoreAccessError("denied");
                },
                Map.of("OPENAI_API_KEY", "from-env")::get);
        assertEquals(Optional.of("from-env"), resolver.resolve(WITH_SECRET, true));
    }

    @Test
    void customEnvVar_isUsed() {
        CredentialResolver resolver = new CredentialResolver(SecretStore.none(), Map.of("MY_KEY", "k")::get);
        assertEquals(Optional.of("k"), resolver.resolve(ENV_ONLY, true));
    }

    @Test
    void nothingFound_required_throws() {
        CredentialResolver resolver = new CredentialResolver(SecretStore.none(), Map.<String, String>of()::get);
        CredentialNotFoundError error = assertThrows(CredentialNotFoundError.class,
                () -> resolver.resolve(ENV_ONLY, true));
        assertEquals("API key for gpt_4o not found. Set 'MY_KEY' or configure 'api_key_secret_name'.",
                error.getMessage());
        assertEquals("MY_KEY", error.getEnvVar());
    }

    @Test
    void nothingFound_optional_returnsEmpty() {
        CredentialResolver resolver = new CredentialResolver(SecretStore.none(), Map.<String, String>of()::get);
        assertTrue(resolver.resolve(ENV_ONLY, false).isEmpty());
    }
}
