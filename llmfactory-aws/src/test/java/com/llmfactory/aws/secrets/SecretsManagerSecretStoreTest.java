package com.llmfactory.aws.secrets;

import com.llmfactory.common.errors.StoreAccessError;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerServiceClientConfiguration;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueResponse;
import software.amazon.awssdk.services.secretsmanager.model.ResourceNotFoundException;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SecretsManagerSecretStoreTest {

    private static class FakeSecretsClient implements SecretsManagerClient {
        final Map<String, String> secrets;
        int calls;
        boolean unreachable;

        FakeSecretsClient(Map<String, String> secrets) {
            this.secrets = secrets;
        }

        @Override
        public GetSecretValueResponse getSecretValue(GetSecretValueRequest request) {
            calls++;
            if (unreachable) {
                throw SdkClientException.create("connection refused");
            }
            String value = secrets.get(request.secretId());
            if (value == null) {
                throw ResourceNotFoundException.builder().message("no secret").build();
            }
            return GetSecretValueResponse.builder().secretString(value).build();
        }

        @Override
        public SecretsManagerServiceClientConfiguration serviceClientConfiguration() {
            throw new UnsupportedOperationException();
        }

        @Override
        public String serviceName() {
            return "secretsmanager";
        }

        @Override
        public void close() {
        }
    }

    private final FakeSecretsClient client = new FakeSecretsClient(Map.of("prod/openai", "sk-secret"));
    private final SecretsManagerSecretStore store =
            new SecretsManagerSecretStore(() -> client, Duration.ofMinutes(5));

    @Test
    void getSecret_returnsSecretString() {
        assertEquals(Optional.of("sk-secret"), store.getSecret("prod/openai"));
    }

    @Test
    void getSecret_isCached() {
        store.getSecret("prod/openai");
        store.getSecret("prod/openai");
        assertEquals(1, client.calls);

        store.invalidateAll();
        store.getSecret("prod/openai");
        assertEquals(2, client.calls);
    }

    @Test
    void getSecret_missing_returnsEmptyAndIsNotCached() {
        assertTrue(store.getSecret("absent").isEmpty());
        assertTrue(store.getSecret("absent").isEmpty());
        assertEquals(2, client.calls);
    }

    @Test
    void getSecret_unreachable_throwsStoreAccessError() {
        client.unreachable = true;
        assertThrows(StoreAccessError.class, () -> store.getSecret("prod/openai"));
    }
}
