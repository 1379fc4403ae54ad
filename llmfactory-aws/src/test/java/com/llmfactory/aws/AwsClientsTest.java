package com.llmfactory.aws;

import com.llmfactory.common.config.FactorySettings;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class AwsClientsTest {

    @Test
    void overrideConfiguration_carriesApiCallTimeout() {
        AwsClients clients = new AwsClients(FactorySettings.builder()
                .awsApiCallTimeout(Duration.ofSeconds(7))
                .build());

        assertEquals(Duration.ofSeconds(7), clients.getOverrides().apiCallTimeout().orElseThrow());
    }

    @Test
    void close_withoutClients_isNoop() {
        AwsClients clients = new AwsClients(Duration.ofSeconds(1));
        assertDoesNotThrow(clients::close);
    }
}
