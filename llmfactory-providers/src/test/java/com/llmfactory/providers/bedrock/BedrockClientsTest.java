package com.llmfactory.providers.bedrock;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BedrockClientsTest {

    @Test
    void forRegion_reusesClientPerRegion() {
        BedrockClients clients = new BedrockClients(FakeBedrockClient::new);

        BedrockRuntimeClient east = clients.forRegion("us-east-1");

        assertSame(east, clients.forRegion("us-east-1"));
        assertSame(east, clients.forRegion(" us-east-1 "));
        assertNotSame(east, clients.forRegion("eu-west-1"));
        assertEquals(2, clients.size());
    }

    @Test
    void forRegion_blankOrNullShareTheDefaultRegionClient() {
        BedrockClients clients = new BedrockClients(FakeBedrockClient::new);

        FakeBedrockClient client = (FakeBedrockClient) clients.forRegion(null);

        assertSame(client, clients.forRegion("  "));
        assertEquals("", client.region);
    }

    @Test
    void close_closesEveryClientAndRejectsFurtherUse() {
        BedrockClients clients = new BedrockClients(FakeBedrockClient::new);
        FakeBedrockClient east = (FakeBedrockClient) clients.forRegion("us-east-1");
        FakeBedrockClient west = (FakeBedrockClient) clients.forRegion("us-west-2");

        clients.close();

        assertTrue(east.closed);
        assertTrue(west.closed);
        assertEquals(0, clients.size());
        assertThrows(IllegalStateException.class, () -> clients.forRegion("us-east-1"));
    }

    @Test
    void builtClient_carriesRegionAndApiCallTimeout() {
        try (BedrockClients clients = new BedrockClients(Duration.ofSeconds(42))) {
            BedrockRuntimeClient client = clients.forRegion("us-east-1");

            assertEquals(Region.US_EAST_1, client.serviceClientConfiguration().region());
            assertEquals(Duration.ofSeconds(42),
                    client.serviceClientConfiguration().overrideConfiguration().apiCallTimeout().orElseThrow());
        }
    }
}
