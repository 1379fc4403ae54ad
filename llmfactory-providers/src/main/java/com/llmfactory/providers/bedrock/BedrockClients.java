package com.llmfactory.providers.bedrock;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClientBuilder;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Bedrock runtime clients shared by every model of a registry, one per
 * region. A blank region uses the SDK default region chain.
 */
@Slf4j
public class BedrockClients implements AutoCloseable {

    private static final String DEFAULT_REGION = "";

    private final Function<String, BedrockRuntimeClient> builder;
    private final Map<String, BedrockRuntimeClient> clients = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public BedrockClients(Duration apiCallTimeout) {
        this(region -> build(region, apiCallTimeout));
    }

    BedrockClients(Function<String, BedrockRuntimeClient> builder) {
        this.builder = builder;
    }

    private static BedrockRuntimeClient build(String region, Duration apiCallTimeout) {
        BedrockRuntimeClientBuilder b = BedrockRuntimeClient.builder()
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(apiCallTimeout)
                        .build());
        if (!region.isEmpty()) {
            b.region(Region.of(region));
        }
        return b.build();
    }

    /**
     * @throws IllegalStateException after {@link #close()}
     */
    public BedrockRuntimeClient forRegion(String region) {
        if (closed) {
            throw new IllegalStateException("Bedrock clients are closed");
        }
        String key = region == null || region.isBlank() ? DEFAULT_REGION : region.trim();
        return clients.computeIfAbsent(key, r -> {
            log.debug("Creating Bedrock runtime client for region '{}'", r);
            return builder.apply(r);
        });
    }

    int size() {
        return clients.size();
    }

    @Override
    public void close() {
        closed = true;
        for (BedrockRuntimeClient client : clients.values()) {
            client.close();
        }
        clients.clear();
    }
}
