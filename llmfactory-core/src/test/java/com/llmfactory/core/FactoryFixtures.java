package com.llmfactory.core;

import com.llmfactory.common.config.FactorySettings;
import com.llmfactory.common.store.LocalObjectStore;
import com.llmfactory.common.store.SecretStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Local-only factory wiring: the "remote" definition directory is a second
 * local directory handed out by an in-memory parameter store.
 */
final class FactoryFixtures {

    static final String GPT_4O = """
            name: GPT-4o
            provider: openai
            model_id: gpt-4o
            input_token_cost_usd_per_million: 2.5
            output_token_cost_usd_per_million: 10.0
            temperature: 0.7
            """;

    static final String CLAUDE = """
            name: Claude 3.7 Sonnet
            provider: bedrock
            model_id: anthropic.claude-3-7-sonnet-20250219-v1:0
            region_name: us-east-1
            """;

    final Path localDir;
    final Path remoteDir;
    final Map<String, String> parameters = new HashMap<>();
    final Map<String, String> env = new HashMap<>();

    FactoryFixtures(Path root) throws IOException {
        this.localDir = Files.createDirectories(root.resolve("local"));
        this.remoteDir = Files.createDirectories(root.resolve("remote"));
        parameters.put(FactorySettings.DEFAULT_MODELS_PATH_PARAMETER, remoteDir.toString());
        env.put("OPENAI_API_KEY", "sk-test");
    }

    FactoryFixtures local(String name, String yaml) throws IOException {
        Files.writeString(localDir.resolve(name + ".yaml"), yaml);
        return this;
    }

    FactoryFixtures remote(String name, String yaml) throws IOException {
        Files.writeString(remoteDir.resolve(name + ".yaml"), yaml);
        return this;
    }

    FactoryOptions options() {
        return FactoryOptions.builder()
                .sourcePath(localDir.toString())
                .settings(FactorySettings.defaults())
                .parameterStore(name -> Optional.ofNullable(parameters.get(name)))
                .secretStore(SecretStore.none())
                .objectStore(new LocalObjectStore())
                .env(env::get)
                .build();
    }
}
