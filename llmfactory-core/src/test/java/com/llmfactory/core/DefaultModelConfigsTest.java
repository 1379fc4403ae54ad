package com.llmfactory.core;

import com.llmfactory.common.config.ConfigSourceReader;
import com.llmfactory.common.config.ConfigValidation;
import com.llmfactory.common.config.ModelCatalog;
import com.llmfactory.common.store.LocalObjectStore;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DefaultModelConfigsTest {

    @Test
    void defaultConfigDir_isStableAndHoldsBundledFiles() {
        String dir = DefaultModelConfigs.defaultConfigDir();
        assertEquals(dir, DefaultModelConfigs.defaultConfigDir());
        assertTrue(Files.isDirectory(Path.of(dir)));

        List<String> files = DefaultModelConfigs.defaultConfigs();
        assertEquals(3, files.size());
        assertTrue(files.get(0).endsWith("claude_sonnet_3_7.yaml"));
    }

    @Test
    void bundledDefinitions_validate() {
        var raw = new ConfigSourceReader(new LocalObjectStore())
                .readDirectory(DefaultModelConfigs.defaultConfigDir(), "local directory");
        ModelCatalog catalog = ConfigValidation.validate("defaults", raw);

        assertEquals(Set.of("claude_sonnet_3_7", "gpt_4o", "llama_3_8b_instruct"), catalog.modelNames());
        assertEquals("openai", catalog.find("gpt_4o").orElseThrow().providerKey());
        assertEquals("bedrock", catalog.find("llama_3_8b_instruct").orElseThrow().providerKey());
    }
}
