package com.llmfactory.common.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class FactorySettingsTest {

    @Test
    void defaults_matchDocumentedValues() {
        FactorySettings settings = FactorySettings.load(new Properties(), Map.of(), new Properties());

        assertEquals("/LLM_CONFIG/PROVIDER_MODULES_S3_PATH", settings.getProviderPathParameter());
        assertEquals("/LLM_CONFIG/MODELS_CONFIG_S3_PATH", settings.getModelsPathParameter());
        assertEquals(128, settings.getCacheMaxSize());
        assertEquals(Duration.ofSeconds(30), settings.getAwsApiCallTimeout());
        assertEquals(Duration.ofMinutes(5), settings.getSecretsCacheTtl());
    }

    @Test
    void precedence_systemOverEnvOverResource() {
        Properties resource = new Properties();
        resource.setProperty(FactorySettings.MODELS_PATH_PARAMETER_KEY, "/from/resource");
        resource.setProperty(FactorySettings.PROVIDER_PATH_PARAMETER_KEY, "/plugins/resource");
        resource.setProperty(FactorySettings.CACHE_MAX_SIZE_KEY, "16");
        Map<String, String> env = Map.of(
                FactorySettings.MODELS_PATH_PARAMETER_ENV, "/from/env",
                FactorySettings.CACHE_MAX_SIZE_ENV, "32");
        Properties system = new Properties();
        system.setProperty(FactorySettings.CACHE_MAX_SIZE_KEY, "64");

        FactorySettings settings = FactorySettings.load(resource, env, system);

        assertEquals("/plugins/resource", settings.getProviderPathParameter());
        assertEquals("/from/env", settings.getModelsPathParameter());
        assertEquals(64, settings.getCacheMaxSize());
    }

    @Test
    void invalidValues_fallBackToDefaults() {
        Map<String, String> env = Map.of(
                FactorySettings.CACHE_MAX_SIZE_ENV, "zero",
                FactorySettings.AWS_API_CALL_TIMEOUT_ENV, "30 seconds",
                FactorySettings.SECRETS_CACHE_TTL_ENV, "PT1M");

        FactorySettings settings = FactorySettings.load(new Properties(), env, new Properties());

        assertEquals(FactorySettings.DEFAULT_CACHE_MAX_SIZE, settings.getCacheMaxSize());
        assertEquals(FactorySettings.DEFAULT_AWS_API_CALL_TIMEOUT, settings.getAwsApiCallTimeout());
        assertEquals(Duration.ofMinutes(1), settings.getSecretsCacheTtl());
    }
}
