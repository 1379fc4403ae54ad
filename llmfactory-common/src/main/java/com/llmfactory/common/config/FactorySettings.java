package com.llmfactory.common.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Properties;

/**
 * Process settings for the factory.
 * <p>
 * Resolved, in increasing precedence, from built-in defaults, the optional
 * {@code llmfactory.properties} classpath resource, environment variables and
 * system properties.
 */
@Slf4j
@Value
@Builder(toBuilder = true)
public class FactorySettings {

    public static final String RESOURCE_NAME = "llmfactory.properties";

    public static final String PROVIDER_PATH_PARAMETER_KEY = "llmfactory.ssm.provider-path-parameter";
    public static final String MODELS_PATH_PARAMETER_KEY = "llmfactory.ssm.models-path-parameter";
    public static final String CACHE_MAX_SIZE_KEY = "llmfactory.cache.max-size";
    public static final String AWS_API_CALL_TIMEOUT_KEY = "llmfactory.aws.api-call-timeout";
    public static final String SECRETS_CACHE_TTL_KEY = "llmfactory.secrets.cache-ttl";

    public static final String PROVIDER_PATH_PARAMETER_ENV = "SSM_PROVIDER_PATH_PARAMETER";
    public static final String MODELS_PATH_PARAMETER_ENV = "SSM_MODELS_PATH_PARAMETER";
    public static final String CACHE_MAX_SIZE_ENV = "LLMFACTORY_CACHE_MAX_SIZE";
    public static final String AWS_API_CALL_TIMEOUT_ENV = "LLMFACTORY_AWS_API_CALL_TIMEOUT";
    public static final String SECRETS_CACHE_TTL_ENV = "LLMFACTORY_SECRETS_CACHE_TTL";

    public static final String DEFAULT_PROVIDER_PATH_PARAMETER = "/LLM_CONFIG/PROVIDER_MODULES_S3_PATH";
    public static final String DEFAULT_MODELS_PATH_PARAMETER = "/LLM_CONFIG/MODELS_CONFIG_S3_PATH";
    public static final int DEFAULT_CACHE_MAX_SIZE = 128;
    public static final Duration DEFAULT_AWS_API_CALL_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_SECRETS_CACHE_TTL = Duration.ofMinutes(5);

    /** Parameter holding the plugin artifact directory (optional lookup). */
    @Builder.Default
    String providerPathParameter = DEFAULT_PROVIDER_PATH_PARAMETER;
    /** Parameter holding the remote definition directory (required lookup). */
    @Builder.Default
    String modelsPathParameter = DEFAULT_MODELS_PATH_PARAMETER;
    @Builder.Default
    int cacheMaxSize = DEFAULT_CACHE_MAX_SIZE;
    @Builder.Default
    Duration awsApiCallTimeout = DEFAULT_AWS_API_CALL_TIMEOUT;
    @Builder.Default
    Duration secretsCacheTtl = DEFAULT_SECRETS_CACHE_TTL;

    public static FactorySettings defaults() {
        return FactorySettings.builder().build();
    }

    /**
     * Resolve settings from the classpath resource, the process environment
     * and system properties.
     */
    public static FactorySettings load() {
        return load(loadResource(), System.getenv(), System.getProperties());
    }

    /**
     * Resolve settings from explicit sources. Later sources win.
     */
    public static FactorySettings load(Properties resource, Map<String, String> env, Properties system) {
        FactorySettings d = defaults();
        return FactorySettings.builder()
                .providerPathParameter(resolve(PROVIDER_PATH_PARAMETER_KEY, PROVIDER_PATH_PARAMETER_ENV,
                        d.providerPathParameter, resource, env, system))
                .modelsPathParameter(resolve(MODELS_PATH_PARAMETER_KEY, MODELS_PATH_PARAMETER_ENV,
                        d.modelsPathParameter, resource, env, system))
                .cacheMaxSize(parseInt(CACHE_MAX_SIZE_KEY,
                        resolve(CACHE_MAX_SIZE_KEY, CACHE_MAX_SIZE_ENV, null, resource, env, system),
                        d.cacheMaxSize))
                .awsApiCallTimeout(parseDuration(AWS_API_CALL_TIMEOUT_KEY,
                        resolve(AWS_API_CALL_TIMEOUT_KEY, AWS_API_CALL_TIMEOUT_ENV, null, resource, env, system),
                        d.awsApiCallTimeout))
                .secretsCacheTtl(parseDuration(SECRETS_CACHE_TTL_KEY,
                        resolve(SECRETS_CACHE_TTL_KEY, SECRETS_CACHE_TTL_ENV, null, resource, env, system),
                        d.secretsCacheTtl))
                .build();
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static Properties loadResource() {
        Properties props = new Properties();
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = FactorySettings.class.getClassLoader();
        }
        try (InputStream in = cl.getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
                log.debug("Loaded settings from classpath resource {}", RESOURCE_NAME);
            }
        } catch (IOException e) {
            log.warn("Could not read {}: {}", RESOURCE_NAME, e.getMessage());
        }
        return props;
    }

    private static String resolve(String key, String envVar, String fallback,
            Properties resource, Map<String, String> env, Properties system) {
        String value = fallback;
        if (resource != null && notBlank(resource.getProperty(key))) {
            value = resource.getProperty(key).trim();
        }
        if (env != null && notBlank(env.get(envVar))) {
            value = env.get(envVar).trim();
        }
        if (system != null && notBlank(system.getProperty(key))) {
            value = system.getProperty(key).trim();
        }
        return value;
    }

    private static int parseInt(String key, String raw, int fallback) {
        if (raw == null) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(raw);
            if (parsed < 1) {
                log.warn("Setting {} must be >= 1, got {}; using {}", key, parsed, fallback);
                return fallback;
            }
            return parsed;
        } catch (NumberFormatException e) {
            log.warn("Setting {} is not an integer: {}; using {}", key, raw, fallback);
            return fallback;
        }
    }

    private static Duration parseDuration(String key, String raw, Duration fallback) {
        if (raw == null) {
            return fallback;
        }
        try {
            return Duration.parse(raw);
        } catch (DateTimeParseException e) {
            log.warn("Setting {} is not an ISO-8601 duration: {}; using {}", key, raw, fallback);
            return fallback;
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
