package com.llmfactory.core;

import com.llmfactory.common.config.FactorySettings;
import com.llmfactory.common.store.ObjectStore;
import com.llmfactory.common.store.ParameterStore;
import com.llmfactory.common.store.SecretStore;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.function.Function;

/**
 * Inputs for building a {@link ModelFactory}. Any store left null is backed
 * by AWS (S3, SSM, Secrets Manager) using the default credential chain.
 */
@Value
@Builder(toBuilder = true)
public class FactoryOptions {
    /** Local definition directory. */
    String sourcePath;
    /** Null resolves {@link FactorySettings#load()}. */
    FactorySettings settings;
    ParameterStore parameterStore;
    SecretStore secretStore;
    /** Store serving both the local and the remote locations. */
    ObjectStore objectStore;
    /** Environment lookup for API keys; null uses the process environment. */
    Function<String, String> env;
    /** Where plugin jars are fetched to; null for a process-wide temporary directory. */
    Path pluginWorkDir;

    public static FactoryOptions forSource(String sourcePath) {
        return FactoryOptions.builder().sourcePath(sourcePath).build();
    }
}
