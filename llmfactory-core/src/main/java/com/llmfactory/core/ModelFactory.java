package com.llmfactory.core;

import com.llmfactory.aws.AwsClients;
import com.llmfactory.aws.s3.S3ObjectStore;
import com.llmfactory.aws.secrets.SecretsManagerSecretStore;
import com.llmfactory.aws.ssm.SsmParameterStore;
import com.llmfactory.common.config.ConfigMerge;
import com.llmfactory.common.config.ConfigSourceReader;
import com.llmfactory.common.config.ConfigValidation;
import com.llmfactory.common.config.FactorySettings;
import com.llmfactory.common.config.ModelCatalog;
import com.llmfactory.common.config.ModelDefinition;
import com.llmfactory.common.errors.ModelConfigurationError;
import com.llmfactory.common.errors.ModelNotFoundError;
import com.llmfactory.common.errors.StoreAccessError;
import com.llmfactory.common.store.LocalObjectStore;
import com.llmfactory.common.store.ObjectStore;
import com.llmfactory.common.store.ObjectStoreRouter;
import com.llmfactory.common.store.ParameterStore;
import com.llmfactory.common.store.SecretStore;
import com.llmfactory.plugin.PluginLoadResult;
import com.llmfactory.plugin.loader.PluginLoader;
import com.llmfactory.providers.CredentialResolver;
import com.llmfactory.providers.LlmModel;
import com.llmfactory.providers.ProviderFactory;
import com.llmfactory.providers.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds model instances from a validated catalog and a provider registry.
 * <p>
 * Instances are created fresh on every call; memoization belongs to
 * {@link ModelInstanceCache}. The factory owns the AWS clients it builds and
 * the registry's shared clients; {@link #close()} releases them.
 */
@Slf4j
public class ModelFactory implements AutoCloseable {

    static final String LOCAL_DESCRIPTION = "local directory";
    static final String REMOTE_DESCRIPTION = "S3 directory";

    private final String sourcePath;
    private final FactorySettings settings;
    private final ProviderRegistry registry;
    private final ConfigSourceReader reader;
    private final ParameterStore parameters;
    private final PluginLoadResult pluginResult;
    private final AwsClients aws;

    private volatile ModelCatalog catalog;
    private volatile boolean closed;

    ModelFactory(String sourcePath, FactorySettings settings, ProviderRegistry registry,
            ConfigSourceReader reader, ParameterStore parameters, PluginLoadResult pluginResult, AwsClients aws) {
        this.sourcePath = sourcePath;
        this.settings = settings;
        this.registry = registry;
        this.reader = reader;
        this.parameters = parameters;
        this.pluginResult = pluginResult;
        this.aws = aws;
    }

    // =========================================================================
    // Construction
    // =========================================================================

    /**
     * Seed the registry, load plugins, then load, merge and validate the
     * local and remote definitions.
     *
     * @throws com.llmfactory.common.errors.ConfigLoadError       when a definition directory cannot be read
     * @throws com.llmfactory.common.errors.ConfigValidationError when any definition is invalid
     * @throws ModelConfigurationError                            when the remote location cannot be resolved
     */
    public static ModelFactory create(FactoryOptions options) {
        if (options.getSourcePath() == null || options.getSourcePath().isBlank()) {
            throw new ModelConfigurationError("A local source path is required to build the model factory.");
        }
        FactorySettings settings = options.getSettings() != null ? options.getSettings() : FactorySettings.load();
        AwsClients aws = new AwsClients(settings);

        ObjectStore objectStore = options.getObjectStore() != null
                ? options.getObjectStore()
                : new ObjectStoreRouter(List.of(new S3ObjectStore(aws::s3), new LocalObjectStore()));
        ParameterStore parameters = options.getParameterStore() != null
                ? options.getParameterStore()
                : new SsmParameterStore(aws::ssm);
        SecretStore secrets = options.getSecretStore() != null
                ? options.getSecretStore()
                : new SecretsManagerSecretStore(aws::secretsManager, settings.getSecretsCacheTtl());
        CredentialResolver credentials = options.getEnv() != null
                ? new CredentialResolver(secrets, options.getEnv())
                : new CredentialResolver(secrets);

        ProviderRegistry registry = new ProviderRegistry();
        registry.registerBuiltins(credentials, settings.getAwsApiCallTimeout());

        PluginLoadResult plugins = new PluginLoader(parameters, objectStore, options.getPluginWorkDir())
                .loadFromParameter(settings.getProviderPathParameter(), registry);

        ModelFactory factory = new ModelFactory(options.getSourcePath(), settings, registry,
                new ConfigSourceReader(objectStore), parameters, plugins, aws);
        try {
            factory.catalog = factory.loadCatalog();
        } catch (RuntimeException e) {
            factory.close();
            throw e;
        }
        return factory;
    }

    // =========================================================================
    // Catalog
    // =========================================================================

    /**
     * Re-read both definition sources and swap the catalog in one step.
     * On failure the current catalog stays in place and the error propagates.
     */
    public ModelCatalog reloadCatalog() {
        ModelCatalog next = loadCatalog();
        catalog = next;
        return next;
    }

    private ModelCatalog loadCatalog() {
        Map<String, Map<String, Object>> local = reader.readDirectory(sourcePath, LOCAL_DESCRIPTION);
        String remoteLocation = resolveRemoteLocation();
        Map<String, Map<String, Object>> remote = reader.readDirectory(remoteLocation, REMOTE_DESCRIPTION);

        ModelCatalog loaded = ConfigValidation.validate(sourcePath, ConfigMerge.mergeTrees(local, remote));
        log.info("Loaded {} model configuration(s) from {} and {}", loaded.size(), sourcePath, remoteLocation);
        return loaded;
    }

    private String resolveRemoteLocation() {
        String parameterName = settings.getModelsPathParameter();
        Optional<String> location;
        try {
            location = parameters.getParameter(parameterName);
        } catch (StoreAccessError e) {
            throw new ModelConfigurationError(
                    "Could not resolve remote model configuration location from '" + parameterName + "': "
                            + e.getMessage(), e);
        }
        if (location.isEmpty() || location.get().isBlank()) {
            throw new ModelConfigurationError(
                    "Remote model configuration location parameter '" + parameterName + "' is not set.");
        }
        return location.get().trim();
    }

    // =========================================================================
    // Instances
    // =========================================================================

    /**
     * Build a new instance of the named model.
     *
     * @throws ModelConfigurationError when the factory is closed, no catalog is loaded or the provider is
     *                                 not registered
     * @throws ModelNotFoundError      when the catalog has no such model
     */
    public LlmModel getModelInstance(String name) {
        if (closed) {
            throw new ModelConfigurationError("Model factory for '" + sourcePath + "' has been closed.");
        }
        ModelCatalog current = catalog;
        if (current == null) {
            throw new ModelConfigurationError("Model configurations not loaded into the factory.");
        }
        ModelDefinition definition = current.find(name).orElseThrow(() -> new ModelNotFoundError(name));
        String providerKey = definition.providerKey();
        ProviderFactory providerFactory = registry.resolve(providerKey)
                .orElseThrow(() -> new ModelConfigurationError(
                        "No model class registered for provider '" + providerKey + "'."));
        log.debug("Creating model {} with provider {}", name, providerKey);
        return providerFactory.create(name, definition);
    }

    public ModelCatalog getCatalog() {
        return catalog;
    }

    public ProviderRegistry getRegistry() {
        return registry;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public FactorySettings getSettings() {
        return settings;
    }

    public PluginLoadResult getPluginResult() {
        return pluginResult;
    }

    public boolean isClosed() {
        return closed;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Close the SDK clients owned by this factory. Models already handed out
     * that call AWS stop working; the catalog stays readable.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        registry.close();
        aws.close();
        log.info("Closed model factory for {}", sourcePath);
    }
}
