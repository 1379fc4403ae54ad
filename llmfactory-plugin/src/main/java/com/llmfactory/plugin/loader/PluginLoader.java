package com.llmfactory.plugin.loader;

import com.llmfactory.common.config.ModelDefinition;
import com.llmfactory.common.errors.ModelConfigurationError;
import com.llmfactory.common.store.ObjectStore;
import com.llmfactory.common.store.ParameterStore;
import com.llmfactory.plugin.PluginDiagnostic;
import com.llmfactory.plugin.PluginLoadResult;
import com.llmfactory.providers.LlmModel;
import com.llmfactory.providers.ProviderFactory;
import com.llmfactory.providers.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * Loads provider model classes from jar artifacts and registers them.
 * <p>
 * Every failure here is soft: it is logged, recorded as a diagnostic, and the
 * remaining artifacts are still processed.
 */
@Slf4j
public class PluginLoader {

    private static final String CLASS_SUFFIX = ".class";

    private static volatile Path sharedWorkDir;

    private final ParameterStore parameters;
    private final ObjectStore store;
    private final Path workDir;

    public PluginLoader(ParameterStore parameters, ObjectStore store) {
        this(parameters, store, null);
    }

    /**
     * @param workDir directory receiving fetched artifacts; null for a
     *                temporary directory shared for the life of the process
     */
    public PluginLoader(ParameterStore parameters, ObjectStore store, Path workDir) {
        this.parameters = parameters;
        this.store = store;
        this.workDir = workDir;
    }

    // =========================================================================
    // Load
    // =========================================================================

    /**
     * Resolve the plugin directory through {@code parameterName} and load
     * every artifact in it. A missing or unreadable parameter means no plugins.
     */
    public PluginLoadResult loadFromParameter(String parameterName, ProviderRegistry registry) {
        Optional<String> location;
        try {
            location = parameters.getParameter(parameterName);
        } catch (RuntimeException e) {
            log.warn("Could not resolve plugin location parameter {}: {}", parameterName, e.getMessage());
            return PluginLoadResult.builder()
                    .diagnostics(new ArrayList<>(List.of(PluginDiagnostic.warn(parameterName, e.getMessage()))))
                    .build();
        }
        if (location.isEmpty() || location.get().isBlank()) {
            log.info("No plugin location configured in {}; skipping plugin loading", parameterName);
            return PluginLoadResult.builder().build();
        }
        return load(location.get().trim(), registry);
    }

    /**
     * Load every artifact directly inside {@code location}.
     */
    public PluginLoadResult load(String location, ProviderRegistry registry) {
        PluginDiscovery.PluginDiscoveryResult discovery = PluginDiscovery.discover(store, location);
        PluginLoadResult result = PluginLoadResult.builder().location(location).build();
        result.getDiagnostics().addAll(discovery.getDiagnostics());
        for (PluginDiagnostic diag : discovery.getDiagnostics()) {
            log.warn("Plugin location {}: {}", location, diag.getMessage());
        }

        for (PluginDiscovery.PluginCandidate candidate : discovery.getCandidates()) {
            loadCandidate(candidate, registry, result);
        }

        log.info("Loaded {} plugin provider(s) from {}", result.getRegisteredKeys().size(), location);
        return result;
    }

    // =========================================================================
    // Load individual candidate
    // =========================================================================

    private void loadCandidate(PluginDiscovery.PluginCandidate candidate, ProviderRegistry registry,
            PluginLoadResult result) {
        String source = candidate.getSource();
        try {
            Path local = fetch(candidate);
            Optional<Class<? extends LlmModel>> type = findModelType(local, source, result);
            if (type.isEmpty()) {
                log.warn("No model class found in plugin {}; skipping", source);
                result.getDiagnostics().add(PluginDiagnostic.warn(source, "no model class found"));
                return;
            }
            registry.register(candidate.getIdHint(), reflectiveFactory(type.get()));
            result.getRegisteredKeys().add(candidate.getIdHint());
            log.info("Registered plugin provider {} from {} ({})", candidate.getIdHint(), source,
                    type.get().getName());
        } catch (IOException | LinkageError | RuntimeException e) {
            log.warn("Failed to load plugin {}: {}", source, e.getMessage());
            result.getDiagnostics().add(PluginDiagnostic.warn(source, "failed to load: " + e.getMessage()));
        }
    }

    private Path fetch(PluginDiscovery.PluginCandidate candidate) throws IOException {
        byte[] bytes = store.read(candidate.getSource());
        Path target = Files.createTempFile(resolveWorkDir(), candidate.getIdHint() + "-", ".jar");
        Files.write(target, bytes);
        return target;
    }

    private Path resolveWorkDir() throws IOException {
        if (workDir != null) {
            Files.createDirectories(workDir);
            return workDir;
        }
        Path dir = sharedWorkDir;
        if (dir == null) {
            synchronized (PluginLoader.class) {
                dir = sharedWorkDir;
                if (dir == null) {
                    dir = Files.createTempDirectory("llmfactory-plugins");
                    dir.toFile().deleteOnExit();
                    sharedWorkDir = dir;
                }
            }
        }
        return dir;
    }

    // =========================================================================
    // Type discovery
    // =========================================================================

    /**
     * Pick the model class of a jar: the manifest's entry class when present,
     * otherwise the first qualifying top-level class in entry-name order.
     */
    Optional<Class<? extends LlmModel>> findModelType(Path jarPath, String source, PluginLoadResult result)
            throws IOException {
        // The class loader stays open once a type is found: registered factories instantiate from it later.
        URLClassLoader loader = new URLClassLoader(new URL[] { jarPath.toUri().toURL() },
                LlmModel.class.getClassLoader());
        Optional<Class<? extends LlmModel>> type = Optional.empty();
        try {
            type = scanJar(jarPath, loader, source, result);
            return type;
        } finally {
            if (type.isEmpty()) {
                loader.close();
            }
        }
    }

    private Optional<Class<? extends LlmModel>> scanJar(Path jarPath, ClassLoader loader, String source,
            PluginLoadResult result) throws IOException {
        try (JarFile jar = new JarFile(jarPath.toFile())) {
            Optional<PluginManifest.Manifest> manifest = PluginManifest.read(jar);
            String entryClass = manifest.map(PluginManifest.Manifest::getEntryClass).orElse(null);
            if (entryClass != null && !entryClass.isBlank()) {
                return loadEntryClass(loader, entryClass.trim(), source, result);
            }

            List<String> classNames = new ArrayList<>();
            for (JarEntry entry : Collections.list(jar.entries())) {
                String name = entry.getName();
                if (!entry.isDirectory() && name.endsWith(CLASS_SUFFIX) && !name.contains("$")
                        && !name.endsWith("module-info.class")) {
                    classNames.add(name);
                }
            }
            classNames.sort(null);

            for (String entryName : classNames) {
                String className = entryName.substring(0, entryName.length() - CLASS_SUFFIX.length())
                        .replace('/', '.');
                Class<?> clazz;
                try {
                    clazz = Class.forName(className, false, loader);
                } catch (ClassNotFoundException | LinkageError e) {
                    log.debug("Skipping unloadable class {} in {}: {}", className, source, e.toString());
                    continue;
                }
                if (isModelType(clazz)) {
                    return Optional.of(clazz.asSubclass(LlmModel.class));
                }
            }
            return Optional.empty();
        }
    }

    private Optional<Class<? extends LlmModel>> loadEntryClass(ClassLoader loader, String entryClass,
            String source, PluginLoadResult result) {
        try {
            Class<?> clazz = Class.forName(entryClass, false, loader);
            if (isModelType(clazz)) {
                return Optional.of(clazz.asSubclass(LlmModel.class));
            }
            result.getDiagnostics().add(PluginDiagnostic.warn(source,
                    "entryClass " + entryClass + " is not a concrete model with a (String, ModelDefinition) constructor"));
        } catch (ClassNotFoundException e) {
            result.getDiagnostics().add(PluginDiagnostic.warn(source, "entryClass not found: " + entryClass));
        }
        return Optional.empty();
    }

    static boolean isModelType(Class<?> clazz) {
        if (clazz == LlmModel.class || !LlmModel.class.isAssignableFrom(clazz)) {
            return false;
        }
        int mods = clazz.getModifiers();
        if (clazz.isInterface() || Modifier.isAbstract(mods) || !Modifier.isPublic(mods)) {
            return false;
        }
        try {
            clazz.getConstructor(String.class, ModelDefinition.class);
            return true;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }

    static ProviderFactory reflectiveFactory(Class<? extends LlmModel> type) {
        Constructor<? extends LlmModel> ctor;
        try {
            ctor = type.getConstructor(String.class, ModelDefinition.class);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(type.getName() + " has no (String, ModelDefinition) constructor", e);
        }
        return (name, definition) -> {
            try {
                return ctor.newInstance(name, definition);
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException re) {
                    throw re;
                }
                if (cause instanceof Error err) {
                    throw err;
                }
                throw new ModelConfigurationError("Failed to create model '" + name + "' with "
                        + type.getName() + ": " + cause, cause);
            } catch (ReflectiveOperationException e) {
                throw new ModelConfigurationError("Failed to create model '" + name + "' with "
                        + type.getName() + ": " + e.getMessage(), e);
            }
        };
    }
}
