package com.llmfactory.core;

import com.llmfactory.common.errors.ConfigLoadError;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Definitions bundled with the library under {@code model_config/}.
 * They are copied to a temporary directory once per process so they can be
 * read like any other local source.
 */
@Slf4j
public final class DefaultModelConfigs {

    private DefaultModelConfigs() {
    }

    static final String RESOURCE_DIR = "model_config/";
    static final List<String> BUNDLED = List.of(
            "claude_sonnet_3_7.yaml",
            "gpt_4o.yaml",
            "llama_3_8b_instruct.yaml");

    private static volatile Path configDir;

    /**
     * Directory holding the bundled definitions.
     */
    public static String defaultConfigDir() {
        Path dir = configDir;
        if (dir == null) {
            synchronized (DefaultModelConfigs.class) {
                dir = configDir;
                if (dir == null) {
                    dir = materialize();
                    configDir = dir;
                }
            }
        }
        return dir.toString();
    }

    /**
     * Paths of the bundled definition files, sorted.
     */
    public static List<String> defaultConfigs() {
        Path dir = Path.of(defaultConfigDir());
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".yaml"))
                    .map(Path::toString)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ConfigLoadError(dir.toString(), "Failed to list bundled definitions", e);
        }
    }

    private static Path materialize() {
        Path dir;
        try {
            dir = Files.createTempDirectory("llmfactory-model-config");
        } catch (IOException e) {
            throw new ConfigLoadError(RESOURCE_DIR, "Failed to create directory for bundled definitions", e);
        }
        ClassLoader cl = DefaultModelConfigs.class.getClassLoader();
        List<Path> written = new ArrayList<>();
        for (String file : BUNDLED) {
            try (InputStream in = cl.getResourceAsStream(RESOURCE_DIR + file)) {
                if (in == null) {
                    throw new ConfigLoadError(RESOURCE_DIR + file, "Bundled definition missing from classpath");
                }
                Path target = dir.resolve(file);
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                target.toFile().deleteOnExit();
                written.add(target);
            } catch (IOException e) {
                throw new ConfigLoadError(RESOURCE_DIR + file, "Failed to copy bundled definition", e);
            }
        }
        dir.toFile().deleteOnExit();
        log.debug("Materialized {} bundled definition(s) in {}", written.size(), dir);
        return dir;
    }
}
