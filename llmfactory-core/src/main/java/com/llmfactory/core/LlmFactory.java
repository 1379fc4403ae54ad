package com.llmfactory.core;

import com.llmfactory.common.config.FactorySettings;
import com.llmfactory.providers.LlmModel;

/**
 * Static entry point: {@code LlmFactory.getLlm("gpt_4o", configDir)}.
 */
public final class LlmFactory {

    private LlmFactory() {
    }

    private static volatile ModelInstanceCache cache;

    public static LlmModel getLlm(String name, String sourcePath) {
        return getLlm(name, sourcePath, false);
    }

    public static LlmModel getLlm(String name, String sourcePath, boolean forceReload) {
        return cache().get(name, sourcePath, forceReload);
    }

    /** The process-wide instance cache, sized from {@link FactorySettings}. */
    public static ModelInstanceCache cache() {
        ModelInstanceCache c = cache;
        if (c == null) {
            synchronized (LlmFactory.class) {
                c = cache;
                if (c == null) {
                    c = new ModelInstanceCache(ModelFactoryHolder.global(), FactorySettings.load().getCacheMaxSize());
                    cache = c;
                }
            }
        }
        return c;
    }

    /**
     * Drop the cached instances and the process-wide factory.
     */
    public static void reset() {
        ModelInstanceCache c = cache;
        if (c != null) {
            c.invalidateAll();
        }
        ModelFactoryHolder.global().reset();
    }
}
