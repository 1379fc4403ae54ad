package com.llmfactory.core;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the process-wide {@link ModelFactory}.
 * <p>
 * The first successful construction wins. Later requests return that factory
 * even when they name a different source path; {@link #reset()} is the only
 * way to switch. A failed construction leaves the holder empty.
 */
@Slf4j
public class ModelFactoryHolder {

    private static final ModelFactoryHolder GLOBAL = new ModelFactoryHolder(FactoryOptions.builder().build());

    private final FactoryOptions template;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile ModelFactory current;

    /**
     * @param template options applied to every construction; the source path
     *                 is filled in per request
     */
    public ModelFactoryHolder(FactoryOptions template) {
        this.template = Objects.requireNonNull(template, "template");
    }

    /** Holder used by {@link LlmFactory}. */
    public static ModelFactoryHolder global() {
        return GLOBAL;
    }

    /**
     * Build the factory from {@code options} unless one is already ready.
     */
    public ModelFactory init(FactoryOptions options) {
        ModelFactory existing = current;
        if (existing != null) {
            warnOnDifferentSource(existing, options.getSourcePath());
            return existing;
        }
        lock.lock();
        try {
            existing = current;
            if (existing != null) {
                warnOnDifferentSource(existing, options.getSourcePath());
                return existing;
            }
            ModelFactory created = ModelFactory.create(options);
            current = created;
            log.info("Model factory initialized for {}", created.getSourcePath());
            return created;
        } finally {
            lock.unlock();
        }
    }

    public ModelFactory getOrInit(String sourcePath) {
        return init(template.toBuilder().sourcePath(sourcePath).build());
    }

    /** The ready factory, or null. */
    public ModelFactory current() {
        return current;
    }

    /**
     * Drop and close the current factory. Instances it built that call AWS
     * stop working, so callers caching them must invalidate too.
     */
    public void reset() {
        ModelFactory previous;
        lock.lock();
        try {
            previous = current;
            current = null;
        } finally {
            lock.unlock();
        }
        if (previous != null) {
            previous.close();
        }
    }

    private static void warnOnDifferentSource(ModelFactory existing, String requested) {
        if (requested != null && !requested.equals(existing.getSourcePath())) {
            log.warn("Model factory already initialized for {}; ignoring source path {}",
                    existing.getSourcePath(), requested);
        }
    }
}
