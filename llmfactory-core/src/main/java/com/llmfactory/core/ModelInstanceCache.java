package com.llmfactory.core;

import com.llmfactory.providers.LlmModel;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded least-recently-used cache of model instances keyed by
 * {@code (name, sourcePath)}.
 * <p>
 * The map is guarded by this object's monitor, but misses are built outside
 * it, so a slow model construction never blocks hits on other keys. When two
 * callers miss on the same key at once, both build and the first to publish
 * wins.
 */
@Slf4j
public class ModelInstanceCache {

    record Key(String name, String sourcePath) {
    }

    private final ModelFactoryHolder holder;
    private final int capacity;
    private final LinkedHashMap<Key, LlmModel> cache;
    /** Bumped on every clear; builds started before a clear are not published. */
    private long generation;

    public ModelInstanceCache(ModelFactoryHolder holder, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.holder = holder;
        this.capacity = capacity;
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Key, LlmModel> eldest) {
                boolean evict = size() > ModelInstanceCache.this.capacity;
                if (evict) {
                    log.debug("Evicting cached model {} ({})", eldest.getKey().name(), eldest.getKey().sourcePath());
                }
                return evict;
            }
        };
    }

    public LlmModel get(String name, String sourcePath) {
        return get(name, sourcePath, false);
    }

    /**
     * Return the cached instance, creating it through the holder's factory
     * on a miss.
     *
     * @param forceReload clear the whole cache before the lookup
     */
    public LlmModel get(String name, String sourcePath, boolean forceReload) {
        Key key = new Key(name, sourcePath);
        long startedAt;
        synchronized (this) {
            if (forceReload) {
                log.info("Clearing model instance cache ({} entries)", cache.size());
                clear();
            }
            LlmModel cached = cache.get(key);
            if (cached != null) {
                return cached;
            }
            startedAt = generation;
        }

        LlmModel created = holder.getOrInit(sourcePath).getModelInstance(name);

        synchronized (this) {
            if (generation != startedAt) {
                log.debug("Cache cleared while building {}; not caching it", name);
                return created;
            }
            LlmModel winner = cache.putIfAbsent(key, created);
            return winner != null ? winner : created;
        }
    }

    public synchronized void invalidateAll() {
        clear();
    }

    private void clear() {
        cache.clear();
        generation++;
    }

    public synchronized int size() {
        return cache.size();
    }

    public int capacity() {
        return capacity;
    }

    synchronized boolean contains(String name, String sourcePath) {
        return cache.containsKey(new Key(name, sourcePath));
    }
}
