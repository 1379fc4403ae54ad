package com.llmfactory.core;

import com.llmfactory.common.config.ModelDefinition;
import com.llmfactory.common.errors.ModelNotFoundError;
import com.llmfactory.providers.AbstractLlmModel;
import com.llmfactory.providers.ChatResult;
import com.llmfactory.providers.LlmModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ModelInstanceCache}.
 */
class ModelInstanceCacheTest {

    @TempDir
    Path root;

    private FactoryFixtures fixtures;
    private String path;

    @BeforeEach
    void setUp() throws Exception {
        fixtures = new FactoryFixtures(root);
        fixtures.local("gpt_4o", FactoryFixtures.GPT_4O)
                .local("gpt_4o_mini", FactoryFixtures.GPT_4O.replace("gpt-4o", "gpt-4o-mini"))
                .local("gpt_35", FactoryFixtures.GPT_4O.replace("gpt-4o", "gpt-3.5-turbo"));
        path = fixtures.localDir.toString();
    }

    private ModelInstanceCache cache(int capacity) {
        return new ModelInstanceCache(new ModelFactoryHolder(fixtures.options()), capacity);
    }

    static class StubModel extends AbstractLlmModel {
        StubModel(String name, ModelDefinition definition) {
            super(name, definition);
        }

        @Override
        public ChatResult invoke(String prompt) {
            return ChatResult.builder().text(prompt).build();
        }
    }

    /** Registers a "slow" provider whose construction blocks until released. */
    private void registerSlowProvider(ModelFactoryHolder holder, CountDownLatch building, CountDownLatch release) {
        holder.getOrInit(path).getRegistry().register("slow", (name, definition) -> {
            building.countDown();
            try {
                if (!release.await(10, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("slow model was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return new StubModel(name, definition);
        });
    }

    @Test
    void get_gpt4oScenario() {
        ModelInstanceCache cache = cache(128);

        LlmModel first = cache.get("gpt_4o", path);
        assertEquals("gpt_4o", first.getName());
        assertSame(first, cache.get("gpt_4o", path));

        ModelNotFoundError error = assertThrows(ModelNotFoundError.class, () -> cache.get("no_such_model", path));
        assertEquals("Config for 'no_such_model' not found.", error.getMessage());
    }

    @Test
    void get_forceReloadReturnsNewInstance() {
        ModelInstanceCache cache = cache(128);
        LlmModel before = cache.get("gpt_4o", path);

        LlmModel reloaded = cache.get("gpt_4o", path, true);

        assertNotSame(before, reloaded);
        assertSame(reloaded, cache.get("gpt_4o", path));
    }

    @Test
    void get_forceReloadClearsEveryEntry() {
        ModelInstanceCache cache = cache(128);
        cache.get("gpt_4o", path);
        cache.get("gpt_4o_mini", path);

        cache.get("gpt_35", path, true);

        assertEquals(1, cache.size());
        assertFalse(cache.contains("gpt_4o", path));
    }

    @Test
    void get_evictsLeastRecentlyUsed() {
        ModelInstanceCache cache = cache(2);
        LlmModel gpt = cache.get("gpt_4o", path);
        cache.get("gpt_4o_mini", path);
        cache.get("gpt_4o", path);

        cache.get("gpt_35", path);

        assertEquals(2, cache.size());
        assertTrue(cache.contains("gpt_4o", path));
        assertFalse(cache.contains("gpt_4o_mini", path));
        assertSame(gpt, cache.get("gpt_4o", path));
    }

    @Test
    void get_failedLookupIsNotCached() {
        ModelInstanceCache cache = cache(4);
        assertThrows(ModelNotFoundError.class, () -> cache.get("no_such_model", path));
        assertEquals(0, cache.size());
    }

    @Test
    void invalidateAll_emptiesCache() {
        ModelInstanceCache cache = cache(4);
        cache.get("gpt_4o", path);

        cache.invalidateAll();

        assertEquals(0, cache.size());
        assertEquals(4, cache.capacity());
    }

    @Test
    void constructor_rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> cache(0));
    }

    // =========================================================================
    // Concurrency
    // =========================================================================

    @Test
    void get_hitsAndOtherMissesProceedWhileAMissIsBuilding() throws Exception {
        fixtures.local("slow_model", "name: Slow\nprovider: slow\nmodel_id: slow-1\n");
        ModelFactoryHolder holder = new ModelFactoryHolder(fixtures.options());
        ModelInstanceCache cache = new ModelInstanceCache(holder, 8);
        LlmModel gpt = cache.get("gpt_4o", path);
        CountDownLatch building = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        registerSlowProvider(holder, building, release);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<LlmModel> slow = executor.submit(() -> cache.get("slow_model", path));
            assertTrue(building.await(5, TimeUnit.SECONDS));

            LlmModel hit = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> cache.get("gpt_4o", path));
            assertSame(gpt, hit);
            LlmModel mini = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> cache.get("gpt_4o_mini", path));
            assertEquals("gpt_4o_mini", mini.getName());
            assertFalse(slow.isDone());

            release.countDown();
            LlmModel slowModel = slow.get(5, TimeUnit.SECONDS);
            assertSame(slowModel, cache.get("slow_model", path));
            assertEquals(3, cache.size());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    void get_buildInterruptedByInvalidateAll_isNotCached() throws Exception {
        fixtures.local("slow_model", "name: Slow\nprovider: slow\nmodel_id: slow-1\n");
        ModelFactoryHolder holder = new ModelFactoryHolder(fixtures.options());
        ModelInstanceCache cache = new ModelInstanceCache(holder, 8);
        CountDownLatch building = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        registerSlowProvider(holder, building, release);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<LlmModel> slow = executor.submit(() -> cache.get("slow_model", path));
            assertTrue(building.await(5, TimeUnit.SECONDS));
            cache.invalidateAll();
            release.countDown();

            assertEquals("slow_model", slow.get(5, TimeUnit.SECONDS).getName());
            assertFalse(cache.contains("slow_model", path));
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }
}
