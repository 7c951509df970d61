package io.llmc.core.models;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ModelCatalogTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private final Map<String, AtomicInteger> fetches = new ConcurrentHashMap<>();
    private final List<Runnable> background = new ArrayList<>();
    private final Executor queued = background::add;

    @Test
    void shouldFetchSynchronouslyOnFirstUseAndSortById() {
        ModelCatalog catalog = new ModelCatalog(new InMemoryModelCache(), this::fetch, queued, fixed(NOW), Duration.ofHours(1));

        List<ModelMetadata> models = catalog.models("openai");

        assertThat(models).extracting(ModelMetadata::id).containsExactly("a-model", "z-model");
        assertThat(fetches.get("openai")).hasValue(1);
        assertThat(catalog.lastRefresh("openai")).contains(NOW);
        assertThat(catalog.needsRefresh("openai")).isFalse();
        assertThat(catalog.needsRefresh("other")).isTrue();
    }

    @Test
    void shouldServeStaleEntryAndRefreshInBackgroundOnce() {
        InMemoryModelCache cache = new InMemoryModelCache();
        cache.put(new ModelCacheEntry("openai", List.of(ModelMetadata.of("old")), NOW.minus(Duration.ofHours(2)), Duration.ofHours(1)));
        ModelCatalog catalog = new ModelCatalog(cache, this::fetch, queued, fixed(NOW), Duration.ofHours(1));

        assertThat(catalog.models("openai")).extracting(ModelMetadata::id).containsExactly("old");
        assertThat(catalog.models("openai")).extracting(ModelMetadata::id).containsExactly("old");
        assertThat(background).hasSize(1);
        assertThat(fetches).doesNotContainKey("openai");

        background.get(0).run();

        assertThat(catalog.models("openai")).extracting(ModelMetadata::id).containsExactly("a-model", "z-model");
        assertThat(catalog.lastRefresh("openai")).contains(NOW);
    }

    @Test
    void shouldKeepStaleEntryWhenBackgroundRefreshFails() {
        InMemoryModelCache cache = new InMemoryModelCache();
        cache.put(new ModelCacheEntry("flaky", List.of(ModelMetadata.of("kept")), Instant.EPOCH, Duration.ofHours(1)));
        ModelCatalog catalog = new ModelCatalog(cache, provider -> {
            throw new IllegalStateException("down");
        }, Runnable::run, fixed(NOW), Duration.ofHours(1));

        assertThat(catalog.models("flaky")).extracting(ModelMetadata::id).containsExactly("kept");
        assertThat(catalog.lastRefresh("flaky")).contains(Instant.EPOCH);
    }

    @Test
    void shouldRetryBackgroundRefreshAfterExecutorRejectsIt() {
        InMemoryModelCache cache = new InMemoryModelCache();
        cache.put(new ModelCacheEntry("openai", List.of(ModelMetadata.of("old")), Instant.EPOCH, Duration.ofHours(1)));
        AtomicInteger rejections = new AtomicInteger();
        Executor rejectFirst = task -> {
            if (rejections.getAndIncrement() == 0) {
                throw new RejectedExecutionException("shutting down");
            }
            background.add(task);
        };
        ModelCatalog catalog = new ModelCatalog(cache, this::fetch, rejectFirst, fixed(NOW), Duration.ofHours(1));

        assertThat(catalog.models("openai")).extracting(ModelMetadata::id).containsExactly("old");
        assertThat(background).isEmpty();

        assertThat(catalog.models("openai")).extracting(ModelMetadata::id).containsExactly("old");
        assertThat(background).hasSize(1);
        background.get(0).run();
        assertThat(catalog.models("openai")).extracting(ModelMetadata::id).containsExactly("a-model", "z-model");
    }

    @Test
    void shouldPersistEntriesAcrossCacheInstances() throws Exception {
        Path file = tempDir.resolve("models-cache.json");
        ModelCatalog catalog = new ModelCatalog(new FileModelCache(file), this::fetch, queued, fixed(NOW), Duration.ofHours(1));
        catalog.refresh("openai");

        FileModelCache reopened = new FileModelCache(file);

        assertThat(reopened.find("openai")).hasValueSatisfying(entry -> {
            assertThat(entry.models()).extracting(ModelMetadata::id).containsExactly("a-model", "z-model");
            assertThat(entry.lastRefresh()).isEqualTo(NOW);
            assertThat(entry.ttl()).isEqualTo(Duration.ofHours(1));
        });
        reopened.remove("openai");
        assertThat(new FileModelCache(file).all()).isEmpty();
    }

    private List<ModelMetadata> fetch(String provider) {
        fetches.computeIfAbsent(provider, ignored -> new AtomicInteger()).incrementAndGet();
        return List.of(ModelMetadata.of("z-model"), ModelMetadata.of("a-model"));
    }

    private static Clock fixed(Instant instant) {
        return Clock.fixed(instant, ZoneOffset.UTC);
    }
}
