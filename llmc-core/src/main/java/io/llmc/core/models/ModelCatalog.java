package io.llmc.core.models;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cached model lists per provider. Missing entries are fetched synchronously; stale entries are served as-is and
 * refreshed in the background.
 */
public final class ModelCatalog {
    private static final Logger LOG = LoggerFactory.getLogger(ModelCatalog.class);

    private final ModelCache cache;
    private final ModelFetcher fetcher;
    private final Executor backgroundExecutor;
    private final Clock clock;
    private final Duration ttl;
    private final Set<String> refreshing = ConcurrentHashMap.newKeySet();

    public ModelCatalog(ModelCache cache, ModelFetcher fetcher, Executor backgroundExecutor, Clock clock, Duration ttl) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.backgroundExecutor = Objects.requireNonNull(backgroundExecutor, "backgroundExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.ttl = ttl == null ? ModelCacheEntry.DEFAULT_TTL : ttl;
    }

    public List<ModelMetadata> models(String provider) {
        Optional<ModelCacheEntry> cached = cache.find(provider);
        if (cached.isEmpty()) {
            return refresh(provider).models();
        }
        ModelCacheEntry entry = cached.get();
        if (entry.stale(clock.instant())) {
            refreshInBackground(provider);
        }
        return entry.models();
    }

    public ModelCacheEntry refresh(String provider) {
        List<ModelMetadata> models = new ArrayList<>(fetcher.fetch(provider));
        models.sort(Comparator.comparing(ModelMetadata::id));
        ModelCacheEntry entry = new ModelCacheEntry(provider, models, clock.instant(), ttl);
        try {
            cache.put(entry);
        } catch (IOException e) {
            LOG.warn("Failed to persist model cache for {}: {}", provider, e.getMessage());
        }
        return entry;
    }

    public Optional<Instant> lastRefresh(String provider) {
        return cache.find(provider).map(ModelCacheEntry::lastRefresh);
    }

    public Map<String, ModelCacheEntry> cached() {
        return cache.all();
    }

    public boolean needsRefresh(String provider) {
        return cache.find(provider).map(entry -> entry.stale(clock.instant())).orElse(true);
    }

    private void refreshInBackground(String provider) {
        if (!refreshing.add(provider)) {
            return;
        }
        try {
            backgroundExecutor.execute(() -> {
                try {
                    refresh(provider);
                } catch (RuntimeException e) {
                    LOG.warn("Background model refresh failed for {}: {}", provider, e.getMessage());
                } finally {
                    refreshing.remove(provider);
                }
            });
        } catch (RejectedExecutionException e) {
            refreshing.remove(provider);
            LOG.warn("Background model refresh for {} was rejected: {}", provider, e.getMessage());
        }
    }

    @FunctionalInterface
    public interface ModelFetcher {
        List<ModelMetadata> fetch(String provider);
    }
}
