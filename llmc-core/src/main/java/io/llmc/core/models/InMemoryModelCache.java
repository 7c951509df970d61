package io.llmc.core.models;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryModelCache implements ModelCache {
    private final Map<String, ModelCacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<ModelCacheEntry> find(String provider) {
        return Optional.ofNullable(entries.get(provider));
    }

    @Override
    public Map<String, ModelCacheEntry> all() {
        return Map.copyOf(entries);
    }

    @Override
    public void put(ModelCacheEntry entry) {
        entries.put(entry.provider(), entry);
    }

    @Override
    public void remove(String provider) {
        entries.remove(provider);
    }
}
