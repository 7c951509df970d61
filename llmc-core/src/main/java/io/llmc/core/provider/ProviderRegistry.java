package io.llmc.core.provider;

import io.llmc.core.config.model.ProviderConfig;
import io.llmc.core.error.ConfigException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Provider configurations shared across requests. Writers swap in a new immutable snapshot; readers never block.
 */
public final class ProviderRegistry {
    private final Object writeLock = new Object();
    private volatile Map<String, ProviderConfig> snapshot = Map.of();

    public ProviderRegistry() {
    }

    public ProviderRegistry(Collection<ProviderConfig> providers) {
        Map<String, ProviderConfig> initial = new LinkedHashMap<>();
        for (ProviderConfig provider : providers) {
            initial.put(provider.name(), provider);
        }
        snapshot = Collections.unmodifiableMap(initial);
    }

    public void add(ProviderConfig provider) {
        Objects.requireNonNull(provider, "provider must not be null");
        requireName(provider);
        synchronized (writeLock) {
            if (snapshot.containsKey(provider.name())) {
                throw new ConfigException("Provider '" + provider.name() + "' already exists");
            }
            Map<String, ProviderConfig> next = new LinkedHashMap<>(snapshot);
            next.put(provider.name(), provider);
            snapshot = Collections.unmodifiableMap(next);
        }
    }

    public void update(ProviderConfig provider) {
        Objects.requireNonNull(provider, "provider must not be null");
        synchronized (writeLock) {
            if (!snapshot.containsKey(provider.name())) {
                throw ConfigException.unknownProvider(provider.name());
            }
            Map<String, ProviderConfig> next = new LinkedHashMap<>(snapshot);
            next.put(provider.name(), provider);
            snapshot = Collections.unmodifiableMap(next);
        }
    }

    public boolean remove(String name) {
        synchronized (writeLock) {
            if (!snapshot.containsKey(name)) {
                return false;
            }
            Map<String, ProviderConfig> next = new LinkedHashMap<>(snapshot);
            next.remove(name);
            snapshot = Collections.unmodifiableMap(next);
            return true;
        }
    }

    public Optional<ProviderConfig> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshot.get(name));
    }

    public ProviderConfig require(String name) {
        return find(name).orElseThrow(() -> ConfigException.unknownProvider(name));
    }

    public boolean contains(String name) {
        return name != null && snapshot.containsKey(name);
    }

    public List<String> names() {
        return new ArrayList<>(snapshot.keySet());
    }

    public List<ProviderConfig> all() {
        return new ArrayList<>(snapshot.values());
    }

    private void requireName(ProviderConfig provider) {
        if (provider.name().isBlank()) {
            throw new ConfigException("Provider name must not be blank");
        }
    }
}
