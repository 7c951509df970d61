package io.llmc.core.models;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

public interface ModelCache {
    Optional<ModelCacheEntry> find(String provider);

    Map<String, ModelCacheEntry> all();

    void put(ModelCacheEntry entry) throws IOException;

    void remove(String provider) throws IOException;
}
