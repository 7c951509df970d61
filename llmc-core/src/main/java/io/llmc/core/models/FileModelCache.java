package io.llmc.core.models;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Model lists persisted as one JSON file. Reads are served from an in-memory snapshot that writers replace.
 */
public final class FileModelCache implements ModelCache {
    private static final Logger LOG = LoggerFactory.getLogger(FileModelCache.class);
    private static final TypeReference<LinkedHashMap<String, ModelCacheEntry>> ENTRIES = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper mapper;
    private volatile Map<String, ModelCacheEntry> snapshot;

    public FileModelCache(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        this.snapshot = load();
    }

    @Override
    public Optional<ModelCacheEntry> find(String provider) {
        return Optional.ofNullable(snapshot.get(provider));
    }

    @Override
    public Map<String, ModelCacheEntry> all() {
        return snapshot;
    }

    @Override
    public synchronized void put(ModelCacheEntry entry) throws IOException {
        Map<String, ModelCacheEntry> next = new LinkedHashMap<>(snapshot);
        next.put(entry.provider(), entry);
        save(next);
        snapshot = Collections.unmodifiableMap(next);
    }

    @Override
    public synchronized void remove(String provider) throws IOException {
        if (!snapshot.containsKey(provider)) {
            return;
        }
        Map<String, ModelCacheEntry> next = new LinkedHashMap<>(snapshot);
        next.remove(provider);
        save(next);
        snapshot = Collections.unmodifiableMap(next);
    }

    private Map<String, ModelCacheEntry> load() {
        if (!Files.exists(path)) {
            return Map.of();
        }
        try {
            return Collections.unmodifiableMap(mapper.readValue(Files.readString(path), ENTRIES));
        } catch (IOException e) {
            LOG.warn("Ignoring unreadable model cache {}: {}", path, e.getMessage());
            return Map.of();
        }
    }

    private void save(Map<String, ModelCacheEntry> entries) throws IOException {
        Path absolute = path.toAbsolutePath();
        Files.createDirectories(absolute.getParent());
        String json = mapper.writerFor(ENTRIES).withDefaultPrettyPrinter().writeValueAsString(entries);
        Path tmp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
