package io.llmc.core.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelCacheEntry(String provider, List<ModelMetadata> models, Instant lastRefresh, Duration ttl) {

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    public ModelCacheEntry {
        Objects.requireNonNull(provider, "provider must not be null");
        models = models == null ? List.of() : List.copyOf(models);
        lastRefresh = lastRefresh == null ? Instant.EPOCH : lastRefresh;
        ttl = ttl == null ? DEFAULT_TTL : ttl;
    }

    public boolean stale(Instant now) {
        return !now.isBefore(lastRefresh.plus(ttl));
    }
}
