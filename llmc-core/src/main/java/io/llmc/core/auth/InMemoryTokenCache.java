package io.llmc.core.auth;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Check, lock per key, re-check, refresh, store. Concurrent callers for the same key wait for one refresh;
 * different keys never contend.
 */
public final class InMemoryTokenCache implements TokenCache {
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryTokenCache.class);

    private final Clock clock;
    private final Map<String, CachedToken> tokens = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public InMemoryTokenCache() {
        this(Clock.systemUTC());
    }

    public InMemoryTokenCache(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public CachedToken getOrRefresh(String key, Duration refreshMargin, TokenRefresher refresher) {
        CachedToken current = tokens.get(key);
        if (current != null && current.usable(clock.instant(), refreshMargin)) {
            return current;
        }
        Object lock = locks.computeIfAbsent(key, ignored -> new Object());
        synchronized (lock) {
            current = tokens.get(key);
            if (current != null && current.usable(clock.instant(), refreshMargin)) {
                return current;
            }
            LOG.debug("Refreshing access token for {}", key);
            CachedToken refreshed = Objects.requireNonNull(refresher.refresh(), "refreshed token must not be null");
            tokens.put(key, refreshed);
            return refreshed;
        }
    }

    @Override
    public void invalidate(String key) {
        tokens.remove(key);
    }
}
