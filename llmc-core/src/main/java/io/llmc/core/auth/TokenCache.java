package io.llmc.core.auth;

import java.time.Duration;

public interface TokenCache {

    /**
     * Returns the cached token for {@code key} unless it expires within {@code refreshMargin}, in which case
     * {@code refresher} is invoked once and its result stored.
     */
    CachedToken getOrRefresh(String key, Duration refreshMargin, TokenRefresher refresher);

    void invalidate(String key);

    @FunctionalInterface
    interface TokenRefresher {
        CachedToken refresh();
    }
}
