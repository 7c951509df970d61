package io.llmc.core.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record CachedToken(String token, Instant expiresAt) {

    public CachedToken {
        Objects.requireNonNull(token, "token must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    }

    public boolean usable(Instant now, Duration refreshMargin) {
        return now.plus(refreshMargin).isBefore(expiresAt);
    }
}
