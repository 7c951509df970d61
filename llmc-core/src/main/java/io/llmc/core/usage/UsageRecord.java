package io.llmc.core.usage;

import java.time.Instant;
import java.util.Objects;

public record UsageRecord(String provider, String model, long inputTokens, long outputTokens, Instant timestamp) {

    public UsageRecord {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public long totalTokens() {
        return inputTokens + outputTokens;
    }
}
