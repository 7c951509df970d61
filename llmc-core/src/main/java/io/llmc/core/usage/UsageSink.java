package io.llmc.core.usage;

/**
 * Receives one record per completed request. Implementations must not throw.
 */
@FunctionalInterface
public interface UsageSink {
    void record(UsageRecord record);

    static UsageSink noop() {
        return record -> {
        };
    }
}
