package io.llmc.core.usage;

public record UsageSummary(String provider, String model, long requests, long inputTokens, long outputTokens) {

    public long totalTokens() {
        return inputTokens + outputTokens;
    }
}
