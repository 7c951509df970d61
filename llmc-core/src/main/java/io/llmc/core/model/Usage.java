package io.llmc.core.model;

public record Usage(long inputTokens, long outputTokens, long totalTokens) {

    public static final Usage ZERO = new Usage(0, 0, 0);

    public static Usage of(long inputTokens, long outputTokens) {
        return new Usage(inputTokens, outputTokens, inputTokens + outputTokens);
    }
}
