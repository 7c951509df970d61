package io.llmc.core.model;

import java.util.List;

public record ChatChunk(
    MessageRole role,
    String content,
    List<ToolCallDelta> toolCalls,
    Usage usage,
    String finishReason
) {

    public ChatChunk {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ChatChunk text(String content) {
        return new ChatChunk(null, content, List.of(), null, null);
    }

    public static ChatChunk finish(String finishReason, Usage usage) {
        return new ChatChunk(null, "", List.of(), usage, finishReason);
    }

    public boolean isEmpty() {
        return content.isEmpty() && toolCalls.isEmpty() && usage == null && finishReason == null && role == null;
    }
}
