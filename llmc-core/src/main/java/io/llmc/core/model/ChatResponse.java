package io.llmc.core.model;

import java.util.List;

public record ChatResponse(
    MessageRole role,
    String content,
    List<ToolCall> toolCalls,
    Usage usage,
    String finishReason
) {

    public ChatResponse {
        role = role == null ? MessageRole.ASSISTANT : role;
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
