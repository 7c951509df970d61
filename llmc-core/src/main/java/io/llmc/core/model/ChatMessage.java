package io.llmc.core.model;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

public record ChatMessage(
    MessageRole role,
    String content,
    List<ContentPart> parts,
    String toolCallId,
    List<ToolCall> toolCalls
) {

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
        parts = parts == null ? List.of() : List.copyOf(parts);
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(MessageRole.SYSTEM, content, List.of(), null, List.of());
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(MessageRole.USER, content, List.of(), null, List.of());
    }

    public static ChatMessage user(List<ContentPart> parts) {
        return new ChatMessage(MessageRole.USER, "", parts, null, List.of());
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(MessageRole.ASSISTANT, content, List.of(), null, List.of());
    }

    public static ChatMessage assistantWithToolCalls(String content, List<ToolCall> toolCalls) {
        return new ChatMessage(MessageRole.ASSISTANT, content, List.of(), null, toolCalls);
    }

    public static ChatMessage tool(String content, String toolCallId) {
        return new ChatMessage(MessageRole.TOOL, content, List.of(), toolCallId, List.of());
    }

    public boolean multipart() {
        return !parts.isEmpty();
    }

    /** Plain text of the message; for multi-part messages the text parts joined in order by a space. */
    public String text() {
        if (parts.isEmpty()) {
            return content;
        }
        StringJoiner joiner = new StringJoiner(ContentPart.TEXT_SEPARATOR);
        for (ContentPart part : parts) {
            if (ContentPart.TEXT.equals(part.type()) && part.text() != null) {
                joiner.add(part.text());
            }
        }
        return joiner.toString();
    }
}
