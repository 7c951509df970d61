package io.llmc.core.model;

import java.util.List;

public record ChatRequest(
    String model,
    List<ChatMessage> messages,
    Integer maxTokens,
    Double temperature,
    List<ToolDefinition> tools,
    boolean stream
) {

    public ChatRequest {
        model = model == null ? "" : model.trim();
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static ChatRequest of(String model, List<ChatMessage> messages) {
        return new ChatRequest(model, messages, null, null, List.of(), false);
    }

    public ChatRequest withModel(String newModel) {
        return new ChatRequest(newModel, messages, maxTokens, temperature, tools, stream);
    }

    public ChatRequest withStream(boolean newStream) {
        return new ChatRequest(model, messages, maxTokens, temperature, tools, newStream);
    }

    /** Throws {@link IllegalArgumentException} when there is nothing to send. */
    public ChatRequest requireMessages() {
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("Chat request must contain at least one message");
        }
        return this;
    }

    public String systemPrompt() {
        StringBuilder builder = new StringBuilder();
        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM) {
                if (builder.length() > 0) {
                    builder.append('\n');
                }
                builder.append(message.text());
            }
        }
        return builder.toString();
    }
}
