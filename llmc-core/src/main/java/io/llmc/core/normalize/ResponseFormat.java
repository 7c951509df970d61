package io.llmc.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import io.llmc.core.model.ChatResponse;
import io.llmc.core.model.MessageRole;
import io.llmc.core.model.ToolCall;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Known non-streaming chat response shapes, in detection order. A shape matches only when its required structure
 * is present; partial matches of different shapes are never combined.
 */
public enum ResponseFormat {
    /** {@code choices[0].message} */
    OPENAI_CHOICES {
        @Override
        Optional<ChatResponse> tryParse(JsonNode root) {
            JsonNode choices = root.path("choices");
            if (!choices.isArray() || choices.isEmpty() || !choices.path(0).path("message").isObject()) {
                return Optional.empty();
            }
            JsonNode choice = choices.path(0);
            JsonNode message = choice.path("message");
            return Optional.of(new ChatResponse(
                MessageRole.fromWire(message.path("role").asText("assistant")),
                JsonParts.text(message.path("content")),
                JsonParts.functionToolCalls(message.path("tool_calls")),
                UsageExtractor.extract(root),
                JsonParts.textOrNull(choice.path("finish_reason"))
            ));
        }
    },

    /** {@code completion_message.content.{type,text}} */
    COMPLETION_MESSAGE {
        @Override
        Optional<ChatResponse> tryParse(JsonNode root) {
            JsonNode message = root.path("completion_message");
            if (!message.isObject()) {
                return Optional.empty();
            }
            JsonNode content = message.path("content");
            boolean hasText = content.isTextual() || content.path("text").isTextual() || content.isArray();
            boolean hasTools = message.path("tool_calls").isArray() && !message.path("tool_calls").isEmpty();
            if (!hasText && !hasTools) {
                return Optional.empty();
            }
            return Optional.of(new ChatResponse(
                MessageRole.fromWire(message.path("role").asText("assistant")),
                JsonParts.text(content),
                JsonParts.functionToolCalls(message.path("tool_calls")),
                UsageExtractor.extract(root),
                JsonParts.textOrNull(message.path("stop_reason"))
            ));
        }
    },

    /** {@code message.content[].text} */
    MESSAGE_CONTENT {
        @Override
        Optional<ChatResponse> tryParse(JsonNode root) {
            JsonNode message = root.path("message");
            if (!message.isObject() || !message.path("content").isArray()) {
                return Optional.empty();
            }
            return Optional.of(new ChatResponse(
                MessageRole.fromWire(message.path("role").asText("assistant")),
                JsonParts.text(message.path("content")),
                JsonParts.functionToolCalls(message.path("tool_calls")),
                UsageExtractor.extract(root),
                JsonParts.textOrNull(root.path("finish_reason"))
            ));
        }
    },

    /** {@code content[].{type,text}} with a {@code stop_reason} field */
    CONTENT_BLOCKS {
        @Override
        Optional<ChatResponse> tryParse(JsonNode root) {
            JsonNode content = root.path("content");
            if (!content.isArray() || !root.has("stop_reason")) {
                return Optional.empty();
            }
            StringBuilder text = new StringBuilder();
            List<ToolCall> toolCalls = new ArrayList<>();
            for (JsonNode block : content) {
                String type = block.path("type").asText("");
                if ("text".equals(type)) {
                    text.append(block.path("text").asText(""));
                } else if ("tool_use".equals(type)) {
                    toolCalls.add(new ToolCall(
                        block.path("id").asText(""),
                        block.path("name").asText(""),
                        JsonParts.arguments(block.path("input"))
                    ));
                }
            }
            return Optional.of(new ChatResponse(
                MessageRole.fromWire(root.path("role").asText("assistant")),
                text.toString(),
                toolCalls,
                UsageExtractor.extract(root),
                JsonParts.textOrNull(root.path("stop_reason"))
            ));
        }
    };

    abstract Optional<ChatResponse> tryParse(JsonNode root);
}
