package io.llmc.core.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmc.core.model.ToolCall;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class JsonParts {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {
    };

    private JsonParts() {
    }

    /** Text of a string node, or the concatenated {@code text} of a parts array. */
    static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            StringBuilder builder = new StringBuilder();
            for (JsonNode part : node) {
                if (part.isTextual()) {
                    builder.append(part.asText());
                } else if (part.path("text").isTextual()
                    && ("text".equals(part.path("type").asText("text")) || !part.has("type"))) {
                    builder.append(part.path("text").asText());
                }
            }
            return builder.toString();
        }
        if (node.isObject() && node.path("text").isTextual()) {
            return node.path("text").asText();
        }
        return "";
    }

    /** OpenAI-style {@code [{id, function: {name, arguments}}]}. */
    static List<ToolCall> functionToolCalls(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<ToolCall> toolCalls = new ArrayList<>();
        int index = 0;
        for (JsonNode item : node) {
            JsonNode function = item.path("function");
            String name = function.path("name").asText("");
            if (!name.isBlank()) {
                String id = item.path("id").asText("");
                toolCalls.add(new ToolCall(id.isBlank() ? "call_" + index : id, name, arguments(function.path("arguments"))));
            }
            index++;
        }
        return toolCalls;
    }

    static Map<String, Object> arguments(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Map.of();
        }
        try {
            if (node.isTextual()) {
                String raw = node.asText();
                return raw.isBlank() ? Map.of() : MAPPER.readValue(raw, OBJECT);
            }
            if (node.isObject()) {
                return MAPPER.convertValue(node, OBJECT);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return Map.of("_raw", node.asText());
        }
        return Map.of();
    }

    static String argumentsJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        return node.isTextual() ? node.asText() : node.toString();
    }

    static String toJson(Map<String, Object> arguments) {
        try {
            return MAPPER.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Tool call arguments are not serializable", e);
        }
    }

    static String textOrNull(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node.asText();
    }
}
