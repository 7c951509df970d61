package io.llmc.core.gateway;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmc.core.error.GatewayException;
import io.llmc.core.model.ChatMessage;
import io.llmc.core.model.ChatRequest;
import io.llmc.core.model.ContentPart;
import io.llmc.core.model.MessageRole;
import io.llmc.core.model.ToolCall;
import io.llmc.core.model.ToolDefinition;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads an inbound OpenAI chat-completion request body into the canonical request.
 */
final class OpenAiRequestReader {
    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    OpenAiRequestReader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    ChatRequest read(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new GatewayException(400, "Request body must be a JSON object");
        }
        JsonNode messagesNode = body.path("messages");
        if (!messagesNode.isArray()) {
            throw new GatewayException(400, "Field 'messages' must be an array");
        }
        List<ChatMessage> messages = new ArrayList<>();
        for (JsonNode item : messagesNode) {
            messages.add(message(item));
        }
        Integer maxTokens = null;
        if (body.path("max_tokens").canConvertToInt()) {
            maxTokens = body.path("max_tokens").intValue();
        } else if (body.path("max_completion_tokens").canConvertToInt()) {
            maxTokens = body.path("max_completion_tokens").intValue();
        }
        Double temperature = body.path("temperature").isNumber() ? body.path("temperature").doubleValue() : null;
        return new ChatRequest(
            body.path("model").asText(""),
            messages,
            maxTokens,
            temperature,
            tools(body.path("tools")),
            body.path("stream").asBoolean(false)
        );
    }

    private ChatMessage message(JsonNode item) {
        MessageRole role = MessageRole.fromWire(item.path("role").asText("user"));
        JsonNode content = item.path("content");
        String text = "";
        List<ContentPart> parts = List.of();
        if (content.isTextual()) {
            text = content.asText();
        } else if (content.isArray()) {
            parts = parts(content);
        }
        String toolCallId = item.path("tool_call_id").isTextual() ? item.path("tool_call_id").asText() : null;
        return new ChatMessage(role, text, parts, toolCallId, toolCalls(item.path("tool_calls")));
    }

    private List<ContentPart> parts(JsonNode content) {
        List<ContentPart> parts = new ArrayList<>();
        for (JsonNode part : content) {
            if (part.isTextual()) {
                parts.add(ContentPart.text(part.asText()));
                continue;
            }
            String type = part.path("type").asText(ContentPart.TEXT);
            switch (type) {
                case ContentPart.IMAGE_URL -> {
                    JsonNode image = part.path("image_url");
                    String url = image.isTextual() ? image.asText() : image.path("url").asText("");
                    if (!url.isBlank()) {
                        parts.add(ContentPart.imageUrl(url));
                    }
                }
                case ContentPart.INPUT_AUDIO -> {
                    JsonNode audio = part.path("input_audio");
                    String data = audio.path("data").asText("");
                    if (!data.isBlank()) {
                        parts.add(ContentPart.inputAudio(data, audio.path("format").asText("wav")));
                    }
                }
                default -> parts.add(ContentPart.text(part.path("text").asText("")));
            }
        }
        return parts;
    }

    private List<ToolCall> toolCalls(JsonNode node) {
        if (!node.isArray()) {
            return List.of();
        }
        List<ToolCall> calls = new ArrayList<>();
        for (JsonNode item : node) {
            JsonNode function = item.path("function");
            String name = function.path("name").asText("");
            if (name.isBlank()) {
                continue;
            }
            calls.add(new ToolCall(item.path("id").asText(""), name, arguments(function.path("arguments"))));
        }
        return calls;
    }

    private Map<String, Object> arguments(JsonNode node) {
        try {
            if (node.isTextual()) {
                String raw = node.asText();
                return raw.isBlank() ? Map.of() : mapper.readValue(raw, OBJECT);
            }
            if (node.isObject()) {
                return mapper.convertValue(node, OBJECT);
            }
            return Map.of();
        } catch (IOException e) {
            throw new GatewayException(400, "Tool call arguments are not valid JSON: " + e.getMessage());
        }
    }

    private List<ToolDefinition> tools(JsonNode node) {
        if (!node.isArray()) {
            return List.of();
        }
        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode item : node) {
            JsonNode function = item.has("function") ? item.path("function") : item;
            String name = function.path("name").asText("");
            if (name.isBlank()) {
                continue;
            }
            Map<String, Object> parameters = function.path("parameters").isObject()
                ? mapper.convertValue(function.path("parameters"), OBJECT)
                : null;
            tools.add(new ToolDefinition(name, function.path("description").asText(""), parameters));
        }
        return tools;
    }
}
