package io.llmc.core.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmc.core.error.UpstreamFormatException;
import io.llmc.core.model.ChatChunk;
import io.llmc.core.model.ChatResponse;
import io.llmc.core.model.ToolCall;
import io.llmc.core.model.ToolCallDelta;
import io.llmc.core.model.Usage;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Re-serializes canonical responses and chunks in OpenAI chat-completion shape, whatever the upstream format was.
 */
final class OpenAiResponseWriter {
    private final ObjectMapper mapper;

    OpenAiResponseWriter(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    Map<String, Object> completion(String id, long created, String model, ChatResponse response) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", "assistant");
        message.put("content", response.content());
        if (response.hasToolCalls()) {
            message.put("tool_calls", toolCalls(response.toolCalls()));
        }
        Map<String, Object> choice = new LinkedHashMap<>();
        choice.put("index", 0);
        choice.put("message", message);
        choice.put("finish_reason", finishReason(response.finishReason(), response.hasToolCalls()));

        Map<String, Object> payload = envelope(id, "chat.completion", created, model);
        payload.put("choices", List.of(choice));
        payload.put("usage", usage(response.usage()));
        return payload;
    }

    Map<String, Object> deltaChunk(String id, long created, String model, ChatChunk chunk, boolean includeRole) {
        Map<String, Object> delta = new LinkedHashMap<>();
        if (includeRole) {
            delta.put("role", "assistant");
        }
        if (!chunk.content().isEmpty()) {
            delta.put("content", chunk.content());
        }
        if (!chunk.toolCalls().isEmpty()) {
            delta.put("tool_calls", toolCallDeltas(chunk.toolCalls()));
        }
        Map<String, Object> choice = new LinkedHashMap<>();
        choice.put("index", 0);
        choice.put("delta", delta);
        choice.put("finish_reason", null);

        Map<String, Object> payload = envelope(id, "chat.completion.chunk", created, model);
        payload.put("choices", List.of(choice));
        return payload;
    }

    Map<String, Object> finishChunk(
        String id,
        long created,
        String model,
        String finishReason,
        boolean sawToolCalls,
        Usage usage,
        boolean includeRole
    ) {
        Map<String, Object> delta = new LinkedHashMap<>();
        if (includeRole) {
            delta.put("role", "assistant");
        }
        Map<String, Object> choice = new LinkedHashMap<>();
        choice.put("index", 0);
        choice.put("delta", delta);
        choice.put("finish_reason", finishReason(finishReason, sawToolCalls));

        Map<String, Object> payload = envelope(id, "chat.completion.chunk", created, model);
        payload.put("choices", List.of(choice));
        payload.put("usage", usage(usage));
        return payload;
    }

    byte[] sseFrame(Map<String, ?> payload) {
        return ("data: " + json(payload) + "\n\n").getBytes(StandardCharsets.UTF_8);
    }

    /** Maps provider-specific stop reasons onto OpenAI's vocabulary. */
    static String finishReason(String raw, boolean toolCalls) {
        if (raw == null || raw.isBlank()) {
            return toolCalls ? "tool_calls" : "stop";
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "stop", "end_turn", "stop_sequence", "complete", "eos", "end" -> "stop";
            case "length", "max_tokens", "max_output_tokens" -> "length";
            case "tool_calls", "tool_use", "tool_call", "function_call" -> "tool_calls";
            case "content_filter", "safety", "error_toxic" -> "content_filter";
            default -> raw;
        };
    }

    private Map<String, Object> envelope(String id, String object, long created, String model) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", id);
        payload.put("object", object);
        payload.put("created", created);
        payload.put("model", model);
        return payload;
    }

    private Map<String, Object> usage(Usage usage) {
        Usage effective = usage == null ? Usage.ZERO : usage;
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("prompt_tokens", effective.inputTokens());
        out.put("completion_tokens", effective.outputTokens());
        out.put("total_tokens", effective.totalTokens());
        return out;
    }

    private List<Map<String, Object>> toolCalls(List<ToolCall> calls) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (ToolCall call : calls) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", call.name());
            function.put("arguments", argumentsJson(call.arguments()));
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", call.id());
            item.put("type", "function");
            item.put("function", function);
            out.add(item);
        }
        return out;
    }

    private List<Map<String, Object>> toolCallDeltas(List<ToolCallDelta> deltas) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (ToolCallDelta delta : deltas) {
            Map<String, Object> function = new LinkedHashMap<>();
            if (delta.name() != null) {
                function.put("name", delta.name());
            }
            function.put("arguments", delta.argumentsFragment());
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("index", delta.index());
            if (delta.id() != null) {
                item.put("id", delta.id());
                item.put("type", "function");
            }
            item.put("function", function);
            out.add(item);
        }
        return out;
    }

    private String argumentsJson(Map<String, Object> arguments) {
        return json(arguments);
    }

    private String json(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UpstreamFormatException("Failed to serialize response", "chat", "", e.getMessage());
        }
    }
}
