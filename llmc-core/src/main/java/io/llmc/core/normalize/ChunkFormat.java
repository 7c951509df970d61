package io.llmc.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import io.llmc.core.model.ChatChunk;
import io.llmc.core.model.ChatResponse;
import io.llmc.core.model.MessageRole;
import io.llmc.core.model.ToolCall;
import io.llmc.core.model.ToolCallDelta;
import io.llmc.core.model.Usage;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Known streaming frame shapes, in detection order.
 */
enum ChunkFormat {
    OPENAI_DELTA {
        @Override
        Optional<FrameResult> tryParse(JsonNode event, ResponseNormalizer normalizer) {
            JsonNode choices = event.path("choices");
            if (!choices.isArray()) {
                return Optional.empty();
            }
            Usage usage = UsageExtractor.extract(event);
            if (choices.isEmpty()) {
                return usage == null ? Optional.empty() : Optional.of(FrameResult.of(ChatChunk.finish(null, usage)));
            }
            JsonNode choice = choices.path(0);
            JsonNode delta = choice.path("delta");
            if (!delta.isObject() && !choice.has("finish_reason")) {
                return Optional.empty();
            }
            List<ToolCallDelta> toolCalls = new ArrayList<>();
            for (JsonNode call : delta.path("tool_calls")) {
                JsonNode function = call.path("function");
                toolCalls.add(new ToolCallDelta(
                    call.path("index").asInt(toolCalls.size()),
                    JsonParts.textOrNull(call.path("id")),
                    JsonParts.textOrNull(function.path("name")),
                    JsonParts.argumentsJson(function.path("arguments"))
                ));
            }
            String role = delta.path("role").asText("");
            return Optional.of(FrameResult.of(new ChatChunk(
                role.isEmpty() ? null : MessageRole.fromWire(role),
                JsonParts.text(delta.path("content")),
                toolCalls,
                usage,
                JsonParts.textOrNull(choice.path("finish_reason"))
            )));
        }
    },

    ANTHROPIC_EVENT {
        private final Set<String> types = Set.of(
            "message_start", "content_block_start", "content_block_delta", "content_block_stop",
            "message_delta", "message_stop", "ping"
        );

        @Override
        Optional<FrameResult> tryParse(JsonNode event, ResponseNormalizer normalizer) {
            String type = event.path("type").asText("");
            if (!types.contains(type)) {
                return Optional.empty();
            }
            return Optional.of(switch (type) {
                case "message_start" -> {
                    JsonNode message = event.path("message");
                    Usage usage = UsageExtractor.fromUsageObject(message.path("usage"));
                    yield FrameResult.of(new ChatChunk(MessageRole.ASSISTANT, "", List.of(), usage, null));
                }
                case "content_block_start" -> {
                    JsonNode block = event.path("content_block");
                    if ("tool_use".equals(block.path("type").asText())) {
                        ToolCallDelta start = new ToolCallDelta(
                            event.path("index").asInt(),
                            block.path("id").asText(""),
                            block.path("name").asText(""),
                            ""
                        );
                        yield FrameResult.of(new ChatChunk(null, "", List.of(start), null, null));
                    }
                    yield FrameResult.of(ChatChunk.text(block.path("text").asText("")));
                }
                case "content_block_delta" -> {
                    JsonNode delta = event.path("delta");
                    if ("input_json_delta".equals(delta.path("type").asText())) {
                        ToolCallDelta fragment = new ToolCallDelta(
                            event.path("index").asInt(), null, null, delta.path("partial_json").asText(""));
                        yield FrameResult.of(new ChatChunk(null, "", List.of(fragment), null, null));
                    }
                    yield FrameResult.of(ChatChunk.text(delta.path("text").asText("")));
                }
                case "message_delta" -> FrameResult.of(ChatChunk.finish(
                    JsonParts.textOrNull(event.path("delta").path("stop_reason")),
                    UsageExtractor.fromUsageObject(event.path("usage"))
                ));
                case "message_stop" -> FrameResult.END;
                default -> FrameResult.SKIP;
            });
        }
    },

    COHERE_EVENT {
        private final Set<String> types = Set.of(
            "message-start", "content-start", "content-delta", "content-end",
            "tool-plan-delta", "tool-call-start", "tool-call-delta", "tool-call-end", "message-end"
        );

        @Override
        Optional<FrameResult> tryParse(JsonNode event, ResponseNormalizer normalizer) {
            String type = event.path("type").asText("");
            if (!types.contains(type)) {
                return Optional.empty();
            }
            JsonNode message = event.path("delta").path("message");
            return Optional.of(switch (type) {
                case "message-start" -> FrameResult.of(new ChatChunk(MessageRole.ASSISTANT, "", List.of(), null, null));
                case "content-delta" -> FrameResult.of(ChatChunk.text(JsonParts.text(message.path("content"))));
                case "tool-call-start", "tool-call-delta" -> {
                    JsonNode call = message.path("tool_calls");
                    JsonNode function = call.path("function");
                    ToolCallDelta delta = new ToolCallDelta(
                        event.path("index").asInt(),
                        JsonParts.textOrNull(call.path("id")),
                        JsonParts.textOrNull(function.path("name")),
                        JsonParts.argumentsJson(function.path("arguments"))
                    );
                    yield FrameResult.of(new ChatChunk(null, "", List.of(delta), null, null));
                }
                case "message-end" -> {
                    JsonNode delta = event.path("delta");
                    ChatChunk last = ChatChunk.finish(
                        JsonParts.textOrNull(delta.path("finish_reason")),
                        UsageExtractor.fromUsageObject(delta.path("usage"))
                    );
                    yield new FrameResult(last, true);
                }
                default -> FrameResult.SKIP;
            });
        }
    },

    LLAMA_EVENT {
        @Override
        Optional<FrameResult> tryParse(JsonNode event, ResponseNormalizer normalizer) {
            JsonNode inner = event.path("event");
            if (!inner.isObject() || !inner.has("event_type")) {
                return Optional.empty();
            }
            String eventType = inner.path("event_type").asText("");
            Usage usage = UsageExtractor.fromMetrics(inner.path("metrics"));
            JsonNode delta = inner.path("delta");
            String text = "text".equals(delta.path("type").asText("text")) ? delta.path("text").asText("") : "";
            String finish = "complete".equals(eventType)
                ? Optional.ofNullable(JsonParts.textOrNull(inner.path("stop_reason"))).orElse("stop")
                : null;
            return Optional.of(FrameResult.of(new ChatChunk(null, text, List.of(), usage, finish)));
        }
    },

    RESPONSE_TEXT {
        @Override
        Optional<FrameResult> tryParse(JsonNode event, ResponseNormalizer normalizer) {
            JsonNode response = event.path("response");
            if (!response.isTextual()) {
                return Optional.empty();
            }
            boolean done = event.path("done").asBoolean(false);
            Usage usage = null;
            if (event.has("prompt_eval_count") || event.has("eval_count")) {
                usage = Usage.of(event.path("prompt_eval_count").asLong(), event.path("eval_count").asLong());
            }
            return Optional.of(FrameResult.of(new ChatChunk(null, response.asText(), List.of(), usage, done ? "stop" : null)));
        }
    },

    FULL_RESPONSE {
        @Override
        Optional<FrameResult> tryParse(JsonNode event, ResponseNormalizer normalizer) {
            return normalizer.tryParse(event).map(response -> FrameResult.of(fromResponse(response)));
        }
    };

    abstract Optional<FrameResult> tryParse(JsonNode event, ResponseNormalizer normalizer);

    static Optional<FrameResult> decode(JsonNode event, ResponseNormalizer normalizer) {
        if (event == null || !event.isObject()) {
            return Optional.empty();
        }
        for (ChunkFormat format : values()) {
            Optional<FrameResult> result = format.tryParse(event, normalizer);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    static ChatChunk fromResponse(ChatResponse response) {
        List<ToolCallDelta> toolCalls = new ArrayList<>();
        for (int i = 0; i < response.toolCalls().size(); i++) {
            ToolCall call = response.toolCalls().get(i);
            toolCalls.add(new ToolCallDelta(i, call.id(), call.name(), JsonParts.toJson(call.arguments())));
        }
        String finish = response.finishReason() == null ? "stop" : response.finishReason();
        return new ChatChunk(response.role(), response.content(), toolCalls, response.usage(), finish);
    }
}
