package io.llmc.core.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmc.core.error.GatewayException;
import io.llmc.core.model.ChatChunk;
import io.llmc.core.model.ChatMessage;
import io.llmc.core.model.ChatRequest;
import io.llmc.core.model.ChatResponse;
import io.llmc.core.model.ContentPart;
import io.llmc.core.model.MessageRole;
import io.llmc.core.model.ToolCall;
import io.llmc.core.model.ToolCallDelta;
import io.llmc.core.model.Usage;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OpenAiWireFormatTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private final OpenAiRequestReader reader = new OpenAiRequestReader(mapper);
    private final OpenAiResponseWriter writer = new OpenAiResponseWriter(mapper);

    @Test
    void shouldReadFullChatRequest() throws Exception {
        ChatRequest request = reader.read(mapper.readTree("""
            {"model":"openai:gpt-4o","stream":true,"max_completion_tokens":64,"temperature":0.2,
             "messages":[
               {"role":"system","content":"be brief"},
               {"role":"user","content":[{"type":"text","text":"what is this"},
                                         {"type":"image_url","image_url":{"url":"https://img/cat.png"}}]},
               {"role":"assistant","content":null,
                "tool_calls":[{"id":"call_1","type":"function",
                               "function":{"name":"lookup","arguments":"{\\"q\\":\\"cat\\"}"}}]},
               {"role":"tool","tool_call_id":"call_1","content":"a cat"}],
             "tools":[{"type":"function","function":{"name":"lookup","description":"Search",
                        "parameters":{"type":"object"}}}]}
            """));

        assertThat(request.model()).isEqualTo("openai:gpt-4o");
        assertThat(request.stream()).isTrue();
        assertThat(request.maxTokens()).isEqualTo(64);
        assertThat(request.temperature()).isEqualTo(0.2);
        assertThat(request.messages()).extracting(ChatMessage::role)
            .containsExactly(MessageRole.SYSTEM, MessageRole.USER, MessageRole.ASSISTANT, MessageRole.TOOL);
        assertThat(request.messages().get(1).parts()).containsExactly(
            ContentPart.text("what is this"), ContentPart.imageUrl("https://img/cat.png"));
        ToolCall call = request.messages().get(2).toolCalls().get(0);
        assertThat(call.id()).isEqualTo("call_1");
        assertThat(call.arguments()).containsEntry("q", "cat");
        assertThat(request.messages().get(3).toolCallId()).isEqualTo("call_1");
        assertThat(request.tools()).singleElement().satisfies(tool -> {
            assertThat(tool.name()).isEqualTo("lookup");
            assertThat(tool.parameters()).containsEntry("type", "object");
        });
    }

    @Test
    void shouldRejectMalformedRequests() throws Exception {
        assertThatThrownBy(() -> reader.read(mapper.readTree("[1,2]")))
            .isInstanceOf(GatewayException.class)
            .satisfies(error -> assertThat(((GatewayException) error).status()).isEqualTo(400));
        assertThatThrownBy(() -> reader.read(mapper.readTree("{\"model\":\"x\"}")))
            .hasMessageContaining("'messages' must be an array");
        assertThatThrownBy(() -> reader.read(mapper.readTree("""
            {"messages":[{"role":"assistant","tool_calls":[{"id":"c","function":{"name":"f","arguments":"{oops"}}]}]}
            """)))
            .hasMessageContaining("Tool call arguments are not valid JSON");
    }

    @Test
    void shouldWriteCompletionWithToolCalls() {
        ChatResponse response = new ChatResponse(MessageRole.ASSISTANT, "",
            List.of(new ToolCall("call_9", "weather", Map.of("city", "Paris"))), Usage.of(5, 3), "tool_use");

        Map<String, Object> payload = writer.completion("chatcmpl-1", 1700000000L, "anthropic:claude", response);
        JsonNode json = mapper.valueToTree(payload);

        assertThat(json.path("object").asText()).isEqualTo("chat.completion");
        assertThat(json.path("created").asLong()).isEqualTo(1700000000L);
        JsonNode choice = json.path("choices").path(0);
        assertThat(choice.path("finish_reason").asText()).isEqualTo("tool_calls");
        JsonNode toolCall = choice.path("message").path("tool_calls").path(0);
        assertThat(toolCall.path("type").asText()).isEqualTo("function");
        assertThat(toolCall.path("function").path("arguments").asText()).isEqualTo("{\"city\":\"Paris\"}");
        assertThat(json.path("usage").path("total_tokens").asLong()).isEqualTo(8);
    }

    @Test
    void shouldWriteDeltaAndFinishChunks() {
        ChatChunk chunk = new ChatChunk(null, "", List.of(new ToolCallDelta(0, "call_1", "lookup", "{\"q\"")), null, null);

        JsonNode delta = mapper.valueToTree(writer.deltaChunk("chatcmpl-2", 1L, "m", chunk, true));
        JsonNode finish = mapper.valueToTree(writer.finishChunk("chatcmpl-2", 1L, "m", null, true, null, false));

        assertThat(delta.path("choices").path(0).path("delta").path("role").asText()).isEqualTo("assistant");
        assertThat(delta.path("choices").path(0).path("finish_reason").isNull()).isTrue();
        JsonNode toolDelta = delta.path("choices").path(0).path("delta").path("tool_calls").path(0);
        assertThat(toolDelta.path("index").asInt()).isZero();
        assertThat(toolDelta.path("function").path("arguments").asText()).isEqualTo("{\"q\"");
        assertThat(finish.path("choices").path(0).path("finish_reason").asText()).isEqualTo("tool_calls");
        assertThat(finish.path("usage").path("prompt_tokens").asLong()).isZero();
        String frame = new String(writer.sseFrame(Map.of("a", 1)), StandardCharsets.UTF_8);
        assertThat(frame).isEqualTo("data: {\"a\":1}\n\n");
    }

    @Test
    void shouldMapFinishReasonsToOpenAiVocabulary() {
        assertThat(OpenAiResponseWriter.finishReason("end_turn", false)).isEqualTo("stop");
        assertThat(OpenAiResponseWriter.finishReason("COMPLETE", false)).isEqualTo("stop");
        assertThat(OpenAiResponseWriter.finishReason("MAX_TOKENS", false)).isEqualTo("length");
        assertThat(OpenAiResponseWriter.finishReason("SAFETY", false)).isEqualTo("content_filter");
        assertThat(OpenAiResponseWriter.finishReason(null, true)).isEqualTo("tool_calls");
        assertThat(OpenAiResponseWriter.finishReason("", false)).isEqualTo("stop");
        assertThat(OpenAiResponseWriter.finishReason("recitation", false)).isEqualTo("recitation");
    }

    @Test
    void shouldMapErrorsToStatusAndType() {
        Map<String, Object> body = GatewayErrors.body(new GatewayException(400, "bad"), 400);
        assertThat(GatewayErrors.status(new GatewayException(404, "missing"))).isEqualTo(404);
        assertThat(GatewayErrors.status(new IllegalStateException("boom"))).isEqualTo(500);
        assertThat(mapper.valueToTree(body).path("error").path("type").asText()).isEqualTo("invalid_request_error");
    }
}
