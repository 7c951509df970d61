package io.llmc.core.normalize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.llmc.core.error.UpstreamFormatException;
import io.llmc.core.model.ChatResponse;
import io.llmc.core.model.MessageRole;
import io.llmc.core.model.Usage;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ResponseNormalizerTest {
    private final ResponseNormalizer normalizer = new ResponseNormalizer();

    @Test
    void shouldParseOpenAiChoices() {
        byte[] body = bytes("""
            {"id":"x","choices":[{"index":0,"message":{"role":"assistant","content":"Hello",
              "tool_calls":[{"id":"call_9","type":"function","function":{"name":"lookup","arguments":"{\\"q\\":\\"x\\"}"}}]},
              "finish_reason":"tool_calls"}],
             "usage":{"prompt_tokens":5,"completion_tokens":7,"total_tokens":12}}
            """);

        ChatResponse response = normalizer.parse(body, "openai");

        assertThat(normalizer.detect(body, "openai")).isEqualTo(ResponseFormat.OPENAI_CHOICES);
        assertThat(response.role()).isEqualTo(MessageRole.ASSISTANT);
        assertThat(response.content()).isEqualTo("Hello");
        assertThat(response.toolCalls()).singleElement().satisfies(call -> {
            assertThat(call.id()).isEqualTo("call_9");
            assertThat(call.name()).isEqualTo("lookup");
            assertThat(call.arguments()).containsEntry("q", "x");
        });
        assertThat(response.usage()).isEqualTo(new Usage(5, 7, 12));
        assertThat(response.finishReason()).isEqualTo("tool_calls");
    }

    @Test
    void shouldParseCompletionMessage() {
        byte[] body = bytes("""
            {"completion_message":{"role":"assistant","content":{"type":"text","text":"Hi from llama"},
              "stop_reason":"stop"},
             "metrics":[{"metric":"num_prompt_tokens","value":3},{"metric":"num_completion_tokens","value":4}]}
            """);

        ChatResponse response = normalizer.parse(body, "llama");

        assertThat(normalizer.detect(body, "llama")).isEqualTo(ResponseFormat.COMPLETION_MESSAGE);
        assertThat(response.content()).isEqualTo("Hi from llama");
        assertThat(response.usage()).isEqualTo(new Usage(3, 4, 7));
        assertThat(response.finishReason()).isEqualTo("stop");
    }

    @Test
    void shouldParseMessageContentArray() {
        byte[] body = bytes("""
            {"id":"c1","message":{"role":"assistant","content":[{"type":"text","text":"Hello "},{"type":"text","text":"there"}]},
             "finish_reason":"COMPLETE","usage":{"billed_units":{"input_tokens":2,"output_tokens":3}}}
            """);

        ChatResponse response = normalizer.parse(body, "cohere");

        assertThat(normalizer.detect(body, "cohere")).isEqualTo(ResponseFormat.MESSAGE_CONTENT);
        assertThat(response.content()).isEqualTo("Hello there");
        assertThat(response.usage()).isEqualTo(new Usage(2, 3, 5));
        assertThat(response.finishReason()).isEqualTo("COMPLETE");
    }

    @Test
    void shouldParseContentBlocksWithToolUse() {
        byte[] body = bytes("""
            {"id":"msg_1","type":"message","role":"assistant",
             "content":[{"type":"text","text":"Checking."},{"type":"tool_use","id":"tu_1","name":"weather","input":{"city":"Paris"}}],
             "stop_reason":"tool_use","usage":{"input_tokens":10,"output_tokens":20}}
            """);

        ChatResponse response = normalizer.parse(body, "anthropic");

        assertThat(normalizer.detect(body, "anthropic")).isEqualTo(ResponseFormat.CONTENT_BLOCKS);
        assertThat(response.content()).isEqualTo("Checking.");
        assertThat(response.toolCalls()).singleElement().satisfies(call -> {
            assertThat(call.id()).isEqualTo("tu_1");
            assertThat(call.arguments()).containsEntry("city", "Paris");
        });
        assertThat(response.usage()).isEqualTo(new Usage(10, 20, 30));
        assertThat(response.finishReason()).isEqualTo("tool_use");
    }

    @Test
    void shouldDetectSameFormatOnRepeatedCalls() {
        byte[] body = bytes("{\"choices\":[{\"message\":{\"content\":\"x\"}}]}");

        assertThat(normalizer.detect(body, "p")).isEqualTo(normalizer.detect(body, "p"));
        assertThat(normalizer.parse(body, "p")).isEqualTo(normalizer.parse(body, "p"));
    }

    @Test
    void shouldLeaveUsageNullWhenAbsent() {
        ChatResponse response = normalizer.parse(bytes("{\"choices\":[{\"message\":{\"content\":\"x\"}}]}"), "p");

        assertThat(response.usage()).isNull();
        assertThat(response.finishReason()).isNull();
    }

    @Test
    void shouldRejectUnknownShapeWithRawBody() {
        assertThatThrownBy(() -> normalizer.parse(bytes("{\"result\":\"x\"}"), "odd"))
            .isInstanceOf(UpstreamFormatException.class)
            .satisfies(error -> {
                UpstreamFormatException upstream = (UpstreamFormatException) error;
                assertThat(upstream.provider()).isEqualTo("odd");
                assertThat(upstream.upstreamBody()).isEqualTo("{\"result\":\"x\"}");
            });
        assertThatThrownBy(() -> normalizer.parse(bytes("not json"), "odd"))
            .isInstanceOf(UpstreamFormatException.class)
            .hasMessageContaining("not valid JSON");
        assertThatThrownBy(() -> normalizer.parse(bytes("{\"content\":[],\"role\":\"assistant\"}"), "odd"))
            .isInstanceOf(UpstreamFormatException.class);
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
