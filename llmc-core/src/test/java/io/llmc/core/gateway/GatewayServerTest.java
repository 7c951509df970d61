package io.llmc.core.gateway;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmc.core.auth.AuthCredential;
import io.llmc.core.config.model.LlmcConfig;
import io.llmc.core.config.model.ProviderConfig;
import io.llmc.core.http.TransportSettings;
import io.llmc.core.runtime.LlmcRuntime;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GatewayServerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();
    private MockWebServer upstream;
    private LlmcRuntime runtime;

    @BeforeEach
    void setUp() throws Exception {
        upstream = new MockWebServer();
        upstream.start();
        LlmcConfig config = LlmcConfig.defaults()
            .withProvider(new ProviderConfig("ollama", upstream.url("/ollama/v1").toString(), null, null, null, null,
                null, null, null, null, null, null, null, List.of("llama3:8b", "mistral")))
            .withProvider(ProviderConfig.of("openai", upstream.url("/openai/v1").toString()))
            .withProvider(ProviderConfig.of("cohere", upstream.url("/cohere/v2").toString()).withPath("chat", "/chat"))
            .withAlias("fast", "openai:gpt-4o-mini");
        runtime = LlmcRuntime.create(config, tempDir.resolve("config.json"), TransportSettings.defaults()
            .withMaxAttempts(1)
            .withIdleTimeout(Duration.ofSeconds(5)));
        runtime.credentials().put("openai", new AuthCredential.ApiKeyBearer("sk-upstream"));
    }

    @AfterEach
    void tearDown() throws Exception {
        runtime.close();
        upstream.shutdown();
    }

    @Test
    void shouldRouteFilteredModelToFilterProvider() throws Exception {
        upstream.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("""
            {"choices":[{"message":{"role":"assistant","content":"pong"},"finish_reason":"stop"}],
             "usage":{"prompt_tokens":2,"completion_tokens":1,"total_tokens":3}}
            """));

        try (GatewayServer server = gateway(new GatewayFilter("ollama", "llama3:8b", null))) {
            HttpResponse<String> response = post(server, "/v1/chat/completions",
                "{\"model\":\"llama3:8b\",\"messages\":[{\"role\":\"user\",\"content\":\"ping\"}]}", null);

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.path("object").asText()).isEqualTo("chat.completion");
            assertThat(body.path("id").asText()).startsWith("chatcmpl-");
            assertThat(body.path("model").asText()).isEqualTo("llama3:8b");
            assertThat(body.path("choices").path(0).path("message").path("content").asText()).isEqualTo("pong");
            assertThat(body.path("usage").path("total_tokens").asLong()).isEqualTo(3);

            RecordedRequest forwarded = upstream.takeRequest();
            assertThat(forwarded.getPath()).isEqualTo("/ollama/v1/chat/completions");
            assertThat(mapper.readTree(forwarded.getBody().readUtf8()).path("model").asText()).isEqualTo("llama3:8b");
        }
    }

    @Test
    void shouldAnswerInOpenAiShapeForCohereUpstream() throws Exception {
        upstream.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("""
            {"id":"c-1","message":{"role":"assistant","content":[{"type":"text","text":"hi"}]},
             "finish_reason":"COMPLETE","usage":{"billed_units":{"input_tokens":3,"output_tokens":1}}}
            """));

        try (GatewayServer server = gateway(GatewayFilter.NONE)) {
            HttpResponse<String> response = post(server, "/chat/completions",
                "{\"model\":\"cohere:command-r\",\"messages\":[{\"role\":\"user\",\"content\":\"hello\"}]}", null);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                value -> assertThat(value).startsWith("application/json"));
            JsonNode body = mapper.readTree(response.body());
            JsonNode choice = body.path("choices").path(0);
            assertThat(choice.path("message").path("role").asText()).isEqualTo("assistant");
            assertThat(choice.path("message").path("content").asText()).isEqualTo("hi");
            assertThat(choice.path("finish_reason").asText()).isEqualTo("stop");
            assertThat(body.path("model").asText()).isEqualTo("cohere:command-r");
            assertThat(body.path("usage").path("prompt_tokens").asLong()).isEqualTo(3);
            assertThat(body.path("usage").path("completion_tokens").asLong()).isEqualTo(1);
            assertThat(upstream.takeRequest().getPath()).isEqualTo("/cohere/v2/chat");
        }
    }

    @Test
    void shouldStreamOpenAiChunksEndingWithUsageAndDone() throws Exception {
        upstream.enqueue(new MockResponse().setHeader("Content-Type", "text/event-stream").setBody("""
            event: message_start
            data: {"type":"message_start","message":{"role":"assistant","usage":{"input_tokens":7,"output_tokens":1}}}

            data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":"Hel"}}

            data: {"type":"content_block_delta","index":0,"delta":{"type":"text_delta","text":"lo"}}

            data: {"type":"message_delta","delta":{"stop_reason":"end_turn"},"usage":{"output_tokens":2}}

            data: {"type":"message_stop"}

            """));

        try (GatewayServer server = gateway(GatewayFilter.NONE)) {
            HttpResponse<String> response = post(server, "/v1/chat/completions",
                "{\"model\":\"fast\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}", null);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.headers().firstValue("Content-Type")).hasValueSatisfying(
                value -> assertThat(value).startsWith("text/event-stream"));
            List<String> frames = dataFrames(response.body());
            assertThat(frames.get(frames.size() - 1)).isEqualTo("[DONE]");

            JsonNode firstDelta = mapper.readTree(frames.get(0));
            assertThat(firstDelta.path("object").asText()).isEqualTo("chat.completion.chunk");
            assertThat(firstDelta.path("model").asText()).isEqualTo("fast");
            assertThat(firstDelta.path("choices").path(0).path("delta").path("role").asText()).isEqualTo("assistant");
            assertThat(firstDelta.path("choices").path(0).path("delta").path("content").asText()).isEqualTo("Hel");
            JsonNode secondDelta = mapper.readTree(frames.get(1));
            assertThat(secondDelta.path("choices").path(0).path("delta").has("role")).isFalse();

            JsonNode finish = mapper.readTree(frames.get(frames.size() - 2));
            assertThat(finish.path("choices").path(0).path("finish_reason").asText()).isEqualTo("stop");
            assertThat(finish.path("usage").path("prompt_tokens").asLong()).isEqualTo(7);
            assertThat(finish.path("usage").path("completion_tokens").asLong()).isEqualTo(2);
            assertThat(finish.path("id").asText()).isEqualTo(firstDelta.path("id").asText());

            RecordedRequest forwarded = upstream.takeRequest();
            assertThat(forwarded.getPath()).isEqualTo("/openai/v1/chat/completions");
            assertThat(forwarded.getHeader("Authorization")).isEqualTo("Bearer sk-upstream");
            JsonNode sent = mapper.readTree(forwarded.getBody().readUtf8());
            assertThat(sent.path("model").asText()).isEqualTo("gpt-4o-mini");
            assertThat(sent.path("stream").asBoolean()).isTrue();
        }
    }

    @Test
    void shouldAbortUpstreamWhenClientDisconnectsMidStream() throws Exception {
        String frame = "data: {\"choices\":[{\"delta\":{\"content\":\"tick \"}}]}\n\n";
        upstream.enqueue(new MockResponse()
            .setHeader("Content-Type", "text/event-stream")
            .setBody(frame.repeat(200))
            .throttleBody(frame.length(), 100, TimeUnit.MILLISECONDS));
        int capacity = runtime.transport().settings().maxConcurrentPerProvider();

        try (GatewayServer server = gateway(GatewayFilter.NONE)) {
            byte[] body = "{\"model\":\"openai:gpt-4o\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"go\"}]}"
                .getBytes(StandardCharsets.UTF_8);
            try (Socket socket = new Socket("127.0.0.1", server.port())) {
                OutputStream out = socket.getOutputStream();
                out.write(("POST /v1/chat/completions HTTP/1.1\r\n"
                    + "Host: 127.0.0.1\r\n"
                    + "Content-Type: application/json\r\n"
                    + "Content-Length: " + body.length + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII));
                out.write(body);
                out.flush();
                InputStream in = socket.getInputStream();
                StringBuilder received = new StringBuilder();
                byte[] buffer = new byte[1024];
                while (!received.toString().contains("tick")) {
                    int read = in.read(buffer);
                    assertThat(read).isPositive();
                    received.append(new String(buffer, 0, read, StandardCharsets.UTF_8));
                }
                assertThat(runtime.transport().limiter().available("openai")).isEqualTo(capacity - 1);
            }

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (runtime.transport().limiter().available("openai") < capacity && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }
            assertThat(runtime.transport().limiter().available("openai")).isEqualTo(capacity);
        }
    }

    @Test
    void shouldStreamRepeatedlyOverOneKeepAliveConnection() throws Exception {
        String sse = "data: {\"choices\":[{\"delta\":{\"content\":\"ok\"}}]}\n\n"
            + "data: {\"choices\":[{\"delta\":{},\"finish_reason\":\"stop\"}]}\n\n"
            + "data: [DONE]\n\n";
        upstream.enqueue(new MockResponse().setHeader("Content-Type", "text/event-stream").setBody(sse));
        upstream.enqueue(new MockResponse().setHeader("Content-Type", "text/event-stream").setBody(sse));
        int capacity = runtime.transport().settings().maxConcurrentPerProvider();

        try (GatewayServer server = gateway(GatewayFilter.NONE)) {
            byte[] body = "{\"model\":\"openai:gpt-4o\",\"stream\":true,\"messages\":[{\"role\":\"user\",\"content\":\"go\"}]}"
                .getBytes(StandardCharsets.UTF_8);
            try (Socket socket = new Socket("127.0.0.1", server.port())) {
                socket.setSoTimeout(5000);
                OutputStream out = socket.getOutputStream();
                InputStream in = socket.getInputStream();
                for (int round = 0; round < 2; round++) {
                    out.write(("POST /v1/chat/completions HTTP/1.1\r\n"
                        + "Host: 127.0.0.1\r\n"
                        + "Content-Type: application/json\r\n"
                        + "Content-Length: " + body.length + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII));
                    out.write(body);
                    out.flush();
                    String response = readChunkedResponse(in);
                    assertThat(response).startsWith("HTTP/1.1 200").contains("\"content\":\"ok\"").contains("data: [DONE]");
                }
            }
            assertThat(upstream.getRequestCount()).isEqualTo(2);
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (runtime.transport().limiter().available("openai") < capacity && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }
            assertThat(runtime.transport().limiter().available("openai")).isEqualTo(capacity);
        }
    }

    @Test
    void shouldRequireBearerKeyExceptOnHealthz() throws Exception {
        try (GatewayServer server = gateway(new GatewayFilter(null, null, "sk-gateway"))) {
            HttpResponse<String> health = get(server, "/healthz", null);
            assertThat(health.statusCode()).isEqualTo(200);
            assertThat(mapper.readTree(health.body()).path("status").asText()).isEqualTo("ok");

            HttpResponse<String> missing = get(server, "/v1/models", null);
            assertThat(missing.statusCode()).isEqualTo(401);
            JsonNode error = mapper.readTree(missing.body()).path("error");
            assertThat(error.path("type").asText()).isEqualTo("authentication_error");
            assertThat(error.path("message").asText()).isEqualTo("Invalid or missing API key");

            assertThat(get(server, "/v1/models", "sk-wrong").statusCode()).isEqualTo(401);
            assertThat(post(server, "/v1/chat/completions", "{}", "sk-wrong").statusCode()).isEqualTo(401);
            assertThat(get(server, "/v1/models?provider=ollama", "sk-gateway").statusCode()).isEqualTo(200);
        }
        assertThat(upstream.getRequestCount()).isZero();
    }

    @Test
    void shouldListModelsWithQualifiedIds() throws Exception {
        upstream.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                if ("/openai/v1/models".equals(request.getPath())) {
                    return new MockResponse().setBody(
                        "{\"data\":[{\"id\":\"gpt-4o\",\"created\":1700000000,\"owned_by\":\"openai-org\"}]}");
                }
                return new MockResponse().setResponseCode(500).setBody("down");
            }
        });

        try (GatewayServer server = gateway(GatewayFilter.NONE)) {
            HttpResponse<String> response = get(server, "/models", null);

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = mapper.readTree(response.body());
            assertThat(body.path("object").asText()).isEqualTo("list");
            Map<String, JsonNode> byId = new LinkedHashMap<>();
            body.path("data").forEach(item -> byId.put(item.path("id").asText(), item));
            assertThat(byId).containsOnlyKeys("ollama:llama3:8b", "ollama:mistral", "openai:gpt-4o");
            JsonNode ollama = byId.get("ollama:llama3:8b");
            assertThat(ollama.path("object").asText()).isEqualTo("model");
            assertThat(ollama.path("owned_by").asText()).isEqualTo("ollama");
            assertThat(ollama.path("created").asLong()).isPositive();
            JsonNode gpt = byId.get("openai:gpt-4o");
            assertThat(gpt.path("created").asLong()).isEqualTo(1700000000L);
            assertThat(gpt.path("owned_by").asText()).isEqualTo("openai-org");
        }
    }

    @Test
    void shouldListBareIdsUnderProviderFilter() throws Exception {
        try (GatewayServer server = gateway(new GatewayFilter("ollama", "llama3:8b", null))) {
            HttpResponse<String> response = get(server, "/v1/models", null);

            JsonNode data = mapper.readTree(response.body()).path("data");
            assertThat(data).hasSize(1);
            assertThat(data.path(0).path("id").asText()).isEqualTo("llama3:8b");

            HttpResponse<String> mismatch = get(server, "/v1/models?provider=openai", null);
            assertThat(mismatch.statusCode()).isEqualTo(400);
            assertThat(mismatch.body()).contains("filter mismatch");
        }
        assertThat(upstream.getRequestCount()).isZero();
    }

    @Test
    void shouldRejectAmbiguousAndInvalidRequests() throws Exception {
        try (GatewayServer server = gateway(GatewayFilter.NONE)) {
            HttpResponse<String> ambiguous = post(server, "/v1/chat/completions",
                "{\"model\":\"gpt-4o\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}", null);
            assertThat(ambiguous.statusCode()).isEqualTo(400);
            JsonNode error = mapper.readTree(ambiguous.body()).path("error");
            assertThat(error.path("type").asText()).isEqualTo("invalid_request_error");
            assertThat(error.path("message").asText()).contains("ambiguous model");

            assertThat(post(server, "/v1/chat/completions", "{not json", null).statusCode()).isEqualTo(400);
            assertThat(post(server, "/v1/chat/completions", "{\"model\":\"openai:gpt-4o\",\"messages\":[]}", null)
                .statusCode()).isEqualTo(400);
            assertThat(get(server, "/v1/chat/completions", null).statusCode()).isEqualTo(405);
        }
        assertThat(upstream.getRequestCount()).isZero();
    }

    @Test
    void shouldPassUpstreamClientErrorsThrough() throws Exception {
        upstream.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"bad key\"}"));

        try (GatewayServer server = gateway(GatewayFilter.NONE)) {
            HttpResponse<String> response = post(server, "/v1/chat/completions",
                "{\"model\":\"openai:gpt-4o\",\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}]}", null);

            assertThat(response.statusCode()).isEqualTo(401);
            JsonNode error = mapper.readTree(response.body()).path("error");
            assertThat(error.path("provider").asText()).isEqualTo("openai");
            assertThat(error.path("operation").asText()).isEqualTo("chat");
            assertThat(error.path("upstream_body").asText()).isEqualTo("{\"error\":\"bad key\"}");
        }
    }

    @Test
    void shouldAnswerCorsPreflight() throws Exception {
        try (GatewayServer server = gateway(new GatewayFilter(null, null, "sk-gateway"))) {
            HttpRequest preflight = HttpRequest.newBuilder(uri(server, "/v1/chat/completions"))
                .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                .header("Origin", "http://localhost:3000")
                .build();

            HttpResponse<String> response = http.send(preflight, HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(204);
            assertThat(response.headers().firstValue("Access-Control-Allow-Origin")).contains("http://localhost:3000");
            assertThat(response.headers().firstValue("Access-Control-Allow-Headers")).hasValueSatisfying(
                value -> assertThat(value).contains("Authorization"));
        }
    }

    private GatewayServer gateway(GatewayFilter filter) {
        GatewayServer server = new GatewayServer("127.0.0.1", 0, runtime.client(), runtime.catalog(), runtime.resolver(),
            filter, mapper, Clock.systemUTC());
        server.start();
        return server;
    }

    private HttpResponse<String> post(GatewayServer server, String path, String json, String key) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri(server, path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json));
        if (key != null) {
            builder.header("Authorization", "Bearer " + key);
        }
        return http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(GatewayServer server, String path, String key) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri(server, path)).GET();
        if (key != null) {
            builder.header("Authorization", "Bearer " + key);
        }
        return http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static URI uri(GatewayServer server, String path) {
        return URI.create("http://127.0.0.1:" + server.port() + path);
    }

    private static String readChunkedResponse(InputStream in) throws Exception {
        StringBuilder received = new StringBuilder();
        byte[] buffer = new byte[1024];
        while (!(received.indexOf("[DONE]") >= 0 && received.toString().endsWith("\r\n0\r\n\r\n"))) {
            int read = in.read(buffer);
            assertThat(read).isPositive();
            received.append(new String(buffer, 0, read, StandardCharsets.UTF_8));
        }
        return received.toString();
    }

    private static List<String> dataFrames(String body) {
        List<String> frames = new ArrayList<>();
        for (String line : body.split("\n")) {
            if (line.startsWith("data: ")) {
                frames.add(line.substring("data: ".length()));
            }
        }
        return frames;
    }
}
