package io.llmc.core.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmc.core.client.LlmClient;
import io.llmc.core.client.ModelTarget;
import io.llmc.core.error.GatewayException;
import io.llmc.core.model.ChatChunk;
import io.llmc.core.model.ChatRequest;
import io.llmc.core.model.ChatResponse;
import io.llmc.core.models.ModelCatalog;
import io.llmc.core.models.ModelMetadata;
import io.llmc.core.normalize.ChatStream;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.ServerConnection;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.AttachmentKey;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenAI-compatible HTTP front for every configured provider.
 *
 * <p>Routes: {@code GET /models}, {@code GET /v1/models}, {@code POST /chat/completions},
 * {@code POST /v1/chat/completions} and {@code GET /healthz}.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final HttpString CORS_ALLOW_ORIGIN = new HttpString("Access-Control-Allow-Origin");
    private static final HttpString CORS_ALLOW_METHODS = new HttpString("Access-Control-Allow-Methods");
    private static final HttpString CORS_ALLOW_HEADERS = new HttpString("Access-Control-Allow-Headers");
    private static final HttpString CORS_MAX_AGE = new HttpString("Access-Control-Max-Age");
    private static final byte[] DONE_FRAME = "data: [DONE]\n\n".getBytes(StandardCharsets.UTF_8);
    private static final AttachmentKey<AtomicReference<ChatStream>> ACTIVE_STREAM = AttachmentKey.create(AtomicReference.class);

    private final String host;
    private final int requestedPort;
    private final LlmClient client;
    private final ModelCatalog catalog;
    private final ModelResolver resolver;
    private final GatewayFilter filter;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final OpenAiRequestReader requestReader;
    private final OpenAiResponseWriter responseWriter;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(
        String host,
        int port,
        LlmClient client,
        ModelCatalog catalog,
        ModelResolver resolver,
        GatewayFilter filter,
        ObjectMapper mapper,
        Clock clock
    ) {
        this.host = host == null || host.isBlank() ? "127.0.0.1" : host;
        this.requestedPort = port;
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.filter = filter == null ? GatewayFilter.NONE : filter;
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.requestReader = new OpenAiRequestReader(mapper);
        this.responseWriter = new OpenAiResponseWriter(mapper);
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }
        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/models", this::handleModels)
            .addExactPath("/v1/models", this::handleModels)
            .addExactPath("/chat/completions", this::handleChatCompletions)
            .addExactPath("/v1/chat/completions", this::handleChatCompletions);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(exchange -> handleWithCors(routes, exchange))
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Gateway listening on http://{}:{} (provider filter: {}, model filter: {}, auth: {})",
            host, actualPort, display(filter.provider()), display(filter.model()),
            filter.requiresKey() ? "bearer key" : "none");
    }

    public int port() {
        return actualPort;
    }

    public GatewayFilter filter() {
        return filter;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
            server = null;
            LOG.info("Gateway stopped");
        }
    }

    private void handleWithCors(PathHandler routes, HttpServerExchange exchange) throws Exception {
        applyCorsHeaders(exchange);
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            exchange.setStatusCode(204);
            exchange.endExchange();
            return;
        }
        routes.handleRequest(exchange);
    }

    private void applyCorsHeaders(HttpServerExchange exchange) {
        String origin = header(exchange, "Origin");
        exchange.getResponseHeaders().put(CORS_ALLOW_ORIGIN, origin.isBlank() ? "*" : origin);
        exchange.getResponseHeaders().put(CORS_ALLOW_METHODS, "GET,POST,OPTIONS");
        exchange.getResponseHeaders().put(CORS_ALLOW_HEADERS, "Content-Type,Authorization");
        exchange.getResponseHeaders().put(CORS_MAX_AGE, "86400");
        if (!origin.isBlank()) {
            exchange.getResponseHeaders().put(Headers.VARY, "Origin");
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, GatewayErrors.body("Method not allowed", 405));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleModels(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleModels(exchange);
                } catch (Exception e) {
                    sendError(exchange, e);
                }
            });
            return;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, GatewayErrors.body("Method not allowed", 405));
            return;
        }
        if (!authorized(exchange)) {
            sendJson(exchange, 401, GatewayErrors.body("Invalid or missing API key", 401));
            return;
        }
        try {
            sendJson(exchange, 200, listModels(queryParam(exchange, "provider")));
        } catch (RuntimeException e) {
            sendError(exchange, e);
        }
    }

    private void handleChatCompletions(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleChatCompletions(exchange);
                } catch (Exception e) {
                    sendError(exchange, e);
                }
            });
            return;
        }
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, GatewayErrors.body("Method not allowed", 405));
            return;
        }
        if (!authorized(exchange)) {
            sendJson(exchange, 401, GatewayErrors.body("Invalid or missing API key", 401));
            return;
        }
        ChatRequest request;
        ModelTarget target;
        try {
            request = requestReader.read(readJsonBody(exchange));
            target = resolver.resolve(request.model(), filter);
        } catch (RuntimeException e) {
            sendError(exchange, e);
            return;
        }
        LOG.debug("Routing {} request for '{}' to {}", request.stream() ? "streaming" : "blocking", request.model(),
            target);
        String responseModel = request.model().isEmpty() ? target.toString() : request.model();
        if (request.stream()) {
            streamCompletion(exchange, target, request, responseModel);
        } else {
            try {
                ChatResponse response = client.chat(target, request);
                sendJson(exchange, 200, responseWriter.completion(completionId(), now(), responseModel, response));
            } catch (RuntimeException e) {
                sendError(exchange, e);
            }
        }
    }

    private void streamCompletion(HttpServerExchange exchange, ModelTarget target, ChatRequest request, String model) {
        ChatStream stream;
        try {
            stream = client.stream(target, request);
        } catch (RuntimeException e) {
            sendError(exchange, e);
            return;
        }
        AtomicReference<ChatStream> active = activeStream(exchange.getConnection());
        active.set(stream);
        try {
            writeStream(exchange, target, stream, model);
        } finally {
            active.compareAndSet(stream, null);
        }
    }

    // One close listener per connection; keep-alive requests on it run one at a time.
    private static AtomicReference<ChatStream> activeStream(ServerConnection connection) {
        AtomicReference<ChatStream> active = connection.getAttachment(ACTIVE_STREAM);
        if (active == null) {
            AtomicReference<ChatStream> created = new AtomicReference<>();
            connection.putAttachment(ACTIVE_STREAM, created);
            connection.addCloseListener(closed -> {
                ChatStream stream = created.getAndSet(null);
                if (stream != null) {
                    stream.close();
                }
            });
            active = created;
        }
        return active;
    }

    private void writeStream(HttpServerExchange exchange, ModelTarget target, ChatStream stream, String model) {
        String id = completionId();
        long created = now();
        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/event-stream; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-cache");
        exchange.startBlocking();
        try (stream; OutputStream out = exchange.getOutputStream()) {
            boolean first = true;
            boolean sawToolCalls = false;
            String finishReason = null;
            try {
                while (stream.hasNext()) {
                    ChatChunk chunk = stream.next();
                    if (chunk.finishReason() != null) {
                        finishReason = chunk.finishReason();
                    }
                    if (chunk.content().isEmpty() && chunk.toolCalls().isEmpty()) {
                        continue;
                    }
                    sawToolCalls |= !chunk.toolCalls().isEmpty();
                    writeFrame(out, responseWriter.sseFrame(responseWriter.deltaChunk(id, created, model, chunk, first)));
                    first = false;
                }
            } catch (RuntimeException e) {
                LOG.warn("Upstream stream from {} failed: {}", target.provider(), e.getMessage());
                writeFrame(out, responseWriter.sseFrame(GatewayErrors.body(e, GatewayErrors.status(e))));
                writeFrame(out, DONE_FRAME);
                return;
            }
            writeFrame(out, responseWriter.sseFrame(
                responseWriter.finishChunk(id, created, model, finishReason, sawToolCalls, stream.usage(), first)));
            writeFrame(out, DONE_FRAME);
        } catch (IOException e) {
            LOG.debug("Client for {} disconnected mid-stream: {}", target, e.getMessage());
        }
    }

    private void writeFrame(OutputStream out, byte[] frame) throws IOException {
        out.write(frame);
        out.flush();
    }

    private Map<String, Object> listModels(String queryProvider) {
        List<String> providers = permittedProviders(queryProvider);
        boolean bareIds = filter.hasProvider();
        List<Map<String, Object>> data = new ArrayList<>();
        for (String provider : providers) {
            List<ModelMetadata> models;
            try {
                models = catalog.models(provider);
            } catch (RuntimeException e) {
                if (providers.size() == 1) {
                    throw e;
                }
                LOG.warn("Skipping models of {}: {}", provider, e.getMessage());
                continue;
            }
            long fallbackCreated = catalog.lastRefresh(provider).map(instant -> instant.getEpochSecond()).orElse(now());
            for (ModelMetadata model : models) {
                String qualified = provider + ":" + model.id();
                if (!filter.allowsModel(qualified, model.id())) {
                    continue;
                }
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("id", bareIds ? model.id() : qualified);
                item.put("object", "model");
                item.put("created", model.created() == null ? fallbackCreated : model.created());
                item.put("owned_by", model.ownedBy() == null || model.ownedBy().isBlank() ? provider : model.ownedBy());
                data.add(item);
            }
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("object", "list");
        payload.put("data", data);
        return payload;
    }

    private List<String> permittedProviders(String queryProvider) {
        if (filter.hasProvider()) {
            if (!queryProvider.isBlank() && !queryProvider.equals(filter.provider())) {
                throw new GatewayException(400, "Provider '" + queryProvider
                    + "' does not match the gateway provider filter '" + filter.provider() + "' (filter mismatch)");
            }
            client.registry().require(filter.provider());
            return List.of(filter.provider());
        }
        if (!queryProvider.isBlank()) {
            client.registry().require(queryProvider);
            return List.of(queryProvider);
        }
        return client.registry().names();
    }

    private boolean authorized(HttpServerExchange exchange) {
        if (!filter.requiresKey()) {
            return true;
        }
        String authorization = header(exchange, "Authorization");
        if (!authorization.startsWith("Bearer ")) {
            return false;
        }
        byte[] presented = authorization.substring("Bearer ".length()).trim().getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(presented, filter.apiKey().getBytes(StandardCharsets.UTF_8));
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendError(HttpServerExchange exchange, Exception error) {
        int status = GatewayErrors.status(error);
        if (status >= 500) {
            LOG.warn("Gateway request failed with {}: {}", status, error.getMessage());
        } else {
            LOG.debug("Gateway request rejected with {}: {}", status, error.getMessage());
        }
        if (exchange.isResponseStarted()) {
            exchange.endExchange();
            return;
        }
        try {
            sendJson(exchange, status, GatewayErrors.body(error, status));
        } catch (IOException e) {
            LOG.debug("Failed to send error response: {}", e.getMessage());
        }
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) {
        exchange.startBlocking();
        try {
            byte[] bytes = exchange.getInputStream().readAllBytes();
            if (bytes.length == 0) {
                return mapper.createObjectNode();
            }
            return mapper.readTree(bytes);
        } catch (JsonProcessingException e) {
            throw new GatewayException(400, "Request body is not valid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new GatewayException(400, "Failed to read request body: " + e.getMessage());
        }
    }

    private String queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        if (values == null || values.isEmpty()) {
            return "";
        }
        String value = values.peekFirst();
        return value == null ? "" : value.trim();
    }

    private String header(HttpServerExchange exchange, String name) {
        String value = exchange.getRequestHeaders().getFirst(name);
        return value == null ? "" : value;
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private static String completionId() {
        return "chatcmpl-" + UUID.randomUUID();
    }

    private static String display(String value) {
        return value.isEmpty() ? "none" : value;
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        try {
            Object address = undertow.getListenerInfo().get(0).getAddress();
            if (address instanceof InetSocketAddress socketAddress) {
                return socketAddress.getPort();
            }
        } catch (RuntimeException ignored) {
            return fallbackPort;
        }
        return fallbackPort;
    }
}
