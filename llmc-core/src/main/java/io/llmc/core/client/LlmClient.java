package io.llmc.core.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmc.core.auth.AuthResolver;
import io.llmc.core.config.model.ProviderConfig;
import io.llmc.core.error.ConfigException;
import io.llmc.core.http.HttpResult;
import io.llmc.core.http.HttpStream;
import io.llmc.core.http.HttpTransport;
import io.llmc.core.model.ChatRequest;
import io.llmc.core.model.ChatResponse;
import io.llmc.core.model.Usage;
import io.llmc.core.models.ModelListParser;
import io.llmc.core.models.ModelMetadata;
import io.llmc.core.normalize.ChatStream;
import io.llmc.core.normalize.ResponseNormalizer;
import io.llmc.core.provider.Operation;
import io.llmc.core.provider.ProviderRegistry;
import io.llmc.core.provider.UrlResolver;
import io.llmc.core.template.RequestRenderer;
import io.llmc.core.usage.UsageRecord;
import io.llmc.core.usage.UsageSink;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one request through the provider pipeline: render, resolve URL, attach auth, send, normalize.
 */
public final class LlmClient {
    private static final Logger LOG = LoggerFactory.getLogger(LlmClient.class);

    private final ProviderRegistry registry;
    private final RequestRenderer renderer;
    private final AuthResolver auth;
    private final HttpTransport transport;
    private final ResponseNormalizer normalizer;
    private final ModelListParser modelListParser;
    private final UsageSink usageSink;
    private final ObjectMapper mapper;
    private final Clock clock;

    public LlmClient(
        ProviderRegistry registry,
        RequestRenderer renderer,
        AuthResolver auth,
        HttpTransport transport,
        ResponseNormalizer normalizer,
        ModelListParser modelListParser,
        UsageSink usageSink,
        ObjectMapper mapper,
        Clock clock
    ) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.auth = Objects.requireNonNull(auth, "auth must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.modelListParser = Objects.requireNonNull(modelListParser, "modelListParser must not be null");
        this.usageSink = usageSink == null ? UsageSink.noop() : usageSink;
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ProviderRegistry registry() {
        return registry;
    }

    public ChatResponse chat(ModelTarget target, ChatRequest request) {
        Prepared prepared = prepare(target, request.withStream(false));
        LOG.debug("chat {} -> {}", target, prepared.url());
        HttpResult result = transport.postJson(
            target.provider(),
            Operation.CHAT.key(),
            prepared.url(),
            prepared.headers(),
            prepared.body()
        );
        ChatResponse response = normalizer.parse(result.body(), target.provider());
        recordUsage(target, response.usage());
        return response;
    }

    /** The caller owns the returned stream and must close it. */
    public ChatStream stream(ModelTarget target, ChatRequest request) {
        Prepared prepared = prepare(target, request.withStream(true));
        LOG.debug("stream {} -> {}", target, prepared.url());
        HttpStream upstream = transport.stream(
            target.provider(),
            Operation.CHAT.key(),
            prepared.url(),
            prepared.headers(),
            prepared.body()
        );
        ChatStream stream = new ChatStream(upstream, target.provider(), normalizer, mapper);
        stream.onComplete(completed -> recordUsage(target, completed.usage()));
        return stream;
    }

    /**
     * Models offered by a provider. A provider with a configured model list is answered from it without a network
     * call.
     */
    public List<ModelMetadata> listModels(String providerName) {
        ProviderConfig provider = registry.require(providerName);
        if (!provider.models().isEmpty()) {
            List<ModelMetadata> configured = new ArrayList<>();
            for (String id : provider.models()) {
                configured.add(ModelMetadata.of(id));
            }
            return configured;
        }
        String url = UrlResolver.resolveUrl(provider, Operation.MODELS, "");
        Map<String, String> headers = auth.prepareHeaders(provider);
        HttpResult result = transport.get(provider.name(), Operation.MODELS.key(), url, headers);
        return modelListParser.parse(result.body(), provider.name());
    }

    private Prepared prepare(ModelTarget target, ChatRequest request) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(request, "request must not be null");
        try {
            request.requireMessages();
        } catch (IllegalArgumentException e) {
            throw new ConfigException(e.getMessage(), Operation.CHAT.key(), target.provider());
        }
        ProviderConfig provider = registry.require(target.provider());
        ChatRequest outbound = request.withModel(target.model());
        byte[] body = renderer.renderRequestBody(provider, target.model(), outbound);
        String url = UrlResolver.resolveUrl(provider, Operation.CHAT, target.model());
        Map<String, String> headers = auth.prepareHeaders(provider);
        return new Prepared(url, headers, body);
    }

    private void recordUsage(ModelTarget target, Usage usage) {
        Usage effective = usage == null ? Usage.ZERO : usage;
        usageSink.record(new UsageRecord(
            target.provider(),
            target.model(),
            effective.inputTokens(),
            effective.outputTokens(),
            clock.instant()
        ));
    }

    private record Prepared(String url, Map<String, String> headers, byte[] body) {
    }
}
