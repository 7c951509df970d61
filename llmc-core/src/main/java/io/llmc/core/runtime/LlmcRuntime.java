package io.llmc.core.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmc.core.auth.AuthResolver;
import io.llmc.core.auth.CredentialStore;
import io.llmc.core.auth.FileCredentialStore;
import io.llmc.core.auth.InMemoryTokenCache;
import io.llmc.core.auth.ServiceAccountTokenExchanger;
import io.llmc.core.auth.TokenUrlExchanger;
import io.llmc.core.client.LlmClient;
import io.llmc.core.config.ConfigPaths;
import io.llmc.core.config.model.LlmcConfig;
import io.llmc.core.gateway.ModelResolver;
import io.llmc.core.http.HttpTransport;
import io.llmc.core.http.TransportSettings;
import io.llmc.core.models.FileModelCache;
import io.llmc.core.models.ModelCacheEntry;
import io.llmc.core.models.ModelCatalog;
import io.llmc.core.models.ModelListParser;
import io.llmc.core.normalize.ResponseNormalizer;
import io.llmc.core.provider.ProviderRegistry;
import io.llmc.core.template.RequestRenderer;
import io.llmc.core.template.TemplateEngine;
import io.llmc.core.usage.SqliteUsageLog;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Process-wide collaborators built from one loaded configuration. Files live next to the config file.
 */
public final class LlmcRuntime implements AutoCloseable {
    private final LlmcConfig config;
    private final ProviderRegistry registry;
    private final CredentialStore credentials;
    private final AuthResolver auth;
    private final HttpTransport transport;
    private final LlmClient client;
    private final ModelCatalog catalog;
    private final ModelResolver resolver;
    private final SqliteUsageLog usageLog;
    private final ExecutorService background;

    private LlmcRuntime(
        LlmcConfig config,
        ProviderRegistry registry,
        CredentialStore credentials,
        AuthResolver auth,
        HttpTransport transport,
        LlmClient client,
        ModelCatalog catalog,
        ModelResolver resolver,
        SqliteUsageLog usageLog,
        ExecutorService background
    ) {
        this.config = config;
        this.registry = registry;
        this.credentials = credentials;
        this.auth = auth;
        this.transport = transport;
        this.client = client;
        this.catalog = catalog;
        this.resolver = resolver;
        this.usageLog = usageLog;
        this.background = background;
    }

    public static LlmcRuntime create(LlmcConfig config, Path configPath, TransportSettings settings) throws IOException {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(configPath, "configPath must not be null");
        Clock clock = Clock.systemUTC();
        ObjectMapper mapper = new ObjectMapper();

        ProviderRegistry registry = new ProviderRegistry(config.providers().values());
        CredentialStore credentials = new FileCredentialStore(ConfigPaths.credentialsPath(configPath));
        HttpTransport transport = new HttpTransport(settings == null ? TransportSettings.defaults() : settings);
        AuthResolver auth = new AuthResolver(
            credentials,
            new InMemoryTokenCache(clock),
            new ServiceAccountTokenExchanger(transport, mapper, clock),
            new TokenUrlExchanger(transport, mapper),
            mapper,
            clock
        );
        SqliteUsageLog usageLog = new SqliteUsageLog(ConfigPaths.usageDbPath(configPath));
        LlmClient client = new LlmClient(
            registry,
            new RequestRenderer(new TemplateEngine(), mapper),
            auth,
            transport,
            new ResponseNormalizer(mapper),
            new ModelListParser(mapper),
            usageLog,
            mapper,
            clock
        );
        ExecutorService background = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "llmc-model-refresh");
            thread.setDaemon(true);
            return thread;
        });
        ModelCatalog catalog = new ModelCatalog(
            new FileModelCache(ConfigPaths.modelsCachePath(configPath)),
            client::listModels,
            background,
            clock,
            ModelCacheEntry.DEFAULT_TTL
        );
        ModelResolver resolver = new ModelResolver(registry, config.aliases());
        return new LlmcRuntime(config, registry, credentials, auth, transport, client, catalog, resolver, usageLog,
            background);
    }

    public LlmcConfig config() {
        return config;
    }

    public ProviderRegistry registry() {
        return registry;
    }

    public CredentialStore credentials() {
        return credentials;
    }

    public AuthResolver auth() {
        return auth;
    }

    public HttpTransport transport() {
        return transport;
    }

    public LlmClient client() {
        return client;
    }

    public ModelCatalog catalog() {
        return catalog;
    }

    public ModelResolver resolver() {
        return resolver;
    }

    public SqliteUsageLog usageLog() {
        return usageLog;
    }

    @Override
    public void close() {
        background.shutdownNow();
        transport.close();
    }
}
