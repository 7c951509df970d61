package io.llmc.cli;

import io.llmc.core.config.model.LlmcConfig;
import io.llmc.core.gateway.ApiKeyGenerator;
import io.llmc.core.gateway.GatewayFilter;
import io.llmc.core.runtime.LlmcRuntime;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "proxy", description = "Run an OpenAI-compatible gateway in front of the configured providers")
public final class ProxyCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--host"}, description = "Bind address", defaultValue = "127.0.0.1")
    String host;

    @Option(names = {"--port"}, description = "Gateway port", defaultValue = "8080")
    int port;

    @Option(names = {"-p", "--provider"}, description = "Only serve this provider")
    String provider;

    @Option(names = {"-m", "--model"}, description = "Only serve this model")
    String model;

    @Option(names = {"-k", "--key"}, description = "Require this bearer key")
    String key;

    @Option(names = "--generate-key", description = "Generate a bearer key and require it")
    boolean generateKey;

    public ProxyCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            String apiKey = key;
            if (generateKey && (apiKey == null || apiKey.isBlank())) {
                apiKey = ApiKeyGenerator.generate();
                System.out.println("Generated API key: " + apiKey);
            }
            GatewayFilter filter = new GatewayFilter(provider, model, apiKey);
            LlmcConfig config = context.loadConfig();
            try (LlmcRuntime runtime = context.openRuntime(config)) {
                if (filter.hasProvider()) {
                    runtime.registry().require(filter.provider());
                }
                return context.gatewayRunner().run(runtime, host, port, filter);
            }
        } catch (Exception e) {
            System.err.println("Proxy command failed: " + e.getMessage());
            return 1;
        }
    }
}
