package io.llmc.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmc.cli.AliasesCommand;
import io.llmc.cli.ChatCommand;
import io.llmc.cli.CliContext;
import io.llmc.cli.ConfigCommand;
import io.llmc.cli.KeysCommand;
import io.llmc.cli.LlmcCliCommand;
import io.llmc.cli.LogsCommand;
import io.llmc.cli.ModelsCommand;
import io.llmc.cli.ProvidersCommand;
import io.llmc.cli.ProxyCommand;
import io.llmc.cli.TemplatesCommand;
import io.llmc.cli.UsageCommand;
import io.llmc.core.config.ConfigPaths;
import io.llmc.core.config.ConfigService;
import io.llmc.core.gateway.GatewayFilter;
import io.llmc.core.gateway.GatewayServer;
import io.llmc.core.http.TransportSettings;
import io.llmc.core.runtime.LlmcRuntime;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import picocli.CommandLine;

public final class LlmcApplication {

    private LlmcApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        CliContext context = new CliContext(
            configService,
            ConfigPaths.defaultConfigPath(),
            TransportSettings.fromEnvironment(System.getenv()),
            LlmcApplication::runGateway
        );

        CommandLine commandLine = new CommandLine(new LlmcCliCommand());
        commandLine.addSubcommand("chat", new ChatCommand(context));
        commandLine.addSubcommand("models", new ModelsCommand(context));
        commandLine.addSubcommand("providers", new ProvidersCommand(context));
        commandLine.addSubcommand("aliases", new AliasesCommand(context));
        commandLine.addSubcommand("keys", new KeysCommand(context));
        commandLine.addSubcommand("proxy", new ProxyCommand(context));
        commandLine.addSubcommand("usage", new UsageCommand(context));
        commandLine.addSubcommand("logs", new LogsCommand(context));
        commandLine.addSubcommand("templates", new TemplatesCommand(context));
        commandLine.addSubcommand("config", new ConfigCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runGateway(LlmcRuntime runtime, String host, int port, GatewayFilter filter)
        throws InterruptedException {
        CountDownLatch shutdown = new CountDownLatch(1);
        try (GatewayServer server = new GatewayServer(
            host,
            port,
            runtime.client(),
            runtime.catalog(),
            runtime.resolver(),
            filter,
            new ObjectMapper(),
            Clock.systemUTC()
        )) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            System.out.println("Gateway started on http://" + host + ":" + server.port());
            System.out.println("Endpoints: GET /v1/models, POST /v1/chat/completions, GET /healthz");
            if (filter.requiresKey()) {
                System.out.println("Authentication enabled: send 'Authorization: Bearer <key>'");
            } else {
                System.out.println("No authentication required");
            }
            shutdown.await();
        }
        return 0;
    }
}
