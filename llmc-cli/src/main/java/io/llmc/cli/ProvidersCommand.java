package io.llmc.cli;

import io.llmc.core.config.model.ChatTemplate;
import io.llmc.core.config.model.LlmcConfig;
import io.llmc.core.config.model.ProviderConfig;
import io.llmc.core.provider.Operation;
import io.llmc.core.provider.ProviderRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(name = "providers", description = "Manage provider configurations")
public final class ProvidersCommand implements Runnable {
    private final CliContext context;

    @Spec
    CommandSpec spec;

    public ProvidersCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "add", description = "Add a provider")
    int add(
        @Parameters(index = "0", paramLabel = "NAME") String name,
        @Parameters(index = "1", paramLabel = "ENDPOINT") String endpoint,
        @Option(names = "--chat-path", description = "Chat completions path") String chatPath,
        @Option(names = "--models-path", description = "Models listing path") String modelsPath,
        @Option(names = "--token-url", description = "Token exchange URL") String tokenUrl,
        @Option(names = "--auth-type", description = "Auth type, e.g. google_sa_jwt") String authType,
        @Option(names = {"-H", "--header"}, description = "Header as NAME=VALUE") Map<String, String> headers
    ) {
        try {
            ProviderConfig provider = ProviderConfig.of(name, endpoint)
                .withPath(Operation.CHAT.key(), chatPath)
                .withPath(Operation.MODELS.key(), modelsPath)
                .withTokenUrl(tokenUrl)
                .withAuthType(authType);
            if (headers != null) {
                for (Map.Entry<String, String> header : headers.entrySet()) {
                    provider = provider.withHeader(header.getKey(), header.getValue());
                }
            }
            LlmcConfig config = context.loadConfig();
            ProviderRegistry registry = new ProviderRegistry(config.providers().values());
            registry.add(provider);
            context.saveConfig(config.withProviders(byName(registry)));
            System.out.println("Added provider " + name + " (" + endpoint + ")");
            return 0;
        } catch (Exception e) {
            System.err.println("Providers add failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "update", description = "Update a provider's endpoint or paths")
    int update(
        @Parameters(index = "0", paramLabel = "NAME") String name,
        @Option(names = "--endpoint", description = "New endpoint") String endpoint,
        @Option(names = "--chat-path", description = "Chat completions path") String chatPath,
        @Option(names = "--models-path", description = "Models listing path") String modelsPath,
        @Option(names = "--token-url", description = "Token exchange URL") String tokenUrl,
        @Option(names = "--auth-type", description = "Auth type, e.g. google_sa_jwt") String authType
    ) {
        return mutate("update", name, provider -> {
            ProviderConfig updated = endpoint == null ? provider : provider.withEndpoint(endpoint);
            if (chatPath != null) {
                updated = updated.withPath(Operation.CHAT.key(), chatPath);
            }
            if (modelsPath != null) {
                updated = updated.withPath(Operation.MODELS.key(), modelsPath);
            }
            if (tokenUrl != null) {
                updated = updated.withTokenUrl(tokenUrl);
            }
            if (authType != null) {
                updated = updated.withAuthType(authType);
            }
            return updated;
        }, "Updated provider " + name);
    }

    @Command(name = "remove", description = "Remove a provider")
    int remove(@Parameters(index = "0", paramLabel = "NAME") String name) {
        try {
            LlmcConfig config = context.loadConfig();
            ProviderRegistry registry = new ProviderRegistry(config.providers().values());
            if (!registry.remove(name)) {
                System.err.println("Providers remove failed: Provider '" + name + "' not found");
                return 1;
            }
            context.saveConfig(config.withProviders(byName(registry)));
            System.out.println("Removed provider " + name);
            return 0;
        } catch (Exception e) {
            System.err.println("Providers remove failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "list", description = "List configured providers")
    int list() {
        try {
            LlmcConfig config = context.loadConfig();
            if (config.providers().isEmpty()) {
                System.out.println("No providers configured.");
                return 0;
            }
            for (ProviderConfig provider : config.providers().values()) {
                String marker = provider.name().equals(config.defaultProvider()) ? " (default)" : "";
                System.out.println(provider.name() + marker + "  " + provider.endpoint());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Providers list failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "path", description = "Set the path of an operation (chat, models, images, speech, embeddings, audio)")
    int path(
        @Parameters(index = "0", paramLabel = "NAME") String name,
        @Parameters(index = "1", paramLabel = "OPERATION") String operation,
        @Parameters(index = "2", paramLabel = "PATH") String path
    ) {
        return mutate("path", name, provider -> provider.withPath(Operation.fromKey(operation).key(), path),
            "Set " + operation + " path of " + name + " to " + path);
    }

    @Command(name = "var", description = "Set a template variable")
    int var(
        @Parameters(index = "0", paramLabel = "NAME") String name,
        @Parameters(index = "1", paramLabel = "KEY") String key,
        @Parameters(index = "2", paramLabel = "VALUE") String value
    ) {
        return mutate("var", name, provider -> provider.withVar(key, value), "Set variable " + key + " on " + name);
    }

    @Command(name = "header", description = "Set a header, or remove it when no value is given")
    int header(
        @Parameters(index = "0", paramLabel = "NAME") String name,
        @Parameters(index = "1", paramLabel = "HEADER") String header,
        @Parameters(index = "2", arity = "0..1", paramLabel = "VALUE") String value
    ) {
        String message = value == null ? "Removed header " + header + " from " + name : "Set header " + header + " on " + name;
        return mutate("header", name, provider -> provider.withHeader(header, value), message);
    }

    @Command(name = "template", description = "Add a chat template for models matching PATTERN; prefix TEMPLATE with @ to read a file")
    int template(
        @Parameters(index = "0", paramLabel = "NAME") String name,
        @Parameters(index = "1", paramLabel = "PATTERN") String pattern,
        @Parameters(index = "2", paramLabel = "TEMPLATE") String template
    ) {
        String body;
        try {
            body = template.startsWith("@") ? Files.readString(Path.of(template.substring(1))) : template;
        } catch (IOException e) {
            System.err.println("Providers template failed: " + e.getMessage());
            return 1;
        }
        return mutate("template", name, provider -> provider.withChatTemplate(new ChatTemplate(pattern, body)),
            "Set chat template for '" + pattern + "' on " + name);
    }

    @Command(name = "default", description = "Set the default provider and optionally the default model")
    int defaults(
        @Parameters(index = "0", paramLabel = "NAME") String name,
        @Parameters(index = "1", arity = "0..1", paramLabel = "MODEL") String model
    ) {
        try {
            LlmcConfig config = context.loadConfig();
            new ProviderRegistry(config.providers().values()).require(name);
            String effectiveModel = model == null ? config.defaultModel() : model;
            context.saveConfig(config.withDefaults(name, effectiveModel));
            System.out.println("Default provider: " + name + (effectiveModel.isBlank() ? "" : ", model: " + effectiveModel));
            return 0;
        } catch (Exception e) {
            System.err.println("Providers default failed: " + e.getMessage());
            return 1;
        }
    }

    private int mutate(String action, String name, UnaryOperator<ProviderConfig> change, String message) {
        try {
            LlmcConfig config = context.loadConfig();
            ProviderRegistry registry = new ProviderRegistry(config.providers().values());
            registry.update(change.apply(registry.require(name)));
            context.saveConfig(config.withProviders(byName(registry)));
            System.out.println(message);
            return 0;
        } catch (Exception e) {
            System.err.println("Providers " + action + " failed: " + e.getMessage());
            return 1;
        }
    }

    private static Map<String, ProviderConfig> byName(ProviderRegistry registry) {
        Map<String, ProviderConfig> providers = new LinkedHashMap<>();
        for (ProviderConfig provider : registry.all()) {
            providers.put(provider.name(), provider);
        }
        return providers;
    }
}
