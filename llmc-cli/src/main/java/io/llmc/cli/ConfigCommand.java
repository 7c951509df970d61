package io.llmc.cli;

import io.llmc.core.config.model.LlmcConfig;
import io.llmc.core.error.ConfigException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "config", description = "Show the configuration, or set, get and delete chat defaults")
public final class ConfigCommand implements Callable<Integer> {
    static final List<String> KEYS = List.of("provider", "model", "system-prompt", "max-tokens", "temperature", "stream");

    private final CliContext context;

    public ConfigCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            System.out.println(context.configService().toPrettyJson(context.loadConfig()));
            return 0;
        } catch (Exception e) {
            System.err.println("Config show failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "path", description = "Print the configuration file path")
    int path() {
        System.out.println(context.configPath().toAbsolutePath());
        return 0;
    }

    @Command(name = "set", description = "Set a default: provider, model, system-prompt, max-tokens, temperature or stream")
    int set(
        @Parameters(index = "0", paramLabel = "KEY") String key,
        @Parameters(index = "1", paramLabel = "VALUE") String value
    ) {
        try {
            LlmcConfig config = context.loadConfig();
            LlmcConfig updated = switch (normalize(key)) {
                case "provider" -> {
                    if (!config.providers().containsKey(value)) {
                        throw new ConfigException("Provider '" + value + "' not found. Add it first with 'llmc providers add'");
                    }
                    yield config.withDefaults(value, config.defaultModel());
                }
                case "model" -> config.withDefaults(config.defaultProvider(), value);
                case "system-prompt" -> config.withSystemPrompt(config.resolveTemplateOrPrompt(value));
                case "max-tokens" -> config.withMaxTokens(LlmcConfig.parseMaxTokens(value));
                case "temperature" -> config.withTemperature(LlmcConfig.parseTemperature(value));
                case "stream" -> config.withStream(parseBoolean(value));
                default -> throw unknownKey(key);
            };
            context.saveConfig(updated);
            System.out.println("Set " + normalize(key) + " to " + display(updated, normalize(key)));
            return 0;
        } catch (Exception e) {
            System.err.println("Config set failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "get", description = "Print one default")
    int get(@Parameters(index = "0", paramLabel = "KEY") String key) {
        try {
            String name = normalize(key);
            if (!KEYS.contains(name)) {
                throw unknownKey(key);
            }
            String value = display(context.loadConfig(), name);
            if (value == null) {
                System.err.println("No " + name + " configured");
                return 1;
            }
            System.out.println(value);
            return 0;
        } catch (Exception e) {
            System.err.println("Config get failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "delete", aliases = "unset", description = "Remove one default")
    int delete(@Parameters(index = "0", paramLabel = "KEY") String key) {
        try {
            LlmcConfig config = context.loadConfig();
            LlmcConfig updated = switch (normalize(key)) {
                case "provider" -> config.withDefaults("", config.defaultModel());
                case "model" -> config.withDefaults(config.defaultProvider(), "");
                case "system-prompt" -> config.withSystemPrompt(null);
                case "max-tokens" -> config.withMaxTokens(null);
                case "temperature" -> config.withTemperature(null);
                case "stream" -> config.withStream(null);
                default -> throw unknownKey(key);
            };
            context.saveConfig(updated);
            System.out.println("Deleted " + normalize(key));
            return 0;
        } catch (Exception e) {
            System.err.println("Config delete failed: " + e.getMessage());
            return 1;
        }
    }

    private static String display(LlmcConfig config, String key) {
        Object value = switch (key) {
            case "provider" -> config.defaultProvider().isEmpty() ? null : config.defaultProvider();
            case "model" -> config.defaultModel().isEmpty() ? null : config.defaultModel();
            case "system-prompt" -> config.systemPrompt();
            case "max-tokens" -> config.maxTokens();
            case "temperature" -> config.temperature();
            case "stream" -> config.stream();
            default -> null;
        };
        return value == null ? null : String.valueOf(value);
    }

    private static String normalize(String key) {
        return key == null ? "" : key.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    private static boolean parseBoolean(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new ConfigException("Invalid stream value '" + value + "'. Use 'true' or 'false'");
        };
    }

    private static ConfigException unknownKey(String key) {
        return new ConfigException("Unknown config key '" + key + "'. Use one of " + String.join(", ", KEYS));
    }
}
