package io.llmc.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.llmc.core.error.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LlmcConfig(
    Map<String, ProviderConfig> providers,
    Map<String, String> aliases,
    @JsonAlias({"default_provider"}) String defaultProvider,
    @JsonAlias({"default_model"}) String defaultModel,
    @JsonAlias({"system_prompt"}) String systemPrompt,
    @JsonAlias({"max_tokens"}) Integer maxTokens,
    Double temperature,
    Boolean stream,
    Map<String, String> templates
) {
    public static final String TEMPLATE_PREFIX = "t:";

    public LlmcConfig {
        providers = keyedByName(providers);
        aliases = aliases == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        defaultProvider = defaultProvider == null ? "" : defaultProvider;
        defaultModel = defaultModel == null ? "" : defaultModel;
        templates = templates == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(templates));
    }

    public static LlmcConfig defaults() {
        return new LlmcConfig(Map.of(), Map.of(), "", "", null, null, null, null, Map.of());
    }

    private static Map<String, ProviderConfig> keyedByName(Map<String, ProviderConfig> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, ProviderConfig> keyed = new LinkedHashMap<>();
        source.forEach((key, provider) -> {
            if (provider != null) {
                keyed.put(key, provider.name().equals(key) ? provider : provider.withName(key));
            }
        });
        return Collections.unmodifiableMap(keyed);
    }

    public LlmcConfig withProviders(Map<String, ProviderConfig> newProviders) {
        return new LlmcConfig(newProviders, aliases, defaultProvider, defaultModel, systemPrompt, maxTokens, temperature,
            stream, templates);
    }

    public LlmcConfig withAliases(Map<String, String> newAliases) {
        return new LlmcConfig(providers, newAliases, defaultProvider, defaultModel, systemPrompt, maxTokens, temperature,
            stream, templates);
    }

    public LlmcConfig withProvider(ProviderConfig provider) {
        Map<String, ProviderConfig> updated = new LinkedHashMap<>(providers);
        updated.put(provider.name(), provider);
        return withProviders(updated);
    }

    public LlmcConfig withoutProvider(String name) {
        if (!providers.containsKey(name)) {
            throw ConfigException.unknownProvider(name);
        }
        Map<String, ProviderConfig> updated = new LinkedHashMap<>(providers);
        updated.remove(name);
        return withProviders(updated);
    }

    /**
     * Adds {@code name -> provider:model}. Alias names cannot contain {@code :} and targets are never
     * re-resolved, so alias chains are impossible.
     */
    public LlmcConfig withAlias(String name, String target) {
        if (name == null || name.isBlank() || name.contains(":")) {
            throw new ConfigException("Alias name must be non-empty and must not contain ':', got '" + name + "'");
        }
        int colon = target == null ? -1 : target.indexOf(':');
        if (colon <= 0 || colon == target.length() - 1) {
            throw new ConfigException("Alias target must be in format 'provider:model', got '" + target + "'");
        }
        String provider = target.substring(0, colon);
        if (!providers.containsKey(provider)) {
            throw new ConfigException("Provider '" + provider + "' not found. Add it first with 'llmc providers add'");
        }
        Map<String, String> updated = new LinkedHashMap<>(aliases);
        updated.put(name.trim(), target.trim());
        return withAliases(updated);
    }

    public LlmcConfig withoutAlias(String name) {
        if (!aliases.containsKey(name)) {
            throw new ConfigException("Alias '" + name + "' not found");
        }
        Map<String, String> updated = new LinkedHashMap<>(aliases);
        updated.remove(name);
        return withAliases(updated);
    }

    public LlmcConfig withDefaults(String provider, String model) {
        return new LlmcConfig(providers, aliases, provider, model, systemPrompt, maxTokens, temperature, stream,
            templates);
    }

    public LlmcConfig withSystemPrompt(String prompt) {
        return new LlmcConfig(providers, aliases, defaultProvider, defaultModel, prompt, maxTokens, temperature, stream,
            templates);
    }

    public LlmcConfig withMaxTokens(Integer tokens) {
        if (tokens != null && tokens <= 0) {
            throw new ConfigException("Max tokens must be positive, got " + tokens);
        }
        return new LlmcConfig(providers, aliases, defaultProvider, defaultModel, systemPrompt, tokens, temperature,
            stream, templates);
    }

    public LlmcConfig withTemperature(Double value) {
        if (value != null && (value.isNaN() || value < 0.0 || value > 2.0)) {
            throw new ConfigException("Temperature must be between 0.0 and 2.0, got " + value);
        }
        return new LlmcConfig(providers, aliases, defaultProvider, defaultModel, systemPrompt, maxTokens, value, stream,
            templates);
    }

    public LlmcConfig withStream(Boolean enabled) {
        return new LlmcConfig(providers, aliases, defaultProvider, defaultModel, systemPrompt, maxTokens, temperature,
            enabled, templates);
    }

    public LlmcConfig withTemplate(String name, String prompt) {
        if (name == null || name.isBlank()) {
            throw new ConfigException("Template name must not be empty");
        }
        if (prompt == null || prompt.isBlank()) {
            throw new ConfigException("Template '" + name + "' must have a prompt");
        }
        Map<String, String> updated = new LinkedHashMap<>(templates);
        updated.put(name.trim(), prompt);
        return withTemplates(updated);
    }

    public LlmcConfig withoutTemplate(String name) {
        if (!templates.containsKey(name)) {
            throw new ConfigException("Template '" + name + "' not found");
        }
        Map<String, String> updated = new LinkedHashMap<>(templates);
        updated.remove(name);
        return withTemplates(updated);
    }

    /**
     * Expands {@code t:<name>} to the stored template prompt. Anything else, including an unknown template name, is
     * returned unchanged.
     */
    public String resolveTemplateOrPrompt(String input) {
        if (input == null || !input.startsWith(TEMPLATE_PREFIX)) {
            return input;
        }
        String stored = templates.get(input.substring(TEMPLATE_PREFIX.length()));
        return stored == null ? input : stored;
    }

    /**
     * Parses token counts such as {@code 2048} or {@code 2k}.
     */
    public static int parseMaxTokens(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        try {
            int tokens = value.endsWith("k")
                ? (int) (Float.parseFloat(value.substring(0, value.length() - 1)) * 1000)
                : Integer.parseInt(value);
            if (tokens <= 0) {
                throw new ConfigException("Max tokens must be positive, got '" + raw + "'");
            }
            return tokens;
        } catch (NumberFormatException e) {
            throw new ConfigException("Invalid max_tokens format: '" + raw + "'", e);
        }
    }

    public static double parseTemperature(String raw) {
        try {
            return Double.parseDouble(raw == null ? "" : raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("Invalid temperature format: '" + raw + "'", e);
        }
    }

    private LlmcConfig withTemplates(Map<String, String> newTemplates) {
        return new LlmcConfig(providers, aliases, defaultProvider, defaultModel, systemPrompt, maxTokens, temperature,
            stream, newTemplates);
    }
}
