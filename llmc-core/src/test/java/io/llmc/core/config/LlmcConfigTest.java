package io.llmc.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.llmc.core.config.model.LlmcConfig;
import io.llmc.core.config.model.ProviderConfig;
import io.llmc.core.error.ConfigException;
import org.junit.jupiter.api.Test;

class LlmcConfigTest {
    private final LlmcConfig base = LlmcConfig.defaults()
        .withProvider(ProviderConfig.of("openai", "https://api.openai.com/v1"));

    @Test
    void shouldAddAndRemoveAliases() {
        LlmcConfig withAlias = base.withAlias("fast", "openai:gpt-4o-mini");

        assertThat(withAlias.aliases()).containsEntry("fast", "openai:gpt-4o-mini");
        assertThat(withAlias.withoutAlias("fast").aliases()).isEmpty();
        assertThatThrownBy(() -> base.withoutAlias("fast"))
            .isInstanceOf(ConfigException.class)
            .hasMessage("Alias 'fast' not found");
    }

    @Test
    void shouldValidateAliasNamesAndTargets() {
        assertThatThrownBy(() -> base.withAlias("a:b", "openai:gpt-4o"))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("must not contain ':'");
        assertThatThrownBy(() -> base.withAlias("fast", "gpt-4o"))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("format 'provider:model'");
        assertThatThrownBy(() -> base.withAlias("fast", "openai:"))
            .isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> base.withAlias("fast", "missing:gpt-4o"))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("Provider 'missing' not found");
    }

    @Test
    void shouldKeyProvidersByMapKey() {
        LlmcConfig renamed = base.withProvider(ProviderConfig.of("local", "http://localhost:8080"));

        assertThat(renamed.providers().get("local").name()).isEqualTo("local");
        assertThat(renamed.withoutProvider("local").providers()).containsOnlyKeys("openai");
        assertThatThrownBy(() -> renamed.withoutProvider("nope")).isInstanceOf(ConfigException.class);
    }

    @Test
    void shouldAllowModelsWithColonsInAliasTargets() {
        LlmcConfig config = LlmcConfig.defaults()
            .withProvider(ProviderConfig.of("ollama", "http://localhost:11434/v1"))
            .withAlias("llama", "ollama:llama3:8b");

        assertThat(config.aliases()).containsEntry("llama", "ollama:llama3:8b");
    }

    @Test
    void shouldResolveTemplateReferencesOnly() {
        LlmcConfig config = base.withTemplate("review", "You are a strict code reviewer.");

        assertThat(config.resolveTemplateOrPrompt("t:review")).isEqualTo("You are a strict code reviewer.");
        assertThat(config.resolveTemplateOrPrompt("t:missing")).isEqualTo("t:missing");
        assertThat(config.resolveTemplateOrPrompt("plain prompt")).isEqualTo("plain prompt");
        assertThat(config.resolveTemplateOrPrompt(null)).isNull();
        assertThat(config.withoutTemplate("review").templates()).isEmpty();
        assertThatThrownBy(() -> config.withoutTemplate("nope"))
            .isInstanceOf(ConfigException.class)
            .hasMessage("Template 'nope' not found");
    }

    @Test
    void shouldParseAndValidateChatDefaults() {
        assertThat(LlmcConfig.parseMaxTokens("2k")).isEqualTo(2000);
        assertThat(LlmcConfig.parseMaxTokens("1.5K")).isEqualTo(1500);
        assertThat(LlmcConfig.parseMaxTokens("512")).isEqualTo(512);
        assertThat(LlmcConfig.parseTemperature("0.7")).isEqualTo(0.7);
        assertThatThrownBy(() -> LlmcConfig.parseMaxTokens("many"))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("Invalid max_tokens format");
        assertThatThrownBy(() -> base.withTemperature(2.5))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("between 0.0 and 2.0");
        assertThatThrownBy(() -> base.withMaxTokens(0)).isInstanceOf(ConfigException.class);
        assertThat(base.withMaxTokens(100).withMaxTokens(null).maxTokens()).isNull();
    }
}
