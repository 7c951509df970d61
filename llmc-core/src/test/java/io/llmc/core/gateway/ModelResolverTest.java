package io.llmc.core.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.llmc.core.client.ModelTarget;
import io.llmc.core.config.model.ProviderConfig;
import io.llmc.core.error.ConfigException;
import io.llmc.core.error.GatewayException;
import io.llmc.core.provider.ProviderRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ModelResolverTest {
    private final ProviderRegistry registry = new ProviderRegistry(List.of(
        ProviderConfig.of("openai", "https://api.openai.com/v1"),
        ProviderConfig.of("ollama", "http://localhost:11434/v1")
    ));
    private final ModelResolver resolver = new ModelResolver(registry, Map.of(
        "fast", "openai:gpt-4o-mini",
        "llama", "ollama:llama3:8b",
        "broken", "nocolon",
        "dangling", "gone:model"
    ));

    @Test
    void shouldResolveAliasesBeforeProviderPrefixes() {
        assertThat(resolver.resolve("fast", "")).isEqualTo(new ModelTarget("openai", "gpt-4o-mini"));
        assertThat(resolver.resolve("llama", "")).isEqualTo(new ModelTarget("ollama", "llama3:8b"));
    }

    @Test
    void shouldSplitProviderPrefixAtFirstColon() {
        assertThat(resolver.resolve("ollama:llama3:8b", "")).isEqualTo(new ModelTarget("ollama", "llama3:8b"));
        assertThat(resolver.resolve("openai:gpt-4o", "ollama")).isEqualTo(new ModelTarget("openai", "gpt-4o"));
    }

    @Test
    void shouldUseFallbackProviderForBareOrUnknownPrefixedModels() {
        assertThat(resolver.resolve("llama3:8b", "ollama")).isEqualTo(new ModelTarget("ollama", "llama3:8b"));
        assertThat(resolver.resolve("gpt-4o", "openai")).isEqualTo(new ModelTarget("openai", "gpt-4o"));
    }

    @Test
    void shouldRejectAmbiguousModels() {
        assertThatThrownBy(() -> resolver.resolve("gpt-4o", ""))
            .isInstanceOf(GatewayException.class)
            .hasMessageContaining("ambiguous model")
            .satisfies(error -> assertThat(((GatewayException) error).status()).isEqualTo(400));
        assertThatThrownBy(() -> resolver.resolve("", "openai")).isInstanceOf(GatewayException.class);
    }

    @Test
    void shouldRejectBrokenAliasesAndUnknownFallbacks() {
        assertThatThrownBy(() -> resolver.resolve("broken", "")).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> resolver.resolve("dangling", ""))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("Provider 'gone' not found");
        assertThatThrownBy(() -> resolver.resolve("gpt-4o", "gone")).isInstanceOf(ConfigException.class);
    }

    @Test
    void shouldApplyGatewayFilter() {
        GatewayFilter filter = new GatewayFilter("ollama", "llama3:8b", null);

        assertThat(resolver.resolve("llama3:8b", filter)).isEqualTo(new ModelTarget("ollama", "llama3:8b"));
        assertThat(resolver.resolve("", filter)).isEqualTo(new ModelTarget("ollama", "llama3:8b"));
        assertThat(resolver.resolve("llama", filter)).isEqualTo(new ModelTarget("ollama", "llama3:8b"));
        assertThatThrownBy(() -> resolver.resolve("openai:gpt-4o", filter))
            .isInstanceOf(GatewayException.class)
            .hasMessageContaining("filter mismatch");
        assertThatThrownBy(() -> resolver.resolve("mistral", filter))
            .isInstanceOf(GatewayException.class)
            .hasMessageContaining("gateway model filter");
    }

    @Test
    void shouldGenerateDistinctKeys() {
        String first = ApiKeyGenerator.generate();

        assertThat(first).startsWith("sk-").hasSize(35).matches("sk-[A-Za-z0-9]{32}");
        assertThat(ApiKeyGenerator.generate()).isNotEqualTo(first);
    }
}
