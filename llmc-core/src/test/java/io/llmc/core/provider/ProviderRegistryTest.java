package io.llmc.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.llmc.core.config.model.ProviderConfig;
import io.llmc.core.error.ConfigException;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ProviderRegistryTest {

    @Test
    void shouldAddFindAndRemoveProviders() {
        ProviderRegistry registry = new ProviderRegistry();
        registry.add(ProviderConfig.of("openai", "https://api.openai.com/v1"));
        registry.add(ProviderConfig.of("ollama", "http://localhost:11434/v1"));

        assertThat(registry.names()).containsExactly("openai", "ollama");
        assertThat(registry.require("ollama").endpoint()).isEqualTo("http://localhost:11434/v1");
        assertThat(registry.remove("openai")).isTrue();
        assertThat(registry.remove("openai")).isFalse();
        assertThat(registry.find("openai")).isEmpty();
        assertThat(registry.contains("ollama")).isTrue();
    }

    @Test
    void shouldRejectDuplicateAndUnknownUpdates() {
        ProviderRegistry registry = new ProviderRegistry(List.of(ProviderConfig.of("openai", "https://a")));

        assertThatThrownBy(() -> registry.add(ProviderConfig.of("openai", "https://b")))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("already exists");
        assertThatThrownBy(() -> registry.update(ProviderConfig.of("other", "https://b")))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("Provider 'other' not found");
        assertThatThrownBy(() -> registry.add(ProviderConfig.of("  ", "https://b")))
            .isInstanceOf(ConfigException.class);
    }

    @Test
    void shouldReplaceProviderOnUpdate() {
        ProviderRegistry registry = new ProviderRegistry(List.of(ProviderConfig.of("openai", "https://a")));

        registry.update(registry.require("openai").withEndpoint("https://b"));

        assertThat(registry.require("openai").endpoint()).isEqualTo("https://b");
    }

    @Test
    void shouldServeReadsWhileWritersMutate() throws Exception {
        ProviderRegistry registry = new ProviderRegistry(List.of(ProviderConfig.of("stable", "https://s")));
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        try {
            for (int t = 0; t < 2; t++) {
                int offset = t;
                executor.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        String name = "p" + offset + "-" + i;
                        registry.add(ProviderConfig.of(name, "https://x"));
                        registry.remove(name);
                    }
                    done.countDown();
                });
                executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        assertThat(registry.require("stable").endpoint()).isEqualTo("https://s");
                        registry.all();
                    }
                    done.countDown();
                });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }
        assertThat(registry.names()).containsExactly("stable");
    }
}
