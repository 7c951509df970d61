package io.llmc.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.llmc.core.config.model.LlmcConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;

public final class ConfigService {
    private static final Map<String, String> SNAKE_CASE_KEYS = Map.of(
        "default_provider", "defaultProvider",
        "default_model", "defaultModel",
        "system_prompt", "systemPrompt",
        "max_tokens", "maxTokens"
    );

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public LlmcConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return LlmcConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(LlmcConfig.defaults());
        JsonNode existingNode = canonicalKeys(mapper.readTree(Files.readString(configPath)));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, LlmcConfig.class);
    }

    public void save(Path configPath, LlmcConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path absolute = configPath.toAbsolutePath();
        Files.createDirectories(absolute.getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Path tmp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public String toPrettyJson(LlmcConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private static JsonNode canonicalKeys(JsonNode root) {
        if (!(root instanceof ObjectNode object)) {
            return root;
        }
        SNAKE_CASE_KEYS.forEach((snake, camel) -> {
            JsonNode value = object.remove(snake);
            if (value != null && !object.has(camel)) {
                object.set(camel, value);
            }
        });
        return object;
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
