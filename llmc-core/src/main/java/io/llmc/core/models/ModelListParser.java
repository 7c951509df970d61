package io.llmc.core.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmc.core.error.UpstreamFormatException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Reads model listings shaped as {@code {"data": [...]}}, {@code {"models": [...]}} or a bare array, whose items are
 * either strings or objects.
 */
public final class ModelListParser {
    private final ObjectMapper mapper;

    public ModelListParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public List<ModelMetadata> parse(byte[] body, String provider) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new UpstreamFormatException("Model list is not valid JSON", "models", provider, text(body));
        }
        JsonNode items = root == null ? null : root.isArray() ? root
            : root.path("data").isArray() ? root.path("data")
            : root.path("models").isArray() ? root.path("models")
            : null;
        if (items == null) {
            throw new UpstreamFormatException("Unrecognized model list format", "models", provider, text(body));
        }
        List<ModelMetadata> models = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (JsonNode item : items) {
            ModelMetadata metadata = item.isTextual() ? ModelMetadata.of(item.asText()) : fromObject(item);
            if (metadata != null && !metadata.id().isBlank() && seen.add(metadata.id())) {
                models.add(metadata);
            }
        }
        return models;
    }

    private ModelMetadata fromObject(JsonNode item) {
        if (!item.isObject()) {
            return null;
        }
        String id = firstText(item, "id", "name", "model");
        if (id == null) {
            return null;
        }
        if (id.startsWith("models/")) {
            id = id.substring("models/".length());
        }
        Set<String> parameters = strings(item.path("supported_parameters"));
        Set<String> inputModalities = strings(item.path("architecture").path("input_modalities"));
        JsonNode capabilities = item.path("capabilities");
        JsonNode topProvider = item.path("top_provider");
        String displayName = firstText(item, "display_name", "displayName", "name");
        String description = firstText(item, "description");
        Integer contextLength = firstInt(item, "context_length", "context_window", "inputTokenLimit", "max_input_tokens");
        Integer maxOutput = firstInt(item, "max_output_tokens", "max_completion_tokens", "outputTokenLimit");
        return new ModelMetadata(
            id,
            displayName,
            description,
            firstText(item, "owned_by"),
            item.path("created").canConvertToLong() ? item.path("created").asLong() : null,
            contextLength != null ? contextLength : firstInt(topProvider, "context_length"),
            firstInt(item, "max_input_tokens", "inputTokenLimit"),
            maxOutput != null ? maxOutput : firstInt(topProvider, "max_completion_tokens"),
            perMillion(item.path("pricing").path("prompt")),
            perMillion(item.path("pricing").path("completion")),
            parameters.contains("tools") || capabilities.path("tool_calling").asBoolean(false)
                || capabilities.path("function_calling").asBoolean(false),
            inputModalities.contains("image") || capabilities.path("vision").asBoolean(false),
            inputModalities.contains("audio") || capabilities.path("audio").asBoolean(false),
            parameters.contains("reasoning") || capabilities.path("reasoning").asBoolean(false),
            capabilities.path("completion_fim").asBoolean(false) || capabilities.path("optimized_for_code").asBoolean(false)
                || looksLikeCodeModel(id, displayName, description),
            true
        );
    }

    private static boolean looksLikeCodeModel(String id, String displayName, String description) {
        String name = (id + " " + (displayName == null ? "" : displayName)).toLowerCase(Locale.ROOT);
        if (name.contains("code")) {
            return true;
        }
        String about = description == null ? "" : description.toLowerCase(Locale.ROOT);
        return about.contains("code") || about.contains("programming");
    }

    private static String firstText(JsonNode item, String... fields) {
        for (String field : fields) {
            JsonNode value = item.path(field);
            if (value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private static Integer firstInt(JsonNode item, String... fields) {
        for (String field : fields) {
            JsonNode value = item.path(field);
            if (value.canConvertToInt()) {
                return value.asInt();
            }
        }
        return null;
    }

    private static Double perMillion(JsonNode perToken) {
        if (perToken.isMissingNode() || perToken.isNull()) {
            return null;
        }
        try {
            return Double.parseDouble(perToken.asText()) * 1_000_000;
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    private static Set<String> strings(JsonNode array) {
        Set<String> values = new LinkedHashSet<>();
        for (JsonNode value : array) {
            values.add(value.asText());
        }
        return values;
    }

    private static String text(byte[] body) {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }
}
