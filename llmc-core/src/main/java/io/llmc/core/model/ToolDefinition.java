package io.llmc.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ToolDefinition(String name, String description, Map<String, Object> parameters) {

    public ToolDefinition {
        Objects.requireNonNull(name, "name must not be null");
        description = description == null ? "" : description;
        parameters = parameters == null
            ? Map.of("type", "object", "properties", Map.of())
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
