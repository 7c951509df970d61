package io.llmc.core.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmc.core.error.ConfigException;
import io.llmc.core.model.ContentPart;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed template tree. Immutable and safe to render from many threads.
 */
public final class CompiledTemplate {
    private final List<Node> nodes;
    private final ObjectMapper mapper;

    CompiledTemplate(List<Node> nodes, ObjectMapper mapper) {
        this.nodes = List.copyOf(nodes);
        this.mapper = mapper;
    }

    public String render(Map<String, ?> context) {
        Objects.requireNonNull(context, "context must not be null");
        Deque<Map<String, ?>> scopes = new ArrayDeque<>();
        scopes.push(context);
        StringBuilder out = new StringBuilder();
        renderAll(nodes, scopes, out);
        return out.toString();
    }

    private void renderAll(List<Node> body, Deque<Map<String, ?>> scopes, StringBuilder out) {
        for (Node node : body) {
            if (node instanceof Text text) {
                out.append(text.value());
            } else if (node instanceof Variable variable) {
                Object value = lookup(variable.path(), scopes);
                out.append(apply(variable.helper(), value));
            } else if (node instanceof Block block) {
                renderBlock(block, scopes, out);
            }
        }
    }

    private void renderBlock(Block block, Deque<Map<String, ?>> scopes, StringBuilder out) {
        Object value = lookup(block.path(), scopes);
        switch (block.kind()) {
            case IF -> renderAll(present(value) ? block.body() : block.elseBody(), scopes, out);
            case UNLESS -> renderAll(present(value) ? block.elseBody() : block.body(), scopes, out);
            case EACH -> {
                if (!(value instanceof Collection<?> items) || items.isEmpty()) {
                    renderAll(block.elseBody(), scopes, out);
                    return;
                }
                int index = 0;
                int size = items.size();
                for (Object item : items) {
                    Map<String, Object> frame = new LinkedHashMap<>();
                    if (item instanceof Map<?, ?> map) {
                        map.forEach((key, nested) -> frame.put(String.valueOf(key), nested));
                    }
                    frame.put("this", item);
                    frame.put("@index", index);
                    frame.put("@first", index == 0);
                    frame.put("@last", index == size - 1);
                    scopes.push(frame);
                    try {
                        renderAll(block.body(), scopes, out);
                    } finally {
                        scopes.pop();
                    }
                    index++;
                }
            }
        }
    }

    private String apply(String helper, Object value) {
        if (helper == null) {
            return interpolate(value);
        }
        return switch (helper) {
            case "json" -> toJson(value);
            case "text" -> escape(plainText(value));
            case "gemini_role" -> escape(geminiRole(value));
            case "bedrock_role" -> escape("system".equals(value) ? "user" : interpolate(value));
            default -> throw new ConfigException("Unknown template helper '" + helper + "'");
        };
    }

    private String interpolate(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String string) {
            return escape(string);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        return escape(toJson(value));
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Failed to emit template value as JSON", e);
        }
    }

    private static String escape(String raw) {
        return new String(JsonStringEncoder.getInstance().quoteAsString(raw));
    }

    private static String geminiRole(Object value) {
        if ("assistant".equals(value)) {
            return "model";
        }
        if ("system".equals(value)) {
            return "user";
        }
        return value == null ? "" : String.valueOf(value);
    }

    private static String plainText(Object value) {
        if (value instanceof Map<?, ?> map && map.containsKey("content")) {
            return plainText(map.get("content"));
        }
        if (value instanceof Collection<?> parts) {
            StringBuilder builder = new StringBuilder();
            for (Object part : parts) {
                if (part instanceof Map<?, ?> map && "text".equals(map.get("type")) && map.get("text") != null) {
                    if (builder.length() > 0) {
                        builder.append(ContentPart.TEXT_SEPARATOR);
                    }
                    builder.append(map.get("text"));
                }
            }
            return builder.toString();
        }
        return value == null ? "" : String.valueOf(value);
    }

    static boolean present(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String string) {
            return !string.isEmpty();
        }
        if (value instanceof Collection<?> collection) {
            return !collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    private static Object lookup(String path, Deque<Map<String, ?>> scopes) {
        String[] segments = path.split("\\.");
        Object current = null;
        boolean found = false;
        for (Map<String, ?> scope : scopes) {
            if (scope.containsKey(segments[0])) {
                current = scope.get(segments[0]);
                found = true;
                break;
            }
        }
        if (!found) {
            return null;
        }
        for (int i = 1; i < segments.length; i++) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segments[i]);
        }
        return current;
    }

    interface Node {
    }

    record Text(String value) implements Node {
    }

    record Variable(String helper, String path) implements Node {
    }

    enum BlockKind {
        IF,
        UNLESS,
        EACH
    }

    record Block(BlockKind kind, String path, List<Node> body, List<Node> elseBody) implements Node {
    }
}
