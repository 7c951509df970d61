package io.llmc.core.template;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmc.core.error.ConfigException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Logic-less templates with a closed token set:
 * <ul>
 *   <li>{@code {{name}}} interpolates a value, JSON-string escaped</li>
 *   <li>{@code {{helper name}}} applies one of {@code json}, {@code text}, {@code gemini_role}, {@code bedrock_role}</li>
 *   <li>{@code {{#if name}}}, {@code {{#unless name}}} and {@code {{#each name}}} blocks, each with an optional
 *       {@code {{else}}}, closed by {@code {{/if}}}, {@code {{/unless}}} or {@code {{/each}}}</li>
 * </ul>
 * Inside {@code each}, item fields resolve first and {@code this}, {@code @index}, {@code @first} and
 * {@code @last} are bound.
 */
public final class TemplateEngine {
    private static final Set<String> HELPERS = Set.of("json", "text", "gemini_role", "bedrock_role");
    private static final Pattern PATH = Pattern.compile("@?[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private final ObjectMapper mapper;
    private final Map<String, CompiledTemplate> cache = new ConcurrentHashMap<>();

    public TemplateEngine() {
        this(new ObjectMapper());
    }

    public TemplateEngine(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String render(String source, Map<String, ?> context) {
        return compile(source).render(context);
    }

    public CompiledTemplate compile(String source) {
        if (source == null) {
            throw new ConfigException("Template must not be null");
        }
        return cache.computeIfAbsent(source, this::parse);
    }

    private CompiledTemplate parse(String source) {
        Deque<OpenBlock> open = new ArrayDeque<>();
        List<CompiledTemplate.Node> root = new ArrayList<>();
        int position = 0;
        while (position < source.length()) {
            int start = source.indexOf("{{", position);
            if (start < 0) {
                current(open, root).add(new CompiledTemplate.Text(source.substring(position)));
                break;
            }
            if (start > position) {
                current(open, root).add(new CompiledTemplate.Text(source.substring(position, start)));
            }
            int end = source.indexOf("}}", start + 2);
            if (end < 0) {
                throw new ConfigException("Unterminated template tag at offset " + start);
            }
            String tag = source.substring(start + 2, end).trim();
            handleTag(tag, open, root, start);
            position = end + 2;
        }
        if (!open.isEmpty()) {
            throw new ConfigException("Unclosed template block '#" + open.peek().kind.name().toLowerCase() + "'");
        }
        return new CompiledTemplate(root, mapper);
    }

    private void handleTag(String tag, Deque<OpenBlock> open, List<CompiledTemplate.Node> root, int offset) {
        if (tag.startsWith("#")) {
            String[] parts = tag.substring(1).trim().split("\\s+");
            if (parts.length != 2) {
                throw new ConfigException("Malformed block tag '{{" + tag + "}}' at offset " + offset);
            }
            CompiledTemplate.BlockKind kind = blockKind(parts[0], tag, offset);
            open.push(new OpenBlock(kind, requirePath(parts[1], tag, offset)));
            return;
        }
        if (tag.startsWith("/")) {
            String name = tag.substring(1).trim();
            if (open.isEmpty() || !open.peek().kind.name().equalsIgnoreCase(name)) {
                throw new ConfigException("Unexpected closing tag '{{" + tag + "}}' at offset " + offset);
            }
            OpenBlock closed = open.pop();
            current(open, root).add(new CompiledTemplate.Block(closed.kind, closed.path, closed.body, closed.elseBody));
            return;
        }
        if ("else".equals(tag)) {
            if (open.isEmpty() || open.peek().inElse) {
                throw new ConfigException("Unexpected '{{else}}' at offset " + offset);
            }
            open.peek().inElse = true;
            return;
        }
        String[] parts = tag.split("\\s+");
        if (parts.length == 1) {
            current(open, root).add(new CompiledTemplate.Variable(null, requirePath(parts[0], tag, offset)));
        } else if (parts.length == 2 && HELPERS.contains(parts[0])) {
            current(open, root).add(new CompiledTemplate.Variable(parts[0], requirePath(parts[1], tag, offset)));
        } else {
            throw new ConfigException("Unknown template tag '{{" + tag + "}}' at offset " + offset);
        }
    }

    private CompiledTemplate.BlockKind blockKind(String name, String tag, int offset) {
        return switch (name) {
            case "if" -> CompiledTemplate.BlockKind.IF;
            case "unless" -> CompiledTemplate.BlockKind.UNLESS;
            case "each" -> CompiledTemplate.BlockKind.EACH;
            default -> throw new ConfigException("Unknown block '{{" + tag + "}}' at offset " + offset);
        };
    }

    private String requirePath(String path, String tag, int offset) {
        if (!PATH.matcher(path).matches()) {
            throw new ConfigException("Invalid name in template tag '{{" + tag + "}}' at offset " + offset);
        }
        return path;
    }

    private List<CompiledTemplate.Node> current(Deque<OpenBlock> open, List<CompiledTemplate.Node> root) {
        if (open.isEmpty()) {
            return root;
        }
        OpenBlock block = open.peek();
        return block.inElse ? block.elseBody : block.body;
    }

    private static final class OpenBlock {
        private final CompiledTemplate.BlockKind kind;
        private final String path;
        private final List<CompiledTemplate.Node> body = new ArrayList<>();
        private final List<CompiledTemplate.Node> elseBody = new ArrayList<>();
        private boolean inElse;

        private OpenBlock(CompiledTemplate.BlockKind kind, String path) {
            this.kind = kind;
            this.path = path;
        }
    }
}
