package io.llmc.core.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.llmc.core.config.model.ChatTemplate;
import io.llmc.core.config.model.ProviderConfig;
import io.llmc.core.error.ConfigException;
import io.llmc.core.model.ChatMessage;
import io.llmc.core.model.ChatRequest;
import io.llmc.core.model.ContentPart;
import io.llmc.core.model.MessageRole;
import io.llmc.core.model.ToolCall;
import io.llmc.core.model.ToolDefinition;
import io.llmc.core.provider.Operation;
import io.llmc.core.provider.UrlResolver;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Renders the outgoing chat body for a provider. The first configured template whose pattern is found in the
 * model name wins; otherwise the OpenAI-style default is used.
 */
public final class RequestRenderer {
    public static final String DEFAULT_CHAT_TEMPLATE = """
        {
          {{#unless model_in_path}}"model": {{json model}},
          {{/unless}}"messages": {{json messages}}{{#if max_tokens}},
          "max_tokens": {{json max_tokens}}{{/if}}{{#if temperature}},
          "temperature": {{json temperature}}{{/if}}{{#if tools}},
          "tools": {{json tools}}{{/if}}{{#if stream}},
          "stream": true{{/if}}
        }
        """;

    private final TemplateEngine engine;
    private final ObjectMapper mapper;
    private final ObjectReader bodyReader;
    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    public RequestRenderer() {
        this(new TemplateEngine(), new ObjectMapper());
    }

    public RequestRenderer(TemplateEngine engine, ObjectMapper mapper) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.bodyReader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public byte[] renderRequestBody(ProviderConfig provider, String modelName, ChatRequest request) {
        Objects.requireNonNull(provider, "provider must not be null");
        request.requireMessages();
        String template = selectTemplate(provider, modelName);
        String rendered = engine.render(template, context(provider, modelName, request));
        try {
            JsonNode parsed = bodyReader.readTree(rendered);
            if (parsed == null || parsed.isMissingNode()) {
                throw new ConfigException("Chat template rendered an empty body", "chat", provider.name());
            }
            return mapper.writeValueAsBytes(parsed);
        } catch (JsonProcessingException e) {
            throw new ConfigException(
                "Chat template did not produce valid JSON for model '" + modelName + "' (provider " + provider.name() + "): "
                    + e.getOriginalMessage(),
                e
            );
        }
    }

    public String selectTemplate(ProviderConfig provider, String modelName) {
        String model = modelName == null ? "" : modelName;
        for (ChatTemplate candidate : provider.chatTemplates()) {
            if (pattern(candidate.pattern(), provider).matcher(model).find()) {
                return candidate.template();
            }
        }
        return DEFAULT_CHAT_TEMPLATE;
    }

    Map<String, Object> context(ProviderConfig provider, String modelName, ChatRequest request) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("model", modelName);
        context.put("model_in_path", UrlResolver.pathContainsModel(provider, Operation.CHAT));
        context.put("messages", toWireMessages(request.messages()));
        String systemPrompt = request.systemPrompt();
        context.put("system_prompt", systemPrompt.isEmpty() ? null : systemPrompt);
        context.put("max_tokens", request.maxTokens());
        context.put("temperature", request.temperature());
        context.put("stream", request.stream());
        context.put("tools", request.tools().isEmpty() ? null : toWireTools(request.tools()));
        context.putAll(provider.vars());
        return context;
    }

    private Pattern pattern(String regex, ProviderConfig provider) {
        try {
            return patterns.computeIfAbsent(regex, Pattern::compile);
        } catch (PatternSyntaxException e) {
            throw new ConfigException(
                "Invalid chat template pattern '" + regex + "' for provider " + provider.name() + ": " + e.getDescription(),
                e
            );
        }
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role().wireName());
            row.put("content", message.multipart() ? toWireParts(message.parts()) : message.content());
            if (message.role() == MessageRole.ASSISTANT && !message.toolCalls().isEmpty()) {
                row.put("tool_calls", toWireToolCalls(message.toolCalls()));
            }
            if (message.role() == MessageRole.TOOL && message.toolCallId() != null && !message.toolCallId().isBlank()) {
                row.put("tool_call_id", message.toolCallId());
            }
            wire.add(row);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireParts(List<ContentPart> parts) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ContentPart part : parts) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("type", part.type());
            switch (part.type()) {
                case ContentPart.IMAGE_URL -> item.put("image_url", Map.of("url", part.url()));
                case ContentPart.INPUT_AUDIO -> {
                    Map<String, Object> audio = new LinkedHashMap<>();
                    audio.put("data", part.data());
                    audio.put("format", part.format() == null ? "wav" : part.format());
                    item.put("input_audio", audio);
                }
                default -> item.put("text", part.text() == null ? "" : part.text());
            }
            wire.add(item);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireToolCalls(List<ToolCall> toolCalls) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (int i = 0; i < toolCalls.size(); i++) {
            ToolCall call = toolCalls.get(i);
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", call.name());
            function.put("arguments", toArgumentsJson(call.arguments()));

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", call.id() == null || call.id().isBlank() ? "call_" + i : call.id());
            item.put("type", "function");
            item.put("function", function);
            wire.add(item);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireTools(List<ToolDefinition> tools) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ToolDefinition tool : tools) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", tool.name());
            function.put("description", tool.description());
            function.put("parameters", tool.parameters());
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("type", "function");
            item.put("function", function);
            wire.add(item);
        }
        return wire;
    }

    private String toArgumentsJson(Map<String, Object> arguments) {
        try {
            return mapper.writeValueAsString(arguments == null ? Map.of() : arguments);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Tool call arguments are not serializable", e);
        }
    }
}
