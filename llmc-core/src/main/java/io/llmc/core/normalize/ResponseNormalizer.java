package io.llmc.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmc.core.error.UpstreamFormatException;
import io.llmc.core.model.ChatResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Detects which known shape a chat response has and converts it to {@link ChatResponse}. Stateless.
 */
public final class ResponseNormalizer {
    private final ObjectMapper mapper;

    public ResponseNormalizer() {
        this(new ObjectMapper());
    }

    public ResponseNormalizer(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public ChatResponse parse(byte[] body, String provider) {
        return parse(readTree(body, provider), body, provider);
    }

    public ResponseFormat detect(byte[] body, String provider) {
        JsonNode root = readTree(body, provider);
        return match(root).map(Detection::format).orElseThrow(() -> unknownShape(body, provider));
    }

    public ChatResponse parse(JsonNode root, byte[] rawBody, String provider) {
        return match(root).map(Detection::response).orElseThrow(() -> unknownShape(rawBody, provider));
    }

    public Optional<ChatResponse> tryParse(JsonNode root) {
        return match(root).map(Detection::response);
    }

    private Optional<Detection> match(JsonNode root) {
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        for (ResponseFormat format : ResponseFormat.values()) {
            Optional<ChatResponse> parsed = format.tryParse(root);
            if (parsed.isPresent()) {
                return Optional.of(new Detection(format, parsed.get()));
            }
        }
        return Optional.empty();
    }

    private JsonNode readTree(byte[] body, String provider) {
        try {
            return mapper.readTree(body == null ? new byte[0] : body);
        } catch (IOException e) {
            throw new UpstreamFormatException("Upstream response is not valid JSON", "chat", provider, asString(body));
        }
    }

    private UpstreamFormatException unknownShape(byte[] body, String provider) {
        return new UpstreamFormatException("Unrecognized chat response format", "chat", provider, asString(body));
    }

    private static String asString(byte[] body) {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    private record Detection(ResponseFormat format, ChatResponse response) {
    }
}
