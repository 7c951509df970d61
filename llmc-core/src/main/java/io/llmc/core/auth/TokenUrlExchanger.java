package io.llmc.core.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmc.core.error.AuthException;
import io.llmc.core.error.TransportException;
import io.llmc.core.http.HttpResult;
import io.llmc.core.http.HttpTransport;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Trades a long-lived key for a short-lived session token: {@code GET tokenUrl} with {@code Authorization: token <key>}
 * answering {@code {"token": ..., "expires_at": <epoch seconds>}}.
 */
public final class TokenUrlExchanger {
    private final HttpTransport transport;
    private final ObjectMapper mapper;

    public TokenUrlExchanger(HttpTransport transport, ObjectMapper mapper) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public CachedToken exchange(String provider, String tokenUrl, String apiKey, Map<String, String> extraHeaders) {
        Map<String, String> headers = new LinkedHashMap<>(extraHeaders == null ? Map.of() : extraHeaders);
        headers.put("Authorization", "token " + apiKey);
        headers.put("Accept", "application/json");
        HttpResult result;
        try {
            result = transport.getUncapped(provider, "token", tokenUrl, headers);
        } catch (TransportException e) {
            throw new AuthException("Token request failed", provider, e.upstreamBody(), e);
        }
        try {
            JsonNode root = mapper.readTree(result.body());
            String token = root.path("token").asText("");
            if (token.isBlank() || !root.path("expires_at").canConvertToLong()) {
                throw new AuthException("Token response is missing token or expires_at", provider, result.bodyString(), null);
            }
            return new CachedToken(token, Instant.ofEpochSecond(root.path("expires_at").asLong()));
        } catch (IOException e) {
            throw new AuthException("Failed to parse token response", provider, result.bodyString(), e);
        }
    }
}
