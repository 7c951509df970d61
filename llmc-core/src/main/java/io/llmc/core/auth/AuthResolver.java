package io.llmc.core.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmc.core.config.model.ProviderConfig;
import io.llmc.core.error.AuthException;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a provider's configured headers plus its credential into the headers of an outgoing request.
 */
public final class AuthResolver {
    static final String API_KEY_PLACEHOLDER = "${api_key}";
    static final Duration REFRESH_MARGIN = Duration.ofSeconds(60);

    private final CredentialStore credentials;
    private final TokenCache tokenCache;
    private final ServiceAccountTokenExchanger serviceAccounts;
    private final TokenUrlExchanger tokenUrls;
    private final ObjectMapper mapper;
    private final Clock clock;

    public AuthResolver(
        CredentialStore credentials,
        TokenCache tokenCache,
        ServiceAccountTokenExchanger serviceAccounts,
        TokenUrlExchanger tokenUrls,
        ObjectMapper mapper,
        Clock clock
    ) {
        this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
        this.tokenCache = Objects.requireNonNull(tokenCache, "tokenCache must not be null");
        this.serviceAccounts = Objects.requireNonNull(serviceAccounts, "serviceAccounts must not be null");
        this.tokenUrls = Objects.requireNonNull(tokenUrls, "tokenUrls must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Map<String, String> prepareHeaders(ProviderConfig provider) {
        Optional<AuthCredential> credential;
        try {
            credential = credentials.find(provider.name());
        } catch (IOException e) {
            throw new AuthException("Failed to read credentials: " + e.getMessage(), provider.name(), null, e);
        }
        return prepareHeaders(provider, credential.orElse(null));
    }

    public Map<String, String> prepareHeaders(ProviderConfig provider, AuthCredential credential) {
        Objects.requireNonNull(provider, "provider must not be null");
        Map<String, String> headers = new LinkedHashMap<>(provider.headers());
        AuthCredential effective = provider.serviceAccountAuth() ? asServiceAccount(provider, credential) : credential;

        if (effective == null) {
            requireNoCredentialNeeded(provider, headers);
            return headers;
        }
        if (effective instanceof AuthCredential.ApiKeyBearer apiKey) {
            return withApiKey(provider, headers, apiKey.secret());
        }
        if (effective instanceof AuthCredential.CustomHeader custom) {
            headers.put(custom.name(), custom.value());
            return headers;
        }
        if (effective instanceof AuthCredential.OAuthToken oauth) {
            if (oauth.expired(clock.instant())) {
                throw new AuthException("OAuth token expired at " + oauth.expiresAt(), provider.name());
            }
            headers.put("Authorization", "Bearer " + oauth.token());
            return headers;
        }
        if (effective instanceof AuthCredential.ServiceAccount account) {
            CachedToken token = tokenCache.getOrRefresh(
                "service-account:" + provider.name(),
                REFRESH_MARGIN,
                () -> serviceAccounts.exchange(provider.name(), account, provider.tokenUrl())
            );
            headers.put("Authorization", "Bearer " + token.token());
            return headers;
        }
        throw new AuthException("Unsupported credential type " + effective.getClass().getSimpleName(), provider.name());
    }

    private Map<String, String> withApiKey(ProviderConfig provider, Map<String, String> headers, String key) {
        if (key.isBlank()) {
            throw new AuthException("API key is empty", provider.name());
        }
        if (provider.hasTokenUrl()) {
            CachedToken token = tokenCache.getOrRefresh(
                "token-url:" + provider.name(),
                Duration.ZERO,
                () -> tokenUrls.exchange(provider.name(), provider.tokenUrl(), key, substituted(provider.headers(), key))
            );
            Map<String, String> result = substituted(headers, key);
            result.put("Authorization", "Bearer " + token.token());
            return result;
        }
        if (containsPlaceholder(headers)) {
            return substituted(headers, key);
        }
        headers.put("Authorization", "Bearer " + key);
        return headers;
    }

    private AuthCredential asServiceAccount(ProviderConfig provider, AuthCredential credential) {
        if (credential == null) {
            throw new AuthException("Service account credential not set", provider.name());
        }
        if (credential instanceof AuthCredential.ServiceAccount) {
            return credential;
        }
        if (credential instanceof AuthCredential.ApiKeyBearer apiKey && apiKey.secret().trim().startsWith("{")) {
            return parseServiceAccountJson(provider.name(), apiKey.secret());
        }
        return credential;
    }

    public AuthCredential.ServiceAccount parseServiceAccountJson(String provider, String json) {
        try {
            JsonNode root = mapper.readTree(json);
            if (!"service_account".equals(root.path("type").asText())) {
                throw new AuthException("Provided key is not a service_account", provider);
            }
            String email = root.path("client_email").asText("");
            String privateKey = root.path("private_key").asText("");
            if (email.isBlank() || privateKey.isBlank()) {
                throw new AuthException("Service account JSON is missing client_email or private_key", provider);
            }
            return new AuthCredential.ServiceAccount(email, privateKey, null, root.path("token_uri").asText(null));
        } catch (IOException e) {
            throw new AuthException("Invalid service account JSON: " + e.getMessage(), provider, null, e);
        }
    }

    private void requireNoCredentialNeeded(ProviderConfig provider, Map<String, String> headers) {
        if (containsPlaceholder(headers) || provider.hasTokenUrl()) {
            throw new AuthException("No API key configured", provider.name());
        }
    }

    private static boolean containsPlaceholder(Map<String, String> headers) {
        for (String value : headers.values()) {
            if (value != null && value.contains(API_KEY_PLACEHOLDER)) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, String> substituted(Map<String, String> headers, String key) {
        Map<String, String> result = new LinkedHashMap<>();
        headers.forEach((name, value) -> result.put(name, value == null ? "" : value.replace(API_KEY_PLACEHOLDER, key)));
        return result;
    }
}
