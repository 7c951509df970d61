package io.llmc.core.auth;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import java.time.Instant;
import java.util.Objects;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(AuthCredential.ApiKeyBearer.class),
    @JsonSubTypes.Type(AuthCredential.CustomHeader.class),
    @JsonSubTypes.Type(AuthCredential.OAuthToken.class),
    @JsonSubTypes.Type(AuthCredential.ServiceAccount.class)
})
public interface AuthCredential {

    String DEFAULT_TOKEN_URI = "https://oauth2.googleapis.com/token";
    String DEFAULT_SCOPE = "https://www.googleapis.com/auth/cloud-platform";

    @JsonTypeName("api_key")
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ApiKeyBearer(String secret) implements AuthCredential {
        public ApiKeyBearer {
            Objects.requireNonNull(secret, "secret must not be null");
        }
    }

    @JsonTypeName("header")
    @JsonIgnoreProperties(ignoreUnknown = true)
    record CustomHeader(String name, String value) implements AuthCredential {
        public CustomHeader {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    @JsonTypeName("oauth")
    @JsonIgnoreProperties(ignoreUnknown = true)
    record OAuthToken(String token, @JsonAlias({"expires_at"}) Instant expiresAt) implements AuthCredential {
        public OAuthToken {
            Objects.requireNonNull(token, "token must not be null");
        }

        public boolean expired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }

    @JsonTypeName("service_account")
    @JsonIgnoreProperties(ignoreUnknown = true)
    record ServiceAccount(
        @JsonAlias({"client_email"}) String clientEmail,
        @JsonAlias({"private_key"}) String privateKeyPem,
        String scope,
        @JsonAlias({"token_uri"}) String tokenUri
    ) implements AuthCredential {
        public ServiceAccount {
            Objects.requireNonNull(clientEmail, "clientEmail must not be null");
            Objects.requireNonNull(privateKeyPem, "privateKeyPem must not be null");
            scope = scope == null || scope.isBlank() ? DEFAULT_SCOPE : scope;
            tokenUri = tokenUri == null || tokenUri.isBlank() ? DEFAULT_TOKEN_URI : tokenUri;
        }
    }
}
