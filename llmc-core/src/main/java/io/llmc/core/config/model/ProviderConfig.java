package io.llmc.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    String name,
    String endpoint,
    @JsonAlias({"chat_path"}) String chatPath,
    @JsonAlias({"models_path"}) String modelsPath,
    @JsonAlias({"images_path"}) String imagesPath,
    @JsonAlias({"speech_path"}) String speechPath,
    @JsonAlias({"embeddings_path"}) String embeddingsPath,
    @JsonAlias({"audio_path"}) String audioPath,
    Map<String, String> headers,
    Map<String, String> vars,
    @JsonAlias({"chat_templates"}) List<ChatTemplate> chatTemplates,
    @JsonAlias({"token_url"}) String tokenUrl,
    @JsonAlias({"auth_type"}) String authType,
    List<String> models
) {

    public static final String AUTH_GOOGLE_SA_JWT = "google_sa_jwt";

    public ProviderConfig {
        name = name == null ? "" : name.trim();
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        headers = orderedCopy(headers);
        vars = orderedCopy(vars);
        chatTemplates = chatTemplates == null ? List.of() : List.copyOf(chatTemplates);
        models = models == null ? List.of() : List.copyOf(models);
        if ((authType == null || authType.isBlank()) && endpoint.contains("aiplatform.googleapis.com")) {
            authType = AUTH_GOOGLE_SA_JWT;
        }
    }

    public static ProviderConfig of(String name, String endpoint) {
        return new ProviderConfig(name, endpoint, null, null, null, null, null, null,
            Map.of(), Map.of(), List.of(), null, null, List.of());
    }

    @JsonIgnore
    public boolean serviceAccountAuth() {
        return AUTH_GOOGLE_SA_JWT.equalsIgnoreCase(authType);
    }

    @JsonIgnore
    public boolean hasTokenUrl() {
        return tokenUrl != null && !tokenUrl.isBlank();
    }

    public ProviderConfig withName(String newName) {
        return new ProviderConfig(newName, endpoint, chatPath, modelsPath, imagesPath, speechPath, embeddingsPath,
            audioPath, headers, vars, chatTemplates, tokenUrl, authType, models);
    }

    public ProviderConfig withEndpoint(String newEndpoint) {
        return new ProviderConfig(name, newEndpoint, chatPath, modelsPath, imagesPath, speechPath, embeddingsPath,
            audioPath, headers, vars, chatTemplates, tokenUrl, authType, models);
    }

    public ProviderConfig withPath(String operation, String path) {
        String chat = chatPath;
        String modelList = modelsPath;
        String images = imagesPath;
        String speech = speechPath;
        String embeddings = embeddingsPath;
        String audio = audioPath;
        switch (operation) {
            case "chat" -> chat = path;
            case "models" -> modelList = path;
            case "images" -> images = path;
            case "speech" -> speech = path;
            case "embeddings" -> embeddings = path;
            case "audio" -> audio = path;
            default -> throw new IllegalArgumentException("Unknown operation: " + operation);
        }
        return new ProviderConfig(name, endpoint, chat, modelList, images, speech, embeddings, audio,
            headers, vars, chatTemplates, tokenUrl, authType, models);
    }

    public ProviderConfig withHeader(String header, String value) {
        Map<String, String> updated = new LinkedHashMap<>(headers);
        if (value == null) {
            updated.remove(header);
        } else {
            updated.put(header, value);
        }
        return new ProviderConfig(name, endpoint, chatPath, modelsPath, imagesPath, speechPath, embeddingsPath,
            audioPath, updated, vars, chatTemplates, tokenUrl, authType, models);
    }

    public ProviderConfig withVar(String key, String value) {
        Map<String, String> updated = new LinkedHashMap<>(vars);
        if (value == null) {
            updated.remove(key);
        } else {
            updated.put(key, value);
        }
        return new ProviderConfig(name, endpoint, chatPath, modelsPath, imagesPath, speechPath, embeddingsPath,
            audioPath, headers, updated, chatTemplates, tokenUrl, authType, models);
    }

    public ProviderConfig withChatTemplate(ChatTemplate template) {
        List<ChatTemplate> updated = new ArrayList<>();
        for (ChatTemplate existing : chatTemplates) {
            if (!existing.pattern().equals(template.pattern())) {
                updated.add(existing);
            }
        }
        updated.add(template);
        return new ProviderConfig(name, endpoint, chatPath, modelsPath, imagesPath, speechPath, embeddingsPath,
            audioPath, headers, vars, updated, tokenUrl, authType, models);
    }

    public ProviderConfig withTokenUrl(String newTokenUrl) {
        return new ProviderConfig(name, endpoint, chatPath, modelsPath, imagesPath, speechPath, embeddingsPath,
            audioPath, headers, vars, chatTemplates, newTokenUrl, authType, models);
    }

    public ProviderConfig withAuthType(String newAuthType) {
        return new ProviderConfig(name, endpoint, chatPath, modelsPath, imagesPath, speechPath, embeddingsPath,
            audioPath, headers, vars, chatTemplates, tokenUrl, newAuthType, models);
    }

    private static Map<String, String> orderedCopy(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
