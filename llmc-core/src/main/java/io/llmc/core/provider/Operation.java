package io.llmc.core.provider;

import io.llmc.core.config.model.ProviderConfig;
import java.util.Locale;

public enum Operation {
    CHAT("chat", "/chat/completions"),
    MODELS("models", "/models"),
    IMAGES("images", "/images/generations"),
    SPEECH("speech", "/audio/speech"),
    EMBEDDINGS("embeddings", "/embeddings"),
    AUDIO("audio", "/audio/transcriptions");

    private final String key;
    private final String defaultPath;

    Operation(String key, String defaultPath) {
        this.key = key;
        this.defaultPath = defaultPath;
    }

    public String key() {
        return key;
    }

    public String defaultPath() {
        return defaultPath;
    }

    public String pathFor(ProviderConfig provider) {
        String configured = switch (this) {
            case CHAT -> provider.chatPath();
            case MODELS -> provider.modelsPath();
            case IMAGES -> provider.imagesPath();
            case SPEECH -> provider.speechPath();
            case EMBEDDINGS -> provider.embeddingsPath();
            case AUDIO -> provider.audioPath();
        };
        return configured == null || configured.isBlank() ? defaultPath : configured;
    }

    public static Operation fromKey(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (Operation operation : values()) {
            if (operation.key.equals(normalized)) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unknown operation: " + raw);
    }
}
