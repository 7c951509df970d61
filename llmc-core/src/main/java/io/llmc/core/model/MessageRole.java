package io.llmc.core.model;

import java.util.Locale;

public enum MessageRole {
    SYSTEM("system"),
    USER("user"),
    ASSISTANT("assistant"),
    TOOL("tool");

    private final String wireName;

    MessageRole(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static MessageRole fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return USER;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "system", "developer" -> SYSTEM;
            case "assistant", "model", "chatbot" -> ASSISTANT;
            case "tool", "function" -> TOOL;
            default -> USER;
        };
    }
}
