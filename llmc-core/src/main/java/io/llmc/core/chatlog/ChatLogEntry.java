package io.llmc.core.chatlog;

import io.llmc.core.model.ChatMessage;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record ChatLogEntry(
    String chatId,
    String model,
    String question,
    String response,
    Instant timestamp,
    Long inputTokens,
    Long outputTokens
) {

    public ChatLogEntry {
        Objects.requireNonNull(chatId, "chatId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        model = model == null ? "" : model;
        question = question == null ? "" : question;
        response = response == null ? "" : response;
    }

    /** Replays a chat as alternating user and assistant messages. */
    public static List<ChatMessage> transcript(List<ChatLogEntry> history) {
        List<ChatMessage> messages = new ArrayList<>(history.size() * 2);
        for (ChatLogEntry entry : history) {
            messages.add(ChatMessage.user(entry.question()));
            messages.add(ChatMessage.assistant(entry.response()));
        }
        return messages;
    }
}
