package io.llmc.core.chatlog;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Question and answer history grouped by chat id, plus the id of the session the CLI continues by default.
 */
public interface ChatLog {
    void append(ChatLogEntry entry) throws IOException;

    /** Entries of one chat, oldest first. */
    List<ChatLogEntry> history(String chatId) throws IOException;

    /** Newest first; a non-positive limit returns everything. */
    List<ChatLogEntry> recent(int limit) throws IOException;

    Optional<String> currentSession() throws IOException;

    void setCurrentSession(String chatId) throws IOException;

    int clearSession(String chatId) throws IOException;

    void purge() throws IOException;

    int purgeOlderThan(Instant cutoff) throws IOException;

    int keepRecent(int count) throws IOException;

    ChatLogStats stats() throws IOException;
}
