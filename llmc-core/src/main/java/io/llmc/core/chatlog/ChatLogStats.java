package io.llmc.core.chatlog;

import java.time.Instant;
import java.util.Map;

/**
 * Totals over the whole log. {@code earliest} and {@code latest} are null when the log is empty; {@code modelUsage}
 * is ordered by entry count, highest first.
 */
public record ChatLogStats(
    long totalEntries,
    long uniqueSessions,
    long fileSizeBytes,
    Instant earliest,
    Instant latest,
    Map<String, Long> modelUsage
) {
}
