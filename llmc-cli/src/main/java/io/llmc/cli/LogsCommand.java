package io.llmc.cli;

import io.llmc.core.chatlog.ChatLog;
import io.llmc.core.chatlog.ChatLogEntry;
import io.llmc.core.chatlog.ChatLogStats;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(name = "logs", description = "Inspect and purge the chat log")
public final class LogsCommand implements Runnable {
    private static final int PREVIEW_LENGTH = 50;

    private final CliContext context;

    @Spec
    CommandSpec spec;

    public LogsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }

    @Command(name = "show", description = "Show every logged exchange, newest first")
    int show(@Option(names = "--minimal", description = "One line per exchange") boolean minimal) {
        try {
            List<ChatLogEntry> entries = context.openChatLog().recent(0);
            if (entries.isEmpty()) {
                System.out.println("No chat logs found.");
                return 0;
            }
            for (ChatLogEntry entry : entries) {
                if (minimal) {
                    System.out.printf("%-36s %-30s %s%n", entry.chatId(), entry.model(), preview(entry.question()));
                } else {
                    printEntry(entry);
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Logs show failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "recent", description = "Show recent exchanges, or one field of the last one")
    int recent(
        @Option(names = {"-n", "--count"}, defaultValue = "10", description = "Entries to show") int count,
        @Parameters(index = "0", arity = "0..1", paramLabel = "FIELD",
            description = "answer, question, model or session of the last exchange") String field
    ) {
        try {
            List<ChatLogEntry> entries = context.openChatLog().recent(field == null ? Math.max(1, count) : 1);
            if (entries.isEmpty()) {
                System.out.println("No chat logs found.");
                return field == null ? 0 : 1;
            }
            if (field == null) {
                entries.forEach(LogsCommand::printEntry);
                return 0;
            }
            ChatLogEntry last = entries.get(0);
            switch (field) {
                case "answer", "a" -> System.out.println(last.response());
                case "question", "q" -> System.out.println(last.question());
                case "model", "m" -> System.out.println(last.model());
                case "session", "s" -> System.out.println(last.chatId());
                default -> {
                    System.err.println("Unknown field '" + field + "'. Use answer, question, model or session.");
                    return 1;
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Logs recent failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "current", description = "Show the exchanges of the current session")
    int current() {
        try {
            ChatLog chatLog = context.openChatLog();
            Optional<String> session = chatLog.currentSession();
            if (session.isEmpty()) {
                System.out.println("No current session.");
                return 0;
            }
            System.out.println("Session " + session.get());
            chatLog.history(session.get()).forEach(LogsCommand::printEntry);
            return 0;
        } catch (Exception e) {
            System.err.println("Logs current failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "stats", description = "Show chat log statistics")
    int stats() {
        try {
            ChatLogStats stats = context.openChatLog().stats();
            System.out.println("Entries:  " + stats.totalEntries());
            System.out.println("Sessions: " + stats.uniqueSessions());
            System.out.println("Size:     " + stats.fileSizeBytes() + " bytes");
            if (stats.earliest() != null) {
                System.out.println("Range:    " + stats.earliest() + " .. " + stats.latest());
            }
            stats.modelUsage().forEach((model, entries) -> System.out.printf("  %-40s %d%n", model, entries));
            return 0;
        } catch (Exception e) {
            System.err.println("Logs stats failed: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "purge", description = "Delete chat logs: everything, by age, or all but the newest")
    int purge(
        @Option(names = "--yes", description = "Confirm deleting every entry") boolean yes,
        @Option(names = "--older-than-days", description = "Delete entries older than this many days") Integer olderThanDays,
        @Option(names = "--keep-recent", description = "Keep only this many newest entries") Integer keepRecent
    ) {
        try {
            ChatLog chatLog = context.openChatLog();
            if (olderThanDays == null && keepRecent == null) {
                if (!yes) {
                    System.err.println("Refusing to delete every chat log without --yes");
                    return 1;
                }
                chatLog.purge();
                System.out.println("Purged all chat logs");
                return 0;
            }
            int removed = 0;
            if (olderThanDays != null) {
                removed += chatLog.purgeOlderThan(Instant.now().minus(Duration.ofDays(Math.max(0, olderThanDays))));
            }
            if (keepRecent != null) {
                removed += chatLog.keepRecent(keepRecent);
            }
            System.out.println("Purged " + removed + " chat log entries");
            return 0;
        } catch (Exception e) {
            System.err.println("Logs purge failed: " + e.getMessage());
            return 1;
        }
    }

    private static void printEntry(ChatLogEntry entry) {
        System.out.println("[" + entry.timestamp() + "] " + entry.chatId() + " " + entry.model());
        System.out.println("Q: " + entry.question());
        System.out.println("A: " + entry.response());
        if (entry.inputTokens() != null || entry.outputTokens() != null) {
            System.out.println("Tokens: " + valueOrDash(entry.inputTokens()) + " in / " + valueOrDash(entry.outputTokens()) + " out");
        }
        System.out.println();
    }

    private static String valueOrDash(Long value) {
        return value == null ? "-" : String.valueOf(value);
    }

    private static String preview(String text) {
        String flat = text.replace('\n', ' ');
        return flat.length() > PREVIEW_LENGTH ? flat.substring(0, PREVIEW_LENGTH) + "..." : flat;
    }
}
