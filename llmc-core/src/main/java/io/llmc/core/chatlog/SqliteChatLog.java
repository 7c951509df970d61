package io.llmc.core.chatlog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class SqliteChatLog implements ChatLog {
    private static final String CURRENT_SESSION_KEY = "current_session";

    // Fixed width so that text comparison orders rows chronologically.
    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final Path dbPath;
    private final String jdbcUrl;

    public SqliteChatLog(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.dbPath = dbPath.toAbsolutePath();
        this.jdbcUrl = "jdbc:sqlite:" + this.dbPath;
        init();
    }

    @Override
    public synchronized void append(ChatLogEntry entry) throws IOException {
        String sql = """
            INSERT INTO chat_logs (chat_id, model, question, response, recorded_at, input_tokens, output_tokens)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, entry.chatId());
            statement.setString(2, entry.model());
            statement.setString(3, entry.question());
            statement.setString(4, entry.response());
            statement.setString(5, TIMESTAMP.format(entry.timestamp()));
            setNullableLong(statement, 6, entry.inputTokens());
            setNullableLong(statement, 7, entry.outputTokens());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to append chat log entry", e);
        }
    }

    @Override
    public synchronized List<ChatLogEntry> history(String chatId) throws IOException {
        String sql = """
            SELECT chat_id, model, question, response, recorded_at, input_tokens, output_tokens
            FROM chat_logs
            WHERE chat_id = ?
            ORDER BY recorded_at ASC, id ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, chatId);
            return readEntries(statement);
        } catch (SQLException e) {
            throw new IOException("Failed to read chat history for " + chatId, e);
        }
    }

    @Override
    public synchronized List<ChatLogEntry> recent(int limit) throws IOException {
        String sql = """
            SELECT chat_id, model, question, response, recorded_at, input_tokens, output_tokens
            FROM chat_logs
            ORDER BY recorded_at DESC, id DESC
            LIMIT ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, limit > 0 ? limit : -1);
            return readEntries(statement);
        } catch (SQLException e) {
            throw new IOException("Failed to list recent chat log entries", e);
        }
    }

    @Override
    public synchronized Optional<String> currentSession() throws IOException {
        String sql = "SELECT value FROM session_state WHERE key = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, CURRENT_SESSION_KEY);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(resultSet.getString("value")) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to read current session", e);
        }
    }

    @Override
    public synchronized void setCurrentSession(String chatId) throws IOException {
        String sql = "INSERT OR REPLACE INTO session_state (key, value) VALUES (?, ?)";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, CURRENT_SESSION_KEY);
            statement.setString(2, chatId);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to store current session", e);
        }
    }

    @Override
    public synchronized int clearSession(String chatId) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM chat_logs WHERE chat_id = ?")) {
            statement.setString(1, chatId);
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to clear session " + chatId, e);
        }
    }

    @Override
    public synchronized void purge() throws IOException {
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                statement.executeUpdate("DELETE FROM chat_logs");
                statement.executeUpdate("DELETE FROM session_state");
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to purge chat logs", e);
        }
    }

    @Override
    public synchronized int purgeOlderThan(Instant cutoff) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM chat_logs WHERE recorded_at < ?")) {
            statement.setString(1, TIMESTAMP.format(cutoff));
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to purge chat logs older than " + cutoff, e);
        }
    }

    @Override
    public synchronized int keepRecent(int count) throws IOException {
        String sql = """
            DELETE FROM chat_logs
            WHERE id NOT IN (
                SELECT id FROM chat_logs ORDER BY recorded_at DESC, id DESC LIMIT ?
            )
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setInt(1, Math.max(0, count));
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to trim chat logs", e);
        }
    }

    @Override
    public synchronized ChatLogStats stats() throws IOException {
        String totals = """
            SELECT COUNT(*) AS total, COUNT(DISTINCT chat_id) AS sessions,
                   MIN(recorded_at) AS earliest, MAX(recorded_at) AS latest
            FROM chat_logs
            """;
        String perModel = """
            SELECT model, COUNT(*) AS entries
            FROM chat_logs
            GROUP BY model
            ORDER BY entries DESC, model ASC
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            long total;
            long sessions;
            Instant earliest;
            Instant latest;
            try (ResultSet resultSet = statement.executeQuery(totals)) {
                resultSet.next();
                total = resultSet.getLong("total");
                sessions = resultSet.getLong("sessions");
                earliest = parseTimestamp(resultSet.getString("earliest"));
                latest = parseTimestamp(resultSet.getString("latest"));
            }
            Map<String, Long> modelUsage = new LinkedHashMap<>();
            try (ResultSet resultSet = statement.executeQuery(perModel)) {
                while (resultSet.next()) {
                    modelUsage.put(resultSet.getString("model"), resultSet.getLong("entries"));
                }
            }
            return new ChatLogStats(total, sessions, Files.size(dbPath), earliest, latest, modelUsage);
        } catch (SQLException e) {
            throw new IOException("Failed to compute chat log statistics", e);
        }
    }

    private static List<ChatLogEntry> readEntries(PreparedStatement statement) throws SQLException {
        try (ResultSet resultSet = statement.executeQuery()) {
            List<ChatLogEntry> entries = new ArrayList<>();
            while (resultSet.next()) {
                entries.add(new ChatLogEntry(
                    resultSet.getString("chat_id"),
                    resultSet.getString("model"),
                    resultSet.getString("question"),
                    resultSet.getString("response"),
                    Instant.parse(resultSet.getString("recorded_at")),
                    nullableLong(resultSet, "input_tokens"),
                    nullableLong(resultSet, "output_tokens")
                ));
            }
            return entries;
        }
    }

    private static Long nullableLong(ResultSet resultSet, String column) throws SQLException {
        long value = resultSet.getLong(column);
        return resultSet.wasNull() ? null : value;
    }

    private static void setNullableLong(PreparedStatement statement, int index, Long value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, value);
        }
    }

    private static Instant parseTimestamp(String value) {
        return value == null ? null : Instant.parse(value);
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String logs = """
            CREATE TABLE IF NOT EXISTS chat_logs (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                chat_id TEXT NOT NULL,
                model TEXT NOT NULL,
                question TEXT NOT NULL,
                response TEXT NOT NULL,
                recorded_at TEXT NOT NULL,
                input_tokens INTEGER,
                output_tokens INTEGER
            )
            """;
        String state = """
            CREATE TABLE IF NOT EXISTS session_state (
                key TEXT PRIMARY KEY,
                value TEXT NOT NULL
            )
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(logs);
            statement.execute(state);
            statement.execute("CREATE INDEX IF NOT EXISTS idx_chat_logs_chat_id ON chat_logs(chat_id)");
            statement.execute("CREATE INDEX IF NOT EXISTS idx_chat_logs_recorded_at ON chat_logs(recorded_at DESC)");
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite chat log", e);
        }
    }
}
