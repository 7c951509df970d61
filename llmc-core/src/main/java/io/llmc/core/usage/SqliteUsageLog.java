package io.llmc.core.usage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SqliteUsageLog implements UsageSink {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteUsageLog.class);

    // Fixed width so that text comparison orders rows chronologically.
    private static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final String jdbcUrl;

    public SqliteUsageLog(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        init();
    }

    @Override
    public void record(UsageRecord record) {
        try {
            append(record);
        } catch (IOException e) {
            LOG.warn("Failed to record usage for {}:{}: {}", record.provider(), record.model(), e.getMessage());
        }
    }

    public synchronized void append(UsageRecord record) throws IOException {
        String sql = """
            INSERT INTO usage_records (recorded_at, provider, model, input_tokens, output_tokens)
            VALUES (?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, TIMESTAMP.format(record.timestamp()));
            statement.setString(2, record.provider());
            statement.setString(3, record.model());
            statement.setLong(4, record.inputTokens());
            statement.setLong(5, record.outputTokens());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to append usage record", e);
        }
    }

    public synchronized List<UsageRecord> list(Instant since) throws IOException {
        String sql = """
            SELECT recorded_at, provider, model, input_tokens, output_tokens
            FROM usage_records
            WHERE recorded_at >= ?
            ORDER BY recorded_at ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, TIMESTAMP.format(since));
            try (ResultSet resultSet = statement.executeQuery()) {
                List<UsageRecord> records = new ArrayList<>();
                while (resultSet.next()) {
                    records.add(new UsageRecord(
                        resultSet.getString("provider"),
                        resultSet.getString("model"),
                        resultSet.getLong("input_tokens"),
                        resultSet.getLong("output_tokens"),
                        Instant.parse(resultSet.getString("recorded_at"))
                    ));
                }
                return records;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list usage records", e);
        }
    }

    public synchronized List<UsageSummary> summarize(Instant since) throws IOException {
        String sql = """
            SELECT provider, model, COUNT(*) AS requests,
                   SUM(input_tokens) AS input_tokens, SUM(output_tokens) AS output_tokens
            FROM usage_records
            WHERE recorded_at >= ?
            GROUP BY provider, model
            ORDER BY SUM(input_tokens) + SUM(output_tokens) DESC, provider ASC, model ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, TIMESTAMP.format(since));
            try (ResultSet resultSet = statement.executeQuery()) {
                List<UsageSummary> summaries = new ArrayList<>();
                while (resultSet.next()) {
                    summaries.add(new UsageSummary(
                        resultSet.getString("provider"),
                        resultSet.getString("model"),
                        resultSet.getLong("requests"),
                        resultSet.getLong("input_tokens"),
                        resultSet.getLong("output_tokens")
                    ));
                }
                return summaries;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to summarize usage", e);
        }
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
        String ddl = """
            CREATE TABLE IF NOT EXISTS usage_records (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                recorded_at TEXT NOT NULL,
                provider TEXT NOT NULL,
                model TEXT NOT NULL,
                input_tokens INTEGER NOT NULL,
                output_tokens INTEGER NOT NULL
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_usage_records_recorded_at
            ON usage_records(recorded_at DESC)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite usage log", e);
        }
    }
}
