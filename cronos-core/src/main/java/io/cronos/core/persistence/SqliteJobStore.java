package io.cronos.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronos.core.cron.Job;
import io.cronos.core.cron.JobType;
import io.cronos.core.cron.JobValidationException;
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
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

public final class SqliteJobStore {
    private static final TypeReference<Map<String, Object>> CONFIG_MAP = new TypeReference<>() {
    };

    private final Path dbPath;
    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteJobStore(Path dbPath) throws PersistenceException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        this.dbPath = dbPath.toAbsolutePath();
        try {
            Files.createDirectories(this.dbPath.getParent());
        } catch (IOException e) {
            throw new PersistenceException("Failed to create directory for " + this.dbPath, e);
        }
        this.jdbcUrl = "jdbc:sqlite:" + this.dbPath;
        this.mapper = new ObjectMapper();
        init();
    }

    public Path path() {
        return dbPath;
    }

    public void upsertAll(Collection<Job> jobs, Collection<String> deletedIds) throws PersistenceException {
        String upsert = """
            INSERT INTO jobs (id, name, type, schedule, schedule_desc, enabled, config, last_run, next_run)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
              name = excluded.name,
              type = excluded.type,
              schedule = excluded.schedule,
              schedule_desc = excluded.schedule_desc,
              enabled = excluded.enabled,
              config = excluded.config,
              last_run = excluded.last_run,
              next_run = excluded.next_run
            """;
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement statement = connection.prepareStatement(upsert);
                 PreparedStatement delete = connection.prepareStatement("DELETE FROM jobs WHERE id = ?")) {
                for (Job job : jobs) {
                    statement.setString(1, job.id());
                    statement.setString(2, job.name());
                    statement.setString(3, job.type() == null ? null : job.type().value());
                    statement.setString(4, job.schedule());
                    statement.setString(5, job.scheduleDesc());
                    statement.setInt(6, job.enabled() ? 1 : 0);
                    statement.setString(7, mapper.writeValueAsString(job.config()));
                    setEpochSeconds(statement, 8, job.lastRun());
                    setEpochSeconds(statement, 9, job.nextRun());
                    statement.addBatch();
                }
                statement.executeBatch();
                for (String id : deletedIds) {
                    delete.setString(1, id);
                    delete.addBatch();
                }
                delete.executeBatch();
                connection.commit();
            } catch (SQLException | JsonProcessingException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new PersistenceException("Failed to save jobs to " + dbPath, e);
        }
    }

    public List<StoredJob> loadAll() throws PersistenceException {
        String sql = """
            SELECT id, name, type, schedule, schedule_desc, enabled, config, last_run, next_run
            FROM jobs
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<StoredJob> rows = new ArrayList<>();
            while (resultSet.next()) {
                rows.add(decode(resultSet));
            }
            return rows;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load jobs from " + dbPath, e);
        }
    }

    public int count() throws PersistenceException {
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT COUNT(*) FROM jobs")) {
            return resultSet.next() ? resultSet.getInt(1) : 0;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to count jobs in " + dbPath, e);
        }
    }

    private StoredJob decode(ResultSet resultSet) throws SQLException {
        String id = resultSet.getString("id");
        try {
            JobType type = JobType.fromValue(resultSet.getString("type"));
            String rawConfig = resultSet.getString("config");
            Map<String, Object> config = rawConfig == null || rawConfig.isBlank()
                ? Map.of()
                : mapper.readValue(rawConfig, CONFIG_MAP);
            Job job = new Job(
                id,
                resultSet.getString("name"),
                type,
                resultSet.getString("schedule"),
                resultSet.getString("schedule_desc"),
                resultSet.getInt("enabled") != 0,
                config,
                epochSeconds(resultSet, "last_run"),
                epochSeconds(resultSet, "next_run")
            );
            return StoredJob.decoded(job);
        } catch (JobValidationException | JsonProcessingException e) {
            return StoredJob.failed(id, "failed to decode row " + id + ": " + e.getMessage());
        }
    }

    private static void setEpochSeconds(PreparedStatement statement, int index, Instant instant) throws SQLException {
        if (instant == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setLong(index, instant.getEpochSecond());
        }
    }

    private static Instant epochSeconds(ResultSet resultSet, String column) throws SQLException {
        long value = resultSet.getLong(column);
        return resultSet.wasNull() ? null : Instant.ofEpochSecond(value);
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            // single-file journal so the backup copy of the database is always complete
            statement.execute("PRAGMA journal_mode=DELETE;");
            statement.execute("PRAGMA synchronous=FULL;");
        }
        return connection;
    }

    private void init() throws PersistenceException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS jobs (
                id TEXT PRIMARY KEY,
                name TEXT,
                type TEXT,
                schedule TEXT,
                schedule_desc TEXT,
                enabled INTEGER,
                config TEXT,
                last_run INTEGER,
                next_run INTEGER
            )
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to initialize SQLite job store at " + dbPath, e);
        }
    }
}
