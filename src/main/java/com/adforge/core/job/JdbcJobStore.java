package com.adforge.core.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-backed {@link JobStore} over the {@code adforge_jobs} table.
 */
public class JdbcJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    private static final String TABLE_NAME = "adforge_jobs";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id             VARCHAR(64) NOT NULL PRIMARY KEY,
                type           VARCHAR(128) NOT NULL,
                status         VARCHAR(16) NOT NULL,
                payload        TEXT NOT NULL,
                result_summary TEXT,
                error          TEXT,
                created_at     TIMESTAMP NOT NULL,
                updated_at     TIMESTAMP NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, type, status, payload, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT id, type, status, payload, result_summary, error, created_at, updated_at
            FROM %s
            WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_RECENT_SQL = """
            SELECT id, type, status, payload, result_summary, error, created_at, updated_at
            FROM %s
            ORDER BY created_at DESC
            LIMIT ?
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s
            SET status = ?, result_summary = ?, error = ?, updated_at = ?
            WHERE id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcJobStore(DataSource dataSource, ObjectMapper objectMapper) {
        this(dataSource, objectMapper, Clock.systemUTC());
    }

    public JdbcJobStore(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Job table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public JobRecord create(String type, ObjectNode payload) {
        Instant now = clock.instant();
        ObjectNode stored = payload != null ? payload : JsonNodeFactory.instance.objectNode();
        JobRecord job = new JobRecord(UUID.randomUUID().toString(), type, JobStatus.PENDING, stored,
                null, null, now, now);
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, job.id());
            stmt.setString(2, type);
            stmt.setString(3, job.status().name());
            stmt.setString(4, serialize(stored));
            stmt.setTimestamp(5, Timestamp.from(now));
            stmt.setTimestamp(6, Timestamp.from(now));
            stmt.executeUpdate();
            log.debug("Created job '{}' of type {}", job.id(), type);
            return job;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to create job of type " + type, e);
        }
    }

    @Override
    public Optional<JobRecord> find(String jobId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load job " + jobId, e);
        }
    }

    @Override
    public JobRecord update(JobRecord job) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
            stmt.setString(1, job.status().name());
            stmt.setString(2, job.resultSummary());
            stmt.setString(3, job.error());
            stmt.setTimestamp(4, Timestamp.from(job.updatedAt() != null ? job.updatedAt() : clock.instant()));
            stmt.setString(5, job.id());
            if (stmt.executeUpdate() == 0) {
                throw new IllegalArgumentException("Unknown job " + job.id());
            }
            return job;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to update job " + job.id(), e);
        }
    }

    @Override
    public List<JobRecord> recent(int limit) {
        List<JobRecord> jobs = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RECENT_SQL)) {
            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to list recent jobs", e);
        }
        return jobs;
    }

    private String serialize(ObjectNode payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job payload", e);
        }
    }

    private JobRecord fromResultSet(ResultSet rs) throws SQLException {
        ObjectNode payload;
        try {
            payload = (ObjectNode) objectMapper.readTree(rs.getString("payload"));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize job payload", e);
        }
        return new JobRecord(
                rs.getString("id"),
                rs.getString("type"),
                JobStatus.valueOf(rs.getString("status")),
                payload,
                rs.getString("result_summary"),
                rs.getString("error"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant());
    }
}
