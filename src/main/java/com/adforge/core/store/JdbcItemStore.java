package com.adforge.core.store;

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

/**
 * JDBC-backed {@link ItemStore}. Each item is one row with a JSON payload column, so completion
 * markers survive process restarts.
 * <p>
 * The table {@code adforge_items} is created by {@link #createTables()}. The SQL sticks to what
 * PostgreSQL and H2 both accept.
 */
public class JdbcItemStore implements ItemStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcItemStore.class);

    private static final String TABLE_NAME = "adforge_items";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                seq          BIGINT GENERATED BY DEFAULT AS IDENTITY,
                id           VARCHAR(255) NOT NULL PRIMARY KEY,
                batch_id     VARCHAR(255) NOT NULL,
                payload      TEXT NOT NULL,
                completed_at TIMESTAMP,
                last_error   TEXT,
                updated_at   TIMESTAMP NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS %s_batch_idx ON %s (batch_id)
            """.formatted(TABLE_NAME, TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, batch_id, payload, updated_at)
            VALUES (?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String EXISTS_SQL = """
            SELECT 1 FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    /** SQLState for unique-constraint violations in both PostgreSQL and H2. */
    private static final String UNIQUE_VIOLATION = "23505";

    private static final String SELECT_BY_ID_SQL = """
            SELECT id, batch_id, payload, completed_at, last_error, updated_at
            FROM %s
            WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_FOR_UPDATE_SQL = SELECT_BY_ID_SQL.strip() + " FOR UPDATE";

    private static final String SELECT_BY_BATCH_SQL = """
            SELECT id, batch_id, payload, completed_at, last_error, updated_at
            FROM %s
            WHERE batch_id = ?
            ORDER BY seq ASC
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s
            SET payload = ?, completed_at = ?, last_error = ?, updated_at = ?
            WHERE id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcItemStore(DataSource dataSource, ObjectMapper objectMapper) {
        this(dataSource, objectMapper, Clock.systemUTC());
    }

    public JdbcItemStore(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Creates the item table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement create = conn.prepareStatement(CREATE_TABLE_SQL);
             PreparedStatement index = conn.prepareStatement(CREATE_INDEX_SQL)) {
            create.execute();
            index.execute();
            log.info("Item table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<ItemRecord> load(String itemId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, itemId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load item " + itemId, e);
        }
    }

    @Override
    public ItemRecord save(String itemId, ItemOutcome outcome) {
        Instant now = clock.instant();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                ItemRecord current;
                try (PreparedStatement select = conn.prepareStatement(SELECT_FOR_UPDATE_SQL)) {
                    select.setString(1, itemId);
                    try (ResultSet rs = select.executeQuery()) {
                        if (!rs.next()) {
                            throw new IllegalArgumentException("Unknown item " + itemId);
                        }
                        current = fromResultSet(rs);
                    }
                }

                ItemRecord next;
                if (outcome.succeeded()) {
                    ObjectNode merged = current.payload().deepCopy();
                    merged.setAll(outcome.patch());
                    next = new ItemRecord(itemId, current.batchId(), merged, now, null, now);
                } else {
                    next = new ItemRecord(itemId, current.batchId(), current.payload(),
                            current.completedAt(), outcome.error(), now);
                }

                try (PreparedStatement update = conn.prepareStatement(UPDATE_SQL)) {
                    update.setString(1, serialize(next.payload()));
                    update.setTimestamp(2, toTimestamp(next.completedAt()));
                    update.setString(3, next.lastError());
                    update.setTimestamp(4, toTimestamp(now));
                    update.setString(5, itemId);
                    update.executeUpdate();
                }
                conn.commit();
                log.debug("Saved {} outcome for item '{}'", outcome.status(), itemId);
                return next;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to save outcome for item " + itemId, e);
        }
    }

    @Override
    public boolean register(String batchId, String itemId, ObjectNode payload) {
        ObjectNode stored = payload != null ? payload : JsonNodeFactory.instance.objectNode();
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement exists = conn.prepareStatement(EXISTS_SQL)) {
                exists.setString(1, itemId);
                try (ResultSet rs = exists.executeQuery()) {
                    if (rs.next()) {
                        return false;
                    }
                }
            }
            try (PreparedStatement insert = conn.prepareStatement(INSERT_SQL)) {
                insert.setString(1, itemId);
                insert.setString(2, batchId);
                insert.setString(3, serialize(stored));
                insert.setTimestamp(4, toTimestamp(clock.instant()));
                return insert.executeUpdate() > 0;
            }
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                log.debug("Item '{}' registered concurrently; keeping existing row", itemId);
                return false;
            }
            throw new IllegalStateException("Failed to register item " + itemId, e);
        }
    }

    @Override
    public List<ItemRecord> listByBatch(String batchId) {
        List<ItemRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_BATCH_SQL)) {
            stmt.setString(1, batchId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to list items of batch " + batchId, e);
        }
        return records;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private String serialize(ObjectNode payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize item payload", e);
        }
    }

    private ObjectNode deserialize(String json) {
        try {
            return (ObjectNode) objectMapper.readTree(json);
        } catch (JsonProcessingException | ClassCastException e) {
            throw new IllegalStateException("Failed to deserialize item payload", e);
        }
    }

    private ItemRecord fromResultSet(ResultSet rs) throws SQLException {
        return new ItemRecord(
                rs.getString("id"),
                rs.getString("batch_id"),
                deserialize(rs.getString("payload")),
                toInstant(rs.getTimestamp("completed_at")),
                rs.getString("last_error"),
                toInstant(rs.getTimestamp("updated_at")));
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
