package com.prfactory.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prfactory.core.model.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link CheckpointStore} that persists checkpoints to a PostgreSQL table.
 * <p>
 * One row per {@code (ticket_id, graph_id)}; saving upserts the row so the latest
 * checkpoint wins. State is stored as JSON. The table {@code workflow_checkpoints}
 * is created automatically via {@link #createTables()}.
 */
public class JdbcCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointStore.class);

    static final String TABLE_NAME = "workflow_checkpoints";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                ticket_id     VARCHAR(255) NOT NULL,
                graph_id      VARCHAR(255) NOT NULL,
                checkpoint_id VARCHAR(255) NOT NULL,
                state         TEXT NOT NULL,
                created_at    TIMESTAMP NOT NULL,
                PRIMARY KEY (ticket_id, graph_id)
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (ticket_id, graph_id, checkpoint_id, state, created_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (ticket_id, graph_id)
            DO UPDATE SET checkpoint_id = EXCLUDED.checkpoint_id,
                          state = EXCLUDED.state,
                          created_at = EXCLUDED.created_at
            """.formatted(TABLE_NAME);

    private static final String SELECT_LATEST_SQL = """
            SELECT checkpoint_id, state, created_at
            FROM %s
            WHERE ticket_id = ? AND graph_id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcCheckpointStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Creates the checkpoint table if it does not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Checkpoint table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void saveCheckpoint(String ticketId, String graphId, String checkpointId, Map<String, Object> state) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, ticketId);
            stmt.setString(2, graphId);
            stmt.setString(3, checkpointId);
            stmt.setString(4, serializeState(state));
            stmt.setTimestamp(5, Timestamp.from(Instant.now()));
            stmt.executeUpdate();

            log.debug("Saved checkpoint '{}' for {}/{}", checkpointId, ticketId, graphId);
        } catch (SQLException e) {
            throw new IllegalStateException(
                    "Failed to save checkpoint '%s' for %s/%s".formatted(checkpointId, ticketId, graphId), e);
        }
    }

    @Override
    public Optional<Checkpoint> loadLatest(String ticketId, String graphId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_LATEST_SQL)) {
            stmt.setString(1, ticketId);
            stmt.setString(2, graphId);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new Checkpoint(
                            ticketId,
                            graphId,
                            rs.getString("checkpoint_id"),
                            deserializeState(rs.getString("state")),
                            rs.getTimestamp("created_at").toInstant()));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException(
                    "Failed to load checkpoint for %s/%s".formatted(ticketId, graphId), e);
        }
        return Optional.empty();
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private String serializeState(Map<String, Object> state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint state", e);
        }
    }

    private Map<String, Object> deserializeState(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize checkpoint state", e);
        }
    }
}
