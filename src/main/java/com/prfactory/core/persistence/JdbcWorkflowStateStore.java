package com.prfactory.core.persistence;

import com.prfactory.core.model.WorkflowState;
import com.prfactory.core.model.WorkflowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link WorkflowStateStore} backed by the {@code workflow_states} table.
 * <p>
 * A partial unique index on {@code ticket_id} for running and suspended rows
 * enforces one active workflow per ticket at the database level. Updates only
 * touch rows that are not yet terminal.
 */
public class JdbcWorkflowStateStore implements WorkflowStateStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowStateStore.class);

    static final String TABLE_NAME = "workflow_states";

    private static final String UNIQUE_VIOLATION = "23505";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                workflow_id   VARCHAR(64)  PRIMARY KEY,
                ticket_id     VARCHAR(255) NOT NULL,
                current_graph VARCHAR(64)  NOT NULL,
                current_state VARCHAR(255),
                status        VARCHAR(32)  NOT NULL,
                started_at    TIMESTAMP    NOT NULL,
                completed_at  TIMESTAMP,
                error_message TEXT
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_ACTIVE_INDEX_SQL = """
            CREATE UNIQUE INDEX IF NOT EXISTS %1$s_active_ticket
            ON %1$s (ticket_id)
            WHERE status IN ('RUNNING', 'SUSPENDED')
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (workflow_id, ticket_id, current_graph, current_state, status,
                            started_at, completed_at, error_message)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s
            SET current_graph = ?, current_state = ?, status = ?, completed_at = ?, error_message = ?
            WHERE workflow_id = ? AND status NOT IN ('COMPLETED', 'FAILED', 'CANCELLED')
            """.formatted(TABLE_NAME);

    private static final String UPDATE_STATUS_SQL = """
            UPDATE %s
            SET status = ?,
                completed_at = COALESCE(?, completed_at),
                error_message = COALESCE(?, error_message)
            WHERE workflow_id = ? AND status NOT IN ('COMPLETED', 'FAILED', 'CANCELLED')
            """.formatted(TABLE_NAME);

    private static final String COMPARE_AND_SET_SQL = """
            UPDATE %s SET status = ? WHERE workflow_id = ? AND status = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_TICKET_SQL = """
            SELECT workflow_id, ticket_id, current_graph, current_state, status,
                   started_at, completed_at, error_message
            FROM %s
            WHERE ticket_id = ?
            ORDER BY started_at DESC
            LIMIT 1
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcWorkflowStateStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            stmt.execute(CREATE_ACTIVE_INDEX_SQL);
            log.info("Workflow state table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void create(WorkflowState state) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, state.workflowId());
            stmt.setString(2, state.ticketId());
            stmt.setString(3, state.currentGraph());
            stmt.setString(4, state.currentState());
            stmt.setString(5, state.status().name());
            stmt.setTimestamp(6, Timestamp.from(state.startedAt()));
            stmt.setTimestamp(7, toTimestamp(state.completedAt()));
            stmt.setString(8, state.errorMessage());
            stmt.executeUpdate();
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                throw new WorkflowConflictException(state.ticketId());
            }
            throw new IllegalStateException("Failed to create workflow " + state.workflowId(), e);
        }
    }

    @Override
    public void save(WorkflowState state) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
            stmt.setString(1, state.currentGraph());
            stmt.setString(2, state.currentState());
            stmt.setString(3, state.status().name());
            stmt.setTimestamp(4, toTimestamp(state.completedAt()));
            stmt.setString(5, state.errorMessage());
            stmt.setString(6, state.workflowId());
            requireUpdated(stmt.executeUpdate(), state.workflowId());
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to save workflow " + state.workflowId(), e);
        }
    }

    @Override
    public Optional<WorkflowState> findByTicketId(String ticketId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_TICKET_SQL)) {
            stmt.setString(1, ticketId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load workflow for ticket " + ticketId, e);
        }
        return Optional.empty();
    }

    @Override
    public void updateStatus(String workflowId, WorkflowStatus status, String errorMessage) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_STATUS_SQL)) {
            stmt.setString(1, status.name());
            stmt.setTimestamp(2, status.isTerminal() ? Timestamp.from(Instant.now()) : null);
            stmt.setString(3, errorMessage);
            stmt.setString(4, workflowId);
            requireUpdated(stmt.executeUpdate(), workflowId);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to update workflow " + workflowId, e);
        }
    }

    @Override
    public boolean compareAndSetStatus(String workflowId, WorkflowStatus expected, WorkflowStatus next) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COMPARE_AND_SET_SQL)) {
            stmt.setString(1, next.name());
            stmt.setString(2, workflowId);
            stmt.setString(3, expected.name());
            return stmt.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to update workflow " + workflowId, e);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static void requireUpdated(int rows, String workflowId) {
        if (rows == 0) {
            throw new WorkflowTerminatedException(workflowId, "Workflow " + workflowId + " is unknown or already terminal");
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static WorkflowState fromResultSet(ResultSet rs) throws SQLException {
        Timestamp completedAt = rs.getTimestamp("completed_at");
        return new WorkflowState(
                rs.getString("workflow_id"),
                rs.getString("ticket_id"),
                rs.getString("current_graph"),
                rs.getString("current_state"),
                WorkflowStatus.valueOf(rs.getString("status")),
                rs.getTimestamp("started_at").toInstant(),
                completedAt == null ? null : completedAt.toInstant(),
                rs.getString("error_message"));
    }
}
