package com.prfactory.core.persistence;

import com.prfactory.core.audit.AuditEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JDBC-based {@link AuditStore} appending one row per entry to {@code workflow_audit}.
 * <p>
 * Rows are never updated or deleted here; the serial id preserves append order
 * for entries recorded within the same millisecond.
 */
public class JdbcAuditStore implements AuditStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditStore.class);

    static final String TABLE_NAME = "workflow_audit";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id          BIGSERIAL    PRIMARY KEY,
                ticket_id   VARCHAR(255) NOT NULL,
                graph_id    VARCHAR(64),
                category    VARCHAR(32)  NOT NULL,
                action      VARCHAR(255) NOT NULL,
                detail      TEXT,
                recorded_at TIMESTAMP    NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_TICKET_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS %1$s_ticket ON %1$s (ticket_id, id)
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (ticket_id, graph_id, category, action, detail, recorded_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_TICKET_SQL = """
            SELECT ticket_id, graph_id, category, action, detail, recorded_at
            FROM %s
            WHERE ticket_id = ?
            ORDER BY id
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcAuditStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            stmt.execute(CREATE_TICKET_INDEX_SQL);
            log.info("Audit table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void append(AuditEntry entry) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, entry.ticketId());
            stmt.setString(2, entry.graphId());
            stmt.setString(3, entry.category());
            stmt.setString(4, entry.action());
            stmt.setString(5, entry.detail());
            stmt.setTimestamp(6, Timestamp.from(entry.timestamp()));
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException(
                    "Failed to append audit entry '%s' for ticket %s".formatted(entry.action(), entry.ticketId()), e);
        }
    }

    @Override
    public List<AuditEntry> entriesFor(String ticketId) {
        List<AuditEntry> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_TICKET_SQL)) {
            stmt.setString(1, ticketId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(new AuditEntry(
                            rs.getString("ticket_id"),
                            rs.getString("graph_id"),
                            rs.getString("category"),
                            rs.getString("action"),
                            rs.getString("detail"),
                            rs.getTimestamp("recorded_at").toInstant()));
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load audit entries for ticket " + ticketId, e);
        }
        return List.copyOf(result);
    }
}
