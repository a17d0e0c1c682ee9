package com.prfactory.core.persistence;

import com.prfactory.core.config.WorkflowProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Provides the checkpoint, workflow-state and audit stores.
 * <p>
 * When a {@link DataSource} is available (the {@code postgres} profile), all stores
 * are JDBC-backed and their tables are created on startup. Otherwise in-memory
 * stores are used, which do not survive a restart.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    public CheckpointStore checkpointStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds != null) {
            log.info("Configuring JDBC checkpoint store (PostgreSQL)");
            var store = new JdbcCheckpointStore(ds);
            store.createTables();
            return store;
        }
        log.info("No DataSource available; using in-memory checkpoint store (state will not persist across restarts)");
        return new InMemoryCheckpointStore();
    }

    @Bean
    public WorkflowStateStore workflowStateStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds != null) {
            log.info("Configuring JDBC workflow state store (PostgreSQL)");
            var store = new JdbcWorkflowStateStore(ds);
            store.createTables();
            return store;
        }
        log.info("No DataSource available; using in-memory workflow state store");
        return new InMemoryWorkflowStateStore();
    }

    @Bean
    public AuditStore auditStore(ObjectProvider<DataSource> dataSource, WorkflowProperties properties)
            throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds != null) {
            log.info("Configuring JDBC audit store (PostgreSQL)");
            var store = new JdbcAuditStore(ds);
            store.createTables();
            return store;
        }
        log.info("No DataSource available; using in-memory audit store keeping {} ended workflows",
                properties.getAuditRetainedWorkflows());
        return new InMemoryAuditStore(properties.getAuditRetainedWorkflows());
    }
}
