package tacoq.manager.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.config.ManagerConfig;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(ManagerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("tacoq-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection and committing.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- TASK TYPES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_types (
                            id              UUID PRIMARY KEY,
                            name            VARCHAR(255) NOT NULL UNIQUE,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- WORKERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS workers (
                            id              UUID PRIMARY KEY,
                            name            VARCHAR(255) NOT NULL,
                            registered_at   TIMESTAMP NOT NULL,
                            last_heartbeat  TIMESTAMP NOT NULL,
                            liveness        VARCHAR(20) DEFAULT 'ALIVE' NOT NULL
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS worker_task_types (
                            worker_id       UUID NOT NULL REFERENCES workers(id) ON DELETE CASCADE,
                            task_type_id    UUID NOT NULL REFERENCES task_types(id),
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            PRIMARY KEY (worker_id, task_type_id)
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS worker_heartbeats (
                            id              UUID PRIMARY KEY,
                            worker_id       UUID NOT NULL REFERENCES workers(id) ON DELETE CASCADE,
                            heartbeat_time  TIMESTAMP NOT NULL,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id              UUID PRIMARY KEY,
                            seq             BIGINT GENERATED BY DEFAULT AS IDENTITY,
                            task_type_id    UUID NOT NULL REFERENCES task_types(id),
                            input_data      CLOB,
                            status          VARCHAR(20) DEFAULT 'PENDING' NOT NULL,
                            created_at      TIMESTAMP NOT NULL,
                            assigned_to     UUID REFERENCES workers(id),
                            CONSTRAINT chk_tasks_assignment CHECK (
                                (status IN ('QUEUED', 'RUNNING') AND assigned_to IS NOT NULL)
                                OR (status NOT IN ('QUEUED', 'RUNNING') AND assigned_to IS NULL))
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_results (
                            id              UUID PRIMARY KEY,
                            task_id         UUID NOT NULL UNIQUE REFERENCES tasks(id) ON DELETE CASCADE,
                            output_data     CLOB,
                            error_data      CLOB,
                            completed_at    TIMESTAMP NOT NULL,
                            worker_id       UUID NOT NULL,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT chk_results_single_outcome CHECK (output_data IS NULL OR error_data IS NULL)
                        );
                    """);

            // one row per (task, worker) the task was taken back from
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_reclaims (
                            task_id         UUID NOT NULL REFERENCES tasks(id) ON DELETE CASCADE,
                            worker_id       UUID NOT NULL,
                            reclaimed_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_type_status_fifo ON tasks(task_type_id, status, created_at, seq);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_assigned_status ON tasks(assigned_to, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_workers_liveness_heartbeat ON workers(liveness, last_heartbeat);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_task_reclaims_task_worker ON task_reclaims(task_id, worker_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_worker_task_types_type ON worker_task_types(task_type_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_heartbeats_worker_time ON worker_heartbeats(worker_id, heartbeat_time);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
