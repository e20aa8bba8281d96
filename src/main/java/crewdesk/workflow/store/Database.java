package crewdesk.workflow.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import crewdesk.workflow.config.WorkflowConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit off; callers commit explicitly.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(WorkflowConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("crewdesk-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
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

            // ---------- SCHEDULED TASKS ----------
            // active_key mirrors dedup_key while the task is PENDING or PROCESSING
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS scheduled_tasks (
                            id              VARCHAR(64) PRIMARY KEY,
                            tenant_id       VARCHAR(64),
                            task_type       VARCHAR(40) NOT NULL,
                            dedup_key       VARCHAR(255),
                            active_key      VARCHAR(255),
                            due_at          TIMESTAMP NOT NULL,
                            payload         CLOB NOT NULL,
                            status          VARCHAR(20) DEFAULT 'PENDING' NOT NULL,
                            attempts        INT DEFAULT 0 NOT NULL,
                            max_attempts    INT DEFAULT 3 NOT NULL,
                            last_error      VARCHAR(2048),
                            created_at      TIMESTAMP NOT NULL,
                            updated_at      TIMESTAMP NOT NULL,
                            claimed_at      TIMESTAMP,
                            executed_at     TIMESTAMP
                        );
                    """);

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id                  BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            tenant_id           VARCHAR(64),
                            customer_name       VARCHAR(255),
                            customer_phone      VARCHAR(32),
                            address             VARCHAR(512),
                            service_date        DATE NOT NULL,
                            scheduled_time      TIME,
                            price               DOUBLE PRECISION,
                            status              VARCHAR(20) DEFAULT 'SCHEDULED' NOT NULL,
                            cleaner_id          BIGINT,
                            latitude            DOUBLE PRECISION,
                            longitude           DOUBLE PRECISION,
                            cleaner_confirmed   BOOLEAN DEFAULT FALSE NOT NULL,
                            customer_notified   BOOLEAN DEFAULT FALSE NOT NULL,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- CLEANERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS cleaners (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            tenant_id       VARCHAR(64),
                            name            VARCHAR(255) NOT NULL,
                            phone           VARCHAR(32),
                            chat_id         VARCHAR(64),
                            active          BOOLEAN DEFAULT TRUE NOT NULL,
                            team_lead       BOOLEAN DEFAULT FALSE NOT NULL,
                            home_latitude   DOUBLE PRECISION,
                            home_longitude  DOUBLE PRECISION
                        );
                    """);

            // ---------- CLEANER ASSIGNMENTS ----------
            // active_job_id mirrors job_id while the offer is PENDING or CONFIRMED
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS cleaner_assignments (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            job_id          BIGINT NOT NULL,
                            cleaner_id      BIGINT NOT NULL,
                            status          VARCHAR(20) DEFAULT 'PENDING' NOT NULL,
                            distance_miles  DOUBLE PRECISION,
                            active_job_id   BIGINT,
                            assigned_at     TIMESTAMP NOT NULL,
                            responded_at    TIMESTAMP
                        );
                    """);

            // ---------- ALERTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS alerts (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            job_id          BIGINT,
                            alert_type      VARCHAR(40) NOT NULL,
                            threshold_value INT,
                            actual_value    INT,
                            message         VARCHAR(4096),
                            acknowledged    BOOLEAN DEFAULT FALSE NOT NULL,
                            created_at      TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- SYSTEM EVENTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS system_events (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            tenant_id       VARCHAR(64),
                            source          VARCHAR(64) NOT NULL,
                            event_type      VARCHAR(40) NOT NULL,
                            message         VARCHAR(4096),
                            job_id          BIGINT,
                            cleaner_id      BIGINT,
                            phone           VARCHAR(32),
                            metadata        CLOB,
                            created_at      TIMESTAMP NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE UNIQUE INDEX IF NOT EXISTS ux_tasks_active_key ON scheduled_tasks(active_key);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status_due ON scheduled_tasks(status, due_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_dedup ON scheduled_tasks(dedup_key, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_date ON jobs(service_date, status);");
            st.addBatch(
                    "CREATE UNIQUE INDEX IF NOT EXISTS ux_assignments_active_job ON cleaner_assignments(active_job_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_assignments_job ON cleaner_assignments(job_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_alerts_ack ON alerts(acknowledged, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_events_job ON system_events(job_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
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
