package harvester.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import harvester.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit disabled; callers commit or roll back explicitly.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("harvester-db-pool");
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

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id                 VARCHAR(64) PRIMARY KEY,
                            owner              VARCHAR(256),
                            status             VARCHAR(20) DEFAULT 'PENDING',
                            input_ref          VARCHAR(1024) NOT NULL,
                            total_batches      INT DEFAULT 0,
                            total_rows         INT DEFAULT 0,
                            batch_size         INT DEFAULT 0,
                            final_artifact_ref VARCHAR(1024),
                            error_message      VARCHAR(2048),
                            failed_batch_index INT,
                            webhook_url        VARCHAR(1024),
                            created_at         TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at         TIMESTAMP,
                            finished_at        TIMESTAMP
                        );
                    """);

            // ---------- BATCHES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS batches (
                            id              VARCHAR(64) PRIMARY KEY,
                            job_id          VARCHAR(64) NOT NULL REFERENCES jobs(id),
                            batch_index     INT NOT NULL,
                            status          VARCHAR(20) DEFAULT 'PENDING',
                            attempt_count   INT DEFAULT 0,
                            max_retries     INT DEFAULT 2,
                            row_count       INT DEFAULT 0,
                            input_ref       VARCHAR(1024) NOT NULL,
                            output_ref      VARCHAR(1024),
                            record_count    INT,
                            last_error      VARCHAR(2048),
                            claimed_by      VARCHAR(128),
                            claimed_at      TIMESTAMP,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            finished_at     TIMESTAMP,
                            CONSTRAINT uq_batches_job_index UNIQUE (job_id, batch_index)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_batches_job_status ON batches(job_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_batches_status_claimed ON batches(status, claimed_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_owner ON jobs(owner);");

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
