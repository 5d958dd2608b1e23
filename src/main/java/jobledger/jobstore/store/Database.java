package jobledger.jobstore.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jobledger.jobstore.config.JobStoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; connections are handed out with
 * autocommit off, so every unit of work ends in an explicit commit or rollback.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    /**
     * A unit of work run against one connection inside one transaction.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    public Database(JobStoreConfig config) {
        this(config.databaseUrl(), config.databasePoolSize(), config.connectionTimeout().toMillis());
    }

    public Database(String jdbcUrl, int poolSize) {
        this(jdbcUrl, poolSize, 5000);
    }

    private Database(String jdbcUrl, int poolSize, long connectionTimeoutMs) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(connectionTimeoutMs);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("jobledger-db-pool");
        hikariConfig.setAutoCommit(false);
        hikariConfig.setTransactionIsolation("TRANSACTION_READ_COMMITTED");

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for committing and closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Run {@code work} in a single transaction. Commits on success, rolls back
     * on any exception and rethrows it.
     */
    public <T> T inTransaction(SqlWork<T> work) throws SQLException {
        try (Connection conn = getConnection()) {
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
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

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    /**
     * Initialize database schema.
     */
    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- JOB RECORDS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_records (
                            id              VARCHAR(255) PRIMARY KEY,
                            next_run_time   TIMESTAMP,
                            trigger_kind    VARCHAR(30) NOT NULL,
                            job_state       BYTEA NOT NULL
                        );
                    """);

            // ---------- JOB EXECUTIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_executions (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            job_id          VARCHAR(255) NOT NULL,
                            status          VARCHAR(50) NOT NULL,
                            run_time        TIMESTAMP NOT NULL,
                            trigger_kind    VARCHAR(30) NOT NULL,
                            finished        TIMESTAMP,
                            exception       VARCHAR(1000),
                            traceback       CLOB,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_job_records_next_run ON job_records(next_run_time);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_job_executions_job ON job_executions(job_id, id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_job_executions_run_time ON job_executions(run_time);");

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
