package jobhub.backend.storage;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jobhub.backend.config.BackendConfig;
import jobhub.backend.error.StorageException;
import jobhub.backend.util.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Backs the JDBC object store, log sink and secret vault.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;
    private final Retry retry;

    public Database(BackendConfig config) {
        this(config.databaseUrl(), config.databasePoolSize(), config.storageRetry());
    }

    public Database(String jdbcUrl, int poolSize) {
        this(jdbcUrl, poolSize, Retry.defaults());
    }

    public Database(String jdbcUrl, int poolSize, Retry retry) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("jobhub-db-pool");
        hikariConfig.setAutoCommit(false);

        // H2 specific settings
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

        this.dataSource = new HikariDataSource(hikariConfig);
        this.retry = retry;

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

    /**
     * Run {@code work} in its own transaction, committing on success and rolling back on failure.
     * Transient SQL errors are retried with backoff; anything else surfaces as {@link StorageException}.
     */
    public <T> T inTransaction(String operation, SqlWork<T> work) {
        try {
            return retry.call(operation, () -> runOnce(work), Database::isTransient);
        } catch (SQLException e) {
            throw new StorageException("Failed to " + operation, e);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while retrying " + operation, e);
        } catch (Exception e) {
            throw new StorageException("Failed to " + operation, e);
        }
    }

    private <T> T runOnce(SqlWork<T> work) throws SQLException {
        try (Connection conn = getConnection()) {
            try {
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    static boolean isTransient(Throwable e) {
        return e instanceof SQLTransientException || e instanceof SQLRecoverableException;
    }

    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- OBJECTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS objects (
                            object_key      VARCHAR(1024) PRIMARY KEY,
                            content         BLOB NOT NULL,
                            size_bytes      BIGINT NOT NULL,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- LOG GROUPS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS log_groups (
                            log_group       VARCHAR(512) PRIMARY KEY,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- LOG EVENTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS log_events (
                            id              BIGINT AUTO_INCREMENT PRIMARY KEY,
                            log_group       VARCHAR(512) NOT NULL,
                            log_stream      VARCHAR(512) NOT NULL,
                            job_id          VARCHAR(512),
                            event_time      TIMESTAMP(9) NOT NULL,
                            source          VARCHAR(20) NOT NULL,
                            message         CLOB NOT NULL
                        );
                    """);

            // ---------- VAULT ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS vault_secrets (
                            secret_name     VARCHAR(1024) PRIMARY KEY,
                            secret_value    CLOB NOT NULL,
                            version         INT DEFAULT 1,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- INDEXES ----------
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_log_events_stream ON log_events(log_group, log_stream, event_time)");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize database schema", e);
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
