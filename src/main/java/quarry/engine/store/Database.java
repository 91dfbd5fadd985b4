package quarry.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import quarry.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    /** SQLState for unique/primary key violations */
    static final String DUPLICATE_KEY = "23505";

    private final HikariDataSource dataSource;

    public Database(EngineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("quarry-db-pool");
        hikariConfig.setAutoCommit(false);

        // H2 specific settings: sibling finishers queue on the parent row lock
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
            hikariConfig.setConnectionInitSql("SET LOCK_TIMEOUT 10000");
        }

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

    static boolean isDuplicateKey(SQLException e) {
        return DUPLICATE_KEY.equals(e.getSQLState());
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- JOBS (immutable part) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id          VARCHAR(255) PRIMARY KEY,
                            parent_id   VARCHAR(255),
                            manager_id  VARCHAR(255),
                            type        VARCHAR(64) NOT NULL,
                            name        VARCHAR(512),
                            config      CLOB NOT NULL,
                            depth       INT DEFAULT 0,
                            created_at  TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- JOB STATES (mutable part) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_states (
                            job_id          VARCHAR(255) PRIMARY KEY,
                            status          VARCHAR(20) NOT NULL,
                            p_total         INT DEFAULT 0,
                            p_pending       INT DEFAULT 0,
                            p_running       INT DEFAULT 0,
                            p_completed     INT DEFAULT 0,
                            p_failed        INT DEFAULT 0,
                            p_cancelled     INT DEFAULT 0,
                            started_at      TIMESTAMP,
                            completed_at    TIMESTAMP,
                            error           VARCHAR(2048),
                            result_count    INT DEFAULT 0,
                            result          CLOB,
                            last_heartbeat  TIMESTAMP,
                            incomplete      BOOLEAN DEFAULT FALSE
                        );
                    """);

            // ---------- JOB LOGS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_logs (
                            id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            job_id      VARCHAR(255) NOT NULL,
                            log_level   VARCHAR(10) NOT NULL,
                            message     VARCHAR(4096) NOT NULL,
                            created_at  TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- JOB DEFINITIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_definitions (
                            id          VARCHAR(255) PRIMARY KEY,
                            name        VARCHAR(512),
                            type        VARCHAR(64),
                            enabled     BOOLEAN DEFAULT TRUE,
                            body        CLOB NOT NULL,
                            updated_at  TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- QUEUE ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS queue_messages (
                            id              VARCHAR(300) PRIMARY KEY,
                            type            VARCHAR(64) NOT NULL,
                            job_id          VARCHAR(255),
                            body            CLOB NOT NULL,
                            visible_at      TIMESTAMP NOT NULL,
                            lease_token     VARCHAR(64),
                            receive_count   INT DEFAULT 0,
                            version         BIGINT DEFAULT 0,
                            created_at      TIMESTAMP NOT NULL
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS dead_letters (
                            id              VARCHAR(300) PRIMARY KEY,
                            type            VARCHAR(64) NOT NULL,
                            job_id          VARCHAR(255),
                            body            CLOB NOT NULL,
                            receive_count   INT DEFAULT 0,
                            reason          VARCHAR(2048),
                            created_at      TIMESTAMP NOT NULL,
                            dead_at         TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- CRAWL DEDUP ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS crawl_seen (
                            scope_id    VARCHAR(255) NOT NULL,
                            url_hash    VARCHAR(64) NOT NULL,
                            url         VARCHAR(4096) NOT NULL,
                            seen_at     TIMESTAMP NOT NULL,
                            PRIMARY KEY (scope_id, url_hash)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_parent ON jobs(parent_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_manager ON jobs(manager_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_type_created ON jobs(type, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_job_states_status ON job_states(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_job_logs_job ON job_logs(job_id, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_queue_visible ON queue_messages(visible_at, created_at);");

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
