package cronmanager.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import cronmanager.coordinator.config.ManagerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Database connection pool and schema migrations.
 * Uses HikariCP for connection pooling; connections are handed out with
 * auto-commit off, so every writer commits explicitly.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private static final String MIGRATION_DIR = "db/migration/";

    /** Applied in order. Never edit a released entry; add a new one. */
    static final List<String> MIGRATIONS = List.of(
            "V1__create_schedules.sql",
            "V2__create_jobs.sql");

    private final HikariDataSource dataSource;

    public Database(ManagerConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("cron-manager-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        migrate();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
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
     * Apply every migration not yet recorded in {@code schema_migrations}.
     * Safe to run on every start.
     */
    void migrate() {
        try (Connection conn = getConnection()) {
            try (Statement st = conn.createStatement()) {
                st.execute("""
                            CREATE TABLE IF NOT EXISTS schema_migrations (
                                version    INT PRIMARY KEY,
                                name       VARCHAR(255) NOT NULL,
                                applied_at TIMESTAMP NOT NULL
                            )
                        """);
            }
            conn.commit();

            Set<Integer> applied = appliedVersions(conn);
            int count = 0;
            for (String migration : MIGRATIONS) {
                int version = versionOf(migration);
                if (applied.contains(version)) {
                    continue;
                }
                apply(conn, version, migration);
                count++;
            }

            if (count > 0) {
                log.info("Applied {} database migration(s)", count);
            } else {
                log.debug("Database schema is up to date");
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to migrate database schema", e);
        }
    }

    private Set<Integer> appliedVersions(Connection conn) throws SQLException {
        Set<Integer> versions = new HashSet<>();
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT version FROM schema_migrations")) {
            while (rs.next()) {
                versions.add(rs.getInt(1));
            }
        }
        return versions;
    }

    private void apply(Connection conn, int version, String migration) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : statements(readMigration(migration))) {
                st.addBatch(sql);
            }
            st.executeBatch();

            try (PreparedStatement ps = conn.prepareStatement(
                    "MERGE INTO schema_migrations (version, name, applied_at) KEY (version) VALUES (?, ?, ?)")) {
                ps.setInt(1, version);
                ps.setString(2, migration);
                ps.setTimestamp(3, Timestamp.from(Instant.now()));
                ps.executeUpdate();
            }
            conn.commit();
            log.info("Applied migration {}", migration);
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        }
    }

    private static String readMigration(String migration) {
        try (InputStream in = Database.class.getClassLoader().getResourceAsStream(MIGRATION_DIR + migration)) {
            if (in == null) {
                throw new IllegalStateException("Migration not found on classpath: " + migration);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read migration " + migration, e);
        }
    }

    static List<String> statements(String script) {
        List<String> statements = new ArrayList<>();
        for (String part : script.split(";")) {
            String sql = part.strip();
            if (!sql.isEmpty()) {
                statements.add(sql);
            }
        }
        return statements;
    }

    static int versionOf(String migration) {
        int separator = migration.indexOf("__");
        if (!migration.startsWith("V") || separator < 2) {
            throw new IllegalArgumentException("Bad migration name: " + migration);
        }
        return Integer.parseInt(migration.substring(1, separator));
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
