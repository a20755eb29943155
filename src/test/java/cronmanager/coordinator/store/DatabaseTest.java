package cronmanager.coordinator.store;

import cronmanager.coordinator.Fixtures;
import org.junit.jupiter.api.Test;

import java.sql.ResultSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseTest {

    @Test
    void migrationsAreRecordedOnceAndRerunSafely() throws Exception {
        String url = Fixtures.memoryUrl("test-migrations");
        try (Database first = new Database(url, 1)) {
            assertTrue(first.isHealthy());

            // Same in-memory database, second start
            try (Database second = new Database(url, 1);
                    var conn = second.getConnection();
                    var st = conn.createStatement();
                    ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM schema_migrations")) {
                assertTrue(rs.next());
                assertEquals(Database.MIGRATIONS.size(), rs.getInt(1));
            }
        }
    }

    @Test
    void closedDatabaseIsUnhealthy() {
        Database db = new Database(Fixtures.memoryUrl("test-health"), 1);
        db.close();
        assertFalse(db.isHealthy());
    }

    @Test
    void splitsScriptIntoStatements() {
        String script = """
                CREATE TABLE a (id INT);

                CREATE INDEX idx_a ON a(id);
                """;
        assertEquals(List.of("CREATE TABLE a (id INT)", "CREATE INDEX idx_a ON a(id)"),
                Database.statements(script));
    }

    @Test
    void parsesMigrationVersion() {
        assertEquals(1, Database.versionOf("V1__create_schedules.sql"));
        assertEquals(12, Database.versionOf("V12__add_index.sql"));
        assertThrows(IllegalArgumentException.class, () -> Database.versionOf("create_jobs.sql"));
    }
}
