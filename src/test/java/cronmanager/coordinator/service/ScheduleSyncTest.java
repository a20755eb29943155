package cronmanager.coordinator.service;

import cronmanager.coordinator.Fixtures;
import cronmanager.coordinator.model.Schedule;
import cronmanager.coordinator.store.Database;
import cronmanager.coordinator.store.JdbcJobRepository;
import cronmanager.coordinator.store.JdbcScheduleRepository;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleSyncTest {

    private static final String UPTIME_CHECK = """
            [
              {
                "name": "uptime-check",
                "app_name": "my-app",
                "schedule": "*/5 * * * *",
                "region": "ord",
                "command": "curl -fsS https://example.com/health",
                "command_timeout": 60,
                "config": {
                  "image": "curlimages/curl:latest",
                  "guest": { "cpu_kind": "shared", "cpus": 1, "memory_mb": 256 }
                }
              }
            ]
            """;

    @TempDir
    Path tempDir;

    private Database db;
    private JdbcScheduleRepository schedules;
    private JdbcJobRepository jobs;
    private ScheduleSync sync;

    @BeforeEach
    void setUp() {
        db = new Database(Fixtures.memoryUrl("test-sync"), 2);
        schedules = new JdbcScheduleRepository(db);
        jobs = new JdbcJobRepository(db);
        sync = new ScheduleSync(schedules);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private Path write(String content) throws Exception {
        Path file = tempDir.resolve("schedules.json");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void createsScheduleFromFile() throws Exception {
        ScheduleSync.Result result = sync.sync(write(UPTIME_CHECK));

        assertEquals(List.of("uptime-check"), result.created());
        Schedule stored = schedules.getByName("uptime-check");
        assertEquals("my-app", stored.appName());
        assertEquals(60, stored.commandTimeout());
        assertEquals("curlimages/curl:latest", stored.config().image());
        assertEquals(256, stored.config().guest().memoryMb());
        assertTrue(stored.enabled());
    }

    @Test
    void secondSyncChangesNothing() throws Exception {
        Path file = write(UPTIME_CHECK);
        sync.sync(file);
        long id = schedules.getByName("uptime-check").id();

        ScheduleSync.Result again = sync.sync(file);

        assertFalse(again.changed());
        assertEquals(1, again.unchanged());
        assertEquals(id, schedules.getByName("uptime-check").id());
    }

    @Test
    void changedDefinitionIsUpdatedInPlace() throws Exception {
        sync.sync(write(UPTIME_CHECK));
        long id = schedules.getByName("uptime-check").id();

        ScheduleSync.Result result = sync.sync(write(UPTIME_CHECK.replace("*/5 * * * *", "0 * * * *")));

        assertEquals(List.of("uptime-check"), result.updated());
        Schedule stored = schedules.getByName("uptime-check");
        assertEquals(id, stored.id());
        assertEquals("0 * * * *", stored.cronExpression());
    }

    @Test
    void removedScheduleIsDeletedWithItsJobs() throws Exception {
        sync.apply(List.of(
                Fixtures.definition("a", "* * * * *", "true", null),
                Fixtures.definition("b", "* * * * *", "true", null)));
        long bId = schedules.getByName("b").id();
        jobs.create(bId);

        ScheduleSync.Result result = sync.apply(List.of(Fixtures.definition("a", "* * * * *", "true", null)));

        assertEquals(List.of("b"), result.deleted());
        assertTrue(schedules.findByName("b").isEmpty());
        assertTrue(jobs.findBySchedule(bId, 10).isEmpty());
    }

    @Test
    void missingTimeoutDefaultsToThirtySeconds() {
        sync.apply(List.of(Fixtures.definition("defaults", "@hourly", "date", null)));
        assertEquals(Schedule.DEFAULT_COMMAND_TIMEOUT, schedules.getByName("defaults").commandTimeout());
    }

    @Test
    void absentOrEmptyFileRemovesEverything() throws Exception {
        sync.apply(List.of(Fixtures.definition("old", "* * * * *", "true", null)));

        ScheduleSync.Result result = sync.sync(tempDir.resolve("does-not-exist.json"));
        assertEquals(List.of("old"), result.deleted());

        sync.apply(List.of(Fixtures.definition("old", "* * * * *", "true", null)));
        assertEquals(List.of("old"), sync.sync(write("  \n")).deleted());
        assertTrue(schedules.findAll().isEmpty());
    }

    @Test
    void invalidEntryLeavesStoreUntouched() {
        sync.apply(List.of(Fixtures.definition("existing", "* * * * *", "true", null)));

        ScheduleFileException e = assertThrows(ScheduleFileException.class, () -> sync.apply(List.of(
                Fixtures.definition("fresh", "* * * * *", "true", null),
                Fixtures.definition("broken", "not a cron", "true", null))));

        assertTrue(e.getMessage().contains("not a cron"), e.getMessage());
        assertEquals(List.of("existing"), schedules.findAll().stream().map(Schedule::name).toList());
    }

    @Test
    void duplicateNamesRejected() {
        assertThrows(ScheduleFileException.class, () -> sync.apply(List.of(
                Fixtures.definition("twice", "* * * * *", "true", null),
                Fixtures.definition("twice", "@daily", "true", null))));
        assertTrue(schedules.findAll().isEmpty());
    }

    @Test
    void malformedJsonRejected() throws Exception {
        Path file = write("{ not json");
        assertThrows(ScheduleFileException.class, () -> sync.sync(file));
    }
}
