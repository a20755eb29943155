package cronmanager.coordinator.store;

import cronmanager.coordinator.Fixtures;
import cronmanager.coordinator.model.Job;
import cronmanager.coordinator.model.JobStatus;
import cronmanager.coordinator.repository.NotFoundException;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobRepositoryTest {

    private static Database db;
    private static JdbcJobRepository repo;
    private static long scheduleId;

    @BeforeAll
    static void setup() {
        db = new Database(Fixtures.memoryUrl("test-jobs"), 2);
        repo = new JdbcJobRepository(db);
        scheduleId = new JdbcScheduleRepository(db).create(Fixtures.schedule("jobs-owner")).id();
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanJobs() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
    }

    @Test
    void createStartsPending() {
        Job job = repo.create(scheduleId);

        assertTrue(job.id() > 0);
        assertEquals(scheduleId, job.scheduleId());
        assertEquals(JobStatus.PENDING, job.status());
        assertNull(job.machineId());
        assertNull(job.exitCode());
        assertNotNull(job.createdAt());
        assertNotNull(job.updatedAt());
        assertNull(job.finishedAt());
    }

    @Test
    void machineAndStatusUpdates() {
        Job job = repo.create(scheduleId);
        repo.updateMachine(job.id(), "m-1");
        repo.updateStatus(job.id(), JobStatus.RUNNING);

        Job found = repo.getById(job.id());
        assertEquals("m-1", found.machineId());
        assertEquals(JobStatus.RUNNING, found.status());
        assertEquals(found, repo.findByMachineId("m-1").orElseThrow());
        assertEquals(List.of(found), repo.findByStatus(JobStatus.RUNNING));
    }

    @Test
    void completeSetsOutputAndFinishedAt() {
        Job job = repo.create(scheduleId);
        repo.complete(job.id(), 0, "hello\n");

        Job found = repo.getById(job.id());
        assertEquals(JobStatus.COMPLETED, found.status());
        assertEquals(0, found.exitCode());
        assertEquals("hello\n", found.stdout());
        assertNull(found.stderr());
        assertNotNull(found.finishedAt());
    }

    @Test
    void failStoresMessageInStderr() {
        Job job = repo.create(scheduleId);
        repo.fail(job.id(), 2, "boom");

        Job found = repo.getById(job.id());
        assertEquals(JobStatus.FAILED, found.status());
        assertEquals(2, found.exitCode());
        assertEquals("boom", found.stderr());
        assertNotNull(found.finishedAt());
    }

    @Test
    void guardedWritesLeaveTerminalJobsAlone() {
        Job job = repo.create(scheduleId);
        repo.updateStatus(job.id(), JobStatus.RUNNING);

        assertTrue(repo.completeIfActive(job.id(), 0, "done"));
        assertFalse(repo.failIfActive(job.id(), -1, "too late"));

        Job found = repo.getById(job.id());
        assertEquals(JobStatus.COMPLETED, found.status());
        assertEquals(0, found.exitCode());
        assertNull(found.stderr());
    }

    @Test
    void unguardedWriteToMissingJobThrows() {
        assertThrows(NotFoundException.class, () -> repo.fail(999_999, 1, "x"));
        assertThrows(NotFoundException.class, () -> repo.updateStatus(999_999, JobStatus.RUNNING));
        assertThrows(NotFoundException.class, () -> repo.getById(999_999));
    }

    @Test
    void findByScheduleMostRecentFirstWithLimit() {
        Job first = repo.create(scheduleId);
        Job second = repo.create(scheduleId);
        Job third = repo.create(scheduleId);

        List<Job> latest = repo.findBySchedule(scheduleId, 2);
        assertEquals(List.of(third, second), latest);
        assertFalse(latest.contains(first));
    }

    @Test
    void findReconcilableOnlyActive() {
        Job pending = repo.create(scheduleId);
        Job running = repo.create(scheduleId);
        repo.updateStatus(running.id(), JobStatus.RUNNING);
        Job done = repo.create(scheduleId);
        repo.complete(done.id(), 0, "");

        assertEquals(List.of(pending, running), repo.findReconcilable());
    }
}
