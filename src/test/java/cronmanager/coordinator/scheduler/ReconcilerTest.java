package cronmanager.coordinator.scheduler;

import cronmanager.cloud.FakeMachineClient;
import cronmanager.cloud.MachineException;
import cronmanager.cloud.model.MachineConfig;
import cronmanager.cloud.model.MachineState;
import cronmanager.coordinator.Fixtures;
import cronmanager.coordinator.model.Job;
import cronmanager.coordinator.model.JobStatus;
import cronmanager.coordinator.model.Schedule;
import cronmanager.coordinator.store.Database;
import cronmanager.coordinator.store.JdbcJobRepository;
import cronmanager.coordinator.store.JdbcScheduleRepository;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static cronmanager.cloud.FakeMachineClient.exited;
import static cronmanager.cloud.FakeMachineClient.machine;
import static cronmanager.cloud.FakeMachineClient.started;
import static org.junit.jupiter.api.Assertions.*;

class ReconcilerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Map<String, String> TAGS = Map.of(MachineConfig.MANAGED_BY_KEY, "true");

    private Database db;
    private JdbcScheduleRepository schedules;
    private JdbcJobRepository jobs;
    private FakeMachineClient machines;
    private Schedule schedule;
    private Reconciler reconciler;

    @BeforeEach
    void setUp() {
        db = new Database(Fixtures.memoryUrl("test-reconciler"), 2);
        schedules = new JdbcScheduleRepository(db);
        jobs = new JdbcJobRepository(db);
        machines = new FakeMachineClient();
        schedule = schedules.create(Fixtures.schedule("reconciled").toBuilder().commandTimeout(60).build());
        reconciler = new Reconciler(schedules, jobs, machines.factory(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private Job job(JobStatus status, String machineId) {
        Job job = jobs.create(schedule.id());
        if (machineId != null) {
            jobs.updateMachine(job.id(), machineId);
        }
        switch (status) {
            case RUNNING -> jobs.updateStatus(job.id(), JobStatus.RUNNING);
            case COMPLETED -> jobs.complete(job.id(), 0, "");
            case FAILED -> jobs.fail(job.id(), 1, "earlier failure");
            case PENDING -> {
            }
        }
        return job;
    }

    private void assertInterrupted(Job job) {
        Job stored = jobs.getById(job.id());
        assertEquals(JobStatus.FAILED, stored.status());
        assertEquals(-1, stored.exitCode());
        assertEquals(Reconciler.INTERRUPTED_MESSAGE, stored.stderr());
    }

    @Test
    void healthyRunningJobIsLeftAlone() {
        machines.put(machine("m-1", MachineState.STARTED, TAGS, started(NOW.minusSeconds(10))));
        Job job = job(JobStatus.RUNNING, "m-1");

        Reconciler.Report report = reconciler.reconcile();

        assertEquals(new Reconciler.Report(1, 0, 0, 0, 0), report);
        assertEquals(JobStatus.RUNNING, jobs.getById(job.id()).status());
        assertTrue(machines.destroyed.isEmpty());
    }

    @Test
    void runningJobOnStoppedMachineIsFailed() {
        machines.put(machine("m-1", MachineState.STOPPED, TAGS, started(NOW.minusSeconds(10))));
        Job job = job(JobStatus.RUNNING, "m-1");

        Reconciler.Report report = reconciler.reconcile();

        assertInterrupted(job);
        assertEquals(List.of("m-1"), machines.destroyed);
        assertEquals(1, report.jobsFailed());
        assertEquals(1, report.machinesDestroyed());
    }

    @Test
    void runningJobPastTimeoutIsFailed() {
        machines.put(machine("m-1", MachineState.STARTED, TAGS, started(NOW.minusSeconds(61))));
        Job job = job(JobStatus.RUNNING, "m-1");

        reconciler.reconcile();

        assertInterrupted(job);
        assertEquals(MachineState.DESTROYED, machines.stored("m-1").state());
    }

    @Test
    void runningJobWhoseMachineExitedCleanlyIsCompleted() {
        machines.put(machine("m-1", MachineState.DESTROYED, TAGS,
                exited(NOW.minusSeconds(5), 0), started(NOW.minusSeconds(20))));
        Job job = job(JobStatus.RUNNING, "m-1");

        Reconciler.Report report = reconciler.reconcile();

        Job stored = jobs.getById(job.id());
        assertEquals(JobStatus.COMPLETED, stored.status());
        assertEquals(0, stored.exitCode());
        assertEquals(1, report.jobsSettled());
        assertEquals(0, report.jobsFailed());
        assertTrue(machines.destroyed.isEmpty());
    }

    @Test
    void runningJobWhoseMachineExitedWithErrorKeepsExitCode() {
        machines.put(machine("m-1", MachineState.DESTROYED, TAGS,
                exited(NOW.minusSeconds(5), 3), started(NOW.minusSeconds(20))));
        Job job = job(JobStatus.RUNNING, "m-1");

        reconciler.reconcile();

        Job stored = jobs.getById(job.id());
        assertEquals(JobStatus.FAILED, stored.status());
        assertEquals(3, stored.exitCode());
        assertNotEquals(Reconciler.INTERRUPTED_MESSAGE, stored.stderr());
    }

    @Test
    void exitEventIsReadWhenMachineIsOnlyFoundByJob() {
        machines.listError = new MachineException("api unavailable", 503);
        machines.put(machine("m-1", MachineState.DESTROYED, TAGS,
                exited(NOW.minusSeconds(5), 0), started(NOW.minusSeconds(20))));
        Job job = job(JobStatus.RUNNING, "m-1");

        Reconciler.Report report = reconciler.reconcile();

        assertEquals(JobStatus.COMPLETED, jobs.getById(job.id()).status());
        assertEquals(1, report.jobsSettled());
    }

    @Test
    void destroyedMachineWithoutExitEventFailsJobAsInterrupted() {
        machines.put(machine("m-1", MachineState.DESTROYED, TAGS, started(NOW.minusSeconds(20))));
        Job job = job(JobStatus.RUNNING, "m-1");

        reconciler.reconcile();

        assertInterrupted(job);
        assertTrue(machines.destroyed.isEmpty());
    }

    @Test
    void leakedMachineOfFinishedJobIsDestroyed() {
        machines.put(machine("m-1", MachineState.STARTED, TAGS, started(NOW.minusSeconds(5))));
        Job job = job(JobStatus.COMPLETED, "m-1");

        Reconciler.Report report = reconciler.reconcile();

        assertEquals(List.of("m-1"), machines.destroyed);
        assertEquals(JobStatus.COMPLETED, jobs.getById(job.id()).status());
        assertEquals(0, report.jobsFailed());
    }

    @Test
    void orphanAndUnmanagedMachinesAreNotDestroyed() {
        machines.put(machine("m-orphan", MachineState.STARTED, TAGS));
        machines.put(machine("m-foreign", MachineState.STARTED, Map.of("owner", "someone-else")));

        Reconciler.Report report = reconciler.reconcile();

        assertEquals(1, report.machinesInspected());
        assertEquals(1, report.orphanMachines());
        assertTrue(machines.destroyed.isEmpty());
    }

    @Test
    void pendingJobsAreFailed() {
        machines.put(machine("m-2", MachineState.CREATED, TAGS));
        Job withoutMachine = job(JobStatus.PENDING, null);
        Job withMachine = job(JobStatus.PENDING, "m-2");

        reconciler.reconcile();

        assertInterrupted(withoutMachine);
        assertInterrupted(withMachine);
        assertEquals(List.of("m-2"), machines.destroyed);
    }

    @Test
    void runningJobWhoseMachineIsGoneIsFailed() {
        Job job = job(JobStatus.RUNNING, "m-vanished");

        reconciler.reconcile();

        assertInterrupted(job);
        assertTrue(machines.destroyed.isEmpty());
    }

    @Test
    void listFailureStillReconcilesJobs() {
        machines.listError = new MachineException("api unavailable", 503);
        Job pending = job(JobStatus.PENDING, null);

        reconciler.reconcile();

        assertInterrupted(pending);
    }

    @Test
    void lookupFailureLeavesRunningJobForMonitor() {
        machines.getError = new MachineException("api unavailable", 503);
        machines.listError = new MachineException("api unavailable", 503);
        Job job = job(JobStatus.RUNNING, "m-1");

        reconciler.reconcile();

        assertEquals(JobStatus.RUNNING, jobs.getById(job.id()).status());
    }

    @Test
    void finishedJobsAreNeverRewritten() {
        Job failed = job(JobStatus.FAILED, "m-old");

        Reconciler.Report report = reconciler.reconcile();

        Job stored = jobs.getById(failed.id());
        assertEquals("earlier failure", stored.stderr());
        assertEquals(new Reconciler.Report(0, 0, 0, 0, 0), report);
    }
}
