package cronmanager.coordinator.service;

import cronmanager.cloud.FakeMachineClient;
import cronmanager.cloud.MachineClientFactory;
import cronmanager.cloud.MachineException;
import cronmanager.cloud.MachineTimeoutException;
import cronmanager.cloud.model.ExecResult;
import cronmanager.cloud.model.LaunchRequest;
import cronmanager.cloud.model.Machine;
import cronmanager.cloud.model.MachineConfig;
import cronmanager.coordinator.Fixtures;
import cronmanager.coordinator.config.ManagerConfig;
import cronmanager.coordinator.model.ExecutionMode;
import cronmanager.coordinator.model.Job;
import cronmanager.coordinator.model.JobStatus;
import cronmanager.coordinator.model.Schedule;
import cronmanager.coordinator.repository.NotFoundException;
import cronmanager.coordinator.store.Database;
import cronmanager.coordinator.store.JdbcJobRepository;
import cronmanager.coordinator.store.JdbcScheduleRepository;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobProcessorTest {

    private Database db;
    private JdbcScheduleRepository schedules;
    private JdbcJobRepository jobs;
    private FakeMachineClient machines;
    private Schedule schedule;

    @BeforeEach
    void setUp() {
        db = new Database(Fixtures.memoryUrl("test-processor"), 2);
        schedules = new JdbcScheduleRepository(db);
        jobs = new JdbcJobRepository(db);
        machines = new FakeMachineClient();
        schedule = schedules.create(Fixtures.schedule("nightly").toBuilder()
                .command("echo hello")
                .commandTimeout(45)
                .build());
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private JobProcessor processor(ExecutionMode mode) {
        ManagerConfig config = ManagerConfig.defaults().withExecutionMode(mode);
        return new JobProcessor(schedules, jobs, machines.factory(), config);
    }

    private Job onlyJob() {
        List<Job> all = jobs.findBySchedule(schedule.id(), 10);
        assertEquals(1, all.size());
        return all.get(0);
    }

    @Test
    void successfulRunCompletesAndDestroysMachine() {
        machines.execResult = new ExecResult(0, "hello\n", "");

        Job job = processor(ExecutionMode.EXEC).process(schedule.id());

        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals(0, job.exitCode());
        assertEquals("hello\n", job.stdout());
        assertEquals("m-1", job.machineId());
        assertNotNull(job.finishedAt());
        assertEquals(List.of("m-1"), machines.destroyed);
        assertEquals(List.of(List.of("/bin/sh", "-c", "echo hello")), machines.executed);
        assertEquals(List.of("cron-app"), machines.appsSeen);
    }

    @Test
    void launchRequestIsTaggedForTheJob() {
        Job job = processor(ExecutionMode.EXEC).process(schedule.id());

        LaunchRequest request = machines.launched.get(0);
        assertEquals("nightly-job-" + job.id(), request.name());
        assertEquals("ord", request.region());
        assertEquals("true", request.config().metadata().get(MachineConfig.MANAGED_BY_KEY));
        assertEquals(String.valueOf(job.id()), request.config().metadata().get(MachineConfig.JOB_ID_KEY));
        assertEquals("nightly", request.config().metadata().get(MachineConfig.SCHEDULE_KEY));
        assertNull(request.config().init());
    }

    @Test
    void provisioningFailureFailsWithoutMachine() {
        machines.provisionError = new MachineException("no capacity in ord", 422);

        JobExecutionException e = assertThrows(JobExecutionException.class,
                () -> processor(ExecutionMode.EXEC).process(schedule.id()));

        assertEquals(JobExecutionException.FailureKind.PROVISIONING, e.kind());
        Job job = onlyJob();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(1, job.exitCode());
        assertNull(job.machineId());
        assertTrue(job.stderr().startsWith("failed to provision machine: "), job.stderr());
        assertTrue(machines.destroyed.isEmpty());
    }

    @Test
    void unexpectedProvisioningErrorFailsJob() {
        FakeMachineClient rejecting = new FakeMachineClient() {
            @Override
            public Machine provision(LaunchRequest request) {
                throw new IllegalArgumentException("bad request");
            }
        };
        JobProcessor processor = new JobProcessor(schedules, jobs, rejecting.factory(), ManagerConfig.defaults());

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> processor.process(schedule.id()));

        assertEquals(JobExecutionException.FailureKind.PROVISIONING, e.kind());
        Job job = onlyJob();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(1, job.exitCode());
        assertEquals("failed to provision machine: bad request", job.stderr());
    }

    @Test
    void clientCreationFailureFailsJob() {
        MachineClientFactory noToken = appName -> {
            throw new IllegalStateException("FLY_API_TOKEN is not set");
        };
        JobProcessor processor = new JobProcessor(schedules, jobs, noToken, ManagerConfig.defaults());

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> processor.process(schedule.id()));

        assertEquals(JobExecutionException.FailureKind.PROVISIONING, e.kind());
        Job job = onlyJob();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(1, job.exitCode());
        assertNull(job.machineId());
    }

    @Test
    void scheduleDeletedDuringProvisioningStillDestroysMachine() {
        FakeMachineClient racing = new FakeMachineClient() {
            @Override
            public Machine provision(LaunchRequest request) {
                schedules.deleteById(schedule.id());
                return super.provision(request);
            }
        };
        JobProcessor processor = new JobProcessor(schedules, jobs, racing.factory(), ManagerConfig.defaults());

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> processor.process(schedule.id()));

        assertEquals(JobExecutionException.FailureKind.STORAGE, e.kind());
        assertTrue(e.getMessage().startsWith("failed to record machine on job: "), e.getMessage());
        assertInstanceOf(NotFoundException.class, e.getCause());
        assertEquals(List.of("m-1"), racing.destroyed);
        assertTrue(racing.executed.isEmpty());
        assertTrue(jobs.findBySchedule(schedule.id(), 10).isEmpty());
    }

    @Test
    void scheduleDeletedDuringInitLaunchStillDestroysMachine() {
        FakeMachineClient racing = new FakeMachineClient() {
            @Override
            public Machine provision(LaunchRequest request) {
                schedules.deleteById(schedule.id());
                return super.provision(request);
            }
        };
        ManagerConfig config = ManagerConfig.defaults().withExecutionMode(ExecutionMode.INIT);
        JobProcessor processor = new JobProcessor(schedules, jobs, racing.factory(), config);

        assertThrows(JobExecutionException.class, () -> processor.process(schedule.id()));

        assertEquals(List.of("m-1"), racing.destroyed);
    }

    @Test
    void nonZeroExitFailsWithThatCode() {
        machines.execResult = new ExecResult(3, "partial", "");

        JobExecutionException e = assertThrows(JobExecutionException.class,
                () -> processor(ExecutionMode.EXEC).process(schedule.id()));

        assertEquals(JobExecutionException.FailureKind.COMMAND_FAILURE, e.kind());
        Job job = onlyJob();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(3, job.exitCode());
        assertEquals("job failed with exit code 3", job.stderr());
        assertEquals(List.of(job.machineId()), machines.destroyed);
    }

    @Test
    void stderrWithZeroExitStillFails() {
        machines.execResult = new ExecResult(0, "", "warning: disk almost full");

        assertThrows(JobExecutionException.class, () -> processor(ExecutionMode.EXEC).process(schedule.id()));

        Job job = onlyJob();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(-1, job.exitCode());
        assertEquals("warning: disk almost full", job.stderr());
    }

    @Test
    void execErrorFailsAndDestroys() {
        machines.execError = new MachineException("connection reset");

        JobExecutionException e = assertThrows(JobExecutionException.class,
                () -> processor(ExecutionMode.EXEC).process(schedule.id()));

        assertEquals(JobExecutionException.FailureKind.EXECUTION, e.kind());
        Job job = onlyJob();
        assertEquals(1, job.exitCode());
        assertTrue(job.stderr().startsWith("failed to execute job: "), job.stderr());
        assertEquals(1, machines.destroyed.size());
    }

    @Test
    void machineThatNeverStartsTimesOut() {
        machines.waitError = new MachineTimeoutException("machine m-1 did not reach started");

        JobExecutionException e = assertThrows(JobExecutionException.class,
                () -> processor(ExecutionMode.EXEC).process(schedule.id()));

        assertEquals(JobExecutionException.FailureKind.TIMEOUT, e.kind());
        Job job = onlyJob();
        assertEquals(JobStatus.FAILED, job.status());
        assertTrue(job.stderr().startsWith("failed to wait for machine to start: "), job.stderr());
        assertTrue(machines.executed.isEmpty());
        assertEquals(List.of("m-1"), machines.destroyed);
    }

    @Test
    void initModeLeavesJobRunningForTheMonitor() {
        Job job = processor(ExecutionMode.INIT).process(schedule.id());

        assertEquals(JobStatus.RUNNING, job.status());
        assertEquals("m-1", job.machineId());
        assertTrue(machines.destroyed.isEmpty());
        assertTrue(machines.executed.isEmpty());

        MachineConfig launched = machines.launched.get(0).config();
        assertEquals(List.of("/bin/sh", "-c", "echo hello"), launched.init().exec());
        assertEquals(MachineConfig.RESTART_NO, launched.restart().policy());
        assertTrue(launched.autoDestroy());
    }

    @Test
    void unknownScheduleCreatesNoJob() {
        assertThrows(NotFoundException.class, () -> processor(ExecutionMode.EXEC).process(schedule.id() + 100));
        assertTrue(jobs.findReconcilable().isEmpty());
        assertTrue(machines.launched.isEmpty());
    }

    @Test
    void destroyFailureDoesNotChangeOutcome() {
        machines.destroyError = new MachineException("api unavailable", 503);

        Job job = processor(ExecutionMode.EXEC).process(schedule.id());

        assertEquals(JobStatus.COMPLETED, job.status());
    }
}
