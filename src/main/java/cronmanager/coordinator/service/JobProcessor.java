package cronmanager.coordinator.service;

import cronmanager.cloud.MachineClient;
import cronmanager.cloud.MachineClientFactory;
import cronmanager.cloud.MachineException;
import cronmanager.cloud.MachineTimeoutException;
import cronmanager.cloud.model.ExecResult;
import cronmanager.cloud.model.Machine;
import cronmanager.cloud.model.MachineState;
import cronmanager.coordinator.config.ManagerConfig;
import cronmanager.coordinator.model.ExecutionMode;
import cronmanager.coordinator.model.Job;
import cronmanager.coordinator.model.JobStatus;
import cronmanager.coordinator.model.Schedule;
import cronmanager.coordinator.repository.JobRepository;
import cronmanager.coordinator.repository.ScheduleRepository;
import cronmanager.coordinator.service.JobExecutionException.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Locale;

/**
 * Runs one trigger of a schedule: creates the job, provisions a machine and
 * drives the job to a terminal state (exec mode) or to {@code running}
 * (init mode, where the monitor observes the exit).
 *
 * Nothing is retried here; the next cron tick is the retry.
 */
public class JobProcessor {

    private static final Logger log = LoggerFactory.getLogger(JobProcessor.class);

    private final ScheduleRepository scheduleRepository;
    private final JobRepository jobRepository;
    private final MachineClientFactory clientFactory;
    private final ExecutionMode mode;
    private final Duration startTimeout;

    public JobProcessor(ScheduleRepository scheduleRepository, JobRepository jobRepository,
            MachineClientFactory clientFactory, ManagerConfig config) {
        this.scheduleRepository = scheduleRepository;
        this.jobRepository = jobRepository;
        this.clientFactory = clientFactory;
        this.mode = config.executionMode();
        this.startTimeout = config.machineStartTimeout();
    }

    /**
     * Trigger a schedule.
     *
     * @return the job as last written
     * @throws cronmanager.coordinator.repository.NotFoundException if the schedule does not exist (no job is
     *                                                              created)
     * @throws JobExecutionException                                if the job ended in {@code failed}
     */
    public Job process(long scheduleId) {
        Schedule schedule = scheduleRepository.getById(scheduleId);

        try (MDC.MDCCloseable s = MDC.putCloseable("schedule-id", String.valueOf(schedule.id()));
                MDC.MDCCloseable a = MDC.putCloseable("app-name", schedule.appName())) {

            Job job = jobRepository.create(schedule.id());
            try (MDC.MDCCloseable j = MDC.putCloseable("job-id", String.valueOf(job.id()))) {
                log.info("Processing job for schedule {} ({} mode)",
                        schedule.name(), mode.name().toLowerCase(Locale.ROOT));
                return run(schedule, job);
            }
        }
    }

    private Job run(Schedule schedule, Job job) {
        MachineClient client;
        Machine machine;
        try {
            client = clientFactory.forApp(schedule.appName());
            machine = client.provision(LaunchRequests.forJob(schedule, job, mode));
        } catch (RuntimeException e) {
            throw fail(job, FailureKind.PROVISIONING, 1, "failed to provision machine: " + e.getMessage(), e);
        }

        // From here on the machine is destroyed unless an init-mode job owns it.
        String machineId = machine.id();
        try (MDC.MDCCloseable m = MDC.putCloseable("machine-id", machineId)) {
            boolean handedOff = false;
            try {
                record(job, "failed to record machine on job",
                        () -> jobRepository.updateMachine(job.id(), machineId));
                record(job, "failed to mark job running",
                        () -> jobRepository.updateStatus(job.id(), JobStatus.RUNNING));

                if (mode == ExecutionMode.INIT) {
                    Job launched = jobRepository.getById(job.id());
                    handedOff = true;
                    log.info("Machine launched, completion will be picked up by the monitor");
                    return launched;
                }

                execute(schedule, job, client, machine);
                return jobRepository.getById(job.id());
            } finally {
                if (!handedOff) {
                    destroyQuietly(client, machineId);
                }
            }
        }
    }

    /**
     * A store write after provisioning. The job row may be gone if its
     * schedule was deleted in the meantime.
     */
    private void record(Job job, String what, Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            throw fail(job, FailureKind.STORAGE, 1, what + ": " + e.getMessage(), e);
        }
    }

    private void execute(Schedule schedule, Job job, MachineClient client, Machine machine) {
        try {
            client.waitForState(machine, MachineState.STARTED, startTimeout);
        } catch (MachineTimeoutException e) {
            throw fail(job, FailureKind.TIMEOUT, 1, "failed to wait for machine to start: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw fail(job, FailureKind.EXECUTION, 1, "failed to wait for machine to start: " + e.getMessage(), e);
        }

        ExecResult result;
        try {
            result = client.exec(LaunchRequests.shell(schedule.command()), machine.id(),
                    schedule.commandTimeoutDuration());
        } catch (MachineTimeoutException e) {
            throw fail(job, FailureKind.TIMEOUT, 1, "failed to execute job: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw fail(job, FailureKind.EXECUTION, 1, "failed to execute job: " + e.getMessage(), e);
        }

        if (result.exitCode() != 0) {
            throw fail(job, FailureKind.COMMAND_FAILURE, result.exitCode(),
                    "job failed with exit code " + result.exitCode(), null);
        }

        // The remote exec path does not always propagate a failing exit code.
        if (!result.stderr().isEmpty()) {
            throw fail(job, FailureKind.COMMAND_FAILURE, -1, result.stderr(), null);
        }

        String stdout = result.stdout();
        record(job, "failed to record job completion", () -> jobRepository.complete(job.id(), 0, stdout));
        log.info("Job completed");
    }

    /**
     * Record the failure on the job and build the exception to throw.
     */
    private JobExecutionException fail(Job job, FailureKind kind, int exitCode, String message, Throwable cause) {
        log.error("Job failed ({}): {}", kind, message, cause);
        try {
            jobRepository.fail(job.id(), exitCode, message);
        } catch (RuntimeException e) {
            log.error("Failed to record failure of job {}", job.id(), e);
            if (cause == null) {
                cause = e;
            } else {
                cause.addSuppressed(e);
            }
        }
        return new JobExecutionException(kind, job.id(), exitCode, message, cause);
    }

    private void destroyQuietly(MachineClient client, String machineId) {
        try {
            client.destroy(machineId);
        } catch (MachineException e) {
            log.error("Failed to destroy machine {}, the reconciler will retry", machineId, e);
        }
    }
}
