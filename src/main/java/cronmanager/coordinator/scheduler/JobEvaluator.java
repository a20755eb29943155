package cronmanager.coordinator.scheduler;

import cronmanager.cloud.MachineClient;
import cronmanager.cloud.MachineClientFactory;
import cronmanager.cloud.MachineNotFoundException;
import cronmanager.cloud.model.Machine;
import cronmanager.cloud.model.MachineEvent;
import cronmanager.coordinator.model.Job;
import cronmanager.coordinator.model.Schedule;
import cronmanager.coordinator.repository.JobRepository;
import cronmanager.coordinator.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Checks one running job against its machine and closes it out when the
 * machine has finished, vanished or overrun the schedule's timeout.
 *
 * Terminal writes only apply to jobs that are still active, so a job
 * finished concurrently by the engine or the reconciler is left alone.
 */
public class JobEvaluator {

    private static final Logger log = LoggerFactory.getLogger(JobEvaluator.class);

    public static final String MACHINE_GONE_MESSAGE = "machine destroyed before we could interpret the results";

    public enum Outcome {
        /** Machine exited 0, job completed */
        COMPLETED,
        /** Machine exited non-zero, job failed */
        FAILED,
        /** Machine overran the timeout, was destroyed and the job failed */
        TIMED_OUT,
        /** Provider no longer knows the machine, job failed */
        MACHINE_GONE,
        /** Still within its timeout */
        IN_PROGRESS,
        /** Someone else finished the job first */
        ALREADY_TERMINAL,
        /** Nothing to check yet, or the machine is in a state that needs a human */
        SKIPPED
    }

    private final ScheduleRepository scheduleRepository;
    private final JobRepository jobRepository;
    private final MachineClientFactory clientFactory;
    private final Clock clock;

    public JobEvaluator(ScheduleRepository scheduleRepository, JobRepository jobRepository,
            MachineClientFactory clientFactory, Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.jobRepository = jobRepository;
        this.clientFactory = clientFactory;
        this.clock = clock;
    }

    /**
     * Provider and store errors propagate; the job is left for the next tick.
     */
    public Outcome evaluate(Job job) {
        if (!job.hasMachine()) {
            log.warn("Running job {} has no machine yet, skipping", job.id());
            return Outcome.SKIPPED;
        }

        Schedule schedule = scheduleRepository.getById(job.scheduleId());
        MachineClient client = clientFactory.forApp(schedule.appName());

        Machine machine;
        try {
            machine = client.get(job.machineId());
        } catch (MachineNotFoundException e) {
            log.warn("Machine {} of job {} is gone", job.machineId(), job.id());
            return jobRepository.failIfActive(job.id(), -1, MACHINE_GONE_MESSAGE)
                    ? Outcome.MACHINE_GONE
                    : Outcome.ALREADY_TERMINAL;
        }

        if (machine.isDestroyed()) {
            return closeOut(job, machine);
        }
        return enforceTimeout(job, schedule, client, machine);
    }

    private Outcome closeOut(Job job, Machine machine) {
        Optional<Integer> exitCode = machine.exitCode();
        if (exitCode.isEmpty()) {
            log.error("Machine {} of job {} is destroyed but has no exit event", machine.id(), job.id());
            return Outcome.SKIPPED;
        }

        int code = exitCode.get();
        if (code == 0) {
            boolean applied = jobRepository.completeIfActive(job.id(), 0, "");
            if (applied) {
                log.info("Job {} completed", job.id());
            }
            return applied ? Outcome.COMPLETED : Outcome.ALREADY_TERMINAL;
        }

        boolean applied = jobRepository.failIfActive(job.id(), code, "");
        if (applied) {
            log.info("Job {} failed with exit code {}", job.id(), code);
        }
        return applied ? Outcome.FAILED : Outcome.ALREADY_TERMINAL;
    }

    private Outcome enforceTimeout(Job job, Schedule schedule, MachineClient client, Machine machine) {
        Instant started = machine.latestEvent(MachineEvent.START)
                .map(MachineEvent::timestamp)
                .orElse(job.updatedAt());
        Duration elapsed = Duration.between(started, clock.instant());

        if (elapsed.compareTo(schedule.commandTimeoutDuration()) <= 0) {
            return Outcome.IN_PROGRESS;
        }

        log.warn("Machine {} of job {} has been running for {}s, over the {}s timeout",
                machine.id(), job.id(), elapsed.toSeconds(), schedule.commandTimeout());
        client.destroy(machine.id());

        String message = "machine " + machine.id() + " exceeded command timeout of "
                + schedule.commandTimeout() + " seconds";
        return jobRepository.failIfActive(job.id(), -1, message) ? Outcome.TIMED_OUT : Outcome.ALREADY_TERMINAL;
    }
}
