package cronmanager.coordinator.scheduler;

import cronmanager.cloud.MachineClient;
import cronmanager.cloud.MachineClientFactory;
import cronmanager.cloud.MachineException;
import cronmanager.cloud.MachineNotFoundException;
import cronmanager.cloud.model.Machine;
import cronmanager.cloud.model.MachineEvent;
import cronmanager.cloud.model.MachineState;
import cronmanager.coordinator.model.Job;
import cronmanager.coordinator.model.Schedule;
import cronmanager.coordinator.repository.JobRepository;
import cronmanager.coordinator.repository.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Startup sweep that repairs jobs and machines left inconsistent by an
 * unclean shutdown. Must finish before the monitor and the API start.
 *
 * Pass 1 walks the tagged machines of every application and settles the job
 * bound to each. Pass 2 walks the jobs that are still pending or running.
 * A destroyed machine with an exit event settles its job from that exit code.
 * Anything whose outcome cannot be known is failed with exit code -1 and
 * {@link #INTERRUPTED_MESSAGE}.
 *
 * Store errors propagate. Provider errors are logged and the item is skipped.
 */
public class Reconciler {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    public static final String INTERRUPTED_MESSAGE = "job was interrupted on shutdown";

    private final ScheduleRepository scheduleRepository;
    private final JobRepository jobRepository;
    private final MachineClientFactory clientFactory;
    private final Clock clock;

    public Reconciler(ScheduleRepository scheduleRepository, JobRepository jobRepository,
            MachineClientFactory clientFactory, Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.jobRepository = jobRepository;
        this.clientFactory = clientFactory;
        this.clock = clock;
    }

    /**
     * Totals of one run.
     *
     * @param machinesInspected tagged machines looked at in pass 1
     * @param orphanMachines    tagged machines no job points to (logged, never deleted)
     * @param machinesDestroyed machines destroyed by either pass
     * @param jobsFailed        jobs failed as interrupted by either pass
     * @param jobsSettled       jobs completed or failed from the exit event of their machine
     */
    public record Report(int machinesInspected, int orphanMachines, int machinesDestroyed, int jobsFailed,
            int jobsSettled) {
    }

    private static final class Tally {
        int inspected;
        int orphans;
        int destroyed;
        int failed;
        int settled;

        Report toReport() {
            return new Report(inspected, orphans, destroyed, failed, settled);
        }
    }

    public Report reconcile() {
        log.info("Reconciling jobs and machines");

        Map<Long, Schedule> schedules = new LinkedHashMap<>();
        for (Schedule schedule : scheduleRepository.findAll()) {
            schedules.put(schedule.id(), schedule);
        }

        Tally tally = new Tally();
        reconcileMachines(schedules, tally);
        reconcileJobs(schedules, tally);

        Report report = tally.toReport();
        log.info("Reconciliation done: {} machine(s) inspected, {} orphan(s), {} destroyed, {} job(s) failed,"
                        + " {} job(s) settled from exit events",
                report.machinesInspected(), report.orphanMachines(), report.machinesDestroyed(), report.jobsFailed(),
                report.jobsSettled());
        return report;
    }

    // --- Pass 1: machines ---

    private void reconcileMachines(Map<Long, Schedule> schedules, Tally tally) {
        Set<String> apps = new LinkedHashSet<>();
        for (Schedule schedule : schedules.values()) {
            apps.add(schedule.appName());
        }

        for (String app : apps) {
            MachineClient client = clientFactory.forApp(app);
            List<Machine> machines;
            try {
                machines = client.list(null);
            } catch (MachineException e) {
                log.error("Failed to list machines of app {}, skipping it", app, e);
                continue;
            }

            for (Machine machine : machines) {
                if (!machine.isManaged()) {
                    continue;
                }
                tally.inspected++;
                try (MDC.MDCCloseable a = MDC.putCloseable("app-name", app);
                        MDC.MDCCloseable m = MDC.putCloseable("machine-id", machine.id())) {
                    reconcileMachine(client, machine, schedules, tally);
                }
            }
        }
    }

    private void reconcileMachine(MachineClient client, Machine machine, Map<Long, Schedule> schedules,
            Tally tally) {
        Optional<Job> found = jobRepository.findByMachineId(machine.id());
        if (found.isEmpty()) {
            log.warn("Tagged machine {} ({}) has no job, leaving it alone", machine.id(), machine.state().apiName());
            tally.orphans++;
            return;
        }

        Job job = found.get();
        switch (job.status()) {
            case PENDING, RUNNING -> {
                if (settleFromExit(job, machine, tally)) {
                    return;
                }
                if (machine.state() != MachineState.STARTED) {
                    log.info("Job {} is {} but its machine is {}", job.id(), job.status(), machine.state().apiName());
                    destroyAndFail(client, machine, job, tally);
                } else if (overTimeout(job, machine, schedules.get(job.scheduleId()))) {
                    log.info("Job {} ran past its timeout while we were down", job.id());
                    destroyAndFail(client, machine, job, tally);
                }
            }
            case COMPLETED, FAILED -> {
                if (!machine.isDestroyed()) {
                    log.info("Destroying leaked machine {} of finished job {}", machine.id(), job.id());
                    destroy(client, machine.id(), tally);
                }
            }
        }
    }

    // --- Pass 2: jobs ---

    private void reconcileJobs(Map<Long, Schedule> schedules, Tally tally) {
        for (Job job : jobRepository.findReconcilable()) {
            try (MDC.MDCCloseable j = MDC.putCloseable("job-id", String.valueOf(job.id()))) {
                reconcileJob(job, schedules.get(job.scheduleId()), tally);
            }
        }
    }

    private void reconcileJob(Job job, Schedule schedule, Tally tally) {
        if (schedule == null) {
            log.warn("Job {} belongs to unknown schedule {}", job.id(), job.scheduleId());
            failInterrupted(job, tally);
            return;
        }
        MachineClient client = clientFactory.forApp(schedule.appName());

        switch (job.status()) {
            case PENDING -> {
                if (job.hasMachine()) {
                    destroy(client, job.machineId(), tally);
                }
                log.info("Job {} never got past pending", job.id());
                failInterrupted(job, tally);
            }
            case RUNNING -> reconcileRunning(job, schedule, client, tally);
            case COMPLETED, FAILED -> log.debug("Job {} finished while reconciling", job.id());
        }
    }

    private void reconcileRunning(Job job, Schedule schedule, MachineClient client, Tally tally) {
        if (!job.hasMachine()) {
            log.warn("Running job {} has no machine", job.id());
            failInterrupted(job, tally);
            return;
        }

        Machine machine;
        try {
            machine = client.get(job.machineId());
        } catch (MachineNotFoundException e) {
            log.info("Machine {} of running job {} no longer exists", job.machineId(), job.id());
            failInterrupted(job, tally);
            return;
        } catch (MachineException e) {
            log.error("Failed to look up machine {} of job {}, leaving it to the monitor",
                    job.machineId(), job.id(), e);
            return;
        }

        if (settleFromExit(job, machine, tally)) {
            return;
        }
        if (machine.state() != MachineState.STARTED || overTimeout(job, machine, schedule)) {
            destroyAndFail(client, machine, job, tally);
        }
    }

    // --- Helpers ---

    /**
     * Record the outcome a destroyed machine left in its event log.
     *
     * @return false if the machine is not destroyed or has no exit event
     */
    private boolean settleFromExit(Job job, Machine machine, Tally tally) {
        if (!machine.isDestroyed()) {
            return false;
        }
        Optional<Integer> exitCode = machine.exitCode();
        if (exitCode.isEmpty()) {
            return false;
        }

        int code = exitCode.get();
        boolean applied = code == 0
                ? jobRepository.completeIfActive(job.id(), 0, "")
                : jobRepository.failIfActive(job.id(), code, "");
        if (applied) {
            tally.settled++;
            log.info("Job {} exited with code {} while we were down", job.id(), code);
        }
        return true;
    }

    private boolean overTimeout(Job job, Machine machine, Schedule schedule) {
        if (schedule == null) {
            return true;
        }
        Instant started = machine.latestEvent(MachineEvent.START)
                .map(MachineEvent::timestamp)
                .orElse(job.updatedAt());
        return Duration.between(started, clock.instant()).compareTo(schedule.commandTimeoutDuration()) > 0;
    }

    private void destroyAndFail(MachineClient client, Machine machine, Job job, Tally tally) {
        if (!machine.isDestroyed()) {
            destroy(client, machine.id(), tally);
        }
        failInterrupted(job, tally);
    }

    /**
     * A machine that survives this stays tagged and bound to a terminal job,
     * so the next reconcile destroys it as leaked.
     */
    private void destroy(MachineClient client, String machineId, Tally tally) {
        try {
            client.destroy(machineId);
            tally.destroyed++;
        } catch (MachineException e) {
            log.error("Failed to destroy machine {}", machineId, e);
        }
    }

    private void failInterrupted(Job job, Tally tally) {
        if (jobRepository.failIfActive(job.id(), -1, INTERRUPTED_MESSAGE)) {
            tally.failed++;
            log.info("Failed job {} as interrupted", job.id());
        }
    }
}
