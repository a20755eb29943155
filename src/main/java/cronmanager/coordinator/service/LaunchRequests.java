package cronmanager.coordinator.service;

import cronmanager.cloud.model.LaunchRequest;
import cronmanager.cloud.model.MachineConfig;
import cronmanager.coordinator.model.ExecutionMode;
import cronmanager.coordinator.model.Job;
import cronmanager.coordinator.model.Schedule;

import java.util.List;
import java.util.Map;

/**
 * Turns a schedule and its job into a machine launch request.
 */
public final class LaunchRequests {

    private LaunchRequests() {
    }

    /** How every command is run on a machine. */
    public static List<String> shell(String command) {
        return List.of("/bin/sh", "-c", command);
    }

    public static LaunchRequest forJob(Schedule schedule, Job job, ExecutionMode mode) {
        MachineConfig config = schedule.config().withMetadata(Map.of(
                MachineConfig.MANAGED_BY_KEY, "true",
                MachineConfig.JOB_ID_KEY, String.valueOf(job.id()),
                MachineConfig.SCHEDULE_KEY, schedule.name()));

        if (mode == ExecutionMode.INIT) {
            config = config.runOnce(shell(schedule.command()));
        }

        return new LaunchRequest(schedule.name() + "-job-" + job.id(), schedule.region(), config);
    }
}
