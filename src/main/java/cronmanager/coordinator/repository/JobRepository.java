package cronmanager.coordinator.repository;

import cronmanager.coordinator.model.Job;
import cronmanager.coordinator.model.JobStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Job persistence.
 * Every mutation bumps {@code updated_at}.
 */
public interface JobRepository {

    /**
     * Insert a pending job for a schedule.
     *
     * @return the stored row, including its assigned id
     */
    Job create(long scheduleId);

    void updateStatus(long jobId, JobStatus status);

    void updateMachine(long jobId, String machineId);

    /**
     * Mark the job failed. The message lands in the stderr column.
     * Applies regardless of the current status.
     */
    void fail(long jobId, int exitCode, String message);

    /**
     * Mark the job completed. Applies regardless of the current status.
     */
    void complete(long jobId, int exitCode, String stdout);

    /**
     * Like {@link #fail} but only while the job is pending or running.
     *
     * @return true if the row changed
     */
    boolean failIfActive(long jobId, int exitCode, String message);

    /**
     * Like {@link #complete} but only while the job is pending or running.
     *
     * @return true if the row changed
     */
    boolean completeIfActive(long jobId, int exitCode, String stdout);

    Optional<Job> findById(long jobId);

    Optional<Job> findByMachineId(String machineId);

    /** Most recent first. */
    List<Job> findBySchedule(long scheduleId, int limit);

    List<Job> findByStatus(JobStatus status);

    /** Jobs that are pending or running. */
    List<Job> findReconcilable();

    default Job getById(long jobId) {
        return findById(jobId).orElseThrow(() -> NotFoundException.job(jobId));
    }
}
