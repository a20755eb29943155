package cronmanager.coordinator.service;

import cronmanager.coordinator.model.Job;
import cronmanager.coordinator.repository.JobRepository;
import cronmanager.coordinator.repository.ScheduleRepository;

import java.util.List;

/**
 * Read side of jobs, plus the trigger entry point shared by HTTP and CLI.
 */
public class JobService {

    public static final int DEFAULT_LIST_LIMIT = 10;
    public static final int MAX_LIST_LIMIT = 500;

    private final ScheduleRepository scheduleRepository;
    private final JobRepository jobRepository;
    private final JobProcessor jobProcessor;

    public JobService(ScheduleRepository scheduleRepository, JobRepository jobRepository, JobProcessor jobProcessor) {
        this.scheduleRepository = scheduleRepository;
        this.jobRepository = jobRepository;
        this.jobProcessor = jobProcessor;
    }

    public Job get(long jobId) {
        return jobRepository.getById(jobId);
    }

    /**
     * Most recent jobs of a schedule.
     *
     * @throws cronmanager.coordinator.repository.NotFoundException if the schedule does not exist
     */
    public List<Job> listForSchedule(long scheduleId, int limit) {
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        scheduleRepository.getById(scheduleId);
        return jobRepository.findBySchedule(scheduleId, limit);
    }

    public Job trigger(long scheduleId) {
        return jobProcessor.process(scheduleId);
    }
}
