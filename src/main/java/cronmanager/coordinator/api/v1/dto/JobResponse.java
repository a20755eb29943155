package cronmanager.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import cronmanager.coordinator.model.Job;

import java.time.Instant;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("id") long id,
        @JsonProperty("schedule_id") long scheduleId,
        @JsonProperty("status") String status,
        @JsonProperty("machine_id") String machineId,
        @JsonProperty("exit_code") Integer exitCode,
        @JsonProperty("stdout") String stdout,
        @JsonProperty("stderr") String stderr,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("finished_at") Instant finishedAt) {

    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.scheduleId(),
                job.status().dbValue(),
                job.machineId(),
                job.exitCode(),
                job.stdout(),
                job.stderr(),
                job.createdAt(),
                job.updatedAt(),
                job.finishedAt());
    }

    /** Without command output, for list responses */
    public JobResponse compact() {
        return new JobResponse(id, scheduleId, status, machineId, exitCode, null, null,
                createdAt, updatedAt, finishedAt);
    }
}
