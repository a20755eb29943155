package cronmanager.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of one execution attempt of a schedule.
 * {@code finishedAt} is set exactly when the status is terminal.
 */
public final class Job {
    private final long id;
    private final long scheduleId;
    private final JobStatus status;
    private final String machineId;
    private final Integer exitCode;
    private final String stdout;
    private final String stderr;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant finishedAt;

    private Job(Builder builder) {
        this.id = builder.id;
        this.scheduleId = builder.scheduleId;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.machineId = builder.machineId;
        this.exitCode = builder.exitCode;
        this.stdout = builder.stdout;
        this.stderr = builder.stderr;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.finishedAt = builder.finishedAt;
    }

    // Getters
    public long id() {
        return id;
    }

    public long scheduleId() {
        return scheduleId;
    }

    public JobStatus status() {
        return status;
    }

    /** Null until provisioning succeeded. */
    public String machineId() {
        return machineId;
    }

    public Integer exitCode() {
        return exitCode;
    }

    public String stdout() {
        return stdout;
    }

    /** Command stderr, or the failure message for failed jobs. */
    public String stderr() {
        return stderr;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean hasMachine() {
        return machineId != null && !machineId.isBlank();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .scheduleId(scheduleId)
                .status(status)
                .machineId(machineId)
                .exitCode(exitCode)
                .stdout(stdout)
                .stderr(stderr)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long id;
        private long scheduleId;
        private JobStatus status = JobStatus.PENDING;
        private String machineId;
        private Integer exitCode;
        private String stdout;
        private String stderr;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant finishedAt;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder scheduleId(long scheduleId) {
            this.scheduleId = scheduleId;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder machineId(String machineId) {
            this.machineId = machineId;
            return this;
        }

        public Builder exitCode(Integer exitCode) {
            this.exitCode = exitCode;
            return this;
        }

        public Builder stdout(String stdout) {
            this.stdout = stdout;
            return this;
        }

        public Builder stderr(String stderr) {
            this.stderr = stderr;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return id == job.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", scheduleId=" + scheduleId + ", status=" + status
                + ", machineId=" + machineId + ", exitCode=" + exitCode + "}";
    }
}
