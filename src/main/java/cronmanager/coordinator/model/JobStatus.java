package cronmanager.coordinator.model;

import java.util.Locale;

/**
 * Lifecycle of a job. Transitions only move forward:
 * {@code PENDING -> RUNNING -> COMPLETED | FAILED}.
 */
public enum JobStatus {
    /** Row created, machine not provisioned or not confirmed yet */
    PENDING,
    /** Machine provisioned and the command is executing */
    RUNNING,
    /** Command exited 0 */
    COMPLETED,
    /** Command failed, timed out, or its outcome could not be determined */
    FAILED;

    public boolean isTerminal() {
        return switch (this) {
            case PENDING, RUNNING -> false;
            case COMPLETED, FAILED -> true;
        };
    }

    /** Value stored in the {@code jobs.status} column. */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromDb(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
