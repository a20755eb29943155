package cronmanager.coordinator.service;

/**
 * A triggered job ended in {@code failed}. Thrown after the failure has been
 * written to the job row, so callers only need to report it.
 */
public class JobExecutionException extends RuntimeException {

    public enum FailureKind {
        /** The machine could not be launched */
        PROVISIONING,
        /** The command could not be invoked on the machine */
        EXECUTION,
        /** The command ran and failed */
        COMMAND_FAILURE,
        /** The machine did not start, or the command outlived its timeout */
        TIMEOUT,
        /** A job row could not be written */
        STORAGE
    }

    private final FailureKind kind;
    private final long jobId;
    private final int exitCode;

    public JobExecutionException(FailureKind kind, long jobId, int exitCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.jobId = jobId;
        this.exitCode = exitCode;
    }

    public FailureKind kind() {
        return kind;
    }

    public long jobId() {
        return jobId;
    }

    /** Exit code recorded on the job. */
    public int exitCode() {
        return exitCode;
    }
}
