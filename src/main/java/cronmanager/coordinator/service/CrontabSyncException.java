package cronmanager.coordinator.service;

/**
 * The crontab could not be installed. The previously installed file is untouched.
 */
public class CrontabSyncException extends RuntimeException {

    private final String toolOutput;

    public CrontabSyncException(String message, String toolOutput) {
        super(toolOutput == null || toolOutput.isBlank() ? message : message + ": " + toolOutput.trim());
        this.toolOutput = toolOutput;
    }

    public CrontabSyncException(String message, Throwable cause) {
        super(message, cause);
        this.toolOutput = null;
    }

    /** Output of the install tool, if it ran. */
    public String toolOutput() {
        return toolOutput;
    }
}
