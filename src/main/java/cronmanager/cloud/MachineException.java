package cronmanager.cloud;

/**
 * Failure talking to the remote compute provider.
 */
public class MachineException extends RuntimeException {

    private final int statusCode;

    public MachineException(String message) {
        this(message, -1, null);
    }

    public MachineException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public MachineException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    protected MachineException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status returned by the provider, or -1 for transport failures. */
    public int statusCode() {
        return statusCode;
    }
}
