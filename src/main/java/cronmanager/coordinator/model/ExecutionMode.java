package cronmanager.coordinator.model;

import java.util.Locale;

/**
 * How a job's command reaches its machine.
 */
public enum ExecutionMode {
    /** Boot the machine, run the command through the exec endpoint and wait for the result */
    EXEC,
    /** Bake the command into the machine's init; the monitor observes the exit */
    INIT;

    public static ExecutionMode parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown execution mode '" + value + "', expected exec or init", e);
        }
    }
}
