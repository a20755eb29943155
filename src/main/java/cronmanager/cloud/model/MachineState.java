package cronmanager.cloud.model;

import java.util.Locale;

/**
 * Lifecycle state reported by the Machines API.
 */
public enum MachineState {
    /** Accepted by the provider, not booted yet */
    CREATED,
    /** Booting */
    STARTING,
    /** Running and reachable */
    STARTED,
    /** Shutting down */
    STOPPING,
    /** Stopped, may be restarted */
    STOPPED,
    /** Being replaced by an update */
    REPLACING,
    /** Being torn down */
    DESTROYING,
    /** Gone; still queryable for a limited retention window */
    DESTROYED,
    /** Suspended to disk */
    SUSPENDED,
    /** Any state this client does not know about */
    UNKNOWN;

    public String apiName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MachineState fromApi(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
