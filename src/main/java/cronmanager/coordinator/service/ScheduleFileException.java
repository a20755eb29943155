package cronmanager.coordinator.service;

/**
 * The schedules file could not be read or contains an invalid definition.
 * Nothing is written to the store when this is thrown.
 */
public class ScheduleFileException extends RuntimeException {

    public ScheduleFileException(String message) {
        super(message);
    }

    public ScheduleFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
