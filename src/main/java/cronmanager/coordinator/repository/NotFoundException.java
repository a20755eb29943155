package cronmanager.coordinator.repository;

/**
 * A schedule or job that the caller asked for does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException schedule(long id) {
        return new NotFoundException("schedule not found: " + id);
    }

    public static NotFoundException schedule(String name) {
        return new NotFoundException("schedule not found: " + name);
    }

    public static NotFoundException job(long id) {
        return new NotFoundException("job not found: " + id);
    }
}
