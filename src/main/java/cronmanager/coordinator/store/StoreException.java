package cronmanager.coordinator.store;

/**
 * Any persistence failure other than a missing row.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
