package cronmanager.cloud;

/**
 * A wait or exec call ran out of time before the machine answered.
 */
public class MachineTimeoutException extends MachineException {

    public MachineTimeoutException(String message) {
        super(message, 408);
    }
}
