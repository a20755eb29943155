package cronmanager.cloud;

/**
 * The machine does not exist, or has aged out of the provider's retention window.
 */
public class MachineNotFoundException extends MachineException {

    private final String machineId;

    public MachineNotFoundException(String machineId) {
        super("machine not found: " + machineId, 404);
        this.machineId = machineId;
    }

    public String machineId() {
        return machineId;
    }
}
