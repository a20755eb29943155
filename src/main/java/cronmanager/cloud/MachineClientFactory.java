package cronmanager.cloud;

/**
 * Hands out {@link MachineClient}s scoped to one application.
 */
@FunctionalInterface
public interface MachineClientFactory {

    MachineClient forApp(String appName);
}
