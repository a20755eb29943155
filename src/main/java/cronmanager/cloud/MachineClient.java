package cronmanager.cloud;

import cronmanager.cloud.model.ExecResult;
import cronmanager.cloud.model.LaunchRequest;
import cronmanager.cloud.model.Machine;
import cronmanager.cloud.model.MachineState;

import java.time.Duration;
import java.util.List;

/**
 * Operations on the machines of a single application.
 * Obtained from {@link MachineClientFactory#forApp(String)}.
 *
 * All methods block on the provider and throw {@link MachineException} on failure.
 */
public interface MachineClient {

    /** Application this client is scoped to. */
    String appName();

    /**
     * Launch a machine.
     *
     * @return the created machine; its id must be persisted before anything else
     */
    Machine provision(LaunchRequest request);

    /**
     * Block until the machine reaches {@code state}.
     *
     * @throws MachineTimeoutException if it does not get there within {@code timeout}
     */
    Machine waitForState(Machine machine, MachineState state, Duration timeout);

    /**
     * Run a command on a started machine and wait for it to finish.
     *
     * @throws MachineTimeoutException if the command outlives {@code timeout}
     */
    ExecResult exec(List<String> command, String machineId, Duration timeout);

    /**
     * @throws MachineNotFoundException if the provider no longer knows the machine
     */
    Machine get(String machineId);

    /**
     * Force-destroy a machine. A machine that is already gone counts as destroyed.
     */
    void destroy(String machineId);

    /**
     * List the application's machines.
     *
     * @param state only machines in this state, or all when {@code null}
     */
    List<Machine> list(MachineState state);
}
