package cronmanager.cloud.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of a remote machine as last reported by the provider.
 * Events are ordered newest first, which is how the Machines API returns them.
 */
public record Machine(
        String id,
        String name,
        MachineState state,
        String region,
        Map<String, String> metadata,
        List<MachineEvent> events) {

    public Machine {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        events = events == null ? List.of() : List.copyOf(events);
    }

    /** Most recent event of the given type. */
    public Optional<MachineEvent> latestEvent(String type) {
        return events.stream().filter(e -> e.isType(type)).findFirst();
    }

    /** Exit code of the main process, if the machine has exited. */
    public Optional<Integer> exitCode() {
        return latestEvent(MachineEvent.EXIT).map(MachineEvent::exitCode);
    }

    public boolean isManaged() {
        return "true".equals(metadata.get(MachineConfig.MANAGED_BY_KEY));
    }

    public boolean isDestroyed() {
        return state == MachineState.DESTROYED;
    }
}
