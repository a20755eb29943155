package cronmanager.cloud.model;

import java.time.Instant;

/**
 * One entry of a machine's event log.
 *
 * @param type      event type, e.g. {@code start}, {@code exit}, {@code destroy}
 * @param status    machine status recorded with the event
 * @param source    who emitted the event ({@code user}, {@code flyd})
 * @param timestamp when the event happened
 * @param exitCode  exit code of the main process, only present on {@code exit} events
 */
public record MachineEvent(
        String type,
        String status,
        String source,
        Instant timestamp,
        Integer exitCode) {

    public static final String START = "start";
    public static final String EXIT = "exit";

    public boolean isType(String eventType) {
        return eventType.equalsIgnoreCase(type);
    }
}
