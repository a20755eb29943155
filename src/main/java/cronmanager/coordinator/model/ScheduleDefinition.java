package cronmanager.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import cronmanager.cloud.model.MachineConfig;

/**
 * A schedule as written by operators: one element of the schedules file, or
 * the body of a create request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScheduleDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("app_name") String appName,
        @JsonProperty("schedule") String schedule,
        @JsonProperty("region") String region,
        @JsonProperty("command") String command,
        @JsonProperty("command_timeout") Integer commandTimeout,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("config") MachineConfig config) {

    /**
     * Check required fields.
     *
     * @throws IllegalArgumentException naming the first missing field
     */
    public void validate() {
        require(name, "name");
        require(appName, "app_name");
        require(schedule, "schedule");
        require(command, "command");
        if (config == null) {
            throw new IllegalArgumentException("schedule '" + name + "': config is required");
        }
        if (config.image() == null || config.image().isBlank()) {
            throw new IllegalArgumentException("schedule '" + name + "': config.image is required");
        }
        if (commandTimeout != null && commandTimeout < 0) {
            throw new IllegalArgumentException("schedule '" + name + "': command_timeout must not be negative");
        }
    }

    /** Defaults: enabled, 30 second timeout. */
    public Schedule toSchedule() {
        return Schedule.builder()
                .name(name.trim())
                .appName(appName.trim())
                .cronExpression(schedule.trim())
                .region(region)
                .command(command)
                .commandTimeout(commandTimeout == null ? 0 : commandTimeout)
                .enabled(enabled == null || enabled)
                .config(config)
                .build();
    }

    private void require(String value, String field) {
        if (value == null || value.isBlank()) {
            String which = name == null || name.isBlank() ? "" : "schedule '" + name + "': ";
            throw new IllegalArgumentException(which + field + " is required");
        }
    }
}
