package cronmanager.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import cronmanager.cloud.model.MachineConfig;
import cronmanager.coordinator.model.Schedule;

/**
 * Response DTO for a schedule.
 * GET /api/v1/schedules, POST /api/v1/schedules
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleResponse(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("app_name") String appName,
        @JsonProperty("schedule") String schedule,
        @JsonProperty("region") String region,
        @JsonProperty("command") String command,
        @JsonProperty("command_timeout") int commandTimeout,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("config") MachineConfig config) {

    public static ScheduleResponse from(Schedule schedule) {
        return new ScheduleResponse(
                schedule.id(),
                schedule.name(),
                schedule.appName(),
                schedule.cronExpression(),
                schedule.region(),
                schedule.command(),
                schedule.commandTimeout(),
                schedule.enabled(),
                schedule.config());
    }
}
