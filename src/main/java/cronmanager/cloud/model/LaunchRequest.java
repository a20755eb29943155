package cronmanager.cloud.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a machine create call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LaunchRequest(
        @JsonProperty("name") String name,
        @JsonProperty("region") String region,
        @JsonProperty("config") MachineConfig config) {
}
