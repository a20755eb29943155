package cronmanager.coordinator.api.command.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for triggering a schedule.
 * POST /command/jobs/trigger
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TriggerJobRequest(
        @JsonProperty("id") Long id) {

    public void validate() {
        if (id == null) {
            throw new IllegalArgumentException("id is required");
        }
        if (id <= 0) {
            throw new IllegalArgumentException("id must be positive");
        }
    }
}
