package cronmanager.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("crontab") String crontab) {

    public static HealthResponse of(boolean databaseOk, boolean crontabOk) {
        return new HealthResponse(
                databaseOk && crontabOk ? "healthy" : "unhealthy",
                databaseOk ? "ok" : "connection failed",
                crontabOk ? "ok" : "missing");
    }

    public boolean healthy() {
        return "healthy".equals(status);
    }
}
