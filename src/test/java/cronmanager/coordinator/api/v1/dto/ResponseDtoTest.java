package cronmanager.coordinator.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import cronmanager.coordinator.model.Job;
import cronmanager.coordinator.model.JobStatus;
import cronmanager.coordinator.util.Json;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ResponseDtoTest {

    @Test
    void jobResponseUsesSnakeCaseAndIsoDates() throws Exception {
        Instant created = Instant.parse("2024-05-01T10:00:00Z");
        Job job = Job.builder()
                .id(12)
                .scheduleId(3)
                .status(JobStatus.FAILED)
                .machineId("m-9")
                .exitCode(-1)
                .stderr("job was interrupted on shutdown")
                .createdAt(created)
                .updatedAt(created)
                .finishedAt(created.plusSeconds(90))
                .build();

        JsonNode json = Json.mapper().valueToTree(JobResponse.from(job));

        assertEquals(3, json.get("schedule_id").asLong());
        assertEquals("failed", json.get("status").asText());
        assertEquals(-1, json.get("exit_code").asInt());
        assertEquals("2024-05-01T10:01:30Z", json.get("finished_at").asText());
        assertFalse(json.has("stdout"));

        JsonNode compact = Json.mapper().valueToTree(JobResponse.from(job).compact());
        assertFalse(compact.has("stderr"));
        assertEquals("m-9", compact.get("machine_id").asText());
    }

    @Test
    void healthResponseStatus() {
        assertTrue(HealthResponse.of(true, true).healthy());

        HealthResponse degraded = HealthResponse.of(false, true);
        assertFalse(degraded.healthy());
        assertEquals("connection failed", degraded.database());
        assertEquals("ok", degraded.crontab());
    }
}
