package cronmanager.coordinator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import cronmanager.cloud.FakeMachineClient;
import cronmanager.cloud.model.ExecResult;
import cronmanager.coordinator.Fixtures;
import cronmanager.coordinator.config.Dependencies;
import cronmanager.coordinator.config.ManagerConfig;
import cronmanager.coordinator.service.CrontabInstaller;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the public and command endpoints through the Netty server with the
 * provider replaced by an in-memory fake.
 */
class HttpEndpointIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String SCHEDULE_BODY = """
            {
              "name": "uptime-check",
              "app_name": "my-app",
              "schedule": "*/5 * * * *",
              "region": "ord",
              "command": "curl -fsS https://example.com/health",
              "command_timeout": 60,
              "config": { "image": "curlimages/curl:latest" }
            }
            """;

    @TempDir
    Path tempDir;

    private Dependencies deps;
    private FakeMachineClient machines;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        ManagerConfig config = ManagerConfig.defaults()
                .withDatabaseUrl(Fixtures.memoryUrl("test-http"))
                .withCrontabPath(tempDir.resolve("crontab").toString())
                .withServerHost("127.0.0.1")
                .withServerPort(port);

        machines = new FakeMachineClient();
        CrontabInstaller installer = file -> new CrontabInstaller.Result(0, "");
        deps = Dependencies.create(config, machines.factory(), installer, Clock.systemUTC());
        deps.startServer();

        baseUrl = "http://127.0.0.1:" + port;
        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return httpClient.send(HttpRequest.newBuilder(URI.create(baseUrl + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> delete(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).DELETE().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private long createSchedule() throws Exception {
        HttpResponse<String> created = post("/api/v1/schedules", SCHEDULE_BODY);
        assertEquals(201, created.statusCode(), created.body());
        return MAPPER.readTree(created.body()).get("id").asLong();
    }

    @Test
    @DisplayName("Create a schedule, trigger it, read the job back")
    void scheduleAndTriggerFlow() throws Exception {
        long scheduleId = createSchedule();

        JsonNode schedule = MAPPER.readTree(get("/api/v1/schedules/" + scheduleId).body());
        assertEquals("uptime-check", schedule.get("name").asText());
        assertEquals("my-app", schedule.get("app_name").asText());
        assertEquals(60, schedule.get("command_timeout").asInt());
        assertTrue(schedule.get("enabled").asBoolean());

        HttpResponse<String> trigger = post("/command/jobs/trigger", "{\"id\": " + scheduleId + "}");
        assertEquals(200, trigger.statusCode(), trigger.body());
        assertEquals("", trigger.body());

        HttpResponse<String> listed = get("/api/v1/schedules/" + scheduleId + "/jobs?limit=5");
        assertEquals(200, listed.statusCode());
        JsonNode jobs = MAPPER.readTree(listed.body());
        assertEquals(1, jobs.size());
        JsonNode summary = jobs.get(0);
        assertEquals("completed", summary.get("status").asText());
        assertFalse(summary.has("stdout"));

        JsonNode job = MAPPER.readTree(get("/api/v1/jobs/" + summary.get("id").asLong()).body());
        assertEquals(0, job.get("exit_code").asInt());
        assertEquals("ok\n", job.get("stdout").asText());
        assertEquals("m-1", job.get("machine_id").asText());
        assertEquals("my-app", machines.appsSeen.get(0));
    }

    @Test
    void failedTriggerIsServerError() throws Exception {
        long scheduleId = createSchedule();
        machines.execResult = new ExecResult(4, "", "");

        HttpResponse<String> trigger = post("/command/jobs/trigger", "{\"id\": " + scheduleId + "}");

        assertEquals(500, trigger.statusCode());
        assertEquals("job failed with exit code 4", MAPPER.readTree(trigger.body()).get("error").asText());
    }

    @Test
    void invalidTriggerBodiesAreServerErrors() throws Exception {
        assertEquals(500, post("/command/jobs/trigger", "{\"id\": 0}").statusCode());
        assertEquals(500, post("/command/jobs/trigger", "not json").statusCode());

        HttpResponse<String> unknown = post("/command/jobs/trigger", "{\"id\": 4242}");
        assertEquals(500, unknown.statusCode());
        assertEquals("schedule not found: 4242", MAPPER.readTree(unknown.body()).get("error").asText());
    }

    @Test
    void healthReflectsCrontab() throws Exception {
        HttpResponse<String> before = get("/api/v1/health");
        assertEquals(503, before.statusCode());
        JsonNode unhealthy = MAPPER.readTree(before.body());
        assertEquals("unhealthy", unhealthy.get("status").asText());
        assertEquals("ok", unhealthy.get("database").asText());
        assertEquals("missing", unhealthy.get("crontab").asText());

        createSchedule();

        assertTrue(Files.exists(tempDir.resolve("crontab")));
        HttpResponse<String> after = get("/api/v1/health");
        assertEquals(200, after.statusCode());
        assertEquals("healthy", MAPPER.readTree(after.body()).get("status").asText());
    }

    @Test
    void clientErrorsMapToStatusCodes() throws Exception {
        createSchedule();

        HttpResponse<String> duplicate = post("/api/v1/schedules", SCHEDULE_BODY);
        assertEquals(400, duplicate.statusCode());
        assertTrue(MAPPER.readTree(duplicate.body()).get("error").asText().contains("already exists"));

        assertEquals(400, post("/api/v1/schedules", "{ broken").statusCode());
        assertEquals(400, get("/api/v1/schedules/abc").statusCode());
        assertEquals(404, get("/api/v1/jobs/999999").statusCode());
        assertEquals(404, get("/api/v1/nothing-here").statusCode());
    }

    @Test
    void deleteRemovesSchedule() throws Exception {
        long scheduleId = createSchedule();

        assertEquals(204, delete("/api/v1/schedules/" + scheduleId).statusCode());
        assertEquals(404, get("/api/v1/schedules/" + scheduleId).statusCode());
        assertEquals(404, delete("/api/v1/schedules/" + scheduleId).statusCode());

        JsonNode all = MAPPER.readTree(get("/api/v1/schedules").body());
        assertEquals(0, all.size());
    }
}
