package cronmanager.cloud.flaps;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import cronmanager.cloud.MachineClient;
import cronmanager.cloud.MachineException;
import cronmanager.cloud.MachineNotFoundException;
import cronmanager.cloud.MachineTimeoutException;
import cronmanager.cloud.auth.AuthService;
import cronmanager.cloud.model.ExecResult;
import cronmanager.cloud.model.LaunchRequest;
import cronmanager.cloud.model.Machine;
import cronmanager.cloud.model.MachineEvent;
import cronmanager.cloud.model.MachineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link MachineClient} backed by the Fly Machines REST API.
 */
public class FlapsMachineClient implements MachineClient {

    private static final Logger log = LoggerFactory.getLogger(FlapsMachineClient.class);

    /** The wait endpoint refuses timeouts longer than this. */
    private static final Duration MAX_WAIT_PER_CALL = Duration.ofSeconds(60);
    private static final Duration EXEC_GRACE = Duration.ofSeconds(10);

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final AuthService auth;
    private final String baseUrl;
    private final String appName;
    private final Duration requestTimeout;

    public FlapsMachineClient(HttpClient http, ObjectMapper mapper, AuthService auth,
            String baseUrl, String appName, Duration requestTimeout) {
        this.http = http;
        this.mapper = mapper;
        this.auth = auth;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.appName = appName;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String appName() {
        return appName;
    }

    @Override
    public Machine provision(LaunchRequest request) {
        HttpResponse<String> response = send(
                request(machinesPath(), requestTimeout)
                        .POST(HttpRequest.BodyPublishers.ofString(toJson(request), StandardCharsets.UTF_8))
                        .build(),
                "launch machine");
        expectSuccess(response, "launch machine", null);
        Machine machine = parseMachine(readTree(response.body()));
        log.info("Launched machine {} in app {}", machine.id(), appName);
        return machine;
    }

    @Override
    public Machine waitForState(Machine machine, MachineState state, Duration timeout) {
        Instant deadline = Instant.now().plus(timeout);
        while (true) {
            Duration remaining = Duration.between(Instant.now(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw new MachineTimeoutException("machine " + machine.id() + " did not reach state "
                        + state.apiName() + " within " + timeout.toSeconds() + "s");
            }
            Duration slice = remaining.compareTo(MAX_WAIT_PER_CALL) > 0 ? MAX_WAIT_PER_CALL : remaining;
            long seconds = Math.max(1, slice.toSeconds());

            String path = machinePath(machine.id()) + "/wait?state=" + encode(state.apiName())
                    + "&timeout=" + seconds;
            HttpResponse<String> response = send(
                    request(path, slice.plus(EXEC_GRACE)).GET().build(),
                    "wait for machine " + machine.id());

            if (response.statusCode() == 408) {
                log.debug("Still waiting for machine {} to reach {}", machine.id(), state.apiName());
                continue;
            }
            expectSuccess(response, "wait for machine", machine.id());
            return get(machine.id());
        }
    }

    @Override
    public ExecResult exec(List<String> command, String machineId, Duration timeout) {
        Map<String, Object> body = new HashMap<>();
        body.put("command", command);
        body.put("timeout", Math.max(1, timeout.toSeconds()));

        HttpResponse<String> response = send(
                request(machinePath(machineId) + "/exec", timeout.plus(EXEC_GRACE))
                        .POST(HttpRequest.BodyPublishers.ofString(toJson(body), StandardCharsets.UTF_8))
                        .build(),
                "exec on machine " + machineId);
        if (response.statusCode() == 408) {
            throw new MachineTimeoutException("command on machine " + machineId
                    + " did not finish within " + timeout.toSeconds() + "s");
        }
        expectSuccess(response, "exec on machine", machineId);
        try {
            return mapper.readValue(response.body(), ExecResult.class);
        } catch (JsonProcessingException e) {
            throw new MachineException("unreadable exec response from machine " + machineId, e);
        }
    }

    @Override
    public Machine get(String machineId) {
        HttpResponse<String> response = send(
                request(machinePath(machineId), requestTimeout).GET().build(),
                "get machine " + machineId);
        expectSuccess(response, "get machine", machineId);
        return parseMachine(readTree(response.body()));
    }

    @Override
    public void destroy(String machineId) {
        HttpResponse<String> response = send(
                request(machinePath(machineId) + "?force=true", requestTimeout).DELETE().build(),
                "destroy machine " + machineId);
        if (response.statusCode() == 404) {
            log.debug("Machine {} already gone", machineId);
            return;
        }
        expectSuccess(response, "destroy machine", machineId);
        log.info("Destroyed machine {}", machineId);
    }

    @Override
    public List<Machine> list(MachineState state) {
        String path = machinesPath();
        if (state != null) {
            path += "?state=" + encode(state.apiName());
        }
        HttpResponse<String> response = send(request(path, requestTimeout).GET().build(),
                "list machines of " + appName);
        expectSuccess(response, "list machines", null);

        JsonNode root = readTree(response.body());
        List<Machine> machines = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode node : root) {
                machines.add(parseMachine(node));
            }
        }
        return machines;
    }

    // --- Wire helpers ---

    static Machine parseMachine(JsonNode node) {
        Map<String, String> metadata = new HashMap<>();
        JsonNode meta = node.path("config").path("metadata");
        meta.fields().forEachRemaining(e -> metadata.put(e.getKey(), e.getValue().asText()));

        List<MachineEvent> events = new ArrayList<>();
        for (JsonNode event : node.path("events")) {
            JsonNode exitCode = event.path("request").path("exit_event").path("exit_code");
            events.add(new MachineEvent(
                    textOrNull(event, "type"),
                    textOrNull(event, "status"),
                    textOrNull(event, "source"),
                    event.hasNonNull("timestamp") ? Instant.ofEpochMilli(event.get("timestamp").asLong()) : null,
                    exitCode.isNumber() ? exitCode.asInt() : null));
        }

        return new Machine(
                textOrNull(node, "id"),
                textOrNull(node, "name"),
                MachineState.fromApi(textOrNull(node, "state")),
                textOrNull(node, "region"),
                metadata,
                events);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private HttpRequest.Builder request(String path, Duration timeout) {
        return HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Authorization", auth.authorizationHeader())
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
    }

    private HttpResponse<String> send(HttpRequest request, String action) {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new MachineTimeoutException("timed out trying to " + action);
        } catch (IOException e) {
            throw new MachineException("failed to " + action + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MachineException("interrupted while trying to " + action, e);
        }
    }

    private void expectSuccess(HttpResponse<String> response, String action, String machineId) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }
        if (status == 404 && machineId != null) {
            throw new MachineNotFoundException(machineId);
        }
        throw new MachineException("failed to " + action + ": HTTP " + status + " " + errorMessage(response.body()),
                status);
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (node.hasNonNull("error")) {
                return node.get("error").asText();
            }
        } catch (JsonProcessingException e) {
            log.debug("Provider error body is not JSON: {}", body);
        }
        return body.trim();
    }

    private JsonNode readTree(String body) {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MachineException("unreadable response from machines API", e);
        }
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new MachineException("failed to encode request", e);
        }
    }

    private String machinesPath() {
        return "/apps/" + encode(appName) + "/machines";
    }

    private String machinePath(String machineId) {
        return machinesPath() + "/" + encode(machineId);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
