package cronmanager.coordinator.api.v1;

import cronmanager.coordinator.api.Controller;
import cronmanager.coordinator.api.v1.dto.JobResponse;
import cronmanager.coordinator.api.v1.dto.ScheduleResponse;
import cronmanager.coordinator.model.Schedule;
import cronmanager.coordinator.model.ScheduleDefinition;
import cronmanager.coordinator.service.JobService;
import cronmanager.coordinator.service.ScheduleService;
import cronmanager.coordinator.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for schedule administration (public API).
 *
 * GET /api/v1/schedules - List schedules
 * POST /api/v1/schedules - Create a schedule
 * GET /api/v1/schedules/{id} - Get a schedule
 * DELETE /api/v1/schedules/{id} - Delete a schedule and its jobs
 * GET /api/v1/schedules/{id}/jobs?limit=n - Recent jobs of a schedule
 */
public class ScheduleController implements Controller {

    private static final Pattern SCHEDULES_PATTERN = Pattern.compile("^/api/v1/schedules$");
    private static final Pattern SCHEDULE_BY_ID_PATTERN = Pattern.compile("^/api/v1/schedules/([^/]+)$");
    private static final Pattern SCHEDULE_JOBS_PATTERN = Pattern.compile("^/api/v1/schedules/([^/]+)/jobs$");

    private final ScheduleService scheduleService;
    private final JobService jobService;

    public ScheduleController(ScheduleService scheduleService, JobService jobService) {
        this.scheduleService = scheduleService;
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (SCHEDULES_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (SCHEDULE_JOBS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET);
        }
        if (SCHEDULE_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        HttpMethod method = req.method();

        if (SCHEDULES_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) ? handleCreate(req) : handleList();
        }

        Matcher jobsMatcher = SCHEDULE_JOBS_PATTERN.matcher(path);
        if (jobsMatcher.matches()) {
            return handleListJobs(parseId(jobsMatcher.group(1)), req);
        }

        Matcher byIdMatcher = SCHEDULE_BY_ID_PATTERN.matcher(path);
        if (byIdMatcher.matches()) {
            long id = parseId(byIdMatcher.group(1));
            if (method.equals(HttpMethod.DELETE)) {
                scheduleService.delete(id);
                return ControllerResponse.empty(HttpResponseStatus.NO_CONTENT);
            }
            return ControllerResponse.json(
                    Json.mapper().writeValueAsString(ScheduleResponse.from(scheduleService.get(id))));
        }

        return ControllerResponse.notFound("unknown schedule endpoint");
    }

    private ControllerResponse handleList() throws Exception {
        List<ScheduleResponse> schedules = scheduleService.list().stream()
                .map(ScheduleResponse::from)
                .toList();
        return ControllerResponse.json(Json.mapper().writeValueAsString(schedules));
    }

    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        ScheduleDefinition definition;
        try {
            definition = Json.mapper().readValue(body, ScheduleDefinition.class);
        } catch (Exception e) {
            throw new IllegalArgumentException("invalid schedule body: " + e.getMessage(), e);
        }

        Schedule created = scheduleService.create(definition);
        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                Json.mapper().writeValueAsString(ScheduleResponse.from(created)));
    }

    private ControllerResponse handleListJobs(long scheduleId, FullHttpRequest req) throws Exception {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        int limit = JobService.DEFAULT_LIST_LIMIT;
        List<String> limitParam = query.parameters().get("limit");
        if (limitParam != null && !limitParam.isEmpty()) {
            try {
                limit = Integer.parseInt(limitParam.get(0));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("limit must be a number", e);
            }
        }

        List<JobResponse> jobs = jobService.listForSchedule(scheduleId, limit).stream()
                .map(JobResponse::from)
                .map(JobResponse::compact)
                .toList();
        return ControllerResponse.json(Json.mapper().writeValueAsString(jobs));
    }

    static long parseId(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid id: " + raw, e);
        }
    }
}
