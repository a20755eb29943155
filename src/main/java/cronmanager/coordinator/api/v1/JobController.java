package cronmanager.coordinator.api.v1;

import cronmanager.coordinator.api.Controller;
import cronmanager.coordinator.api.v1.dto.JobResponse;
import cronmanager.coordinator.service.JobService;
import cronmanager.coordinator.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GET /api/v1/jobs/{id} - Job detail including command output
 */
public class JobController implements Controller {

    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && JOB_BY_ID_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Matcher matcher = JOB_BY_ID_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.notFound("unknown job endpoint");
        }
        long jobId = ScheduleController.parseId(matcher.group(1));
        return ControllerResponse.json(Json.mapper().writeValueAsString(JobResponse.from(jobService.get(jobId))));
    }
}
