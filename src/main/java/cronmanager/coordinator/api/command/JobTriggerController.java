package cronmanager.coordinator.api.command;

import cronmanager.coordinator.api.Controller;
import cronmanager.coordinator.api.command.dto.TriggerJobRequest;
import cronmanager.coordinator.model.Job;
import cronmanager.coordinator.service.JobService;
import cronmanager.coordinator.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Trigger endpoint used by remote schedulers.
 *
 * POST /command/jobs/trigger {"id": scheduleId}
 *
 * Empty 200 once the job has run (or, in init mode, started). Any failure,
 * including a bad body or unknown schedule, is a 500 with {"error": ...}.
 */
public class JobTriggerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobTriggerController.class);

    private static final String PATH = "/command/jobs/trigger";

    private final JobService jobService;

    public JobTriggerController(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String body = req.content().toString(StandardCharsets.UTF_8);
            TriggerJobRequest request = Json.mapper().readValue(body, TriggerJobRequest.class);
            request.validate();

            Job job = jobService.trigger(request.id());
            log.info("Triggered schedule {} as job {} ({})", request.id(), job.id(), job.status());
            return ControllerResponse.empty(HttpResponseStatus.OK);
        } catch (Exception e) {
            log.error("Trigger failed: {}", e.getMessage());
            return ControllerResponse.error(e.getMessage());
        }
    }
}
