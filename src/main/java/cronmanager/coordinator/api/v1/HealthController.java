package cronmanager.coordinator.api.v1;

import cronmanager.coordinator.api.Controller;
import cronmanager.coordinator.api.v1.dto.HealthResponse;
import cronmanager.coordinator.store.Database;
import cronmanager.coordinator.util.Json;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Health check controller.
 * GET /api/v1/health
 *
 * Healthy when the database answers and the crontab has been installed at least once.
 */
public class HealthController implements Controller {

    private final Database database;
    private final Path crontabPath;

    public HealthController(Database database, Path crontabPath) {
        this.database = database;
        this.crontabPath = crontabPath;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        HealthResponse response = HealthResponse.of(database.isHealthy(), Files.isRegularFile(crontabPath));
        return ControllerResponse.json(
                response.healthy() ? HttpResponseStatus.OK : HttpResponseStatus.SERVICE_UNAVAILABLE,
                Json.mapper().writeValueAsString(response));
    }
}
