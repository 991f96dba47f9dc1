package tacoq.manager.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.api.Controller;
import tacoq.manager.api.v1.dto.HealthResponse;
import tacoq.manager.model.TaskStatus;
import tacoq.manager.model.WorkerLiveness;
import tacoq.manager.server.RouterHandler;
import tacoq.manager.service.TaskService;
import tacoq.manager.service.WorkerRegistry;
import tacoq.manager.store.Database;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "0.1.0";

    private final Database database;
    private final WorkerRegistry workerRegistry;
    private final TaskService taskService;

    public HealthController(Database database, WorkerRegistry workerRegistry, TaskService taskService) {
        this.database = database;
        this.workerRegistry = workerRegistry;
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                HealthResponse response = HealthResponse.unhealthy("connection failed");
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    workerRegistry.countByLiveness(WorkerLiveness.ALIVE),
                    taskService.countByStatus(TaskStatus.PENDING),
                    taskService.countByStatus(TaskStatus.QUEUED),
                    taskService.countByStatus(TaskStatus.RUNNING));

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            try {
                HealthResponse response = HealthResponse.unhealthy(e.getMessage());
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            } catch (Exception ex) {
                return ControllerResponse.error("health check failed");
            }
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
