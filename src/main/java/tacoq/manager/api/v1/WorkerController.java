package tacoq.manager.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.api.Controller;
import tacoq.manager.api.v1.dto.WorkerResponse;
import tacoq.manager.server.RouterHandler;
import tacoq.manager.service.WorkerRegistry;

import java.util.List;

/**
 * Controller for worker listing (public API).
 * GET /api/v1/workers
 */
public class WorkerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkerController.class);

    private final WorkerRegistry workerRegistry;

    public WorkerController(WorkerRegistry workerRegistry) {
        this.workerRegistry = workerRegistry;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/workers".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            List<WorkerResponse> workers = workerRegistry.findAll().stream()
                    .map(WorkerResponse::from)
                    .toList();
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(workers));
        } catch (Exception e) {
            log.error("Worker controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
