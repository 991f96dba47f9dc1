package tacoq.manager.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.api.Controller;
import tacoq.manager.api.v1.dto.CreateTaskTypeRequest;
import tacoq.manager.api.v1.dto.TaskTypeResponse;
import tacoq.manager.exception.ManagerException;
import tacoq.manager.model.TaskType;
import tacoq.manager.server.RouterHandler;
import tacoq.manager.service.TaskTypeService;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Controller for task types (public API).
 *
 * POST /api/v1/task-types - Create a task type (idempotent by name)
 * GET /api/v1/task-types - List task types
 */
public class TaskTypeController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskTypeController.class);

    private static final String PATH = "/api/v1/task-types";

    private final TaskTypeService taskTypeService;

    public TaskTypeController(TaskTypeService taskTypeService) {
        this.taskTypeService = taskTypeService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return PATH.equals(path) && (method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST)) {
                return handleCreate(req);
            }
            return handleList();
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed JSON body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (ManagerException e) {
            return ControllerResponse.failure(e);
        } catch (Exception e) {
            log.error("Task type controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/task-types
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateTaskTypeRequest request = RouterHandler.mapper().readValue(body, CreateTaskTypeRequest.class);
        request.validate();

        TaskType type = taskTypeService.create(request.name().trim());

        return ControllerResponse.json(HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(TaskTypeResponse.from(type)));
    }

    /**
     * GET /api/v1/task-types
     */
    private ControllerResponse handleList() throws Exception {
        List<TaskTypeResponse> types = taskTypeService.list().stream()
                .map(TaskTypeResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(types));
    }
}
