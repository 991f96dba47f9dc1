package tacoq.manager.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.api.Controller;
import tacoq.manager.api.v1.dto.SubmitTaskRequest;
import tacoq.manager.api.v1.dto.SubmitTaskResponse;
import tacoq.manager.api.v1.dto.TaskResponse;
import tacoq.manager.exception.ManagerException;
import tacoq.manager.model.TaskDetails;
import tacoq.manager.model.TaskStatus;
import tacoq.manager.model.Transition;
import tacoq.manager.server.RouterHandler;
import tacoq.manager.service.TaskService;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task submission (public API).
 *
 * POST /api/v1/tasks - Submit a task
 * GET /api/v1/tasks/{taskId} - Get task status and result
 * POST /api/v1/tasks/{taskId}/cancel - Cancel a task that has not started
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");
    private static final Pattern CANCEL_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/cancel$");

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATTERN.matcher(path).matches() || CANCEL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return TASK_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST) && TASKS_PATTERN.matcher(path).matches()) {
                return handleSubmit(req);
            }

            Matcher cancelMatcher = CANCEL_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.POST) && cancelMatcher.matches()) {
                return handleCancel(UUID.fromString(cancelMatcher.group(1)));
            }

            Matcher taskMatcher = TASK_BY_ID_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.GET) && taskMatcher.matches()) {
                return handleGet(UUID.fromString(taskMatcher.group(1)));
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed JSON body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (ManagerException e) {
            return ControllerResponse.failure(e);
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/tasks
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        SubmitTaskRequest request = RouterHandler.mapper().readValue(body, SubmitTaskRequest.class);
        request.validate();

        UUID taskId = taskService.submit(request.taskType(), request.inputJson());

        return ControllerResponse.json(HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(
                        new SubmitTaskResponse(taskId, TaskStatus.PENDING.name())));
    }

    /**
     * GET /api/v1/tasks/{taskId}
     */
    private ControllerResponse handleGet(UUID taskId) throws Exception {
        Optional<TaskDetails> details = taskService.find(taskId);
        if (details.isEmpty()) {
            return ControllerResponse.notFound("task not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(details.get())));
    }

    /**
     * POST /api/v1/tasks/{taskId}/cancel
     */
    private ControllerResponse handleCancel(UUID taskId) throws Exception {
        Transition transition = taskService.cancel(taskId);
        String status = taskService.findById(taskId).map(t -> t.status().name()).orElse(null);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("cancelled", transition.applied());
        response.put("status", status);

        // a STALE cancel means the task already started or finished
        HttpResponseStatus httpStatus = transition.applied() ? HttpResponseStatus.OK : HttpResponseStatus.CONFLICT;
        return ControllerResponse.json(httpStatus, RouterHandler.mapper().writeValueAsString(response));
    }
}
