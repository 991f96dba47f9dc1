package tacoq.manager.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.api.Controller;
import tacoq.manager.api.internal.v1.dto.OperationResponse;
import tacoq.manager.api.internal.v1.dto.StartTaskRequest;
import tacoq.manager.api.internal.v1.dto.TaskResultRequest;
import tacoq.manager.exception.ManagerException;
import tacoq.manager.model.ReportOutcome;
import tacoq.manager.model.Transition;
import tacoq.manager.server.RouterHandler;
import tacoq.manager.service.ResultReconciler;
import tacoq.manager.service.TaskService;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for task signals from workers (internal API).
 * POST /internal/v1/tasks/{taskId}/start - Execution started
 * POST /internal/v1/tasks/{taskId}/result - Report outcome (idempotent)
 */
public class TaskReportController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskReportController.class);

    private static final Pattern START_PATTERN = Pattern.compile("^/internal/v1/tasks/([^/]+)/start$");
    private static final Pattern RESULT_PATTERN = Pattern.compile("^/internal/v1/tasks/([^/]+)/result$");

    private final TaskService taskService;
    private final ResultReconciler reconciler;

    public TaskReportController(TaskService taskService, ResultReconciler reconciler) {
        this.taskService = taskService;
        this.reconciler = reconciler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return START_PATTERN.matcher(path).matches() || RESULT_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            String body = req.content().toString(StandardCharsets.UTF_8);

            Matcher startMatcher = START_PATTERN.matcher(path);
            if (startMatcher.matches()) {
                return handleStart(UUID.fromString(startMatcher.group(1)), body);
            }

            Matcher resultMatcher = RESULT_PATTERN.matcher(path);
            if (resultMatcher.matches()) {
                return handleResult(UUID.fromString(resultMatcher.group(1)), body);
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed JSON body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (ManagerException e) {
            return ControllerResponse.failure(e);
        } catch (Exception e) {
            log.error("Task report controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /internal/v1/tasks/{taskId}/start
     */
    private ControllerResponse handleStart(UUID taskId, String body) throws Exception {
        StartTaskRequest request = RouterHandler.mapper().readValue(body, StartTaskRequest.class);
        request.validate();

        Transition transition = taskService.markRunning(taskId, request.workerId());
        if (!transition.applied()) {
            return ControllerResponse.json(HttpResponseStatus.CONFLICT,
                    RouterHandler.mapper().writeValueAsString(OperationResponse.stale()));
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));
    }

    /**
     * POST /internal/v1/tasks/{taskId}/result
     * Duplicate, orphaned and cancelled outcomes are still 200: the worker is done with the task either way.
     */
    private ControllerResponse handleResult(UUID taskId, String body) throws Exception {
        TaskResultRequest request = RouterHandler.mapper().readValue(body, TaskResultRequest.class);
        request.validate();

        ReportOutcome outcome = reconciler.reconcile(request.toReport(taskId));
        if (outcome == ReportOutcome.NOT_FOUND) {
            return ControllerResponse.notFound("task not found");
        }
        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(OperationResponse.success(outcome.name())));
    }
}
