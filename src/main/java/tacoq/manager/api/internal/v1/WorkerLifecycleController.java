package tacoq.manager.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.api.Controller;
import tacoq.manager.api.internal.v1.dto.HeartbeatRequest;
import tacoq.manager.api.internal.v1.dto.OperationResponse;
import tacoq.manager.api.internal.v1.dto.RegisterWorkerRequest;
import tacoq.manager.api.internal.v1.dto.RegisterWorkerResponse;
import tacoq.manager.config.ManagerConfig;
import tacoq.manager.exception.ManagerException;
import tacoq.manager.model.HeartbeatOutcome;
import tacoq.manager.model.TaskType;
import tacoq.manager.model.Worker;
import tacoq.manager.server.RouterHandler;
import tacoq.manager.service.WorkerRegistry;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for worker registration and heartbeats (internal API).
 * POST /internal/v1/workers/register - Register or re-register a worker
 * POST /internal/v1/workers/{workerId}/heartbeat - Worker heartbeat
 * DELETE /internal/v1/workers/{workerId} - Graceful worker shutdown
 */
public class WorkerLifecycleController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkerLifecycleController.class);

    private static final Pattern REGISTER_PATTERN = Pattern.compile("^/internal/v1/workers/register$");
    private static final Pattern HEARTBEAT_PATTERN = Pattern.compile("^/internal/v1/workers/([^/]+)/heartbeat$");
    private static final Pattern WORKER_PATTERN = Pattern.compile("^/internal/v1/workers/([^/]+)$");

    private final WorkerRegistry workerRegistry;
    private final ManagerConfig config;

    public WorkerLifecycleController(WorkerRegistry workerRegistry, ManagerConfig config) {
        this.workerRegistry = workerRegistry;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return REGISTER_PATTERN.matcher(path).matches() || HEARTBEAT_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.DELETE)) {
            return WORKER_PATTERN.matcher(path).matches() && !REGISTER_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST) && REGISTER_PATTERN.matcher(path).matches()) {
                return handleRegister(req);
            }

            Matcher heartbeatMatcher = HEARTBEAT_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.POST) && heartbeatMatcher.matches()) {
                return handleHeartbeat(UUID.fromString(heartbeatMatcher.group(1)), req);
            }

            Matcher workerMatcher = WORKER_PATTERN.matcher(path);
            if (req.method().equals(HttpMethod.DELETE) && workerMatcher.matches()) {
                return handleUnregister(UUID.fromString(workerMatcher.group(1)));
            }

            return ControllerResponse.notFound("unknown worker endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed JSON body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (ManagerException e) {
            return ControllerResponse.failure(e);
        } catch (Exception e) {
            log.error("Worker lifecycle controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /internal/v1/workers/register
     */
    private ControllerResponse handleRegister(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        RegisterWorkerRequest request = RouterHandler.mapper().readValue(body, RegisterWorkerRequest.class);
        request.validate();

        UUID workerId = request.workerId() != null ? request.workerId() : UUID.randomUUID();
        Worker worker = workerRegistry.registerByNames(workerId, request.name(), request.taskTypesOrEmpty());

        List<String> queues = request.taskTypesOrEmpty().stream()
                .distinct()
                .map(TaskType::queueName)
                .toList();

        RegisterWorkerResponse response = new RegisterWorkerResponse(
                worker.id(), queues, config.heartbeatTimeout().dividedBy(3).toMillis());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /internal/v1/workers/{workerId}/heartbeat
     */
    private ControllerResponse handleHeartbeat(UUID workerId, FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        HeartbeatRequest request = body.isBlank()
                ? HeartbeatRequest.empty()
                : RouterHandler.mapper().readValue(body, HeartbeatRequest.class);

        HeartbeatOutcome outcome = workerRegistry.heartbeat(workerId, request.timestamp());

        if (outcome == HeartbeatOutcome.REREGISTER_REQUIRED) {
            return ControllerResponse.json(HttpResponseStatus.CONFLICT,
                    RouterHandler.mapper().writeValueAsString(OperationResponse.reregisterRequired()));
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));
    }

    /**
     * DELETE /internal/v1/workers/{workerId}
     */
    private ControllerResponse handleUnregister(UUID workerId) throws Exception {
        int reclaimed = workerRegistry.unregister(workerId);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("ok", true, "reclaimedTasks", reclaimed)));
    }
}
