package tacoq.manager.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.api.Controller;
import tacoq.manager.api.internal.v1.dto.NackRequest;
import tacoq.manager.api.internal.v1.dto.OperationResponse;
import tacoq.manager.api.internal.v1.dto.PollResponse;
import tacoq.manager.exception.ManagerException;
import tacoq.manager.exception.UnknownTaskTypeException;
import tacoq.manager.model.TaskType;
import tacoq.manager.server.RouterHandler;
import tacoq.manager.service.TaskTypeService;
import tacoq.manager.transport.Delivery;
import tacoq.manager.transport.MessageCodec;
import tacoq.manager.transport.QueueTransport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Exposes the queue transport to out-of-process workers (internal API).
 * Polls never block: the event loop thread must stay free.
 *
 * POST /internal/v1/queues/{typeName}/poll - Take the next dispatch of a task type
 * POST /internal/v1/deliveries/{tag}/ack - Settle a delivery
 * POST /internal/v1/deliveries/{tag}/nack - Reject a delivery, requeued by default
 */
public class QueueController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(QueueController.class);

    private static final Pattern POLL_PATTERN = Pattern.compile("^/internal/v1/queues/([^/]+)/poll$");
    private static final Pattern ACK_PATTERN = Pattern.compile("^/internal/v1/deliveries/(\\d+)/ack$");
    private static final Pattern NACK_PATTERN = Pattern.compile("^/internal/v1/deliveries/(\\d+)/nack$");

    private final QueueTransport transport;
    private final TaskTypeService taskTypeService;

    public QueueController(QueueTransport transport, TaskTypeService taskTypeService) {
        this.transport = transport;
        this.taskTypeService = taskTypeService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return POLL_PATTERN.matcher(path).matches()
                || ACK_PATTERN.matcher(path).matches()
                || NACK_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher pollMatcher = POLL_PATTERN.matcher(path);
            if (pollMatcher.matches()) {
                return handlePoll(pollMatcher.group(1));
            }

            Matcher ackMatcher = ACK_PATTERN.matcher(path);
            if (ackMatcher.matches()) {
                boolean settled = transport.ack(Long.parseLong(ackMatcher.group(1)));
                return settled(settled);
            }

            Matcher nackMatcher = NACK_PATTERN.matcher(path);
            if (nackMatcher.matches()) {
                String body = req.content().toString(StandardCharsets.UTF_8);
                NackRequest request = body.isBlank()
                        ? new NackRequest(null)
                        : RouterHandler.mapper().readValue(body, NackRequest.class);
                boolean settled = transport.nack(Long.parseLong(nackMatcher.group(1)), request.requeueOrDefault());
                return settled(settled);
            }

            return ControllerResponse.notFound("unknown queue endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed JSON body");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (ManagerException e) {
            return ControllerResponse.failure(e);
        } catch (Exception e) {
            log.error("Queue controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /internal/v1/queues/{typeName}/poll
     */
    private ControllerResponse handlePoll(String typeName) throws Exception {
        TaskType type = taskTypeService.findByName(typeName)
                .orElseThrow(() -> new UnknownTaskTypeException(typeName));

        Optional<Delivery> next = transport.poll(type.queueName(), Duration.ZERO);
        if (next.isEmpty()) {
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(PollResponse.empty()));
        }

        Delivery delivery = next.get();
        try {
            PollResponse response = PollResponse.of(delivery, MessageCodec.decodeDispatch(delivery.body()));
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
        } catch (IOException e) {
            log.error("Dropping undecodable dispatch on {} (delivery {})", type.queueName(), delivery.tag(), e);
            transport.nack(delivery.tag(), false);
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(PollResponse.empty()));
        }
    }

    private ControllerResponse settled(boolean settled) throws Exception {
        if (!settled) {
            return ControllerResponse.json(HttpResponseStatus.NOT_FOUND,
                    RouterHandler.mapper().writeValueAsString(OperationResponse.unknownDelivery()));
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success()));
    }
}
