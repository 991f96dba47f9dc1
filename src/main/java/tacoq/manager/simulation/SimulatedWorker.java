package tacoq.manager.simulation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.model.HeartbeatOutcome;
import tacoq.manager.model.ResultReport;
import tacoq.manager.model.TaskType;
import tacoq.manager.service.TaskService;
import tacoq.manager.service.WorkerRegistry;
import tacoq.manager.transport.Delivery;
import tacoq.manager.transport.DispatchMessage;
import tacoq.manager.transport.MessageCodec;
import tacoq.manager.transport.QueueTransport;
import tacoq.manager.transport.ResultMessage;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A single in-process worker speaking the worker protocol.
 * Registers, then loops: heartbeat when due, poll its queues, sleep to simulate work,
 * publish the outcome to the results queue, ack the delivery.
 * Stops cleanly on Thread.interrupt(); an interrupted worker does not unregister,
 * which is how tests simulate a crash.
 */
public final class SimulatedWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SimulatedWorker.class);
    private static final Duration POLL_TIMEOUT = Duration.ofMillis(100);

    private final UUID workerId;
    private final String name;
    private final List<String> taskTypes;
    private final WorkerRegistry workerRegistry;
    private final TaskService taskService;
    private final QueueTransport transport;
    private final Duration heartbeatInterval;
    private final int delayMinMs;
    private final int delayMaxMs;
    private final double failRate;
    private final AtomicInteger completed = new AtomicInteger();

    private volatile boolean heartbeatsPaused = false;

    public SimulatedWorker(UUID workerId,
            String name,
            List<String> taskTypes,
            WorkerRegistry workerRegistry,
            TaskService taskService,
            QueueTransport transport,
            Duration heartbeatInterval,
            int delayMinMs,
            int delayMaxMs,
            double failRate) {
        this.workerId = workerId;
        this.name = name;
        this.taskTypes = List.copyOf(taskTypes);
        this.workerRegistry = workerRegistry;
        this.taskService = taskService;
        this.transport = transport;
        this.heartbeatInterval = heartbeatInterval;
        this.delayMinMs = delayMinMs;
        this.delayMaxMs = delayMaxMs;
        this.failRate = failRate;
    }

    @Override
    public void run() {
        Thread.currentThread().setName("sim-worker-" + name);

        register();
        log.info("Sim worker {} started on {}", name, taskTypes);

        long nextHeartbeat = System.nanoTime() + heartbeatInterval.toNanos();

        while (!Thread.currentThread().isInterrupted()) {
            try {
                if (System.nanoTime() >= nextHeartbeat) {
                    sendHeartbeat();
                    nextHeartbeat = System.nanoTime() + heartbeatInterval.toNanos();
                }

                boolean worked = false;
                for (String type : taskTypes) {
                    Optional<Delivery> delivery = transport.poll(TaskType.queueName(type), POLL_TIMEOUT);
                    if (delivery.isPresent()) {
                        execute(delivery.get());
                        worked = true;
                    }
                }
                if (!worked) {
                    Thread.sleep(10);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.warn("Sim worker {} error: {}", name, e.getMessage());
                try {
                    Thread.sleep(200);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        log.info("Sim worker {} stopped after {} tasks", name, completed.get());
    }

    private void execute(Delivery delivery) throws InterruptedException {
        DispatchMessage message;
        try {
            message = MessageCodec.decodeDispatch(delivery.body());
        } catch (IOException e) {
            log.warn("Sim worker {} rejecting undecodable dispatch {}", name, delivery.tag());
            transport.nack(delivery.tag(), false);
            return;
        }

        // the start signal is only accepted from the assigned worker
        if (workerId.equals(message.workerId())) {
            taskService.markRunning(message.taskId(), workerId);
        }

        int delay = delayMinMs >= delayMaxMs ? delayMinMs
                : ThreadLocalRandom.current().nextInt(delayMinMs, delayMaxMs);
        Thread.sleep(delay);

        boolean shouldFail = failRate > 0 && ThreadLocalRandom.current().nextDouble() < failRate;
        ResultReport report = shouldFail
                ? ResultReport.failure(message.taskId(), workerId, "{\"sim\":true,\"error\":\"simulated failure\"}")
                : ResultReport.success(message.taskId(), workerId,
                        String.format("{\"sim\":true,\"delayMs\":%d}", delay));

        transport.publish(QueueTransport.RESULTS_QUEUE, MessageCodec.encode(ResultMessage.from(report)));
        transport.ack(delivery.tag());
        completed.incrementAndGet();
        log.debug("Sim worker {} finished task {} (success={})", name, message.taskId(), !shouldFail);
    }

    private void register() {
        workerRegistry.registerByNames(workerId, name, taskTypes);
    }

    private void sendHeartbeat() {
        if (heartbeatsPaused) {
            return;
        }
        try {
            if (workerRegistry.heartbeat(workerId, null) == HeartbeatOutcome.REREGISTER_REQUIRED) {
                log.info("Sim worker {} was declared dead, registering again", name);
                register();
            }
        } catch (Exception e) {
            log.debug("Sim worker {} heartbeat failed: {}", name, e.getMessage());
        }
    }

    /**
     * Stop sending heartbeats while still consuming, as a worker behind a partition would.
     */
    public void pauseHeartbeats(boolean paused) {
        this.heartbeatsPaused = paused;
    }

    public UUID workerId() {
        return workerId;
    }

    public int completedCount() {
        return completed.get();
    }
}
