package tacoq.manager.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.config.ManagerConfig;
import tacoq.manager.exception.PublishFailureException;
import tacoq.manager.model.Task;
import tacoq.manager.model.TaskType;
import tacoq.manager.model.Transition;
import tacoq.manager.model.Worker;
import tacoq.manager.model.WorkerLiveness;
import tacoq.manager.repository.TaskRepository;
import tacoq.manager.service.RetryPolicy;
import tacoq.manager.service.TaskLifecycle;
import tacoq.manager.service.TaskTypeService;
import tacoq.manager.service.WorkerRegistry;
import tacoq.manager.transport.DispatchMessage;
import tacoq.manager.transport.MessageCodec;
import tacoq.manager.transport.QueueTransport;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Matches PENDING tasks to capable ALIVE workers and publishes them.
 *
 * Per task type, pending tasks are taken oldest first and each goes to the capable
 * worker with the fewest in-flight tasks. The task is moved to QUEUED before it is
 * published; if publishing keeps failing the assignment is rolled back so the task
 * is picked up again by a later pass.
 *
 * Passes must not overlap within one instance; the scheduler runs them on a single thread.
 */
public class Dispatcher implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final TaskRepository taskRepository;
    private final TaskTypeService taskTypeService;
    private final WorkerRegistry workerRegistry;
    private final TaskLifecycle lifecycle;
    private final QueueTransport transport;
    private final ManagerConfig config;
    private final RetryPolicy retryPolicy;

    public Dispatcher(TaskRepository taskRepository, TaskTypeService taskTypeService, WorkerRegistry workerRegistry,
            TaskLifecycle lifecycle, QueueTransport transport, ManagerConfig config) {
        this.taskRepository = taskRepository;
        this.taskTypeService = taskTypeService;
        this.workerRegistry = workerRegistry;
        this.lifecycle = lifecycle;
        this.transport = transport;
        this.config = config;
        this.retryPolicy = RetryPolicy.exponential(config.publishBackoff());
    }

    @Override
    public void run() {
        try {
            dispatchOnce();
        } catch (Exception e) {
            log.error("Dispatch pass failed", e);
        }
    }

    /**
     * Run one dispatch pass over every task type with pending work.
     *
     * @return number of tasks published
     */
    public synchronized int dispatchOnce() {
        List<UUID> typeIds = taskRepository.findTypesWithPending();
        if (typeIds.isEmpty()) {
            return 0;
        }

        Map<UUID, Integer> inFlight = taskRepository.countInFlightByWorker();
        int published = 0;

        for (UUID typeId : typeIds) {
            Optional<TaskType> type = taskTypeService.findById(typeId);
            if (type.isEmpty()) {
                continue;
            }
            try {
                published += dispatchType(type.get(), inFlight);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Dispatch pass interrupted");
                break;
            } catch (Exception e) {
                log.error("Dispatch of task type {} failed", type.get().name(), e);
            }
        }

        if (published > 0) {
            log.info("Dispatched {} tasks", published);
        }
        return published;
    }

    private int dispatchType(TaskType type, Map<UUID, Integer> inFlight) throws InterruptedException {
        Set<UUID> capable = new LinkedHashSet<>(workerRegistry.capableWorkers(type.id()));
        if (capable.isEmpty()) {
            log.debug("No live worker for task type {}", type.name());
            return 0;
        }

        List<Task> pending = taskRepository.findPendingByType(type.id(), config.dispatchBatchSize());
        int published = 0;

        for (Task task : pending) {
            UUID workerId = leastLoaded(capable, inFlight);

            if (lifecycle.assign(task.id(), workerId) == Transition.STALE) {
                // cancelled, taken by another dispatcher, or the worker stopped being eligible
                if (!stillAlive(workerId)) {
                    capable.remove(workerId);
                    log.debug("Worker {} left ALIVE during dispatch of {}", workerId, type.name());
                    if (capable.isEmpty()) {
                        break;
                    }
                }
                continue;
            }

            DispatchMessage message = new DispatchMessage(task.id(), type.name(), workerId, task.inputData());
            if (publishWithRetry(type.queueName(), message)) {
                inFlight.merge(workerId, 1, Integer::sum);
                published++;
                log.debug("Task {} published to {} for worker {}", task.id(), type.queueName(), workerId);
            } else {
                lifecycle.rollbackAssignment(task.id(), workerId);
            }
        }
        return published;
    }

    private boolean publishWithRetry(String queue, DispatchMessage message) throws InterruptedException {
        byte[] body = MessageCodec.encode(message);
        int maxAttempts = config.publishMaxAttempts();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                transport.publish(queue, body);
                return true;
            } catch (PublishFailureException e) {
                if (attempt == maxAttempts) {
                    log.error("Publishing task {} to {} failed after {} attempts", message.taskId(), queue,
                            maxAttempts, e);
                } else {
                    log.warn("Publishing task {} to {} failed (attempt {}/{}): {}", message.taskId(), queue,
                            attempt, maxAttempts, e.getMessage());
                    Thread.sleep(retryPolicy.nextBackoff(attempt).toMillis());
                }
            }
        }
        return false;
    }

    private boolean stillAlive(UUID workerId) {
        return workerRegistry.findById(workerId)
                .map(Worker::liveness)
                .filter(liveness -> liveness == WorkerLiveness.ALIVE)
                .isPresent();
    }

    private static UUID leastLoaded(Set<UUID> workers, Map<UUID, Integer> inFlight) {
        UUID best = null;
        int bestLoad = Integer.MAX_VALUE;
        for (UUID worker : workers) {
            int load = inFlight.getOrDefault(worker, 0);
            if (load < bestLoad) {
                best = worker;
                bestLoad = load;
            }
        }
        return best;
    }
}
