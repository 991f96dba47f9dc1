package tacoq.manager.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.config.ManagerConfig;
import tacoq.manager.exception.WorkerNotFoundException;
import tacoq.manager.model.HeartbeatOutcome;
import tacoq.manager.model.Heartbeat;
import tacoq.manager.model.Worker;
import tacoq.manager.model.WorkerLiveness;
import tacoq.manager.repository.WorkerRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Service layer for worker registration and heartbeats.
 */
public class WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerRegistry.class);

    private final WorkerRepository workerRepository;
    private final TaskTypeService taskTypeService;
    private final ManagerConfig config;
    private final List<Consumer<Worker>> registrationListeners = new CopyOnWriteArrayList<>();

    public WorkerRegistry(WorkerRepository workerRepository, TaskTypeService taskTypeService, ManagerConfig config) {
        this.workerRepository = workerRepository;
        this.taskTypeService = taskTypeService;
        this.config = config;
    }

    /**
     * Called after every successful registration.
     */
    public void addRegistrationListener(Consumer<Worker> listener) {
        registrationListeners.add(listener);
    }

    /**
     * Register a worker, or refresh the registration of a known one.
     * The capability set is replaced and the worker is ALIVE afterwards,
     * even if it had been declared DEAD.
     *
     * @throws tacoq.manager.exception.InvalidCapabilityException if a task type does not exist;
     *         nothing is written in that case
     */
    public Worker register(UUID workerId, String name, Set<UUID> taskTypeIds) {
        if (workerId == null) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        Set<UUID> capabilities = taskTypeIds == null ? Set.of() : Set.copyOf(taskTypeIds);

        // task types are never deleted, so the check cannot go stale before the write
        taskTypeService.requireExisting(capabilities);

        Instant now = config.clock().instant();
        Worker worker = Worker.builder()
                .id(workerId)
                .name(name)
                .registeredAt(now)
                .lastHeartbeat(now)
                .liveness(WorkerLiveness.ALIVE)
                .capabilities(capabilities)
                .build();

        workerRepository.register(worker);

        for (Consumer<Worker> listener : registrationListeners) {
            listener.accept(worker);
        }
        return worker;
    }

    /**
     * Register with task type names instead of IDs.
     */
    public Worker registerByNames(UUID workerId, String name, Collection<String> taskTypeNames) {
        Set<UUID> ids = taskTypeService.resolve(taskTypeNames == null ? Set.of() : taskTypeNames);
        return register(workerId, name, ids);
    }

    /**
     * Workers that may receive tasks of the given type right now.
     */
    public Set<UUID> capableWorkers(UUID taskTypeId) {
        return workerRepository.findCapable(taskTypeId, WorkerLiveness.ALIVE);
    }

    /**
     * Record a heartbeat. The stored heartbeat time is the worker's timestamp capped
     * at the receive time, so a fast worker clock cannot keep it alive in advance.
     *
     * @param timestamp worker-side timestamp, or null to use the receive time
     * @throws WorkerNotFoundException if the worker never registered
     */
    public HeartbeatOutcome heartbeat(UUID workerId, Instant timestamp) {
        Instant receivedAt = config.clock().instant();
        Instant heartbeatTime = timestamp == null || timestamp.isAfter(receivedAt) ? receivedAt : timestamp;

        WorkerLiveness liveness = workerRepository
                .recordHeartbeat(workerId, heartbeatTime, receivedAt, receivedAt.minus(config.heartbeatTimeout()))
                .orElseThrow(() -> new WorkerNotFoundException(workerId));

        if (liveness == WorkerLiveness.DEAD) {
            log.warn("Heartbeat from dead worker {}, re-registration required", workerId);
            return HeartbeatOutcome.REREGISTER_REQUIRED;
        }
        log.debug("Heartbeat from worker {} at {}", workerId, heartbeatTime);
        return HeartbeatOutcome.ACCEPTED;
    }

    /**
     * Graceful shutdown of a worker: it is declared DEAD at once and its
     * in-flight tasks go back to PENDING.
     *
     * @return number of reclaimed tasks
     */
    public int unregister(UUID workerId) {
        if (workerRepository.findById(workerId).isEmpty()) {
            throw new WorkerNotFoundException(workerId);
        }
        int reclaimed = workerRepository.markDeadAndReclaim(workerId, null).orElse(0);
        log.info("Worker {} unregistered, {} tasks reclaimed", workerId, reclaimed);
        return reclaimed;
    }

    public Optional<Worker> findById(UUID workerId) {
        return workerRepository.findById(workerId);
    }

    public List<Worker> findAll() {
        return workerRepository.findAll();
    }

    public List<Heartbeat> recentHeartbeats(UUID workerId, int limit) {
        return workerRepository.findHeartbeats(workerId, limit);
    }

    public int countByLiveness(WorkerLiveness liveness) {
        return workerRepository.countByLiveness(liveness);
    }
}
