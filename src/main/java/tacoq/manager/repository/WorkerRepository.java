package tacoq.manager.repository;

import tacoq.manager.model.Heartbeat;
import tacoq.manager.model.Worker;
import tacoq.manager.model.WorkerLiveness;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;

/**
 * Repository interface for workers, their capabilities and heartbeats.
 * Liveness lives in the store so any number of detectors agree on it.
 */
public interface WorkerRepository {

    /**
     * Insert or refresh a worker in one transaction: name and capabilities are replaced,
     * liveness becomes ALIVE, a heartbeat is seeded at the registration time, and any
     * tasks still assigned to this identity from a previous process are returned to PENDING.
     *
     * @param worker worker with its capability set
     * @return number of stale assignments reclaimed
     */
    int register(Worker worker);

    Optional<Worker> findById(UUID workerId);

    List<Worker> findAll();

    /**
     * Workers with the given liveness that declared the task type.
     */
    Set<UUID> findCapable(UUID taskTypeId, WorkerLiveness liveness);

    /**
     * Append a heartbeat and raise last_heartbeat to max(existing, heartbeatTime).
     * SUSPECTED moves back to ALIVE only if that maximum is not before {@code suspectBefore};
     * DEAD stays DEAD.
     *
     * @return the worker's liveness after the update, empty if the worker is unknown
     */
    Optional<WorkerLiveness> recordHeartbeat(UUID workerId, Instant heartbeatTime, Instant receivedAt,
            Instant suspectBefore);

    /**
     * Move ALIVE workers whose last heartbeat is older than the cutoff to SUSPECTED.
     *
     * @return IDs of the workers that moved
     */
    List<UUID> markSuspected(Instant lastHeartbeatBefore);

    /**
     * Workers not yet DEAD whose last heartbeat is older than the cutoff.
     */
    List<UUID> findDeathCandidates(Instant lastHeartbeatBefore);

    /**
     * Declare a worker dead and reclaim its QUEUED and RUNNING tasks in one transaction.
     * Guarded on the worker not being DEAD already and, when a cutoff is given, on its
     * last heartbeat still being older than the cutoff.
     *
     * @param lastHeartbeatBefore cutoff, or null to skip the heartbeat guard
     * @return number of reclaimed tasks, empty if the guard failed
     */
    OptionalInt markDeadAndReclaim(UUID workerId, Instant lastHeartbeatBefore);

    /**
     * Most recent heartbeats of a worker, newest first.
     */
    List<Heartbeat> findHeartbeats(UUID workerId, int limit);

    int countByLiveness(WorkerLiveness liveness);
}
