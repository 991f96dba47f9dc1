package tacoq.manager.repository;

import tacoq.manager.model.ReportOutcome;
import tacoq.manager.model.ResultReport;
import tacoq.manager.model.Task;
import tacoq.manager.model.TaskResult;
import tacoq.manager.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for tasks and their results.
 * Every status change is a conditional update on the current status.
 */
public interface TaskRepository {

    /**
     * Save a new task.
     */
    void save(Task task);

    Optional<Task> findById(UUID taskId);

    /**
     * Task types that currently have at least one PENDING task.
     */
    List<UUID> findTypesWithPending();

    /**
     * PENDING tasks of a type, oldest first.
     */
    List<Task> findPendingByType(UUID taskTypeId, int limit);

    List<Task> findByStatus(TaskStatus status, int limit);

    List<Task> findAssignedTo(UUID workerId);

    /**
     * Number of QUEUED and RUNNING tasks per assigned worker.
     */
    Map<UUID, Integer> countInFlightByWorker();

    /**
     * PENDING -> QUEUED with assigned_to set.
     * Only applies if the worker is ALIVE and declared the task's type.
     *
     * @return true if the task moved
     */
    boolean assign(UUID taskId, UUID workerId);

    /**
     * QUEUED -> RUNNING, only while still assigned to the worker.
     */
    boolean markRunning(UUID taskId, UUID workerId);

    /**
     * QUEUED -> PENDING after a publish that never succeeded,
     * only while still assigned to the worker.
     */
    boolean rollbackAssignment(UUID taskId, UUID workerId);

    /**
     * PENDING | QUEUED -> CANCELLED.
     */
    boolean cancel(UUID taskId);

    /**
     * Record the result and move QUEUED | RUNNING -> COMPLETED | FAILED in one transaction.
     * The guard check and both writes share the transaction, so a concurrent duplicate
     * report cannot interleave. A report from a DEAD or unknown worker, or from a worker the
     * task was reclaimed from while another worker now holds it, is ORPHANED.
     */
    ReportOutcome finalizeWithResult(ResultReport report, UUID resultId, Instant completedAt);

    Optional<TaskResult> findResult(UUID taskId);

    int countByStatus(TaskStatus status);
}
