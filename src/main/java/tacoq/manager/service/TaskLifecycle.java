package tacoq.manager.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.model.Transition;
import tacoq.manager.repository.TaskRepository;

import java.util.UUID;

/**
 * Guarded task status transitions.
 * A STALE result means the task was moved by someone else; callers re-read and decide.
 */
public class TaskLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TaskLifecycle.class);

    private final TaskRepository taskRepository;

    public TaskLifecycle(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    /** PENDING -> QUEUED, only for an ALIVE worker that declared the task's type */
    public Transition assign(UUID taskId, UUID workerId) {
        Transition t = Transition.of(taskRepository.assign(taskId, workerId));
        if (t.applied()) {
            log.debug("Task {} assigned to worker {}", taskId, workerId);
        } else {
            log.debug("Assignment of task {} to worker {} is stale", taskId, workerId);
        }
        return t;
    }

    /** QUEUED -> RUNNING, only while still assigned to the worker */
    public Transition markRunning(UUID taskId, UUID workerId) {
        Transition t = Transition.of(taskRepository.markRunning(taskId, workerId));
        if (!t.applied()) {
            log.warn("Start signal for task {} from worker {} is stale", taskId, workerId);
        }
        return t;
    }

    /** QUEUED -> PENDING after a publish that never went through */
    public Transition rollbackAssignment(UUID taskId, UUID workerId) {
        Transition t = Transition.of(taskRepository.rollbackAssignment(taskId, workerId));
        if (t.applied()) {
            log.info("Task {} returned to PENDING after failed publish", taskId);
        } else {
            log.warn("Rollback of task {} from worker {} is stale", taskId, workerId);
        }
        return t;
    }

    /** PENDING | QUEUED -> CANCELLED */
    public Transition cancel(UUID taskId) {
        Transition t = Transition.of(taskRepository.cancel(taskId));
        if (t.applied()) {
            log.info("Task {} cancelled", taskId);
        }
        return t;
    }
}
