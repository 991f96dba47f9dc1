package tacoq.manager.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Task lifecycle status.
 *
 * <pre>
 * PENDING  -> QUEUED      dispatcher assignment
 * QUEUED   -> RUNNING     worker start signal
 * QUEUED   -> PENDING     worker death, failed publish
 * RUNNING  -> PENDING     worker death
 * QUEUED   -> COMPLETED | FAILED   result reported
 * RUNNING  -> COMPLETED | FAILED   result reported
 * PENDING  -> CANCELLED   external cancellation
 * QUEUED   -> CANCELLED   external cancellation
 * </pre>
 */
public enum TaskStatus {
    /** Created, waiting for a capable live worker */
    PENDING,
    /** Assigned to a worker and published to the type's queue */
    QUEUED,
    /** The assigned worker signalled that execution started */
    RUNNING,
    /** Finished with an output */
    COMPLETED,
    /** Finished with an error */
    FAILED,
    /** Cancelled before execution started */
    CANCELLED;

    /** Check if a worker-reported outcome has already been applied */
    public boolean hasResult() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Statuses from which {@code target} may be entered. The store builds its
     * conditional updates from this, so the table above is what the SQL enforces.
     */
    public static Set<TaskStatus> sourcesOf(TaskStatus target) {
        Set<TaskStatus> sources = EnumSet.noneOf(TaskStatus.class);
        for (TaskStatus status : values()) {
            if (status.canTransitionTo(target)) {
                sources.add(status);
            }
        }
        return sources;
    }

    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case PENDING -> target == QUEUED || target == CANCELLED;
            case QUEUED -> target == RUNNING || target == PENDING || target == COMPLETED
                    || target == FAILED || target == CANCELLED;
            case RUNNING -> target == PENDING || target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
