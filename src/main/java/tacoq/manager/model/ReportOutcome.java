package tacoq.manager.model;

/**
 * Result of reconciling a worker-reported outcome.
 */
public enum ReportOutcome {
    /** Result row created and task finalized */
    RECORDED,

    /** Task already completed or failed - acknowledged as a no-op */
    DUPLICATE,

    /**
     * Result discarded: the task was reclaimed, the reporter is dead or unknown,
     * or the task was taken back from the reporter and now belongs to another worker
     */
    ORPHANED,

    /** Task was cancelled before the result arrived - result discarded */
    CANCELLED,

    /** Task not found */
    NOT_FOUND;

    /** Check if the report can be acknowledged to the transport */
    public boolean acknowledged() {
        return this != NOT_FOUND;
    }
}
