package tacoq.manager.model;

/**
 * Worker liveness as classified from its latest heartbeat.
 */
public enum WorkerLiveness {
    /** Heartbeat within the heartbeat timeout */
    ALIVE,
    /** Heartbeat missed, still inside the death grace period */
    SUSPECTED,
    /** Declared dead; only re-registration brings it back */
    DEAD;

    /** Check if the worker may receive new assignments */
    public boolean canAcceptWork() {
        return this == ALIVE;
    }
}
