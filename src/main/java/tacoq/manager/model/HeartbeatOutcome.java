package tacoq.manager.model;

/**
 * Result of recording a heartbeat.
 */
public enum HeartbeatOutcome {
    /** Heartbeat recorded, worker is alive */
    ACCEPTED,

    /** Heartbeat recorded for audit but the worker is dead and must register again */
    REREGISTER_REQUIRED
}
