package tacoq.manager.model;

/**
 * Outcome of a guarded status transition.
 */
public enum Transition {
    /** The guard held and the task moved */
    APPLIED,

    /**
     * The guard failed: the task was already moved by someone else.
     * Callers re-read the task and decide.
     */
    STALE;

    public boolean applied() {
        return this == APPLIED;
    }

    public static Transition of(boolean applied) {
        return applied ? APPLIED : STALE;
    }
}
