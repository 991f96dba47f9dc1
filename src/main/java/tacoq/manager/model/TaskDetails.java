package tacoq.manager.model;

/**
 * A task together with its result, if one was recorded.
 */
public record TaskDetails(Task task, TaskResult result) {

    public boolean hasResult() {
        return result != null;
    }
}
