package tacoq.manager.model;

import java.util.UUID;

/**
 * Outcome of a task execution as reported by a worker.
 * outputData and errorData are raw JSON; at most one of them is set.
 */
public record ResultReport(
        UUID taskId,
        UUID workerId,
        boolean success,
        String outputData,
        String errorData) {

    public static ResultReport success(UUID taskId, UUID workerId, String outputData) {
        return new ResultReport(taskId, workerId, true, outputData, null);
    }

    public static ResultReport failure(UUID taskId, UUID workerId, String errorData) {
        return new ResultReport(taskId, workerId, false, null, errorData);
    }

    public void validate() {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId is required");
        }
        if (workerId == null) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (outputData != null && errorData != null) {
            throw new IllegalArgumentException("only one of outputData and errorData may be set");
        }
        if (success && errorData != null) {
            throw new IllegalArgumentException("a successful result cannot carry errorData");
        }
        if (!success && outputData != null) {
            throw new IllegalArgumentException("a failed result cannot carry outputData");
        }
    }

    public TaskStatus targetStatus() {
        return success ? TaskStatus.COMPLETED : TaskStatus.FAILED;
    }
}
