package tacoq.manager.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import tacoq.manager.model.Task;
import tacoq.manager.model.TaskDetails;
import tacoq.manager.model.TaskResult;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for task details.
 * GET /api/v1/tasks/{taskId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("id") UUID id,
        @JsonProperty("taskTypeId") UUID taskTypeId,
        @JsonProperty("status") String status,
        @JsonRawValue @JsonProperty("inputData") String inputData, // raw JSON, not re-serialized
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("assignedTo") UUID assignedTo,
        @JsonProperty("result") Result result) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Result(
            @JsonRawValue @JsonProperty("outputData") String outputData,
            @JsonRawValue @JsonProperty("errorData") String errorData,
            @JsonProperty("workerId") UUID workerId,
            @JsonProperty("completedAt") Instant completedAt) {

        public static Result from(TaskResult result) {
            return new Result(result.outputData(), result.errorData(), result.workerId(), result.completedAt());
        }
    }

    public static TaskResponse from(TaskDetails details) {
        Task task = details.task();
        return new TaskResponse(
                task.id(),
                task.taskTypeId(),
                task.status().name(),
                task.inputData(),
                task.createdAt(),
                task.assignedTo(),
                details.hasResult() ? Result.from(details.result()) : null);
    }
}
