package tacoq.manager.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Request DTO for the start signal of a task.
 * POST /internal/v1/tasks/{taskId}/start
 */
public record StartTaskRequest(
        @JsonProperty("workerId") UUID workerId) {

    public void validate() {
        if (workerId == null) {
            throw new IllegalArgumentException("workerId is required");
        }
    }
}
