package tacoq.manager.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request DTO for submitting a task.
 * POST /api/v1/tasks
 */
public record SubmitTaskRequest(
        @JsonProperty("taskType") String taskType,
        @JsonProperty("inputData") JsonNode inputData // stored as-is
) {
    public void validate() {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType is required");
        }
    }

    /** Input as JSON string for storage, null when absent */
    public String inputJson() {
        return inputData == null || inputData.isNull() ? null : inputData.toString();
    }
}
