package tacoq.manager.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import tacoq.manager.model.ResultReport;

import java.util.UUID;

/**
 * Request DTO for reporting a task outcome.
 * POST /internal/v1/tasks/{taskId}/result
 */
public record TaskResultRequest(
        @JsonProperty("workerId") UUID workerId,
        @JsonProperty("success") Boolean success,
        @JsonProperty("outputData") JsonNode outputData, // stored as-is
        @JsonProperty("errorData") JsonNode errorData) {

    public void validate() {
        if (workerId == null) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (success == null) {
            throw new IllegalArgumentException("success is required");
        }
    }

    public ResultReport toReport(UUID taskId) {
        return new ResultReport(taskId, workerId, success, json(outputData), json(errorData));
    }

    private static String json(JsonNode node) {
        return node == null || node.isNull() ? null : node.toString();
    }
}
