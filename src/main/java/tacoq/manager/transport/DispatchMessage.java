package tacoq.manager.transport;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Work item published to the queue of a task type.
 * The payload is passed through as an opaque string.
 */
public record DispatchMessage(
        @JsonProperty("taskId") UUID taskId,
        @JsonProperty("taskType") String taskType,
        @JsonProperty("workerId") UUID workerId,
        @JsonProperty("inputData") String inputData) {
}
