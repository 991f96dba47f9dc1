package tacoq.manager.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

/**
 * Response DTO for worker registration.
 * Tells the worker which queues to consume and how often to send heartbeats.
 */
public record RegisterWorkerResponse(
        @JsonProperty("workerId") UUID workerId,
        @JsonProperty("queues") List<String> queues,
        @JsonProperty("heartbeatIntervalMs") long heartbeatIntervalMs) {
}
