package tacoq.manager.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import tacoq.manager.model.Worker;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for a registered worker.
 * GET /api/v1/workers
 */
public record WorkerResponse(
        @JsonProperty("id") UUID id,
        @JsonProperty("name") String name,
        @JsonProperty("liveness") String liveness,
        @JsonProperty("registeredAt") Instant registeredAt,
        @JsonProperty("lastHeartbeat") Instant lastHeartbeat,
        @JsonProperty("capabilities") List<UUID> capabilities) {

    public static WorkerResponse from(Worker worker) {
        return new WorkerResponse(
                worker.id(),
                worker.name(),
                worker.liveness().name(),
                worker.registeredAt(),
                worker.lastHeartbeat(),
                worker.capabilities().stream().sorted().toList());
    }
}
