package tacoq.manager.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Request DTO for worker heartbeat. The body may be empty.
 * POST /internal/v1/workers/{workerId}/heartbeat
 */
public record HeartbeatRequest(
        @JsonProperty("timestamp") Instant timestamp) {

    public static HeartbeatRequest empty() {
        return new HeartbeatRequest(null);
    }
}
