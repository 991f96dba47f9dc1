package tacoq.manager.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("aliveWorkers") Integer aliveWorkers,
        @JsonProperty("pendingTasks") Integer pendingTasks,
        @JsonProperty("queuedTasks") Integer queuedTasks,
        @JsonProperty("runningTasks") Integer runningTasks) {

    public static HealthResponse healthy(String uptime, String version, int aliveWorkers, int pendingTasks,
            int queuedTasks, int runningTasks) {
        return new HealthResponse("healthy", "ok", uptime, version, aliveWorkers, pendingTasks, queuedTasks,
                runningTasks);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}
