package tacoq.manager.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

/**
 * Request DTO for worker registration.
 * POST /internal/v1/workers/register
 */
public record RegisterWorkerRequest(
        @JsonProperty("workerId") UUID workerId, // optional, generated when absent
        @JsonProperty("name") String name,
        @JsonProperty("taskTypes") List<String> taskTypes) {

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        if (taskTypes != null && taskTypes.stream().anyMatch(t -> t == null || t.isBlank())) {
            throw new IllegalArgumentException("taskTypes must not contain blank names");
        }
    }

    public List<String> taskTypesOrEmpty() {
        return taskTypes == null ? List.of() : taskTypes;
    }
}
