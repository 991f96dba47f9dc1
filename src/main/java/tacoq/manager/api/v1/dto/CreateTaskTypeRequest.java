package tacoq.manager.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for creating a task type.
 * POST /api/v1/task-types
 */
public record CreateTaskTypeRequest(
        @JsonProperty("name") String name) {

    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
    }
}
