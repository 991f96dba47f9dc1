package tacoq.manager.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

public record SubmitTaskResponse(
        @JsonProperty("taskId") UUID taskId,
        @JsonProperty("status") String status) {
}
