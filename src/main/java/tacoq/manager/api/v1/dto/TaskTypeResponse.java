package tacoq.manager.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import tacoq.manager.model.TaskType;

import java.time.Instant;
import java.util.UUID;

public record TaskTypeResponse(
        @JsonProperty("id") UUID id,
        @JsonProperty("name") String name,
        @JsonProperty("queue") String queue,
        @JsonProperty("createdAt") Instant createdAt) {

    public static TaskTypeResponse from(TaskType type) {
        return new TaskTypeResponse(type.id(), type.name(), type.queueName(), type.createdAt());
    }
}
