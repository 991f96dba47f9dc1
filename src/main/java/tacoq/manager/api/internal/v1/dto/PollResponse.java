package tacoq.manager.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tacoq.manager.transport.Delivery;
import tacoq.manager.transport.DispatchMessage;

/**
 * Response DTO for a queue poll. Empty when the queue had nothing ready.
 * POST /internal/v1/queues/{typeName}/poll
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PollResponse(
        @JsonProperty("deliveryTag") Long deliveryTag,
        @JsonProperty("redelivered") Boolean redelivered,
        @JsonProperty("message") DispatchMessage message) {

    public static PollResponse of(Delivery delivery, DispatchMessage message) {
        return new PollResponse(delivery.tag(), delivery.redelivered(), message);
    }

    public static PollResponse empty() {
        return new PollResponse(null, null, null);
    }

    public boolean hasMessage() {
        return message != null;
    }
}
