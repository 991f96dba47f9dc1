package tacoq.manager.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for internal API operations.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("error") String error,
        @JsonProperty("outcome") String outcome) {

    public static OperationResponse success() {
        return new OperationResponse(true, null, null);
    }

    public static OperationResponse success(String outcome) {
        return new OperationResponse(true, null, outcome);
    }

    public static OperationResponse error(String error) {
        return new OperationResponse(false, error, null);
    }

    public static OperationResponse reregisterRequired() {
        return new OperationResponse(false, "reregister_required", null);
    }

    public static OperationResponse stale() {
        return new OperationResponse(false, "stale_transition", null);
    }

    public static OperationResponse unknownDelivery() {
        return error("unknown_delivery");
    }
}
