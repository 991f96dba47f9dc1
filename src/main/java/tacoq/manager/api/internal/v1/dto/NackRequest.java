package tacoq.manager.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /internal/v1/deliveries/{tag}/nack
 */
public record NackRequest(
        @JsonProperty("requeue") Boolean requeue) {

    public boolean requeueOrDefault() {
        return requeue == null || requeue;
    }
}
