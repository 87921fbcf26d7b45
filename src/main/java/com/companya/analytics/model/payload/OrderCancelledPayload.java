package com.companya.analytics.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cancellation carries the human-readable order number; the order id is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderCancelledPayload(
        @JsonProperty("order_id") String orderId,
        @JsonProperty("order_number") String orderNumber) implements IdOnlyPayload {

    @Override
    public String entityId() {
        return orderId;
    }
}
