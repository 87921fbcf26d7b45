package com.companya.analytics.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProductDeletedPayload(@JsonProperty("product_id") String productId) implements IdOnlyPayload {

    @Override
    public String entityId() {
        return productId;
    }
}
