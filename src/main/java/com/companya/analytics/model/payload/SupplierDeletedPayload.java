package com.companya.analytics.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SupplierDeletedPayload(@JsonProperty("supplier_id") String supplierId) implements IdOnlyPayload {

    @Override
    public String entityId() {
        return supplierId;
    }
}
