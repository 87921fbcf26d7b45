package com.companya.analytics.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UserDeletedPayload(@JsonProperty("user_id") String userId) implements IdOnlyPayload {

    @Override
    public String entityId() {
        return userId;
    }
}
