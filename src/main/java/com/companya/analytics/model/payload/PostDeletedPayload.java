package com.companya.analytics.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PostDeletedPayload(@JsonProperty("post_id") String postId) implements IdOnlyPayload {

    @Override
    public String entityId() {
        return postId;
    }
}
