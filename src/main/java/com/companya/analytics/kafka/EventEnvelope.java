package com.companya.analytics.kafka;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Wire envelope shared by producer and consumer. {@code data} stays an untyped
 * tree until the event kind is known.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventEnvelope(
        @JsonProperty("event_type") String eventType,
        @JsonProperty("event_id") String eventId,
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("data") JsonNode data) {
}
