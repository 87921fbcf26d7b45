package com.companya.analytics.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON codec for {@link EventEnvelope} and the typed payloads behind it.
 */
@Component
@RequiredArgsConstructor
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;

    public EventEnvelope decode(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedEnvelopeException("Empty message body");
        }
        JsonNode tree;
        try {
            tree = objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new MalformedEnvelopeException("Body is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
        if (tree == null || !tree.isObject()) {
            throw new MalformedEnvelopeException("Envelope must be a JSON object");
        }
        EventEnvelope envelope;
        try {
            envelope = objectMapper.treeToValue(tree, EventEnvelope.class);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new MalformedEnvelopeException("Envelope fields have unexpected types", ex);
        }
        if (envelope.eventType() == null || envelope.eventType().isBlank()) {
            throw new MalformedEnvelopeException("Envelope has no event_type");
        }
        return envelope;
    }

    /**
     * Binds the envelope's data block to the payload type of {@code kind}. A missing
     * or null block binds to an empty payload.
     */
    public Object readPayload(EventEnvelope envelope, EventKind kind) {
        JsonNode data = envelope.data();
        if (data == null || data.isNull() || data.isMissingNode()) {
            data = objectMapper.createObjectNode();
        }
        if (!data.isObject()) {
            throw new MalformedEnvelopeException("data of " + kind.wireName() + " must be a JSON object");
        }
        try {
            return objectMapper.treeToValue(data, kind.getPayloadType());
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new MalformedEnvelopeException(
                    "data does not match " + kind.getPayloadType().getSimpleName() + " for " + kind.wireName(), ex);
        }
    }

    public String encode(EventEnvelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize envelope " + envelope.eventId(), ex);
        }
    }

    public JsonNode toTree(Object payload) {
        return objectMapper.valueToTree(payload);
    }
}
