package com.companya.analytics.helper;

import com.companya.analytics.consumer.DomainEvent;
import com.companya.analytics.kafka.EnvelopeCodec;
import com.companya.analytics.kafka.EventEnvelope;
import com.companya.analytics.kafka.EventKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads the JSON envelopes under {@code src/test/resources/events}.
 */
public final class TestEvents {

    public static final ObjectMapper MAPPER = new ObjectMapper();
    public static final EnvelopeCodec CODEC = new EnvelopeCodec(MAPPER);

    private TestEvents() {
    }

    public static String json(String name) {
        try {
            return new ClassPathResource("events/" + name + ".json").getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    /**
     * Decodes a fixture the way the dispatcher does.
     */
    public static DomainEvent event(String name) {
        return decode(json(name));
    }

    public static DomainEvent decode(String body) {
        EventEnvelope envelope = CODEC.decode(body);
        EventKind kind = EventKind.fromWireName(envelope.eventType())
                .orElseThrow(() -> new IllegalArgumentException("Unknown kind " + envelope.eventType()));
        return new DomainEvent(kind, envelope, CODEC.readPayload(envelope, kind));
    }

    /**
     * Same fixture with a different event timestamp, for replay and ordering scenarios.
     */
    public static String withTimestamp(String name, String timestamp) {
        return json(name).replaceFirst("\"timestamp\": \"[^\"]*\"", "\"timestamp\": \"" + timestamp + "\"");
    }
}
