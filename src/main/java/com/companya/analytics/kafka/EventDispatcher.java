package com.companya.analytics.kafka;

import com.companya.analytics.consumer.DomainEvent;
import com.companya.analytics.consumer.EventHandler;
import com.companya.analytics.consumer.HandlerRegistry;
import com.companya.analytics.metrics.ReplicationMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns one raw message body into a handler invocation. Undecodable messages and
 * unknown kinds are reported as skipped; anything thrown by the handler propagates
 * so the caller can leave the offset uncommitted.
 */
@Slf4j
@Component
public class EventDispatcher {

    private final EnvelopeCodec codec;
    private final HandlerRegistry registry;
    private final ReplicationMetrics metrics;

    public EventDispatcher(EnvelopeCodec codec, HandlerRegistry registry, ReplicationMetrics metrics) {
        this.codec = codec;
        this.registry = registry;
        this.metrics = metrics;
    }

    public DispatchOutcome dispatch(String topic, String body) {
        EventEnvelope envelope;
        try {
            envelope = codec.decode(body);
        } catch (MalformedEnvelopeException ex) {
            log.warn("Skipping malformed message on {}: {}", topic, ex.getMessage());
            metrics.skipped("malformed");
            return DispatchOutcome.SKIPPED_MALFORMED;
        }

        Optional<EventKind> resolved = EventKind.fromWireName(envelope.eventType());
        if (resolved.isEmpty()) {
            log.warn("Unknown event type '{}' on {} (event={})", envelope.eventType(), topic, envelope.eventId());
            metrics.skipped("unknown_kind");
            return DispatchOutcome.SKIPPED_UNKNOWN_KIND;
        }
        EventKind kind = resolved.get();

        if (!kind.belongsTo(topic)) {
            log.warn("{} arrived on topic '{}' instead of '{}', dispatching by kind",
                    kind.wireName(), topic, kind.getTopic().topicName());
            metrics.misrouted(kind, topic);
        }

        Optional<EventHandler> handler = registry.handlerFor(kind);
        if (handler.isEmpty()) {
            log.warn("No consumer registered for {} (event={})", kind.wireName(), envelope.eventId());
            metrics.skipped("unknown_kind");
            return DispatchOutcome.SKIPPED_UNKNOWN_KIND;
        }

        Object payload;
        try {
            payload = codec.readPayload(envelope, kind);
        } catch (MalformedEnvelopeException ex) {
            log.warn("Skipping {} entity={}: {}", kind.wireName(), envelope.entityId(), ex.getMessage());
            metrics.skipped("malformed");
            return DispatchOutcome.SKIPPED_MALFORMED;
        }

        try {
            handler.get().handle(new DomainEvent(kind, envelope, payload));
        } catch (RuntimeException ex) {
            metrics.failed(kind.wireName());
            throw ex;
        }
        metrics.processed(kind);
        return DispatchOutcome.PROCESSED;
    }
}
