package com.companya.analytics.consumer;

import com.companya.analytics.kafka.EventEnvelope;
import com.companya.analytics.kafka.EventKind;

/**
 * A decoded envelope whose payload has been bound to the type its kind declares.
 */
public record DomainEvent(EventKind kind, EventEnvelope envelope, Object payload) {

    public <P> P payload(Class<P> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException(kind.wireName() + " carries "
                    + (payload == null ? "no payload" : payload.getClass().getSimpleName())
                    + ", not " + type.getSimpleName());
        }
        return type.cast(payload);
    }

    public String entityId() {
        return envelope.entityId();
    }

    public String eventId() {
        return envelope.eventId();
    }

    public String emittedAt() {
        return envelope.timestamp();
    }
}
