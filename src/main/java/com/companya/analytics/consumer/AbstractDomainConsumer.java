package com.companya.analytics.consumer;

import com.companya.analytics.config.ReplicaProperties;
import com.companya.analytics.model.payload.IdOnlyPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Flattening helpers shared by the per-topic consumers.
 * <p>
 * Handlers are exposed as method references, so Spring's {@code @Transactional}
 * proxy never sees the call; parent and child writes are grouped through
 * {@link #writeTogether(Runnable)} instead.
 */
public abstract class AbstractDomainConsumer implements DomainConsumer {

    private final TransactionTemplate transactionTemplate;
    private final ReplicaProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    protected AbstractDomainConsumer(TransactionTemplate transactionTemplate, ReplicaProperties properties,
                                     ObjectMapper objectMapper, Clock clock) {
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Runs a parent write and its child writes in one local transaction, unless
     * atomic parent/child writes are switched off.
     */
    protected void writeTogether(Runnable writes) {
        if (properties.isAtomicParentChildWrites()) {
            transactionTemplate.executeWithoutResult(status -> writes.run());
        } else {
            writes.run();
        }
    }

    protected static <T> T require(T value, String field, DomainEvent event) {
        if (value == null || (value instanceof String text && text.isBlank())) {
            throw new PayloadContractException(event.kind().wireName() + " entity=" + event.entityId()
                    + " is missing required field '" + field + "'");
        }
        return value;
    }

    /**
     * Id of the aggregate a full snapshot describes. Snapshots do not repeat their own id.
     */
    protected static String entityId(DomainEvent event) {
        return require(event.entityId(), "entity_id", event);
    }

    /**
     * Id named in a deletion payload, falling back to the envelope's entity id.
     */
    protected static String deletedId(DomainEvent event) {
        IdOnlyPayload payload = event.payload(IdOnlyPayload.class);
        String id = payload.entityId();
        if (id == null || id.isBlank()) {
            id = event.entityId();
        }
        return require(id, "entity_id", event);
    }

    protected static LocalDateTime eventTime(DomainEvent event) {
        return EventTimestamps.parse(event.emittedAt());
    }

    /**
     * For NOT NULL timestamp columns: the payload value, else the event time, else now.
     */
    protected LocalDateTime timestampOrEventTime(String value, DomainEvent event) {
        LocalDateTime parsed = EventTimestamps.parse(value);
        if (parsed != null) {
            return parsed;
        }
        LocalDateTime emitted = eventTime(event);
        return emitted != null ? emitted : LocalDateTime.now(clock);
    }

    protected static int zeroIfNull(Integer value) {
        return value == null ? 0 : value;
    }

    protected String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), ex);
        }
    }
}
