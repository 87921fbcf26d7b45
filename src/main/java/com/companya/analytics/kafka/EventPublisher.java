package com.companya.analytics.kafka;

import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Producer side of the envelope contract. Callers emit only after the write
 * that produced {@code data} has been made durable; {@link #emitAfterCommit}
 * enforces that ordering when the write runs inside a Spring transaction.
 */
@Slf4j
@Service
public class EventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final EnvelopeCodec codec;
    private final Clock clock;

    public EventPublisher(KafkaTemplate<String, String> kafkaTemplate, EnvelopeCodec codec, Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * Wraps {@code data} in a fresh envelope and sends it to the kind's topic,
     * partitioned by {@code entityId}.
     */
    public CompletableFuture<SendResult<String, String>> emit(EventKind kind, String entityId, Object data) {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId is required to emit " + kind.wireName());
        }
        EventEnvelope envelope = new EventEnvelope(
                kind.wireName(),
                UUID.randomUUID().toString(),
                entityId,
                Instant.now(clock).toString(),
                codec.toTree(data));

        String topic = kind.getTopic().topicName();
        CompletableFuture<SendResult<String, String>> future =
                kafkaTemplate.send(topic, entityId, codec.encode(envelope));
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Delivery failed for {} entity={} event={}", kind.wireName(), entityId, envelope.eventId(), ex);
            } else {
                log.debug("Delivered {} entity={} to {}-{}@{}", kind.wireName(), entityId,
                        topic, result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            }
        });
        return future;
    }

    /**
     * Emits once the surrounding transaction commits; nothing is sent on rollback.
     * Without an active transaction the caller's write has already returned, so the
     * event is sent straight away.
     */
    public void emitAfterCommit(EventKind kind, String entityId, Object data) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            emit(kind, entityId, data);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                emit(kind, entityId, data);
            }
        });
    }

    public void flush() {
        kafkaTemplate.flush();
    }
}
