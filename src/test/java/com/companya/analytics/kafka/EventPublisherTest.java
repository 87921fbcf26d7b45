package com.companya.analytics.kafka;

import com.companya.analytics.model.payload.UserDeletedPayload;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EventPublisher")
class EventPublisherTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private final EnvelopeCodec codec = new EnvelopeCodec(new ObjectMapper());

    private EventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new EventPublisher(kafkaTemplate, codec, CLOCK);
    }

    @AfterEach
    void clearSynchronization() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("Emits to the kind's topic keyed by entity id")
    void emitsKeyedEnvelope() {
        // Given
        when(kafkaTemplate.send(eq("user"), eq("u1"), anyString())).thenReturn(new CompletableFuture<SendResult<String, String>>());

        // When
        publisher.emit(EventKind.USER_DELETED, "u1", new UserDeletedPayload("u1"));

        // Then
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("user"), eq("u1"), body.capture());
        EventEnvelope envelope = codec.decode(body.getValue());
        assertThat(envelope.eventType()).isEqualTo("user.deleted");
        assertThat(envelope.entityId()).isEqualTo("u1");
        assertThat(envelope.timestamp()).isEqualTo("2024-03-01T10:00:00Z");
        assertThat(envelope.eventId()).hasSize(36);
        assertThat(envelope.data().path("user_id").asText()).isEqualTo("u1");
    }

    @Test
    @DisplayName("Each emission gets a fresh event id")
    void eventIdsAreUnique() {
        when(kafkaTemplate.send(eq("post"), eq("post1"), anyString())).thenReturn(new CompletableFuture<SendResult<String, String>>());

        publisher.emit(EventKind.POST_UPDATED, "post1", Map.of("post_type", "text"));
        publisher.emit(EventKind.POST_UPDATED, "post1", Map.of("post_type", "text"));

        ArgumentCaptor<String> bodies = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate, times(2)).send(eq("post"), eq("post1"), bodies.capture());
        assertThat(codec.decode(bodies.getAllValues().get(0)).eventId())
                .isNotEqualTo(codec.decode(bodies.getAllValues().get(1)).eventId());
    }

    @Test
    @DisplayName("Rejects a blank entity id")
    void rejectsBlankEntityId() {
        assertThatThrownBy(() -> publisher.emit(EventKind.USER_CREATED, " ", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    @DisplayName("Inside a transaction, emission waits for the commit")
    void emitAfterCommitDefersUntilCommit() {
        // Given
        TransactionSynchronizationManager.initSynchronization();
        when(kafkaTemplate.send(eq("product"), eq("p1"), anyString())).thenReturn(new CompletableFuture<SendResult<String, String>>());

        // When
        publisher.emitAfterCommit(EventKind.PRODUCT_DELETED, "p1", Map.of("product_id", "p1"));

        // Then
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            synchronization.afterCommit();
        }
        verify(kafkaTemplate).send(eq("product"), eq("p1"), anyString());
    }

    @Test
    @DisplayName("A rolled-back transaction emits nothing")
    void rollbackEmitsNothing() {
        TransactionSynchronizationManager.initSynchronization();

        publisher.emitAfterCommit(EventKind.PRODUCT_DELETED, "p1", Map.of("product_id", "p1"));
        for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
            synchronization.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK);
        }

        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    @DisplayName("Without a transaction, emission is immediate")
    void emitAfterCommitWithoutTransactionEmitsNow() {
        when(kafkaTemplate.send(eq("order"), eq("o1"), anyString())).thenReturn(new CompletableFuture<SendResult<String, String>>());

        publisher.emitAfterCommit(EventKind.ORDER_CANCELLED, "o1", Map.of("order_number", "ORD-1"));

        verify(kafkaTemplate).send(eq("order"), eq("o1"), anyString());
    }
}
