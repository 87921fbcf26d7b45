package com.companya.analytics.kafka;

import com.companya.analytics.consumer.DomainConsumer;
import com.companya.analytics.consumer.DomainEvent;
import com.companya.analytics.consumer.EventHandler;
import com.companya.analytics.consumer.HandlerRegistry;
import com.companya.analytics.consumer.PayloadContractException;
import com.companya.analytics.helper.TestEvents;
import com.companya.analytics.metrics.ReplicationMetrics;
import com.companya.analytics.model.payload.UserDeletedPayload;
import com.companya.analytics.model.payload.UserPayload;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventDispatcher")
class EventDispatcherTest {

    private final List<DomainEvent> handled = new ArrayList<>();
    private SimpleMeterRegistry meterRegistry;
    private EventDispatcher dispatcher;
    private RuntimeException failure;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        DomainConsumer users = new DomainConsumer() {
            @Override
            public Topic topic() {
                return Topic.USER;
            }

            @Override
            public EventHandler handlerFor(EventKind kind) {
                return event -> {
                    if (failure != null) {
                        throw failure;
                    }
                    handled.add(event);
                };
            }
        };
        dispatcher = new EventDispatcher(TestEvents.CODEC, new HandlerRegistry(List.of(users)),
                new ReplicationMetrics(meterRegistry));
    }

    @Test
    @DisplayName("Decodes, binds the typed payload and invokes the handler")
    void dispatchesToHandler() {
        DispatchOutcome outcome = dispatcher.dispatch("user", TestEvents.json("user-created"));

        assertThat(outcome).isEqualTo(DispatchOutcome.PROCESSED);
        assertThat(handled).singleElement().satisfies(event -> {
            assertThat(event.kind()).isEqualTo(EventKind.USER_CREATED);
            assertThat(event.entityId()).isEqualTo("u1");
            assertThat(event.payload(UserPayload.class).getProfile().getDisplayName()).isEqualTo("Ana");
        });
        assertThat(meterRegistry.counter(ReplicationMetrics.PROCESSED, "kind", "user.created").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Deletion events carry their id-only payload")
    void dispatchesDeletion() {
        dispatcher.dispatch("user", TestEvents.json("user-deleted"));

        assertThat(handled.get(0).payload(UserDeletedPayload.class).userId()).isEqualTo("u1");
    }

    @Test
    @DisplayName("Malformed bodies are skipped without invoking any handler")
    void skipsMalformedBody() {
        DispatchOutcome outcome = dispatcher.dispatch("user", "{not json");

        assertThat(outcome).isEqualTo(DispatchOutcome.SKIPPED_MALFORMED);
        assertThat(handled).isEmpty();
        assertThat(meterRegistry.counter(ReplicationMetrics.SKIPPED, "reason", "malformed").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Payloads that do not bind are skipped as malformed")
    void skipsUnbindablePayload() {
        DispatchOutcome outcome = dispatcher.dispatch("user",
                "{\"event_type\":\"user.updated\",\"entity_id\":\"u1\",\"data\":{\"version\":\"two\"}}");

        assertThat(outcome).isEqualTo(DispatchOutcome.SKIPPED_MALFORMED);
        assertThat(handled).isEmpty();
    }

    @Test
    @DisplayName("Unknown event kinds are skipped")
    void skipsUnknownKind() {
        DispatchOutcome outcome = dispatcher.dispatch("user",
                "{\"event_type\":\"user.exploded\",\"entity_id\":\"u1\",\"data\":{}}");

        assertThat(outcome).isEqualTo(DispatchOutcome.SKIPPED_UNKNOWN_KIND);
        assertThat(meterRegistry.counter(ReplicationMetrics.SKIPPED, "reason", "unknown_kind").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Known kinds without a registered consumer are skipped")
    void skipsKindWithoutConsumer() {
        DispatchOutcome outcome = dispatcher.dispatch("product", TestEvents.json("product-deleted"));

        assertThat(outcome).isEqualTo(DispatchOutcome.SKIPPED_UNKNOWN_KIND);
        assertThat(handled).isEmpty();
    }

    @Test
    @DisplayName("A kind on a foreign topic is flagged but still dispatched by kind")
    void dispatchesMisroutedKind() {
        DispatchOutcome outcome = dispatcher.dispatch("post", TestEvents.json("user-created"));

        assertThat(outcome).isEqualTo(DispatchOutcome.PROCESSED);
        assertThat(handled).hasSize(1);
        assertThat(meterRegistry.counter(ReplicationMetrics.MISROUTED, "kind", "user.created", "topic", "post").count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Handler failures propagate and are counted")
    void handlerFailurePropagates() {
        failure = new PayloadContractException("missing email");

        assertThatThrownBy(() -> dispatcher.dispatch("user", TestEvents.json("user-created")))
                .isSameAs(failure);
        assertThat(meterRegistry.counter(ReplicationMetrics.FAILED, "kind", "user.created").count()).isEqualTo(1.0);
        assertThat(meterRegistry.find(ReplicationMetrics.PROCESSED).counter()).isNull();
    }
}
