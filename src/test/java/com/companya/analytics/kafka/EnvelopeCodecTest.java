package com.companya.analytics.kafka;

import com.companya.analytics.helper.TestEvents;
import com.companya.analytics.model.payload.OrderCancelledPayload;
import com.companya.analytics.model.payload.ProductPayload;
import com.companya.analytics.model.payload.UserPayload;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EnvelopeCodec")
class EnvelopeCodecTest {

    private final EnvelopeCodec codec = new EnvelopeCodec(new ObjectMapper());

    @Nested
    @DisplayName("decode")
    class Decode {

        @Test
        @DisplayName("Reads every envelope field")
        void readsEnvelopeFields() {
            EventEnvelope envelope = codec.decode(TestEvents.json("user-created"));

            assertThat(envelope.eventType()).isEqualTo("user.created");
            assertThat(envelope.eventId()).isEqualTo("0b6a3f0e-1c53-4a3d-9e0e-6b1d9d7f0a01");
            assertThat(envelope.entityId()).isEqualTo("u1");
            assertThat(envelope.timestamp()).isEqualTo("2024-03-01T10:00:00Z");
            assertThat(envelope.data().path("profile").path("display_name").asText()).isEqualTo("Ana");
        }

        @Test
        @DisplayName("Ignores unknown envelope fields")
        void ignoresUnknownFields() {
            EventEnvelope envelope = codec.decode(
                    "{\"event_type\":\"user.deleted\",\"entity_id\":\"u9\",\"trace\":\"x\",\"data\":{}}");

            assertThat(envelope.entityId()).isEqualTo("u9");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "not json", "[1,2]", "\"text\"", "{\"entity_id\":\"u1\"}",
                "{\"event_type\":\"  \"}", "{\"event_type\":{\"nested\":true}}"})
        @DisplayName("Rejects bodies that are not an envelope")
        void rejectsMalformedBodies(String body) {
            assertThatThrownBy(() -> codec.decode(body)).isInstanceOf(MalformedEnvelopeException.class);
        }

        @Test
        @DisplayName("Rejects a null body")
        void rejectsNullBody() {
            assertThatThrownBy(() -> codec.decode(null)).isInstanceOf(MalformedEnvelopeException.class);
        }
    }

    @Nested
    @DisplayName("readPayload")
    class ReadPayload {

        @Test
        @DisplayName("Binds nested objects and the keyed variant map")
        void bindsProductSnapshot() {
            EventEnvelope envelope = codec.decode(TestEvents.json("product-created"));

            ProductPayload product = (ProductPayload) codec.readPayload(envelope, EventKind.PRODUCT_CREATED);

            assertThat(product.getSupplierInfo().getName()).isEqualTo("Acme");
            assertThat(product.getVariants()).containsOnlyKeys("small", "medium", "large");
            assertThat(product.getVariants().get("small").getAttributes())
                    .singleElement()
                    .satisfies(attribute -> assertThat(attribute.getAttributeValue()).isEqualTo("S"));
            assertThat(product.getVariants().get("large").getPackageDimensions().getWidthCm()).isNull();
        }

        @Test
        @DisplayName("Missing data binds to an empty payload with empty sub-objects")
        void missingDataBindsToEmptyPayload() {
            EventEnvelope envelope = codec.decode("{\"event_type\":\"user.updated\",\"entity_id\":\"u1\"}");

            UserPayload user = (UserPayload) codec.readPayload(envelope, EventKind.USER_UPDATED);

            assertThat(user.getContactInfo()).isNotNull();
            assertThat(user.getProfile().getDisplayName()).isNull();
        }

        @Test
        @DisplayName("Null sub-objects bind to empty instances")
        void nullSubObjectsBecomeEmpty() {
            EventEnvelope envelope = codec.decode(
                    "{\"event_type\":\"user.updated\",\"data\":{\"contact_info\":null,\"profile\":null}}");

            UserPayload user = (UserPayload) codec.readPayload(envelope, EventKind.USER_UPDATED);

            assertThat(user.getContactInfo().getPrimaryEmail()).isNull();
            assertThat(user.getProfile()).isNotNull();
        }

        @Test
        @DisplayName("Id-only payloads bind to records")
        void bindsIdOnlyPayload() {
            EventEnvelope envelope = codec.decode(TestEvents.json("order-cancelled"));

            OrderCancelledPayload payload = (OrderCancelledPayload) codec.readPayload(envelope, EventKind.ORDER_CANCELLED);

            assertThat(payload.orderNumber()).isEqualTo("ORD-1001");
            assertThat(payload.entityId()).isNull();
        }

        @Test
        @DisplayName("Non-object data is malformed")
        void rejectsNonObjectData() {
            EventEnvelope envelope = codec.decode("{\"event_type\":\"user.deleted\",\"data\":[\"u1\"]}");

            assertThatThrownBy(() -> codec.readPayload(envelope, EventKind.USER_DELETED))
                    .isInstanceOf(MalformedEnvelopeException.class);
        }

        @Test
        @DisplayName("Type mismatches inside data are malformed")
        void rejectsMistypedFields() {
            EventEnvelope envelope = codec.decode(
                    "{\"event_type\":\"product.updated\",\"data\":{\"base_price_cents\":\"cheap\"}}");

            assertThatThrownBy(() -> codec.readPayload(envelope, EventKind.PRODUCT_UPDATED))
                    .isInstanceOf(MalformedEnvelopeException.class)
                    .hasMessageContaining("ProductPayload");
        }
    }

    @Test
    @DisplayName("Encoded envelopes use the wire field names")
    void encodeUsesWireNames() {
        EventEnvelope envelope = new EventEnvelope("post.deleted", "e1", "post1", "2024-06-02T18:00:00Z",
                codec.toTree(Map.of("post_id", "post1")));

        String json = codec.encode(envelope);

        assertThat(json).contains("\"event_type\":\"post.deleted\"", "\"entity_id\":\"post1\"",
                "\"timestamp\":\"2024-06-02T18:00:00Z\"", "\"data\":{\"post_id\":\"post1\"}");
        assertThat(codec.decode(json)).isEqualTo(envelope);
    }
}
