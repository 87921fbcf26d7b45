package com.companya.analytics.repository;

import com.companya.analytics.AnalyticsReplicaApplication;
import com.companya.analytics.helper.ReplicaTables;
import com.companya.analytics.model.row.OrderItemRow;
import com.companya.analytics.model.row.OrderRow;
import com.companya.analytics.schema.SchemaBootstrap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(classes = AnalyticsReplicaApplication.class)
@ActiveProfiles("test")
@DisplayName("OrderRepository")
class OrderRepositoryTest {

    private static final LocalDateTime PLACED = LocalDateTime.of(2024, 5, 1, 15, 0);

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private SchemaBootstrap schemaBootstrap;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        schemaBootstrap.initialize();
        ReplicaTables.clear(jdbcTemplate);
        orderRepository.upsert(order("pending", "ana@example.com", PLACED));
        orderRepository.upsertItems("o1", List.of(item("pending", 1500, null, PLACED)));
    }

    private static OrderRow order(String status, String email, LocalDateTime eventTs) {
        return OrderRow.builder()
                .orderId("o1")
                .orderNumber("ORD-1001")
                .customerUserId("u1")
                .customerEmail(email)
                .shippingStreet1("9 Elm St")
                .status(status)
                .createdAt(PLACED)
                .updatedAt(eventTs)
                .eventId("e-" + eventTs)
                .eventTimestamp(eventTs)
                .build();
    }

    private static OrderItemRow item(String fulfillment, int unitPrice, String tracking, LocalDateTime eventTs) {
        return OrderItemRow.builder()
                .orderId("o1")
                .itemId("i1")
                .productId("p1")
                .supplierId("s1")
                .productName("Ceramic Mug")
                .variantAttributesJson("{\"size\":\"M\"}")
                .quantity(2)
                .unitPriceCents(unitPrice)
                .finalPriceCents(unitPrice)
                .totalCents(unitPrice * 2)
                .fulfillmentStatus(fulfillment)
                .shippedQuantity(0)
                .trackingNumber(tracking)
                .eventId("e-" + eventTs)
                .eventTimestamp(eventTs)
                .build();
    }

    @Nested
    @DisplayName("Selective upsert")
    class SelectiveUpsert {

        @Test
        @DisplayName("A newer event moves status but leaves the customer snapshot")
        void newerEventUpdatesMutableColumnsOnly() {
            LocalDateTime later = PLACED.plusDays(2);

            orderRepository.upsert(order("shipped", "changed@example.com", later));

            OrderRow stored = orderRepository.findById("o1").orElseThrow();
            assertThat(stored.getStatus()).isEqualTo("shipped");
            assertThat(stored.getUpdatedAt()).isEqualTo(later);
            assertThat(stored.getCustomerEmail()).isEqualTo("ana@example.com");
            assertThat(stored.getEventTimestamp()).isEqualTo(later);
            assertThat(stored.getEventId()).isEqualTo("e-" + later);
        }

        @Test
        @DisplayName("An older event never reverts what a newer one applied")
        void olderEventIsIgnored() {
            LocalDateTime later = PLACED.plusDays(2);
            orderRepository.upsert(order("shipped", "ana@example.com", later));

            orderRepository.upsert(order("paid", "ana@example.com", PLACED.plusDays(1)));

            OrderRow stored = orderRepository.findById("o1").orElseThrow();
            assertThat(stored.getStatus()).isEqualTo("shipped");
            assertThat(stored.getEventTimestamp()).isEqualTo(later);
        }

        @Test
        @DisplayName("Item prices stay frozen while fulfillment follows the event")
        void itemPricesFrozen() {
            orderRepository.upsertItems("o1", List.of(item("shipped", 9999, "1Z999", PLACED.plusDays(2))));

            assertThat(orderRepository.findItems("o1")).singleElement().satisfies(item -> {
                assertThat(item.getUnitPriceCents()).isEqualTo(1500);
                assertThat(item.getTotalCents()).isEqualTo(3000);
                assertThat(item.getFulfillmentStatus()).isEqualTo("shipped");
                assertThat(item.getTrackingNumber()).isEqualTo("1Z999");
            });
        }

        @Test
        @DisplayName("Items of another order are rejected")
        void foreignItemRejected() {
            OrderItemRow foreign = item("pending", 1500, null, PLACED).toBuilder().orderId("o2").build();

            assertThatThrownBy(() -> orderRepository.upsertItems("o1", List.of(foreign)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("o2");
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        @DisplayName("Cancels and records the event")
        void cancels() {
            LocalDateTime cancelledAt = PLACED.plusDays(3);

            assertThat(orderRepository.cancel("o1", "e-cancel", cancelledAt)).isEqualTo(1);

            OrderRow stored = orderRepository.findById("o1").orElseThrow();
            assertThat(stored.getStatus()).isEqualTo("cancelled");
            assertThat(stored.getUpdatedAt()).isEqualTo(cancelledAt);
            assertThat(stored.getEventId()).isEqualTo("e-cancel");
            assertThat(orderRepository.findItems("o1")).hasSize(1);
        }

        @Test
        @DisplayName("A stale cancellation is ignored")
        void staleCancellation() {
            orderRepository.upsert(order("delivered", "ana@example.com", PLACED.plusDays(5)));

            assertThat(orderRepository.cancel("o1", "e-cancel", PLACED.plusDays(1))).isZero();
            assertThat(orderRepository.findById("o1").orElseThrow().getStatus()).isEqualTo("delivered");
        }

        @Test
        @DisplayName("Without an event time the cancellation always applies")
        void untimedCancellation() {
            assertThat(orderRepository.cancel("o1", "e-cancel", null)).isEqualTo(1);

            OrderRow stored = orderRepository.findById("o1").orElseThrow();
            assertThat(stored.getStatus()).isEqualTo("cancelled");
            assertThat(stored.getEventTimestamp()).isEqualTo(PLACED);
        }

        @Test
        @DisplayName("Cancels by order number when no id is known")
        void cancelsByOrderNumber() {
            assertThat(orderRepository.cancelByOrderNumber("ORD-1001", "e-cancel", PLACED.plusDays(3))).isEqualTo(1);
            assertThat(orderRepository.findById("o1").orElseThrow().getStatus()).isEqualTo("cancelled");

            assertThat(orderRepository.cancelByOrderNumber("ORD-1001", "e-stale", PLACED.plusDays(1))).isZero();
            assertThat(orderRepository.findById("o1").orElseThrow().getEventId()).isEqualTo("e-cancel");
        }

        @Test
        @DisplayName("Unknown orders affect nothing")
        void unknownOrder() {
            assertThat(orderRepository.cancel("ghost", "e-cancel", PLACED)).isZero();
        }
    }
}
