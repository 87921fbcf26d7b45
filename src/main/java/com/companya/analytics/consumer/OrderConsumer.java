package com.companya.analytics.consumer;

import com.companya.analytics.config.ReplicaProperties;
import com.companya.analytics.kafka.EventKind;
import com.companya.analytics.kafka.Topic;
import com.companya.analytics.model.payload.OrderCancelledPayload;
import com.companya.analytics.model.payload.OrderPayload;
import com.companya.analytics.model.row.OrderItemRow;
import com.companya.analytics.model.row.OrderRow;
import com.companya.analytics.repository.OrderRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
public class OrderConsumer extends AbstractDomainConsumer {

    static final String DEFAULT_FULFILLMENT_STATUS = "pending";

    private final OrderRepository orderRepository;

    public OrderConsumer(OrderRepository orderRepository, TransactionTemplate transactionTemplate,
                         ReplicaProperties properties, ObjectMapper objectMapper, Clock clock) {
        super(transactionTemplate, properties, objectMapper, clock);
        this.orderRepository = orderRepository;
    }

    @Override
    public Topic topic() {
        return Topic.ORDER;
    }

    @Override
    public EventHandler handlerFor(EventKind kind) {
        return switch (kind) {
            case ORDER_CREATED, ORDER_STATUS_CHANGED -> this::upsertOrder;
            case ORDER_CANCELLED -> this::cancelOrder;
            default -> null;
        };
    }

    void upsertOrder(DomainEvent event) {
        OrderPayload order = event.payload(OrderPayload.class);
        String orderId = entityId(event);
        LocalDateTime eventTime = eventTime(event);
        OrderPayload.Customer customer = order.getCustomer();
        OrderPayload.ShippingAddress shipping = order.getShippingAddress();

        OrderRow row = OrderRow.builder()
                .orderId(orderId)
                .orderNumber(require(order.getOrderNumber(), "order_number", event))
                .customerUserId(require(customer.getUserId(), "customer.user_id", event))
                .customerDisplayName(customer.getDisplayName())
                .customerEmail(customer.getEmail())
                .customerPhone(customer.getPhone())
                .shippingRecipientName(shipping.getRecipientName())
                .shippingPhone(shipping.getPhone())
                .shippingStreet1(shipping.getStreetAddress1())
                .shippingStreet2(shipping.getStreetAddress2())
                .shippingCity(shipping.getCity())
                .shippingState(shipping.getState())
                .shippingZipCode(shipping.getZipCode())
                .shippingCountry(shipping.getCountry())
                .status(require(order.getStatus(), "status", event))
                .createdAt(timestampOrEventTime(order.getCreatedAt(), event))
                .updatedAt(timestampOrEventTime(order.getUpdatedAt(), event))
                .eventId(event.eventId())
                .eventTimestamp(eventTime)
                .build();

        List<OrderItemRow> items = new ArrayList<>(order.getItems().size());
        for (OrderPayload.Item item : order.getItems()) {
            if (item != null) {
                items.add(toItemRow(orderId, item, event, eventTime));
            }
        }

        writeTogether(() -> {
            orderRepository.upsert(row);
            orderRepository.upsertItems(orderId, items);
        });
        log.info("[{}] order={} status={} items={}", event.kind(), orderId, row.getStatus(), items.size());
    }

    /**
     * Keyed on the payload order id, then the envelope entity id, then the order number.
     */
    void cancelOrder(DomainEvent event) {
        OrderCancelledPayload cancelled = event.payload(OrderCancelledPayload.class);
        String orderNumber = cancelled.orderNumber();
        String orderId = firstNonBlank(cancelled.orderId(), event.entityId());
        LocalDateTime eventTime = eventTime(event);

        int updated;
        if (orderId != null) {
            updated = orderRepository.cancel(orderId, event.eventId(), eventTime);
        } else {
            updated = orderRepository.cancelByOrderNumber(
                    require(orderNumber, "order_number", event), event.eventId(), eventTime);
        }
        if (updated == 0) {
            log.warn("[{}] order={} number={} unknown or already superseded", event.kind(), orderId, orderNumber);
        } else {
            log.info("[{}] order={} number={}", event.kind(), orderId, orderNumber);
        }
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        return second == null || second.isBlank() ? null : second;
    }

    private OrderItemRow toItemRow(String orderId, OrderPayload.Item item, DomainEvent event, LocalDateTime eventTime) {
        OrderPayload.ProductSnapshot snapshot = item.getProductSnapshot();
        String status = item.getFulfillmentStatus();
        return OrderItemRow.builder()
                .orderId(orderId)
                .itemId(require(item.getItemId(), "items[].item_id", event))
                .productId(require(snapshot.getProductId(), "items[].product_snapshot.product_id", event))
                .supplierId(require(snapshot.getSupplierId(), "items[].product_snapshot.supplier_id", event))
                .productName(require(snapshot.getProductName(), "items[].product_snapshot.product_name", event))
                .variantName(snapshot.getVariantName())
                .variantAttributesJson(toJson(snapshot.getVariantAttributes()))
                .imageUrl(snapshot.getImageUrl())
                .supplierName(snapshot.getSupplierName())
                .quantity(require(item.getQuantity(), "items[].quantity", event))
                .unitPriceCents(require(item.getUnitPriceCents(), "items[].unit_price_cents", event))
                .finalPriceCents(require(item.getFinalPriceCents(), "items[].final_price_cents", event))
                .totalCents(require(item.getTotalCents(), "items[].total_cents", event))
                .fulfillmentStatus(status == null || status.isBlank() ? DEFAULT_FULFILLMENT_STATUS : status)
                .shippedQuantity(zeroIfNull(item.getShippedQuantity()))
                .trackingNumber(item.getTrackingNumber())
                .carrier(item.getCarrier())
                .shippedAt(EventTimestamps.parse(item.getShippedAt()))
                .deliveredAt(EventTimestamps.parse(item.getDeliveredAt()))
                .eventId(event.eventId())
                .eventTimestamp(eventTime)
                .build();
    }
}
