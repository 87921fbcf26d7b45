package com.companya.analytics.model.row;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder(toBuilder = true)
public class OrderItemRow {

    String orderId;
    String itemId;
    String productId;
    String supplierId;
    String productName;
    String variantName;
    String variantAttributesJson;
    String imageUrl;
    String supplierName;
    Integer quantity;
    Integer unitPriceCents;
    Integer finalPriceCents;
    Integer totalCents;
    String fulfillmentStatus;
    Integer shippedQuantity;
    String trackingNumber;
    String carrier;
    LocalDateTime shippedAt;
    LocalDateTime deliveredAt;
    String eventId;
    LocalDateTime eventTimestamp;
}
