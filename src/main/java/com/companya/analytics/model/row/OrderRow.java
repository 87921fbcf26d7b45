package com.companya.analytics.model.row;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/** One row of {@code orders}. Customer columns are a snapshot taken at checkout. */
@Value
@Builder(toBuilder = true)
public class OrderRow {

    String orderId;
    String orderNumber;
    String customerUserId;
    String customerDisplayName;
    String customerEmail;
    String customerPhone;
    String shippingRecipientName;
    String shippingPhone;
    String shippingStreet1;
    String shippingStreet2;
    String shippingCity;
    String shippingState;
    String shippingZipCode;
    String shippingCountry;
    String status;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
    String eventId;
    LocalDateTime eventTimestamp;
}
