package com.companya.analytics.model.row;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder(toBuilder = true)
public class ProductRow {

    String productId;
    String supplierId;
    String supplierName;
    String name;
    String shortDescription;
    String category;
    String unitType;
    String baseSku;
    String brand;
    Integer basePriceCents;
    String status;
    Integer viewCount;
    Integer favoriteCount;
    Integer purchaseCount;
    Integer totalReviews;
    LocalDateTime publishedAt;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
    String eventId;
    LocalDateTime eventTimestamp;
}
