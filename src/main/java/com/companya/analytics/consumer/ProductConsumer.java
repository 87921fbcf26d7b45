package com.companya.analytics.consumer;

import com.companya.analytics.config.ReplicaProperties;
import com.companya.analytics.kafka.EventKind;
import com.companya.analytics.kafka.Topic;
import com.companya.analytics.model.payload.ProductPayload;
import com.companya.analytics.model.row.ProductRow;
import com.companya.analytics.model.row.ProductVariantRow;
import com.companya.analytics.repository.ProductRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Every product lifecycle event carries the full snapshot, so all of them share
 * one routine: upsert the product, then replace its variant set.
 */
@Slf4j
@Component
public class ProductConsumer extends AbstractDomainConsumer {

    private final ProductRepository productRepository;

    public ProductConsumer(ProductRepository productRepository, TransactionTemplate transactionTemplate,
                           ReplicaProperties properties, ObjectMapper objectMapper, Clock clock) {
        super(transactionTemplate, properties, objectMapper, clock);
        this.productRepository = productRepository;
    }

    @Override
    public Topic topic() {
        return Topic.PRODUCT;
    }

    @Override
    public EventHandler handlerFor(EventKind kind) {
        return switch (kind) {
            case PRODUCT_CREATED, PRODUCT_UPDATED, PRODUCT_PUBLISHED,
                    PRODUCT_DISCONTINUED, PRODUCT_OUT_OF_STOCK, PRODUCT_RESTORED -> this::upsertProduct;
            case PRODUCT_DELETED -> this::deleteProduct;
            default -> null;
        };
    }

    void upsertProduct(DomainEvent event) {
        ProductPayload product = event.payload(ProductPayload.class);
        String productId = entityId(event);
        ProductRow row = toRow(productId, product, event);
        List<ProductVariantRow> variants = toVariantRows(productId, product.getVariants());

        writeTogether(() -> {
            productRepository.upsert(row);
            productRepository.replaceVariants(productId, variants);
        });
        log.info("[{}] product={} variants={}", event.kind(), productId, variants.size());
    }

    void deleteProduct(DomainEvent event) {
        String productId = deletedId(event);
        productRepository.delete(productId);
        log.info("[{}] product={}", event.kind(), productId);
    }

    private ProductRow toRow(String productId, ProductPayload product, DomainEvent event) {
        ProductPayload.Stats stats = product.getStats();
        return ProductRow.builder()
                .productId(productId)
                .supplierId(require(product.getSupplierId(), "supplier_id", event))
                .supplierName(product.getSupplierInfo().getName())
                .name(require(product.getName(), "name", event))
                .shortDescription(product.getShortDescription())
                .category(require(product.getCategory(), "category", event))
                .unitType(product.getUnitType())
                .baseSku(product.getMetadata().getBaseSku())
                .brand(product.getMetadata().getBrand())
                .basePriceCents(product.getBasePriceCents())
                .status(require(product.getStatus(), "status", event))
                .viewCount(zeroIfNull(stats.getViewCount()))
                .favoriteCount(zeroIfNull(stats.getFavoriteCount()))
                .purchaseCount(zeroIfNull(stats.getPurchaseCount()))
                .totalReviews(zeroIfNull(stats.getTotalReviews()))
                .publishedAt(EventTimestamps.parse(product.getPublishedAt()))
                .createdAt(timestampOrEventTime(product.getCreatedAt(), event))
                .updatedAt(timestampOrEventTime(product.getUpdatedAt(), event))
                .eventId(event.eventId())
                .eventTimestamp(eventTime(event))
                .build();
    }

    private List<ProductVariantRow> toVariantRows(String productId, Map<String, ProductPayload.Variant> variants) {
        List<ProductVariantRow> rows = new ArrayList<>(variants.size());
        variants.forEach((key, variant) -> {
            if (variant == null) {
                return;
            }
            ProductPayload.PackageDimensions dimensions = variant.getPackageDimensions();
            rows.add(ProductVariantRow.builder()
                    .productId(productId)
                    .variantKey(key)
                    .variantId(variant.getVariantId())
                    .variantName(variant.getVariantName())
                    .attributesJson(toJson(variant.getAttributes()))
                    .priceCents(variant.getPriceCents())
                    .costCents(variant.getCostCents())
                    .quantity(zeroIfNull(variant.getQuantity()))
                    .widthCm(dimensions.getWidthCm())
                    .heightCm(dimensions.getHeightCm())
                    .depthCm(dimensions.getDepthCm())
                    .imageUrl(variant.getImageUrl())
                    .build());
        });
        return rows;
    }
}
