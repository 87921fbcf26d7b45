package com.companya.analytics.model.row;

import lombok.Builder;
import lombok.Value;

/**
 * One row of {@code product_variants}. {@code variantKey} is the key the variant had in the
 * product's variant map; attributes are kept as a JSON array.
 */
@Value
@Builder(toBuilder = true)
public class ProductVariantRow {

    String productId;
    String variantKey;
    String variantId;
    String variantName;
    String attributesJson;
    Integer priceCents;
    Integer costCents;
    Integer quantity;
    Double widthCm;
    Double heightCm;
    Double depthCm;
    String imageUrl;
}
