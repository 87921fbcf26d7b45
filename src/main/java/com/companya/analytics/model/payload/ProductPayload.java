package com.companya.analytics.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full product snapshot shared by every product lifecycle event.
 * Variants arrive keyed by their display key, e.g. {@code "small"}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProductPayload {

    @JsonProperty("supplier_id")
    private String supplierId;

    @JsonProperty("supplier_info")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private SupplierInfo supplierInfo = new SupplierInfo();

    @JsonProperty("name")
    private String name;

    @JsonProperty("short_description")
    private String shortDescription;

    @JsonProperty("category")
    private String category;

    @JsonProperty("unit_type")
    private String unitType;

    @JsonProperty("metadata")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Metadata metadata = new Metadata();

    @JsonProperty("base_price_cents")
    private Integer basePriceCents;

    @JsonProperty("status")
    private String status;

    @JsonProperty("stats")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Stats stats = new Stats();

    @JsonProperty("variants")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Map<String, Variant> variants = new LinkedHashMap<>();

    @JsonProperty("published_at")
    private String publishedAt;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("updated_at")
    private String updatedAt;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SupplierInfo {
        @JsonProperty("name")
        private String name;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata {
        @JsonProperty("base_sku")
        private String baseSku;

        @JsonProperty("brand")
        private String brand;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Stats {
        @JsonProperty("view_count")
        private Integer viewCount;

        @JsonProperty("favorite_count")
        private Integer favoriteCount;

        @JsonProperty("purchase_count")
        private Integer purchaseCount;

        @JsonProperty("total_reviews")
        private Integer totalReviews;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Variant {
        @JsonProperty("variant_id")
        private String variantId;

        @JsonProperty("variant_name")
        private String variantName;

        @JsonProperty("attributes")
        @JsonSetter(nulls = Nulls.AS_EMPTY)
        private List<Attribute> attributes = new ArrayList<>();

        @JsonProperty("price_cents")
        private Integer priceCents;

        @JsonProperty("cost_cents")
        private Integer costCents;

        @JsonProperty("quantity")
        private Integer quantity;

        @JsonProperty("package_dimensions")
        @JsonSetter(nulls = Nulls.AS_EMPTY)
        private PackageDimensions packageDimensions = new PackageDimensions();

        @JsonProperty("image_url")
        private String imageUrl;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Attribute {
        @JsonProperty("attribute_name")
        private String attributeName;

        @JsonProperty("attribute_value")
        private String attributeValue;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PackageDimensions {
        @JsonProperty("width_cm")
        private Double widthCm;

        @JsonProperty("height_cm")
        private Double heightCm;

        @JsonProperty("depth_cm")
        private Double depthCm;
    }
}
