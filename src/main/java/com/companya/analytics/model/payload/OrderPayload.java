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
 * Full order snapshot. Customer and product data are frozen copies taken when
 * the order was placed.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OrderPayload {

    @JsonProperty("order_number")
    private String orderNumber;

    @JsonProperty("customer")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Customer customer = new Customer();

    @JsonProperty("shipping_address")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private ShippingAddress shippingAddress = new ShippingAddress();

    @JsonProperty("status")
    private String status;

    @JsonProperty("items")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<Item> items = new ArrayList<>();

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("updated_at")
    private String updatedAt;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Customer {
        @JsonProperty("user_id")
        private String userId;

        @JsonProperty("display_name")
        private String displayName;

        @JsonProperty("email")
        private String email;

        @JsonProperty("phone")
        private String phone;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ShippingAddress {
        @JsonProperty("recipient_name")
        private String recipientName;

        @JsonProperty("phone")
        private String phone;

        @JsonProperty("street_address_1")
        private String streetAddress1;

        @JsonProperty("street_address_2")
        private String streetAddress2;

        @JsonProperty("city")
        private String city;

        @JsonProperty("state")
        private String state;

        @JsonProperty("zip_code")
        private String zipCode;

        @JsonProperty("country")
        private String country;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Item {
        @JsonProperty("item_id")
        private String itemId;

        @JsonProperty("product_snapshot")
        @JsonSetter(nulls = Nulls.AS_EMPTY)
        private ProductSnapshot productSnapshot = new ProductSnapshot();

        @JsonProperty("quantity")
        private Integer quantity;

        @JsonProperty("unit_price_cents")
        private Integer unitPriceCents;

        @JsonProperty("final_price_cents")
        private Integer finalPriceCents;

        @JsonProperty("total_cents")
        private Integer totalCents;

        @JsonProperty("fulfillment_status")
        private String fulfillmentStatus;

        @JsonProperty("shipped_quantity")
        private Integer shippedQuantity;

        @JsonProperty("tracking_number")
        private String trackingNumber;

        @JsonProperty("carrier")
        private String carrier;

        @JsonProperty("shipped_at")
        private String shippedAt;

        @JsonProperty("delivered_at")
        private String deliveredAt;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProductSnapshot {
        @JsonProperty("product_id")
        private String productId;

        @JsonProperty("supplier_id")
        private String supplierId;

        @JsonProperty("product_name")
        private String productName;

        @JsonProperty("variant_name")
        private String variantName;

        @JsonProperty("variant_attributes")
        @JsonSetter(nulls = Nulls.AS_EMPTY)
        private Map<String, String> variantAttributes = new LinkedHashMap<>();

        @JsonProperty("image_url")
        private String imageUrl;

        @JsonProperty("supplier_name")
        private String supplierName;
    }
}
