package com.companya.analytics.repository;

import com.companya.analytics.model.row.OrderItemRow;
import com.companya.analytics.model.row.OrderRow;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.BeanPropertySqlParameterSource;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSourceUtils;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Orders and their items. Both are written with a selective upsert: customer,
 * shipping, product snapshot and price columns are fixed at insert time and only
 * status, fulfillment and tracking columns follow later events, never moving
 * backwards in event time.
 */
@Repository
public class OrderRepository {

    static final List<String> COLUMNS = List.of(
            "order_id", "order_number", "customer_user_id", "customer_display_name", "customer_email",
            "customer_phone", "shipping_recipient_name", "shipping_phone", "shipping_street_1",
            "shipping_street_2", "shipping_city", "shipping_state", "shipping_zip_code", "shipping_country",
            "status", "created_at", "updated_at", "event_id", "event_timestamp");

    static final List<String> MUTABLE_COLUMNS = List.of("status", "updated_at");

    static final List<String> ITEM_COLUMNS = List.of(
            "order_id", "item_id", "product_id", "supplier_id", "product_name", "variant_name",
            "variant_attributes_json", "image_url", "supplier_name", "quantity", "unit_price_cents",
            "final_price_cents", "total_cents", "fulfillment_status", "shipped_quantity",
            "tracking_number", "carrier", "shipped_at", "delivered_at", "event_id", "event_timestamp");

    static final List<String> MUTABLE_ITEM_COLUMNS = List.of(
            "fulfillment_status", "shipped_quantity", "tracking_number", "carrier", "shipped_at", "delivered_at");

    private static final String UPSERT = UpsertStatements.selectiveUpsert("orders", COLUMNS, MUTABLE_COLUMNS);
    private static final String UPSERT_ITEM =
            UpsertStatements.selectiveUpsert("order_items", ITEM_COLUMNS, MUTABLE_ITEM_COLUMNS);

    private static final RowMapper<OrderRow> ROW_MAPPER = (rs, rowNum) -> OrderRow.builder()
            .orderId(rs.getString("order_id"))
            .orderNumber(rs.getString("order_number"))
            .customerUserId(rs.getString("customer_user_id"))
            .customerDisplayName(rs.getString("customer_display_name"))
            .customerEmail(rs.getString("customer_email"))
            .customerPhone(rs.getString("customer_phone"))
            .shippingRecipientName(rs.getString("shipping_recipient_name"))
            .shippingPhone(rs.getString("shipping_phone"))
            .shippingStreet1(rs.getString("shipping_street_1"))
            .shippingStreet2(rs.getString("shipping_street_2"))
            .shippingCity(rs.getString("shipping_city"))
            .shippingState(rs.getString("shipping_state"))
            .shippingZipCode(rs.getString("shipping_zip_code"))
            .shippingCountry(rs.getString("shipping_country"))
            .status(rs.getString("status"))
            .createdAt(JdbcColumns.timestamp(rs, "created_at"))
            .updatedAt(JdbcColumns.timestamp(rs, "updated_at"))
            .eventId(rs.getString("event_id"))
            .eventTimestamp(JdbcColumns.timestamp(rs, "event_timestamp"))
            .build();

    private static final RowMapper<OrderItemRow> ITEM_MAPPER = (rs, rowNum) -> OrderItemRow.builder()
            .orderId(rs.getString("order_id"))
            .itemId(rs.getString("item_id"))
            .productId(rs.getString("product_id"))
            .supplierId(rs.getString("supplier_id"))
            .productName(rs.getString("product_name"))
            .variantName(rs.getString("variant_name"))
            .variantAttributesJson(rs.getString("variant_attributes_json"))
            .imageUrl(rs.getString("image_url"))
            .supplierName(rs.getString("supplier_name"))
            .quantity(JdbcColumns.integer(rs, "quantity"))
            .unitPriceCents(JdbcColumns.integer(rs, "unit_price_cents"))
            .finalPriceCents(JdbcColumns.integer(rs, "final_price_cents"))
            .totalCents(JdbcColumns.integer(rs, "total_cents"))
            .fulfillmentStatus(rs.getString("fulfillment_status"))
            .shippedQuantity(JdbcColumns.integer(rs, "shipped_quantity"))
            .trackingNumber(rs.getString("tracking_number"))
            .carrier(rs.getString("carrier"))
            .shippedAt(JdbcColumns.timestamp(rs, "shipped_at"))
            .deliveredAt(JdbcColumns.timestamp(rs, "delivered_at"))
            .eventId(rs.getString("event_id"))
            .eventTimestamp(JdbcColumns.timestamp(rs, "event_timestamp"))
            .build();

    private final NamedParameterJdbcTemplate jdbc;

    public OrderRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void upsert(OrderRow row) {
        jdbc.update(UPSERT, new BeanPropertySqlParameterSource(row));
    }

    /**
     * Items absent from {@code items} are left in place; an order event never removes items.
     */
    public void upsertItems(String orderId, List<OrderItemRow> items) {
        if (items.isEmpty()) {
            return;
        }
        for (OrderItemRow item : items) {
            if (!orderId.equals(item.getOrderId())) {
                throw new IllegalArgumentException("Item " + item.getItemId() + " belongs to order "
                        + item.getOrderId() + ", not " + orderId);
            }
        }
        jdbc.batchUpdate(UPSERT_ITEM, SqlParameterSourceUtils.createBatch(items));
    }

    /**
     * Sets the order to {@code cancelled} unless a newer event has already been applied.
     *
     * @return rows affected, 0 if the order is unknown or the cancellation is stale
     */
    public int cancel(String orderId, String eventId, LocalDateTime eventTimestamp) {
        return cancelWhere("order_id", orderId, eventId, eventTimestamp);
    }

    /**
     * Same as {@link #cancel}, keyed on the unique order number for events that carry no id.
     */
    public int cancelByOrderNumber(String orderNumber, String eventId, LocalDateTime eventTimestamp) {
        return cancelWhere("order_number", orderNumber, eventId, eventTimestamp);
    }

    private int cancelWhere(String keyColumn, String key, String eventId, LocalDateTime eventTimestamp) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("key", key)
                .addValue("eventId", eventId);
        if (eventTimestamp == null) {
            return jdbc.update("UPDATE orders SET status = 'cancelled', event_id = :eventId WHERE "
                    + keyColumn + " = :key", params);
        }
        params.addValue("eventTimestamp", eventTimestamp);
        return jdbc.update("""
                UPDATE orders
                   SET status = 'cancelled', updated_at = :eventTimestamp,
                       event_id = :eventId, event_timestamp = :eventTimestamp
                 WHERE %s = :key
                   AND (event_timestamp IS NULL OR event_timestamp <= :eventTimestamp)""".formatted(keyColumn),
                params);
    }

    public Optional<OrderRow> findById(String orderId) {
        return jdbc.query("SELECT * FROM orders WHERE order_id = :orderId",
                new MapSqlParameterSource("orderId", orderId), ROW_MAPPER).stream().findFirst();
    }

    public List<OrderItemRow> findItems(String orderId) {
        return jdbc.query("SELECT * FROM order_items WHERE order_id = :orderId ORDER BY item_id",
                new MapSqlParameterSource("orderId", orderId), ITEM_MAPPER);
    }

    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM orders", new MapSqlParameterSource(), Long.class);
        return count == null ? 0 : count;
    }
}
