package com.companya.analytics.repository;

import com.companya.analytics.model.row.ProductRow;
import com.companya.analytics.model.row.ProductVariantRow;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.BeanPropertySqlParameterSource;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSourceUtils;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Products and their variants. Variants are owned by the product: they are
 * replaced as a set on every product event and removed by the foreign key
 * cascade when the product is deleted.
 */
@Repository
public class ProductRepository {

    static final List<String> COLUMNS = List.of(
            "product_id", "supplier_id", "supplier_name", "name", "short_description", "category",
            "unit_type", "base_sku", "brand", "base_price_cents", "status",
            "view_count", "favorite_count", "purchase_count", "total_reviews",
            "published_at", "created_at", "updated_at", "event_id", "event_timestamp");

    static final List<String> VARIANT_COLUMNS = List.of(
            "product_id", "variant_key", "variant_id", "variant_name", "attributes_json",
            "price_cents", "cost_cents", "quantity", "width_cm", "height_cm", "depth_cm", "image_url");

    private static final String UPSERT = UpsertStatements.fullUpsert("products", COLUMNS, Set.of("product_id"));
    private static final String INSERT_VARIANT = UpsertStatements.insert("product_variants", VARIANT_COLUMNS);

    private static final RowMapper<ProductRow> ROW_MAPPER = (rs, rowNum) -> ProductRow.builder()
            .productId(rs.getString("product_id"))
            .supplierId(rs.getString("supplier_id"))
            .supplierName(rs.getString("supplier_name"))
            .name(rs.getString("name"))
            .shortDescription(rs.getString("short_description"))
            .category(rs.getString("category"))
            .unitType(rs.getString("unit_type"))
            .baseSku(rs.getString("base_sku"))
            .brand(rs.getString("brand"))
            .basePriceCents(JdbcColumns.integer(rs, "base_price_cents"))
            .status(rs.getString("status"))
            .viewCount(JdbcColumns.integer(rs, "view_count"))
            .favoriteCount(JdbcColumns.integer(rs, "favorite_count"))
            .purchaseCount(JdbcColumns.integer(rs, "purchase_count"))
            .totalReviews(JdbcColumns.integer(rs, "total_reviews"))
            .publishedAt(JdbcColumns.timestamp(rs, "published_at"))
            .createdAt(JdbcColumns.timestamp(rs, "created_at"))
            .updatedAt(JdbcColumns.timestamp(rs, "updated_at"))
            .eventId(rs.getString("event_id"))
            .eventTimestamp(JdbcColumns.timestamp(rs, "event_timestamp"))
            .build();

    private static final RowMapper<ProductVariantRow> VARIANT_MAPPER = (rs, rowNum) -> ProductVariantRow.builder()
            .productId(rs.getString("product_id"))
            .variantKey(rs.getString("variant_key"))
            .variantId(rs.getString("variant_id"))
            .variantName(rs.getString("variant_name"))
            .attributesJson(rs.getString("attributes_json"))
            .priceCents(JdbcColumns.integer(rs, "price_cents"))
            .costCents(JdbcColumns.integer(rs, "cost_cents"))
            .quantity(JdbcColumns.integer(rs, "quantity"))
            .widthCm(JdbcColumns.decimal(rs, "width_cm"))
            .heightCm(JdbcColumns.decimal(rs, "height_cm"))
            .depthCm(JdbcColumns.decimal(rs, "depth_cm"))
            .imageUrl(rs.getString("image_url"))
            .build();

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;

    public ProductRepository(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactionTemplate) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
    }

    public void upsert(ProductRow row) {
        jdbc.update(UPSERT, new BeanPropertySqlParameterSource(row));
    }

    /**
     * Deletes every variant of the product and inserts {@code variants} in its place,
     * in one transaction. An empty list leaves the product with no variants.
     */
    public void replaceVariants(String productId, List<ProductVariantRow> variants) {
        transactionTemplate.executeWithoutResult(status -> {
            jdbc.update("DELETE FROM product_variants WHERE product_id = :productId",
                    new MapSqlParameterSource("productId", productId));
            if (!variants.isEmpty()) {
                jdbc.batchUpdate(INSERT_VARIANT, SqlParameterSourceUtils.createBatch(variants));
            }
        });
    }

    public int delete(String productId) {
        return jdbc.update("DELETE FROM products WHERE product_id = :productId",
                new MapSqlParameterSource("productId", productId));
    }

    public Optional<ProductRow> findById(String productId) {
        return jdbc.query("SELECT * FROM products WHERE product_id = :productId",
                new MapSqlParameterSource("productId", productId), ROW_MAPPER).stream().findFirst();
    }

    public List<ProductVariantRow> findVariants(String productId) {
        return jdbc.query("SELECT * FROM product_variants WHERE product_id = :productId ORDER BY variant_key",
                new MapSqlParameterSource("productId", productId), VARIANT_MAPPER);
    }

    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM products", new MapSqlParameterSource(), Long.class);
        return count == null ? 0 : count;
    }

    public long countVariants() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM product_variants", new MapSqlParameterSource(), Long.class);
        return count == null ? 0 : count;
    }
}
