package com.companya.analytics.repository;

import com.companya.analytics.model.row.SupplierRow;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.BeanPropertySqlParameterSource;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public class SupplierRepository {

    static final List<String> COLUMNS = List.of(
            "supplier_id", "email", "primary_phone",
            "contact_person_name", "contact_person_title", "contact_person_email", "contact_person_phone",
            "legal_name", "dba_name",
            "street_address_1", "street_address_2", "city", "state", "zip_code", "country",
            "support_email", "support_phone",
            "facebook_url", "instagram_handle", "twitter_handle", "linkedin_url",
            "timezone", "created_at", "updated_at", "event_id", "event_timestamp");

    private static final String UPSERT = UpsertStatements.fullUpsert("suppliers", COLUMNS, Set.of("supplier_id"));

    private static final RowMapper<SupplierRow> ROW_MAPPER = (rs, rowNum) -> SupplierRow.builder()
            .supplierId(rs.getString("supplier_id"))
            .email(rs.getString("email"))
            .primaryPhone(rs.getString("primary_phone"))
            .contactPersonName(rs.getString("contact_person_name"))
            .contactPersonTitle(rs.getString("contact_person_title"))
            .contactPersonEmail(rs.getString("contact_person_email"))
            .contactPersonPhone(rs.getString("contact_person_phone"))
            .legalName(rs.getString("legal_name"))
            .dbaName(rs.getString("dba_name"))
            .streetAddress1(rs.getString("street_address_1"))
            .streetAddress2(rs.getString("street_address_2"))
            .city(rs.getString("city"))
            .state(rs.getString("state"))
            .zipCode(rs.getString("zip_code"))
            .country(rs.getString("country"))
            .supportEmail(rs.getString("support_email"))
            .supportPhone(rs.getString("support_phone"))
            .facebookUrl(rs.getString("facebook_url"))
            .instagramHandle(rs.getString("instagram_handle"))
            .twitterHandle(rs.getString("twitter_handle"))
            .linkedinUrl(rs.getString("linkedin_url"))
            .timezone(rs.getString("timezone"))
            .createdAt(JdbcColumns.timestamp(rs, "created_at"))
            .updatedAt(JdbcColumns.timestamp(rs, "updated_at"))
            .eventId(rs.getString("event_id"))
            .eventTimestamp(JdbcColumns.timestamp(rs, "event_timestamp"))
            .build();

    private final NamedParameterJdbcTemplate jdbc;

    public SupplierRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void upsert(SupplierRow row) {
        jdbc.update(UPSERT, new BeanPropertySqlParameterSource(row));
    }

    public int delete(String supplierId) {
        return jdbc.update("DELETE FROM suppliers WHERE supplier_id = :supplierId",
                new MapSqlParameterSource("supplierId", supplierId));
    }

    public Optional<SupplierRow> findById(String supplierId) {
        return jdbc.query("SELECT * FROM suppliers WHERE supplier_id = :supplierId",
                new MapSqlParameterSource("supplierId", supplierId), ROW_MAPPER).stream().findFirst();
    }

    public List<SupplierRow> findByLocation(String country, String state) {
        return jdbc.query("SELECT * FROM suppliers WHERE country = :country AND state = :state ORDER BY city, legal_name",
                new MapSqlParameterSource().addValue("country", country).addValue("state", state), ROW_MAPPER);
    }

    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM suppliers", new MapSqlParameterSource(), Long.class);
        return count == null ? 0 : count;
    }
}
