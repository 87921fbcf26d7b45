package com.companya.analytics.repository;

import com.companya.analytics.model.row.UserRow;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.BeanPropertySqlParameterSource;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public class UserRepository {

    static final List<String> COLUMNS = List.of(
            "user_id", "email", "phone", "display_name", "avatar", "bio", "version",
            "deleted_at", "created_at", "updated_at", "event_id", "event_timestamp");

    private static final String UPSERT = UpsertStatements.fullUpsert("users", COLUMNS, Set.of("user_id"));

    private static final String SOFT_DELETE = """
            UPDATE users
               SET deleted_at = :deletedAt, event_id = :eventId, event_timestamp = :eventTimestamp
             WHERE user_id = :userId""";

    private static final RowMapper<UserRow> ROW_MAPPER = (rs, rowNum) -> UserRow.builder()
            .userId(rs.getString("user_id"))
            .email(rs.getString("email"))
            .phone(rs.getString("phone"))
            .displayName(rs.getString("display_name"))
            .avatar(rs.getString("avatar"))
            .bio(rs.getString("bio"))
            .version(JdbcColumns.integer(rs, "version"))
            .deletedAt(JdbcColumns.timestamp(rs, "deleted_at"))
            .createdAt(JdbcColumns.timestamp(rs, "created_at"))
            .updatedAt(JdbcColumns.timestamp(rs, "updated_at"))
            .eventId(rs.getString("event_id"))
            .eventTimestamp(JdbcColumns.timestamp(rs, "event_timestamp"))
            .build();

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public UserRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    public void upsert(UserRow row) {
        jdbc.update(UPSERT, new BeanPropertySqlParameterSource(row));
    }

    /**
     * Marks the user deleted as of the event time, or now when the event has none.
     * The row stays readable by id.
     *
     * @return rows affected, 0 if the user was never replicated
     */
    public int softDelete(String userId, String eventId, LocalDateTime eventTimestamp) {
        LocalDateTime deletedAt = eventTimestamp != null ? eventTimestamp : LocalDateTime.now(clock);
        return jdbc.update(SOFT_DELETE, new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("deletedAt", deletedAt)
                .addValue("eventId", eventId)
                .addValue("eventTimestamp", eventTimestamp));
    }

    public Optional<UserRow> findById(String userId) {
        return jdbc.query("SELECT * FROM users WHERE user_id = :userId",
                new MapSqlParameterSource("userId", userId), ROW_MAPPER).stream().findFirst();
    }

    public List<UserRow> findActive() {
        return jdbc.query("SELECT * FROM users WHERE deleted_at IS NULL ORDER BY created_at",
                new MapSqlParameterSource(), ROW_MAPPER);
    }

    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM users", new MapSqlParameterSource(), Long.class);
        return count == null ? 0 : count;
    }
}
