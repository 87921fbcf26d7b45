package com.companya.analytics.repository;

import com.companya.analytics.model.row.PostRow;
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
public class PostRepository {

    static final List<String> COLUMNS = List.of(
            "post_id", "post_type", "author_user_id", "author_display_name", "author_avatar", "author_type",
            "text_content", "media_json", "link_url", "link_title", "link_description", "link_image",
            "link_site_name", "view_count", "like_count", "comment_count", "share_count", "save_count",
            "engagement_rate", "last_comment_at", "deleted_at", "published_at", "created_at", "updated_at",
            "event_id", "event_timestamp");

    private static final String UPSERT = UpsertStatements.fullUpsert("posts", COLUMNS, Set.of("post_id"));

    private static final RowMapper<PostRow> ROW_MAPPER = (rs, rowNum) -> PostRow.builder()
            .postId(rs.getString("post_id"))
            .postType(rs.getString("post_type"))
            .authorUserId(rs.getString("author_user_id"))
            .authorDisplayName(rs.getString("author_display_name"))
            .authorAvatar(rs.getString("author_avatar"))
            .authorType(rs.getString("author_type"))
            .textContent(rs.getString("text_content"))
            .mediaJson(rs.getString("media_json"))
            .linkUrl(rs.getString("link_url"))
            .linkTitle(rs.getString("link_title"))
            .linkDescription(rs.getString("link_description"))
            .linkImage(rs.getString("link_image"))
            .linkSiteName(rs.getString("link_site_name"))
            .viewCount(JdbcColumns.integer(rs, "view_count"))
            .likeCount(JdbcColumns.integer(rs, "like_count"))
            .commentCount(JdbcColumns.integer(rs, "comment_count"))
            .shareCount(JdbcColumns.integer(rs, "share_count"))
            .saveCount(JdbcColumns.integer(rs, "save_count"))
            .engagementRate(JdbcColumns.decimal(rs, "engagement_rate"))
            .lastCommentAt(JdbcColumns.timestamp(rs, "last_comment_at"))
            .deletedAt(JdbcColumns.timestamp(rs, "deleted_at"))
            .publishedAt(JdbcColumns.timestamp(rs, "published_at"))
            .createdAt(JdbcColumns.timestamp(rs, "created_at"))
            .updatedAt(JdbcColumns.timestamp(rs, "updated_at"))
            .eventId(rs.getString("event_id"))
            .eventTimestamp(JdbcColumns.timestamp(rs, "event_timestamp"))
            .build();

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public PostRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    public void upsert(PostRow row) {
        jdbc.update(UPSERT, new BeanPropertySqlParameterSource(row));
    }

    public int softDelete(String postId, String eventId, LocalDateTime eventTimestamp) {
        LocalDateTime deletedAt = eventTimestamp != null ? eventTimestamp : LocalDateTime.now(clock);
        return jdbc.update("""
                UPDATE posts
                   SET deleted_at = :deletedAt, event_id = :eventId, event_timestamp = :eventTimestamp
                 WHERE post_id = :postId""", new MapSqlParameterSource()
                .addValue("postId", postId)
                .addValue("deletedAt", deletedAt)
                .addValue("eventId", eventId)
                .addValue("eventTimestamp", eventTimestamp));
    }

    public Optional<PostRow> findById(String postId) {
        return jdbc.query("SELECT * FROM posts WHERE post_id = :postId",
                new MapSqlParameterSource("postId", postId), ROW_MAPPER).stream().findFirst();
    }

    public List<PostRow> findActive() {
        return jdbc.query("SELECT * FROM posts WHERE deleted_at IS NULL ORDER BY created_at",
                new MapSqlParameterSource(), ROW_MAPPER);
    }

    public List<PostRow> findByAuthor(String authorUserId) {
        return jdbc.query("SELECT * FROM posts WHERE author_user_id = :authorUserId AND deleted_at IS NULL"
                        + " ORDER BY published_at DESC",
                new MapSqlParameterSource("authorUserId", authorUserId), ROW_MAPPER);
    }

    public long count() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM posts", new MapSqlParameterSource(), Long.class);
        return count == null ? 0 : count;
    }
}
