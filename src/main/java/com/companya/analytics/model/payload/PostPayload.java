package com.companya.analytics.model.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Full post snapshot. Media items are kept as raw JSON because they are only
 * ever stored as a serialized column.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PostPayload {

    @JsonProperty("post_type")
    private String postType;

    @JsonProperty("author")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Author author = new Author();

    @JsonProperty("text_content")
    private String textContent;

    @JsonProperty("media")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<JsonNode> media = new ArrayList<>();

    @JsonProperty("link_preview")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private LinkPreview linkPreview = new LinkPreview();

    @JsonProperty("stats")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Stats stats = new Stats();

    @JsonProperty("deleted_at")
    private String deletedAt;

    @JsonProperty("published_at")
    private String publishedAt;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("updated_at")
    private String updatedAt;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Author {
        @JsonProperty("user_id")
        private String userId;

        @JsonProperty("display_name")
        private String displayName;

        @JsonProperty("avatar")
        private String avatar;

        @JsonProperty("author_type")
        private String authorType;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LinkPreview {
        @JsonProperty("url")
        private String url;

        @JsonProperty("title")
        private String title;

        @JsonProperty("description")
        private String description;

        @JsonProperty("image")
        private String image;

        @JsonProperty("site_name")
        private String siteName;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Stats {
        @JsonProperty("view_count")
        private Integer viewCount;

        @JsonProperty("like_count")
        private Integer likeCount;

        @JsonProperty("comment_count")
        private Integer commentCount;

        @JsonProperty("share_count")
        private Integer shareCount;

        @JsonProperty("save_count")
        private Integer saveCount;

        @JsonProperty("engagement_rate")
        private Double engagementRate;

        @JsonProperty("last_comment_at")
        private String lastCommentAt;
    }
}
