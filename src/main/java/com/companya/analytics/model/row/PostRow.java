package com.companya.analytics.model.row;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder(toBuilder = true)
public class PostRow {

    String postId;
    String postType;
    String authorUserId;
    String authorDisplayName;
    String authorAvatar;
    String authorType;
    String textContent;
    String mediaJson;
    String linkUrl;
    String linkTitle;
    String linkDescription;
    String linkImage;
    String linkSiteName;
    Integer viewCount;
    Integer likeCount;
    Integer commentCount;
    Integer shareCount;
    Integer saveCount;
    Double engagementRate;
    LocalDateTime lastCommentAt;
    LocalDateTime deletedAt;
    LocalDateTime publishedAt;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
    String eventId;
    LocalDateTime eventTimestamp;
}
