package com.companya.analytics.consumer;

import com.companya.analytics.config.ReplicaProperties;
import com.companya.analytics.kafka.EventKind;
import com.companya.analytics.kafka.Topic;
import com.companya.analytics.model.payload.PostPayload;
import com.companya.analytics.model.row.PostRow;
import com.companya.analytics.repository.PostRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

@Slf4j
@Component
public class PostConsumer extends AbstractDomainConsumer {

    private final PostRepository postRepository;

    public PostConsumer(PostRepository postRepository, TransactionTemplate transactionTemplate,
                        ReplicaProperties properties, ObjectMapper objectMapper, Clock clock) {
        super(transactionTemplate, properties, objectMapper, clock);
        this.postRepository = postRepository;
    }

    @Override
    public Topic topic() {
        return Topic.POST;
    }

    @Override
    public EventHandler handlerFor(EventKind kind) {
        return switch (kind) {
            case POST_CREATED, POST_UPDATED, POST_PUBLISHED -> this::upsertPost;
            case POST_DELETED -> this::deletePost;
            default -> null;
        };
    }

    void upsertPost(DomainEvent event) {
        PostPayload post = event.payload(PostPayload.class);
        PostPayload.Author author = post.getAuthor();
        PostPayload.Stats stats = post.getStats();
        PostPayload.LinkPreview link = post.getLinkPreview();
        String postId = entityId(event);

        postRepository.upsert(PostRow.builder()
                .postId(postId)
                .postType(require(post.getPostType(), "post_type", event))
                .authorUserId(require(author.getUserId(), "author.user_id", event))
                .authorDisplayName(author.getDisplayName())
                .authorAvatar(author.getAvatar())
                .authorType(author.getAuthorType())
                .textContent(post.getTextContent())
                .mediaJson(post.getMedia().isEmpty() ? null : toJson(post.getMedia()))
                .linkUrl(link.getUrl())
                .linkTitle(link.getTitle())
                .linkDescription(link.getDescription())
                .linkImage(link.getImage())
                .linkSiteName(link.getSiteName())
                .viewCount(zeroIfNull(stats.getViewCount()))
                .likeCount(zeroIfNull(stats.getLikeCount()))
                .commentCount(zeroIfNull(stats.getCommentCount()))
                .shareCount(zeroIfNull(stats.getShareCount()))
                .saveCount(zeroIfNull(stats.getSaveCount()))
                .engagementRate(stats.getEngagementRate() == null ? 0.0 : stats.getEngagementRate())
                .lastCommentAt(EventTimestamps.parse(stats.getLastCommentAt()))
                .deletedAt(EventTimestamps.parse(post.getDeletedAt()))
                .publishedAt(EventTimestamps.parse(post.getPublishedAt()))
                .createdAt(timestampOrEventTime(post.getCreatedAt(), event))
                .updatedAt(timestampOrEventTime(post.getUpdatedAt(), event))
                .eventId(event.eventId())
                .eventTimestamp(eventTime(event))
                .build());
        log.info("[{}] post={} type={}", event.kind(), postId, post.getPostType());
    }

    void deletePost(DomainEvent event) {
        String postId = deletedId(event);
        int updated = postRepository.softDelete(postId, event.eventId(), eventTime(event));
        if (updated == 0) {
            log.warn("[{}] post={} not present in replica", event.kind(), postId);
        } else {
            log.info("[{}] post={}", event.kind(), postId);
        }
    }
}
