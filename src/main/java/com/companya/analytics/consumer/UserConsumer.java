package com.companya.analytics.consumer;

import com.companya.analytics.config.ReplicaProperties;
import com.companya.analytics.kafka.EventKind;
import com.companya.analytics.kafka.Topic;
import com.companya.analytics.model.payload.UserPayload;
import com.companya.analytics.model.row.UserRow;
import com.companya.analytics.repository.UserRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

@Slf4j
@Component
public class UserConsumer extends AbstractDomainConsumer {

    private final UserRepository userRepository;

    public UserConsumer(UserRepository userRepository, TransactionTemplate transactionTemplate,
                        ReplicaProperties properties, ObjectMapper objectMapper, Clock clock) {
        super(transactionTemplate, properties, objectMapper, clock);
        this.userRepository = userRepository;
    }

    @Override
    public Topic topic() {
        return Topic.USER;
    }

    @Override
    public EventHandler handlerFor(EventKind kind) {
        return switch (kind) {
            case USER_CREATED, USER_UPDATED -> this::upsertUser;
            case USER_DELETED -> this::deleteUser;
            default -> null;
        };
    }

    void upsertUser(DomainEvent event) {
        UserPayload user = event.payload(UserPayload.class);
        String userId = entityId(event);
        userRepository.upsert(UserRow.builder()
                .userId(userId)
                .email(require(user.getContactInfo().getPrimaryEmail(), "contact_info.primary_email", event))
                .phone(user.getContactInfo().getPhone())
                .displayName(require(user.getProfile().getDisplayName(), "profile.display_name", event))
                .avatar(user.getProfile().getAvatar())
                .bio(user.getProfile().getBio())
                .version(user.getVersion())
                .deletedAt(EventTimestamps.parse(user.getDeletedAt()))
                .createdAt(timestampOrEventTime(user.getCreatedAt(), event))
                .updatedAt(timestampOrEventTime(user.getUpdatedAt(), event))
                .eventId(event.eventId())
                .eventTimestamp(eventTime(event))
                .build());
        log.info("[{}] user={}", event.kind(), userId);
    }

    void deleteUser(DomainEvent event) {
        String userId = deletedId(event);
        int updated = userRepository.softDelete(userId, event.eventId(), eventTime(event));
        if (updated == 0) {
            log.warn("[{}] user={} not present in replica", event.kind(), userId);
        } else {
            log.info("[{}] user={}", event.kind(), userId);
        }
    }
}
