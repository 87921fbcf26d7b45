package com.companya.analytics.consumer;

import com.companya.analytics.kafka.EventKind;
import com.companya.analytics.kafka.Topic;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Closed dispatch table from event kind to handler, assembled once from every
 * {@link DomainConsumer} bean. Construction fails if a registered topic has a
 * kind without a handler or if two consumers claim the same topic.
 */
@Slf4j
@Component
public class HandlerRegistry {

    private final Map<EventKind, EventHandler> handlers = new EnumMap<>(EventKind.class);
    private final Set<Topic> topics = EnumSet.noneOf(Topic.class);

    public HandlerRegistry(List<DomainConsumer> consumers) {
        for (DomainConsumer consumer : consumers) {
            Topic topic = consumer.topic();
            if (!topics.add(topic)) {
                throw new IllegalStateException("Topic '" + topic.topicName() + "' is registered by more than one consumer");
            }
            Map<EventKind, EventHandler> domainHandlers = consumer.getHandlers();
            Set<EventKind> missing = EnumSet.noneOf(EventKind.class);
            for (EventKind kind : EventKind.forTopic(topic)) {
                EventHandler handler = domainHandlers.get(kind);
                if (handler == null) {
                    missing.add(kind);
                } else {
                    handlers.put(kind, handler);
                }
            }
            if (!missing.isEmpty()) {
                throw new IllegalStateException("No handler for " + missing + " on topic '" + topic.topicName() + "'");
            }
        }
        log.info("Registered {} handlers across topics {}", handlers.size(), topics);
    }

    public Optional<EventHandler> handlerFor(EventKind kind) {
        return Optional.ofNullable(handlers.get(kind));
    }

    public Set<Topic> topics() {
        return Collections.unmodifiableSet(topics);
    }
}
