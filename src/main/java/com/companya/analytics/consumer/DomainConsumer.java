package com.companya.analytics.consumer;

import com.companya.analytics.kafka.EventKind;
import com.companya.analytics.kafka.Topic;

import java.util.EnumMap;
import java.util.Map;

/**
 * Handlers for every event kind of one topic.
 */
public interface DomainConsumer {

    Topic topic();

    /**
     * @return the handler for {@code kind}, or {@code null} if this consumer does not handle it
     */
    EventHandler handlerFor(EventKind kind);

    default Map<EventKind, EventHandler> getHandlers() {
        Map<EventKind, EventHandler> handlers = new EnumMap<>(EventKind.class);
        for (EventKind kind : EventKind.forTopic(topic())) {
            EventHandler handler = handlerFor(kind);
            if (handler != null) {
                handlers.put(kind, handler);
            }
        }
        return handlers;
    }
}
