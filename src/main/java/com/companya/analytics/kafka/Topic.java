package com.companya.analytics.kafka;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * One topic per upstream domain. Messages are keyed by entity id.
 */
public enum Topic {
    USER("user"),
    SUPPLIER("supplier"),
    PRODUCT("product"),
    ORDER("order"),
    POST("post");

    private final String topicName;

    Topic(String topicName) {
        this.topicName = topicName;
    }

    public String topicName() {
        return topicName;
    }

    public static Optional<Topic> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (Topic topic : values()) {
            if (topic.topicName.equals(name)) {
                return Optional.of(topic);
            }
        }
        return Optional.empty();
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(Topic::topicName).toList();
    }
}
