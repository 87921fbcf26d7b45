package com.companya.analytics.consumer;

@FunctionalInterface
public interface EventHandler {

    void handle(DomainEvent event);
}
