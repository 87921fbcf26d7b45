package com.companya.analytics.kafka;

public enum ConsumerState {
    IDLE,
    POLLING,
    DISPATCHING,
    SHUTTING_DOWN
}
