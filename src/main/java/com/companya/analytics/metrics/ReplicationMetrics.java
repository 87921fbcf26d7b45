package com.companya.analytics.metrics;

import com.companya.analytics.kafka.EventKind;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Counters for the replication loop.
 */
@Component
public class ReplicationMetrics {

    public static final String PROCESSED = "replica.events.processed";
    public static final String SKIPPED = "replica.events.skipped";
    public static final String FAILED = "replica.events.failed";
    public static final String DEAD_LETTERED = "replica.events.dead_lettered";
    public static final String MISROUTED = "replica.events.misrouted";

    private final MeterRegistry meterRegistry;

    public ReplicationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void processed(EventKind kind) {
        meterRegistry.counter(PROCESSED, "kind", kind.wireName()).increment();
    }

    public void skipped(String reason) {
        meterRegistry.counter(SKIPPED, "reason", reason).increment();
    }

    public void failed(String kind) {
        meterRegistry.counter(FAILED, "kind", kind).increment();
    }

    /** A kind arrived on a topic other than its own. It is still dispatched. */
    public void misrouted(EventKind kind, String topic) {
        meterRegistry.counter(MISROUTED, "kind", kind.wireName(), "topic", topic).increment();
    }

    public void deadLettered() {
        meterRegistry.counter(DEAD_LETTERED).increment();
    }
}
