package com.companya.analytics.kafka;

/**
 * Result of handing one message to the dispatcher. Every outcome here lets the
 * loop commit past the message; handler failures are thrown instead.
 */
public enum DispatchOutcome {
    PROCESSED,
    SKIPPED_MALFORMED,
    SKIPPED_UNKNOWN_KIND
}
