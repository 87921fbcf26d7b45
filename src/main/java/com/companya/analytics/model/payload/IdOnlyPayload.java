package com.companya.analytics.model.payload;

/**
 * Minimal payload carrying just the id of the affected entity.
 */
public interface IdOnlyPayload {

    /**
     * @return the id named in the payload, or {@code null} when the producer left it out
     */
    String entityId();
}
