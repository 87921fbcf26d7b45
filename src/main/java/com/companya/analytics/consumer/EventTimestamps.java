package com.companya.analytics.consumer;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * The single parser for every timestamp that reaches the replica, whether it
 * sits on the envelope, a payload, a stats block or a list item.
 */
public final class EventTimestamps {

    private EventTimestamps() {
    }

    /**
     * Parses an ISO-8601 string into a UTC {@link LocalDateTime}. Strings without an
     * offset are taken to be UTC already. Blank or {@code null} input gives {@code null}.
     *
     * @throws PayloadContractException if the value is not ISO-8601
     */
    public static LocalDateTime parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        try {
            return OffsetDateTime.parse(text).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException ignored) {
            // no offset: fall through to a local parse
        }
        try {
            return LocalDateTime.parse(text);
        } catch (DateTimeParseException ex) {
            throw new PayloadContractException("Not an ISO-8601 timestamp: '" + value + "'");
        }
    }
}
