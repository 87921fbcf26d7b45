package com.companya.analytics.kafka;

/**
 * Message body cannot be read as an envelope, or its data block does not fit
 * the payload type of its event kind.
 */
public class MalformedEnvelopeException extends RuntimeException {

    public MalformedEnvelopeException(String message) {
        super(message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
