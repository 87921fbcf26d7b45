package com.companya.analytics.consumer;

/**
 * A payload is missing a field the producer contract guarantees. Processing of
 * the message fails so that it is redelivered rather than silently dropped.
 */
public class PayloadContractException extends RuntimeException {

    public PayloadContractException(String message) {
        super(message);
    }
}
