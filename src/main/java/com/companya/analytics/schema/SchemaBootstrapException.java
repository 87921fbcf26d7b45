package com.companya.analytics.schema;

public class SchemaBootstrapException extends RuntimeException {

    public SchemaBootstrapException(String message, Throwable cause) {
        super(message, cause);
    }
}
