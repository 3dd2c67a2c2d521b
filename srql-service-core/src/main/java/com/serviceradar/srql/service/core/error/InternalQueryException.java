package com.serviceradar.srql.service.core.error;

/** Compiler or database failure. Logged with context and surfaced to callers as an opaque error. */
public class InternalQueryException extends RuntimeException {

    public InternalQueryException(String message) {
        super(message);
    }

    public InternalQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
