package com.serviceradar.srql.service.core.error;

/**
 * Raised for anything attributable to the caller: unknown entity, unsupported field or operator,
 * malformed literal, oversized list or missing clause. The message is safe to return verbatim.
 */
public class InvalidRequestException extends IllegalArgumentException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
