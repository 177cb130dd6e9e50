package com.biai.explorer.exception;

/**
 * Raised when a filter, identifier or aggregation request cannot be turned into SQL.
 * Surfaced to callers as a client error (HTTP 400).
 */
public class InvalidQueryException extends IllegalArgumentException {

    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
