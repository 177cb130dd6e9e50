package com.biai.explorer.exception;

/**
 * Identifier rejected by the whitelist or format check.
 */
public class InvalidIdentifierException extends InvalidQueryException {

    public InvalidIdentifierException(String message) {
        super(message);
    }
}
