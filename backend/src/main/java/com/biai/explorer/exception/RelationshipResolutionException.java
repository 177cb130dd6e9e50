package com.biai.explorer.exception;

/**
 * No usable relationship path between two tables of a dataset.
 * Fatal for parent counting; cross-table filters recover by dropping the fragment.
 */
public class RelationshipResolutionException extends InvalidQueryException {

    public RelationshipResolutionException(String message) {
        super(message);
    }
}
