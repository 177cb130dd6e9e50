package com.biai.explorer.exception;

import com.biai.explorer.model.enums.FilterOperator;

/**
 * Filter operator that is recognised but has no SQL translation yet.
 */
public class UnsupportedOperatorException extends InvalidQueryException {

    public UnsupportedOperatorException(FilterOperator operator) {
        super(operator.getValue() + " operator not yet implemented");
    }
}
