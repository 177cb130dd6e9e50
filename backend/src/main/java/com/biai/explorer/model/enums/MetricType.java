package com.biai.explorer.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What an aggregation counts: raw rows, or distinct entities of an ancestor table.
 */
public enum MetricType {
    ROWS("rows"),
    PARENT("parent");

    private final String value;

    MetricType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
