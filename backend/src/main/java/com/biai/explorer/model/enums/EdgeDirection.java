package com.biai.explorer.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction in which a relationship is traversed.
 * FORWARD follows the foreign key towards the referenced (parent) table;
 * BACKWARD walks from a referenced table to a table that references it.
 */
public enum EdgeDirection {
    FORWARD("forward"),
    BACKWARD("backward");

    private final String value;

    EdgeDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
