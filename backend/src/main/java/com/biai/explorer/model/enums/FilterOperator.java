package com.biai.explorer.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Comparison operators available on leaf filters.
 */
public enum FilterOperator {
    EQ("eq"),
    IN("in"),
    GT("gt"),
    LT("lt"),
    GTE("gte"),
    LTE("lte"),
    BETWEEN("between"),
    TEMPORAL_BEFORE("temporal_before"),
    TEMPORAL_AFTER("temporal_after"),
    TEMPORAL_DURATION("temporal_duration"),
    TEMPORAL_WITHIN("temporal_within"),
    TEMPORAL_OVERLAPS("temporal_overlaps");

    private final String value;

    FilterOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lenient lookup; unknown operators yield an empty result so the leaf is dropped.
     */
    public static Optional<FilterOperator> lookup(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (FilterOperator op : values()) {
            if (op.value.equals(value)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
