package com.biai.explorer.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * How a column is presented in the explorer, which decides the statistics computed for it.
 */
public enum DisplayType {
    CATEGORICAL("categorical"),
    NUMERIC("numeric"),
    ID("id"),
    GEOGRAPHIC("geographic"),
    SURVIVAL_TIME("survival_time"),
    SURVIVAL_STATUS("survival_status"),
    TEXT("text"),
    DATETIME("datetime");

    private final String value;

    DisplayType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Display type used for aggregation: survival columns aggregate like their
     * underlying numeric or categorical data.
     */
    public DisplayType normalized() {
        if (this == SURVIVAL_TIME) {
            return NUMERIC;
        }
        if (this == SURVIVAL_STATUS) {
            return CATEGORICAL;
        }
        return this;
    }

    public boolean hasCategories() {
        return this == CATEGORICAL || this == ID || this == GEOGRAPHIC;
    }

    public static Optional<DisplayType> lookup(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (DisplayType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
