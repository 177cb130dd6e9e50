package com.biai.explorer.model.query;

/**
 * Visible column of a table with its stored display type.
 */
public record ColumnMetadata(String columnName, String displayType) {}
