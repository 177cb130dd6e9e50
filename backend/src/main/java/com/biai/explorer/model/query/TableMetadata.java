package com.biai.explorer.model.query;

import java.util.List;
import java.util.Set;

/**
 * Table of a dataset as seen by the query engine.
 *
 * @param tableId catalog identifier of the table
 * @param tableName logical name used by filters and relationships
 * @param storageName ClickHouse table name, optionally prefixed with the database
 * @param rowCount row count recorded at import time
 * @param columns names of the table's physical columns (identifier whitelist)
 * @param relationships foreign keys declared on this table
 */
public record TableMetadata(
    String tableId,
    String tableName,
    String storageName,
    long rowCount,
    Set<String> columns,
    List<Relationship> relationships
) {

    public TableMetadata {
        columns = columns == null ? Set.of() : Set.copyOf(columns);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    public TableMetadata(String tableName, String storageName, List<Relationship> relationships) {
        this(tableName, tableName, storageName, 0L, Set.of(), relationships);
    }

    public boolean hasColumn(String column) {
        return column != null && columns.contains(column);
    }
}
