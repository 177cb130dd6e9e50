package com.biai.explorer.model.query;

/**
 * Declared foreign key: the owning table's {@code foreignKey} column references
 * {@code referencedTable.referencedColumn}.
 */
public record Relationship(
    String foreignKey,
    String referencedTable,
    String referencedColumn,
    String type
) {}
