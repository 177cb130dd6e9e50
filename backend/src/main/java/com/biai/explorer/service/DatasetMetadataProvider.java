package com.biai.explorer.service;

import com.biai.explorer.model.query.ColumnMetadata;
import com.biai.explorer.model.query.TableMetadata;

import java.util.List;

/**
 * Catalog metadata the aggregation engine works from.
 */
public interface DatasetMetadataProvider {

    /**
     * @throws jakarta.persistence.EntityNotFoundException if the dataset has no such table
     */
    TableMetadata findTable(String datasetId, String tableId);

    /**
     * Every table of the dataset with its known columns and declared relationships.
     */
    List<TableMetadata> loadTables(String datasetId);

    /**
     * Non-hidden columns of a table, newest first.
     */
    List<ColumnMetadata> visibleColumns(String datasetId, String tableId);
}
