package com.biai.explorer.service;

import com.biai.explorer.model.catalog.DatasetColumn;
import com.biai.explorer.model.catalog.DatasetTable;
import com.biai.explorer.model.catalog.TableRelationship;
import com.biai.explorer.model.query.ColumnMetadata;
import com.biai.explorer.model.query.Relationship;
import com.biai.explorer.model.query.TableMetadata;
import com.biai.explorer.repository.DatasetColumnRepository;
import com.biai.explorer.repository.DatasetTableRepository;
import com.biai.explorer.repository.TableRelationshipRepository;
import jakarta.persistence.EntityNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads dataset metadata from the catalog database.
 */
@Service
@Transactional(readOnly = true)
public class JpaDatasetMetadataProvider implements DatasetMetadataProvider {

    private final DatasetTableRepository tableRepository;
    private final DatasetColumnRepository columnRepository;
    private final TableRelationshipRepository relationshipRepository;

    public JpaDatasetMetadataProvider(DatasetTableRepository tableRepository,
                                      DatasetColumnRepository columnRepository,
                                      TableRelationshipRepository relationshipRepository) {
        this.tableRepository = tableRepository;
        this.columnRepository = columnRepository;
        this.relationshipRepository = relationshipRepository;
    }

    @Override
    public TableMetadata findTable(String datasetId, String tableId) {
        DatasetTable table = tableRepository.findByDatasetIdAndTableId(datasetId, tableId)
            .orElseThrow(() -> new EntityNotFoundException("Table not found: " + tableId));

        Set<String> columns = columnRepository.findByDatasetId(datasetId).stream()
            .filter(c -> tableId.equals(c.getTableId()))
            .map(DatasetColumn::getColumnName)
            .collect(Collectors.toSet());

        List<Relationship> relationships = relationshipRepository.findByDatasetId(datasetId).stream()
            .filter(r -> tableId.equals(r.getTableId()))
            .map(this::toRelationship)
            .collect(Collectors.toList());

        return toMetadata(table, columns, relationships);
    }

    @Override
    public List<TableMetadata> loadTables(String datasetId) {
        Map<String, Set<String>> columnsByTable = columnRepository.findByDatasetId(datasetId).stream()
            .collect(Collectors.groupingBy(DatasetColumn::getTableId,
                Collectors.mapping(DatasetColumn::getColumnName, Collectors.toSet())));

        Map<String, List<Relationship>> relationshipsByTable = relationshipRepository.findByDatasetId(datasetId)
            .stream()
            .collect(Collectors.groupingBy(TableRelationship::getTableId,
                Collectors.mapping(this::toRelationship, Collectors.toList())));

        return tableRepository.findByDatasetId(datasetId).stream()
            .map(table -> toMetadata(table,
                columnsByTable.getOrDefault(table.getTableId(), Set.of()),
                relationshipsByTable.getOrDefault(table.getTableId(), List.of())))
            .collect(Collectors.toList());
    }

    @Override
    public List<ColumnMetadata> visibleColumns(String datasetId, String tableId) {
        return columnRepository.findVisible(datasetId, tableId).stream()
            .map(c -> new ColumnMetadata(c.getColumnName(), c.getDisplayType()))
            .collect(Collectors.toList());
    }

    private TableMetadata toMetadata(DatasetTable table, Set<String> columns, List<Relationship> relationships) {
        return new TableMetadata(
            table.getTableId(),
            table.getTableName(),
            table.getClickhouseTableName(),
            table.getRowCount(),
            columns,
            relationships
        );
    }

    private Relationship toRelationship(TableRelationship rel) {
        return new Relationship(rel.getForeignKey(), rel.getReferencedTable(), rel.getReferencedColumn(),
            rel.getRelationshipType());
    }
}
