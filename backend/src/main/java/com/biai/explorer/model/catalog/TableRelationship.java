package com.biai.explorer.model.catalog;

import jakarta.persistence.*;
import lombok.*;

/**
 * Foreign key declared on a dataset table: {@code foreignKey} of the owning table
 * references {@code referencedTable.referencedColumn}.
 */
@Entity
@Table(name = "table_relationships", indexes = {
    @Index(name = "idx_table_relationships_dataset", columnList = "dataset_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableRelationship {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "dataset_id", nullable = false, length = 255)
    private String datasetId;

    @Column(name = "table_id", nullable = false, length = 255)
    private String tableId;

    @Column(name = "foreign_key", nullable = false, length = 128)
    private String foreignKey;

    @Column(name = "referenced_table", nullable = false, length = 128)
    private String referencedTable;

    @Column(name = "referenced_column", nullable = false, length = 128)
    private String referencedColumn;

    @Column(name = "relationship_type", length = 50)
    private String relationshipType;
}
