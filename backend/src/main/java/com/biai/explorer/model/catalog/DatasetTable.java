package com.biai.explorer.model.catalog;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A table imported into a dataset. The rows live in ClickHouse under
 * {@link #clickhouseTableName}; this entity only holds catalog metadata.
 */
@Entity
@Table(name = "dataset_tables", indexes = {
    @Index(name = "idx_dataset_tables_dataset", columnList = "dataset_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetTable {

    @Id
    @Column(name = "table_id", length = 255)
    private String tableId;

    @Column(name = "dataset_id", nullable = false, length = 255)
    private String datasetId;

    @Column(name = "table_name", nullable = false, length = 128)
    private String tableName;

    @Column(name = "display_name", length = 255)
    private String displayName;

    /**
     * Storage table, optionally prefixed with its database ({@code biai.patients_ab12}).
     */
    @Column(name = "clickhouse_table_name", nullable = false, length = 255)
    private String clickhouseTableName;

    @Column(name = "row_count")
    private long rowCount;

    @Column(name = "primary_key", length = 128)
    private String primaryKey;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
