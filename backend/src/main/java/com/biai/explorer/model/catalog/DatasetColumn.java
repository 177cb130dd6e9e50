package com.biai.explorer.model.catalog;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "dataset_columns", indexes = {
    @Index(name = "idx_dataset_columns_table", columnList = "dataset_id, table_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetColumn {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "dataset_id", nullable = false, length = 255)
    private String datasetId;

    @Column(name = "table_id", nullable = false, length = 255)
    private String tableId;

    @Column(name = "column_name", nullable = false, length = 128)
    private String columnName;

    @Column(name = "column_type", length = 100)
    private String columnType;

    /**
     * Explorer display type as stored at import ({@code categorical}, {@code numeric}, ...).
     */
    @Column(name = "display_type", length = 50)
    private String displayType;

    @Column(name = "is_hidden")
    private boolean hidden;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
