package com.biai.explorer.repository;

import com.biai.explorer.model.catalog.DatasetColumn;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for column metadata of dataset tables.
 */
@Repository
public interface DatasetColumnRepository extends JpaRepository<DatasetColumn, Long> {

    List<DatasetColumn> findByDatasetId(String datasetId);

    /**
     * Columns shown in the explorer, newest first.
     */
    @Query("SELECT c FROM DatasetColumn c WHERE c.datasetId = :datasetId AND c.tableId = :tableId " +
           "AND c.hidden = false ORDER BY c.createdAt DESC")
    List<DatasetColumn> findVisible(@Param("datasetId") String datasetId, @Param("tableId") String tableId);
}
