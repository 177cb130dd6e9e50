package com.biai.explorer.repository;

import com.biai.explorer.model.catalog.DatasetTable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DatasetTableRepository extends JpaRepository<DatasetTable, String> {

    List<DatasetTable> findByDatasetId(String datasetId);

    Optional<DatasetTable> findByDatasetIdAndTableId(String datasetId, String tableId);
}
