package com.biai.explorer.repository;

import com.biai.explorer.model.catalog.TableRelationship;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TableRelationshipRepository extends JpaRepository<TableRelationship, Long> {

    List<TableRelationship> findByDatasetId(String datasetId);
}
