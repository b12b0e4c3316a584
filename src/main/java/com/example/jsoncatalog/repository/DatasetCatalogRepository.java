package com.example.jsoncatalog.repository;

import com.example.jsoncatalog.model.DatasetCatalogEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DatasetCatalogRepository extends JpaRepository<DatasetCatalogEntry, Long>,
        JpaSpecificationExecutor<DatasetCatalogEntry> {

    Optional<DatasetCatalogEntry> findByDatasetId(String datasetId);

    boolean existsByDatasetId(String datasetId);

    // Several uploads may share a file name; the newest wins
    Optional<DatasetCatalogEntry> findFirstByOriginalNameOrderByCreatedAtDesc(String originalName);

    // pattern is lower-cased and uses '!' as the LIKE escape character
    @Query("SELECT DISTINCT e FROM DatasetCatalogEntry e LEFT JOIN e.tags t " +
            "WHERE lower(e.originalName) LIKE :pattern ESCAPE '!' " +
            "OR lower(e.description) LIKE :pattern ESCAPE '!' " +
            "OR lower(t) LIKE :pattern ESCAPE '!' " +
            "ORDER BY e.createdAt DESC")
    List<DatasetCatalogEntry> searchByKeyword(@Param("pattern") String pattern, Pageable pageable);
}
