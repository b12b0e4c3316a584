package com.example.jsoncatalog.service.catalog;

import com.example.jsoncatalog.model.DatasetCatalogEntry;

import java.util.List;
import java.util.Optional;

/**
 * Persistence of dataset catalog entries, independent of where the dataset rows live.
 */
public interface CatalogStore {

    /**
     * Stores a new entry. Never overwrites: an existing dataset id is rejected.
     *
     * @throws com.example.jsoncatalog.exception.DuplicateDatasetException if the id is already cataloged
     */
    DatasetCatalogEntry create(DatasetCatalogEntry entry);

    Optional<DatasetCatalogEntry> get(String datasetId);

    /**
     * Looks an entry up by dataset id, then by original file name (newest first).
     */
    Optional<DatasetCatalogEntry> findByIdOrName(String reference);

    CatalogPage list(CatalogFilter filter, PageOptions options);

    /**
     * Changes tags and/or description only; null arguments are left untouched.
     */
    Optional<DatasetCatalogEntry> update(String datasetId, List<String> tags, String description);

    /**
     * @throws com.example.jsoncatalog.exception.DatasetNotFoundException if nothing is cataloged under the id
     */
    void delete(String datasetId);

    List<DatasetCatalogEntry> search(String keyword);
}
